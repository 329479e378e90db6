package net.eventmail.integration.spring.secret;

import net.eventmail.core.error.ConfigurationException;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EnvSecretResolverTest {

    final EnvSecretResolver resolver = new EnvSecretResolver(Map.of("SMTP_PASSWORD", "s3cret"));

    @Test
    void env_reference_reads_variable() {
        assertThat(resolver.resolve("env:SMTP_PASSWORD")).isEqualTo("s3cret");
        assertThat(resolver.resolve("ENV: SMTP_PASSWORD ")).isEqualTo("s3cret");
    }

    @Test
    void other_values_are_literal() {
        assertThat(resolver.resolve("plain-password")).isEqualTo("plain-password");
        assertThat(resolver.resolve("")).isEmpty();
        assertThat(resolver.resolve(null)).isNull();
    }

    @Test
    void unset_variable_is_a_configuration_error() {
        assertThatThrownBy(() -> resolver.resolve("env:MISSING"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("MISSING");
        assertThatThrownBy(() -> resolver.resolve("env:"))
                .isInstanceOf(ConfigurationException.class);
    }
}
