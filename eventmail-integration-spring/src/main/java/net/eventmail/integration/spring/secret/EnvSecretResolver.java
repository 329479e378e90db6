package net.eventmail.integration.spring.secret;

import net.eventmail.core.error.ConfigurationException;
import net.eventmail.core.spi.SecretResolver;

import java.util.Map;
import java.util.function.Function;

/**
 * {@code env:NAME} reads the process environment; any other value is returned as is.
 * An {@code env:} reference to an unset variable is a configuration error.
 */
public final class EnvSecretResolver implements SecretResolver {
    static final String PREFIX = "env:";

    private final Function<String, String> env;

    public EnvSecretResolver() {
        this((Function<String, String>) System::getenv);
    }

    public EnvSecretResolver(Map<String, String> env) {
        this(env::get);
    }

    private EnvSecretResolver(Function<String, String> env) {
        this.env = env;
    }

    @Override
    public String resolve(String configured) {
        if (configured == null) return null;
        if (!configured.regionMatches(true, 0, PREFIX, 0, PREFIX.length())) return configured;

        String name = configured.substring(PREFIX.length()).trim();
        if (name.isEmpty()) throw new ConfigurationException("empty environment variable name in '" + configured + "'");
        String value = env.apply(name);
        if (value == null) throw new ConfigurationException("environment variable " + name + " is not set");
        return value;
    }
}
