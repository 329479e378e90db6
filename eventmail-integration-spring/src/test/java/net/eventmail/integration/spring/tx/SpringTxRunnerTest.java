package net.eventmail.integration.spring.tx;

import net.eventmail.adapter.jdbc.TxContext;
import net.eventmail.adapter.jdbc.repo.JdbcTimeJobRepository;
import net.eventmail.core.error.StoreUnavailableException;
import net.eventmail.core.service.ProcessExecutor;
import net.eventmail.core.service.RecurrenceCalculator;
import net.eventmail.core.service.TimeEventTickService;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;

import javax.sql.DataSource;
import java.lang.reflect.Proxy;
import java.sql.SQLException;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SpringTxRunnerTest {

    static DataSource unreachable() {
        return (DataSource) Proxy.newProxyInstance(SpringTxRunnerTest.class.getClassLoader(),
                new Class<?>[]{DataSource.class}, (proxy, m, args) -> switch (m.getName()) {
                    case "getConnection" -> throw new SQLException("Connection refused", "08006");
                    case "hashCode" -> System.identityHashCode(proxy);
                    case "equals" -> proxy == args[0];
                    case "toString" -> "unreachable-store";
                    default -> throw new UnsupportedOperationException(m.getName());
                });
    }

    final DataSource ds = unreachable();
    final SpringTxRunner tx = new SpringTxRunner(new DataSourceTransactionManager(ds), ds);

    @Test
    void claim_against_an_unreachable_store_is_store_unavailable() {
        try (var executor = new ProcessExecutor()) {
            var svc = new TimeEventTickService(new JdbcTimeJobRepository(), tx, Instant::now,
                    new RecurrenceCalculator(), executor, 10);

            assertThatThrownBy(svc::claimDue)
                    .isInstanceOf(StoreUnavailableException.class)
                    .hasRootCauseInstanceOf(SQLException.class);
        }
    }

    @Test
    void required_and_requires_new_both_report_the_outage() {
        assertThatThrownBy(() -> tx.required(() -> "never")).isInstanceOf(StoreUnavailableException.class);
        assertThatThrownBy(() -> tx.requiresNew(() -> "never")).isInstanceOf(StoreUnavailableException.class);
        assertThat(TxContext.get()).isNull();
    }
}
