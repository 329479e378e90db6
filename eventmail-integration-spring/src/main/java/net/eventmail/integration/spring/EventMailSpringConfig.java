package net.eventmail.integration.spring;

import net.eventmail.adapter.jdbc.repo.JdbcProcedureJobRepository;
import net.eventmail.adapter.jdbc.repo.JdbcProcedureParameterRepository;
import net.eventmail.adapter.jdbc.repo.JdbcTimeJobRepository;
import net.eventmail.core.spi.Clock;
import net.eventmail.core.spi.ProcedureJobRepository;
import net.eventmail.core.spi.ProcedureParameterRepository;
import net.eventmail.core.spi.TimeJobRepository;
import net.eventmail.core.spi.TxRunner;
import net.eventmail.integration.spring.tx.SpringTxRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;

@Configuration
public class EventMailSpringConfig {

    // TxRunner (Spring)
    @Bean
    public TxRunner txRunner(PlatformTransactionManager tm, DataSource ds) {
        return new SpringTxRunner(tm, ds);
    }

    // Repository 구현 등록 (adapter-jdbc 재사용)
    @Bean public TimeJobRepository timeJobRepository() { return new JdbcTimeJobRepository(); }
    @Bean public ProcedureJobRepository procedureJobRepository() { return new JdbcProcedureJobRepository(); }
    @Bean public ProcedureParameterRepository procedureParameterRepository() { return new JdbcProcedureParameterRepository(); }

    @Bean public Clock systemClock() { return Clock.system(); }
}
