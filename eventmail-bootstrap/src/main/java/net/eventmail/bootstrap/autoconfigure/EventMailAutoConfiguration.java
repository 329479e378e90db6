package net.eventmail.bootstrap.autoconfigure;

import net.eventmail.adapter.jdbc.JdbcProcedureInvoker;
import net.eventmail.bootstrap.props.EventMailProperties;
import net.eventmail.core.service.AlertComposer;
import net.eventmail.core.service.ParameterBinder;
import net.eventmail.core.service.ProcedureEventTickService;
import net.eventmail.core.service.ProcessExecutor;
import net.eventmail.core.service.RecurrenceCalculator;
import net.eventmail.core.service.TimeEventTickService;
import net.eventmail.core.spi.Clock;
import net.eventmail.core.spi.Notifier;
import net.eventmail.core.spi.ProcedureInvoker;
import net.eventmail.core.spi.ProcedureJobRepository;
import net.eventmail.core.spi.ProcedureParameterRepository;
import net.eventmail.core.spi.SecretResolver;
import net.eventmail.core.spi.TimeJobRepository;
import net.eventmail.core.spi.TxRunner;
import net.eventmail.integration.spring.EventMailSpringConfig;
import net.eventmail.integration.spring.mail.GraphNotifier;
import net.eventmail.integration.spring.mail.LoggingNotifier;
import net.eventmail.integration.spring.mail.MailNotifier;
import net.eventmail.integration.spring.sched.EventMailSchedulers;
import net.eventmail.integration.spring.sched.TickLoop;
import net.eventmail.integration.spring.secret.EnvSecretResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.JavaMailSenderImpl;

import java.util.ArrayList;
import java.util.Properties;

@AutoConfiguration
@EnableConfigurationProperties(EventMailProperties.class)
@Import(EventMailSpringConfig.class) // integration-spring: repos/tx/clock wiring
public class EventMailAutoConfiguration {
    private static final Logger log = LoggerFactory.getLogger(EventMailAutoConfiguration.class);

    // --- SPI 기본 구현(없으면) 제공 ---

    @Bean
    @ConditionalOnMissingBean
    public SecretResolver secretResolver() {
        return new EnvSecretResolver();
    }

    @Bean
    @ConditionalOnMissingBean
    public ProcedureInvoker procedureInvoker(EventMailProperties props) {
        return new JdbcProcedureInvoker(props.getProcedureTimeout());
    }

    @Bean
    @ConditionalOnMissingBean(JavaMailSender.class)
    @ConditionalOnExpression("${eventmail.mail.enabled:true} and '${eventmail.mail.sender:graph}'.equalsIgnoreCase('smtp')")
    public JavaMailSenderImpl eventMailSender(EventMailProperties props, SecretResolver secrets) {
        EventMailProperties.Mail m = props.getMail();
        var sender = new JavaMailSenderImpl();
        sender.setHost(m.getHost());
        sender.setPort(m.getPort());
        sender.setDefaultEncoding("UTF-8");
        if (m.getUsername() != null && !m.getUsername().isBlank()) {
            sender.setUsername(m.getUsername());
            sender.setPassword(secrets.resolve(m.getPassword()));
        }
        Properties p = sender.getJavaMailProperties();
        p.put("mail.smtp.auth", String.valueOf(m.getUsername() != null && !m.getUsername().isBlank()));
        p.put("mail.smtp.starttls.enable", String.valueOf(m.isStartTls()));
        p.put("mail.smtp.starttls.required", String.valueOf(m.isStartTls()));
        return sender;
    }

    @Bean
    @ConditionalOnMissingBean
    public Notifier notifier(EventMailProperties props, SecretResolver secrets, ObjectProvider<JavaMailSender> sender) {
        EventMailProperties.Mail m = props.getMail();
        if (!m.isEnabled()) {
            log.warn("Mail is disabled; alerts will only be logged");
            return new LoggingNotifier();
        }
        if (m.getSender() == EventMailProperties.Mail.Sender.SMTP) {
            JavaMailSender s = sender.getIfAvailable();
            if (s == null) {
                log.warn("No JavaMailSender available; alerts will only be logged");
                return new LoggingNotifier();
            }
            return new MailNotifier(s, m.getFrom(), m.getAliases());
        }
        EventMailProperties.Mail.Graph g = m.getGraph();
        log.info("Alerts are sent through Microsoft Graph as {}", m.getFrom());
        return GraphNotifier.create(g.getTenantId(), g.getClientId(), secrets.resolve(g.getClientSecret()),
                m.getFrom(), m.getAliases());
    }

    // --- 코어 서비스 조립 ---

    @Bean
    @ConditionalOnMissingBean
    public RecurrenceCalculator recurrenceCalculator(EventMailProperties props) {
        return new RecurrenceCalculator(props.getRecurrence().getDriftTolerance(),
                props.getRecurrence().getDefaultInterval());
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public ProcessExecutor processExecutor() {
        return new ProcessExecutor();
    }

    @Bean
    @ConditionalOnMissingBean
    public TimeEventTickService timeEventTick(TimeJobRepository jobs,
                                              TxRunner tx,
                                              Clock clock,
                                              RecurrenceCalculator recurrence,
                                              ProcessExecutor executor,
                                              EventMailProperties props) {
        return new TimeEventTickService(jobs, tx, clock, recurrence, executor, props.getTimeEvents().getBatchSize());
    }

    @Bean
    @ConditionalOnMissingBean
    public ParameterBinder parameterBinder(ProcedureParameterRepository params, ProcedureInvoker invoker) {
        return new ParameterBinder(params, invoker);
    }

    @Bean
    @ConditionalOnMissingBean
    public ProcedureEventTickService procedureEventTick(ProcedureJobRepository jobs,
                                                        ParameterBinder binder,
                                                        Notifier notifier,
                                                        TxRunner tx,
                                                        Clock clock,
                                                        EventMailProperties props) {
        return new ProcedureEventTickService(jobs, binder, new AlertComposer(), notifier, tx, clock,
                props.getProcedureEvents().getBatchSize());
    }

    // --- 스케줄러 등록 (프로퍼티로 주기 제어) ---

    @Bean
    @ConditionalOnProperty(prefix = "eventmail.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
    public EventMailSchedulers eventMailSchedulers(TimeEventTickService timeTick,
                                                   ProcedureEventTickService procTick,
                                                   EventMailProperties props) {
        var loops = new ArrayList<TickLoop>();
        if (props.getTimeEvents().isEnabled()) {
            loops.add(new TickLoop("eventmail-time-events", props.getTimeEvents().getTickInterval(), timeTick::tickOnce));
        }
        if (props.getProcedureEvents().isEnabled()) {
            // 인터럽트가 닿지 않는 JDBC 호출은 취소 훅으로 끊는다
            loops.add(new TickLoop("eventmail-procedure-events", props.getProcedureEvents().getTickInterval(),
                    procTick::tickOnce, procTick::cancelRunning));
        }
        return new EventMailSchedulers(loops, props.getScheduler().getShutdownTimeout());
    }
}
