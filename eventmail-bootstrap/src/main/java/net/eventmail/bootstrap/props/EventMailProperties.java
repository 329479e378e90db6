package net.eventmail.bootstrap.props;

import net.eventmail.core.error.ConfigurationException;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Bound and validated before any eventmail bean is built, so a bad value fails startup with one
 * {@link ConfigurationException} listing every problem.
 */
@ConfigurationProperties("eventmail")
public class EventMailProperties implements InitializingBean {
    private Loop timeEvents = new Loop(Duration.ofSeconds(1));
    private Loop procedureEvents = new Loop(Duration.ofSeconds(30));
    private Recurrence recurrence = new Recurrence();
    private Mail mail = new Mail();
    private Scheduler scheduler = new Scheduler();
    private Duration procedureTimeout = Duration.ofSeconds(30);

    public Loop getTimeEvents() {
        return timeEvents;
    }

    public void setTimeEvents(Loop timeEvents) {
        this.timeEvents = timeEvents;
    }

    public Loop getProcedureEvents() {
        return procedureEvents;
    }

    public void setProcedureEvents(Loop procedureEvents) {
        this.procedureEvents = procedureEvents;
    }

    public Recurrence getRecurrence() {
        return recurrence;
    }

    public void setRecurrence(Recurrence recurrence) {
        this.recurrence = recurrence;
    }

    public Mail getMail() {
        return mail;
    }

    public void setMail(Mail mail) {
        this.mail = mail;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public void setScheduler(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    public Duration getProcedureTimeout() {
        return procedureTimeout;
    }

    public void setProcedureTimeout(Duration procedureTimeout) {
        this.procedureTimeout = procedureTimeout;
    }

    @Override
    public void afterPropertiesSet() {
        validate();
    }

    /** 기동 시 한 번. 실패하면 컨텍스트가 뜨지 않는다 */
    public void validate() {
        List<String> problems = new ArrayList<>();
        timeEvents.check("eventmail.time-events", problems);
        procedureEvents.check("eventmail.procedure-events", problems);
        if (recurrence.getDriftTolerance() == null || recurrence.getDriftTolerance().isNegative()) {
            problems.add("eventmail.recurrence.drift-tolerance must be >= 0");
        }
        if (!positive(recurrence.getDefaultInterval())) {
            problems.add("eventmail.recurrence.default-interval must be positive");
        }
        if (!positive(scheduler.getShutdownTimeout())) {
            problems.add("eventmail.scheduler.shutdown-timeout must be positive");
        }
        if (procedureTimeout == null || procedureTimeout.isNegative()) {
            problems.add("eventmail.procedure-timeout must be >= 0");
        }
        if (mail.isEnabled()) {
            if (blank(mail.getFrom())) problems.add("eventmail.mail.from is required when mail is enabled");
            if (mail.getSender() == null) {
                problems.add("eventmail.mail.sender must be graph or smtp");
            } else if (mail.getSender() == Mail.Sender.SMTP) {
                if (blank(mail.getHost())) problems.add("eventmail.mail.host is required for smtp");
                if (mail.getPort() <= 0 || mail.getPort() > 65535) problems.add("eventmail.mail.port out of range: " + mail.getPort());
            } else {
                Mail.Graph g = mail.getGraph();
                if (blank(g.getTenantId())) problems.add("eventmail.mail.graph.tenant-id is required for graph");
                if (blank(g.getClientId())) problems.add("eventmail.mail.graph.client-id is required for graph");
                if (blank(g.getClientSecret())) problems.add("eventmail.mail.graph.client-secret is required for graph");
            }
        }
        if (!problems.isEmpty()) {
            throw new ConfigurationException("invalid configuration: " + String.join("; ", problems));
        }
    }

    private static boolean positive(Duration d) {
        return d != null && !d.isZero() && !d.isNegative();
    }

    private static boolean blank(String s) {
        return s == null || s.isBlank();
    }

    public static class Scheduler {
        private boolean enabled = true;
        private Duration shutdownTimeout = Duration.ofSeconds(30);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getShutdownTimeout() {
            return shutdownTimeout;
        }

        public void setShutdownTimeout(Duration shutdownTimeout) {
            this.shutdownTimeout = shutdownTimeout;
        }
    }

    public static class Loop {
        private boolean enabled = true;
        private Duration tickInterval;
        private int batchSize = 10;

        public Loop() {
            this(Duration.ofSeconds(1));
        }

        Loop(Duration tickInterval) {
            this.tickInterval = tickInterval;
        }

        void check(String prefix, List<String> problems) {
            if (!positive(tickInterval)) problems.add(prefix + ".tick-interval must be positive");
            if (batchSize <= 0) problems.add(prefix + ".batch-size must be positive");
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getTickInterval() {
            return tickInterval;
        }

        public void setTickInterval(Duration tickInterval) {
            this.tickInterval = tickInterval;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }
    }

    public static class Recurrence {
        private Duration driftTolerance = Duration.ofMillis(500);
        private Duration defaultInterval = Duration.ofMinutes(5);

        public Duration getDriftTolerance() {
            return driftTolerance;
        }

        public void setDriftTolerance(Duration driftTolerance) {
            this.driftTolerance = driftTolerance;
        }

        public Duration getDefaultInterval() {
            return defaultInterval;
        }

        public void setDefaultInterval(Duration defaultInterval) {
            this.defaultInterval = defaultInterval;
        }
    }

    public static class Mail {
        public enum Sender { GRAPH, SMTP }

        private boolean enabled = true;
        /** 발송 경로. graph 가 기본 */
        private Sender sender = Sender.GRAPH;
        private Graph graph = new Graph();
        private String host = "smtp.office365.com";
        private int port = 587;
        private String username;
        /** 평문 또는 env:VAR */
        private String password;
        private boolean startTls = true;
        private String from;
        private Map<String, String> aliases = new LinkedHashMap<>(); // ← 가변

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Sender getSender() {
            return sender;
        }

        public void setSender(Sender sender) {
            this.sender = sender;
        }

        public Graph getGraph() {
            return graph;
        }

        public void setGraph(Graph graph) {
            this.graph = graph;
        }

        public String getHost() {
            return host;
        }

        public void setHost(String host) {
            this.host = host;
        }

        public int getPort() {
            return port;
        }

        public void setPort(int port) {
            this.port = port;
        }

        public String getUsername() {
            return username;
        }

        public void setUsername(String username) {
            this.username = username;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }

        public boolean isStartTls() {
            return startTls;
        }

        public void setStartTls(boolean startTls) {
            this.startTls = startTls;
        }

        public String getFrom() {
            return from;
        }

        public void setFrom(String from) {
            this.from = from;
        }

        public Map<String, String> getAliases() {
            return aliases;
        }

        public void setAliases(Map<String, String> aliases) {
            this.aliases = aliases;
        }

        /** Entra ID 앱 등록 (client credential). 보내는 사서함은 from */
        public static class Graph {
            private String tenantId;
            private String clientId;
            /** 평문 또는 env:VAR */
            private String clientSecret;

            public String getTenantId() {
                return tenantId;
            }

            public void setTenantId(String tenantId) {
                this.tenantId = tenantId;
            }

            public String getClientId() {
                return clientId;
            }

            public void setClientId(String clientId) {
                this.clientId = clientId;
            }

            public String getClientSecret() {
                return clientSecret;
            }

            public void setClientSecret(String clientSecret) {
                this.clientSecret = clientSecret;
            }
        }
    }
}
