package net.eventmail.app;

import net.eventmail.core.spi.Notifier;
import org.awaitility.Awaitility;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.OracleContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(classes = EventMailApplication.class)
@Testcontainers(disabledWithoutDocker = true)
class SchedulingFlowIT {

    @Container
    static OracleContainer oracle = new OracleContainer("gvenzl/oracle-xe:21-slim")
            .withStartupTimeout(Duration.ofMinutes(5));

    @DynamicPropertySource
    static void dbProps(DynamicPropertyRegistry r) {
        // Boot DataSource & Flyway가 Testcontainers DB로 붙도록
        r.add("spring.datasource.url", oracle::getJdbcUrl);
        r.add("spring.datasource.username", oracle::getUsername);
        r.add("spring.datasource.password", oracle::getPassword);
        r.add("eventmail.mail.enabled", () -> "false");
        r.add("eventmail.procedure-events.tick-interval", () -> "500ms");
        r.add("eventmail.time-events.tick-interval", () -> "200ms");
    }

    record Sent(String to, String subject, String html) {}

    static final List<Sent> outbox = new CopyOnWriteArrayList<>();

    @TestConfiguration
    static class RecordingMail {
        @Bean
        Notifier notifier() {
            return (to, subject, html) -> outbox.add(new Sent(to, subject, html));
        }
    }

    @Autowired JdbcTemplate jdbc;

    @BeforeEach
    void setUp() {
        outbox.clear();
        jdbc.update("DELETE FROM TB_PROC_PARAM");
        jdbc.update("DELETE FROM TB_PROC_EVENT");
        jdbc.update("DELETE FROM TB_TIME_EVENT");
    }

    @Test
    void time_event_runs_program_and_moves_to_next_slot() throws Exception {
        Path dir = Files.createTempDirectory("eventmail-it");
        Path marker = dir.resolve("marker.txt");

        // 1) 시드: 이미 due 인 잡 하나 (/bin/sh 로 마커 파일 생성)
        jdbc.update("""
            INSERT INTO TB_TIME_EVENT (JOB_NAME, FILE_PATH, ARGUMENTS, WORKING_DIRECTORY, ENABLED,
                                       INTERVAL_MINUTES, SCHEDULE_ANCHOR_UTC, MAX_RETRIES, RETRY_INTERVAL_SECONDS, NEXT_RUN_TIME)
            VALUES ('touch-marker', '/bin/sh', ?, ?, 'Y', 5,
                    SYS_EXTRACT_UTC(SYSTIMESTAMP) - NUMTODSINTERVAL(1,'SECOND'), 0, 0,
                    SYS_EXTRACT_UTC(SYSTIMESTAMP) - NUMTODSINTERVAL(1,'SECOND'))
        """, "-c \"echo ran > marker.txt\"", dir.toString());

        // 2) 대기: 파일이 생기고 NEXT_RUN_TIME 이 미래로 이동
        Awaitility.await().atMost(Duration.ofSeconds(30)).untilAsserted(() -> {
            assertThat(marker).exists();
            Integer advanced = jdbc.queryForObject("""
                SELECT COUNT(*) FROM TB_TIME_EVENT
                 WHERE JOB_NAME='touch-marker'
                   AND LAST_RUN_TIME IS NOT NULL
                   AND NEXT_RUN_TIME > LAST_RUN_TIME + NUMTODSINTERVAL(4,'MINUTE')
            """, Integer.class);
            assertThat(advanced).isEqualTo(1);
        });
        assertThat(Files.readString(marker).trim()).isEqualTo("ran");
    }

    @Test
    void triggered_procedure_sends_alert() {
        jdbc.execute("""
            CREATE OR REPLACE PROCEDURE SP_FLOW_ALERT (p_site IN VARCHAR2) AS
                c SYS_REFCURSOR;
            BEGIN
                OPEN c FOR
                    SELECT 1 AS "Triggered", p_site AS "Site" FROM dual
                    UNION ALL
                    SELECT 0, 'quiet' FROM dual;
                DBMS_SQL.RETURN_RESULT(c);
            END;""");
        jdbc.update("""
            INSERT INTO TB_PROC_EVENT (STORED_PROC_NAME, POLL_INTERVAL_SECONDS, FIRE_ON_ANY_TRUE, EMAIL_GROUP_ALIAS, ENABLED, NEXT_RUN_TIME)
            VALUES ('SP_FLOW_ALERT', 3600, 'Y', 'ops@example.com', 'Y', SYS_EXTRACT_UTC(SYSTIMESTAMP) - NUMTODSINTERVAL(1,'SECOND'))
        """);
        Long id = jdbc.queryForObject("SELECT ID FROM TB_PROC_EVENT WHERE STORED_PROC_NAME='SP_FLOW_ALERT'", Long.class);
        jdbc.update("""
            INSERT INTO TB_PROC_PARAM (PROC_EVENT_ID, ORDINAL, PARAM_NAME, SQL_TYPE, DIRECTION, VALUE_TEXT)
            VALUES (?, 1, 'p_site', 'nvarchar', 'in', 'Plant 4')
        """, id);

        Awaitility.await().atMost(Duration.ofSeconds(30)).until(() -> !outbox.isEmpty());

        Sent mail = outbox.get(0);
        assertThat(mail.to()).isEqualTo("ops@example.com");
        assertThat(mail.subject()).isEqualTo("SP Triggered: SP_FLOW_ALERT");
        assertThat(mail.html()).contains("<td>Plant 4</td>").doesNotContain("quiet");
        // 폴링 1시간: 같은 행이 다시 돌지 않는다
        assertThat(outbox).hasSize(1);
    }
}
