package net.eventmail.adapter.jdbc;

import net.eventmail.adapter.jdbc.repo.JdbcProcedureJobRepository;
import net.eventmail.adapter.jdbc.repo.JdbcProcedureParameterRepository;
import net.eventmail.core.error.ActionExecutionException;
import net.eventmail.core.model.BoundParameter;
import net.eventmail.core.model.ParamDirection;
import net.eventmail.core.model.ParamType;
import net.eventmail.core.model.ProcedureJob;
import net.eventmail.core.model.ProcedureResult;
import net.eventmail.core.model.TypedValue;
import net.eventmail.core.service.AlertComposer;
import net.eventmail.core.service.ParameterBinder;
import net.eventmail.core.service.ProcedureEventTickService;
import net.eventmail.core.spi.Notifier;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class ProcedureMonitorAcceptanceTest extends TestSupport {

    record Sent(String to, String subject, String body) {}

    JdbcTxRunner tx;
    JdbcProcedureJobRepository jobs;
    JdbcProcedureParameterRepository params;
    JdbcProcedureInvoker invoker;
    List<Sent> outbox = new CopyOnWriteArrayList<>();
    Notifier notifier = (to, subject, body) -> outbox.add(new Sent(to, subject, body));

    @BeforeAll
    void initAll() {
        tx = new JdbcTxRunner(ds);
        jobs = new JdbcProcedureJobRepository();
        params = new JdbcProcedureParameterRepository();
        invoker = new JdbcProcedureInvoker();
    }

    @BeforeEach
    void clean() throws Exception {
        truncateAll(tx);
        outbox.clear();
    }

    @Test
    void invoke_collects_implicit_results_and_out_values() throws Exception {
        var bound = List.of(
                new BoundParameter("p_threshold", ParamDirection.IN, new TypedValue(ParamType.DECIMAL, new BigDecimal("5"))),
                new BoundParameter("p_label", ParamDirection.IN, new TypedValue(ParamType.TEXT, "line-1")),
                new BoundParameter("p_count", ParamDirection.OUT, TypedValue.nullOf(ParamType.INTEGER)));

        ProcedureResult r = tx.required(() -> invoker.invoke("SP_TEST_ALERT", bound));

        assertThat(r.rows()).hasSize(3);
        assertThat(r.rows().get(0).columns()).containsExactly("Triggered", "Label", "X");
        assertThat(r.rows().get(0).get("label")).isEqualTo("line-1");
        assertThat(r.rows()).filteredOn(row -> row.triggered()).hasSize(1);
        assertThat(r.outputs()).containsEntry("p_count", 3);
    }

    @Test
    void failing_procedure_raises_action_execution_failure() {
        assertThatThrownBy(() -> tx.required(() -> invoker.invoke("SP_TEST_FAIL", List.of())))
                .isInstanceOf(ActionExecutionException.class)
                .hasMessageContaining("SP_TEST_FAIL");
    }

    @Test
    void cancel_aborts_a_call_blocked_in_the_database() throws Exception {
        var slow = new JdbcProcedureInvoker(Duration.ofMinutes(5));
        var failure = new AtomicReference<Throwable>();
        Thread caller = new Thread(() -> {
            try {
                tx.required(() -> slow.invoke("SP_TEST_SLOW", List.of(
                        new BoundParameter("p_seconds", ParamDirection.IN, new TypedValue(ParamType.INTEGER, 120)))));
            } catch (Throwable t) {
                failure.set(t);
            }
        }, "slow-procedure");
        caller.start();
        await().atMost(Duration.ofSeconds(30)).until(() -> slow.runningCalls() == 1);

        // execute() 진입 전에 cancel 이 도착할 수 있으니 끝날 때까지 반복
        await().atMost(Duration.ofSeconds(30)).pollInterval(Duration.ofMillis(500)).until(() -> {
            slow.cancelRunning();
            return !caller.isAlive();
        });

        assertThat(failure.get()).isInstanceOf(ActionExecutionException.class).hasMessageContaining("SP_TEST_SLOW");
        assertThat(slow.runningCalls()).isZero();
    }

    @Test
    void tick_binds_stored_parameters_mails_triggered_rows_and_reschedules() throws Exception {
        Instant now = Instant.now().truncatedTo(ChronoUnit.MILLIS);
        long id = seedProcedureJob(tx, "SP_TEST_ALERT", now.minusSeconds(1), 45);
        tx.required(() -> {
            try (var ps = TxContext.get().prepareStatement("""
                INSERT INTO TB_PROC_PARAM(PROC_EVENT_ID, ORDINAL, PARAM_NAME, SQL_TYPE, DIRECTION, VALUE_TEXT, VALUE_DECIMAL)
                VALUES (?, ?, ?, ?, ?, ?, ?)
            """)) {
                Object[][] rows = {
                        // ordinal, name, type, direction, text, decimal
                        {1, "p_threshold", "decimal", "in", null, new BigDecimal("20")},
                        {2, "@p_label", "nvarchar", "input", "<b>tank</b>", null},
                        {3, "p_count", "int", "output", null, null},
                };
                for (Object[] r : rows) {
                    ps.setLong(1, id);
                    ps.setInt(2, (Integer) r[0]);
                    ps.setString(3, (String) r[1]);
                    ps.setString(4, (String) r[2]);
                    ps.setString(5, (String) r[3]);
                    ps.setString(6, (String) r[4]);
                    ps.setBigDecimal(7, (BigDecimal) r[5]);
                    ps.addBatch();
                }
                ps.executeBatch();
            }
            return null;
        });

        var binder = new ParameterBinder(params, invoker);
        var svc = new ProcedureEventTickService(jobs, binder, new AlertComposer(), notifier, tx, () -> now, 10);

        assertThat(svc.tickOnce()).isEqualTo(1);

        assertThat(outbox).hasSize(1);
        Sent mail = outbox.get(0);
        assertThat(mail.to()).isEqualTo("ops@example.com");
        assertThat(mail.subject()).isEqualTo("SP Triggered: SP_TEST_ALERT");
        assertThat(mail.body()).contains("&lt;b&gt;tank&lt;/b&gt;").doesNotContain("<b>tank</b>");
        // threshold 20 → 1행, 3행 트리거
        assertThat(mail.body().split("<tr>")).hasSize(1 + 1 + 2);

        ProcedureJob after = tx.required(() -> jobs.findById(id).orElseThrow());
        assertThat(after.lastRunTime()).isEqualTo(now);
        assertThat(after.nextRunTime()).isEqualTo(now.plusSeconds(45));
    }

    @Test
    void failing_procedure_still_reschedules() throws Exception {
        Instant now = Instant.now().truncatedTo(ChronoUnit.MILLIS);
        long id = seedProcedureJob(tx, "SP_TEST_FAIL", now.minusSeconds(1), 30);

        var svc = new ProcedureEventTickService(jobs, new ParameterBinder(params, invoker), new AlertComposer(),
                notifier, tx, () -> now, 10);
        svc.tickOnce();

        assertThat(outbox).isEmpty();
        assertThat(tx.required(() -> jobs.findById(id).orElseThrow().nextRunTime())).isEqualTo(now.plusSeconds(30));
    }
}
