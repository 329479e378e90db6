package net.eventmail.core.service;

import net.eventmail.core.error.NotificationException;
import net.eventmail.core.model.ProcedureJob;
import net.eventmail.core.model.ProcedureResult;
import net.eventmail.core.spi.Clock;
import net.eventmail.core.spi.Notifier;
import net.eventmail.core.spi.ProcedureJobRepository;
import net.eventmail.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

public final class ProcedureEventTickService {
    private static final Logger log = LoggerFactory.getLogger(ProcedureEventTickService.class);

    private final ProcedureJobRepository jobs;
    private final ParameterBinder binder;
    private final AlertComposer alerts;
    private final Notifier notifier;
    private final TxRunner tx;
    private final Clock clock;
    private final int batchSize;

    public ProcedureEventTickService(ProcedureJobRepository jobs,
                                     ParameterBinder binder,
                                     AlertComposer alerts,
                                     Notifier notifier,
                                     TxRunner tx,
                                     Clock clock,
                                     int batchSize) {
        if (batchSize <= 0) throw new IllegalArgumentException("batchSize must be positive");
        this.jobs = jobs;
        this.binder = binder;
        this.alerts = alerts;
        this.notifier = notifier;
        this.tx = tx;
        this.clock = clock;
        this.batchSize = batchSize;
    }

    public int tickOnce() throws Exception {
        List<ProcedureJob> claimed = claimDue();
        int ran = 0;
        for (ProcedureJob job : claimed) {
            if (Thread.currentThread().isInterrupted()) {
                log.info("Procedure-event tick cancelled, {} of {} claimed procedures not run", claimed.size() - ran, claimed.size());
                break;
            }
            dispatch(job);
            ran++;
        }
        return ran;
    }

    /** 루프 정지 시 호출: 블로킹 중인 프로시저 호출을 끊는다 */
    public void cancelRunning() {
        binder.cancelRunning();
    }

    /** 폴링 주기는 결과와 무관하게 선점 시점에 고정 전진: next = now + poll */
    public List<ProcedureJob> claimDue() throws Exception {
        return tx.requiresNew(() -> {
            Instant now = clock.now();
            var out = new ArrayList<ProcedureJob>();
            for (ProcedureJob job : jobs.lockDue(batchSize, now)) {
                Instant next = now.plus(job.pollInterval());
                jobs.markClaimed(job.id(), now, next);
                log.debug("Claimed procedure {} ({}) at {}, next {}", job.id(), job.qualifiedName(), now, next);
                out.add(job);
            }
            return out;
        });
    }

    void dispatch(ProcedureJob job) {
        ProcedureResult result;
        try {
            // 파라미터 조회 + 호출은 잡마다 짧은 세션 하나
            result = tx.requiresNew(() -> binder.execute(job));
        } catch (Exception e) {
            log.error("Procedure {} (job {}) failed", job.qualifiedName(), job.id(), e);
            return;
        }
        if (!result.outputs().isEmpty()) {
            log.debug("Procedure {} outputs: {}", job.qualifiedName(), result.outputs());
        }
        try {
            var outcome = alerts.composeAndSend(job.storedProcName(), result.rows(), job.fireOnAnyTrue(),
                    job.emailGroupAlias(), notifier);
            log.debug("Procedure {} returned {} row(s), alert {}", job.qualifiedName(), result.rows().size(), outcome);
        } catch (NotificationException e) {
            log.error("Alert for {} could not be sent to '{}'", job.storedProcName(), job.emailGroupAlias(), e);
        } catch (RuntimeException e) {
            log.error("Alert for {} failed", job.storedProcName(), e);
        }
    }
}
