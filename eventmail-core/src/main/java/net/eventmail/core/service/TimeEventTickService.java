package net.eventmail.core.service;

import net.eventmail.core.model.ExecutionResult;
import net.eventmail.core.model.ProcessSpec;
import net.eventmail.core.model.TimeJob;
import net.eventmail.core.spi.Clock;
import net.eventmail.core.spi.TimeJobRepository;
import net.eventmail.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

public final class TimeEventTickService {
    private static final Logger log = LoggerFactory.getLogger(TimeEventTickService.class);

    private final TimeJobRepository jobs;
    private final TxRunner tx;
    private final Clock clock;
    private final RecurrenceCalculator recurrence;
    private final ProcessExecutor executor;
    private final int batchSize;

    public TimeEventTickService(TimeJobRepository jobs,
                                TxRunner tx,
                                Clock clock,
                                RecurrenceCalculator recurrence,
                                ProcessExecutor executor,
                                int batchSize) {
        if (batchSize <= 0) throw new IllegalArgumentException("batchSize must be positive");
        this.jobs = jobs;
        this.tx = tx;
        this.clock = clock;
        this.recurrence = recurrence;
        this.executor = executor;
        this.batchSize = batchSize;
    }

    /** due 잡 선점(커서 전진 포함) → 순서대로 실행. 한 잡의 실패가 나머지를 막지 않는다 */
    public int tickOnce() throws Exception {
        List<TimeJob> claimed = claimDue();
        int ran = 0;
        for (TimeJob job : claimed) {
            if (Thread.currentThread().isInterrupted()) {
                log.info("Time-event tick cancelled, {} of {} claimed jobs not started", claimed.size() - ran, claimed.size());
                break;
            }
            dispatch(job);
            ran++;
        }
        return ran;
    }

    /** 하나의 트랜잭션: 잠금 + LAST_RUN_TIME/NEXT_RUN_TIME 갱신. 커밋 후 반환 */
    public List<TimeJob> claimDue() throws Exception {
        return tx.requiresNew(() -> {
            Instant now = clock.now();
            var out = new ArrayList<TimeJob>();
            for (TimeJob job : jobs.lockDue(batchSize, now)) {
                Instant next = recurrence.next(job, now);
                jobs.markClaimed(job.id(), now, next);
                log.info("Claimed time job {} ({}) at {}, due {}, next {}", job.id(), job.name(), now, job.nextRunTime(), next);
                out.add(job);
            }
            return out;
        });
    }

    void dispatch(TimeJob job) {
        try {
            ExecutionResult r = executor.run(ProcessSpec.of(job));
            if (r.success()) {
                log.info("Job {} OK after {} attempt(s): {}", job.id(), r.attempts(), r.stdout());
            } else {
                log.error("Job {} ({}) failed after {} attempt(s), exit={}: {}",
                        job.id(), job.name(), r.attempts(), r.exitCode(), r.stderr());
            }
        } catch (RuntimeException e) {
            log.error("Job {} ({}) could not be executed", job.id(), job.name(), e);
        }
    }
}
