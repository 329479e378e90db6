package net.eventmail.core.service;

import net.eventmail.core.error.NotificationException;
import net.eventmail.core.model.ProcedureJob;
import net.eventmail.core.model.TimeJob;
import net.eventmail.core.spi.Notifier;
import net.eventmail.core.spi.ProcedureJobRepository;
import net.eventmail.core.spi.TimeJobRepository;
import net.eventmail.core.spi.TxRunner;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Predicate;

/** In-memory stand-ins for the store side of the tick services. */
final class Fakes {
    private Fakes() {}

    /** 트랜잭션 없이 바로 실행. 호출 횟수만 기록 */
    static final class DirectTx implements TxRunner {
        int requiresNewCalls;

        @Override public <T> T required(Callable<T> body) throws Exception { return body.call(); }

        @Override
        public <T> T requiresNew(Callable<T> body) throws Exception {
            requiresNewCalls++;
            return body.call();
        }
    }

    static final class TimeJobs implements TimeJobRepository {
        final Map<Long, TimeJob> rows = new LinkedHashMap<>();

        void put(TimeJob j) { rows.put(j.id(), j); }

        @Override
        public List<TimeJob> lockDue(int limit, Instant now) {
            return rows.values().stream()
                    .filter(TimeJob::enabled)
                    .filter(j -> !j.nextRunTime().isAfter(now))
                    .sorted(Comparator.comparing(TimeJob::nextRunTime).thenComparing(TimeJob::id))
                    .limit(limit)
                    .toList();
        }

        @Override
        public void markClaimed(long jobId, Instant claimedAt, Instant nextRunTime) {
            TimeJob j = rows.get(jobId);
            if (j == null) throw new IllegalStateException("time job not found: " + jobId);
            rows.put(jobId, claimed(j, claimedAt, nextRunTime));
        }

        @Override
        public Optional<TimeJob> findById(long id) { return Optional.ofNullable(rows.get(id)); }

        /** 선점 직후 상태: lastRunTime=claimedAt, nextRunTime=next */
        static TimeJob claimed(TimeJob j, Instant claimedAt, Instant next) {
            return new TimeJob(j.id(), j.name(), j.filePath(), j.arguments(), j.workingDirectory(), j.enabled(),
                    j.intervalMinutes(), j.scheduleAnchor(), j.maxRetries(), j.retryIntervalSeconds(), next, claimedAt);
        }
    }

    static final class ProcedureJobs implements ProcedureJobRepository {
        final Map<Long, ProcedureJob> rows = new LinkedHashMap<>();

        void put(ProcedureJob j) { rows.put(j.id(), j); }

        @Override
        public List<ProcedureJob> lockDue(int limit, Instant now) {
            return rows.values().stream()
                    .filter(ProcedureJob::enabled)
                    .filter(j -> !j.nextRunTime().isAfter(now))
                    .sorted(Comparator.comparing(ProcedureJob::nextRunTime).thenComparing(ProcedureJob::id))
                    .limit(limit)
                    .toList();
        }

        @Override
        public void markClaimed(long jobId, Instant claimedAt, Instant nextRunTime) {
            ProcedureJob j = rows.get(jobId);
            if (j == null) throw new IllegalStateException("procedure job not found: " + jobId);
            rows.put(jobId, new ProcedureJob(j.id(), j.storedProcName(), j.databaseName(), j.pollIntervalSeconds(),
                    j.fireOnAnyTrue(), j.emailGroupAlias(), j.enabled(), nextRunTime, claimedAt));
        }

        @Override
        public Optional<ProcedureJob> findById(long id) { return Optional.ofNullable(rows.get(id)); }
    }

    record Mail(String to, String subject, String html) {}

    static final class RecordingNotifier implements Notifier {
        final List<Mail> sent = new CopyOnWriteArrayList<>();
        Predicate<String> failFor = s -> false;

        @Override
        public void send(String toExpression, String subject, String htmlBody) {
            if (failFor.test(subject)) throw new NotificationException("relay refused " + subject, null);
            sent.add(new Mail(toExpression, subject, htmlBody));
        }

        List<String> subjects() {
            var out = new ArrayList<String>();
            sent.forEach(m -> out.add(m.subject()));
            return out;
        }
    }
}
