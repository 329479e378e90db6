package net.eventmail.core.service;

import net.eventmail.core.model.TimeJob;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Next-run computation for time jobs.
 * <p>
 * A claim within {@code driftTolerance} of the row's due time advances relative to that due time,
 * so the cadence stays phase-locked. A later (or earlier) claim snaps onto the grid defined by
 * {@code scheduleAnchor + k * interval} instead of compounding the delay.
 */
public final class RecurrenceCalculator {
    public static final Duration DEFAULT_DRIFT_TOLERANCE = Duration.ofMillis(500);
    public static final Duration DEFAULT_INTERVAL = Duration.ofMinutes(5);

    private final Duration driftTolerance;
    private final Duration defaultInterval;

    public RecurrenceCalculator() {
        this(DEFAULT_DRIFT_TOLERANCE, DEFAULT_INTERVAL);
    }

    public RecurrenceCalculator(Duration driftTolerance, Duration defaultInterval) {
        this.driftTolerance = Objects.requireNonNull(driftTolerance, "driftTolerance");
        this.defaultInterval = Objects.requireNonNull(defaultInterval, "defaultInterval");
        if (driftTolerance.isNegative()) throw new IllegalArgumentException("driftTolerance < 0");
        if (defaultInterval.isZero() || defaultInterval.isNegative()) {
            throw new IllegalArgumentException("defaultInterval must be positive");
        }
    }

    public Duration intervalOf(TimeJob job) {
        Integer m = job.intervalMinutes();
        return (m == null || m <= 0) ? defaultInterval : Duration.ofMinutes(m);
    }

    /**
     * @return the next run time for a claim at {@code now}; a job that is not due yet keeps its
     *         current next run time, so the call never advances a row twice
     */
    public Instant next(TimeJob job, Instant now) {
        Instant due = job.nextRunTime();
        if (due != null && due.isAfter(now)) return due;

        Duration interval = intervalOf(job);
        if (due == null) return snap(now, now, interval);

        long driftMs = Math.abs(Duration.between(due, now).toMillis());
        if (driftMs > driftTolerance.toMillis()) {
            Instant anchor = job.scheduleAnchor() != null ? job.scheduleAnchor() : due;
            return snap(anchor, now, interval);
        }
        return due.plus(interval);
    }

    /** anchor + (floor((base - anchor) / interval) + 1) * interval */
    static Instant snap(Instant anchor, Instant base, Duration interval) {
        long intervalMs = interval.toMillis();
        long elapsed = Math.floorDiv(Duration.between(anchor, base).toMillis(), intervalMs);
        return anchor.plusMillis((elapsed + 1) * intervalMs);
    }
}
