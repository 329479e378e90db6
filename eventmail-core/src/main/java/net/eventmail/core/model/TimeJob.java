package net.eventmail.core.model;

import java.time.Duration;
import java.time.Instant;

/**
 * One row of the time-event queue: an external program run on a fixed cadence.
 * {@code intervalMinutes} may be null; the recurrence falls back to its configured default.
 */
public record TimeJob(
        Long id,
        String name,
        String filePath,
        String arguments,
        String workingDirectory,
        boolean enabled,
        Integer intervalMinutes,
        Instant scheduleAnchor,
        int maxRetries,
        int retryIntervalSeconds,
        Instant nextRunTime,
        Instant lastRunTime
) {
    public Duration retryInterval() {
        return Duration.ofSeconds(Math.max(0, retryIntervalSeconds));
    }
}
