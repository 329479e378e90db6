package net.eventmail.core.model;

import java.time.Duration;

public record ProcessSpec(
        String filePath,
        String arguments,
        String workingDirectory,
        int maxRetries,
        Duration retryInterval
) {
    public static ProcessSpec of(TimeJob job) {
        return new ProcessSpec(job.filePath(), job.arguments(), job.workingDirectory(),
                job.maxRetries(), job.retryInterval());
    }
}
