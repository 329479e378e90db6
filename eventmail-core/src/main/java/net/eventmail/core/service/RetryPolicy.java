package net.eventmail.core.service;

import net.eventmail.core.model.ProcessSpec;

import java.time.Duration;

/**
 * Bounded retry with a fixed delay: {@code maxRetries + 1} attempts in total.
 */
public record RetryPolicy(int maxRetries, Duration interval) {

    public RetryPolicy {
        maxRetries = Math.max(0, maxRetries);
        interval = (interval == null || interval.isNegative()) ? Duration.ZERO : interval;
    }

    public static RetryPolicy of(ProcessSpec spec) {
        return new RetryPolicy(spec.maxRetries(), spec.retryInterval());
    }

    public int maxAttempts() { return maxRetries + 1; }

    /** attempt: 방금 실패한 시도 번호 (1부터) */
    public boolean canRetry(int attempt) { return attempt < maxAttempts(); }

    /** 고정 간격. 시도 번호와 무관 */
    public Duration backoff(int attempt) { return interval; }
}
