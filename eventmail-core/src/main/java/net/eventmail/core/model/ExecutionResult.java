package net.eventmail.core.model;

/**
 * Outcome of running an external program. Streams are the ones captured on the last attempt;
 * {@code exitCode} is null when the last attempt never produced one (launch failure, cancellation).
 */
public record ExecutionResult(
        boolean success,
        int attempts,
        Integer exitCode,
        String stdout,
        String stderr
) {}
