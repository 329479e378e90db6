package net.eventmail.core.model;

import java.time.Duration;
import java.time.Instant;

public record ProcedureJob(
        Long id,
        String storedProcName,
        String databaseName,
        int pollIntervalSeconds,
        boolean fireOnAnyTrue,
        String emailGroupAlias,
        boolean enabled,
        Instant nextRunTime,
        Instant lastRunTime
) {
    public Duration pollInterval() {
        return Duration.ofSeconds(pollIntervalSeconds);
    }

    /** {@code database.proc} when a qualifier is present, otherwise the bare procedure name. */
    public String qualifiedName() {
        if (databaseName == null || databaseName.isBlank()) return storedProcName;
        return databaseName.trim() + "." + storedProcName;
    }
}
