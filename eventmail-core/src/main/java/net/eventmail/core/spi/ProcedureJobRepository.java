package net.eventmail.core.spi;

import net.eventmail.core.model.ProcedureJob;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface ProcedureJobRepository {
    /** ENABLED + NEXT_RUN_TIME<=now 중 최대 limit건 잠금 (FOR UPDATE SKIP LOCKED) */
    List<ProcedureJob> lockDue(int limit, Instant now) throws Exception;

    void markClaimed(long jobId, Instant claimedAt, Instant nextRunTime) throws Exception;

    Optional<ProcedureJob> findById(long id) throws Exception;
}
