package net.eventmail.core.spi;

import net.eventmail.core.model.TimeJob;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface TimeJobRepository {
    /** ENABLED + NEXT_RUN_TIME<=now 중 최대 limit건 잠금 (FOR UPDATE SKIP LOCKED), NEXT_RUN_TIME 오름차순 */
    List<TimeJob> lockDue(int limit, Instant now) throws Exception;

    /** 선점 표시: LAST_RUN_TIME=claimedAt, NEXT_RUN_TIME=nextRunTime */
    void markClaimed(long jobId, Instant claimedAt, Instant nextRunTime) throws Exception;

    Optional<TimeJob> findById(long id) throws Exception;
}
