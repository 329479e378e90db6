package net.eventmail.adapter.jdbc.repo;

import net.eventmail.adapter.jdbc.JdbcUtil;
import net.eventmail.adapter.jdbc.TxContext;
import net.eventmail.adapter.jdbc.mapper.RowMappers;
import net.eventmail.core.model.TimeJob;
import net.eventmail.core.spi.TimeJobRepository;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public final class JdbcTimeJobRepository implements TimeJobRepository {

    @Override
    public List<TimeJob> lockDue(int limit, Instant now) throws Exception {
        Connection c = TxContext.require();

        // due 최대 limit건을 집어서 잠금. 다른 선점자가 잡고 있는 행은 건너뜀
        try (var ps = c.prepareStatement("""
            SELECT  e.*
            FROM    TB_TIME_EVENT e
            WHERE   e.ROWID IN (
                SELECT rid
                FROM (
                    SELECT  e2.ROWID AS rid
                    FROM    TB_TIME_EVENT e2
                    WHERE   e2.ENABLED = 'Y'
                      AND   e2.NEXT_RUN_TIME <= ?
                    ORDER BY e2.NEXT_RUN_TIME ASC, e2.ID ASC
                    FETCH FIRST ? ROWS ONLY
                )
            )
              AND   e.ENABLED = 'Y'
              AND   e.NEXT_RUN_TIME <= ?
            ORDER BY e.NEXT_RUN_TIME ASC, e.ID ASC
            FOR UPDATE OF e.NEXT_RUN_TIME SKIP LOCKED
        """)) {
            JdbcUtil.setInstant(ps, 1, now);
            ps.setInt(2, limit);
            JdbcUtil.setInstant(ps, 3, now);
            try (var rs = ps.executeQuery()) {
                var out = new ArrayList<TimeJob>();
                while (rs.next()) out.add(RowMappers.toTimeJob(rs));
                return out;
            }
        } catch (SQLException e) {
            throw JdbcUtil.translate("lockDue(TB_TIME_EVENT)", e);
        }
    }

    @Override
    public void markClaimed(long jobId, Instant claimedAt, Instant nextRunTime) throws Exception {
        try (var ps = TxContext.require().prepareStatement("""
            UPDATE TB_TIME_EVENT
               SET LAST_RUN_TIME = ?,
                   NEXT_RUN_TIME = ?,
                   UPDATED_AT    = SYSTIMESTAMP
             WHERE ID = ?
        """)) {
            JdbcUtil.setInstant(ps, 1, claimedAt);
            JdbcUtil.setInstant(ps, 2, nextRunTime);
            ps.setLong(3, jobId);
            if (ps.executeUpdate() == 0) {
                throw new IllegalStateException("TB_TIME_EVENT not found for ID=" + jobId);
            }
        } catch (SQLException e) {
            throw JdbcUtil.translate("markClaimed(TB_TIME_EVENT)", e);
        }
    }

    @Override
    public Optional<TimeJob> findById(long id) throws Exception {
        try (var ps = TxContext.require().prepareStatement("SELECT * FROM TB_TIME_EVENT WHERE ID = ?")) {
            ps.setLong(1, id);
            try (var rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(RowMappers.toTimeJob(rs)) : Optional.empty();
            }
        }
    }
}
