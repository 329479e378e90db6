package net.eventmail.adapter.jdbc.repo;

import net.eventmail.adapter.jdbc.JdbcUtil;
import net.eventmail.adapter.jdbc.TxContext;
import net.eventmail.adapter.jdbc.mapper.RowMappers;
import net.eventmail.core.model.ProcedureJob;
import net.eventmail.core.spi.ProcedureJobRepository;

import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public final class JdbcProcedureJobRepository implements ProcedureJobRepository {

    @Override
    public List<ProcedureJob> lockDue(int limit, Instant now) throws Exception {
        try (var ps = TxContext.require().prepareStatement("""
            SELECT  p.*
            FROM    TB_PROC_EVENT p
            WHERE   p.ROWID IN (
                SELECT rid
                FROM (
                    SELECT  p2.ROWID AS rid
                    FROM    TB_PROC_EVENT p2
                    WHERE   p2.ENABLED = 'Y'
                      AND   p2.NEXT_RUN_TIME <= ?
                    ORDER BY p2.NEXT_RUN_TIME ASC, p2.ID ASC
                    FETCH FIRST ? ROWS ONLY
                )
            )
              AND   p.ENABLED = 'Y'
              AND   p.NEXT_RUN_TIME <= ?
            ORDER BY p.NEXT_RUN_TIME ASC, p.ID ASC
            FOR UPDATE OF p.NEXT_RUN_TIME SKIP LOCKED
        """)) {
            JdbcUtil.setInstant(ps, 1, now);
            ps.setInt(2, limit);
            JdbcUtil.setInstant(ps, 3, now);
            try (var rs = ps.executeQuery()) {
                var out = new ArrayList<ProcedureJob>();
                while (rs.next()) out.add(RowMappers.toProcedureJob(rs));
                return out;
            }
        } catch (SQLException e) {
            throw JdbcUtil.translate("lockDue(TB_PROC_EVENT)", e);
        }
    }

    @Override
    public void markClaimed(long jobId, Instant claimedAt, Instant nextRunTime) throws Exception {
        try (var ps = TxContext.require().prepareStatement("""
            UPDATE TB_PROC_EVENT
               SET LAST_RUN_TIME = ?,
                   NEXT_RUN_TIME = ?,
                   UPDATED_AT    = SYSTIMESTAMP
             WHERE ID = ?
        """)) {
            JdbcUtil.setInstant(ps, 1, claimedAt);
            JdbcUtil.setInstant(ps, 2, nextRunTime);
            ps.setLong(3, jobId);
            if (ps.executeUpdate() == 0) {
                throw new IllegalStateException("TB_PROC_EVENT not found for ID=" + jobId);
            }
        } catch (SQLException e) {
            throw JdbcUtil.translate("markClaimed(TB_PROC_EVENT)", e);
        }
    }

    @Override
    public Optional<ProcedureJob> findById(long id) throws Exception {
        try (var ps = TxContext.require().prepareStatement("SELECT * FROM TB_PROC_EVENT WHERE ID = ?")) {
            ps.setLong(1, id);
            try (var rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(RowMappers.toProcedureJob(rs)) : Optional.empty();
            }
        }
    }
}
