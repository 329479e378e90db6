package net.eventmail.adapter.jdbc.repo;

import net.eventmail.adapter.jdbc.JdbcUtil;
import net.eventmail.adapter.jdbc.TxContext;
import net.eventmail.adapter.jdbc.mapper.RowMappers;
import net.eventmail.core.model.ProcedureParameter;
import net.eventmail.core.spi.ProcedureParameterRepository;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

public final class JdbcProcedureParameterRepository implements ProcedureParameterRepository {

    @Override
    public List<ProcedureParameter> findByProcedure(long procedureId) throws Exception {
        try (var ps = TxContext.require().prepareStatement("""
            SELECT *
              FROM TB_PROC_PARAM
             WHERE PROC_EVENT_ID = ?
             ORDER BY ORDINAL, ID
        """)) {
            ps.setLong(1, procedureId);
            try (var rs = ps.executeQuery()) {
                var out = new ArrayList<ProcedureParameter>();
                while (rs.next()) out.add(RowMappers.toProcedureParameter(rs));
                return out;
            }
        } catch (SQLException e) {
            throw JdbcUtil.translate("findByProcedure", e);
        }
    }
}
