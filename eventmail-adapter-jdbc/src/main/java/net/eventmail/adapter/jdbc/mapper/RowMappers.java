package net.eventmail.adapter.jdbc.mapper;

import net.eventmail.adapter.jdbc.JdbcUtil;
import net.eventmail.core.model.ProcedureJob;
import net.eventmail.core.model.ProcedureParameter;
import net.eventmail.core.model.ResultRow;
import net.eventmail.core.model.TimeJob;

import java.sql.Clob;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.OffsetDateTime;

public final class RowMappers {
    private RowMappers() {}

    /** oracle.jdbc.OracleTypes.TIMESTAMPTZ */
    private static final int ORACLE_TIMESTAMPTZ = -101;

    // --- TB_TIME_EVENT ---
    public static TimeJob toTimeJob(ResultSet rs) throws SQLException {
        return new TimeJob(
                rs.getLong("ID"),
                rs.getString("JOB_NAME"),
                rs.getString("FILE_PATH"),
                rs.getString("ARGUMENTS"),
                rs.getString("WORKING_DIRECTORY"),
                JdbcUtil.isYes(rs.getString("ENABLED")),
                JdbcUtil.getNullableInt(rs, "INTERVAL_MINUTES"),
                JdbcUtil.getInstant(rs, "SCHEDULE_ANCHOR_UTC"),
                rs.getInt("MAX_RETRIES"),
                rs.getInt("RETRY_INTERVAL_SECONDS"),
                JdbcUtil.getInstant(rs, "NEXT_RUN_TIME"),
                JdbcUtil.getInstant(rs, "LAST_RUN_TIME")
        );
    }

    // --- TB_PROC_EVENT ---
    public static ProcedureJob toProcedureJob(ResultSet rs) throws SQLException {
        return new ProcedureJob(
                rs.getLong("ID"),
                rs.getString("STORED_PROC_NAME"),
                rs.getString("DATABASE_NAME"),
                rs.getInt("POLL_INTERVAL_SECONDS"),
                JdbcUtil.isYes(rs.getString("FIRE_ON_ANY_TRUE")),
                rs.getString("EMAIL_GROUP_ALIAS"),
                JdbcUtil.isYes(rs.getString("ENABLED")),
                JdbcUtil.getInstant(rs, "NEXT_RUN_TIME"),
                JdbcUtil.getInstant(rs, "LAST_RUN_TIME")
        );
    }

    // --- TB_PROC_PARAM ---
    public static ProcedureParameter toProcedureParameter(ResultSet rs) throws SQLException {
        String bool = rs.getString("VALUE_BOOL");
        return new ProcedureParameter(
                rs.getLong("ID"),
                rs.getLong("PROC_EVENT_ID"),
                rs.getInt("ORDINAL"),
                rs.getString("PARAM_NAME"),
                rs.getString("SQL_TYPE"),
                rs.getString("DIRECTION"),
                rs.getString("VALUE_TEXT"),
                JdbcUtil.getNullableInt(rs, "VALUE_INT"),
                rs.getBigDecimal("VALUE_DECIMAL"),
                JdbcUtil.getInstant(rs, "VALUE_TIMESTAMP"),
                bool == null ? null : JdbcUtil.isYes(bool)
        );
    }

    // --- 프로시저 결과 행 (임의 컬럼) ---
    public static ResultRow toResultRow(ResultSet rs) throws SQLException {
        ResultSetMetaData md = rs.getMetaData();
        var b = ResultRow.builder();
        for (int i = 1; i <= md.getColumnCount(); i++) {
            String label = md.getColumnLabel(i);
            b.put(label == null || label.isEmpty() ? md.getColumnName(i) : label, cell(rs, md.getColumnType(i), i));
        }
        return b.build();
    }

    /** 시각은 UTC 기준 Instant 로 (JVM 타임존과 무관), 그 외 드라이버 전용 타입은 렌더링 가능한 값으로 */
    static Object cell(ResultSet rs, int sqlType, int i) throws SQLException {
        switch (sqlType) {
            case Types.TIMESTAMP, Types.DATE -> {
                Timestamp t = rs.getTimestamp(i, JdbcUtil.utc());
                return t == null ? null : t.toInstant();
            }
            case Types.TIMESTAMP_WITH_TIMEZONE, ORACLE_TIMESTAMPTZ -> {
                OffsetDateTime t = rs.getObject(i, OffsetDateTime.class);
                return t == null ? null : t.toInstant();
            }
            default -> {
                Object v = rs.getObject(i);
                if (v instanceof Clob c) return c.getSubString(1, (int) Math.min(c.length(), Integer.MAX_VALUE));
                return v;
            }
        }
    }
}
