package net.eventmail.adapter.jdbc;

import net.eventmail.core.error.StoreUnavailableException;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTransientConnectionException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.Calendar;
import java.util.TimeZone;

public final class JdbcUtil {
    private JdbcUtil() {}

    /** 모든 시각 컬럼은 UTC로 저장 (JVM 타임존과 무관하게) */
    private static final ThreadLocal<Calendar> UTC =
            ThreadLocal.withInitial(() -> Calendar.getInstance(TimeZone.getTimeZone("UTC")));

    public static Timestamp ts(Instant i) { return i == null ? null : Timestamp.from(i); }

    public static void setInstant(PreparedStatement ps, int idx, Instant i) throws SQLException {
        if (i == null) ps.setNull(idx, Types.TIMESTAMP);
        else ps.setTimestamp(idx, ts(i), UTC.get());
    }

    public static Instant getInstant(ResultSet rs, String column) throws SQLException {
        Timestamp t = rs.getTimestamp(column, UTC.get());
        return t == null ? null : t.toInstant();
    }

    public static Calendar utc() { return UTC.get(); }

    public static boolean isYes(String s) { return s != null && "Y".equalsIgnoreCase(s.trim()); }

    public static Integer getNullableInt(ResultSet rs, String column) throws SQLException {
        int v = rs.getInt(column);
        return rs.wasNull() ? null : v;
    }

    /** 연결 계열 오류(SQLState 08xxx 등)인지 */
    public static boolean isConnectivity(SQLException e) {
        for (SQLException cur = e; cur != null; cur = cur.getNextException()) {
            if (cur instanceof SQLTransientConnectionException
                    || cur instanceof SQLNonTransientConnectionException
                    || cur instanceof SQLRecoverableException) return true;
            String state = cur.getSQLState();
            if (state != null && state.startsWith("08")) return true;
        }
        return false;
    }

    /** 연결 계열이면 StoreUnavailableException, 아니면 그대로 */
    public static Exception translate(String op, SQLException e) {
        return isConnectivity(e) ? new StoreUnavailableException(op + ": store unavailable", e) : e;
    }
}
