package net.eventmail.adapter.jdbc;

import net.eventmail.adapter.jdbc.mapper.RowMappers;
import net.eventmail.core.error.ActionExecutionException;
import net.eventmail.core.error.ConfigurationException;
import net.eventmail.core.model.BoundParameter;
import net.eventmail.core.model.ProcedureResult;
import net.eventmail.core.model.ResultRow;
import net.eventmail.core.model.TypedValue;
import net.eventmail.core.spi.ProcedureInvoker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.sql.CallableStatement;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Calls a stored procedure with named-notation binds ({@code name => ?}) and collects every
 * result set it returns, implicit results included.
 * <p>
 * Statements in flight are tracked so {@link #cancelRunning()} can abort them from another
 * thread; a blocking {@code execute()} does not react to {@link Thread#interrupt()}.
 */
public final class JdbcProcedureInvoker implements ProcedureInvoker {
    private static final Logger log = LoggerFactory.getLogger(JdbcProcedureInvoker.class);

    public static final Duration DEFAULT_QUERY_TIMEOUT = Duration.ofSeconds(30);

    /** schema.package.proc 까지. 따옴표/공백/세미콜론 불가 */
    private static final Pattern QUALIFIED = Pattern.compile("[A-Za-z][A-Za-z0-9_$#]*(\\.[A-Za-z][A-Za-z0-9_$#]*){0,2}");
    private static final Pattern PARAM = Pattern.compile("[A-Za-z][A-Za-z0-9_$#]*");

    private static final int MAX_RESULTS = 64;

    private final Duration queryTimeout;
    private final Set<CallableStatement> running = ConcurrentHashMap.newKeySet();

    public JdbcProcedureInvoker() { this(DEFAULT_QUERY_TIMEOUT); }

    public JdbcProcedureInvoker(Duration queryTimeout) { this.queryTimeout = queryTimeout; }

    @Override
    public ProcedureResult invoke(String qualifiedName, List<BoundParameter> parameters) throws Exception {
        String sql = callSql(qualifiedName, parameters);
        try (CallableStatement cs = TxContext.require().prepareCall(sql)) {
            if (!queryTimeout.isZero()) cs.setQueryTimeout((int) Math.max(1, queryTimeout.toSeconds()));
            running.add(cs);
            try {
                return call(cs, parameters);
            } finally {
                running.remove(cs);
            }
        } catch (SQLException e) {
            Exception translated = JdbcUtil.translate("invoke " + qualifiedName, e);
            if (translated != e) throw translated;
            throw new ActionExecutionException("procedure " + qualifiedName + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void cancelRunning() {
        for (CallableStatement cs : running) {
            try {
                cs.cancel();
                log.info("Cancelled running procedure call");
            } catch (SQLException e) {
                log.warn("Could not cancel running procedure call", e);
            }
        }
    }

    int runningCalls() { return running.size(); }

    private static ProcedureResult call(CallableStatement cs, List<BoundParameter> parameters) throws SQLException {
        for (int i = 0; i < parameters.size(); i++) {
            bind(cs, i + 1, parameters.get(i));
        }

        var rows = new ArrayList<ResultRow>();
        if (cs.execute()) readRows(cs, rows);
        // 암시적 결과셋(DBMS_SQL.RETURN_RESULT)은 getMoreResults 로만 나온다
        for (int i = 0; i < MAX_RESULTS; i++) {
            if (cs.getMoreResults()) readRows(cs, rows);
            else if (cs.getUpdateCount() == -1) break;
        }

        Map<String, Object> outputs = new LinkedHashMap<>();
        for (int i = 0; i < parameters.size(); i++) {
            BoundParameter p = parameters.get(i);
            if (p.direction().isOutput()) outputs.put(p.name(), readOutput(cs, i + 1, p));
        }
        return new ProcedureResult(rows, outputs);
    }

    static String callSql(String qualifiedName, List<BoundParameter> parameters) {
        if (qualifiedName == null || !QUALIFIED.matcher(qualifiedName).matches()) {
            throw new ConfigurationException("not a valid procedure name: " + qualifiedName);
        }
        for (BoundParameter p : parameters) {
            if (!PARAM.matcher(p.name()).matches()) {
                throw new ConfigurationException("not a valid parameter name: " + p.name() + " (" + qualifiedName + ")");
            }
        }
        String args = parameters.stream().map(p -> p.name() + " => ?").collect(Collectors.joining(", "));
        return "{call " + qualifiedName + "(" + args + ")}";
    }

    private static void readRows(CallableStatement cs, List<ResultRow> rows) throws SQLException {
        try (var rs = cs.getResultSet()) {
            while (rs.next()) rows.add(RowMappers.toResultRow(rs));
        }
    }

    private static void bind(CallableStatement cs, int idx, BoundParameter p) throws SQLException {
        int sqlType = p.type().sqlType();
        if (p.direction().isOutput()) cs.registerOutParameter(idx, sqlType);
        if (!p.direction().isInput()) return;

        TypedValue v = p.value();
        if (v.isNull()) {
            cs.setNull(idx, sqlType);
            return;
        }
        switch (p.type()) {
            case INTEGER -> cs.setInt(idx, (Integer) v.value());
            case TEXT -> cs.setString(idx, (String) v.value());
            case DECIMAL -> cs.setBigDecimal(idx, (BigDecimal) v.value());
            case TIMESTAMP -> cs.setTimestamp(idx, Timestamp.from((Instant) v.value()), JdbcUtil.utc());
            case BOOLEAN -> cs.setBoolean(idx, (Boolean) v.value());
        }
    }

    private static Object readOutput(CallableStatement cs, int idx, BoundParameter p) throws SQLException {
        Object v = switch (p.type()) {
            case INTEGER -> cs.getInt(idx);
            case TEXT -> cs.getString(idx);
            case DECIMAL -> cs.getBigDecimal(idx);
            case TIMESTAMP -> {
                Timestamp t = cs.getTimestamp(idx, JdbcUtil.utc());
                yield t == null ? null : t.toInstant();
            }
            case BOOLEAN -> cs.getBoolean(idx);
        };
        return cs.wasNull() ? null : v;
    }
}
