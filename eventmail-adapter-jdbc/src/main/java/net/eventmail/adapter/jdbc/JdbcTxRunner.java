package net.eventmail.adapter.jdbc;

import net.eventmail.core.error.StoreUnavailableException;
import net.eventmail.core.spi.TxRunner;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.concurrent.Callable;

/**
 * Plain-JDBC store session: one pooled connection per outermost body, committed on return and
 * rolled back on any throwable. Connectivity failures surface as {@link StoreUnavailableException}.
 */
public final class JdbcTxRunner implements TxRunner {
    private final DataSource ds;

    public JdbcTxRunner(DataSource ds) { this.ds = ds; }

    @Override
    public <T> T required(Callable<T> body) throws Exception {
        if (TxContext.get() != null) {
            // 이미 진행 중인 트랜잭션에 참여
            return body.call();
        }
        return inNewTransaction(body);
    }

    @Override
    public <T> T requiresNew(Callable<T> body) throws Exception {
        // 바깥 트랜잭션을 '정지' / 새 커넥션으로 대체 후, 종료 시 복원
        Connection suspended = TxContext.get();
        try {
            return inNewTransaction(body);
        } finally {
            if (suspended != null) TxContext.set(suspended);
        }
    }

    private <T> T inNewTransaction(Callable<T> body) throws Exception {
        try (Connection c = open()) {
            boolean prevAuto = c.getAutoCommit();
            c.setAutoCommit(false);
            TxContext.set(c);
            try {
                T r = body.call();
                c.commit();
                return r;
            } catch (Throwable t) {            // Throwable로 롤백 보장
                safeRollback(c);
                if (t instanceof SQLException se) throw JdbcUtil.translate("transaction", se);
                sneakyThrow(t);                 // 검사/비검사 구분없이 재던짐
                return null; // unreachable
            } finally {
                TxContext.clear();              // 반드시 해제
                try { c.setAutoCommit(prevAuto); } catch (SQLException ignore) { /* 커넥션 반납 시 풀에서 리셋 */ }
            }
        }
    }

    private Connection open() {
        try {
            return ds.getConnection();
        } catch (SQLException e) {
            throw new StoreUnavailableException("cannot open store session", e);
        }
    }

    private static void safeRollback(Connection c) {
        try { c.rollback(); } catch (SQLException ignore) { /* 끊긴 커넥션이면 롤백도 실패 */ }
    }

    @SuppressWarnings("unchecked")
    private static <E extends Throwable> void sneakyThrow(Throwable t) throws E { throw (E) t; }
}
