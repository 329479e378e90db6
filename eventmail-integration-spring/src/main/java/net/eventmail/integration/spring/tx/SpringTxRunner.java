package net.eventmail.integration.spring.tx;

import net.eventmail.adapter.jdbc.JdbcUtil;
import net.eventmail.adapter.jdbc.TxContext;
import net.eventmail.core.error.StoreUnavailableException;
import net.eventmail.core.spi.TxRunner;
import org.springframework.jdbc.CannotGetJdbcConnectionException;
import org.springframework.jdbc.datasource.DataSourceUtils;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.concurrent.Callable;

/**
 * {@link TxRunner} on top of a Spring {@link PlatformTransactionManager}. The transaction's
 * connection is exposed through {@link TxContext} so the JDBC repositories work unchanged.
 */
public final class SpringTxRunner implements TxRunner {
    private final PlatformTransactionManager tm;
    private final DataSource ds;

    public SpringTxRunner(PlatformTransactionManager tm, DataSource ds) {
        this.tm = tm;
        this.ds = ds;
    }

    @Override
    public <T> T required(Callable<T> body) throws Exception {
        return execute(TransactionDefinition.PROPAGATION_REQUIRED, body);
    }

    @Override
    public <T> T requiresNew(Callable<T> body) throws Exception {
        return execute(TransactionDefinition.PROPAGATION_REQUIRES_NEW, body);
    }

    private <T> T execute(int propagation, Callable<T> body) throws Exception {
        var tpl = new TransactionTemplate(tm);
        tpl.setPropagationBehavior(propagation);

        // REQUIRES_NEW 동안 바깥 커넥션은 정지, 끝나면 복원
        Connection suspended = propagation == TransactionDefinition.PROPAGATION_REQUIRES_NEW ? TxContext.get() : null;
        try {
            return tpl.execute(status -> {
                // 참여하는 경우 이미 꽂힌 커넥션 그대로 사용
                Connection existing = TxContext.get();
                if (existing != null && suspended == null) {
                    return call(body);
                }

                // 스프링 트랜잭션의 물리 커넥션을 끌어와 TxContext에 꽂아줌
                Connection con = DataSourceUtils.getConnection(ds);
                try {
                    TxContext.set(con);
                    return call(body);
                } finally {
                    TxContext.clear();
                    DataSourceUtils.releaseConnection(con, ds); // 스프링이 관리하는 방식으로 반납
                }
            });
        } catch (CheckedBodyException e) {
            Exception cause = (Exception) e.getCause();
            if (cause instanceof SQLException se) throw JdbcUtil.translate("transaction", se);
            throw cause;
        } catch (CannotGetJdbcConnectionException | CannotCreateTransactionException e) {
            throw new StoreUnavailableException("cannot open store session", e);
        } finally {
            if (suspended != null) TxContext.set(suspended);
        }
    }

    private static <T> T call(Callable<T> body) {
        try {
            return body.call();
        } catch (RuntimeException re) {
            throw re;
        } catch (Exception e) {
            throw new CheckedBodyException(e);
        }
    }

    /** TransactionTemplate 밖으로 검사 예외를 실어 나르기 위한 포장. 롤백은 그대로 일어난다 */
    private static final class CheckedBodyException extends RuntimeException {
        CheckedBodyException(Exception cause) { super(cause); }
    }
}
