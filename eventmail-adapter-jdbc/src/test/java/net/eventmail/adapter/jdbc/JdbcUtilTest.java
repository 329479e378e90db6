package net.eventmail.adapter.jdbc;

import net.eventmail.core.error.StoreUnavailableException;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.sql.SQLRecoverableException;
import java.sql.SQLSyntaxErrorException;

import static org.assertj.core.api.Assertions.assertThat;

class JdbcUtilTest {

    @Test
    void connection_class_sql_state_is_store_unavailable() {
        var e = new SQLException("io error", "08006");
        assertThat(JdbcUtil.isConnectivity(e)).isTrue();
        assertThat(JdbcUtil.translate("lockDue", e)).isInstanceOf(StoreUnavailableException.class).hasCause(e);
    }

    @Test
    void recoverable_exception_is_store_unavailable() {
        assertThat(JdbcUtil.isConnectivity(new SQLRecoverableException("closed connection"))).isTrue();
    }

    @Test
    void chained_connection_failure_is_detected() {
        var top = new SQLException("batch failed", "HY000");
        top.setNextException(new SQLException("socket", "08S01"));
        assertThat(JdbcUtil.isConnectivity(top)).isTrue();
    }

    @Test
    void other_sql_errors_pass_through() {
        var e = new SQLSyntaxErrorException("ORA-00942", "42000");
        assertThat(JdbcUtil.translate("lockDue", e)).isSameAs(e);
    }

    @Test
    void yes_no_flags() {
        assertThat(JdbcUtil.isYes("Y")).isTrue();
        assertThat(JdbcUtil.isYes(" y ")).isTrue();
        assertThat(JdbcUtil.isYes("N")).isFalse();
        assertThat(JdbcUtil.isYes(null)).isFalse();
    }
}
