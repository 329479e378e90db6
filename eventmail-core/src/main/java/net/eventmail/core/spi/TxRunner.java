package net.eventmail.core.spi;

import java.util.concurrent.Callable;

/**
 * Scoped store session. Repositories only work inside a body run by one of these methods;
 * the connection is released when the body returns.
 */
public interface TxRunner {
    /** 진행 중인 트랜잭션이 있으면 참여, 없으면 새로 시작 */
    <T> T required(Callable<T> body) throws Exception;

    /** 항상 새 커넥션/트랜잭션. 바깥 트랜잭션은 끝날 때까지 정지 */
    <T> T requiresNew(Callable<T> body) throws Exception;
}
