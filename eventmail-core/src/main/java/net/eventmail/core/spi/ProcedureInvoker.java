package net.eventmail.core.spi;

import net.eventmail.core.model.BoundParameter;
import net.eventmail.core.model.ProcedureResult;

import java.util.List;

public interface ProcedureInvoker {
    /**
     * Calls {@code qualifiedName} with the given parameters in order, materializes every row it
     * returns and reads back OUT / INOUT values.
     */
    ProcedureResult invoke(String qualifiedName, List<BoundParameter> parameters) throws Exception;

    /** 진행 중인 호출을 (다른 스레드에서) 중단시킨다. 인터럽트가 닿지 않는 드라이버용 */
    default void cancelRunning() {}
}
