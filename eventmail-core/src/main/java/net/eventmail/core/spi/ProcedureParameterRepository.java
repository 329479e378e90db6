package net.eventmail.core.spi;

import net.eventmail.core.model.ProcedureParameter;

import java.util.List;

public interface ProcedureParameterRepository {
    /** ORDINAL 순 */
    List<ProcedureParameter> findByProcedure(long procedureId) throws Exception;
}
