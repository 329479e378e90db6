package net.eventmail.core.service;

import net.eventmail.core.error.ConfigurationException;
import net.eventmail.core.model.BoundParameter;
import net.eventmail.core.model.ParamDirection;
import net.eventmail.core.model.ParamType;
import net.eventmail.core.model.ProcedureJob;
import net.eventmail.core.model.ProcedureParameter;
import net.eventmail.core.model.ProcedureResult;
import net.eventmail.core.model.TypedValue;
import net.eventmail.core.spi.ProcedureInvoker;
import net.eventmail.core.spi.ProcedureParameterRepository;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a procedure's parameter rows into typed, directed bindings and calls the procedure.
 * Must run inside a store session ({@link net.eventmail.core.spi.TxRunner}).
 */
public final class ParameterBinder {
    private final ProcedureParameterRepository params;
    private final ProcedureInvoker invoker;

    public ParameterBinder(ProcedureParameterRepository params, ProcedureInvoker invoker) {
        this.params = params;
        this.invoker = invoker;
    }

    public List<BoundParameter> bind(long procedureId) throws Exception {
        var out = new ArrayList<BoundParameter>();
        for (ProcedureParameter p : params.findByProcedure(procedureId)) {
            out.add(toBound(p));
        }
        return out;
    }

    public ProcedureResult invoke(ProcedureJob job, List<BoundParameter> parameters) throws Exception {
        return invoker.invoke(job.qualifiedName(), parameters);
    }

    /** bind + invoke */
    public ProcedureResult execute(ProcedureJob job) throws Exception {
        return invoke(job, bind(job.id()));
    }

    public void cancelRunning() {
        invoker.cancelRunning();
    }

    static BoundParameter toBound(ProcedureParameter p) {
        String name = p.name() == null ? "" : p.name().trim();
        if (name.startsWith("@") || name.startsWith(":")) name = name.substring(1); // 이전 스키마 표기 허용
        if (name.isEmpty()) {
            throw new ConfigurationException("parameter #" + p.ordinal() + " of procedure " + p.procedureId() + " has no name");
        }
        ParamType type = ParamType.from(p.declaredType());
        ParamDirection direction = ParamDirection.from(p.direction());
        // OUT 전용은 입력값을 보내지 않는다
        TypedValue value = direction == ParamDirection.OUT ? TypedValue.nullOf(type) : p.typedValue(type);
        return new BoundParameter(name, direction, value);
    }
}
