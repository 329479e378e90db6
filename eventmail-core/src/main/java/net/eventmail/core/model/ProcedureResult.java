package net.eventmail.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rows produced by a procedure call plus the post-call values of its OUT / INOUT parameters,
 * keyed by parameter name.
 */
public record ProcedureResult(List<ResultRow> rows, Map<String, Object> outputs) {
    public ProcedureResult {
        rows = List.copyOf(rows);
        // OUT 값은 null 일 수 있어서 Map.copyOf 대신 LinkedHashMap
        outputs = outputs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(outputs));
    }
}
