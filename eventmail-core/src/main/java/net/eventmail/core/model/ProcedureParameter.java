package net.eventmail.core.model;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Parameter definition row for a monitored procedure. Only the slot that matches
 * {@code declaredType} is read; the others are ignored even when populated.
 */
public record ProcedureParameter(
        Long id,
        long procedureId,
        int ordinal,
        String name,
        String declaredType,
        String direction,
        String valueText,
        Integer valueInt,
        BigDecimal valueDecimal,
        Instant valueTimestamp,
        Boolean valueBool
) {
    public TypedValue typedValue(ParamType type) {
        return switch (type) {
            case INTEGER -> new TypedValue(type, valueInt);
            case TEXT -> new TypedValue(type, valueText);
            case DECIMAL -> new TypedValue(type, valueDecimal);
            case TIMESTAMP -> new TypedValue(type, valueTimestamp);
            case BOOLEAN -> new TypedValue(type, valueBool);
        };
    }
}
