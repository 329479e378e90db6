package net.eventmail.core.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * A parameter value tagged with its declared type. A null {@code value} is a typed SQL NULL;
 * it is never converted into another type.
 */
public record TypedValue(ParamType type, Object value) {

    public TypedValue {
        Objects.requireNonNull(type, "type");
        if (value != null && !javaType(type).isInstance(value)) {
            throw new IllegalArgumentException(type + " value must be " + javaType(type).getSimpleName()
                    + " but was " + value.getClass().getSimpleName());
        }
    }

    public static TypedValue nullOf(ParamType type) { return new TypedValue(type, null); }

    public boolean isNull() { return value == null; }

    public static Class<?> javaType(ParamType type) {
        return switch (type) {
            case INTEGER -> Integer.class;
            case TEXT -> String.class;
            case DECIMAL -> BigDecimal.class;
            case TIMESTAMP -> Instant.class;
            case BOOLEAN -> Boolean.class;
        };
    }
}
