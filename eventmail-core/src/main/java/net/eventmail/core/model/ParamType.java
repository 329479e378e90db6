package net.eventmail.core.model;

import net.eventmail.core.error.ConfigurationException;

import java.sql.Types;
import java.util.Locale;

/** Declared type of a procedure parameter; each one reads exactly one value slot. */
public enum ParamType {
    INTEGER(Types.INTEGER),
    TEXT(Types.VARCHAR),
    DECIMAL(Types.DECIMAL),
    TIMESTAMP(Types.TIMESTAMP),
    BOOLEAN(Types.BOOLEAN);

    private final int sqlType;

    ParamType(int sqlType) { this.sqlType = sqlType; }

    public int sqlType() { return sqlType; }

    public static ParamType from(String s) {
        if (s == null) throw new ConfigurationException("parameter type is missing");
        return switch (s.trim().toLowerCase(Locale.ROOT)) {
            case "int", "integer", "number" -> INTEGER;
            case "text", "nvarchar", "varchar", "varchar2", "string" -> TEXT;
            case "decimal", "numeric" -> DECIMAL;
            case "timestamp", "datetime", "datetime2", "date" -> TIMESTAMP;
            case "boolean", "bool", "bit" -> BOOLEAN;
            default -> throw new ConfigurationException("unknown parameter type: " + s);
        };
    }
}
