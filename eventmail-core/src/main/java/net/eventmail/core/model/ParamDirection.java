package net.eventmail.core.model;

import net.eventmail.core.error.ConfigurationException;

import java.util.Locale;

public enum ParamDirection {
    IN, OUT, INOUT;

    public boolean isInput() { return this != OUT; }

    public boolean isOutput() { return this != IN; }

    public static ParamDirection from(String s) {
        if (s == null || s.isBlank()) return IN;
        return switch (s.trim().toLowerCase(Locale.ROOT)) {
            case "in", "input" -> IN;
            case "out", "output" -> OUT;
            case "inout", "in_out", "inputoutput" -> INOUT;
            default -> throw new ConfigurationException("unknown parameter direction: " + s);
        };
    }
}
