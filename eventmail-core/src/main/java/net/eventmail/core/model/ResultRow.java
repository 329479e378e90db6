package net.eventmail.core.model;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * One row returned by a monitored procedure. Column order is kept as returned;
 * lookups ignore case.
 */
public final class ResultRow {
    public static final String TRIGGERED = "Triggered";

    private final Map<String, Object> values;
    private final Map<String, String> keysByLower;

    private ResultRow(Map<String, Object> values, Map<String, String> keysByLower) {
        this.values = values;
        this.keysByLower = keysByLower;
    }

    public static ResultRow of(Map<String, ?> columns) {
        var b = builder();
        columns.forEach(b::put);
        return b.build();
    }

    public static Builder builder() { return new Builder(); }

    public List<String> columns() { return List.copyOf(values.keySet()); }

    public Object get(String column) {
        if (column == null) return null;
        String key = keysByLower.get(column.toLowerCase(Locale.ROOT));
        return key == null ? null : values.get(key);
    }

    /**
     * {@code Triggered} column as a gate signal: Boolean true, or numeric 1 since Oracle has no
     * SQL boolean and returns {@code NUMBER(1)} flags. Anything else, text and a missing column
     * included, is false.
     */
    public boolean triggered() {
        return isTrue(get(TRIGGERED));
    }

    public int size() { return values.size(); }

    static boolean isTrue(Object v) {
        if (v instanceof Boolean b) return b;
        if (v instanceof Number n) return n.doubleValue() == 1d;
        return false;
    }

    @Override public String toString() { return "ResultRow" + values; }

    public static final class Builder {
        private final Map<String, Object> values = new LinkedHashMap<>();
        private final Map<String, String> keysByLower = new HashMap<>();

        private Builder() {}

        /** 같은 이름(대소문자 무시)이 다시 오면 마지막 값이 이긴다. 위치는 처음 것 유지 */
        public Builder put(String column, Object value) {
            String lower = column.toLowerCase(Locale.ROOT);
            String existing = keysByLower.get(lower);
            if (existing != null) {
                values.put(existing, value);
            } else {
                keysByLower.put(lower, column);
                values.put(column, value);
            }
            return this;
        }

        public ResultRow build() {
            return new ResultRow(new LinkedHashMap<>(values), new HashMap<>(keysByLower));
        }
    }
}
