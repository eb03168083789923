package com.skyt.core.property;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * Flat record of named facts. Values are restricted to Long, Boolean and
 * String so records serialize and compare without loss.
 */
public final class RecordValue implements PropertyValue {

    private final Map<String, Object> entries;

    private RecordValue(Map<String, Object> entries) {
        this.entries = Collections.unmodifiableMap(new TreeMap<>(entries));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static RecordValue of(Map<String, Object> entries) {
        Builder builder = new Builder();
        entries.forEach(builder::putObject);
        return builder.build();
    }

    @Override
    public ValueShape getShape() {
        return ValueShape.RECORD;
    }

    public Map<String, Object> getEntries() { return entries; }
    public Set<String>         keys()       { return entries.keySet(); }
    public Object              get(String key) { return entries.get(key); }
    public int                 size()       { return entries.size(); }

    public long getLong(String key) {
        Object value = entries.get(key);
        return value instanceof Long ? (Long) value : 0L;
    }

    public String getString(String key) {
        Object value = entries.get(key);
        return value == null ? null : value.toString();
    }

    public boolean getBoolean(String key) {
        return Boolean.TRUE.equals(entries.get(key));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RecordValue)) return false;
        return entries.equals(((RecordValue) o).entries);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entries);
    }

    @Override
    public String toString() {
        return "Record" + entries;
    }

    // =========================================================================
    // Builder
    // =========================================================================

    public static final class Builder {
        private final Map<String, Object> entries = new TreeMap<>();

        private Builder() {}

        public Builder put(String key, long value)    { entries.put(key, value); return this; }
        public Builder put(String key, boolean value) { entries.put(key, value); return this; }

        public Builder put(String key, String value) {
            entries.put(key, value == null ? "" : value);
            return this;
        }

        public Builder putObject(String key, Object value) {
            if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
                entries.put(key, ((Number) value).longValue());
            } else if (value instanceof Long || value instanceof Boolean || value instanceof String) {
                entries.put(key, value);
            } else {
                throw new IllegalArgumentException("Unsupported record value for '" + key + "': "
                        + (value == null ? "null" : value.getClass().getSimpleName()));
            }
            return this;
        }

        public RecordValue build() {
            return new RecordValue(entries);
        }
    }
}
