package com.skyt.core.explain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Structured data an explainer hands to the strategy for its difference type.
 * This is the only channel between explanation and rewriting.
 *
 * Values are strings, ints, booleans, string lists or string-to-string maps.
 */
public final class TransformationHints {

    private static final TransformationHints EMPTY = new TransformationHints(Map.of());

    private final Map<String, Object> values;

    private TransformationHints(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static TransformationHints empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    // =========================================================================
    // Typed accessors
    // =========================================================================

    public boolean has(String key) {
        return values.containsKey(key);
    }

    public String getString(String key) {
        Object value = values.get(key);
        return value == null ? null : value.toString();
    }

    public int getInt(String key, int fallback) {
        Object value = values.get(key);
        return value instanceof Integer ? (Integer) value : fallback;
    }

    public boolean getBoolean(String key) {
        return Boolean.TRUE.equals(values.get(key));
    }

    @SuppressWarnings("unchecked")
    public List<String> getStringList(String key) {
        Object value = values.get(key);
        return value instanceof List ? (List<String>) value : List.of();
    }

    @SuppressWarnings("unchecked")
    public Map<String, String> getStringMap(String key) {
        Object value = values.get(key);
        return value instanceof Map ? (Map<String, String>) value : Map.of();
    }

    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public String toString() {
        return values.toString();
    }

    // =========================================================================
    // Builder
    // =========================================================================

    public static final class Builder {
        private final Map<String, Object> values = new LinkedHashMap<>();

        private Builder() {}

        public Builder put(String key, String value)  { values.put(key, value); return this; }
        public Builder put(String key, int value)     { values.put(key, value); return this; }
        public Builder put(String key, boolean value) { values.put(key, value); return this; }

        public Builder putList(String key, List<String> value) {
            values.put(key, List.copyOf(value));
            return this;
        }

        public Builder putMap(String key, Map<String, String> value) {
            values.put(key, Collections.unmodifiableMap(new LinkedHashMap<>(value)));
            return this;
        }

        public TransformationHints build() {
            return new TransformationHints(values);
        }
    }
}
