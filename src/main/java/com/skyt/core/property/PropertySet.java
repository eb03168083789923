package com.skyt.core.property;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Immutable mapping from every {@link PropertyKind} to its value.
 *
 * A well-formed set has a value for every kind. The null-filled set marks an
 * unparsable fragment and is never mixed with real values: a set is either
 * complete or entirely null.
 */
public final class PropertySet {

    private static final PropertySet NULL_FILLED = new PropertySet(new EnumMap<>(PropertyKind.class));

    private final Map<PropertyKind, PropertyValue> values;

    private PropertySet(EnumMap<PropertyKind, PropertyValue> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    /** The incomparable set returned for unparsable source. */
    public static PropertySet nullFilled() {
        return NULL_FILLED;
    }

    public static Builder builder() {
        return new Builder();
    }

    // =========================================================================
    // Accessors
    // =========================================================================

    /** Value for the kind, or null when the set is null-filled. */
    public PropertyValue get(PropertyKind kind) {
        return values.get(kind);
    }

    public boolean has(PropertyKind kind) {
        return values.containsKey(kind);
    }

    public boolean isNullFilled() {
        return values.isEmpty();
    }

    public Map<PropertyKind, PropertyValue> asMap() {
        return values;
    }

    public RecordValue getRecord(PropertyKind kind) {
        PropertyValue value = values.get(kind);
        return value instanceof RecordValue ? (RecordValue) value : null;
    }

    public SequenceValue getSequence(PropertyKind kind) {
        PropertyValue value = values.get(kind);
        return value instanceof SequenceValue ? (SequenceValue) value : null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PropertySet)) return false;
        return values.equals(((PropertySet) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return isNullFilled() ? "PropertySet{null-filled}" : "PropertySet" + values;
    }

    // =========================================================================
    // Builder
    // =========================================================================

    public static final class Builder {
        private final EnumMap<PropertyKind, PropertyValue> values = new EnumMap<>(PropertyKind.class);

        private Builder() {}

        public Builder put(PropertyKind kind, PropertyValue value) {
            if (kind == null) {
                throw new IllegalArgumentException("Property kind must not be null");
            }
            if (value == null) {
                throw new IllegalArgumentException("Missing value for " + kind.getKey());
            }
            if (value.getShape() != kind.getShape()) {
                throw new IllegalArgumentException("Property " + kind.getKey() + " expects "
                        + kind.getShape() + " but got " + value.getShape());
            }
            values.put(kind, value);
            return this;
        }

        /** Builds the set; every kind must have been supplied. */
        public PropertySet build() {
            for (PropertyKind kind : PropertyKind.values()) {
                if (!values.containsKey(kind)) {
                    throw new IllegalStateException("Property set is missing " + kind.getKey());
                }
            }
            return new PropertySet(new EnumMap<>(values));
        }
    }
}
