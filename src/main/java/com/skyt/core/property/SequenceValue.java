package com.skyt.core.property;

import java.util.Collections;
import java.util.List;
import java.util.ArrayList;

/** Ordered list of string tokens. */
public final class SequenceValue implements PropertyValue {

    private static final SequenceValue EMPTY = new SequenceValue(List.of());

    private final List<String> items;

    private SequenceValue(List<String> items) {
        this.items = Collections.unmodifiableList(new ArrayList<>(items));
    }

    public static SequenceValue of(List<String> items) {
        if (items == null || items.isEmpty()) return EMPTY;
        for (String item : items) {
            if (item == null) throw new IllegalArgumentException("Sequence items must not be null");
        }
        return new SequenceValue(items);
    }

    public static SequenceValue empty() {
        return EMPTY;
    }

    @Override
    public ValueShape getShape() {
        return ValueShape.SEQUENCE;
    }

    public List<String> getItems() { return items; }
    public int          size()     { return items.size(); }
    public boolean      isEmpty()  { return items.isEmpty(); }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SequenceValue)) return false;
        return items.equals(((SequenceValue) o).items);
    }

    @Override
    public int hashCode() {
        return items.hashCode();
    }

    @Override
    public String toString() {
        return "Sequence" + items;
    }
}
