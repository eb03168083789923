package com.skyt.core.property;

/**
 * Value held by one slot of a {@link PropertySet}. Implementations are
 * immutable and define value equality.
 */
public interface PropertyValue {

    ValueShape getShape();
}
