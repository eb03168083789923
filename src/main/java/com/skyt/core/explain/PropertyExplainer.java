package com.skyt.core.explain;

import com.skyt.core.property.PropertyKind;
import com.skyt.core.property.PropertyValue;

/**
 * Turns a nonzero distance on one property into a typed, hinted difference.
 *
 * Implementations recognize a small closed set of idioms and return null for
 * anything they cannot attribute to one of their {@link DifferenceType}s.
 */
public interface PropertyExplainer {

    PropertyKind getPropertyKind();

    PropertyDifference explain(PropertyValue candidateValue, PropertyValue canonValue,
                               ExplanationContext context);
}
