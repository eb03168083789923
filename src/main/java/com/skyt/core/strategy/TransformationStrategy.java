package com.skyt.core.strategy;

import com.skyt.core.explain.DifferenceType;
import com.skyt.core.explain.PropertyDifference;
import com.skyt.core.property.PropertyKind;

/**
 * A stateless rewrite rule bound to one property kind.
 *
 * {@link #generate} works on the syntax tree and is guided only by the
 * difference's hints. It returns the rewritten source, or null when the hinted
 * site is no longer present or the rewrite does not apply.
 */
public interface TransformationStrategy {

    String getName();

    PropertyKind getPropertyKind();

    boolean canHandle(DifferenceType type);

    String generate(PropertyDifference difference, String source);
}
