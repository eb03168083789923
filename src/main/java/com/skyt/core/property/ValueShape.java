package com.skyt.core.property;

/** The value form a {@link PropertyKind} carries, which also selects its distance rule. */
public enum ValueShape {
    /** Flat string-keyed record; distance is the fraction of mismatched keys. */
    RECORD,
    /** Ordered tokens; distance is one minus the multiset overlap over the larger length. */
    SEQUENCE,
    /** Literal plus name-invariant structure hash; distance is equality under the naming policy. */
    HASH_PAIR,
    /** Recursion shape; compared with its own rule. */
    RECURSION_SCHEMA
}
