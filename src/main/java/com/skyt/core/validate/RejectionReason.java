package com.skyt.core.validate;

/**
 * Why a rewrite was rolled back. Gates are checked in declaration order of
 * cost, cheapest first; the first failing gate wins.
 */
public enum RejectionReason {
    /** The rewrite no longer parses. */
    UNPARSABLE,
    /** The rewrite references a name that nothing in the fragment or the builtin allow-list binds. */
    UNBOUND_IDENTIFIER,
    /** The rewrite has no method or type declaration left. */
    NO_DEFINITIONS,
    /** Distance to the canon went up. */
    DISTANCE_REGRESSION,
    /** The oracle's verdict on the rewrite is worse than on the code before it. */
    ORACLE_REGRESSION,
    /** The behavior probe saw a different return value or exception class. */
    BEHAVIOR_CHANGED,
    /** The behavior probe could not run, so equivalence is unproven. */
    PROBE_INCONCLUSIVE
}
