package com.skyt.core.naming;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Which identifiers may be renamed toward the canon.
 *
 *   fixed   : names that must never be renamed, and that are always valid targets
 *   flexible: names eligible as rename targets; empty means every non-fixed name
 *   strict  : disables all renaming regardless of the two lists
 *
 * Strict also makes structure comparison name-sensitive: the literal hash is
 * compared instead of the name-invariant one.
 */
public final class NamingPolicy {

    private static final NamingPolicy PERMISSIVE = new NamingPolicy(Set.of(), Set.of(), false);

    private final Set<String> fixedNames;
    private final Set<String> flexibleNames;
    private final boolean     strict;

    private NamingPolicy(Collection<String> fixedNames, Collection<String> flexibleNames, boolean strict) {
        this.fixedNames    = Collections.unmodifiableSet(new LinkedHashSet<>(fixedNames));
        this.flexibleNames = Collections.unmodifiableSet(new LinkedHashSet<>(flexibleNames));
        this.strict        = strict;
    }

    public static NamingPolicy of(Collection<String> fixedNames, Collection<String> flexibleNames, boolean strict) {
        return new NamingPolicy(
                fixedNames == null ? Set.of() : fixedNames,
                flexibleNames == null ? Set.of() : flexibleNames,
                strict);
    }

    /** No fixed names, everything flexible, renaming on. */
    public static NamingPolicy permissive() {
        return PERMISSIVE;
    }

    public static NamingPolicy strictPolicy() {
        return new NamingPolicy(Set.of(), Set.of(), true);
    }

    // =========================================================================
    // Queries
    // =========================================================================

    public boolean allowsRename(String from, String to) {
        if (strict) return false;
        if (from == null || to == null || from.equals(to)) return false;
        if (fixedNames.contains(from)) return false;
        if (flexibleNames.isEmpty()) return true;
        return flexibleNames.contains(to) || fixedNames.contains(to);
    }

    public boolean isNameSensitive() {
        return strict;
    }

    public Set<String> getFixedNames()    { return fixedNames; }
    public Set<String> getFlexibleNames() { return flexibleNames; }
    public boolean     isStrict()         { return strict; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NamingPolicy)) return false;
        NamingPolicy other = (NamingPolicy) o;
        return strict == other.strict
                && fixedNames.equals(other.fixedNames)
                && flexibleNames.equals(other.flexibleNames);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * fixedNames.hashCode() + flexibleNames.hashCode()) + (strict ? 1 : 0);
    }

    @Override
    public String toString() {
        return "NamingPolicy{strict=" + strict + ", fixed=" + fixedNames + ", flexible=" + flexibleNames + "}";
    }
}
