package com.skyt.core.property;

import java.util.Objects;

/**
 * Shape of self-reference in a fragment.
 *
 * Branching is the largest number of self-calls a single execution path can
 * make: one per path is LINEAR (binary search), two is BINARY (naive fibonacci).
 */
public final class RecursionSchema implements PropertyValue {

    public enum Branching {
        NONE,
        LINEAR,
        BINARY,
        MULTI_WAY;

        public static Branching fromCallsPerPath(int calls) {
            if (calls <= 0) return NONE;
            if (calls == 1) return LINEAR;
            if (calls == 2) return BINARY;
            return MULTI_WAY;
        }
    }

    private static final RecursionSchema NON_RECURSIVE =
            new RecursionSchema(false, Branching.NONE, 0, 0, false);

    private final boolean   recursive;
    private final Branching branching;
    private final int       baseCaseCount;
    private final int       recursiveCallCount;
    private final boolean   divideAndConquer;

    public RecursionSchema(boolean recursive, Branching branching, int baseCaseCount,
                           int recursiveCallCount, boolean divideAndConquer) {
        this.recursive          = recursive;
        this.branching          = Objects.requireNonNull(branching, "branching");
        this.baseCaseCount      = baseCaseCount;
        this.recursiveCallCount = recursiveCallCount;
        this.divideAndConquer   = divideAndConquer;
    }

    public static RecursionSchema nonRecursive() {
        return NON_RECURSIVE;
    }

    @Override
    public ValueShape getShape() {
        return ValueShape.RECURSION_SCHEMA;
    }

    public boolean   isRecursive()           { return recursive; }
    public Branching getBranching()          { return branching; }
    public int       getBaseCaseCount()      { return baseCaseCount; }
    public int       getRecursiveCallCount() { return recursiveCallCount; }
    public boolean   isDivideAndConquer()    { return divideAndConquer; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RecursionSchema)) return false;
        RecursionSchema other = (RecursionSchema) o;
        return recursive == other.recursive
                && branching == other.branching
                && baseCaseCount == other.baseCaseCount
                && recursiveCallCount == other.recursiveCallCount
                && divideAndConquer == other.divideAndConquer;
    }

    @Override
    public int hashCode() {
        return Objects.hash(recursive, branching, baseCaseCount, recursiveCallCount, divideAndConquer);
    }

    @Override
    public String toString() {
        return "RecursionSchema{recursive=" + recursive + ", branching=" + branching
                + ", baseCases=" + baseCaseCount + ", recursiveCalls=" + recursiveCallCount
                + ", divideAndConquer=" + divideAndConquer + "}";
    }
}
