package com.skyt.core.explain;

import org.junit.jupiter.api.Test;

import static com.skyt.core.explain.ExplainerFixtures.explain;
import static org.junit.jupiter.api.Assertions.*;

class BaseCaseExplainerTest {

    private final BaseCaseExplainer explainer = new BaseCaseExplainer();

    @Test
    void testEquivalentGuardSpelledDifferently() {
        PropertyDifference diff = explain(explainer,
                "int fib(int n) { if (n < 2) return n; return fib(n - 1) + fib(n - 2); }",
                "int fib(int n) { if (n <= 1) return n; return fib(n - 1) + fib(n - 2); }");

        assertEquals(DifferenceType.BASE_CASE_PREDICATE_FORM, diff.getType());
        assertEquals("LESS_EQUALS", diff.getHints().getString(BaseCaseExplainer.HINT_OPERATOR));
        assertEquals(1, diff.getHints().getInt(BaseCaseExplainer.HINT_BOUND, -99));
        assertEquals(0, diff.getHints().getInt(BaseCaseExplainer.HINT_GUARD_INDEX, -1));
    }

    @Test
    void testDifferentGuardsAreNotExplained() {
        assertNull(explain(explainer,
                "int fact(int n) { if (n <= 0) return 1; return n * fact(n - 1); }",
                "int fact(int n) { if (n <= 1) return 1; return n * fact(n - 1); }"));
    }
}
