package com.skyt.core.explain;

import org.junit.jupiter.api.Test;

import static com.skyt.core.explain.ExplainerFixtures.explain;
import static org.junit.jupiter.api.Assertions.*;

class StatementOrderingExplainerTest {

    private final StatementOrderingExplainer explainer = new StatementOrderingExplainer();

    @Test
    void testSingleTemporary() {
        PropertyDifference diff = explain(explainer,
                "int f(int n) { int r = n * 2; return r; }",
                "int f(int n) { return n * 2; }");

        assertNotNull(diff);
        assertEquals(DifferenceType.CONSECUTIVE_STATEMENTS_CONSOLIDATABLE, diff.getType());
        assertEquals("f", diff.getHints().getString(StatementOrderingExplainer.HINT_METHOD));
        assertEquals("r", diff.getHints().getString(StatementOrderingExplainer.HINT_VARIABLE));
        assertEquals(1, diff.getHints().getInt(StatementOrderingExplainer.HINT_CHAIN_LENGTH, 0));
        assertEquals(DifferenceType.CONSECUTIVE_STATEMENTS_CONSOLIDATABLE.getSeverity(), diff.getSeverity());
    }

    @Test
    void testChainedAssignments() {
        PropertyDifference diff = explain(explainer,
                "int f(int a, int b) { int r = a + b; r = r * 2; return r; }",
                "int f(int a, int b) { return (a + b) * 2; }");

        assertEquals(DifferenceType.CHAINED_STATEMENTS_CONSOLIDATABLE, diff.getType());
        assertEquals(2, diff.getHints().getInt(StatementOrderingExplainer.HINT_CHAIN_LENGTH, 0));
    }

    @Test
    void testCanonWithTemporaryIsNotExplained() {
        assertNull(explain(explainer,
                "int f(int n) { int r = n * 2; return r; }",
                "int f(int n) { int x = n * 2; return x; }"));
    }
}
