package com.skyt.core.explain;

import org.junit.jupiter.api.Test;

import java.util.List;

import static com.skyt.core.explain.ExplainerFixtures.explain;
import static org.junit.jupiter.api.Assertions.*;

class LogicalEquivalenceExplainerTest {

    private final LogicalEquivalenceExplainer explainer = new LogicalEquivalenceExplainer();

    @Test
    void testSizeCompareTowardsIsEmpty() {
        PropertyDifference diff = explain(explainer,
                "boolean f(String x) { return x.length() == 0; }",
                "boolean f(String x) { return x.isEmpty(); }");

        assertEquals(DifferenceType.EMPTY_CHECK_FORM, diff.getType());
        assertEquals(LogicalEquivalenceExplainer.FORM_IS_EMPTY,
                diff.getHints().getString(LogicalEquivalenceExplainer.HINT_TARGET_FORM));
        assertEquals(List.of("x"), diff.getHints().getStringList(LogicalEquivalenceExplainer.HINT_SCOPES));
    }

    @Test
    void testIsEmptyTowardsSizeCompare() {
        PropertyDifference diff = explain(explainer,
                "boolean f(List<Integer> xs) { return !xs.isEmpty(); }",
                "boolean f(List<Integer> xs) { return xs.size() != 0; }");

        assertEquals(LogicalEquivalenceExplainer.FORM_SIZE_COMPARE,
                diff.getHints().getString(LogicalEquivalenceExplainer.HINT_TARGET_FORM));
        assertEquals("size", diff.getHints().getString(LogicalEquivalenceExplainer.HINT_SIZE_METHOD));
    }

    @Test
    void testBooleanRedundancy() {
        PropertyDifference diff = explain(explainer,
                "boolean f(boolean done) { return done == true; }",
                "boolean f(boolean done) { return done; }");

        assertEquals(DifferenceType.BOOLEAN_REDUNDANCY, diff.getType());
        assertEquals(1, diff.getHints().getInt(LogicalEquivalenceExplainer.HINT_COUNT, 0));
    }

    @Test
    void testSameFormsAreNotExplained() {
        assertNull(explain(explainer,
                "boolean f(String s) { return s.isEmpty(); }",
                "boolean f(String t) { return t.isEmpty(); }"));
    }
}
