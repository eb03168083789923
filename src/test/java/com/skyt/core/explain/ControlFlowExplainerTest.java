package com.skyt.core.explain;

import com.skyt.core.parse.TernaryForms;
import org.junit.jupiter.api.Test;

import static com.skyt.core.explain.ExplainerFixtures.explain;
import static org.junit.jupiter.api.Assertions.*;

class ControlFlowExplainerTest {

    private final ControlFlowExplainer explainer = new ControlFlowExplainer();

    @Test
    void testIfElseAgainstConditional() {
        PropertyDifference diff = explain(explainer,
                "int max(int a, int b) { if (a > b) { return a; } else { return b; } }",
                "int max(int a, int b) { return a > b ? a : b; }");

        assertEquals(DifferenceType.IF_ELSE_VS_TERNARY, diff.getType());
        assertEquals("max", diff.getHints().getString(ControlFlowExplainer.HINT_METHOD));
        assertEquals(TernaryForms.Form.RETURN_ELSE.name(), diff.getHints().getString(ControlFlowExplainer.HINT_FORM));
        assertEquals("a > b", diff.getHints().getString(ControlFlowExplainer.HINT_CONDITION));
    }

    @Test
    void testCanonWithoutConditionalIsNotExplained() {
        assertNull(explain(explainer,
                "int max(int a, int b) { if (a > b) return a; return b; }",
                "int max(int a, int b) { return Math.max(a, b); }"));
    }
}
