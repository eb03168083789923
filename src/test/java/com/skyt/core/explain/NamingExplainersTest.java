package com.skyt.core.explain;

import com.skyt.core.naming.NamingPolicy;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.skyt.core.explain.ExplainerFixtures.explain;
import static org.junit.jupiter.api.Assertions.*;

class NamingExplainersTest {

    private static final String CANDIDATE = "int f(int[] items) { return items.length; }";
    private static final String CANON     = "int f(int[] arr) { return arr.length; }";

    private final ParameterNamingExplainer parameters = new ParameterNamingExplainer();
    private final LocalNamingExplainer locals = new LocalNamingExplainer();

    @Test
    void testParameterRenameProposed() {
        PropertyDifference diff = explain(parameters, CANDIDATE, CANON);

        assertEquals(DifferenceType.PARAMETER_NAMING_DIFFERENCE, diff.getType());
        assertEquals(Map.of("items", "arr"), diff.getHints().getStringMap(ParameterNamingExplainer.HINT_RENAMES));
    }

    @Test
    void testStrictPolicyProposesNothing() {
        assertNull(explain(parameters, CANDIDATE, CANON, NamingPolicy.strictPolicy()));
    }

    @Test
    void testFixedNameKept() {
        assertNull(explain(parameters, CANDIDATE, CANON, NamingPolicy.of(List.of("items"), List.of(), false)));
    }

    @Test
    void testCollidingRenameDropped() {
        assertNull(explain(parameters,
                "int f(int a, int b) { return a - b; }",
                "int f(int b, int a) { return b - a; }"));
    }

    @Test
    void testLocalRenameBySharedPositionAndType() {
        PropertyDifference diff = explain(locals,
                "int f(int n) { int total = 0; for (int i = 0; i < n; i++) total += i; return total; }",
                "int f(int n) { int sum = 0; for (int i = 0; i < n; i++) sum += i; return sum; }");

        assertEquals(DifferenceType.LOCAL_NAMING_DIFFERENCE, diff.getType());
        assertEquals(Map.of("total", "sum"), diff.getHints().getStringMap(LocalNamingExplainer.HINT_RENAMES));
    }
}
