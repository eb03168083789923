package com.skyt.core.explain;

import org.junit.jupiter.api.Test;

import static com.skyt.core.explain.ExplainerFixtures.explain;
import static org.junit.jupiter.api.Assertions.*;

class StructureIdiomExplainerTest {

    private final StructureIdiomExplainer explainer = new StructureIdiomExplainer();

    @Test
    void testLoopVersusStream() {
        PropertyDifference diff = explain(explainer,
                "List<Integer> evens(List<Integer> xs) { List<Integer> out = new ArrayList<>(); "
                        + "for (Integer x : xs) { if (x % 2 == 0) out.add(x); } return out; }",
                "List<Integer> evens(List<Integer> xs) { return xs.stream().filter(x -> x % 2 == 0).toList(); }");

        assertEquals(DifferenceType.LOOP_VS_STREAM, diff.getType());
        assertEquals("out", diff.getHints().getString(StructureIdiomExplainer.HINT_RESULT_VARIABLE));
        assertTrue(diff.getHints().getBoolean(StructureIdiomExplainer.HINT_USE_TO_LIST));
    }

    @Test
    void testConcatenationVersusJoin() {
        PropertyDifference diff = explain(explainer,
                "String all(List<String> xs) { String s = \"\"; for (String x : xs) s += x; return s; }",
                "String all(List<String> xs) { return String.join(\"\", xs); }");

        assertEquals(DifferenceType.STRING_BUILDING_IDIOM, diff.getType());
        assertEquals("s", diff.getHints().getString(StructureIdiomExplainer.HINT_ACCUMULATOR));
        assertTrue(diff.getHints().getBoolean(StructureIdiomExplainer.HINT_PREFER_JOIN));
    }

    @Test
    void testBothLoopingIsNotExplained() {
        String loop = "List<Integer> copy(List<Integer> xs) { List<Integer> out = new ArrayList<>(); "
                + "for (Integer x : xs) out.add(x); return out; }";

        assertNull(explain(explainer, loop, loop.replace("out", "res")));
    }
}
