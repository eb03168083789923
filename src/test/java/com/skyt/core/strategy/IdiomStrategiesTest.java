package com.skyt.core.strategy;

import com.skyt.core.explain.ControlFlowExplainer;
import com.skyt.core.explain.DifferenceType;
import com.skyt.core.explain.StructureIdiomExplainer;
import com.skyt.core.explain.TransformationHints;
import org.junit.jupiter.api.Test;

import static com.skyt.core.strategy.StrategyFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class IdiomStrategiesTest {

    private static final String COLLECT_LOOP =
            "List<Integer> evens(List<Integer> xs) {\n"
                    + "  List<Integer> out = new ArrayList<>();\n"
                    + "  for (Integer x : xs) { if (x % 2 == 0) out.add(x); }\n"
                    + "  return out;\n"
                    + "}";

    private final StreamCollectStrategy streams = new StreamCollectStrategy(PARSER);
    private final StringJoinStrategy joins = new StringJoinStrategy(PARSER);
    private final TernaryStrategy ternaries = new TernaryStrategy(PARSER);

    private TransformationHints streamHints(boolean useToList) {
        return TransformationHints.builder()
                .put(StructureIdiomExplainer.HINT_METHOD, "evens")
                .put(StructureIdiomExplainer.HINT_RESULT_VARIABLE, "out")
                .put(StructureIdiomExplainer.HINT_USE_TO_LIST, useToList)
                .build();
    }

    @Test
    void testCollectLoopToStream() {
        String out = streams.generate(difference(DifferenceType.LOOP_VS_STREAM, streamHints(false)), COLLECT_LOOP);

        assertSameCode("List<Integer> evens(List<Integer> xs) { "
                + "return xs.stream().filter(x -> x % 2 == 0).collect(Collectors.toList()); }", out);
    }

    @Test
    void testCollectorsImportAddedToCompilationUnit() {
        String out = streams.generate(difference(DifferenceType.LOOP_VS_STREAM, streamHints(false)),
                "import java.util.*;\n\nclass Evens {\n" + COLLECT_LOOP + "\n}");

        assertNotNull(out);
        assertTrue(out.contains("import java.util.stream.Collectors;"));
        assertTrue(out.contains(".collect(Collectors.toList())"));
    }

    @Test
    void testToListSkipsImport() {
        String out = streams.generate(difference(DifferenceType.LOOP_VS_STREAM, streamHints(true)),
                "import java.util.*;\n\nclass Evens {\n" + COLLECT_LOOP + "\n}");

        assertFalse(out.contains("Collectors"));
        assertTrue(out.contains("xs.stream().filter(x -> x % 2 == 0).toList()"));
    }

    @Test
    void testConcatenationToStringJoin() {
        TransformationHints hints = TransformationHints.builder()
                .put(StructureIdiomExplainer.HINT_ACCUMULATOR, "s")
                .put(StructureIdiomExplainer.HINT_PREFER_JOIN, true)
                .build();

        String out = joins.generate(difference(DifferenceType.STRING_BUILDING_IDIOM, hints),
                "String all(List<String> xs) { String s = \"\"; for (String x : xs) s += x; return s; }");

        assertSameCode("String all(List<String> xs) { return String.join(\"\", xs); }", out);
    }

    @Test
    void testBuilderLoopToJoiningCollector() {
        TransformationHints hints = TransformationHints.builder()
                .put(StructureIdiomExplainer.HINT_ACCUMULATOR, "sb")
                .build();

        String out = joins.generate(difference(DifferenceType.STRING_BUILDING_IDIOM, hints),
                "String digits(List<Integer> xs) { StringBuilder sb = new StringBuilder(); "
                        + "for (Integer x : xs) sb.append(x * 2); return sb.toString(); }");

        assertSameCode("String digits(List<Integer> xs) { "
                + "return xs.stream().map(x -> String.valueOf(x * 2)).collect(Collectors.joining()); }", out);
    }

    @Test
    void testIfElseToConditional() {
        TransformationHints hints = TransformationHints.builder()
                .put(ControlFlowExplainer.HINT_METHOD, "max")
                .put(ControlFlowExplainer.HINT_CONDITION, "a > b")
                .build();

        String out = ternaries.generate(difference(DifferenceType.IF_ELSE_VS_TERNARY, hints),
                "int max(int a, int b) { if (a > b) { return a; } else { return b; } }");

        assertSameCode("int max(int a, int b) { return a > b ? a : b; }", out);
    }

    @Test
    void testAssignmentBranchesToConditional() {
        String out = ternaries.generate(difference(DifferenceType.IF_ELSE_VS_TERNARY, TransformationHints.empty()),
                "int sign(int n) { int s; if (n < 0) s = -1; else s = 1; return s; }");

        assertSameCode("int sign(int n) { int s; s = n < 0 ? -1 : 1; return s; }", out);
    }

    @Test
    void testNoSiteNoRewrite() {
        assertNull(ternaries.generate(difference(DifferenceType.IF_ELSE_VS_TERNARY, TransformationHints.empty()),
                "int max(int a, int b) { return Math.max(a, b); }"));
    }
}
