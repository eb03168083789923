package com.skyt.core.parse;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LoopIdiomsTest {

    private final SourceParser parser = new SourceParser();

    @Test
    void testFilteredCollectLoop() {
        ParsedSource parsed = parser.parse(
                "List<Integer> evens(List<Integer> xs) {\n"
                        + "  List<Integer> out = new ArrayList<>();\n"
                        + "  for (Integer x : xs) { if (x % 2 == 0) out.add(x); }\n"
                        + "  return out;\n"
                        + "}");

        LoopIdioms.CollectLoop loop = LoopIdioms.findCollectLoop(parsed.primaryMethod());

        assertNotNull(loop);
        assertEquals("out", loop.getResultVariable());
        assertEquals("xs.stream().filter(x -> x % 2 == 0).collect(Collectors.toList())",
                loop.streamExpression(false).toString());
        assertEquals("xs.stream().filter(x -> x % 2 == 0).toList()", loop.streamExpression(true).toString());
    }

    @Test
    void testArraySourceIsNotACollectLoop() {
        ParsedSource parsed = parser.parse(
                "List<Integer> copy(int[] xs) { List<Integer> out = new ArrayList<>(); "
                        + "for (int x : xs) out.add(x); return out; }");

        assertNull(LoopIdioms.findCollectLoop(parsed.primaryMethod()));
    }

    @Test
    void testConcatLoopsInBothSpellings() {
        ParsedSource compound = parser.parse(
                "String all(List<String> xs) { String s = \"\"; for (String x : xs) s += x; return s; }");
        ParsedSource plain = parser.parse(
                "String all(List<String> xs) { String s = \"\"; for (String x : xs) s = s + x; return s; }");

        LoopIdioms.JoinLoop first = LoopIdioms.findJoinLoop(compound.primaryMethod());
        LoopIdioms.JoinLoop second = LoopIdioms.findJoinLoop(plain.primaryMethod());

        assertNotNull(first);
        assertNotNull(second);
        assertTrue(first.joinsElementsDirectly());
        assertEquals("String.join(\"\", xs)", first.joinExpression(true).toString());
    }

    @Test
    void testBuilderLoopOverIntArray() {
        ParsedSource parsed = parser.parse(
                "String digits(int[] xs) { StringBuilder sb = new StringBuilder(); "
                        + "for (int x : xs) sb.append(x); return sb.toString(); }");

        LoopIdioms.JoinLoop loop = LoopIdioms.findJoinLoop(parsed.primaryMethod());

        assertNotNull(loop);
        assertTrue(loop.usesArrays());
        assertFalse(loop.joinsElementsDirectly());
        assertEquals("Arrays.stream(xs).mapToObj(x -> String.valueOf(x)).collect(Collectors.joining())",
                loop.joinExpression(true).toString());
    }
}
