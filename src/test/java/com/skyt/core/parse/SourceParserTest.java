package com.skyt.core.parse;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SourceParserTest {

    private final SourceParser parser = new SourceParser();

    @Test
    void testBareMethodsAreWrapped() {
        ParsedSource parsed = parser.parse("int f(int n) { return n * 2; }\n\nint g() { return 1; }");

        assertNotNull(parsed);
        assertTrue(parsed.isWrapped());
        assertEquals(2, parsed.getMethods().size());
        assertEquals(2, parsed.topLevelDefinitionCount());
        assertNotNull(parsed.findMethod("g"));
    }

    @Test
    void testWrappedPrintKeepsFragmentShape() {
        ParsedSource parsed = parser.parse("int f(int n) { return n * 2; }");

        String printed = parsed.print();

        assertFalse(printed.contains(SourceParser.HOLDER_CLASS));
        assertTrue(printed.startsWith("int f(int n)"));
        assertEquals(printed, parser.parse(printed).print());
    }

    @Test
    void testCompilationUnitIsNotWrapped() {
        ParsedSource parsed = parser.parse("public class Calc { int twice(int n) { return n * 2; } }");

        assertNotNull(parsed);
        assertFalse(parsed.isWrapped());
        assertEquals(1, parsed.topLevelDefinitionCount());
        assertEquals("Calc", parsed.binaryTypeName());
        assertTrue(parsed.print().contains("class Calc"));
    }

    @Test
    void testCompilableSourceForWrappedFragment() {
        ParsedSource parsed = parser.parse("int f(int n) { return n; }");

        String source = parsed.compilableSource();

        assertTrue(source.contains("class " + SourceParser.HOLDER_CLASS));
        assertTrue(source.contains("import java.util.*;"));
    }

    @Test
    void testGarbageDoesNotParse() {
        assertNull(parser.parse("int f(int n) { return n * ; }"));
        assertNull(parser.parse("def f(n): return n"));
        assertNull(parser.parse(null));
        assertFalse(parser.isParseable("}{"));
    }

    @Test
    void testBlankSourceIsNotParsed() {
        assertNull(parser.parse(""));
        assertNull(parser.parse("   \n"));
    }
}
