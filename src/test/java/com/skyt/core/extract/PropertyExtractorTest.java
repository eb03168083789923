package com.skyt.core.extract;

import com.skyt.config.AnalysisMode;
import com.skyt.config.AnalysisModeResolver;
import com.skyt.core.parse.SourceParser;
import com.skyt.core.property.PropertyKind;
import com.skyt.core.property.PropertySet;
import com.skyt.core.property.RecordValue;
import com.skyt.core.property.RecursionSchema;
import com.skyt.core.property.StructureHashPair;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PropertyExtractorTest {

    private static final String FIB =
            "int fib(int n) {\n"
                    + "    if (n < 2) return n;\n"
                    + "    return fib(n - 1) + fib(n - 2);\n"
                    + "}";

    private final SourceParser parser = new SourceParser();
    private final PropertyExtractor extractor =
            new PropertyExtractor(parser, new AnalysisModeResolver("baseline"));

    @Test
    void testEveryKindIsPresent() {
        PropertySet props = extractor.extract(FIB);

        assertFalse(props.isNullFilled());
        for (PropertyKind kind : PropertyKind.values()) {
            assertTrue(props.has(kind), "missing " + kind.getKey());
            assertEquals(kind.getShape(), props.get(kind).getShape());
        }
    }

    @Test
    void testExtractionIsDeterministic() {
        assertEquals(extractor.extract(FIB), extractor.extract(FIB));
    }

    @Test
    void testWhitespaceAndCommentsDoNotMatter() {
        String reformatted = "int fib(int n){  // classic\n if(n<2) return n;\n\n\n return fib(n-1)+fib(n-2); }";

        assertEquals(extractor.extract(FIB), extractor.extract(reformatted));
    }

    @Test
    void testUnparsableSourceIsNullFilled() {
        assertTrue(extractor.extract("int fib(int n) { return ; ; }}").isNullFilled());
        assertTrue(extractor.extract((String) null).isNullFilled());
    }

    @Test
    void testRecursionSchema() {
        RecursionSchema schema = (RecursionSchema) extractor.extract(FIB).get(PropertyKind.RECURSION_SCHEMA);

        assertTrue(schema.isRecursive());
        assertEquals(RecursionSchema.Branching.BINARY, schema.getBranching());
        assertEquals(1, schema.getBaseCaseCount());
    }

    @Test
    void testRenamingKeepsNameInvariantHash() {
        StructureHashPair a = (StructureHashPair) extractor.extract("int f(int x) { int y = x + 1; return y; }")
                .get(PropertyKind.NORMALIZED_STRUCTURE);
        StructureHashPair b = (StructureHashPair) extractor.extract("int f(int a) { int b = a + 1; return b; }")
                .get(PropertyKind.NORMALIZED_STRUCTURE);

        assertNotEquals(a.getLiteralHash(), b.getLiteralHash());
        assertEquals(a.getNameInvariantHash(), b.getNameInvariantHash());
    }

    @Test
    void testEmptinessForm() {
        RecordValue sizeForm = extractor.extract("boolean f(String s) { return s.length() == 0; }")
                .getRecord(PropertyKind.LOGICAL_EQUIVALENCE);
        RecordValue callForm = extractor.extract("boolean f(String s) { return s.isEmpty(); }")
                .getRecord(PropertyKind.LOGICAL_EQUIVALENCE);

        assertEquals("size-compare", sizeForm.getString("emptinessForm"));
        assertEquals("is-empty", callForm.getString("emptinessForm"));
    }

    @Test
    void testStringLiteralsInSourceOrder() {
        PropertySet props = extractor.extract("String f(String s) { return s.replaceAll(\"\\\\s+\", \"-\"); }");

        assertEquals(List.of("\\\\s+", "-"), props.getSequence(PropertyKind.STRING_LITERALS).getItems());
    }

    @Test
    void testParameterNamesInContract() {
        RecordValue contract = extractor.extract("int f(int[] items) { return items.length; }")
                .getRecord(PropertyKind.FUNCTION_CONTRACTS);

        assertEquals("f", contract.getString("names"));
        assertTrue(contract.getString("paramNames").contains("items"));
    }

    @Test
    void testEnhancedModeAddsDetail() {
        PropertyExtractor enhanced = new PropertyExtractor(parser, new AnalysisModeResolver("enhanced"));

        PropertySet props = enhanced.extract(FIB);

        assertEquals(AnalysisMode.ENHANCED, enhanced.getMode());
        assertTrue(props.getRecord(PropertyKind.COMPLEXITY_CLASS).keys().contains("cyclomatic"));
        assertFalse(extractor.extract(FIB).getRecord(PropertyKind.COMPLEXITY_CLASS).keys().contains("cyclomatic"));
    }

    @Test
    void testExecutionPathsThroughTryAndCatch() {
        String source = "int parse(String s) { try { return Integer.parseInt(s); } "
                + "catch (NumberFormatException e) { return -1; } }";

        List<String> paths = extractor.extract(source).getSequence(PropertyKind.EXECUTION_PATHS).getItems();

        assertTrue(paths.contains("try>return"));
        assertTrue(paths.contains("try>catch>return"));
    }

    @Test
    void testCatchClauseCountsAsDecisionInEnhancedMode() {
        PropertyExtractor enhanced = new PropertyExtractor(parser, new AnalysisModeResolver("enhanced"));
        String source = "int parse(String s) { try { return Integer.parseInt(s); } "
                + "catch (NumberFormatException e) { return -1; } }";

        RecordValue complexity = enhanced.extract(source).getRecord(PropertyKind.COMPLEXITY_CLASS);

        assertEquals(2L, complexity.getLong("cyclomatic"));
    }
}
