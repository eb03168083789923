package com.skyt.core.strategy;

import com.skyt.core.explain.DifferenceType;
import com.skyt.core.explain.StatementOrderingExplainer;
import com.skyt.core.explain.TransformationHints;
import com.skyt.core.property.PropertyKind;
import org.junit.jupiter.api.Test;

import static com.skyt.core.strategy.StrategyFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class StatementConsolidationStrategyTest {

    private final StatementConsolidationStrategy strategy = new StatementConsolidationStrategy(PARSER);

    private TransformationHints hints(String method, String variable) {
        return TransformationHints.builder()
                .put(StatementOrderingExplainer.HINT_METHOD, method)
                .put(StatementOrderingExplainer.HINT_VARIABLE, variable)
                .build();
    }

    @Test
    void testMetadata() {
        assertEquals("statement-consolidation", strategy.getName());
        assertEquals(PropertyKind.STATEMENT_ORDERING, strategy.getPropertyKind());
        assertTrue(strategy.canHandle(DifferenceType.CHAINED_STATEMENTS_CONSOLIDATABLE));
        assertFalse(strategy.canHandle(DifferenceType.EMPTY_CHECK_FORM));
    }

    @Test
    void testFoldsSingleTemporary() {
        String out = strategy.generate(
                difference(DifferenceType.CONSECUTIVE_STATEMENTS_CONSOLIDATABLE, hints("f", "r")),
                "int f(int n) { int r = n * 2; return r; }");

        assertSameCode("int f(int n) { return n * 2; }", out);
    }

    @Test
    void testFoldsChainWithPrecedence() {
        String out = strategy.generate(
                difference(DifferenceType.CHAINED_STATEMENTS_CONSOLIDATABLE, hints("f", "r")),
                "int f(int a, int b) { int r = a + b; r = r * 2; return r; }");

        assertSameCode("int f(int a, int b) { return (a + b) * 2; }", out);
    }

    @Test
    void testTargetsHintedMethodOnly() {
        String out = strategy.generate(
                difference(DifferenceType.CONSECUTIVE_STATEMENTS_CONSOLIDATABLE, hints("g", "y")),
                "int f(int n) { int r = n; return r; }\n\nint g(int n) { int y = n + 1; return y; }");

        assertSameCode("int f(int n) { int r = n; return r; }\n\nint g(int n) { return n + 1; }", out);
    }

    @Test
    void testStaleHintYieldsNothing() {
        assertNull(strategy.generate(
                difference(DifferenceType.CONSECUTIVE_STATEMENTS_CONSOLIDATABLE, hints("f", "other")),
                "int f(int n) { int r = n * 2; return r; }"));
        assertNull(strategy.generate(
                difference(DifferenceType.CONSECUTIVE_STATEMENTS_CONSOLIDATABLE, hints("f", "r")),
                "int f(int n) { return n * 2; }"));
    }

    @Test
    void testWrongTypeOrUnparsableYieldsNothing() {
        assertNull(strategy.generate(difference(DifferenceType.EMPTY_CHECK_FORM, hints("f", "r")),
                "int f(int n) { int r = n * 2; return r; }"));
        assertNull(strategy.generate(
                difference(DifferenceType.CONSECUTIVE_STATEMENTS_CONSOLIDATABLE, hints("f", "r")), "int f( {"));
    }
}
