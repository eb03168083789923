package com.skyt.core.parse;

import com.github.javaparser.ast.expr.BinaryExpr;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LogicalFormsTest {

    private final SourceParser parser = new SourceParser();

    private BinaryExpr binary(String text) {
        return parser.parseExpression(text).asBinaryExpr();
    }

    @Test
    void testSizeComparisons() {
        LogicalForms.SizeComparison eq = LogicalForms.sizeComparison(binary("s.length() == 0"));
        LogicalForms.SizeComparison gt = LogicalForms.sizeComparison(binary("xs.size() > 0"));
        LogicalForms.SizeComparison mirrored = LogicalForms.sizeComparison(binary("0 != xs.size()"));

        assertTrue(eq.isEmptyCheck());
        assertEquals("length", eq.getSizeMethod());
        assertFalse(gt.isEmptyCheck());
        assertEquals("xs", mirrored.getScope().toString());
        assertNull(LogicalForms.sizeComparison(binary("xs.size() == 1")));
    }

    @Test
    void testFormBuilders() {
        assertEquals("s.isEmpty()", LogicalForms.isEmptyForm(parser.parseExpression("s"), true).toString());
        assertEquals("!s.isEmpty()", LogicalForms.isEmptyForm(parser.parseExpression("s"), false).toString());
        assertEquals("s.size() != 0",
                LogicalForms.sizeCompareForm(parser.parseExpression("s"), "size", false).toString());
    }

    @Test
    void testBooleanLiteralSimplification() {
        assertEquals("done", LogicalForms.simplifyBooleanComparison(binary("done == true")).toString());
        assertEquals("!done", LogicalForms.simplifyBooleanComparison(binary("false == done")).toString());
        assertEquals("!(a && b)", LogicalForms.simplifyBooleanComparison(binary("(a && b) != true")).toString());
        assertNull(LogicalForms.simplifyBooleanComparison(binary("a == b")));
    }
}
