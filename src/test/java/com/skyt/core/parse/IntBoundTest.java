package com.skyt.core.parse;

import com.github.javaparser.ast.expr.BinaryExpr;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class IntBoundTest {

    private final SourceParser parser = new SourceParser();

    @Test
    void testParseBothOrientations() {
        IntBound direct = IntBound.parse(parser.parseExpression("n <= 1"));
        IntBound mirrored = IntBound.parse(parser.parseExpression("1 >= n"));

        assertEquals("n", direct.getVariable());
        assertEquals(BinaryExpr.Operator.LESS_EQUALS, mirrored.getOperator());
        assertEquals(1, mirrored.getBound());
    }

    @Test
    void testStrictAndInclusiveBoundsAreEquivalent() {
        IntBound strict = IntBound.parse(parser.parseExpression("n < 2"));
        IntBound inclusive = IntBound.parse(parser.parseExpression("n <= 1"));
        IntBound other = IntBound.parse(parser.parseExpression("n <= 0"));

        assertTrue(strict.isEquivalentTo(inclusive));
        assertFalse(strict.isEquivalentTo(other));
        assertFalse(strict.isEquivalentTo(IntBound.parse(parser.parseExpression("n > 0"))));
    }

    @Test
    void testNonOrderingRejected() {
        assertNull(IntBound.parse(parser.parseExpression("n == 1")));
        assertNull(IntBound.parse(parser.parseExpression("a < b")));
        assertThrows(IllegalArgumentException.class, () -> IntBound.of("n", BinaryExpr.Operator.EQUALS, 1));
    }

    @Test
    void testNegativeBoundRendering() {
        assertEquals("n < -1", IntBound.of("n", BinaryExpr.Operator.LESS, -1).toExpression().toString());
    }

    @Test
    void testIntegralCheck() {
        ParsedSource parsed = parser.parse("int f(int n, double d) { return n; }");

        assertTrue(IntBound.of("n", BinaryExpr.Operator.LESS, 2).isIntegralIn(parsed.primaryMethod()));
        assertFalse(IntBound.of("d", BinaryExpr.Operator.LESS, 2).isIntegralIn(parsed.primaryMethod()));
    }
}
