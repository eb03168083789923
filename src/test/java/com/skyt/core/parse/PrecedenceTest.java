package com.skyt.core.parse;

import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.NameExpr;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PrecedenceTest {

    private final SourceParser parser = new SourceParser();

    @Test
    void testRankOrdering() {
        assertTrue(Precedence.rank(BinaryExpr.Operator.MULTIPLY) > Precedence.rank(BinaryExpr.Operator.PLUS));
        assertTrue(Precedence.rank(BinaryExpr.Operator.PLUS) > Precedence.rank(BinaryExpr.Operator.LESS));
        assertTrue(Precedence.rank(BinaryExpr.Operator.AND) > Precedence.rank(BinaryExpr.Operator.OR));
    }

    @Test
    void testLooserOperandIsParenthesized() {
        Expression outer = parser.parseExpression("x * 2");
        NameExpr slot = outer.findFirst(NameExpr.class).orElseThrow();

        Precedence.splice(slot, parser.parseExpression("a + b"));

        assertEquals("(a + b) * 2", outer.toString());
    }

    @Test
    void testTighterOperandIsLeftBare() {
        Expression outer = parser.parseExpression("x + 2");
        NameExpr slot = outer.findFirst(NameExpr.class).orElseThrow();

        Precedence.splice(slot, parser.parseExpression("a * b"));

        assertEquals("a * b + 2", outer.toString());
    }

    @Test
    void testEqualRankOnRightIsParenthesized() {
        Expression outer = parser.parseExpression("2 - x");
        NameExpr slot = outer.findFirst(NameExpr.class).orElseThrow();

        Precedence.splice(slot, parser.parseExpression("a - b"));

        assertEquals("2 - (a - b)", outer.toString());
    }
}
