package com.skyt.core.parse;

import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.BooleanLiteralExpr;
import com.github.javaparser.ast.expr.EnclosedExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.IntegerLiteralExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.UnaryExpr;

/**
 * Recognizers for equivalent boolean spellings: emptiness checks written as a
 * size comparison or as {@code isEmpty()}, and comparisons against boolean
 * literals.
 */
public final class LogicalForms {

    private LogicalForms() {}

    // =========================================================================
    // Emptiness
    // =========================================================================

    /** A size comparison against zero, normalized to "is empty" or "is not empty". */
    public static final class SizeComparison {
        private final Expression scope;
        private final String     sizeMethod;
        private final boolean    emptyCheck;

        SizeComparison(Expression scope, String sizeMethod, boolean emptyCheck) {
            this.scope      = scope;
            this.sizeMethod = sizeMethod;
            this.emptyCheck = emptyCheck;
        }

        public Expression getScope()      { return scope; }
        public String     getSizeMethod() { return sizeMethod; }
        /** True for {@code == 0}; false for {@code != 0} and {@code > 0}. */
        public boolean    isEmptyCheck()  { return emptyCheck; }
    }

    /**
     * Matches {@code s.length() == 0}, {@code s.size() != 0}, {@code s.size() > 0}
     * and their mirrored forms. Returns null for anything else.
     */
    public static SizeComparison sizeComparison(BinaryExpr bin) {
        Expression left  = bin.getLeft();
        Expression right = bin.getRight();
        BinaryExpr.Operator op = bin.getOperator();

        if (isSizeCall(left) && isZero(right)) {
            if (op == BinaryExpr.Operator.EQUALS)     return of(left, true);
            if (op == BinaryExpr.Operator.NOT_EQUALS) return of(left, false);
            if (op == BinaryExpr.Operator.GREATER)    return of(left, false);
        }
        if (isZero(left) && isSizeCall(right)) {
            if (op == BinaryExpr.Operator.EQUALS)     return of(right, true);
            if (op == BinaryExpr.Operator.NOT_EQUALS) return of(right, false);
            if (op == BinaryExpr.Operator.LESS)       return of(right, false);
        }
        return null;
    }

    public static Expression sizeComparisonScope(BinaryExpr bin) {
        SizeComparison comparison = sizeComparison(bin);
        return comparison == null ? null : comparison.getScope();
    }

    /** {@code x.isEmpty()} with a receiver and no arguments. */
    public static boolean isEmptinessCall(MethodCallExpr call) {
        return call.getNameAsString().equals("isEmpty")
                && call.getArguments().isEmpty()
                && call.getScope().isPresent();
    }

    /** Builds {@code scope.isEmpty()} or {@code !scope.isEmpty()}. */
    public static Expression isEmptyForm(Expression scope, boolean emptyCheck) {
        MethodCallExpr call = new MethodCallExpr(scope.clone(), "isEmpty");
        return emptyCheck ? call : new UnaryExpr(call, UnaryExpr.Operator.LOGICAL_COMPLEMENT);
    }

    /** Builds {@code scope.method() == 0} or {@code scope.method() != 0}. */
    public static Expression sizeCompareForm(Expression scope, String sizeMethod, boolean emptyCheck) {
        MethodCallExpr call = new MethodCallExpr(scope.clone(), sizeMethod);
        return new BinaryExpr(call, new IntegerLiteralExpr("0"),
                emptyCheck ? BinaryExpr.Operator.EQUALS : BinaryExpr.Operator.NOT_EQUALS);
    }

    private static SizeComparison of(Expression call, boolean emptyCheck) {
        MethodCallExpr sizeCall = call.asMethodCallExpr();
        return new SizeComparison(sizeCall.getScope().get(), sizeCall.getNameAsString(), emptyCheck);
    }

    private static boolean isSizeCall(Expression expr) {
        if (!expr.isMethodCallExpr()) return false;
        MethodCallExpr call = expr.asMethodCallExpr();
        String name = call.getNameAsString();
        return (name.equals("size") || name.equals("length"))
                && call.getArguments().isEmpty()
                && call.getScope().isPresent();
    }

    private static boolean isZero(Expression expr) {
        Integer value = AstQueries.intLiteral(expr);
        return value != null && value == 0;
    }

    // =========================================================================
    // Boolean literal comparisons
    // =========================================================================

    /** {@code b == true}, {@code false != b} and similar. */
    public static boolean isBooleanLiteralComparison(BinaryExpr bin) {
        BinaryExpr.Operator op = bin.getOperator();
        if (op != BinaryExpr.Operator.EQUALS && op != BinaryExpr.Operator.NOT_EQUALS) return false;
        return bin.getLeft().isBooleanLiteralExpr() != bin.getRight().isBooleanLiteralExpr();
    }

    /**
     * Equivalent expression without the literal: {@code b == true} → {@code b},
     * {@code b == false} → {@code !b}. Null when not a literal comparison.
     */
    public static Expression simplifyBooleanComparison(BinaryExpr bin) {
        if (!isBooleanLiteralComparison(bin)) return null;
        boolean literalOnLeft = bin.getLeft().isBooleanLiteralExpr();
        BooleanLiteralExpr literal = (literalOnLeft ? bin.getLeft() : bin.getRight()).asBooleanLiteralExpr();
        Expression operand = (literalOnLeft ? bin.getRight() : bin.getLeft()).clone();

        boolean keepsOperand = literal.getValue() == (bin.getOperator() == BinaryExpr.Operator.EQUALS);
        if (keepsOperand) {
            return operand;
        }
        Expression negand = needsParentheses(operand) ? new EnclosedExpr(operand) : operand;
        return new UnaryExpr(negand, UnaryExpr.Operator.LOGICAL_COMPLEMENT);
    }

    private static boolean needsParentheses(Expression expr) {
        return expr.isBinaryExpr() || expr.isConditionalExpr() || expr.isAssignExpr()
                || expr.isInstanceOfExpr() || expr.isLambdaExpr() || expr.isCastExpr();
    }
}
