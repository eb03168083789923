package com.skyt.core.parse;

import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.IntegerLiteralExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.UnaryExpr;
import com.github.javaparser.ast.type.Type;

import java.util.Set;

/**
 * A comparison of an integral variable against an int literal, such as
 * {@code n < 2} or {@code 1 >= n}. Over integers, {@code n < 2} and
 * {@code n <= 1} select the same values; two bounds are equivalent when they
 * agree after normalizing strict comparisons to inclusive ones.
 */
public final class IntBound {

    private static final Set<String> INTEGRAL = Set.of("int", "long", "short", "byte", "char");

    private final String              variable;
    private final BinaryExpr.Operator operator;
    private final int                 bound;

    private IntBound(String variable, BinaryExpr.Operator operator, int bound) {
        this.variable = variable;
        this.operator = operator;
        this.bound    = bound;
    }

    public String              getVariable() { return variable; }
    public BinaryExpr.Operator getOperator() { return operator; }
    public int                 getBound()    { return bound; }

    /** Parses {@code var op literal} or {@code literal op var}; null for anything else. */
    public static IntBound parse(Expression expr) {
        if (expr == null) return null;
        if (expr.isEnclosedExpr()) return parse(expr.asEnclosedExpr().getInner());
        if (!expr.isBinaryExpr()) return null;
        BinaryExpr bin = expr.asBinaryExpr();
        BinaryExpr.Operator op = bin.getOperator();
        if (!isOrdering(op)) return null;

        Integer right = AstQueries.intLiteral(bin.getRight());
        if (bin.getLeft().isNameExpr() && right != null) {
            return new IntBound(bin.getLeft().asNameExpr().getNameAsString(), op, right);
        }
        Integer left = AstQueries.intLiteral(bin.getLeft());
        if (bin.getRight().isNameExpr() && left != null) {
            return new IntBound(bin.getRight().asNameExpr().getNameAsString(), mirror(op), left);
        }
        return null;
    }

    public static IntBound of(String variable, BinaryExpr.Operator operator, int bound) {
        if (!isOrdering(operator)) throw new IllegalArgumentException("Not an ordering operator: " + operator);
        return new IntBound(variable, operator, bound);
    }

    /** True when the variable is a parameter or local of {@code method} with an integral primitive type. */
    public boolean isIntegralIn(MethodDeclaration method) {
        Type type = AssignmentChain.declaredType(method, variable);
        return type != null && type.isPrimitiveType() && INTEGRAL.contains(type.asString());
    }

    /** Same variable and the same set of integers selected. */
    public boolean isEquivalentTo(IntBound other) {
        if (other == null || !variable.equals(other.variable)) return false;
        if (isUpper() != other.isUpper()) return false;
        return inclusiveBound() == other.inclusiveBound();
    }

    public Expression toExpression() {
        Expression literal = bound < 0
                ? new UnaryExpr(new IntegerLiteralExpr(String.valueOf(-(long) bound)), UnaryExpr.Operator.MINUS)
                : new IntegerLiteralExpr(String.valueOf(bound));
        return new BinaryExpr(new NameExpr(variable), literal, operator);
    }

    @Override
    public String toString() {
        return variable + " " + operator.asString() + " " + bound;
    }

    // =========================================================================
    // Private helpers
    // =========================================================================

    private boolean isUpper() {
        return operator == BinaryExpr.Operator.LESS || operator == BinaryExpr.Operator.LESS_EQUALS;
    }

    /** {@code n < k} as {@code n <= k - 1}; {@code n > k} as {@code n >= k + 1}. */
    private long inclusiveBound() {
        if (operator == BinaryExpr.Operator.LESS)    return (long) bound - 1;
        if (operator == BinaryExpr.Operator.GREATER) return (long) bound + 1;
        return bound;
    }

    private static boolean isOrdering(BinaryExpr.Operator op) {
        return op == BinaryExpr.Operator.LESS || op == BinaryExpr.Operator.LESS_EQUALS
                || op == BinaryExpr.Operator.GREATER || op == BinaryExpr.Operator.GREATER_EQUALS;
    }

    private static BinaryExpr.Operator mirror(BinaryExpr.Operator op) {
        return switch (op) {
            case LESS -> BinaryExpr.Operator.GREATER;
            case LESS_EQUALS -> BinaryExpr.Operator.GREATER_EQUALS;
            case GREATER -> BinaryExpr.Operator.LESS;
            case GREATER_EQUALS -> BinaryExpr.Operator.LESS_EQUALS;
            default -> op;
        };
    }
}
