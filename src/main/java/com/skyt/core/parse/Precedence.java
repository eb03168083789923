package com.skyt.core.parse;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.EnclosedExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.ReturnStmt;

/**
 * Operator precedence for splicing one expression into another. Parentheses
 * are added only where the grammar would otherwise re-associate the operand.
 */
public final class Precedence {

    private Precedence() {}

    /** Binding strength of a binary operator; higher binds tighter. */
    public static int rank(BinaryExpr.Operator op) {
        return switch (op) {
            case OR -> 1;
            case AND -> 2;
            case BINARY_OR -> 3;
            case XOR -> 4;
            case BINARY_AND -> 5;
            case EQUALS, NOT_EQUALS -> 6;
            case LESS, GREATER, LESS_EQUALS, GREATER_EQUALS -> 7;
            case LEFT_SHIFT, SIGNED_RIGHT_SHIFT, UNSIGNED_RIGHT_SHIFT -> 8;
            case PLUS, MINUS -> 9;
            case MULTIPLY, DIVIDE, REMAINDER -> 10;
        };
    }

    /**
     * Replaces {@code slot} (already attached to the tree) with
     * {@code replacement}, parenthesized if its new position needs it.
     */
    public static void splice(Expression slot, Expression replacement) {
        Node parent = slot.getParentNode().orElse(null);
        slot.replace(parenthesizeFor(replacement, parent, slot));
    }

    /** {@code operand}, or {@code (operand)} when it would bind wrongly in {@code slot} of {@code parent}. */
    public static Expression parenthesizeFor(Expression operand, Node parent, Node slot) {
        if (isPrimary(operand) || parent == null) {
            return operand;
        }
        if (parent instanceof ReturnStmt || parent instanceof ExpressionStmt
                || parent instanceof VariableDeclarator || parent instanceof EnclosedExpr) {
            return operand;
        }
        if (parent instanceof MethodCallExpr && isArgument((MethodCallExpr) parent, slot)) {
            return operand;
        }
        if (parent instanceof ObjectCreationExpr) {
            return operand;
        }
        if (parent instanceof BinaryExpr) {
            BinaryExpr outer = (BinaryExpr) parent;
            if (operand.isUnaryExpr() || operand.isCastExpr()) {
                return operand;
            }
            if (operand.isBinaryExpr()) {
                int inner = rank(operand.asBinaryExpr().getOperator());
                int around = rank(outer.getOperator());
                boolean right = outer.getRight() == slot;
                if (inner > around || (inner == around && !right)) {
                    return operand;
                }
            }
            if (operand.isInstanceOfExpr()) {
                int around = rank(outer.getOperator());
                if (around < 7 || (around == 7 && outer.getLeft() == slot)) {
                    return operand;
                }
            }
        }
        return new EnclosedExpr(operand);
    }

    private static boolean isPrimary(Expression expr) {
        return expr.isNameExpr() || expr.isLiteralExpr() || expr.isMethodCallExpr()
                || expr.isFieldAccessExpr() || expr.isArrayAccessExpr() || expr.isEnclosedExpr()
                || expr.isObjectCreationExpr() || expr.isThisExpr() || expr.isClassExpr()
                || expr.isArrayCreationExpr() || expr.isMethodReferenceExpr();
    }

    private static boolean isArgument(MethodCallExpr call, Node slot) {
        for (Expression argument : call.getArguments()) {
            if (argument == slot) return true;
        }
        return false;
    }
}
