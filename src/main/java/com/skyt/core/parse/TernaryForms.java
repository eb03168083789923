package com.skyt.core.parse;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.ConditionalExpr;
import com.github.javaparser.ast.expr.EnclosedExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.ReturnStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.github.javaparser.ast.type.Type;

import java.util.ArrayList;
import java.util.List;

/**
 * If statements that pick one of two values and can be written as a
 * conditional expression.
 */
public final class TernaryForms {

    public enum Form {
        /** {@code if (c) return a; else return b;} */
        RETURN_ELSE,
        /** {@code if (c) return a;} directly followed by {@code return b;} */
        RETURN_FALLTHROUGH,
        /** {@code if (c) v = a; else v = b;} */
        ASSIGN
    }

    private TernaryForms() {}

    public static final class Site {
        private final IfStmt     ifStmt;
        private final Form       form;
        private final Expression thenValue;
        private final Expression elseValue;
        private final Statement  fallthrough;
        private final String     target;

        Site(IfStmt ifStmt, Form form, Expression thenValue, Expression elseValue,
             Statement fallthrough, String target) {
            this.ifStmt      = ifStmt;
            this.form        = form;
            this.thenValue   = thenValue;
            this.elseValue   = elseValue;
            this.fallthrough = fallthrough;
            this.target      = target;
        }

        public Form   getForm()      { return form; }
        public String getCondition() { return ifStmt.getCondition().toString(); }
        public String getTarget()    { return target; }

        public ConditionalExpr conditional() {
            return new ConditionalExpr(
                    wrapIfNeeded(ifStmt.getCondition().clone(), true),
                    wrapIfNeeded(thenValue.clone(), false),
                    wrapIfNeeded(elseValue.clone(), false));
        }

        /** Replaces the if statement (and a fall-through return) with the conditional form. */
        public void rewrite() {
            Statement replacement;
            if (form == Form.ASSIGN) {
                replacement = new ExpressionStmt(new AssignExpr(
                        new NameExpr(target), conditional(), AssignExpr.Operator.ASSIGN));
            } else {
                replacement = new ReturnStmt(conditional());
            }
            if (fallthrough != null) {
                fallthrough.remove();
            }
            ifStmt.replace(replacement);
        }
    }

    /** Every rewritable site in {@code method}, in source order. */
    public static List<Site> find(MethodDeclaration method) {
        List<Site> sites = new ArrayList<>();
        for (IfStmt ifStmt : method.findAll(IfStmt.class)) {
            if (AstQueries.isInNestedScope(ifStmt, method)) continue;
            Site site = match(ifStmt, method);
            if (site != null) sites.add(site);
        }
        return sites;
    }

    private static Site match(IfStmt ifStmt, MethodDeclaration method) {
        Type returnType = method.getType();
        Statement then = ifStmt.getThenStmt();
        Expression thenReturn = AstQueries.returnedExpression(then);

        if (ifStmt.getElseStmt().isPresent()) {
            Statement otherwise = ifStmt.getElseStmt().get();
            if (otherwise.isIfStmt()) return null;
            Expression elseReturn = AstQueries.returnedExpression(otherwise);
            if (thenReturn != null && elseReturn != null) {
                if (mayChangeBoxing(returnType, thenReturn, elseReturn)) return null;
                return new Site(ifStmt, Form.RETURN_ELSE, thenReturn, elseReturn, null, null);
            }
            AssignExpr thenAssign = plainAssignment(then);
            AssignExpr elseAssign = plainAssignment(otherwise);
            if (thenAssign != null && elseAssign != null
                    && thenAssign.getTarget().isNameExpr()
                    && thenAssign.getTarget().equals(elseAssign.getTarget())) {
                String target = thenAssign.getTarget().asNameExpr().getNameAsString();
                Type targetType = AssignmentChain.declaredType(method, target);
                if (mayChangeBoxing(targetType, thenAssign.getValue(), elseAssign.getValue())) return null;
                return new Site(ifStmt, Form.ASSIGN, thenAssign.getValue(), elseAssign.getValue(), null, target);
            }
            return null;
        }

        if (thenReturn == null) return null;
        Statement next = nextSibling(ifStmt);
        Expression nextReturn = next == null ? null : AstQueries.returnedExpression(next);
        if (nextReturn == null || !next.isReturnStmt()) return null;
        if (mayChangeBoxing(returnType, thenReturn, nextReturn)) return null;
        return new Site(ifStmt, Form.RETURN_FALLTHROUGH, thenReturn, nextReturn, next, null);
    }

    // =========================================================================
    // Private helpers
    // =========================================================================

    private static AssignExpr plainAssignment(Statement stmt) {
        Statement single = AstQueries.unwrapSingle(stmt);
        if (single == null || !single.isExpressionStmt()) return null;
        Expression expr = single.asExpressionStmt().getExpression();
        if (!expr.isAssignExpr() || expr.asAssignExpr().getOperator() != AssignExpr.Operator.ASSIGN) return null;
        return expr.asAssignExpr();
    }

    private static Statement nextSibling(IfStmt ifStmt) {
        Node parent = ifStmt.getParentNode().orElse(null);
        if (!(parent instanceof BlockStmt)) return null;
        NodeList<Statement> siblings = ((BlockStmt) parent).getStatements();
        for (int i = 0; i < siblings.size() - 1; i++) {
            if (siblings.get(i) == ifStmt) return siblings.get(i + 1);
        }
        return null;
    }

    /**
     * A conditional expression unifies its branch types, which can turn an
     * Integer into a Double behind a reference return type. Numeric branches
     * are only accepted when the target type is primitive.
     */
    private static boolean mayChangeBoxing(Type target, Expression a, Expression b) {
        if (target != null && target.isPrimitiveType()) return false;
        return isNumeric(a) || isNumeric(b);
    }

    private static boolean isNumeric(Expression expr) {
        if (expr.isIntegerLiteralExpr() || expr.isLongLiteralExpr() || expr.isDoubleLiteralExpr()
                || expr.isCharLiteralExpr()) {
            return true;
        }
        if (expr.isUnaryExpr()) return isNumeric(expr.asUnaryExpr().getExpression());
        if (expr.isBinaryExpr()) {
            return isNumeric(expr.asBinaryExpr().getLeft()) || isNumeric(expr.asBinaryExpr().getRight());
        }
        if (expr.isCastExpr()) return expr.asCastExpr().getType().isPrimitiveType();
        return false;
    }

    private static Expression wrapIfNeeded(Expression expr, boolean condition) {
        boolean wrap = expr.isAssignExpr() || expr.isLambdaExpr() || (condition && expr.isConditionalExpr());
        return wrap ? new EnclosedExpr(expr) : expr;
    }
}
