package com.skyt.core.parse;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.LambdaExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.expr.UnaryExpr;
import com.github.javaparser.ast.expr.VariableDeclarationExpr;
import com.github.javaparser.ast.stmt.ReturnStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.github.javaparser.ast.type.Type;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A run of statements at the end of a method that builds one variable and
 * then returns it:
 *
 * <pre>
 *   int r = n * 2;      // start: declaration or plain assignment
 *   r = r + 1;          // links: each reads r exactly once
 *   r *= 3;             //        or compound-assigns it
 *   return r;
 * </pre>
 *
 * Such a run can be folded into {@code return (n * 2 + 1) * 3;}. Links after
 * the start must be free of calls and side effects so that folding does not
 * reorder anything observable.
 */
public final class AssignmentChain {

    private final MethodDeclaration method;
    private final String            variable;
    private final List<Statement>   statements;
    private final ReturnStmt        returnStmt;

    private AssignmentChain(MethodDeclaration method, String variable,
                            List<Statement> statements, ReturnStmt returnStmt) {
        this.method     = method;
        this.variable   = variable;
        this.statements = Collections.unmodifiableList(statements);
        this.returnStmt = returnStmt;
    }

    public MethodDeclaration getMethod()     { return method; }
    public String            getVariable()   { return variable; }
    public List<Statement>   getStatements() { return statements; }
    public ReturnStmt        getReturnStmt() { return returnStmt; }

    /** Statements folded into the return, excluding the return itself. */
    public int length() {
        return statements.size();
    }

    // =========================================================================
    // Detection
    // =========================================================================

    /** The foldable trailing chain of {@code method}, or null. */
    public static AssignmentChain find(MethodDeclaration method) {
        List<Statement> body = AstQueries.bodyStatements(method);
        if (body.size() < 2) return null;

        Statement last = body.get(body.size() - 1);
        if (!last.isReturnStmt()) return null;
        Expression returned = last.asReturnStmt().getExpression().orElse(null);
        if (returned == null || !returned.isNameExpr()) return null;
        String variable = returned.asNameExpr().getNameAsString();

        List<Statement> links = new ArrayList<>();
        boolean started = false;
        for (int i = body.size() - 2; i >= 0 && !started; i--) {
            Statement stmt = body.get(i);
            if (initializerOf(stmt, variable) != null) {
                links.add(0, stmt);
                started = true;
                continue;
            }
            AssignExpr assign = assignmentTo(stmt, variable);
            if (assign == null) break;
            links.add(0, stmt);
            if (assign.getOperator() == AssignExpr.Operator.ASSIGN
                    && AstQueries.countNameReads(assign.getValue(), variable) == 0) {
                started = true;
            }
        }
        if (!started) return null;

        for (int i = 1; i < links.size(); i++) {
            AssignExpr link = assignmentTo(links.get(i), variable);
            int reads = AstQueries.countNameReads(link.getValue(), variable);
            boolean plain = link.getOperator() == AssignExpr.Operator.ASSIGN;
            if (plain ? reads != 1 : reads != 0) return null;
            if (!isSideEffectFree(link.getValue())) return null;
        }

        Type declared = declaredType(method, variable);
        if (declared == null || !declared.asString().equals(method.getType().asString())) return null;

        return new AssignmentChain(method, variable, links, last.asReturnStmt());
    }

    // =========================================================================
    // Folding
    // =========================================================================

    /** The single expression equivalent to the whole chain. Does not touch the tree. */
    public Expression fold() {
        Expression acc = startValue().clone();
        for (int i = 1; i < statements.size(); i++) {
            AssignExpr link = assignmentTo(statements.get(i), variable);
            Expression value = link.getValue().clone();
            if (link.getOperator() == AssignExpr.Operator.ASSIGN) {
                if (AstQueries.isName(value, variable)) continue;
                NameExpr slot = null;
                for (NameExpr name : value.findAll(NameExpr.class)) {
                    if (name.getNameAsString().equals(variable)) slot = name;
                }
                Precedence.splice(slot, acc);
                acc = value;
            } else {
                BinaryExpr.Operator op = link.getOperator().toBinaryOperator().orElseThrow();
                BinaryExpr combined = new BinaryExpr(new NameExpr("l"), new NameExpr("r"), op);
                Precedence.splice(combined.getLeft(), acc);
                Precedence.splice(combined.getRight(), value);
                acc = combined;
            }
        }
        return acc;
    }

    /**
     * Rewrites the tree in place: the chain is removed and the return yields
     * {@link #fold()}. When the chain started with a plain assignment, a bare
     * declaration of the variable that nothing else reads is removed too.
     */
    public void collapse() {
        Expression folded = fold();
        for (Statement stmt : statements) {
            stmt.remove();
        }
        returnStmt.setExpression(folded);
        removeUnusedDeclaration();
    }

    private void removeUnusedDeclaration() {
        boolean referenced = method.findAll(NameExpr.class).stream()
                .anyMatch(name -> name.getNameAsString().equals(variable));
        if (referenced) return;
        for (VariableDeclarator declarator : method.findAll(VariableDeclarator.class)) {
            if (!declarator.getNameAsString().equals(variable) || declarator.getInitializer().isPresent()) continue;
            Node parent = declarator.getParentNode().orElse(null);
            if (!(parent instanceof VariableDeclarationExpr)) continue;
            VariableDeclarationExpr decl = (VariableDeclarationExpr) parent;
            if (decl.getVariables().size() == 1) {
                decl.getParentNode().ifPresent(Node::remove);
            } else {
                declarator.remove();
            }
            return;
        }
    }

    private Expression startValue() {
        Statement start = statements.get(0);
        Expression init = initializerOf(start, variable);
        return init != null ? init : assignmentTo(start, variable).getValue();
    }

    // =========================================================================
    // Private helpers
    // =========================================================================

    private static Expression initializerOf(Statement stmt, String variable) {
        if (!stmt.isExpressionStmt()) return null;
        Expression expr = stmt.asExpressionStmt().getExpression();
        if (!expr.isVariableDeclarationExpr()) return null;
        VariableDeclarationExpr decl = expr.asVariableDeclarationExpr();
        if (decl.getVariables().size() != 1) return null;
        VariableDeclarator declarator = decl.getVariable(0);
        if (!declarator.getNameAsString().equals(variable)) return null;
        return declarator.getInitializer().orElse(null);
    }

    private static AssignExpr assignmentTo(Statement stmt, String variable) {
        if (!stmt.isExpressionStmt()) return null;
        Expression expr = stmt.asExpressionStmt().getExpression();
        if (!expr.isAssignExpr()) return null;
        AssignExpr assign = expr.asAssignExpr();
        return AstQueries.isName(assign.getTarget(), variable) ? assign : null;
    }

    private static boolean isSideEffectFree(Expression expr) {
        for (Node node : expr.findAll(Node.class)) {
            if (node instanceof MethodCallExpr || node instanceof AssignExpr
                    || node instanceof ObjectCreationExpr || node instanceof LambdaExpr) {
                return false;
            }
            if (node instanceof UnaryExpr && isIncrementOrDecrement(((UnaryExpr) node).getOperator())) {
                return false;
            }
        }
        return true;
    }

    private static boolean isIncrementOrDecrement(UnaryExpr.Operator op) {
        return op == UnaryExpr.Operator.PREFIX_INCREMENT || op == UnaryExpr.Operator.PREFIX_DECREMENT
                || op == UnaryExpr.Operator.POSTFIX_INCREMENT || op == UnaryExpr.Operator.POSTFIX_DECREMENT;
    }

    /** Declared type of a local or parameter of {@code method}, or null when not declared there. */
    public static Type declaredType(MethodDeclaration method, String name) {
        for (Parameter p : method.getParameters()) {
            if (p.getNameAsString().equals(name)) return p.getType();
        }
        for (VariableDeclarator v : method.findAll(VariableDeclarator.class)) {
            if (v.getNameAsString().equals(name)) return v.getType();
        }
        return null;
    }
}
