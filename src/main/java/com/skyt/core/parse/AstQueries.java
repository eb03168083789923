package com.skyt.core.parse;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.ConditionalExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.IntegerLiteralExpr;
import com.github.javaparser.ast.expr.LambdaExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.expr.SwitchExpr;
import com.github.javaparser.ast.expr.UnaryExpr;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.LocalClassDeclarationStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.github.javaparser.ast.stmt.SwitchEntry;
import com.github.javaparser.ast.stmt.SwitchStmt;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Read-only queries over JavaParser trees shared by the extractor,
 * the explainers and the strategies.
 */
public final class AstQueries {

    private AstQueries() {}

    // =========================================================================
    // Statements
    // =========================================================================

    /** Coarse statement category used for ordering signatures. */
    public static String statementKind(Statement stmt) {
        if (stmt.isExpressionStmt()) {
            Expression expr = stmt.asExpressionStmt().getExpression();
            if (expr.isVariableDeclarationExpr()) return "declare";
            if (expr.isAssignExpr())              return "assign";
            if (expr.isUnaryExpr())               return "update";
            if (expr.isMethodCallExpr())          return "call";
            return "expr";
        }
        if (stmt.isReturnStmt())   return "return";
        if (stmt.isIfStmt())       return "if";
        if (stmt.isForStmt())      return "for";
        if (stmt.isForEachStmt())  return "foreach";
        if (stmt.isWhileStmt())    return "while";
        if (stmt.isDoStmt())       return "do";
        if (stmt.isSwitchStmt())   return "switch";
        if (stmt.isTryStmt())      return "try";
        if (stmt.isThrowStmt())    return "throw";
        if (stmt.isBlockStmt())    return "block";
        if (stmt.isBreakStmt())    return "break";
        if (stmt.isContinueStmt()) return "continue";
        if (stmt.isLocalClassDeclarationStmt()) return "class";
        return "other";
    }

    public static List<Statement> bodyStatements(MethodDeclaration method) {
        if (method == null || method.getBody().isEmpty()) return List.of();
        return method.getBody().get().getStatements();
    }

    /** A statement, or the single statement of a one-element block. */
    public static Statement unwrapSingle(Statement stmt) {
        if (stmt.isBlockStmt()) {
            BlockStmt block = stmt.asBlockStmt();
            return block.getStatements().size() == 1 ? block.getStatement(0) : null;
        }
        return stmt;
    }

    /** The returned expression of a bare or single-statement-block return, else null. */
    public static Expression returnedExpression(Statement stmt) {
        Statement single = stmt == null ? null : unwrapSingle(stmt);
        if (single == null || !single.isReturnStmt()) return null;
        return single.asReturnStmt().getExpression().orElse(null);
    }

    // =========================================================================
    // Self-reference
    // =========================================================================

    public static boolean isSelfCall(MethodCallExpr call, MethodDeclaration method) {
        if (!call.getNameAsString().equals(method.getNameAsString())) return false;
        if (call.getArguments().size() != method.getParameters().size()) return false;
        return call.getScope().isEmpty() || call.getScope().get().isThisExpr();
    }

    public static List<MethodCallExpr> selfCalls(MethodDeclaration method) {
        List<MethodCallExpr> calls = new ArrayList<>();
        for (MethodCallExpr call : method.findAll(MethodCallExpr.class)) {
            if (isSelfCall(call, method)) calls.add(call);
        }
        return calls;
    }

    public static boolean containsSelfCall(Node node, MethodDeclaration method) {
        if (node instanceof MethodCallExpr && isSelfCall((MethodCallExpr) node, method)) return true;
        for (MethodCallExpr call : node.findAll(MethodCallExpr.class)) {
            if (isSelfCall(call, method)) return true;
        }
        return false;
    }

    /**
     * Largest number of self-calls a single execution path can make. Mutually
     * exclusive branches (if/else, ternary, switch) contribute their maximum.
     */
    public static int selfCallsOnPath(Node node, MethodDeclaration method) {
        if (node instanceof LambdaExpr || node instanceof LocalClassDeclarationStmt) {
            return 0;
        }
        if (node instanceof ObjectCreationExpr
                && ((ObjectCreationExpr) node).getAnonymousClassBody().isPresent()) {
            return 0;
        }
        if (node instanceof IfStmt) {
            IfStmt ifStmt = (IfStmt) node;
            int thenCalls = selfCallsOnPath(ifStmt.getThenStmt(), method);
            int elseCalls = ifStmt.getElseStmt().map(e -> selfCallsOnPath(e, method)).orElse(0);
            return selfCallsOnPath(ifStmt.getCondition(), method) + Math.max(thenCalls, elseCalls);
        }
        if (node instanceof ConditionalExpr) {
            ConditionalExpr cond = (ConditionalExpr) node;
            return selfCallsOnPath(cond.getCondition(), method)
                    + Math.max(selfCallsOnPath(cond.getThenExpr(), method),
                               selfCallsOnPath(cond.getElseExpr(), method));
        }
        if (node instanceof SwitchStmt) {
            SwitchStmt sw = (SwitchStmt) node;
            return selfCallsOnPath(sw.getSelector(), method) + maxOverEntries(sw.getEntries(), method);
        }
        if (node instanceof SwitchExpr) {
            SwitchExpr sw = (SwitchExpr) node;
            return selfCallsOnPath(sw.getSelector(), method) + maxOverEntries(sw.getEntries(), method);
        }
        int total = node instanceof MethodCallExpr && isSelfCall((MethodCallExpr) node, method) ? 1 : 0;
        for (Node child : node.getChildNodes()) {
            total += selfCallsOnPath(child, method);
        }
        return total;
    }

    private static int maxOverEntries(List<SwitchEntry> entries, MethodDeclaration method) {
        int max = 0;
        for (SwitchEntry entry : entries) {
            int sum = 0;
            for (Statement stmt : entry.getStatements()) sum += selfCallsOnPath(stmt, method);
            max = Math.max(max, sum);
        }
        return max;
    }

    /**
     * Leading guard statements of a recursive method: top-level ifs, before the
     * first self-call, whose then-branch exits without recursing.
     */
    public static List<IfStmt> baseCaseGuards(MethodDeclaration method) {
        List<IfStmt> guards = new ArrayList<>();
        for (Statement stmt : bodyStatements(method)) {
            if (!stmt.isIfStmt()) {
                if (containsSelfCall(stmt, method)) break;
                continue;
            }
            IfStmt ifStmt = stmt.asIfStmt();
            if (containsSelfCall(ifStmt.getCondition(), method)
                    || containsSelfCall(ifStmt.getThenStmt(), method)) {
                break;
            }
            if (exits(ifStmt.getThenStmt())) {
                guards.add(ifStmt);
            }
            if (ifStmt.getElseStmt().isPresent() && containsSelfCall(ifStmt.getElseStmt().get(), method)) {
                break;
            }
        }
        return guards;
    }

    private static boolean exits(Statement stmt) {
        if (stmt.isReturnStmt() || stmt.isThrowStmt()) return true;
        if (stmt.isBlockStmt()) {
            List<Statement> inner = stmt.asBlockStmt().getStatements();
            return !inner.isEmpty() && exits(inner.get(inner.size() - 1));
        }
        return false;
    }

    /** Halving step: {@code x / 2}, {@code x >> 1}, {@code x >>> 1} or their compound forms. */
    public static boolean containsHalving(Node node) {
        for (BinaryExpr bin : node.findAll(BinaryExpr.class)) {
            if (isHalving(bin.getOperator(), bin.getRight())) return true;
        }
        for (AssignExpr assign : node.findAll(AssignExpr.class)) {
            BinaryExpr.Operator op = assign.getOperator().toBinaryOperator().orElse(null);
            if (op != null && isHalving(op, assign.getValue())) return true;
        }
        return false;
    }

    private static boolean isHalving(BinaryExpr.Operator op, Expression right) {
        Integer value = intLiteral(right);
        if (value == null) return false;
        if (op == BinaryExpr.Operator.DIVIDE) return value == 2;
        return (op == BinaryExpr.Operator.SIGNED_RIGHT_SHIFT
                || op == BinaryExpr.Operator.UNSIGNED_RIGHT_SHIFT) && value == 1;
    }

    // =========================================================================
    // Names and literals
    // =========================================================================

    public static int countNameReads(Node node, String name) {
        int count = node instanceof NameExpr && ((NameExpr) node).getNameAsString().equals(name) ? 1 : 0;
        for (NameExpr expr : node.findAll(NameExpr.class)) {
            if (expr != node && expr.getNameAsString().equals(name)) count++;
        }
        return count;
    }

    public static boolean isName(Expression expr, String name) {
        return expr != null && expr.isNameExpr() && expr.asNameExpr().getNameAsString().equals(name);
    }

    /** Value of a plain int literal (optionally negated), else null. */
    public static Integer intLiteral(Expression expr) {
        if (expr == null) return null;
        if (expr.isIntegerLiteralExpr()) {
            Number number = ((IntegerLiteralExpr) expr).asNumber();
            return number instanceof Integer ? (Integer) number : null;
        }
        if (expr.isUnaryExpr() && expr.asUnaryExpr().getOperator() == UnaryExpr.Operator.MINUS) {
            Integer inner = intLiteral(expr.asUnaryExpr().getExpression());
            return inner == null ? null : -inner;
        }
        return null;
    }

    /** Names of fields declared by any type in the tree. */
    public static Set<String> fieldNames(Node root) {
        Set<String> names = new HashSet<>();
        for (TypeDeclaration<?> type : root.findAll(TypeDeclaration.class)) {
            type.getFields().forEach(f -> f.getVariables().forEach(v -> names.add(v.getNameAsString())));
        }
        return names;
    }

    /** True when the node sits inside a lambda or local/anonymous class nested in the method. */
    public static boolean isInNestedScope(Node node, MethodDeclaration method) {
        Node current = node.getParentNode().orElse(null);
        while (current != null && current != method) {
            if (current instanceof LambdaExpr || current instanceof LocalClassDeclarationStmt) return true;
            if (current instanceof ObjectCreationExpr
                    && ((ObjectCreationExpr) current).getAnonymousClassBody().isPresent()) return true;
            current = current.getParentNode().orElse(null);
        }
        return false;
    }

    // =========================================================================
    // Pairing
    // =========================================================================

    /**
     * Pair each candidate method with the canon method of the same name, falling
     * back to the canon method at the same position.
     */
    public static List<MethodPair> pairMethods(ParsedSource candidate, ParsedSource canon) {
        List<MethodPair> pairs = new ArrayList<>();
        List<MethodDeclaration> canonMethods = canon.getMethods();
        List<MethodDeclaration> candidateMethods = candidate.getMethods();
        for (int i = 0; i < candidateMethods.size(); i++) {
            MethodDeclaration method = candidateMethods.get(i);
            MethodDeclaration match = canon.findMethod(method.getNameAsString());
            if (match == null && i < canonMethods.size()) {
                match = canonMethods.get(i);
            }
            if (match != null) {
                pairs.add(new MethodPair(method, match));
            }
        }
        return pairs;
    }
}
