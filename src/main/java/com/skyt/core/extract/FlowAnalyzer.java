package com.skyt.core.extract;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.ConditionalExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.stmt.BreakStmt;
import com.github.javaparser.ast.stmt.CatchClause;
import com.github.javaparser.ast.stmt.ContinueStmt;
import com.github.javaparser.ast.stmt.DoStmt;
import com.github.javaparser.ast.stmt.ForEachStmt;
import com.github.javaparser.ast.stmt.ForStmt;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.ReturnStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.github.javaparser.ast.stmt.SwitchEntry;
import com.github.javaparser.ast.stmt.SwitchStmt;
import com.github.javaparser.ast.stmt.ThrowStmt;
import com.github.javaparser.ast.stmt.TryStmt;
import com.github.javaparser.ast.stmt.WhileStmt;
import com.skyt.config.AnalysisMode;
import com.skyt.core.parse.AstQueries;
import com.skyt.core.parse.ParsedSource;
import com.skyt.core.property.RecordValue;
import com.skyt.core.property.RecursionSchema;
import com.skyt.core.property.SequenceValue;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Control-flow facets: branch/loop signature, exit paths, termination and
 * complexity class.
 */
final class FlowAnalyzer {

    private final AnalysisMode mode;

    FlowAnalyzer(AnalysisMode mode) {
        this.mode = mode;
    }

    // =========================================================================
    // Control-flow signature
    // =========================================================================

    RecordValue controlFlowSignature(ParsedSource source) {
        Node root = source.getCompilationUnit();
        List<String> calls = root.findAll(MethodCallExpr.class).stream()
                .map(MethodCallExpr::getNameAsString)
                .collect(Collectors.toList());

        return RecordValue.builder()
                .put("if",         root.findAll(IfStmt.class).size())
                .put("ternary",    root.findAll(ConditionalExpr.class).size())
                .put("switch",     root.findAll(SwitchStmt.class).size())
                .put("for",        root.findAll(ForStmt.class).size())
                .put("forEach",    root.findAll(ForEachStmt.class).size())
                .put("while",      root.findAll(WhileStmt.class).size())
                .put("doWhile",    root.findAll(DoStmt.class).size())
                .put("try",        root.findAll(TryStmt.class).size())
                .put("return",     root.findAll(ReturnStmt.class).size())
                .put("throw",      root.findAll(ThrowStmt.class).size())
                .put("break",      root.findAll(BreakStmt.class).size())
                .put("continue",   root.findAll(ContinueStmt.class).size())
                .put("maxNesting", nestingDepth(root, false))
                .put("calls",      String.join(",", calls))
                .build();
    }

    // =========================================================================
    // Execution paths
    // =========================================================================

    /**
     * One token per method exit: the chain of enclosing branch constructs
     * followed by the exit kind, e.g. {@code if>return}, {@code else>throw}.
     */
    SequenceValue executionPaths(ParsedSource source) {
        List<String> paths = new ArrayList<>();
        for (MethodDeclaration method : source.getMethods()) {
            if (method.getBody().isEmpty()) continue;
            for (Statement exit : method.getBody().get().findAll(Statement.class)) {
                if (!exit.isReturnStmt() && !exit.isThrowStmt()) continue;
                if (AstQueries.isInNestedScope(exit, method)) continue;
                paths.add(pathTo(exit, method) + (exit.isReturnStmt() ? "return" : "throw"));
            }
            List<Statement> body = AstQueries.bodyStatements(method);
            if (body.isEmpty() || !endsInExit(body.get(body.size() - 1))) {
                paths.add("end");
            }
        }
        return SequenceValue.of(paths);
    }

    private String pathTo(Node exit, MethodDeclaration method) {
        List<String> segments = new ArrayList<>();
        Node child   = exit;
        Node current = exit.getParentNode().orElse(null);
        while (current != null && current != method) {
            if (current instanceof IfStmt) {
                IfStmt ifStmt = (IfStmt) current;
                boolean inElse = ifStmt.getElseStmt().isPresent() && ifStmt.getElseStmt().get() == child;
                if (child != ifStmt.getCondition()) segments.add(0, inElse ? "else" : "if");
            } else if (current instanceof ForStmt || current instanceof ForEachStmt
                    || current instanceof WhileStmt || current instanceof DoStmt) {
                segments.add(0, "loop");
            } else if (current instanceof SwitchEntry) {
                segments.add(0, "case");
            } else if (current instanceof CatchClause) {
                segments.add(0, "catch");
            } else if (current instanceof TryStmt) {
                segments.add(0, "try");
            }
            child   = current;
            current = current.getParentNode().orElse(null);
        }
        return segments.isEmpty() ? "" : String.join(">", segments) + ">";
    }

    private boolean endsInExit(Statement stmt) {
        if (stmt.isReturnStmt() || stmt.isThrowStmt()) return true;
        if (stmt.isIfStmt()) {
            IfStmt ifStmt = stmt.asIfStmt();
            return ifStmt.getElseStmt().isPresent()
                    && endsInExit(ifStmt.getThenStmt())
                    && endsInExit(ifStmt.getElseStmt().get());
        }
        if (stmt.isBlockStmt()) {
            List<Statement> inner = stmt.asBlockStmt().getStatements();
            return !inner.isEmpty() && endsInExit(inner.get(inner.size() - 1));
        }
        return false;
    }

    // =========================================================================
    // Termination
    // =========================================================================

    RecordValue termination(ParsedSource source) {
        Node root = source.getCompilationUnit();
        int loops = root.findAll(ForStmt.class).size() + root.findAll(ForEachStmt.class).size()
                + root.findAll(WhileStmt.class).size() + root.findAll(DoStmt.class).size();

        int unbounded = 0;
        for (WhileStmt loop : root.findAll(WhileStmt.class)) {
            if (isTrueLiteral(loop.getCondition())) unbounded++;
        }
        for (DoStmt loop : root.findAll(DoStmt.class)) {
            if (isTrueLiteral(loop.getCondition())) unbounded++;
        }
        for (ForStmt loop : root.findAll(ForStmt.class)) {
            if (loop.getCompare().isEmpty() || isTrueLiteral(loop.getCompare().get())) unbounded++;
        }

        boolean recursive = false;
        List<String> guards = new ArrayList<>();
        for (MethodDeclaration method : source.getMethods()) {
            if (AstQueries.selfCalls(method).isEmpty()) continue;
            recursive = true;
            for (IfStmt guard : AstQueries.baseCaseGuards(method)) {
                guards.add(guard.getCondition().toString());
            }
        }

        return RecordValue.builder()
                .put("loops",          loops)
                .put("unboundedLoops", unbounded)
                .put("recursive",      recursive)
                .put("baseCaseGuards", String.join(" ; ", guards))
                .build();
    }

    private static boolean isTrueLiteral(Expression expr) {
        return expr.isBooleanLiteralExpr() && expr.asBooleanLiteralExpr().getValue();
    }

    // =========================================================================
    // Complexity class
    // =========================================================================

    RecordValue complexity(ParsedSource source, RecursionSchema schema) {
        Node root      = source.getCompilationUnit();
        int  loopDepth = nestingDepth(root, true);
        boolean halving = AstQueries.containsHalving(root);
        boolean streams = root.findAll(MethodCallExpr.class).stream()
                .anyMatch(c -> c.getNameAsString().equals("stream"));

        RecordValue.Builder record = RecordValue.builder()
                .put("loopDepth", loopDepth)
                .put("recursive", schema.isRecursive())
                .put("class",     complexityLabel(schema, loopDepth, halving, streams));

        if (mode == AnalysisMode.ENHANCED) {
            record.put("cyclomatic",  cyclomatic(root));
            record.put("nestedLoops", nestedLoops(root));
        }
        return record.build();
    }

    private String complexityLabel(RecursionSchema schema, int loopDepth, boolean halving, boolean streams) {
        if (schema.isRecursive()) {
            if (schema.isDivideAndConquer()) {
                return loopDepth >= 1 ? "O(n log n)" : "O(n)";
            }
            if (schema.getBranching().ordinal() >= RecursionSchema.Branching.BINARY.ordinal()) {
                return "O(2^n)";
            }
            return halving ? "O(log n)" : "O(n)";
        }
        if (loopDepth >= 2) return "O(n^" + loopDepth + ")";
        if (loopDepth == 1) return halving ? "O(log n)" : "O(n)";
        return streams ? "O(n)" : "O(1)";
    }

    private int cyclomatic(Node root) {
        int decisions = root.findAll(IfStmt.class).size()
                + root.findAll(ConditionalExpr.class).size()
                + root.findAll(ForStmt.class).size()
                + root.findAll(ForEachStmt.class).size()
                + root.findAll(WhileStmt.class).size()
                + root.findAll(DoStmt.class).size()
                + root.findAll(CatchClause.class).size();
        for (SwitchEntry entry : root.findAll(SwitchEntry.class)) {
            if (!entry.getLabels().isEmpty()) decisions++;
        }
        for (BinaryExpr bin : root.findAll(BinaryExpr.class)) {
            if (bin.getOperator() == BinaryExpr.Operator.AND || bin.getOperator() == BinaryExpr.Operator.OR) {
                decisions++;
            }
        }
        return 1 + decisions;
    }

    private int nestedLoops(Node root) {
        int count = 0;
        for (Node loop : loopsIn(root)) {
            Node parent = loop.getParentNode().orElse(null);
            while (parent != null) {
                if (isLoop(parent)) {
                    count++;
                    break;
                }
                parent = parent.getParentNode().orElse(null);
            }
        }
        return count;
    }

    // =========================================================================
    // Private helpers
    // =========================================================================

    private List<Node> loopsIn(Node root) {
        List<Node> loops = new ArrayList<>();
        root.walk(node -> {
            if (isLoop(node)) loops.add(node);
        });
        return loops;
    }

    private static boolean isLoop(Node node) {
        return node instanceof ForStmt || node instanceof ForEachStmt
                || node instanceof WhileStmt || node instanceof DoStmt;
    }

    private static boolean isBranchOrLoop(Node node) {
        return isLoop(node) || node instanceof IfStmt || node instanceof SwitchStmt || node instanceof TryStmt;
    }

    /** Deepest nesting of control constructs, or of loops only when {@code loopsOnly}. */
    private int nestingDepth(Node node, boolean loopsOnly) {
        int deepestChild = 0;
        for (Node child : node.getChildNodes()) {
            deepestChild = Math.max(deepestChild, nestingDepth(child, loopsOnly));
        }
        boolean counts = loopsOnly ? isLoop(node) : isBranchOrLoop(node);
        return counts ? deepestChild + 1 : deepestChild;
    }
}
