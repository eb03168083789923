package com.skyt.core.extract;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.ArrayAccessExpr;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.expr.UnaryExpr;
import com.github.javaparser.ast.expr.VariableDeclarationExpr;
import com.github.javaparser.ast.stmt.ForEachStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.skyt.config.AnalysisMode;
import com.skyt.core.parse.AstQueries;
import com.skyt.core.parse.ParsedSource;
import com.skyt.core.property.RecordValue;
import com.skyt.core.property.SequenceValue;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Data facets: which names each definition reads, what the fragment mutates,
 * and the top-level statement order of each method.
 */
final class DataFlowAnalyzer {

    private static final Set<String> MUTATORS = Set.of(
            "add", "addAll", "put", "putAll", "remove", "removeIf", "removeAll", "retainAll",
            "clear", "set", "sort", "push", "pop", "offer", "poll", "append", "insert", "replaceAll");

    private final AnalysisMode mode;

    DataFlowAnalyzer(AnalysisMode mode) {
        this.mode = mode;
    }

    // =========================================================================
    // Data-dependency graph
    // =========================================================================

    /** Assigned name → sorted, comma-joined names its definitions read. */
    RecordValue dataDependencies(ParsedSource source) {
        Map<String, Set<String>> graph = new TreeMap<>();
        Node root = source.getCompilationUnit();

        for (VariableDeclarator declarator : root.findAll(VariableDeclarator.class)) {
            if (declarator.getParentNode().orElse(null) instanceof VariableDeclarationExpr
                    && declarator.getParentNode().get().getParentNode().orElse(null) instanceof ForEachStmt) {
                continue;
            }
            Set<String> reads = graph.computeIfAbsent(declarator.getNameAsString(), k -> new TreeSet<>());
            declarator.getInitializer().ifPresent(init -> reads.addAll(namesRead(init)));
        }
        for (AssignExpr assign : root.findAll(AssignExpr.class)) {
            if (!assign.getTarget().isNameExpr()) continue;
            String target = assign.getTarget().asNameExpr().getNameAsString();
            Set<String> reads = graph.computeIfAbsent(target, k -> new TreeSet<>());
            reads.addAll(namesRead(assign.getValue()));
            if (assign.getOperator() != AssignExpr.Operator.ASSIGN) reads.add(target);
        }
        for (ForEachStmt loop : root.findAll(ForEachStmt.class)) {
            String variable = loop.getVariableDeclarator().getNameAsString();
            graph.computeIfAbsent(variable, k -> new TreeSet<>()).addAll(namesRead(loop.getIterable()));
        }

        RecordValue.Builder record = RecordValue.builder();
        graph.forEach((name, reads) -> record.put(name, String.join(",", reads)));
        return record.build();
    }

    private static Set<String> namesRead(Expression expr) {
        Set<String> names = new TreeSet<>();
        if (expr.isNameExpr()) names.add(expr.asNameExpr().getNameAsString());
        for (NameExpr name : expr.findAll(NameExpr.class)) {
            names.add(name.getNameAsString());
        }
        return names;
    }

    // =========================================================================
    // Side-effect profile
    // =========================================================================

    RecordValue sideEffects(ParsedSource source) {
        Node        root   = source.getCompilationUnit();
        Set<String> fields = AstQueries.fieldNames(root);

        int ioCalls        = 0;
        int mutatorCalls   = 0;
        int paramMutations = 0;
        int fieldWrites    = 0;

        for (MethodDeclaration method : source.getMethods()) {
            Set<String> params = new HashSet<>();
            for (Parameter p : method.getParameters()) params.add(p.getNameAsString());
            Set<String> locals = new HashSet<>();
            method.findAll(VariableDeclarator.class).forEach(v -> locals.add(v.getNameAsString()));

            for (MethodCallExpr call : method.findAll(MethodCallExpr.class)) {
                if (isIoCall(call)) ioCalls++;
                if (MUTATORS.contains(call.getNameAsString()) && call.getScope().isPresent()) {
                    mutatorCalls++;
                    Expression scope = call.getScope().get();
                    if (scope.isNameExpr() && params.contains(scope.asNameExpr().getNameAsString())) {
                        paramMutations++;
                    }
                }
            }
            for (AssignExpr assign : method.findAll(AssignExpr.class)) {
                Expression target = assign.getTarget();
                if (writesField(target, fields, params, locals)) fieldWrites++;
                if (target.isArrayAccessExpr()) {
                    Expression array = ((ArrayAccessExpr) target).getName();
                    if (array.isNameExpr() && params.contains(array.asNameExpr().getNameAsString())) {
                        paramMutations++;
                    }
                }
            }
            for (UnaryExpr unary : method.findAll(UnaryExpr.class)) {
                if (isIncrementOrDecrement(unary)
                        && writesField(unary.getExpression(), fields, params, locals)) {
                    fieldWrites++;
                }
            }
        }

        boolean pure = ioCalls == 0 && fieldWrites == 0 && paramMutations == 0;
        RecordValue.Builder record = RecordValue.builder()
                .put("io",                ioCalls > 0)
                .put("writesFields",      fieldWrites > 0)
                .put("mutatesParameters", paramMutations > 0)
                .put("pure",              pure);

        if (mode == AnalysisMode.ENHANCED) {
            record.put("ioCalls",             ioCalls);
            record.put("fieldWrites",         fieldWrites);
            record.put("collectionMutations", mutatorCalls);
            record.put("allocations",         root.findAll(ObjectCreationExpr.class).size());
        }
        return record.build();
    }

    private static boolean isIoCall(MethodCallExpr call) {
        if (call.getScope().isEmpty()) return false;
        Expression scope = call.getScope().get();
        if (scope.isFieldAccessExpr()) {
            FieldAccessExpr field = scope.asFieldAccessExpr();
            return field.getScope().isNameExpr()
                    && field.getScope().asNameExpr().getNameAsString().equals("System")
                    && (field.getNameAsString().equals("out") || field.getNameAsString().equals("err"));
        }
        return scope.isNameExpr() && scope.asNameExpr().getNameAsString().equals("Files");
    }

    private static boolean writesField(Expression target, Set<String> fields,
                                       Set<String> params, Set<String> locals) {
        if (target.isFieldAccessExpr()) {
            return target.asFieldAccessExpr().getScope().isThisExpr();
        }
        if (target.isNameExpr()) {
            String name = target.asNameExpr().getNameAsString();
            return fields.contains(name) && !params.contains(name) && !locals.contains(name);
        }
        return false;
    }

    private static boolean isIncrementOrDecrement(UnaryExpr unary) {
        UnaryExpr.Operator op = unary.getOperator();
        return op == UnaryExpr.Operator.PREFIX_INCREMENT || op == UnaryExpr.Operator.PREFIX_DECREMENT
                || op == UnaryExpr.Operator.POSTFIX_INCREMENT || op == UnaryExpr.Operator.POSTFIX_DECREMENT;
    }

    // =========================================================================
    // Statement ordering
    // =========================================================================

    SequenceValue statementOrdering(ParsedSource source) {
        List<String> kinds = new ArrayList<>();
        for (MethodDeclaration method : source.getMethods()) {
            for (Statement stmt : AstQueries.bodyStatements(method)) {
                kinds.add(AstQueries.statementKind(stmt));
            }
        }
        return SequenceValue.of(kinds);
    }
}
