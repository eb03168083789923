package com.skyt.core.compliance;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.stmt.DoStmt;
import com.github.javaparser.ast.stmt.ForStmt;
import com.github.javaparser.ast.stmt.WhileStmt;
import com.skyt.core.oracle.Contract;
import com.skyt.core.parse.AstQueries;
import com.skyt.core.parse.ParsedSource;
import com.skyt.core.parse.SourceParser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * ContractComplianceChecker: static checks of a fragment against its contract.
 *
 * Each configured constraint is one check; the score is passed / total, and a
 * contract with no constraints scores 1.0. Unparsable code scores 0.
 */
@Component
public class ContractComplianceChecker implements ComplianceChecker {

    private static final Logger log = LoggerFactory.getLogger(ContractComplianceChecker.class);

    private static final Set<String> STACK_TYPES = Set.of("Stack", "ArrayDeque", "Deque", "LinkedList");

    private final SourceParser parser;

    public ContractComplianceChecker(SourceParser parser) {
        this.parser = parser;
    }

    @Override
    public ComplianceReport check(String code, Contract contract) {
        ParsedSource parsed = parser.parse(code);
        if (parsed == null) {
            return new ComplianceReport(false, 0.0, List.of("Code does not parse"));
        }
        if (contract == null) {
            return new ComplianceReport(true, 1.0, List.of());
        }

        List<String> violations = new ArrayList<>();
        int checks = 0;
        int passed = 0;

        if (contract.getFunctionName() != null) {
            checks++;
            if (parsed.findMethod(contract.getFunctionName()) != null) passed++;
            else violations.add("Missing required function: '" + contract.getFunctionName() + "'");
        }

        if (contract.getClassName() != null) {
            checks++;
            if (hasType(parsed, contract.getClassName())) passed++;
            else violations.add("Missing required class: '" + contract.getClassName() + "'");
        }

        if (!contract.getRequiredMethods().isEmpty()) {
            checks++;
            List<String> missing = new ArrayList<>();
            for (String method : contract.getRequiredMethods()) {
                if (parsed.findMethod(method) == null) missing.add(method);
            }
            if (missing.isEmpty()) passed++;
            else missing.forEach(m -> violations.add("Missing required method: '" + m + "'"));
        }

        if (contract.getRequiresRecursion() != null) {
            checks++;
            boolean recursive = isRecursive(parsed);
            if (recursive == contract.getRequiresRecursion()) {
                passed++;
            } else if (contract.getRequiresRecursion()) {
                violations.add("Recursion required but implementation is iterative");
            } else {
                violations.add("Recursion forbidden but implementation recurses");
            }
        }

        if (contract.getAlgorithm() != null && !contract.getAlgorithm().isBlank()) {
            checks++;
            String violation = checkAlgorithm(parsed, contract.getAlgorithm());
            if (violation == null) passed++;
            else violations.add(violation);
        }

        double score = checks == 0 ? 1.0 : (double) passed / checks;
        log.debug("[Compliance] {}: {}/{} checks passed", contract.getId(), passed, checks);
        return new ComplianceReport(violations.isEmpty(), score, violations);
    }

    // =========================================================================
    // Individual checks
    // =========================================================================

    private boolean hasType(ParsedSource parsed, String name) {
        for (TypeDeclaration<?> type : parsed.getCompilationUnit().findAll(TypeDeclaration.class)) {
            if (type.getNameAsString().equals(name)) return true;
        }
        return false;
    }

    private boolean isRecursive(ParsedSource parsed) {
        for (MethodDeclaration method : parsed.getMethods()) {
            if (!AstQueries.selfCalls(method).isEmpty()) return true;
        }
        return false;
    }

    /** Null when the fragment matches the algorithm family, else the violation text. */
    private String checkAlgorithm(ParsedSource parsed, String algorithm) {
        Node root = parsed.getCompilationUnit();
        String family = algorithm.trim().toLowerCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        return switch (family) {
            case "binary_search" -> isBinarySearch(parsed, root)
                    ? null : "Does not use binary search (required: '" + algorithm + "')";
            case "euclidean" -> isEuclidean(parsed, root)
                    ? null : "Does not use Euclidean algorithm (required: '" + algorithm + "')";
            case "stack" -> usesStack(root)
                    ? null : "Does not use a stack-based approach (required: '" + algorithm + "')";
            default -> {
                log.warn("[Compliance] Unknown algorithm family '{}', check skipped as passed", algorithm);
                yield null;
            }
        };
    }

    private boolean isBinarySearch(ParsedSource parsed, Node root) {
        boolean iterates = !root.findAll(WhileStmt.class).isEmpty()
                || !root.findAll(ForStmt.class).isEmpty()
                || !root.findAll(DoStmt.class).isEmpty()
                || isRecursive(parsed);
        return iterates && AstQueries.containsHalving(root);
    }

    private boolean isEuclidean(ParsedSource parsed, Node root) {
        boolean modulo = root.findAll(BinaryExpr.class).stream()
                .anyMatch(b -> b.getOperator() == BinaryExpr.Operator.REMAINDER);
        boolean iterates = !root.findAll(WhileStmt.class).isEmpty() || isRecursive(parsed);
        return modulo && iterates;
    }

    private boolean usesStack(Node root) {
        boolean stackType = root.findAll(ObjectCreationExpr.class).stream()
                .anyMatch(c -> STACK_TYPES.contains(c.getType().getNameAsString()));
        boolean pushPop = root.findAll(MethodCallExpr.class).stream()
                .anyMatch(c -> c.getNameAsString().equals("push") || c.getNameAsString().equals("pop"));
        return stackType && pushPop;
    }
}
