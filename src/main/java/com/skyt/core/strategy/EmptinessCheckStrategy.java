package com.skyt.core.strategy;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.UnaryExpr;
import com.skyt.core.explain.DifferenceType;
import com.skyt.core.explain.LogicalEquivalenceExplainer;
import com.skyt.core.explain.PropertyDifference;
import com.skyt.core.explain.TransformationHints;
import com.skyt.core.parse.LogicalForms;
import com.skyt.core.parse.ParsedSource;
import com.skyt.core.parse.Precedence;
import com.skyt.core.parse.SourceParser;

import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Rewrites emptiness checks on the hinted receivers between
 * {@code x.size() == 0} and {@code x.isEmpty()}, in whichever direction the
 * canon uses.
 */
@Component
public class EmptinessCheckStrategy extends AbstractAstStrategy {

    public EmptinessCheckStrategy(SourceParser parser) {
        super("emptiness-check", parser, DifferenceType.EMPTY_CHECK_FORM);
    }

    @Override
    protected boolean rewrite(ParsedSource parsed, TransformationHints hints, PropertyDifference difference) {
        Set<String> scopes = new HashSet<>(hints.getStringList(LogicalEquivalenceExplainer.HINT_SCOPES));
        if (scopes.isEmpty()) return false;

        String target = hints.getString(LogicalEquivalenceExplainer.HINT_TARGET_FORM);
        if (LogicalEquivalenceExplainer.FORM_IS_EMPTY.equals(target)) {
            return toIsEmpty(parsed, scopes);
        }
        if (LogicalEquivalenceExplainer.FORM_SIZE_COMPARE.equals(target)) {
            String sizeMethod = hints.getString(LogicalEquivalenceExplainer.HINT_SIZE_METHOD);
            return sizeMethod != null && toSizeCompare(parsed, scopes, sizeMethod);
        }
        return false;
    }

    private static boolean toIsEmpty(ParsedSource parsed, Set<String> scopes) {
        boolean changed = false;
        List<BinaryExpr> comparisons = parsed.getCompilationUnit().findAll(BinaryExpr.class);
        for (BinaryExpr bin : comparisons) {
            LogicalForms.SizeComparison comparison = LogicalForms.sizeComparison(bin);
            if (comparison == null || !scopes.contains(comparison.getScope().toString())) continue;
            Expression replacement = LogicalForms.isEmptyForm(comparison.getScope(), comparison.isEmptyCheck());
            Precedence.splice(bin, replacement);
            changed = true;
        }
        return changed;
    }

    private static boolean toSizeCompare(ParsedSource parsed, Set<String> scopes, String sizeMethod) {
        boolean changed = false;
        List<MethodCallExpr> calls = parsed.getCompilationUnit().findAll(MethodCallExpr.class);
        for (MethodCallExpr call : calls) {
            if (!LogicalForms.isEmptinessCall(call)) continue;
            Expression scope = call.getScope().get();
            if (!scopes.contains(scope.toString())) continue;

            Node parent = call.getParentNode().orElse(null);
            if (parent instanceof UnaryExpr
                    && ((UnaryExpr) parent).getOperator() == UnaryExpr.Operator.LOGICAL_COMPLEMENT) {
                Precedence.splice((UnaryExpr) parent, LogicalForms.sizeCompareForm(scope, sizeMethod, false));
            } else {
                Precedence.splice(call, LogicalForms.sizeCompareForm(scope, sizeMethod, true));
            }
            changed = true;
        }
        return changed;
    }
}
