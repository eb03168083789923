package com.skyt.core.strategy;

import com.github.javaparser.ast.body.MethodDeclaration;
import com.skyt.core.explain.DifferenceType;
import com.skyt.core.explain.PropertyDifference;
import com.skyt.core.explain.StatementOrderingExplainer;
import com.skyt.core.explain.TransformationHints;
import com.skyt.core.parse.AssignmentChain;
import com.skyt.core.parse.ParsedSource;
import com.skyt.core.parse.SourceParser;

import org.springframework.stereotype.Component;

/**
 * Folds a trailing assign-then-return chain into one return statement:
 * {@code int r = n * 2; return r;} becomes {@code return n * 2;}.
 */
@Component
public class StatementConsolidationStrategy extends AbstractAstStrategy {

    public StatementConsolidationStrategy(SourceParser parser) {
        super("statement-consolidation", parser,
                DifferenceType.CONSECUTIVE_STATEMENTS_CONSOLIDATABLE, DifferenceType.CHAINED_STATEMENTS_CONSOLIDATABLE);
    }

    @Override
    protected boolean rewrite(ParsedSource parsed, TransformationHints hints, PropertyDifference difference) {
        MethodDeclaration method = hintedMethod(parsed, hints, StatementOrderingExplainer.HINT_METHOD);
        if (method == null) return false;

        AssignmentChain chain = AssignmentChain.find(method);
        if (chain == null) return false;

        String variable = hints.getString(StatementOrderingExplainer.HINT_VARIABLE);
        if (variable != null && !variable.equals(chain.getVariable())) return false;

        chain.collapse();
        return true;
    }
}
