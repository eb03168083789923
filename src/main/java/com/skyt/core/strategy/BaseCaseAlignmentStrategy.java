package com.skyt.core.strategy;

import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.stmt.IfStmt;
import com.skyt.core.explain.BaseCaseExplainer;
import com.skyt.core.explain.DifferenceType;
import com.skyt.core.explain.PropertyDifference;
import com.skyt.core.explain.TransformationHints;
import com.skyt.core.parse.AstQueries;
import com.skyt.core.parse.IntBound;
import com.skyt.core.parse.ParsedSource;
import com.skyt.core.parse.SourceParser;

import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Rewrites a base-case guard to the canon's spelling of the same integer
 * bound, e.g. {@code n < 2} to {@code n <= 1}. Refuses when the bounds are not
 * equivalent.
 */
@Component
public class BaseCaseAlignmentStrategy extends AbstractAstStrategy {

    public BaseCaseAlignmentStrategy(SourceParser parser) {
        super("base-case-alignment", parser, DifferenceType.BASE_CASE_PREDICATE_FORM);
    }

    @Override
    protected boolean rewrite(ParsedSource parsed, TransformationHints hints, PropertyDifference difference) {
        MethodDeclaration method = hintedMethod(parsed, hints, BaseCaseExplainer.HINT_METHOD);
        String variable = hints.getString(BaseCaseExplainer.HINT_VARIABLE);
        String operator = hints.getString(BaseCaseExplainer.HINT_OPERATOR);
        int index = hints.getInt(BaseCaseExplainer.HINT_GUARD_INDEX, -1);
        if (method == null || variable == null || operator == null || !hints.has(BaseCaseExplainer.HINT_BOUND)) {
            return false;
        }

        List<IfStmt> guards = AstQueries.baseCaseGuards(method);
        if (index < 0 || index >= guards.size()) return false;
        IfStmt guard = guards.get(index);

        IntBound want;
        try {
            want = IntBound.of(variable, BinaryExpr.Operator.valueOf(operator),
                    hints.getInt(BaseCaseExplainer.HINT_BOUND, 0));
        } catch (IllegalArgumentException e) {
            return false;
        }
        IntBound have = IntBound.parse(guard.getCondition());
        if (have == null || !have.isEquivalentTo(want) || !have.isIntegralIn(method)) return false;
        if (guard.getCondition().toString().equals(want.toExpression().toString())) return false;

        guard.setCondition(want.toExpression());
        return true;
    }
}
