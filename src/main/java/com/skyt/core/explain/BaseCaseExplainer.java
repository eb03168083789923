package com.skyt.core.explain;

import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.stmt.IfStmt;
import com.skyt.core.parse.AstQueries;
import com.skyt.core.parse.IntBound;
import com.skyt.core.parse.MethodPair;
import com.skyt.core.property.PropertyKind;
import com.skyt.core.property.PropertyValue;

import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Base-case guards of a recursive method that select the same integers as the
 * canon's guard but are spelled differently, e.g. {@code n < 2} against
 * {@code n <= 1}.
 */
@Component
public class BaseCaseExplainer implements PropertyExplainer {

    public static final String HINT_METHOD      = "method";
    public static final String HINT_GUARD_INDEX = "guardIndex";
    public static final String HINT_VARIABLE    = "variable";
    public static final String HINT_OPERATOR    = "operator";
    public static final String HINT_BOUND       = "bound";

    @Override
    public PropertyKind getPropertyKind() {
        return PropertyKind.TERMINATION_PROPERTIES;
    }

    @Override
    public PropertyDifference explain(PropertyValue candidateValue, PropertyValue canonValue,
                                      ExplanationContext context) {
        for (MethodPair pair : AstQueries.pairMethods(context.getCandidate(), context.getCanon())) {
            MethodDeclaration candidate = pair.getCandidate();
            if (AstQueries.selfCalls(candidate).isEmpty() || AstQueries.selfCalls(pair.getCanon()).isEmpty()) {
                continue;
            }
            List<IfStmt> mine   = AstQueries.baseCaseGuards(candidate);
            List<IfStmt> theirs = AstQueries.baseCaseGuards(pair.getCanon());

            for (int i = 0; i < Math.min(mine.size(), theirs.size()); i++) {
                IntBound have = IntBound.parse(mine.get(i).getCondition());
                IntBound want = IntBound.parse(theirs.get(i).getCondition());
                if (have == null || want == null) continue;
                if (!have.isEquivalentTo(want) || !have.isIntegralIn(candidate)) continue;
                if (mine.get(i).getCondition().toString().equals(want.toExpression().toString())) continue;

                return PropertyDifference.builder(DifferenceType.BASE_CASE_PREDICATE_FORM)
                        .explanation(String.format("%s base case %d tests '%s'; canon tests the equivalent '%s'",
                                candidate.getNameAsString(), i, mine.get(i).getCondition(), want))
                        .hints(TransformationHints.builder()
                                .put(HINT_METHOD, candidate.getNameAsString())
                                .put(HINT_GUARD_INDEX, i)
                                .put(HINT_VARIABLE, want.getVariable())
                                .put(HINT_OPERATOR, want.getOperator().name())
                                .put(HINT_BOUND, want.getBound())
                                .build())
                        .candidateDetail(mine.get(i).getCondition().toString())
                        .canonDetail(theirs.get(i).getCondition().toString())
                        .build();
            }
        }
        return null;
    }
}
