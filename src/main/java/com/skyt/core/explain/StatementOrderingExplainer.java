package com.skyt.core.explain;

import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.stmt.Statement;
import com.skyt.core.parse.AssignmentChain;
import com.skyt.core.parse.AstQueries;
import com.skyt.core.parse.MethodPair;
import com.skyt.core.property.PropertyKind;
import com.skyt.core.property.PropertyValue;

import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Detects a trailing "assign, then return the same name" run in the candidate
 * where the canon returns inline. One assignment is
 * {@link DifferenceType#CONSECUTIVE_STATEMENTS_CONSOLIDATABLE}; a longer run of
 * same-target assignments is {@link DifferenceType#CHAINED_STATEMENTS_CONSOLIDATABLE}.
 */
@Component
public class StatementOrderingExplainer implements PropertyExplainer {

    public static final String HINT_METHOD       = "method";
    public static final String HINT_VARIABLE     = "variable";
    public static final String HINT_CHAIN_LENGTH = "chainLength";

    @Override
    public PropertyKind getPropertyKind() {
        return PropertyKind.STATEMENT_ORDERING;
    }

    @Override
    public PropertyDifference explain(PropertyValue candidateValue, PropertyValue canonValue,
                                      ExplanationContext context) {
        for (MethodPair pair : AstQueries.pairMethods(context.getCandidate(), context.getCanon())) {
            if (!returnsInline(pair.getCanon())) continue;

            AssignmentChain chain = AssignmentChain.find(pair.getCandidate());
            if (chain == null) continue;

            String method = pair.getCandidate().getNameAsString();
            DifferenceType type = chain.length() == 1
                    ? DifferenceType.CONSECUTIVE_STATEMENTS_CONSOLIDATABLE
                    : DifferenceType.CHAINED_STATEMENTS_CONSOLIDATABLE;

            return PropertyDifference.builder(type)
                    .explanation(String.format("%s assigns '%s' in %d statement(s) before returning it; canon returns inline",
                            method, chain.getVariable(), chain.length()))
                    .hints(TransformationHints.builder()
                            .put(HINT_METHOD, method)
                            .put(HINT_VARIABLE, chain.getVariable())
                            .put(HINT_CHAIN_LENGTH, chain.length())
                            .build())
                    .candidateDetail(String.valueOf(candidateValue))
                    .canonDetail(String.valueOf(canonValue))
                    .build();
        }
        return null;
    }

    private static boolean returnsInline(MethodDeclaration method) {
        List<Statement> body = AstQueries.bodyStatements(method);
        if (body.isEmpty()) return false;
        Statement last = body.get(body.size() - 1);
        if (!last.isReturnStmt()) return false;
        Expression returned = last.asReturnStmt().getExpression().orElse(null);
        return returned != null && !returned.isNameExpr();
    }
}
