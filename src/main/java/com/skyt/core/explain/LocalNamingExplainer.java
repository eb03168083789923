package com.skyt.core.explain;

import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.skyt.core.parse.AstQueries;
import com.skyt.core.parse.MethodPair;
import com.skyt.core.property.PropertyKind;
import com.skyt.core.property.PropertyValue;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Local variables whose names differ from the canon local declared at the
 * same position with the same type. Subject to the naming policy.
 */
@Component
public class LocalNamingExplainer implements PropertyExplainer {

    public static final String HINT_METHOD  = "method";
    public static final String HINT_RENAMES = "renames";

    @Override
    public PropertyKind getPropertyKind() {
        return PropertyKind.DATA_DEPENDENCY_GRAPH;
    }

    @Override
    public PropertyDifference explain(PropertyValue candidateValue, PropertyValue canonValue,
                                      ExplanationContext context) {
        if (context.getNamingPolicy().isStrict()) {
            return null;
        }
        for (MethodPair pair : AstQueries.pairMethods(context.getCandidate(), context.getCanon())) {
            List<VariableDeclarator> candidateLocals = pair.getCandidate().findAll(VariableDeclarator.class);
            List<VariableDeclarator> canonLocals     = pair.getCanon().findAll(VariableDeclarator.class);

            List<String> from = new ArrayList<>();
            List<String> to   = new ArrayList<>();
            for (int i = 0; i < Math.min(candidateLocals.size(), canonLocals.size()); i++) {
                VariableDeclarator mine   = candidateLocals.get(i);
                VariableDeclarator theirs = canonLocals.get(i);
                if (!mine.getType().asString().equals(theirs.getType().asString())) continue;
                from.add(mine.getNameAsString());
                to.add(theirs.getNameAsString());
            }

            MethodDeclaration method = pair.getCandidate();
            Map<String, String> renames = RenameProposals.filter(
                    from, to, method, context.getCandidate(), context.getNamingPolicy());
            if (renames.isEmpty()) continue;

            return PropertyDifference.builder(DifferenceType.LOCAL_NAMING_DIFFERENCE)
                    .explanation("Local names of " + method.getNameAsString() + " differ: "
                            + RenameProposals.describe(renames))
                    .hints(TransformationHints.builder()
                            .put(HINT_METHOD, method.getNameAsString())
                            .putMap(HINT_RENAMES, renames)
                            .build())
                    .candidateDetail(String.valueOf(candidateValue))
                    .canonDetail(String.valueOf(canonValue))
                    .build();
        }
        return null;
    }
}
