package com.skyt.core.explain;

import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.skyt.core.parse.AstQueries;
import com.skyt.core.parse.MethodPair;
import com.skyt.core.property.PropertyKind;
import com.skyt.core.property.PropertyValue;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Positional parameter names that differ from the canon's, for methods of the
 * same arity. Only renames the naming policy permits are proposed; under a
 * strict policy this explainer never fires.
 */
@Component
public class ParameterNamingExplainer implements PropertyExplainer {

    public static final String HINT_METHOD  = "method";
    public static final String HINT_RENAMES = "renames";

    @Override
    public PropertyKind getPropertyKind() {
        return PropertyKind.FUNCTION_CONTRACTS;
    }

    @Override
    public PropertyDifference explain(PropertyValue candidateValue, PropertyValue canonValue,
                                      ExplanationContext context) {
        if (context.getNamingPolicy().isStrict()) {
            return null;
        }
        for (MethodPair pair : AstQueries.pairMethods(context.getCandidate(), context.getCanon())) {
            MethodDeclaration candidate = pair.getCandidate();
            MethodDeclaration canon     = pair.getCanon();
            if (candidate.getParameters().size() != canon.getParameters().size()) continue;

            Map<String, String> renames = RenameProposals.filter(
                    names(candidate), names(canon), candidate, context.getCandidate(), context.getNamingPolicy());
            if (renames.isEmpty()) continue;

            return PropertyDifference.builder(DifferenceType.PARAMETER_NAMING_DIFFERENCE)
                    .explanation("Parameter names of " + candidate.getNameAsString() + " differ: "
                            + RenameProposals.describe(renames))
                    .hints(TransformationHints.builder()
                            .put(HINT_METHOD, candidate.getNameAsString())
                            .putMap(HINT_RENAMES, renames)
                            .build())
                    .candidateDetail(String.join(",", names(candidate)))
                    .canonDetail(String.join(",", names(canon)))
                    .build();
        }
        return null;
    }

    private static List<String> names(MethodDeclaration method) {
        return method.getParameters().stream().map(Parameter::getNameAsString).collect(Collectors.toList());
    }
}
