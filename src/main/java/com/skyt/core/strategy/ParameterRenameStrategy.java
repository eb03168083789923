package com.skyt.core.strategy;

import com.github.javaparser.ast.body.MethodDeclaration;
import com.skyt.core.explain.DifferenceType;
import com.skyt.core.explain.ParameterNamingExplainer;
import com.skyt.core.explain.PropertyDifference;
import com.skyt.core.explain.TransformationHints;
import com.skyt.core.parse.ParsedSource;
import com.skyt.core.parse.SourceParser;

import org.springframework.stereotype.Component;

import java.util.Map;

/** Renames parameters to the canon's names. The explainer has already applied the naming policy. */
@Component
public class ParameterRenameStrategy extends AbstractAstStrategy {

    public ParameterRenameStrategy(SourceParser parser) {
        super("parameter-rename", parser, DifferenceType.PARAMETER_NAMING_DIFFERENCE);
    }

    @Override
    protected boolean rewrite(ParsedSource parsed, TransformationHints hints, PropertyDifference difference) {
        MethodDeclaration method = hintedMethod(parsed, hints, ParameterNamingExplainer.HINT_METHOD);
        Map<String, String> renames = hints.getStringMap(ParameterNamingExplainer.HINT_RENAMES);
        if (method == null || renames.isEmpty()) return false;

        boolean declared = method.getParameters().stream()
                .anyMatch(p -> renames.containsKey(p.getNameAsString()));
        return declared && IdentifierRenamer.rename(method, renames) > 0;
    }
}
