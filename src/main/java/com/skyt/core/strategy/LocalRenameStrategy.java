package com.skyt.core.strategy;

import com.github.javaparser.ast.body.MethodDeclaration;
import com.skyt.core.explain.DifferenceType;
import com.skyt.core.explain.LocalNamingExplainer;
import com.skyt.core.explain.PropertyDifference;
import com.skyt.core.explain.TransformationHints;
import com.skyt.core.parse.ParsedSource;
import com.skyt.core.parse.SourceParser;

import org.springframework.stereotype.Component;

import java.util.Map;

@Component
public class LocalRenameStrategy extends AbstractAstStrategy {

    public LocalRenameStrategy(SourceParser parser) {
        super("local-rename", parser, DifferenceType.LOCAL_NAMING_DIFFERENCE);
    }

    @Override
    protected boolean rewrite(ParsedSource parsed, TransformationHints hints, PropertyDifference difference) {
        MethodDeclaration method = hintedMethod(parsed, hints, LocalNamingExplainer.HINT_METHOD);
        Map<String, String> renames = hints.getStringMap(LocalNamingExplainer.HINT_RENAMES);
        if (method == null || renames.isEmpty()) return false;
        return IdentifierRenamer.rename(method, renames) > 0;
    }
}
