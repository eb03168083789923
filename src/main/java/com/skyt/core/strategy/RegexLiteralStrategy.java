package com.skyt.core.strategy;

import com.github.javaparser.ast.expr.StringLiteralExpr;
import com.skyt.core.explain.DifferenceType;
import com.skyt.core.explain.PropertyDifference;
import com.skyt.core.explain.StringLiteralExplainer;
import com.skyt.core.explain.TransformationHints;
import com.skyt.core.parse.ParsedSource;
import com.skyt.core.parse.SourceParser;

import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Substitutes the canon's spelling of a regex literal. Replacements are keyed
 * on the literal's escaped source text.
 */
@Component
public class RegexLiteralStrategy extends AbstractAstStrategy {

    public RegexLiteralStrategy(SourceParser parser) {
        super("regex-literal", parser,
                DifferenceType.REGEX_CHARACTER_CLASS_DIFFERENCE, DifferenceType.REGEX_PATTERN_VARIATION);
    }

    @Override
    protected boolean rewrite(ParsedSource parsed, TransformationHints hints, PropertyDifference difference) {
        Map<String, String> replacements = hints.getStringMap(StringLiteralExplainer.HINT_REPLACEMENTS);
        if (replacements.isEmpty()) return false;

        boolean changed = false;
        for (StringLiteralExpr literal : parsed.getCompilationUnit().findAll(StringLiteralExpr.class)) {
            String replacement = replacements.get(literal.getValue());
            if (replacement == null || replacement.equals(literal.getValue())) continue;
            literal.setValue(replacement);
            changed = true;
        }
        return changed;
    }
}
