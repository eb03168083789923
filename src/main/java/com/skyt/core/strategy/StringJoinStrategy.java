package com.skyt.core.strategy;

import com.github.javaparser.ast.body.MethodDeclaration;
import com.skyt.core.explain.DifferenceType;
import com.skyt.core.explain.PropertyDifference;
import com.skyt.core.explain.StructureIdiomExplainer;
import com.skyt.core.explain.TransformationHints;
import com.skyt.core.parse.LoopIdioms;
import com.skyt.core.parse.ParsedSource;
import com.skyt.core.parse.SourceParser;

import org.springframework.stereotype.Component;

/**
 * Replaces string accumulation in a loop with {@code String.join} or a
 * {@code Collectors.joining()} stream.
 */
@Component
public class StringJoinStrategy extends AbstractAstStrategy {

    public StringJoinStrategy(SourceParser parser) {
        super("string-join", parser, DifferenceType.STRING_BUILDING_IDIOM);
    }

    @Override
    protected boolean rewrite(ParsedSource parsed, TransformationHints hints, PropertyDifference difference) {
        MethodDeclaration method = hintedMethod(parsed, hints, StructureIdiomExplainer.HINT_METHOD);
        if (method == null) return false;

        LoopIdioms.JoinLoop loop = LoopIdioms.findJoinLoop(method);
        if (loop == null) return false;
        String accumulator = hints.getString(StructureIdiomExplainer.HINT_ACCUMULATOR);
        if (accumulator != null && !accumulator.equals(loop.getAccumulator())) return false;

        boolean preferJoin = hints.getBoolean(StructureIdiomExplainer.HINT_PREFER_JOIN);
        boolean stringJoin = preferJoin && loop.joinsElementsDirectly();
        boolean arrays     = loop.usesArrays();
        if (!loop.replaceWithJoin(preferJoin)) return false;

        if (!stringJoin) {
            ensureImport(parsed, "java.util.stream.Collectors");
            if (arrays) ensureImport(parsed, "java.util.Arrays");
        }
        return true;
    }
}
