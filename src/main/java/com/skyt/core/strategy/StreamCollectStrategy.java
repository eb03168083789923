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

/** Replaces an accumulate-into-list loop with a stream pipeline ending in a collect. */
@Component
public class StreamCollectStrategy extends AbstractAstStrategy {

    public StreamCollectStrategy(SourceParser parser) {
        super("stream-collect", parser, DifferenceType.LOOP_VS_STREAM);
    }

    @Override
    protected boolean rewrite(ParsedSource parsed, TransformationHints hints, PropertyDifference difference) {
        MethodDeclaration method = hintedMethod(parsed, hints, StructureIdiomExplainer.HINT_METHOD);
        if (method == null) return false;

        LoopIdioms.CollectLoop loop = LoopIdioms.findCollectLoop(method);
        if (loop == null) return false;
        String result = hints.getString(StructureIdiomExplainer.HINT_RESULT_VARIABLE);
        if (result != null && !result.equals(loop.getResultVariable())) return false;

        boolean useToList = hints.getBoolean(StructureIdiomExplainer.HINT_USE_TO_LIST);
        loop.replaceWithStream(useToList);
        if (!useToList) {
            ensureImport(parsed, "java.util.stream.Collectors");
        }
        return true;
    }
}
