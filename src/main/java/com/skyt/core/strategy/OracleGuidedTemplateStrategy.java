package com.skyt.core.strategy;

import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.skyt.core.parse.AstQueries;
import com.skyt.core.parse.MethodPair;
import com.skyt.core.parse.ParsedSource;
import com.skyt.core.parse.SourceParser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Opt-in fallback tier: copies the canon's method bodies, parameters and
 * return types into the candidate wholesale, keeping the candidate's method
 * names. Calls between paired canon methods are redirected to the candidate's
 * names.
 *
 * <p>This is the one rewrite that is not derived from an explained
 * difference, so it is kept out of {@link StrategyRegistry}. The pipeline
 * only consults it when the caller enabled it and both sides passed the
 * oracle.</p>
 */
@Component
public class OracleGuidedTemplateStrategy {

    private static final Logger log = LoggerFactory.getLogger(OracleGuidedTemplateStrategy.class);

    public static final String NAME = "oracle-guided-template";

    private final SourceParser parser;

    public OracleGuidedTemplateStrategy(SourceParser parser) {
        this.parser = parser;
    }

    public String getName() {
        return NAME;
    }

    /**
     * Candidate restructured after the canon, or null when either side does not
     * parse, no method pairs up, or the candidate already has the canon's
     * structure.
     */
    public String generate(String candidateSource, String canonSource) {
        ParsedSource candidate = parser.parse(candidateSource);
        ParsedSource canon     = parser.parse(canonSource);
        if (candidate == null || canon == null) return null;

        List<MethodPair> pairs = AstQueries.pairMethods(candidate, canon);
        if (pairs.isEmpty()) return null;

        String before = candidate.print();
        Map<String, String> callNames = new HashMap<>();
        for (MethodPair pair : pairs) {
            callNames.put(pair.getCanon().getNameAsString(), pair.getCandidate().getNameAsString());
        }

        for (MethodPair pair : pairs) {
            MethodDeclaration target = pair.getCandidate();
            MethodDeclaration source = pair.getCanon();
            if (source.getBody().isEmpty()) continue;

            NodeList<Parameter> parameters = new NodeList<>();
            source.getParameters().forEach(p -> parameters.add(p.clone()));
            target.setType(source.getType().clone());
            target.setParameters(parameters);
            target.setBody(source.getBody().get().clone());
            redirectCalls(target, callNames);
        }

        String after = candidate.print();
        if (after.equals(before)) return null;
        log.info("[Template] Applied canon structure to {} method(s)", pairs.size());
        return after;
    }

    private static void redirectCalls(MethodDeclaration method, Map<String, String> callNames) {
        for (MethodCallExpr call : method.findAll(MethodCallExpr.class)) {
            if (call.getScope().isPresent() && !call.getScope().get().isThisExpr()) continue;
            String renamed = callNames.get(call.getNameAsString());
            if (renamed != null) call.setName(renamed);
        }
    }
}
