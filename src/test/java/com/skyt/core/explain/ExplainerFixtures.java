package com.skyt.core.explain;

import com.skyt.config.AnalysisModeResolver;
import com.skyt.core.extract.PropertyExtractor;
import com.skyt.core.naming.NamingPolicy;
import com.skyt.core.parse.ParsedSource;
import com.skyt.core.parse.SourceParser;
import com.skyt.core.property.PropertySet;

import static org.junit.jupiter.api.Assertions.assertNotNull;

/** Runs a single explainer over a candidate/canon pair the way the registry does. */
final class ExplainerFixtures {

    static final SourceParser PARSER = new SourceParser();
    static final PropertyExtractor EXTRACTOR =
            new PropertyExtractor(PARSER, new AnalysisModeResolver("baseline"));

    private ExplainerFixtures() {}

    static PropertyDifference explain(PropertyExplainer explainer, String candidate, String canon) {
        return explain(explainer, candidate, canon, NamingPolicy.permissive());
    }

    static PropertyDifference explain(PropertyExplainer explainer, String candidate, String canon,
                                      NamingPolicy policy) {
        ParsedSource candidateParsed = PARSER.parse(candidate);
        ParsedSource canonParsed     = PARSER.parse(canon);
        assertNotNull(candidateParsed, "candidate fixture must parse");
        assertNotNull(canonParsed, "canon fixture must parse");

        PropertySet candidateProps = EXTRACTOR.extract(candidateParsed);
        PropertySet canonProps     = EXTRACTOR.extract(canonParsed);
        ExplanationContext context = new ExplanationContext(candidateParsed, canonParsed, policy);
        return explainer.explain(candidateProps.get(explainer.getPropertyKind()),
                canonProps.get(explainer.getPropertyKind()), context);
    }
}
