package com.skyt.core.strategy;

import com.skyt.core.explain.DifferenceType;
import com.skyt.core.explain.PropertyDifference;
import com.skyt.core.explain.TransformationHints;
import com.skyt.core.parse.ParsedSource;
import com.skyt.core.parse.SourceParser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

final class StrategyFixtures {

    static final SourceParser PARSER = new SourceParser();

    private StrategyFixtures() {}

    static PropertyDifference difference(DifferenceType type, TransformationHints hints) {
        return PropertyDifference.builder(type).explanation("fixture").hints(hints).build();
    }

    /** Compares modulo formatting by printing both through the parser. */
    static void assertSameCode(String expected, String actual) {
        assertNotNull(actual, "strategy produced no rewrite");
        ParsedSource want = PARSER.parse(expected);
        ParsedSource got  = PARSER.parse(actual);
        assertNotNull(got, "rewrite does not parse: " + actual);
        assertEquals(want.print(), got.print());
    }
}
