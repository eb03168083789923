package com.skyt.core.explain;

import com.skyt.core.distance.DistanceCalculator;
import com.skyt.core.distance.DistanceReport;
import com.skyt.core.naming.NamingPolicy;
import com.skyt.core.parse.ParsedSource;
import com.skyt.core.property.PropertyKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.skyt.core.explain.ExplainerFixtures.EXTRACTOR;
import static com.skyt.core.explain.ExplainerFixtures.PARSER;
import static org.junit.jupiter.api.Assertions.*;

class ExplainerRegistryTest {

    @Test
    void testDefaultsCoverEightKinds() {
        ExplainerRegistry registry = ExplainerRegistry.defaults();

        assertEquals(8, registry.getExplainers().size());
        assertTrue(registry.explainerFor(PropertyKind.STATEMENT_ORDERING) instanceof StatementOrderingExplainer);
        assertNull(registry.explainerFor(PropertyKind.COMPLEXITY_CLASS));
    }

    @Test
    void testDuplicateKindRejected() {
        assertThrows(IllegalStateException.class, () -> new ExplainerRegistry(
                List.of(new StatementOrderingExplainer(), new StatementOrderingExplainer())));
    }

    @Test
    void testExplainAllOverDeltas() {
        ParsedSource candidate = PARSER.parse("int f(int n) { int r = n * 2; return r; }");
        ParsedSource canon = PARSER.parse("int f(int n) { return n * 2; }");
        DistanceReport report = new DistanceCalculator().report(
                EXTRACTOR.extract(candidate), EXTRACTOR.extract(canon), NamingPolicy.permissive());

        List<PropertyDifference> diffs = ExplainerRegistry.defaults().explainAll(report.getDeltas(),
                new ExplanationContext(candidate, canon, NamingPolicy.permissive()));

        assertTrue(diffs.stream().anyMatch(d -> d.getType() == DifferenceType.CONSECUTIVE_STATEMENTS_CONSOLIDATABLE));
        assertTrue(diffs.stream().allMatch(d -> d.getKind() == d.getType().getKind()));
    }
}
