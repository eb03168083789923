package com.skyt.core.strategy;

import com.skyt.core.explain.DifferenceType;
import com.skyt.core.explain.PropertyDifference;
import com.skyt.core.explain.TransformationHints;
import com.skyt.core.parse.ParsedSource;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static com.skyt.core.strategy.StrategyFixtures.PARSER;
import static org.junit.jupiter.api.Assertions.*;

class StrategyRegistryTest {

    private final StrategyRegistry registry = StrategyRegistry.defaults(PARSER);

    @Test
    void testEveryDifferenceTypeHasAStrategy() {
        for (DifferenceType type : DifferenceType.values()) {
            List<TransformationStrategy> strategies = registry.strategiesFor(type);
            assertFalse(strategies.isEmpty(), "no strategy for " + type);
            strategies.forEach(s -> assertEquals(type.getKind(), s.getPropertyKind()));
        }
    }

    @Test
    void testStrategiesSortedByName() {
        List<String> names = registry.getStrategies().stream()
                .map(TransformationStrategy::getName)
                .collect(Collectors.toList());

        assertEquals(10, names.size());
        assertEquals(names.stream().sorted().collect(Collectors.toList()), names);
        assertFalse(names.contains(OracleGuidedTemplateStrategy.NAME));
    }

    @Test
    void testStructureKindSharedByTwoStrategies() {
        assertEquals(List.of("stream-collect"), registry.strategiesFor(DifferenceType.LOOP_VS_STREAM).stream()
                .map(TransformationStrategy::getName).collect(Collectors.toList()));
        assertEquals(List.of("string-join"), registry.strategiesFor(DifferenceType.STRING_BUILDING_IDIOM).stream()
                .map(TransformationStrategy::getName).collect(Collectors.toList()));
    }

    @Test
    void testMixedKindsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new AbstractAstStrategy("mixed", PARSER,
                DifferenceType.EMPTY_CHECK_FORM, DifferenceType.LOOP_VS_STREAM) {
            @Override
            protected boolean rewrite(ParsedSource parsed, TransformationHints hints,
                                      PropertyDifference difference) {
                return false;
            }
        });
    }
}
