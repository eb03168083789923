package com.skyt.core.strategy;

import com.skyt.core.explain.DifferenceType;
import com.skyt.core.parse.SourceParser;
import com.skyt.core.property.PropertyKind;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Explainable strategies indexed by property kind. The oracle-guided template
 * tier is deliberately not registered here.
 */
@Component
public class StrategyRegistry {

    private static final Logger log = LoggerFactory.getLogger(StrategyRegistry.class);

    private final Map<PropertyKind, List<TransformationStrategy>> byKind = new EnumMap<>(PropertyKind.class);
    private final List<TransformationStrategy> strategies;

    public StrategyRegistry(List<TransformationStrategy> strategies) {
        List<TransformationStrategy> sorted = new ArrayList<>(strategies);
        sorted.sort(Comparator.comparing(TransformationStrategy::getName));
        this.strategies = Collections.unmodifiableList(sorted);
        for (TransformationStrategy strategy : sorted) {
            byKind.computeIfAbsent(strategy.getPropertyKind(), k -> new ArrayList<>()).add(strategy);
        }
        log.info("[Strategies] Registered {} strategies: {}", sorted.size(),
                sorted.stream().map(TransformationStrategy::getName).toList());
    }

    /** The full built-in set, for use without a Spring context. */
    public static StrategyRegistry defaults(SourceParser parser) {
        return new StrategyRegistry(List.of(
                new StatementConsolidationStrategy(parser),
                new EmptinessCheckStrategy(parser),
                new BooleanSimplificationStrategy(parser),
                new StreamCollectStrategy(parser),
                new StringJoinStrategy(parser),
                new TernaryStrategy(parser),
                new RegexLiteralStrategy(parser),
                new ParameterRenameStrategy(parser),
                new LocalRenameStrategy(parser),
                new BaseCaseAlignmentStrategy(parser)
        ));
    }

    /** Strategies of the type's property kind that accept the type, in name order. */
    public List<TransformationStrategy> strategiesFor(DifferenceType type) {
        List<TransformationStrategy> matching = new ArrayList<>();
        for (TransformationStrategy strategy : byKind.getOrDefault(type.getKind(), List.of())) {
            if (strategy.canHandle(type)) matching.add(strategy);
        }
        return matching;
    }

    public List<TransformationStrategy> getStrategies() {
        return strategies;
    }
}
