package com.skyt.core.explain;

import com.skyt.core.distance.PropertyDelta;
import com.skyt.core.property.PropertyKind;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * ExplainerRegistry: one explainer per property kind.
 *
 * Kinds without an explainer (recursion schema, numerical behavior, ...) never
 * produce a difference; their distance can only be closed by rewrites that
 * another explainer motivates, or by the template tier.
 */
@Component
public class ExplainerRegistry {

    private static final Logger log = LoggerFactory.getLogger(ExplainerRegistry.class);

    private final Map<PropertyKind, PropertyExplainer> explainers = new EnumMap<>(PropertyKind.class);

    public ExplainerRegistry(List<PropertyExplainer> explainers) {
        for (PropertyExplainer explainer : explainers) {
            PropertyExplainer previous = this.explainers.put(explainer.getPropertyKind(), explainer);
            if (previous != null) {
                throw new IllegalStateException("Two explainers for " + explainer.getPropertyKind().getKey()
                        + ": " + previous.getClass().getSimpleName() + ", "
                        + explainer.getClass().getSimpleName());
            }
        }
        log.info("[Explainers] Registered {} explainers: {}", this.explainers.size(), this.explainers.keySet());
    }

    /** The default set, for use outside a Spring context. */
    public static ExplainerRegistry defaults() {
        return new ExplainerRegistry(List.of(
                new StatementOrderingExplainer(),
                new LogicalEquivalenceExplainer(),
                new StructureIdiomExplainer(),
                new ControlFlowExplainer(),
                new StringLiteralExplainer(),
                new ParameterNamingExplainer(),
                new LocalNamingExplainer(),
                new BaseCaseExplainer()));
    }

    public PropertyExplainer explainerFor(PropertyKind kind) {
        return explainers.get(kind);
    }

    public Map<PropertyKind, PropertyExplainer> getExplainers() {
        return Collections.unmodifiableMap(explainers);
    }

    /**
     * Runs the matching explainer over every nonzero delta. Exceptions are not
     * caught here: a failing explainer aborts the caller's iteration.
     */
    public List<PropertyDifference> explainAll(List<PropertyDelta> deltas, ExplanationContext context) {
        List<PropertyDifference> differences = new ArrayList<>();
        for (PropertyDelta delta : deltas) {
            if (!delta.isNonZero()) continue;
            PropertyExplainer explainer = explainers.get(delta.getKind());
            if (explainer == null) continue;
            PropertyDifference difference =
                    explainer.explain(delta.getCandidateValue(), delta.getCanonValue(), context);
            if (difference != null) {
                log.debug("[Explainers] {} -> {}", delta.getKind().getKey(), difference);
                differences.add(difference);
            }
        }
        return differences;
    }
}
