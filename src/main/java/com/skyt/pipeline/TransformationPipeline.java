package com.skyt.pipeline;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.skyt.core.canon.CanonRecord;
import com.skyt.core.distance.DistanceCalculator;
import com.skyt.core.distance.DistanceReport;
import com.skyt.core.explain.ExplainerRegistry;
import com.skyt.core.explain.ExplanationContext;
import com.skyt.core.explain.PropertyDifference;
import com.skyt.core.extract.PropertyExtractor;
import com.skyt.core.naming.NamingPolicy;
import com.skyt.core.oracle.Contract;
import com.skyt.core.oracle.Oracle;
import com.skyt.core.parse.ParsedSource;
import com.skyt.core.parse.SourceParser;
import com.skyt.core.property.PropertySet;
import com.skyt.core.strategy.OracleGuidedTemplateStrategy;
import com.skyt.core.strategy.StrategyRegistry;
import com.skyt.core.strategy.TransformationStrategy;
import com.skyt.core.validate.ValidationContext;
import com.skyt.core.validate.ValidationGate;
import com.skyt.core.validate.ValidationResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * TransformationPipeline: the extract → explain → rewrite → validate loop
 * that moves a candidate toward its canon.
 *
 * Each iteration explains every nonzero property delta, tries the strategies
 * for each explained difference (most severe first) and keeps the first
 * rewrite per difference that passes the {@link ValidationGate}. Several
 * differences can be fixed in one iteration. The loop stops when the
 * distance reaches zero, when an iteration accepts nothing, when the budget
 * is spent, or when a candidate repeats.
 *
 * Nothing escapes {@link #transform}: parse and explanation failures end the
 * run as ABORTED with the original text, strategy exceptions are logged and
 * skipped.
 */
@Service
public class TransformationPipeline {

    private static final Logger log = LoggerFactory.getLogger(TransformationPipeline.class);

    private final SourceParser                 parser;
    private final PropertyExtractor            extractor;
    private final DistanceCalculator           calculator;
    private final ExplainerRegistry            explainers;
    private final StrategyRegistry             strategies;
    private final OracleGuidedTemplateStrategy templateStrategy;
    private final ValidationGate               gate;
    private final PipelineSettings             settings;
    private final Oracle                       oracle;
    private final ObjectMapper                 objectMapper = new ObjectMapper();

    public TransformationPipeline(
            SourceParser                 parser,
            PropertyExtractor            extractor,
            DistanceCalculator           calculator,
            ExplainerRegistry            explainers,
            StrategyRegistry             strategies,
            OracleGuidedTemplateStrategy templateStrategy,
            ValidationGate               gate,
            PipelineSettings             settings,
            @Nullable Oracle             oracle
    ) {
        this.parser           = parser;
        this.extractor        = extractor;
        this.calculator       = calculator;
        this.explainers       = explainers;
        this.strategies       = strategies;
        this.templateStrategy = templateStrategy;
        this.gate             = gate;
        this.settings         = settings;
        this.oracle           = oracle;
    }

    // =========================================================================
    // MAIN ENTRY POINTS
    // =========================================================================

    /**
     * Transforms {@code candidate} toward {@code canon}.
     *
     * @param contract  optional; with an oracle it enables oracle-backed validation and the template tier
     * @param options   per-call overrides, or null for the configured defaults
     */
    public TransformResult transform(String candidate, String canon, Contract contract, TransformOptions options) {
        return run(candidate, canon, null, null, null, contract, options);
    }

    /** Transforms toward an anchored canon, using its stored snapshot and naming policy. */
    public TransformResult transform(String candidate, CanonRecord canon, Contract contract, TransformOptions options) {
        PropertySet snapshot = canon.getAnalysisMode() == extractor.getMode()
                ? canon.getProperties()
                : extractor.extract(canon.getSource());
        return run(candidate, canon.getSource(), snapshot, canon.isOracleValidated(),
                canon.getNamingPolicy(), contract, options);
    }

    public TransformResult transform(String candidate, String canon) {
        return transform(candidate, canon, null, null);
    }

    // =========================================================================
    // Loop
    // =========================================================================

    private TransformResult run(String candidate, String canonSource, PropertySet canonSnapshot,
                                Boolean canonValidated, NamingPolicy recordPolicy,
                                Contract contract, TransformOptions options) {
        long startTime = System.currentTimeMillis();
        TransformOptions opts = options != null ? options : TransformOptions.defaults();
        int maxIterations = opts.getMaxIterations() != null ? opts.getMaxIterations() : settings.getMaxIterations();
        boolean templateEnabled = opts.getTemplateTierEnabled() != null
                ? opts.getTemplateTierEnabled() : settings.isTemplateTierEnabled();
        NamingPolicy policy = resolvePolicy(opts, contract, recordPolicy);

        PipelineRunState run = new PipelineRunState(candidate);
        run.enter(PipelineState.EXTRACTING_PROPERTIES);

        ParsedSource canonParsed = parser.parse(canonSource);
        PropertySet canonProperties = canonSnapshot != null ? canonSnapshot : extractor.extract(canonParsed);
        if (canonParsed == null || canonProperties.isNullFilled()) {
            log.warn("[Pipeline] Canon does not parse; aborting");
            return finish(run, PipelineState.ABORTED, "Canon does not parse", startTime);
        }

        ValidationContext validation = new ValidationContext(
                canonProperties, policy, contract, oracle, settings.getOracleTimeoutMillis());

        while (true) {
            run.enter(PipelineState.EXTRACTING_PROPERTIES);
            ParsedSource current = parser.parse(run.getCurrent());
            PropertySet properties = extractor.extract(current);
            if (current == null || properties.isNullFilled()) {
                run.recordDistance(1.0);
                log.warn("[Pipeline] Candidate does not parse; returning it unchanged");
                return finish(run, PipelineState.ABORTED, "Candidate does not parse", startTime);
            }

            DistanceReport report = calculator.report(properties, canonProperties, policy);
            run.recordDistance(report.getDistance());
            if (report.isIdentical()) {
                return finish(run, PipelineState.CONVERGED, "Distance is zero", startTime);
            }
            if (run.getIterations() >= maxIterations) {
                return finish(run, PipelineState.EXHAUSTED,
                        "Iteration budget of " + maxIterations + " spent", startTime);
            }
            run.incrementIterations();

            run.enter(PipelineState.EXPLAINING_DIFFERENCES);
            List<PropertyDifference> differences;
            try {
                differences = explainers.explainAll(report.nonZeroDeltas(),
                        new ExplanationContext(current, canonParsed, policy));
            } catch (RuntimeException e) {
                log.error("[Pipeline] Explanation failed; returning candidate unchanged", e);
                return finish(run, PipelineState.ABORTED, "Explanation failed: " + e, startTime);
            }

            boolean accepted;
            if (differences.isEmpty()) {
                if (!templateEligible(run, validation, report, templateEnabled, canonValidated, canonSource)) {
                    return finish(run, PipelineState.EXHAUSTED, "No explainable difference", startTime);
                }
                accepted = applyTemplate(run, validation, canonSource);
            } else {
                accepted = applyStrategies(run, validation, differences);
            }

            if (!accepted) {
                return finish(run, PipelineState.EXHAUSTED,
                        "No rewrite accepted in iteration " + run.getIterations(), startTime);
            }
            if (!run.markVisited()) {
                return finish(run, PipelineState.EXHAUSTED, "Candidate repeated an earlier state", startTime);
            }
        }
    }

    private boolean applyStrategies(PipelineRunState run, ValidationContext validation,
                                    List<PropertyDifference> differences) {
        run.enter(PipelineState.SELECTING_STRATEGIES);
        List<PropertyDifference> ordered = new ArrayList<>(differences);
        ordered.sort(Comparator.comparingDouble(PropertyDifference::getSeverity).reversed());

        boolean acceptedAny = false;
        for (PropertyDifference difference : ordered) {
            for (TransformationStrategy strategy : strategies.strategiesFor(difference.getType())) {
                run.enter(PipelineState.APPLYING_STRATEGY);
                String before = run.getCurrent();
                String rewrite;
                try {
                    rewrite = strategy.generate(difference, before);
                } catch (RuntimeException e) {
                    log.warn("[Pipeline] Strategy {} failed on {}: {}",
                            strategy.getName(), difference.getType().tag(), e.toString());
                    run.strategyError(strategy.getName(), difference.getType(), e.toString());
                    continue;
                }
                if (rewrite == null || rewrite.equals(before)) {
                    run.noRewrite(strategy.getName(), difference.getType());
                    continue;
                }

                run.enter(PipelineState.VALIDATING);
                ValidationResult result = gate.validate(before, rewrite, validation, false);
                if (result.isAccepted()) {
                    log.info("[Pipeline] Iteration {}: {} accepted for {} (distance {})",
                            run.getIterations(), strategy.getName(), difference.getType().tag(),
                            String.format("%.4f", result.getDistanceAfter()));
                    run.accept(rewrite, strategy.getName(), difference.getType(),
                            result.getDistanceAfter(), result.getDetail());
                    acceptedAny = true;
                    break;
                }
                log.debug("[Pipeline] Iteration {}: {} rejected: {}",
                        run.getIterations(), strategy.getName(), result);
                run.reject(strategy.getName(), difference.getType(), result.getReason(), result.getDetail());
            }
        }
        return acceptedAny;
    }

    // =========================================================================
    // Template tier
    // =========================================================================

    private boolean templateEligible(PipelineRunState run, ValidationContext validation, DistanceReport report,
                                     boolean enabled, Boolean canonValidated, String canonSource) {
        if (!enabled || report.getDistance() <= settings.getTemplateDistanceThreshold() || !validation.hasOracle()) {
            return false;
        }
        boolean canonPasses = canonValidated != null
                ? canonValidated
                : validation.oracleResultFor(canonSource).isPassed();
        if (!canonPasses) {
            log.debug("[Pipeline] Template tier skipped: canon is not oracle-validated");
            return false;
        }
        if (!validation.oracleResultFor(run.getCurrent()).isPassed()) {
            log.debug("[Pipeline] Template tier skipped: candidate fails the oracle");
            return false;
        }
        return true;
    }

    private boolean applyTemplate(PipelineRunState run, ValidationContext validation, String canonSource) {
        run.enter(PipelineState.APPLYING_STRATEGY);
        String before = run.getCurrent();
        String rewrite;
        try {
            rewrite = templateStrategy.generate(before, canonSource);
        } catch (RuntimeException e) {
            log.warn("[Pipeline] Template tier failed: {}", e.toString());
            run.strategyError(templateStrategy.getName(), null, e.toString());
            return false;
        }
        if (rewrite == null || rewrite.equals(before)) {
            run.noRewrite(templateStrategy.getName(), null);
            return false;
        }

        run.enter(PipelineState.VALIDATING);
        ValidationResult result = gate.validate(before, rewrite, validation, true);
        if (!result.isAccepted()) {
            run.reject(templateStrategy.getName(), null, result.getReason(), result.getDetail());
            return false;
        }
        log.info("[Pipeline] Iteration {}: template tier accepted (distance {})",
                run.getIterations(), String.format("%.4f", result.getDistanceAfter()));
        run.accept(rewrite, templateStrategy.getName(), null, result.getDistanceAfter(), result.getDetail());
        return true;
    }

    // =========================================================================
    // Result assembly
    // =========================================================================

    private TransformResult finish(PipelineRunState run, PipelineState outcome, String reason, long startTime) {
        run.enter(outcome);
        boolean aborted = outcome == PipelineState.ABORTED;

        String       transformed = aborted ? run.getOriginal() : run.getCurrent();
        List<String> applied     = aborted ? List.of() : run.getApplied();
        boolean      success     = outcome == PipelineState.CONVERGED || !applied.isEmpty();
        double       initial     = Double.isNaN(run.getInitialDistance()) ? 1.0 : run.getInitialDistance();
        double       last        = Double.isNaN(run.getCurrentDistance()) ? 1.0 : run.getCurrentDistance();
        double       finalDist   = aborted ? initial : last;

        TransformResult result = new TransformResult(transformed, success, run.getIterations(), applied,
                outcome, initial, finalDist, run.getAttempts(), reason);
        logSummary(result, System.currentTimeMillis() - startTime);
        return result;
    }

    private void logSummary(TransformResult result, long wallMillis) {
        ObjectNode json = objectMapper.createObjectNode();
        json.put("outcome", result.getOutcome().name());
        json.put("success", result.isSuccess());
        json.put("iterations", result.getIterationsUsed());
        json.put("initial_distance", round(result.getInitialDistance()));
        json.put("final_distance", round(result.getFinalDistance()));
        ArrayNode applied = json.putArray("applied");
        result.getAppliedStrategyNames().forEach(applied::add);
        json.put("attempts", result.getAttempts().size());
        json.put("reason", result.getReason());
        json.put("wall_ms", wallMillis);
        log.info("[Pipeline] {}", json);
    }

    private static double round(double value) {
        return Math.round(value * 10_000d) / 10_000d;
    }

    private static NamingPolicy resolvePolicy(TransformOptions options, Contract contract, NamingPolicy recordPolicy) {
        if (options.getNamingPolicy() != null) return options.getNamingPolicy();
        if (contract != null && contract.getNamingPolicy() != null) return contract.getNamingPolicy();
        if (recordPolicy != null) return recordPolicy;
        return NamingPolicy.permissive();
    }
}
