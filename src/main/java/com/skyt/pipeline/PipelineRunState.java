package com.skyt.pipeline;

import com.skyt.core.explain.DifferenceType;
import com.skyt.core.validate.RejectionReason;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Mutable bookkeeping for a single transform call. Created per call and
 * never shared, so concurrent calls do not interact.
 */
final class PipelineRunState {

    private static final Logger log = LoggerFactory.getLogger(PipelineRunState.class);

    private final String               original;
    private final List<String>         applied  = new ArrayList<>();
    private final List<RewriteAttempt> attempts = new ArrayList<>();
    private final Set<String>          visited  = new HashSet<>();

    private String        current;
    private PipelineState state           = PipelineState.IDLE;
    private int           iterations      = 0;
    private double        initialDistance = Double.NaN;
    private double        currentDistance = Double.NaN;

    PipelineRunState(String original) {
        this.original = original;
        this.current  = original;
        visited.add(original);
    }

    // =========================================================================
    // State machine
    // =========================================================================

    void enter(PipelineState next) {
        if (state.isTerminal()) {
            throw new IllegalStateException("Run already finished in " + state);
        }
        if (next != state) {
            log.trace("[Pipeline] {} → {}", state, next);
        }
        state = next;
    }

    PipelineState getState() { return state; }

    // =========================================================================
    // Candidate
    // =========================================================================

    String getOriginal() { return original; }
    String getCurrent()  { return current; }

    void accept(String rewrite, String strategyName, DifferenceType type, double distanceAfter, String detail) {
        current         = rewrite;
        currentDistance = distanceAfter;
        applied.add(strategyName);
        attempts.add(new RewriteAttempt(iterations, strategyName, type, RewriteAttempt.Outcome.ACCEPTED, null, detail));
    }

    void reject(String strategyName, DifferenceType type, RejectionReason reason, String detail) {
        attempts.add(new RewriteAttempt(iterations, strategyName, type, RewriteAttempt.Outcome.REJECTED, reason, detail));
    }

    void noRewrite(String strategyName, DifferenceType type) {
        attempts.add(new RewriteAttempt(iterations, strategyName, type, RewriteAttempt.Outcome.NO_REWRITE, null, null));
    }

    void strategyError(String strategyName, DifferenceType type, String detail) {
        attempts.add(new RewriteAttempt(iterations, strategyName, type,
                RewriteAttempt.Outcome.STRATEGY_ERROR, null, detail));
    }

    /** False when the current candidate was already seen earlier in this run. */
    boolean markVisited() {
        return visited.add(current);
    }

    // =========================================================================
    // Counters
    // =========================================================================

    int  getIterations()      { return iterations; }
    void incrementIterations() { iterations++; }

    void recordDistance(double distance) {
        if (Double.isNaN(initialDistance)) initialDistance = distance;
        currentDistance = distance;
    }

    double getInitialDistance() { return initialDistance; }
    double getCurrentDistance() { return currentDistance; }

    List<String>         getApplied()  { return applied; }
    List<RewriteAttempt> getAttempts() { return attempts; }
}
