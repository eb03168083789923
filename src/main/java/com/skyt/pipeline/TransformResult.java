package com.skyt.pipeline;

import java.util.List;

/**
 * What {@link TransformationPipeline#transform} hands back. Never null and
 * never thrown past: failures show up as {@link PipelineState#ABORTED} with
 * the original candidate.
 */
public final class TransformResult {

    private final String               transformed;
    private final boolean              success;
    private final int                  iterationsUsed;
    private final List<String>         appliedStrategyNames;
    private final PipelineState        outcome;
    private final double               initialDistance;
    private final double               finalDistance;
    private final List<RewriteAttempt> attempts;
    private final String               reason;

    TransformResult(String transformed, boolean success, int iterationsUsed, List<String> appliedStrategyNames,
                    PipelineState outcome, double initialDistance, double finalDistance,
                    List<RewriteAttempt> attempts, String reason) {
        this.transformed          = transformed;
        this.success              = success;
        this.iterationsUsed       = iterationsUsed;
        this.appliedStrategyNames = List.copyOf(appliedStrategyNames);
        this.outcome              = outcome;
        this.initialDistance      = initialDistance;
        this.finalDistance        = finalDistance;
        this.attempts             = List.copyOf(attempts);
        this.reason               = reason != null ? reason : "";
    }

    public String               getTransformed()          { return transformed; }
    public boolean              isSuccess()               { return success; }
    /** Iterations that went past the convergence check; zero for a candidate already equal to the canon. */
    public int                  getIterationsUsed()       { return iterationsUsed; }
    public List<String>         getAppliedStrategyNames() { return appliedStrategyNames; }
    public PipelineState        getOutcome()              { return outcome; }
    public double               getInitialDistance()      { return initialDistance; }
    public double               getFinalDistance()        { return finalDistance; }
    public List<RewriteAttempt> getAttempts()             { return attempts; }
    /** Why the run stopped. */
    public String               getReason()               { return reason; }

    @Override
    public String toString() {
        return String.format("TransformResult{%s, success=%b, iterations=%d, applied=%s, distance %.4f → %.4f}",
                outcome, success, iterationsUsed, appliedStrategyNames, initialDistance, finalDistance);
    }
}
