package com.skyt.pipeline;

import com.skyt.core.explain.DifferenceType;
import com.skyt.core.validate.RejectionReason;

/** One strategy invocation within a transform call and what became of it. */
public final class RewriteAttempt {

    public enum Outcome {
        /** Rewrite passed every gate and became the current candidate. */
        ACCEPTED,
        /** Rewrite failed a gate and was rolled back. */
        REJECTED,
        /** Strategy found nothing to rewrite. */
        NO_REWRITE,
        /** Strategy threw; the candidate was left untouched. */
        STRATEGY_ERROR
    }

    private final int             iteration;
    private final String          strategyName;
    /** Null for the template tier, which does not answer a specific difference. */
    private final DifferenceType  differenceType;
    private final Outcome         outcome;
    private final RejectionReason rejectionReason;
    private final String          detail;

    public RewriteAttempt(int iteration, String strategyName, DifferenceType differenceType,
                          Outcome outcome, RejectionReason rejectionReason, String detail) {
        this.iteration       = iteration;
        this.strategyName    = strategyName;
        this.differenceType  = differenceType;
        this.outcome         = outcome;
        this.rejectionReason = rejectionReason;
        this.detail          = detail != null ? detail : "";
    }

    public int             getIteration()       { return iteration; }
    public String          getStrategyName()    { return strategyName; }
    public DifferenceType  getDifferenceType()  { return differenceType; }
    public Outcome         getOutcome()         { return outcome; }
    public RejectionReason getRejectionReason() { return rejectionReason; }
    public String          getDetail()          { return detail; }
    public boolean         isAccepted()         { return outcome == Outcome.ACCEPTED; }

    @Override
    public String toString() {
        String type = differenceType == null ? "template" : differenceType.tag();
        String reason = rejectionReason == null ? "" : " " + rejectionReason;
        return "RewriteAttempt{#" + iteration + " " + strategyName + " [" + type + "] " + outcome + reason + "}";
    }
}
