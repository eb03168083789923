package com.skyt.pipeline;

/**
 * States of one transform call.
 *
 * IDLE → EXTRACTING_PROPERTIES → EXPLAINING_DIFFERENCES → SELECTING_STRATEGIES
 *      → APPLYING_STRATEGY ⇄ VALIDATING → (next iteration) EXTRACTING_PROPERTIES
 *
 * Terminal states:
 *   CONVERGED  distance to the canon reached zero.
 *   EXHAUSTED  the iteration budget was spent, nothing was explainable, no
 *              rewrite was accepted in a full iteration, or a previously seen
 *              candidate came back.
 *   ABORTED    extraction or explanation itself failed; the original
 *              candidate is returned unchanged.
 */
public enum PipelineState {
    IDLE,
    EXTRACTING_PROPERTIES,
    EXPLAINING_DIFFERENCES,
    SELECTING_STRATEGIES,
    APPLYING_STRATEGY,
    VALIDATING,
    CONVERGED,
    EXHAUSTED,
    ABORTED;

    public boolean isTerminal() {
        return this == CONVERGED || this == EXHAUSTED || this == ABORTED;
    }
}
