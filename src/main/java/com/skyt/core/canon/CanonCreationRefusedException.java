package com.skyt.core.canon;

/**
 * Anchoring was refused and nothing was written. Raised deliberately so an
 * incorrect reference never becomes canonical.
 */
public class CanonCreationRefusedException extends CanonStoreException {

    public enum Reason {
        ORACLE_FAILED,
        ORACLE_RESULT_MISSING,
        DUPLICATE,
        UNPARSABLE
    }

    private final String taskId;
    private final Reason reason;

    public CanonCreationRefusedException(String taskId, Reason reason, String message) {
        super("Canon creation refused for task '" + taskId + "' (" + reason + "): " + message);
        this.taskId = taskId;
        this.reason = reason;
    }

    public String getTaskId() { return taskId; }
    public Reason getReason() { return reason; }
}
