package com.skyt.core.canon;

/** No canon has been anchored for the requested task. */
public class CanonMissingException extends CanonStoreException {

    private final String taskId;

    public CanonMissingException(String taskId) {
        super("No canon anchored for task '" + taskId + "'");
        this.taskId = taskId;
    }

    public String getTaskId() { return taskId; }
}
