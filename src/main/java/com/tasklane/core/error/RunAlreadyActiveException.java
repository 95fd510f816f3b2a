package com.tasklane.core.error;

/**
 * Thrown when a list already has a RUNNING (or PAUSED) run.
 */
public class RunAlreadyActiveException extends TasklaneException {

    private final String activeRunId;

    public RunAlreadyActiveException(String taskListId, String activeRunId) {
        super("Task list " + taskListId + " already has active run " + activeRunId);
        this.activeRunId = activeRunId;
    }

    public String activeRunId() {
        return activeRunId;
    }
}
