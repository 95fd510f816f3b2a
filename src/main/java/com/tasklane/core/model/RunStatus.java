package com.tasklane.core.model;

/**
 * Status of one execution run. At most one run per task list is RUNNING.
 */
public enum RunStatus {
    RUNNING,
    PAUSED,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
