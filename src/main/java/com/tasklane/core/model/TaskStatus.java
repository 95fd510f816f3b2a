package com.tasklane.core.model;

/**
 * Status of an individual task.
 */
public enum TaskStatus {
    DRAFT,
    PENDING,
    IN_PROGRESS,
    VALIDATING,
    COMPLETED,
    FAILED,
    BLOCKED,
    CANCELLED,
    SKIPPED,
    SUPERSEDED;

    /** Dependencies on a task in one of these states are satisfied. */
    public boolean isTerminalSuccess() {
        return this == COMPLETED || this == SKIPPED;
    }

    /** Tasks in these states are not planned into waves. */
    public boolean isSettled() {
        return this == COMPLETED || this == SKIPPED || this == SUPERSEDED;
    }
}
