package com.tasklane.core.model;

/**
 * Worker instance lifecycle: SPAWNING -> IDLE -> RUNNING -> COMPLETING -> TERMINATED,
 * with a direct jump to TERMINATED on timeout or cancellation.
 */
public enum WorkerStatus {
    SPAWNING,
    IDLE,
    RUNNING,
    COMPLETING,
    TERMINATED;

    public boolean canTransitionTo(WorkerStatus next) {
        return switch (this) {
            case SPAWNING -> next == IDLE || next == TERMINATED;
            case IDLE -> next == RUNNING || next == TERMINATED;
            case RUNNING -> next == COMPLETING || next == TERMINATED;
            case COMPLETING -> next == TERMINATED;
            case TERMINATED -> false;
        };
    }
}
