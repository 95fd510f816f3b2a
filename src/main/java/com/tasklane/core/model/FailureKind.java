package com.tasklane.core.model;

/**
 * Task-level failure categories reported in a run summary.
 */
public enum FailureKind {
    WORKER_TIMEOUT,
    WORKER_FAILURE,
    NO_PROGRESS,
    DEPENDENCY_FAILED,
    UNRESOLVED_DEPENDENCY,
    CANCELLED
}
