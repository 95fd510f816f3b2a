package com.tasklane.core.model;

/**
 * Why a worker reported failure.
 */
public enum FailureReason {
    /** Missed heartbeats or wall-clock budget exceeded. */
    TIMEOUT,
    /** The task itself failed with a specific error. */
    ERROR,
    /** The worker could not be started or crashed outside the task. */
    INFRASTRUCTURE
}
