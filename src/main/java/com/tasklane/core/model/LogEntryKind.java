package com.tasklane.core.model;

/**
 * Closed set of execution log entry kinds.
 */
public enum LogEntryKind {
    SPAWNED,
    RESUMED,
    ACTION,
    FILE_CHANGE,
    CHECKPOINT,
    ERROR,
    INTERRUPTED,
    COMPLETED,
    FAILED,
    CANCELLED
}
