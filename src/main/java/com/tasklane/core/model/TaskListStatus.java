package com.tasklane.core.model;

/**
 * Lifecycle of a task list as observed by clients.
 */
public enum TaskListStatus {
    DRAFT,
    READY,
    IN_PROGRESS,
    PAUSED,
    COMPLETED,
    FAILED,
    ARCHIVED
}
