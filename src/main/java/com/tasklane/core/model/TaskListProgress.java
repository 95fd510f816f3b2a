package com.tasklane.core.model;

import java.io.Serializable;

/**
 * Aggregate progress counters for a task list.
 */
public record TaskListProgress(
    int total,
    int completed,
    int failed,
    int blocked
) implements Serializable {

    public static TaskListProgress empty(int total) {
        return new TaskListProgress(total, 0, 0, 0);
    }

    public int percentComplete() {
        return total == 0 ? 100 : (completed * 100) / total;
    }
}
