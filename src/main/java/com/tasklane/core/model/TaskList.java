package com.tasklane.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * An ordered, approved collection of tasks executed together.
 *
 * @param id                 unique identifier
 * @param name               display name
 * @param status             list-level status
 * @param approved           approval toggle set by the planning collaborator
 * @param maxParallelWorkers cap on concurrently running workers for this list
 * @param taskIds            member task IDs in position order
 * @param progress           aggregate counters refreshed after every wave
 * @param updatedAt          last status or progress change
 */
public record TaskList(
    String id,
    String name,
    TaskListStatus status,
    boolean approved,
    int maxParallelWorkers,
    List<String> taskIds,
    TaskListProgress progress,
    Instant updatedAt
) implements Serializable {

    public TaskList {
        taskIds = taskIds != null ? List.copyOf(taskIds) : List.of();
        progress = progress != null ? progress : TaskListProgress.empty(taskIds.size());
        if (maxParallelWorkers < 1) {
            throw new IllegalArgumentException("maxParallelWorkers must be at least 1, got " + maxParallelWorkers);
        }
    }

    public TaskList withStatus(TaskListStatus newStatus, Instant at) {
        return new TaskList(id, name, newStatus, approved, maxParallelWorkers, taskIds, progress, at);
    }

    public TaskList withProgress(TaskListProgress newProgress, Instant at) {
        return new TaskList(id, name, status, approved, maxParallelWorkers, taskIds, newProgress, at);
    }

    public TaskList withApproved(boolean value, Instant at) {
        return new TaskList(id, name, status, value, maxParallelWorkers, taskIds, progress, at);
    }
}
