package com.tasklane.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tasklane.core.model.Effort;
import com.tasklane.core.model.FileImpact;
import com.tasklane.core.model.FileOperation;
import com.tasklane.core.model.Task;
import com.tasklane.core.model.TaskList;
import com.tasklane.core.model.TaskListProgress;
import com.tasklane.core.model.TaskListStatus;
import com.tasklane.core.model.TaskStatus;

import java.time.Instant;
import java.util.List;

/**
 * Inbound JSON body for POST /api/v1/task-lists, also the format of task list files read by the CLI.
 *
 * @param id                   unique list identifier
 * @param name                 display name; nullable, defaults to the id
 * @param maxParallelWorkers   per-list worker cap; nullable, defaults to 3
 * @param tasks                member tasks in position order
 */
public record TaskListRequest(
    String id,
    String name,
    @JsonProperty("max_parallel_workers") Integer maxParallelWorkers,
    List<TaskRequest> tasks
) {

    static final int DEFAULT_MAX_PARALLEL_WORKERS = 3;

    public record TaskRequest(
        String id,
        String title,
        String description,
        @JsonProperty("file_impacts") List<FileImpactRequest> fileImpacts,
        @JsonProperty("depends_on") List<String> dependsOn,
        @JsonProperty("conflicts_with") List<String> conflictsWith,
        List<String> checks,
        @JsonProperty("quick_win") boolean quickWin,
        Instant deadline,
        String effort
    ) {}

    public record FileImpactRequest(String path, String operation, Double confidence) {}

    public TaskList toTaskList() {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Task list id is required");
        }
        int workers = maxParallelWorkers != null ? maxParallelWorkers : DEFAULT_MAX_PARALLEL_WORKERS;
        var taskIds = tasks().stream().map(TaskRequest::id).toList();
        return new TaskList(id, name != null ? name : id, TaskListStatus.DRAFT, false, workers,
                taskIds, TaskListProgress.empty(taskIds.size()), null);
    }

    public List<Task> toTasks() {
        return tasks().stream().map(TaskListRequest::toTask).toList();
    }

    @Override
    public List<TaskRequest> tasks() {
        return tasks != null ? tasks : List.of();
    }

    private static Task toTask(TaskRequest t) {
        if (t.id() == null || t.id().isBlank()) {
            throw new IllegalArgumentException("Every task needs an id");
        }
        var impacts = t.fileImpacts() == null ? List.<FileImpact>of() : t.fileImpacts().stream()
                .map(f -> new FileImpact(f.path(), parseOperation(f.operation()),
                        f.confidence() != null ? f.confidence() : 1.0))
                .toList();
        Effort effort = t.effort() != null ? Effort.valueOf(t.effort().toUpperCase()) : Effort.MEDIUM;
        return new Task(t.id(), t.title() != null ? t.title() : t.id(), t.description(), TaskStatus.DRAFT,
                impacts, t.dependsOn(), t.conflictsWith(), t.checks(), t.quickWin(), t.deadline(), effort, null);
    }

    private static FileOperation parseOperation(String operation) {
        if (operation == null) {
            throw new IllegalArgumentException("File impact operation is required");
        }
        return FileOperation.valueOf(operation.toUpperCase());
    }
}
