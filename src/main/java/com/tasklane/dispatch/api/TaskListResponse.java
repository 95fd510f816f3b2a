package com.tasklane.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tasklane.core.model.Task;
import com.tasklane.core.model.TaskList;
import com.tasklane.core.model.TaskListProgress;

import java.time.Instant;
import java.util.List;

/**
 * JSON response for task list endpoints.
 */
public record TaskListResponse(
    String id,
    String name,
    String status,
    boolean approved,
    @JsonProperty("max_parallel_workers") int maxParallelWorkers,
    TaskListProgress progress,
    @JsonProperty("updated_at") Instant updatedAt,
    List<TaskResponse> tasks
) {

    public record TaskResponse(
        String id,
        String title,
        String status,
        @JsonProperty("depends_on") List<String> dependsOn,
        @JsonProperty("assigned_worker") String assignedWorker
    ) {}

    static TaskListResponse of(TaskList list, List<Task> tasks) {
        var taskResponses = tasks.stream()
                .map(t -> new TaskResponse(t.id(), t.title(), t.status().name(), t.dependsOn(), t.assignedWorkerId()))
                .toList();
        return new TaskListResponse(list.id(), list.name(), list.status().name(), list.approved(),
                list.maxParallelWorkers(), list.progress(), list.updatedAt(), taskResponses);
    }
}
