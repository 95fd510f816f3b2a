package com.tasklane.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Structured outcome of a run: which waves finished, which tasks failed or were blocked and why.
 */
public record RunSummary(
    String runId,
    String taskListId,
    int runNumber,
    RunStatus status,
    List<Integer> completedWaves,
    List<String> completedTaskIds,
    List<TaskFailure> failures,
    String failureReason
) implements Serializable {

    public RunSummary {
        completedWaves = completedWaves != null ? List.copyOf(completedWaves) : List.of();
        completedTaskIds = completedTaskIds != null ? List.copyOf(completedTaskIds) : List.of();
        failures = failures != null ? List.copyOf(failures) : List.of();
    }

    /**
     * @param taskId the failed, blocked or cancelled task
     * @param kind   failure category
     * @param detail last error, blocking task, or analysis text
     */
    public record TaskFailure(String taskId, FailureKind kind, String detail) implements Serializable {}
}
