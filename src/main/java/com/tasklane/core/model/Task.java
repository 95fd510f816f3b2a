package com.tasklane.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * A single unit of work handed to a build agent.
 *
 * @param id               unique identifier (e.g. "TASK-001")
 * @param title            short human-readable title
 * @param description      what this task should accomplish
 * @param status           current lifecycle status
 * @param fileImpacts      file operations this task declares (used for conflict detection)
 * @param dependsOn        IDs of tasks that must complete first
 * @param conflictsWith    IDs of tasks that must never share a wave with this one
 * @param checks           validation checks the agent must pass; a task without checks is not ready
 * @param quickWin         priority input: small task with visible payoff
 * @param deadline         priority input: nullable due date
 * @param effort           effort bucket
 * @param assignedWorkerId worker currently handling this task, null when unassigned
 */
public record Task(
    String id,
    String title,
    String description,
    TaskStatus status,
    List<FileImpact> fileImpacts,
    List<String> dependsOn,
    List<String> conflictsWith,
    List<String> checks,
    boolean quickWin,
    Instant deadline,
    Effort effort,
    String assignedWorkerId
) implements Serializable {

    public Task {
        fileImpacts = fileImpacts != null ? List.copyOf(fileImpacts) : List.of();
        dependsOn = dependsOn != null ? List.copyOf(dependsOn) : List.of();
        conflictsWith = conflictsWith != null ? List.copyOf(conflictsWith) : List.of();
        checks = checks != null ? List.copyOf(checks) : List.of();
        effort = effort != null ? effort : Effort.MEDIUM;
    }

    public Task withStatus(TaskStatus newStatus) {
        return new Task(id, title, description, newStatus, fileImpacts, dependsOn, conflictsWith,
                checks, quickWin, deadline, effort, assignedWorkerId);
    }

    public Task withAssignedWorker(String workerId) {
        return new Task(id, title, description, status, fileImpacts, dependsOn, conflictsWith,
                checks, quickWin, deadline, effort, workerId);
    }
}
