package com.tasklane.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * One attempt at executing a task list end to end. The run ID is the isolation lane:
 * waves, workers and log entries created under it are scoped to it.
 *
 * @param id                    unique run identifier
 * @param taskListId            owning task list
 * @param runNumber             monotonic per list, starting at 1
 * @param status                run status
 * @param tasksTotal            tasks planned into this run
 * @param tasksCompleted        tasks that reached COMPLETED
 * @param tasksFailed           tasks that failed permanently
 * @param tasksBlocked          tasks blocked by a failed dependency or escalation
 * @param waveCount             number of planned waves
 * @param wavesCompleted        waves that reached a terminal state
 * @param peakConcurrentWorkers highest number of simultaneously running workers observed
 * @param failureReason         nullable; set when the run fails or is aborted
 * @param startedAt             when the run was created
 * @param completedAt           nullable; when the run reached a terminal state
 */
public record ExecutionRun(
    String id,
    String taskListId,
    int runNumber,
    RunStatus status,
    int tasksTotal,
    int tasksCompleted,
    int tasksFailed,
    int tasksBlocked,
    int waveCount,
    int wavesCompleted,
    int peakConcurrentWorkers,
    String failureReason,
    Instant startedAt,
    Instant completedAt
) implements Serializable {

    public ExecutionRun withStatus(RunStatus newStatus, String reason, Instant at) {
        return new ExecutionRun(id, taskListId, runNumber, newStatus, tasksTotal, tasksCompleted,
                tasksFailed, tasksBlocked, waveCount, wavesCompleted, peakConcurrentWorkers,
                reason, startedAt, newStatus.isTerminal() ? at : null);
    }

    public ExecutionRun withCounts(int completed, int failed, int blocked, int wavesDone, int peak) {
        return new ExecutionRun(id, taskListId, runNumber, status, tasksTotal, completed,
                failed, blocked, waveCount, wavesDone, peak, failureReason, startedAt, completedAt);
    }

    public ExecutionRun withPlan(int total, int waves) {
        return new ExecutionRun(id, taskListId, runNumber, status, total, tasksCompleted,
                tasksFailed, tasksBlocked, waves, wavesCompleted, peakConcurrentWorkers,
                failureReason, startedAt, completedAt);
    }
}
