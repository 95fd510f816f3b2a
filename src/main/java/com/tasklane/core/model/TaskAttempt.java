package com.tasklane.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * Outcome of one worker attempt at a task. Kept across runs so that no-progress
 * detection can compare consecutive attempts.
 */
public record TaskAttempt(
    String taskId,
    String runId,
    String workerId,
    int attempt,
    WorkerResult.Outcome outcome,
    FailureReason reason,
    String lastError,
    List<String> filesModified,
    List<String> checkpoints,
    Instant finishedAt
) implements Serializable {

    public TaskAttempt {
        filesModified = filesModified != null ? List.copyOf(filesModified) : List.of();
        checkpoints = checkpoints != null ? List.copyOf(checkpoints) : List.of();
    }

    public static TaskAttempt of(WorkerInstance worker, WorkerResult result, Instant at) {
        return new TaskAttempt(worker.taskId(), worker.runId(), worker.id(), worker.attempt(),
                result.outcome(), result.reason(), result.lastError(),
                result.filesModified(), result.checkpoints(), at);
    }

    public boolean failed() {
        return outcome == WorkerResult.Outcome.FAILURE;
    }
}
