package com.tasklane.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Terminal result a worker reports back to the coordinator.
 *
 * @param outcome       SUCCESS, FAILURE or CANCELLED
 * @param reason        failure reason, null unless outcome is FAILURE
 * @param lastError     last error text, null unless outcome is FAILURE
 * @param filesModified files the worker changed during this attempt
 * @param checkpoints   commit / checkpoint markers recorded during this attempt
 */
public record WorkerResult(
    Outcome outcome,
    FailureReason reason,
    String lastError,
    List<String> filesModified,
    List<String> checkpoints
) implements Serializable {

    public enum Outcome { SUCCESS, FAILURE, CANCELLED }

    public WorkerResult {
        filesModified = filesModified != null ? List.copyOf(filesModified) : List.of();
        checkpoints = checkpoints != null ? List.copyOf(checkpoints) : List.of();
    }

    public static WorkerResult success(List<String> filesModified, List<String> checkpoints) {
        return new WorkerResult(Outcome.SUCCESS, null, null, filesModified, checkpoints);
    }

    public static WorkerResult failure(FailureReason reason, String lastError,
                                       List<String> filesModified, List<String> checkpoints) {
        return new WorkerResult(Outcome.FAILURE, reason, lastError, filesModified, checkpoints);
    }

    public static WorkerResult failure(FailureReason reason, String lastError) {
        return failure(reason, lastError, List.of(), List.of());
    }

    public static WorkerResult cancelled() {
        return new WorkerResult(Outcome.CANCELLED, null, null, List.of(), List.of());
    }

    public boolean isSuccess() {
        return outcome == Outcome.SUCCESS;
    }
}
