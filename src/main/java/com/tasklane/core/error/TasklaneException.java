package com.tasklane.core.error;

/**
 * Base type for engine errors that reject an operation before any work starts.
 * Task-level failures during a run are never thrown; they are recorded as results.
 */
public class TasklaneException extends RuntimeException {
    public TasklaneException(String message) {
        super(message);
    }

    public TasklaneException(String message, Throwable cause) {
        super(message, cause);
    }
}
