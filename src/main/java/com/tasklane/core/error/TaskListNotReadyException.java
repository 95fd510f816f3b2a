package com.tasklane.core.error;

import java.util.List;

/**
 * Thrown when a run is requested for a list that is not READY, or a list fails readiness validation.
 */
public class TaskListNotReadyException extends TasklaneException {

    private final List<String> problems;

    public TaskListNotReadyException(String message) {
        this(message, List.of());
    }

    public TaskListNotReadyException(String message, List<String> problems) {
        super(problems.isEmpty() ? message : message + ": " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> problems() {
        return problems;
    }
}
