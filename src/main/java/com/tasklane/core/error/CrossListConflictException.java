package com.tasklane.core.error;

import java.util.List;

/**
 * Thrown when a list declares file operations that conflict with a list that is already in progress.
 */
public class CrossListConflictException extends TasklaneException {

    private final List<String> conflictingPaths;

    public CrossListConflictException(String taskListId, String otherListId, List<String> conflictingPaths) {
        super("Task list " + taskListId + " conflicts with in-progress list " + otherListId
                + " on " + conflictingPaths);
        this.conflictingPaths = List.copyOf(conflictingPaths);
    }

    public List<String> conflictingPaths() {
        return conflictingPaths;
    }
}
