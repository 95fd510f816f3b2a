package com.tasklane.core.error;

/**
 * Thrown when starting another run would exceed the concurrent-list limit.
 */
public class CapacityExceededException extends TasklaneException {
    public CapacityExceededException(String message) {
        super(message);
    }
}
