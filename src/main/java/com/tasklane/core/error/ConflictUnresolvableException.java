package com.tasklane.core.error;

/**
 * Thrown when hard conflicts make it impossible to place a task into any wave.
 */
public class ConflictUnresolvableException extends TasklaneException {
    public ConflictUnresolvableException(String message) {
        super(message);
    }
}
