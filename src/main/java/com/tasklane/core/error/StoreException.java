package com.tasklane.core.error;

/**
 * Thrown when the execution store cannot read or write a record.
 */
public class StoreException extends TasklaneException {
    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
