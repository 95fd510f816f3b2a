package com.tasklane.core.error;

public class NotFoundException extends TasklaneException {
    public NotFoundException(String kind, String id) {
        super(kind + " not found: " + id);
    }
}
