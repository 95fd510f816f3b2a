package com.tasklane.core.model;

/**
 * Kind of change a task declares against a file path.
 */
public enum FileOperation {
    CREATE,
    UPDATE,
    DELETE,
    READ
}
