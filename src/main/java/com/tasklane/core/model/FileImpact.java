package com.tasklane.core.model;

import java.io.Serializable;

/**
 * A file operation a task declares it will perform.
 *
 * @param path       project-relative path
 * @param operation  CREATE, UPDATE, DELETE or READ
 * @param confidence how sure the planner is about this impact (0.0 - 1.0); informational only,
 *                   every declared impact is treated as binding
 */
public record FileImpact(
    String path,
    FileOperation operation,
    double confidence
) implements Serializable {

    public FileImpact(String path, FileOperation operation) {
        this(path, operation, 1.0);
    }
}
