package com.tasklane.dispatch.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tasklane.dispatch.api.TaskListRequest;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads task list files. The format is the JSON body accepted by {@code POST /api/v1/task-lists}.
 */
final class TaskListFiles {

    private TaskListFiles() {
    }

    static TaskListRequest read(ObjectMapper objectMapper, Path file) throws IOException {
        if (!Files.isRegularFile(file)) {
            throw new IOException("Task list file not found: " + file);
        }
        return objectMapper.readValue(file.toFile(), TaskListRequest.class);
    }
}
