package com.tasklane.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * Append-only execution log line, scoped to a run.
 *
 * @param sequence  store-assigned, strictly increasing append order
 * @param runId     owning run
 * @param taskId    task the writing worker handles
 * @param workerId  writing worker
 * @param kind      entry kind
 * @param message   free text
 * @param timestamp when the entry was appended
 */
public record LogEntry(
    long sequence,
    String runId,
    String taskId,
    String workerId,
    LogEntryKind kind,
    String message,
    Instant timestamp
) implements Serializable {}
