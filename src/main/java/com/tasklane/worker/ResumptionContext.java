package com.tasklane.worker;

import com.tasklane.core.model.LogEntry;

import java.io.Serializable;
import java.util.List;

/**
 * Bounded tail of the execution log handed to a replacement worker.
 *
 * @param taskId        the task being resumed
 * @param entries       the last entries written for the task in this run, oldest first
 * @param droppedEntries number of older entries cut off by the tail bound
 */
public record ResumptionContext(
    String taskId,
    List<LogEntry> entries,
    int droppedEntries
) implements Serializable {

    public ResumptionContext {
        entries = entries != null ? List.copyOf(entries) : List.of();
    }

    public static ResumptionContext empty(String taskId) {
        return new ResumptionContext(taskId, List.of(), 0);
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * Plain-text rendering, one entry per line: {@code [KIND] worker-id: message}.
     */
    public String render() {
        var sb = new StringBuilder();
        if (droppedEntries > 0) {
            sb.append("... ").append(droppedEntries).append(" earlier entries omitted\n");
        }
        for (var entry : entries) {
            sb.append('[').append(entry.kind()).append("] ")
              .append(entry.workerId()).append(": ")
              .append(entry.message()).append('\n');
        }
        return sb.toString();
    }
}
