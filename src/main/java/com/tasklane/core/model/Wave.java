package com.tasklane.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * An ordered stage within a run. Membership is fixed when the run is planned.
 *
 * @param id             unique wave identifier
 * @param runId          owning run
 * @param waveNumber     1-based, strictly increasing within a run
 * @param status         wave status
 * @param taskIds        assigned tasks in dispatch (priority) order
 * @param completedCount tasks that completed
 * @param failedCount    tasks that failed, were cancelled or escalated
 * @param skippedCount   tasks not attempted because a dependency failed
 * @param startedAt      nullable
 * @param completedAt    nullable
 */
public record Wave(
    String id,
    String runId,
    int waveNumber,
    WaveStatus status,
    List<String> taskIds,
    int completedCount,
    int failedCount,
    int skippedCount,
    Instant startedAt,
    Instant completedAt
) implements Serializable {

    public Wave {
        taskIds = taskIds != null ? List.copyOf(taskIds) : List.of();
    }

    public Wave started(Instant at) {
        return new Wave(id, runId, waveNumber, WaveStatus.RUNNING, taskIds, 0, 0, 0, at, null);
    }

    public Wave finished(WaveStatus newStatus, int completed, int failed, int skipped, Instant at) {
        return new Wave(id, runId, waveNumber, newStatus, taskIds, completed, failed, skipped, startedAt, at);
    }
}
