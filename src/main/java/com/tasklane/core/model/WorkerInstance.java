package com.tasklane.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * One spawned worker handling exactly one task within one wave of one run.
 *
 * @param id                 unique worker identifier
 * @param runId              owning run (isolation lane)
 * @param waveId             owning wave
 * @param taskId             the single task this worker handles
 * @param attempt            1-based attempt number for this task within the run
 * @param status             lifecycle status
 * @param lastHeartbeatAt    nullable until the first heartbeat
 * @param missedHeartbeats   consecutive heartbeat intervals without a heartbeat
 * @param progressPercent    last reported progress (0-100)
 * @param currentStep        last reported step description, nullable
 * @param spawnedAt          creation time
 * @param terminatedAt       nullable
 * @param terminationReason  nullable; e.g. "completed", "failed", "timeout", "cancelled"
 */
public record WorkerInstance(
    String id,
    String runId,
    String waveId,
    String taskId,
    int attempt,
    WorkerStatus status,
    Instant lastHeartbeatAt,
    int missedHeartbeats,
    int progressPercent,
    String currentStep,
    Instant spawnedAt,
    Instant terminatedAt,
    String terminationReason
) implements Serializable {

    public WorkerInstance withStatus(WorkerStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("Worker " + id + " cannot move from " + status + " to " + next);
        }
        return new WorkerInstance(id, runId, waveId, taskId, attempt, next, lastHeartbeatAt,
                missedHeartbeats, progressPercent, currentStep, spawnedAt, terminatedAt, terminationReason);
    }

    public WorkerInstance withHeartbeat(Instant at, int progress, String step) {
        return new WorkerInstance(id, runId, waveId, taskId, attempt, status, at, 0,
                progress, step != null ? step : currentStep, spawnedAt, terminatedAt, terminationReason);
    }

    public WorkerInstance withMissedHeartbeats(int missed) {
        return new WorkerInstance(id, runId, waveId, taskId, attempt, status, lastHeartbeatAt,
                missed, progressPercent, currentStep, spawnedAt, terminatedAt, terminationReason);
    }

    public WorkerInstance terminated(String reason, Instant at) {
        return new WorkerInstance(id, runId, waveId, taskId, attempt, WorkerStatus.TERMINATED,
                lastHeartbeatAt, missedHeartbeats, progressPercent, currentStep, spawnedAt, at, reason);
    }

    public boolean isActive() {
        return status != WorkerStatus.TERMINATED;
    }
}
