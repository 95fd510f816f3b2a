package com.tasklane.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for task list execution.
 */
@Service
public class TasklaneMetrics {

    private final MeterRegistry registry;

    public TasklaneMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordPlanningDuration(long ms) {
        Timer.builder("tasklane.planning.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordRunResult(String status) {
        Counter.builder("tasklane.runs.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordWorkerExecution(String outcome, long ms) {
        Timer.builder("tasklane.worker.duration")
                .tag("outcome", outcome)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordRetry(String reason) {
        Counter.builder("tasklane.task.retries")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void incrementEscalations(String reason) {
        Counter.builder("tasklane.escalations.total")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    /**
     * Records a worker flagged as stuck by the supervisor.
     *
     * @param cause "missed_heartbeats" or "wall_clock"
     */
    public void recordStuckWorker(String cause) {
        Counter.builder("tasklane.worker.stuck")
                .description("Workers terminated by stuck detection")
                .tag("cause", cause)
                .register(registry)
                .increment();
    }

    /**
     * Records a task deferred to a later wave because it conflicts with a task already placed.
     */
    public void recordConflictDeferral() {
        Counter.builder("tasklane.planning.conflict_deferrals")
                .description("Tasks deferred to a later wave due to file or explicit conflicts")
                .register(registry)
                .increment();
    }

    /**
     * Records wave size and dispatch.
     *
     * @param taskCount number of tasks in the wave
     */
    public void recordWaveExecution(int taskCount) {
        Counter.builder("tasklane.wave.executions")
                .description("Waves dispatched")
                .register(registry)
                .increment();

        DistributionSummary.builder("tasklane.wave.task_count")
                .description("Number of tasks per wave")
                .register(registry)
                .record(taskCount);
    }

    public void recordPeakConcurrency(int workers) {
        DistributionSummary.builder("tasklane.run.peak_workers")
                .description("Peak concurrently running workers per run")
                .register(registry)
                .record(workers);
    }
}
