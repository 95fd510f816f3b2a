package com.tasklane.worker;

import com.tasklane.core.error.NotFoundException;
import com.tasklane.core.events.EventBus;
import com.tasklane.core.events.EventTypes;
import com.tasklane.core.logging.MdcContext;
import com.tasklane.core.metrics.TasklaneMetrics;
import com.tasklane.core.model.ExecutionRun;
import com.tasklane.core.model.FailureReason;
import com.tasklane.core.model.LogEntry;
import com.tasklane.core.model.LogEntryKind;
import com.tasklane.core.model.Task;
import com.tasklane.core.model.TaskAttempt;
import com.tasklane.core.model.Wave;
import com.tasklane.core.model.WorkerInstance;
import com.tasklane.core.model.WorkerResult;
import com.tasklane.core.model.WorkerStatus;
import com.tasklane.core.persistence.ExecutionStore;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.UnaryOperator;

/**
 * Owns the lifecycle of worker instances: spawn, heartbeat tracking, log appending,
 * stuck detection and termination.
 *
 * <p>Each worker runs one {@link BuildAgent} invocation for exactly one task on its own thread.
 * A worker is flagged stuck when {@code maxMissedHeartbeats} heartbeat intervals pass without a
 * heartbeat, or when its wall-clock budget runs out, whichever comes first. A stuck worker is
 * terminated, the interruption is logged and its result is {@code failure(TIMEOUT)}.
 * Every worker settles exactly once: whichever of completion, timeout or cancellation happens
 * first wins.
 */
@Service
public class WorkerSupervisor {

    private static final Logger log = LoggerFactory.getLogger(WorkerSupervisor.class);

    /** Why a worker is being terminated from outside. */
    public enum Termination { TIMEOUT, CANCELLED }

    private final ExecutionStore store;
    private final BuildAgent agent;
    private final EventBus eventBus;
    private final Clock clock;
    private final TasklaneMetrics metrics;
    private final Duration heartbeatInterval;
    private final int maxMissedHeartbeats;
    private final Duration timeout;
    private final int logTailLines;

    private final ConcurrentHashMap<String, Handle> handles = new ConcurrentHashMap<>();
    private final ExecutorService workerExecutor = Executors.newCachedThreadPool(namedThreads("tasklane-worker-"));
    private final ScheduledExecutorService monitor = Executors.newSingleThreadScheduledExecutor(namedThreads("tasklane-heartbeat-monitor-"));

    @Autowired
    public WorkerSupervisor(ExecutionStore store, WorkerProperties properties, BuildAgent agent,
                            EventBus eventBus, Clock clock,
                            @Autowired(required = false) TasklaneMetrics metrics) {
        this(store, agent, eventBus, clock, metrics,
                Duration.ofSeconds(properties.getHeartbeatIntervalSeconds()),
                properties.getMaxMissedHeartbeats(),
                Duration.ofSeconds(properties.getTimeoutSeconds()),
                properties.getLogTailLines());
    }

    WorkerSupervisor(ExecutionStore store, BuildAgent agent, EventBus eventBus, Clock clock,
                     TasklaneMetrics metrics, Duration heartbeatInterval, int maxMissedHeartbeats,
                     Duration timeout, int logTailLines) {
        this.store = store;
        this.agent = agent;
        this.eventBus = eventBus;
        this.clock = clock;
        this.metrics = metrics;
        this.heartbeatInterval = heartbeatInterval;
        this.maxMissedHeartbeats = maxMissedHeartbeats;
        this.timeout = timeout;
        this.logTailLines = logTailLines;
    }

    @PostConstruct
    public void start() {
        long intervalMs = heartbeatInterval.toMillis();
        monitor.scheduleAtFixedRate(this::runStuckCheck, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("Worker supervisor started (agent={}, heartbeat={}s, maxMissed={}, timeout={}s)",
                agent.name(), heartbeatInterval.toSeconds(), maxMissedHeartbeats, timeout.toSeconds());
    }

    @PreDestroy
    public void shutdown() {
        monitor.shutdownNow();
        for (var handle : handles.values()) {
            terminate(handle.worker.id(), Termination.CANCELLED, "supervisor shutting down");
        }
        workerExecutor.shutdownNow();
    }

    /**
     * Creates a worker bound to {@code task} and starts its build agent. A replacement worker
     * receives the bounded log tail of earlier workers for the same task in the same run.
     */
    public WorkerInstance spawn(ExecutionRun run, Wave wave, Task task, int attempt) {
        String workerId = "worker-" + UUID.randomUUID().toString().substring(0, 8);
        Instant now = clock.instant();
        var worker = new WorkerInstance(workerId, run.id(), wave.id(), task.id(), attempt,
                WorkerStatus.SPAWNING, null, 0, 0, null, now, null, null);
        store.saveWorker(worker);

        var resumption = resumptionContext(run.id(), task.id());
        if (resumption.isEmpty()) {
            store.appendLog(run.id(), task.id(), workerId, LogEntryKind.SPAWNED,
                    "Worker spawned for task " + task.id() + " (attempt " + attempt + ")", now);
        } else {
            store.appendLog(run.id(), task.id(), workerId, LogEntryKind.RESUMED,
                    "Worker resuming task " + task.id() + " (attempt " + attempt + ") from "
                            + resumption.entries().size() + " prior log entries", now);
        }

        var handle = new Handle(worker);
        handles.put(workerId, handle);
        update(handle, w -> w.withStatus(WorkerStatus.IDLE));

        eventBus.publish(EventTypes.WORKER_SPAWNED, run.id(), task.id(),
                Map.of("workerId", workerId, "attempt", attempt, "wave", wave.waveNumber()));
        log.info("Spawned worker {} for task {} (run {}, wave {}, attempt {})",
                workerId, task.id(), run.id(), wave.waveNumber(), attempt);

        var command = new DispatchCommand(run.id(), run.taskListId(), wave.waveNumber(),
                workerId, attempt, task, resumption);
        handle.execution = workerExecutor.submit(() -> runAgent(handle, command));
        return handle.worker;
    }

    /**
     * Blocks until the worker reaches a terminal state and returns its result.
     */
    public WorkerResult await(String workerId) throws InterruptedException {
        Handle handle = handles.get(workerId);
        if (handle == null) {
            throw new NotFoundException("Worker", workerId);
        }
        try {
            return handle.result.get();
        } catch (ExecutionException e) {
            throw new IllegalStateException("Worker " + workerId + " did not settle cleanly", e.getCause());
        } finally {
            if (handle.result.isDone()) {
                handles.remove(workerId, handle);
            }
        }
    }

    /**
     * Records a heartbeat and resets the missed-heartbeat counter.
     *
     * @return false when the worker is unknown or already terminated
     */
    public boolean heartbeat(String workerId, int progressPercent, String currentStep) {
        Handle handle = handles.get(workerId);
        if (handle == null || handle.settled.get()) {
            log.debug("Ignoring heartbeat from inactive worker {}", workerId);
            return false;
        }
        int progress = Math.max(0, Math.min(100, progressPercent));
        var worker = update(handle, w -> w.withHeartbeat(clock.instant(), progress, currentStep));
        eventBus.publish(EventTypes.TASK_PROGRESS, worker.runId(), worker.taskId(),
                Map.of("workerId", workerId, "progressPercent", progress,
                        "currentStep", currentStep != null ? currentStep : ""));
        return true;
    }

    /**
     * Appends a log entry on behalf of an active worker.
     *
     * @return the stored entry, or empty when the worker is no longer active
     */
    public Optional<LogEntry> append(String workerId, LogEntryKind kind, String message) {
        Handle handle = handles.get(workerId);
        if (handle == null || handle.settled.get()) {
            if (handle == null && store.findWorker(workerId).isEmpty()) {
                throw new NotFoundException("Worker", workerId);
            }
            log.debug("Dropping {} log entry from terminated worker {}", kind, workerId);
            return Optional.empty();
        }
        var worker = handle.worker;
        if (kind == LogEntryKind.FILE_CHANGE) {
            handle.files.add(message);
        } else if (kind == LogEntryKind.CHECKPOINT) {
            handle.checkpoints.add(message);
        }
        return Optional.of(store.appendLog(worker.runId(), worker.taskId(), workerId, kind, message, clock.instant()));
    }

    /**
     * Terminates a worker from outside: interrupts its agent, logs the interruption and settles
     * its result as {@code failure(TIMEOUT)} or {@code cancelled}.
     *
     * @return true if this call settled the worker, false if it had already settled
     */
    public boolean terminate(String workerId, Termination cause, String detail) {
        Handle handle = handles.get(workerId);
        if (handle == null) {
            return false;
        }
        WorkerResult result = cause == Termination.TIMEOUT
                ? WorkerResult.failure(FailureReason.TIMEOUT, detail, List.copyOf(handle.files), List.copyOf(handle.checkpoints))
                : WorkerResult.cancelled();
        boolean settled = settle(handle, result, cause == Termination.TIMEOUT ? "timeout" : "cancelled", detail);
        Future<?> execution = handle.execution;
        if (execution != null) {
            execution.cancel(true);
        }
        return settled;
    }

    /**
     * Scans active workers for missed heartbeats and expired wall-clock budgets, terminating
     * every stuck worker with reason TIMEOUT.
     *
     * @return IDs of the workers terminated by this scan
     */
    public List<String> checkStuck() {
        var terminated = new ArrayList<String>();
        Instant now = clock.instant();
        for (var handle : handles.values()) {
            if (handle.settled.get()) continue;

            var worker = update(handle, w -> w.withMissedHeartbeats(missedSince(w, now)));
            boolean wallClock = !Duration.between(worker.spawnedAt(), now).minus(timeout).isNegative();
            boolean missed = worker.missedHeartbeats() >= maxMissedHeartbeats;
            if (!wallClock && !missed) continue;

            String cause = wallClock ? "wall_clock" : "missed_heartbeats";
            String detail = wallClock
                    ? "Worker exceeded wall-clock budget of " + timeout.toSeconds() + "s"
                    : "Worker missed " + worker.missedHeartbeats() + " consecutive heartbeats";
            log.warn("Worker {} on task {} is stuck: {}", worker.id(), worker.taskId(), detail);
            if (metrics != null) metrics.recordStuckWorker(cause);
            eventBus.publish(EventTypes.WORKER_STUCK, worker.runId(), worker.taskId(),
                    Map.of("workerId", worker.id(), "cause", cause, "detail", detail));

            if (terminate(worker.id(), Termination.TIMEOUT, detail)) {
                terminated.add(worker.id());
            }
        }
        return terminated;
    }

    /**
     * Last {@code logTailLines} entries written for a task within a run, oldest first.
     */
    public ResumptionContext resumptionContext(String runId, String taskId) {
        List<LogEntry> entries = store.logForTask(runId, taskId);
        int dropped = Math.max(0, entries.size() - logTailLines);
        return new ResumptionContext(taskId, entries.subList(dropped, entries.size()), dropped);
    }

    public List<WorkerInstance> activeWorkers() {
        return handles.values().stream()
                .filter(h -> !h.settled.get())
                .map(h -> h.worker)
                .toList();
    }

    public int activeWorkerCount() {
        return (int) handles.values().stream().filter(h -> !h.settled.get()).count();
    }

    public String agentName() {
        return agent.name();
    }

    public boolean isAgentAvailable() {
        return agent.isAvailable();
    }

    private void runAgent(Handle handle, DispatchCommand command) {
        var worker = handle.worker;
        MdcContext.setWorker(worker.runId(), worker.taskId(), worker.id());
        try {
            if (handle.settled.get()) return;
            update(handle, w -> w.status() == WorkerStatus.IDLE ? w.withStatus(WorkerStatus.RUNNING) : w);
            WorkerResult result = agent.execute(command, new Channel(worker.id()));
            settle(handle, result, result.isSuccess() ? "completed" : "failed", null);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            settle(handle, WorkerResult.failure(FailureReason.INFRASTRUCTURE, "Worker interrupted"), "interrupted", null);
        } catch (RuntimeException e) {
            log.error("Build agent {} crashed on task {}: {}", agent.name(), worker.taskId(), e.getMessage(), e);
            settle(handle, WorkerResult.failure(FailureReason.INFRASTRUCTURE, e.getMessage()), "failed", null);
        } finally {
            MdcContext.clear();
        }
    }

    private boolean settle(Handle handle, WorkerResult reported, String reason, String detail) {
        if (!handle.settled.compareAndSet(false, true)) {
            return false;
        }
        Instant now = clock.instant();
        var result = mergeReported(handle, reported);
        var worker = update(handle, w -> {
            var next = w.status() == WorkerStatus.RUNNING ? w.withStatus(WorkerStatus.COMPLETING) : w;
            return next.terminated(reason, now);
        });

        LogEntryKind kind = switch (result.outcome()) {
            case SUCCESS -> LogEntryKind.COMPLETED;
            case CANCELLED -> LogEntryKind.CANCELLED;
            case FAILURE -> result.reason() == FailureReason.TIMEOUT ? LogEntryKind.INTERRUPTED : LogEntryKind.FAILED;
        };
        String message = switch (kind) {
            case COMPLETED -> "Task completed";
            case CANCELLED -> "Worker cancelled" + (detail != null ? ": " + detail : "");
            case INTERRUPTED -> "Worker interrupted: " + detail;
            default -> "Task failed (" + result.reason() + "): " + result.lastError();
        };
        store.appendLog(worker.runId(), worker.taskId(), worker.id(), kind, message, now);
        store.recordAttempt(TaskAttempt.of(worker, result, now));

        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - handle.startNanos);
        if (metrics != null) {
            metrics.recordWorkerExecution(result.outcome().name().toLowerCase(), elapsedMs);
        }
        eventBus.publish(EventTypes.WORKER_TERMINATED, worker.runId(), worker.taskId(),
                Map.of("workerId", worker.id(), "reason", reason, "outcome", result.outcome().name()));
        log.info("Worker {} on task {} terminated: {} ({}ms)", worker.id(), worker.taskId(), reason, elapsedMs);

        handle.result.complete(result);
        return true;
    }

    // Files and checkpoints reported through the log count toward the attempt.
    private static WorkerResult mergeReported(Handle handle, WorkerResult result) {
        if (result.outcome() == WorkerResult.Outcome.CANCELLED) return result;
        Set<String> files = new LinkedHashSet<>(result.filesModified());
        files.addAll(handle.files);
        Set<String> checkpoints = new LinkedHashSet<>(result.checkpoints());
        checkpoints.addAll(handle.checkpoints);
        return new WorkerResult(result.outcome(), result.reason(), result.lastError(),
                List.copyOf(files), List.copyOf(checkpoints));
    }

    private int missedSince(WorkerInstance worker, Instant now) {
        Instant baseline = worker.lastHeartbeatAt() != null ? worker.lastHeartbeatAt() : worker.spawnedAt();
        long elapsed = Duration.between(baseline, now).toMillis();
        return elapsed <= 0 ? 0 : (int) (elapsed / heartbeatInterval.toMillis());
    }

    private WorkerInstance update(Handle handle, UnaryOperator<WorkerInstance> change) {
        synchronized (handle) {
            handle.worker = change.apply(handle.worker);
            store.saveWorker(handle.worker);
            return handle.worker;
        }
    }

    private void runStuckCheck() {
        try {
            checkStuck();
        } catch (RuntimeException e) {
            log.error("Stuck-worker scan failed: {}", e.getMessage(), e);
        }
    }

    private static ThreadFactory namedThreads(String prefix) {
        var counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    private final class Channel implements WorkerChannel {
        private final String workerId;

        private Channel(String workerId) {
            this.workerId = workerId;
        }

        @Override
        public void heartbeat(int progressPercent, String currentStep) {
            WorkerSupervisor.this.heartbeat(workerId, progressPercent, currentStep);
        }

        @Override
        public void log(LogEntryKind kind, String message) {
            append(workerId, kind, message);
        }
    }

    private static final class Handle {
        private volatile WorkerInstance worker;
        private volatile Future<?> execution;
        private final CompletableFuture<WorkerResult> result = new CompletableFuture<>();
        private final AtomicBoolean settled = new AtomicBoolean();
        private final Set<String> files = ConcurrentHashMap.newKeySet();
        private final Set<String> checkpoints = ConcurrentHashMap.newKeySet();
        private final long startNanos = System.nanoTime();

        private Handle(WorkerInstance worker) {
            this.worker = worker;
        }
    }
}
