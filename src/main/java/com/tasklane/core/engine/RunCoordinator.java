package com.tasklane.core.engine;

import com.tasklane.core.error.CapacityExceededException;
import com.tasklane.core.error.CrossListConflictException;
import com.tasklane.core.error.CycleDetectedException;
import com.tasklane.core.error.NotFoundException;
import com.tasklane.core.error.RunAlreadyActiveException;
import com.tasklane.core.error.TaskListNotReadyException;
import com.tasklane.core.escalation.ProgressAnalyzer;
import com.tasklane.core.events.EventBus;
import com.tasklane.core.events.EventTypes;
import com.tasklane.core.logging.MdcContext;
import com.tasklane.core.metrics.TasklaneMetrics;
import com.tasklane.core.model.ExecutionRun;
import com.tasklane.core.model.FailureKind;
import com.tasklane.core.model.FailureReason;
import com.tasklane.core.model.FileImpact;
import com.tasklane.core.model.LogEntry;
import com.tasklane.core.model.LogEntryKind;
import com.tasklane.core.model.RunStatus;
import com.tasklane.core.model.RunSummary;
import com.tasklane.core.model.Task;
import com.tasklane.core.model.TaskAttempt;
import com.tasklane.core.model.TaskList;
import com.tasklane.core.model.TaskListStatus;
import com.tasklane.core.model.TaskStatus;
import com.tasklane.core.model.Wave;
import com.tasklane.core.model.WaveStatus;
import com.tasklane.core.model.WorkerInstance;
import com.tasklane.core.model.WorkerResult;
import com.tasklane.core.persistence.ExecutionStore;
import com.tasklane.core.scheduler.DependencyResolver;
import com.tasklane.core.scheduler.FileConflictChecker;
import com.tasklane.core.scheduler.WavePlanner;
import com.tasklane.worker.WorkerSupervisor;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Owns execution runs: admission, planning, wave-by-wave dispatch, retries, escalation,
 * pause / resume / cancel and the final run summary.
 *
 * <p>Waves are planned once when the run starts and persisted; membership never changes during
 * the run. Each run is driven by one coordinator thread that re-reads persisted run and wave rows
 * before every wave, so a paused or orphaned run can be re-entered from storage alone. Within a
 * wave every task gets its own runner that holds a slot of the list's parallel-worker limit and
 * of the global worker pool for as long as it has a live worker, including retries.
 */
@Service
public class RunCoordinator {

    private static final Logger log = LoggerFactory.getLogger(RunCoordinator.class);

    /** Snapshot of engine activity across all runs. */
    public record EngineStatus(int activeRuns, int runningWorkers, int tasksCompleted, int tasksFailed,
                               int availableWorkerSlots) {}

    private enum TaskOutcome { COMPLETED, FAILED, ESCALATED, CANCELLED, NOT_STARTED }

    private enum Decision { RETRY, FAIL, ESCALATE }

    private final ExecutionStore store;
    private final TaskListStateMachine lists;
    private final WavePlanner planner;
    private final DependencyResolver resolver;
    private final FileConflictChecker conflictChecker;
    private final WorkerSupervisor supervisor;
    private final ProgressAnalyzer analyzer;
    private final EventBus eventBus;
    private final TasklaneMetrics metrics;
    private final Clock clock;
    private final EngineProperties properties;

    private final Semaphore globalWorkers;
    private final Map<String, RunContext> activeRuns = new ConcurrentHashMap<>();
    private final Object admissionLock = new Object();
    private final ExecutorService coordinatorExecutor = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "tasklane-coordinator");
        t.setDaemon(true);
        return t;
    });
    private final ExecutorService taskExecutor = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "tasklane-task-runner");
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public RunCoordinator(ExecutionStore store, TaskListStateMachine lists, WavePlanner planner,
                          DependencyResolver resolver, FileConflictChecker conflictChecker,
                          WorkerSupervisor supervisor, ProgressAnalyzer analyzer, EventBus eventBus,
                          @Autowired(required = false) TasklaneMetrics metrics, Clock clock,
                          EngineProperties properties) {
        this.store = store;
        this.lists = lists;
        this.planner = planner;
        this.resolver = resolver;
        this.conflictChecker = conflictChecker;
        this.supervisor = supervisor;
        this.analyzer = analyzer;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.clock = clock;
        this.properties = properties;
        this.globalWorkers = new Semaphore(properties.getMaxGlobalWorkers(), true);
    }

    @PreDestroy
    public void shutdown() {
        coordinatorExecutor.shutdownNow();
        taskExecutor.shutdownNow();
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (properties.isRecoverOnStartup()) {
            recoverInterruptedRuns();
        }
    }

    /**
     * Re-enters every RUNNING run that no coordinator in this process is driving, i.e. runs left
     * behind by a previous process. PAUSED runs wait for an explicit resume.
     *
     * @return IDs of the runs that were resumed
     */
    public List<String> recoverInterruptedRuns() {
        var recovered = new ArrayList<String>();
        for (var run : store.activeRuns()) {
            if (run.status() != RunStatus.RUNNING || activeRuns.containsKey(run.id())) continue;
            try {
                resumeRun(run.id());
                recovered.add(run.id());
            } catch (RuntimeException e) {
                log.error("Could not recover run {} of task list {}: {}", run.id(), run.taskListId(), e.getMessage(), e);
            }
        }
        if (!recovered.isEmpty()) {
            log.info("Recovered {} interrupted run(s): {}", recovered.size(), recovered);
        }
        return recovered;
    }

    // ── Run lifecycle ────────────────────────────────────────────────────

    /**
     * Creates a new run for a READY list, plans its waves and starts executing them in the background.
     *
     * @throws TaskListNotReadyException   if the list is not READY or fails readiness validation
     * @throws RunAlreadyActiveException   if the list already has a RUNNING or PAUSED run
     * @throws CapacityExceededException   if the concurrent-list limit is reached
     * @throws CycleDetectedException      if the dependency graph has a cycle
     * @throws CrossListConflictException  if another in-progress list touches the same files
     */
    public ExecutionRun startRun(String taskListId) {
        synchronized (admissionLock) {
            TaskList list = lists.get(taskListId);
            Optional<ExecutionRun> active = activeRunFor(taskListId);
            if (active.isPresent()) {
                throw new RunAlreadyActiveException(taskListId, active.get().id());
            }
            if (list.status() != TaskListStatus.READY) {
                throw new TaskListNotReadyException("Task list " + taskListId + " is " + list.status() + ", expected READY");
            }
            long activeLists = store.activeRuns().stream().map(ExecutionRun::taskListId).distinct().count();
            if (activeLists >= properties.getMaxConcurrentLists()) {
                throw new CapacityExceededException("Concurrent task list limit reached ("
                        + properties.getMaxConcurrentLists() + ")");
            }

            var report = lists.validate(taskListId);
            if (report.cycleDetected()) {
                throw new CycleDetectedException(report.cyclicTaskIds());
            }
            if (!report.isReady()) {
                throw new TaskListNotReadyException("Task list " + taskListId + " failed readiness validation", report.problems());
            }

            var allTasks = lists.tasks(taskListId);
            var toPlan = new ArrayList<Task>();
            for (var task : allTasks) {
                if (!task.status().isSettled()) {
                    Task reset = new Task(task.id(), task.title(), task.description(), TaskStatus.PENDING,
                            task.fileImpacts(), task.dependsOn(), task.conflictsWith(), task.checks(),
                            task.quickWin(), task.deadline(), task.effort(), null);
                    toPlan.add(reset);
                }
            }
            if (properties.isCrossListConflictDetection()) {
                checkCrossListConflicts(taskListId, toPlan);
            }

            var plan = planner.plan(toPlan, allTasks);
            if (!plan.unplaceable().isEmpty()) {
                throw new TaskListNotReadyException("Task list " + taskListId + " has tasks that can never run",
                        plan.unplaceable().entrySet().stream()
                                .map(e -> e.getKey() + " waits on " + e.getValue())
                                .toList());
            }
            toPlan.forEach(t -> lists.updateTask(taskListId, t));

            int runNumber = store.runsForList(taskListId).size() + 1;
            String runId = "run-" + UUID.randomUUID().toString().substring(0, 8);
            var now = clock.instant();
            var run = new ExecutionRun(runId, taskListId, runNumber, RunStatus.RUNNING,
                    plan.taskCount(), 0, 0, 0, plan.waves().size(), 0, 0, null, now, null);
            store.saveRun(run);
            for (var planned : plan.waves()) {
                store.saveWave(new Wave(runId + "-w" + planned.waveNumber(), runId, planned.waveNumber(),
                        WaveStatus.PENDING, planned.taskIds(), 0, 0, 0, null, null));
            }
            lists.advance(taskListId, TaskListStatus.IN_PROGRESS);
            lists.refreshProgress(taskListId);

            log.info("Started run {} (#{}) for task list {}: {} tasks in {} waves",
                    runId, runNumber, taskListId, plan.taskCount(), plan.waves().size());
            eventBus.publish(EventTypes.RUN_STARTED, runId, null,
                    Map.of("taskListId", taskListId, "runNumber", runNumber,
                            "tasks", plan.taskCount(), "waves", plan.waves().size()));
            launch(run, list.maxParallelWorkers());
            return run;
        }
    }

    /**
     * Requests a pause at the next wave boundary. Workers already running finish their tasks.
     */
    public ExecutionRun pauseRun(String runId) {
        var run = getRun(runId);
        if (run.status() == RunStatus.PAUSED) {
            return run;
        }
        RunContext ctx = activeRuns.get(runId);
        if (run.status() != RunStatus.RUNNING || ctx == null) {
            throw new IllegalStateException("Run " + runId + " is " + run.status() + " and cannot be paused");
        }
        ctx.pauseRequested = true;
        log.info("Pause requested for run {}", runId);
        return run;
    }

    /**
     * Re-enters a PAUSED run, or a RUNNING run left without a coordinator (e.g. after a restart),
     * from its persisted rows and continues with the first unfinished wave.
     */
    public ExecutionRun resumeRun(String runId) {
        synchronized (admissionLock) {
            var run = getRun(runId);
            RunContext driving = activeRuns.get(runId);
            if (driving != null) {
                // Pause not yet honored: keep the current driver going.
                driving.pauseRequested = false;
                return run;
            }
            if (run.status() != RunStatus.PAUSED && run.status() != RunStatus.RUNNING) {
                throw new IllegalStateException("Run " + runId + " is " + run.status() + " and cannot be resumed");
            }
            var list = lists.get(run.taskListId());
            recoverOrphans(run);

            var resumed = run.withStatus(RunStatus.RUNNING, null, clock.instant());
            store.saveRun(resumed);
            if (list.status() == TaskListStatus.PAUSED) {
                lists.advance(list.id(), TaskListStatus.IN_PROGRESS);
            }
            log.info("Resuming run {} for task list {}", runId, run.taskListId());
            eventBus.publish(EventTypes.RUN_RESUMED, runId, null, Map.of("taskListId", run.taskListId()));
            launch(resumed, list.maxParallelWorkers());
            return resumed;
        }
    }

    /**
     * Cancels a run. Active workers are terminated and their tasks become CANCELLED; completed
     * tasks stay completed. The list returns to READY so it can be run again.
     */
    public ExecutionRun cancelRun(String runId) {
        var run = getRun(runId);
        if (run.status().isTerminal()) {
            throw new IllegalStateException("Run " + runId + " is already " + run.status());
        }
        RunContext ctx = activeRuns.get(runId);
        if (ctx == null) {
            recoverOrphans(run);
            finishCancelled(run);
            return getRun(runId);
        }
        ctx.cancelRequested = true;
        log.info("Cancelling run {} ({} active workers)", runId, ctx.workerIds.size());
        for (String workerId : List.copyOf(ctx.workerIds)) {
            supervisor.terminate(workerId, WorkerSupervisor.Termination.CANCELLED, "run cancelled");
        }
        return getRun(runId);
    }

    /**
     * Waits for the run's coordinator to stop (terminal state or pause) and returns the stored run.
     */
    public ExecutionRun awaitRun(String runId, Duration timeout) throws InterruptedException, TimeoutException {
        RunContext ctx = activeRuns.get(runId);
        if (ctx != null && ctx.future != null) {
            try {
                ctx.future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (ExecutionException e) {
                log.error("Coordinator for run {} ended with error", runId, e.getCause());
            }
        }
        return getRun(runId);
    }

    // ── Queries ──────────────────────────────────────────────────────────

    public ExecutionRun getRun(String runId) {
        return store.findRun(runId).orElseThrow(() -> new NotFoundException("Run", runId));
    }

    public List<ExecutionRun> runsFor(String taskListId) {
        return store.runsForList(taskListId);
    }

    public List<Wave> waves(String runId) {
        return store.wavesForRun(getRun(runId).id());
    }

    public List<WorkerInstance> workers(String runId) {
        return store.workersForRun(getRun(runId).id());
    }

    /**
     * Execution log of a run, optionally narrowed to one task, in append order.
     */
    public List<LogEntry> log(String runId, String taskId) {
        getRun(runId);
        return taskId == null ? store.logForRun(runId) : store.logForTask(runId, taskId);
    }

    /**
     * Plans the list's unsettled tasks without creating a run.
     */
    public WavePlanner.WavePlan previewPlan(String taskListId) {
        var allTasks = lists.tasks(taskListId);
        var toPlan = allTasks.stream()
                .filter(t -> !t.status().isSettled())
                .map(t -> t.withStatus(TaskStatus.PENDING))
                .toList();
        return planner.plan(toPlan, allTasks);
    }

    /**
     * Which waves finished, which tasks completed, and which failed or were blocked and why.
     */
    public RunSummary summary(String runId) {
        var run = getRun(runId);
        var waves = store.wavesForRun(runId);
        var byId = new LinkedHashMap<String, Task>();
        lists.tasks(run.taskListId()).forEach(t -> byId.put(t.id(), t));

        var completedWaves = new ArrayList<Integer>();
        var completedTasks = new ArrayList<String>();
        var failures = new ArrayList<RunSummary.TaskFailure>();
        for (var wave : waves) {
            if (wave.status() == WaveStatus.COMPLETED) {
                completedWaves.add(wave.waveNumber());
            }
            for (String taskId : wave.taskIds()) {
                Task task = byId.get(taskId);
                if (task == null) continue;
                if (task.status().isTerminalSuccess()) {
                    completedTasks.add(taskId);
                } else {
                    describeFailure(run, task, byId).ifPresent(failures::add);
                }
            }
        }
        return new RunSummary(run.id(), run.taskListId(), run.runNumber(), run.status(),
                completedWaves, completedTasks, failures, run.failureReason());
    }

    /**
     * Tasks that directly or transitively depend on {@code taskId} and so cannot run until it completes.
     */
    public Set<String> blockedBy(String taskId) {
        for (var list : store.listTaskLists()) {
            if (list.taskIds().contains(taskId)) {
                return resolver.transitiveDependents(taskId, lists.tasks(list.id()));
            }
        }
        throw new NotFoundException("Task", taskId);
    }

    public EngineStatus status() {
        int completed = 0;
        int failed = 0;
        var runs = store.activeRuns();
        for (var run : runs) {
            completed += run.tasksCompleted();
            failed += run.tasksFailed();
        }
        return new EngineStatus(runs.size(), supervisor.activeWorkerCount(), completed, failed,
                globalWorkers.availablePermits());
    }

    public boolean isDriving(String runId) {
        return activeRuns.containsKey(runId);
    }

    // ── Coordinator loop ─────────────────────────────────────────────────

    private void launch(ExecutionRun run, int maxParallelWorkers) {
        var ctx = new RunContext(run.id(), run.taskListId(), maxParallelWorkers, run.peakConcurrentWorkers());
        activeRuns.put(run.id(), ctx);
        ctx.future = coordinatorExecutor.submit(() -> drive(ctx));
    }

    private void drive(RunContext ctx) {
        MdcContext.setRun(ctx.taskListId, ctx.runId);
        try {
            while (true) {
                var run = getRun(ctx.runId);
                var next = store.wavesForRun(ctx.runId).stream()
                        .filter(w -> !w.status().isTerminal())
                        .findFirst();
                if (ctx.cancelRequested) {
                    finishCancelled(run);
                    return;
                }
                if (next.isEmpty()) {
                    finish(run, ctx);
                    return;
                }
                if (ctx.pauseRequested && pauseIfRequested(run, ctx)) {
                    return;
                }
                if (abortIfStalled(run, ctx)) {
                    return;
                }
                executeWave(ctx, run, next.get());
            }
        } catch (RuntimeException e) {
            log.error("Coordinator for run {} failed: {}", ctx.runId, e.getMessage(), e);
            failRun(ctx.runId, "Coordinator error: " + e.getMessage());
        } finally {
            activeRuns.remove(ctx.runId, ctx);
            MdcContext.clear();
        }
    }

    private void executeWave(RunContext ctx, ExecutionRun run, Wave wave) {
        MdcContext.setWave(run.id(), wave.waveNumber());
        var started = wave.startedAt() == null ? wave.started(clock.instant())
                : new Wave(wave.id(), wave.runId(), wave.waveNumber(), WaveStatus.RUNNING, wave.taskIds(),
                        wave.completedCount(), wave.failedCount(), wave.skippedCount(), wave.startedAt(), null);
        store.saveWave(started);
        log.info("Wave {} of run {} starting with {} task(s): {}",
                wave.waveNumber(), run.id(), wave.taskIds().size(), wave.taskIds());
        eventBus.publish(EventTypes.WAVE_STARTED, run.id(), null,
                Map.of("wave", wave.waveNumber(), "taskIds", wave.taskIds()));
        if (metrics != null) metrics.recordWaveExecution(wave.taskIds().size());

        var listTasks = taskMap(run.taskListId());
        int completed = 0;
        int failed = 0;
        int skipped = 0;
        var runners = new LinkedHashMap<String, Future<TaskOutcome>>();
        for (String taskId : wave.taskIds()) {
            Task task = listTasks.get(taskId);
            if (task.status().isTerminalSuccess()) {
                completed++;
                continue;
            }
            if (task.status() == TaskStatus.FAILED || task.status() == TaskStatus.CANCELLED) {
                failed++;
                continue;
            }
            Optional<String> failedDep = task.dependsOn().stream()
                    .filter(dep -> listTasks.containsKey(dep) && !listTasks.get(dep).status().isTerminalSuccess())
                    .findFirst();
            if (task.status() == TaskStatus.BLOCKED || failedDep.isPresent()) {
                if (task.status() != TaskStatus.BLOCKED) {
                    markBlocked(run, task, failedDep.get());
                }
                skipped++;
                continue;
            }
            runners.put(taskId, taskExecutor.submit(() -> runTask(ctx, run, started, task)));
        }

        var failedTasks = new ArrayList<String>();
        boolean cancelled = false;
        for (var entry : runners.entrySet()) {
            TaskOutcome outcome = join(entry.getValue(), entry.getKey());
            switch (outcome) {
                case COMPLETED -> completed++;
                case FAILED, ESCALATED -> {
                    failed++;
                    failedTasks.add(entry.getKey());
                }
                case CANCELLED, NOT_STARTED -> cancelled = true;
            }
        }

        var allTasks = lists.tasks(run.taskListId());
        for (String failedId : failedTasks) {
            blockDependents(run, failedId, allTasks);
        }

        WaveStatus status = cancelled || ctx.cancelRequested ? WaveStatus.CANCELLED
                : failed > 0 ? WaveStatus.FAILED : WaveStatus.COMPLETED;
        var finished = started.finished(status, completed, failed, skipped, clock.instant());
        store.saveWave(finished);
        updateCounts(run.id(), ctx);
        lists.refreshProgress(run.taskListId());

        log.info("Wave {} of run {} {}: {} completed, {} failed, {} skipped",
                wave.waveNumber(), run.id(), status, completed, failed, skipped);
        eventBus.publish(EventTypes.WAVE_COMPLETED, run.id(), null,
                Map.of("wave", wave.waveNumber(), "status", status.name(),
                        "completed", completed, "failed", failed, "skipped", skipped));

        store.wavesForRun(run.id()).stream()
                .filter(w -> w.status() == WaveStatus.PENDING)
                .findFirst()
                .ifPresent(w -> eventBus.publish(EventTypes.WAVE_READY, run.id(), null,
                        Map.of("wave", w.waveNumber(), "taskIds", w.taskIds())));
    }

    private TaskOutcome runTask(RunContext ctx, ExecutionRun run, Wave wave, Task task) {
        MdcContext.setRun(run.taskListId(), run.id());
        boolean listSlot = false;
        boolean globalSlot = false;
        try {
            ctx.listWorkers.acquire();
            listSlot = true;
            globalWorkers.acquire();
            globalSlot = true;

            int attempt = (int) store.attemptsForTask(task.id()).stream()
                    .filter(a -> a.runId().equals(run.id()))
                    .count() + 1;
            while (true) {
                if (ctx.cancelRequested) {
                    return TaskOutcome.NOT_STARTED;
                }
                WorkerInstance worker = supervisor.spawn(run, wave, task, attempt);
                lists.updateTask(run.taskListId(), task.withStatus(TaskStatus.IN_PROGRESS).withAssignedWorker(worker.id()));
                eventBus.publish(EventTypes.TASK_STARTED, run.id(), task.id(),
                        Map.of("workerId", worker.id(), "attempt", attempt, "wave", wave.waveNumber()));

                WorkerResult result;
                ctx.workerStarted(worker.id());
                try {
                    if (ctx.cancelRequested) {
                        supervisor.terminate(worker.id(), WorkerSupervisor.Termination.CANCELLED, "run cancelled");
                    }
                    result = supervisor.await(worker.id());
                } finally {
                    ctx.workerFinished(worker.id());
                }

                switch (result.outcome()) {
                    case SUCCESS -> {
                        lists.updateTask(run.taskListId(), task.withStatus(TaskStatus.COMPLETED));
                        eventBus.publish(EventTypes.TASK_COMPLETED, run.id(), task.id(),
                                Map.of("workerId", worker.id(), "attempt", attempt,
                                        "filesModified", result.filesModified()));
                        return TaskOutcome.COMPLETED;
                    }
                    case CANCELLED -> {
                        lists.updateTask(run.taskListId(), task.withStatus(TaskStatus.CANCELLED));
                        eventBus.publish(EventTypes.TASK_CANCELLED, run.id(), task.id(), Map.of("workerId", worker.id()));
                        return TaskOutcome.CANCELLED;
                    }
                    case FAILURE -> {
                        var analysis = analyzer.analyze(task.id());
                        Decision decision = decide(attempt, analysis);
                        String reason = result.reason() != null ? result.reason().name() : FailureReason.ERROR.name();
                        if (decision == Decision.RETRY && !ctx.cancelRequested) {
                            log.info("Task {} attempt {} failed ({}); retrying", task.id(), attempt, reason);
                            if (metrics != null) metrics.recordRetry(reason.toLowerCase());
                            eventBus.publish(EventTypes.TASK_RETRYING, run.id(), task.id(),
                                    Map.of("attempt", attempt, "reason", reason,
                                            "lastError", String.valueOf(result.lastError())));
                            attempt++;
                            continue;
                        }
                        if (decision == Decision.ESCALATE) {
                            lists.updateTask(run.taskListId(), task.withStatus(TaskStatus.BLOCKED));
                            log.warn("Task {} escalated after {} failures: {}", task.id(),
                                    analysis.consecutiveFailures(), analysis.analysis());
                            if (metrics != null) metrics.incrementEscalations("no_progress");
                            eventBus.publish(EventTypes.TASK_ESCALATED, run.id(), task.id(),
                                    Map.of("taskListId", run.taskListId(),
                                            "consecutiveFailures", analysis.consecutiveFailures(),
                                            "oscillating", analysis.oscillating(),
                                            "lastError", String.valueOf(result.lastError()),
                                            "analysis", analysis.analysis()));
                            return TaskOutcome.ESCALATED;
                        }
                        lists.updateTask(run.taskListId(), task.withStatus(TaskStatus.FAILED));
                        log.warn("Task {} failed permanently after {} attempt(s): {}", task.id(), attempt, result.lastError());
                        eventBus.publish(EventTypes.TASK_FAILED, run.id(), task.id(),
                                Map.of("attempts", attempt, "reason", reason,
                                        "lastError", String.valueOf(result.lastError())));
                        return TaskOutcome.FAILED;
                    }
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return TaskOutcome.NOT_STARTED;
        } finally {
            if (globalSlot) globalWorkers.release();
            if (listSlot) ctx.listWorkers.release();
            MdcContext.clear();
        }
    }

    private Decision decide(int attempt, ProgressAnalyzer.Analysis analysis) {
        if (analysis.consecutiveFailures() >= properties.getEscalationThreshold()) {
            if (analysis.shouldEscalate()) {
                return Decision.ESCALATE;
            }
            return attempt < properties.getRetryBudget() + properties.getProgressRetryAllowance()
                    ? Decision.RETRY : Decision.FAIL;
        }
        return attempt < properties.getRetryBudget() ? Decision.RETRY : Decision.FAIL;
    }

    private TaskOutcome join(Future<TaskOutcome> future, String taskId) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return TaskOutcome.NOT_STARTED;
        } catch (ExecutionException e) {
            log.error("Task runner for {} crashed: {}", taskId, e.getCause().getMessage(), e.getCause());
            return TaskOutcome.FAILED;
        }
    }

    private void blockDependents(ExecutionRun run, String failedTaskId, List<Task> allTasks) {
        var byId = new HashMap<String, Task>();
        allTasks.forEach(t -> byId.put(t.id(), t));
        for (String dependentId : resolver.transitiveDependents(failedTaskId, allTasks)) {
            Task dependent = byId.get(dependentId);
            if (dependent == null || dependent.status().isSettled() || dependent.status() == TaskStatus.BLOCKED) {
                continue;
            }
            markBlocked(run, dependent, failedTaskId);
        }
    }

    private void markBlocked(ExecutionRun run, Task task, String blockingTaskId) {
        lists.updateTask(run.taskListId(), task.withStatus(TaskStatus.BLOCKED));
        log.info("Task {} blocked by {}", task.id(), blockingTaskId);
        eventBus.publish(EventTypes.TASK_BLOCKED, run.id(), task.id(), Map.of("blockedBy", blockingTaskId));
    }

    // An abort is only warranted when no task in any remaining wave can still run.
    private boolean abortIfStalled(ExecutionRun run, RunContext ctx) {
        var remaining = store.wavesForRun(run.id()).stream()
                .filter(w -> !w.status().isTerminal())
                .toList();
        var byId = taskMap(run.taskListId());
        var stuck = new ArrayList<String>();
        for (var wave : remaining) {
            for (String taskId : wave.taskIds()) {
                Task task = byId.get(taskId);
                if (task.status() != TaskStatus.BLOCKED) {
                    return false;
                }
                stuck.add(taskId);
            }
        }
        if (stuck.isEmpty()) {
            return false;
        }
        var now = clock.instant();
        for (var wave : remaining) {
            store.saveWave(new Wave(wave.id(), wave.runId(), wave.waveNumber(), WaveStatus.FAILED, wave.taskIds(),
                    0, 0, wave.taskIds().size(), wave.startedAt() != null ? wave.startedAt() : now, now));
        }
        String reason = "Run aborted: remaining tasks " + stuck + " are blocked by failed dependencies";
        log.warn(reason);
        updateCounts(run.id(), ctx);
        lists.refreshProgress(run.taskListId());
        completeRun(run.id(), RunStatus.FAILED, reason, ctx);
        return true;
    }

    private void finish(ExecutionRun run, RunContext ctx) {
        var counted = updateCounts(run.id(), ctx);
        lists.refreshProgress(run.taskListId());
        if (counted.tasksFailed() == 0 && counted.tasksBlocked() == 0
                && counted.tasksCompleted() == counted.tasksTotal()) {
            completeRun(run.id(), RunStatus.COMPLETED, null, ctx);
        } else {
            completeRun(run.id(), RunStatus.FAILED, counted.tasksFailed() + " task(s) failed, "
                    + counted.tasksBlocked() + " blocked", ctx);
        }
    }

    private void completeRun(String runId, RunStatus status, String reason, RunContext ctx) {
        var run = getRun(runId).withStatus(status, reason, clock.instant());
        store.saveRun(run);
        lists.advance(run.taskListId(),
                status == RunStatus.COMPLETED ? TaskListStatus.COMPLETED : TaskListStatus.FAILED);
        if (metrics != null) {
            metrics.recordRunResult(status.name());
            metrics.recordPeakConcurrency(ctx.peak.get());
        }
        log.info("Run {} {}: {}/{} tasks completed, {} failed, {} blocked{}", runId, status,
                run.tasksCompleted(), run.tasksTotal(), run.tasksFailed(), run.tasksBlocked(),
                reason != null ? " (" + reason + ")" : "");
        var payload = new HashMap<String, Object>();
        payload.put("taskListId", run.taskListId());
        payload.put("completed", run.tasksCompleted());
        payload.put("failed", run.tasksFailed());
        payload.put("blocked", run.tasksBlocked());
        payload.put("peakWorkers", run.peakConcurrentWorkers());
        if (reason != null) payload.put("reason", reason);
        eventBus.publish(status == RunStatus.COMPLETED ? EventTypes.RUN_COMPLETED : EventTypes.RUN_FAILED,
                runId, null, payload);
    }

    // Deregisters with the PAUSED save under the admission lock; a resume either clears the
    // request or relaunches the stored run.
    private boolean pauseIfRequested(ExecutionRun run, RunContext ctx) {
        synchronized (admissionLock) {
            if (!ctx.pauseRequested) {
                return false;
            }
            updateCounts(run.id(), ctx);
            store.saveRun(getRun(run.id()).withStatus(RunStatus.PAUSED, null, clock.instant()));
            lists.advance(run.taskListId(), TaskListStatus.PAUSED);
            activeRuns.remove(ctx.runId, ctx);
        }
        log.info("Run {} paused at wave boundary", run.id());
        eventBus.publish(EventTypes.RUN_PAUSED, run.id(), null, Map.of("taskListId", run.taskListId()));
        return true;
    }

    private void finishCancelled(ExecutionRun run) {
        var now = clock.instant();
        for (var wave : store.wavesForRun(run.id())) {
            if (!wave.status().isTerminal()) {
                store.saveWave(new Wave(wave.id(), wave.runId(), wave.waveNumber(), WaveStatus.CANCELLED,
                        wave.taskIds(), wave.completedCount(), wave.failedCount(), wave.skippedCount(),
                        wave.startedAt(), now));
            }
        }
        store.saveRun(getRun(run.id()).withStatus(RunStatus.CANCELLED, "Cancelled", now));
        var list = lists.get(run.taskListId());
        if (list.status() == TaskListStatus.IN_PROGRESS || list.status() == TaskListStatus.PAUSED) {
            lists.advance(run.taskListId(), TaskListStatus.READY);
        }
        lists.refreshProgress(run.taskListId());
        if (metrics != null) metrics.recordRunResult(RunStatus.CANCELLED.name());
        log.info("Run {} cancelled", run.id());
        eventBus.publish(EventTypes.RUN_CANCELLED, run.id(), null, Map.of("taskListId", run.taskListId()));
    }

    private void failRun(String runId, String reason) {
        try {
            var run = getRun(runId);
            if (run.status().isTerminal()) return;
            store.saveRun(run.withStatus(RunStatus.FAILED, reason, clock.instant()));
            var list = lists.get(run.taskListId());
            if (TaskListStateMachine.canTransition(list.status(), TaskListStatus.FAILED)) {
                lists.advance(run.taskListId(), TaskListStatus.FAILED);
            }
            eventBus.publish(EventTypes.RUN_FAILED, runId, null, Map.of("reason", reason));
        } catch (RuntimeException e) {
            log.error("Could not record failure of run {}: {}", runId, e.getMessage(), e);
        }
    }

    private ExecutionRun updateCounts(String runId, RunContext ctx) {
        var run = getRun(runId);
        var byId = taskMap(run.taskListId());
        int completed = 0;
        int failed = 0;
        int blocked = 0;
        int wavesDone = 0;
        for (var wave : store.wavesForRun(runId)) {
            if (wave.status().isTerminal()) wavesDone++;
            for (String taskId : wave.taskIds()) {
                TaskStatus status = byId.get(taskId).status();
                if (status.isTerminalSuccess()) completed++;
                else if (status == TaskStatus.FAILED) failed++;
                else if (status == TaskStatus.BLOCKED) blocked++;
            }
        }
        var updated = run.withCounts(completed, failed, blocked, wavesDone,
                Math.max(run.peakConcurrentWorkers(), ctx.peak.get()));
        store.saveRun(updated);
        return updated;
    }

    // Workers recorded as live for a run nobody is driving belong to a previous process.
    private void recoverOrphans(ExecutionRun run) {
        var now = clock.instant();
        var live = new HashSet<String>();
        supervisor.activeWorkers().forEach(w -> live.add(w.id()));
        for (var worker : store.workersForRun(run.id())) {
            if (worker.isActive() && !live.contains(worker.id())) {
                store.saveWorker(worker.terminated("orphaned", now));
                store.appendLog(run.id(), worker.taskId(), worker.id(),
                        LogEntryKind.INTERRUPTED, "Worker lost with its coordinator", now);
            }
        }
        var byId = taskMap(run.taskListId());
        for (var wave : store.wavesForRun(run.id())) {
            for (String taskId : wave.taskIds()) {
                Task task = byId.get(taskId);
                if (task != null && task.status() == TaskStatus.IN_PROGRESS) {
                    lists.updateTask(run.taskListId(), task.withStatus(TaskStatus.PENDING).withAssignedWorker(null));
                }
            }
        }
    }

    private void checkCrossListConflicts(String taskListId, List<Task> toPlan) {
        var impacts = new ArrayList<FileImpact>();
        toPlan.forEach(t -> impacts.addAll(t.fileImpacts()));
        for (var other : store.listTaskLists()) {
            if (other.id().equals(taskListId)) continue;
            if (other.status() != TaskListStatus.IN_PROGRESS && other.status() != TaskListStatus.PAUSED) continue;
            var otherImpacts = new ArrayList<FileImpact>();
            for (var task : lists.tasks(other.id())) {
                if (!task.status().isSettled()) otherImpacts.addAll(task.fileImpacts());
            }
            var conflicts = conflictChecker.conflictingPaths(impacts, otherImpacts);
            if (!conflicts.isEmpty()) {
                var paths = new LinkedHashSet<String>();
                conflicts.forEach(c -> paths.add(c.path()));
                throw new CrossListConflictException(taskListId, other.id(), List.copyOf(paths));
            }
        }
    }

    private Optional<RunSummary.TaskFailure> describeFailure(ExecutionRun run, Task task, Map<String, Task> byId) {
        List<TaskAttempt> attempts = store.attemptsForTask(task.id()).stream()
                .filter(a -> a.runId().equals(run.id()))
                .toList();
        TaskAttempt last = attempts.isEmpty() ? null : attempts.get(attempts.size() - 1);
        return switch (task.status()) {
            case FAILED -> Optional.of(new RunSummary.TaskFailure(task.id(),
                    last != null && last.reason() == FailureReason.TIMEOUT ? FailureKind.WORKER_TIMEOUT : FailureKind.WORKER_FAILURE,
                    last != null ? last.lastError() : null));
            case CANCELLED -> Optional.of(new RunSummary.TaskFailure(task.id(), FailureKind.CANCELLED, "Cancelled while running"));
            case BLOCKED -> {
                if (last != null && last.failed()) {
                    yield Optional.of(new RunSummary.TaskFailure(task.id(), FailureKind.NO_PROGRESS, last.lastError()));
                }
                Optional<String> blocker = firstUnsatisfiedDependency(task, byId, new HashSet<>());
                yield Optional.of(blocker
                        .map(b -> new RunSummary.TaskFailure(task.id(), FailureKind.DEPENDENCY_FAILED, "Blocked by " + b))
                        .orElseGet(() -> new RunSummary.TaskFailure(task.id(), FailureKind.UNRESOLVED_DEPENDENCY,
                                "Dependencies " + task.dependsOn() + " unresolved")));
            }
            default -> Optional.empty();
        };
    }

    // Walks down to the root failed task so the summary names the cause, not an intermediate.
    private Optional<String> firstUnsatisfiedDependency(Task task, Map<String, Task> byId, Set<String> seen) {
        for (String dep : task.dependsOn()) {
            Task depTask = byId.get(dep);
            if (depTask == null || depTask.status().isTerminalSuccess() || !seen.add(dep)) continue;
            if (depTask.status() == TaskStatus.BLOCKED) {
                var deeper = firstUnsatisfiedDependency(depTask, byId, seen);
                if (deeper.isPresent()) return deeper;
            }
            return Optional.of(dep);
        }
        return Optional.empty();
    }

    private Optional<ExecutionRun> activeRunFor(String taskListId) {
        return store.activeRuns().stream()
                .filter(r -> r.taskListId().equals(taskListId))
                .findFirst();
    }

    private Map<String, Task> taskMap(String taskListId) {
        var byId = new HashMap<String, Task>();
        lists.tasks(taskListId).forEach(t -> byId.put(t.id(), t));
        return byId;
    }

    /**
     * In-memory handle for a run being driven. Everything here can be rebuilt from storage.
     */
    private static final class RunContext {
        private final String runId;
        private final String taskListId;
        private final Semaphore listWorkers;
        private final Set<String> workerIds = ConcurrentHashMap.newKeySet();
        private final AtomicInteger running = new AtomicInteger();
        private final AtomicInteger peak;
        private volatile boolean pauseRequested;
        private volatile boolean cancelRequested;
        private volatile Future<?> future;

        private RunContext(String runId, String taskListId, int maxParallelWorkers, int previousPeak) {
            this.runId = runId;
            this.taskListId = taskListId;
            this.listWorkers = new Semaphore(maxParallelWorkers, true);
            this.peak = new AtomicInteger(previousPeak);
        }

        private void workerStarted(String workerId) {
            workerIds.add(workerId);
            peak.accumulateAndGet(running.incrementAndGet(), Math::max);
        }

        private void workerFinished(String workerId) {
            workerIds.remove(workerId);
            running.decrementAndGet();
        }
    }
}
