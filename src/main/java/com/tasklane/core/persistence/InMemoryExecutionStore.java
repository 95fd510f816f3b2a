package com.tasklane.core.persistence;

import com.tasklane.core.model.ExecutionRun;
import com.tasklane.core.model.LogEntry;
import com.tasklane.core.model.LogEntryKind;
import com.tasklane.core.model.RunStatus;
import com.tasklane.core.model.Task;
import com.tasklane.core.model.TaskAttempt;
import com.tasklane.core.model.TaskList;
import com.tasklane.core.model.Wave;
import com.tasklane.core.model.WorkerInstance;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Map-backed {@link ExecutionStore}. Not durable across restarts; used when no DataSource is configured.
 */
public class InMemoryExecutionStore implements ExecutionStore {

    private final Map<String, TaskList> taskLists = new ConcurrentHashMap<>();
    private final Map<String, Task> tasks = new ConcurrentHashMap<>();
    private final Map<String, String> taskOwners = new ConcurrentHashMap<>();
    private final Map<String, ExecutionRun> runs = new ConcurrentHashMap<>();
    private final Map<String, Wave> waves = new ConcurrentHashMap<>();
    private final Map<String, WorkerInstance> workers = new ConcurrentHashMap<>();
    private final List<LogEntry> log = new ArrayList<>();
    private final List<TaskAttempt> attempts = new CopyOnWriteArrayList<>();
    private long nextSequence = 1;

    @Override
    public void saveTaskList(TaskList taskList) {
        taskLists.put(taskList.id(), taskList);
    }

    @Override
    public Optional<TaskList> findTaskList(String taskListId) {
        return Optional.ofNullable(taskLists.get(taskListId));
    }

    @Override
    public List<TaskList> listTaskLists() {
        return taskLists.values().stream()
                .sorted(Comparator.comparing(TaskList::id))
                .toList();
    }

    @Override
    public void saveTask(String taskListId, Task task) {
        tasks.put(task.id(), task);
        taskOwners.put(task.id(), taskListId);
    }

    @Override
    public Optional<Task> findTask(String taskId) {
        return Optional.ofNullable(tasks.get(taskId));
    }

    @Override
    public List<Task> tasksForList(String taskListId) {
        return tasks.values().stream()
                .filter(t -> taskListId.equals(taskOwners.get(t.id())))
                .sorted(Comparator.comparing(Task::id))
                .toList();
    }

    @Override
    public void saveRun(ExecutionRun run) {
        runs.put(run.id(), run);
    }

    @Override
    public Optional<ExecutionRun> findRun(String runId) {
        return Optional.ofNullable(runs.get(runId));
    }

    @Override
    public List<ExecutionRun> runsForList(String taskListId) {
        return runs.values().stream()
                .filter(r -> r.taskListId().equals(taskListId))
                .sorted(Comparator.comparingInt(ExecutionRun::runNumber))
                .toList();
    }

    @Override
    public List<ExecutionRun> activeRuns() {
        return runs.values().stream()
                .filter(r -> r.status() == RunStatus.RUNNING || r.status() == RunStatus.PAUSED)
                .sorted(Comparator.comparing(ExecutionRun::startedAt))
                .toList();
    }

    @Override
    public void saveWave(Wave wave) {
        waves.put(wave.id(), wave);
    }

    @Override
    public List<Wave> wavesForRun(String runId) {
        return waves.values().stream()
                .filter(w -> w.runId().equals(runId))
                .sorted(Comparator.comparingInt(Wave::waveNumber))
                .toList();
    }

    @Override
    public void saveWorker(WorkerInstance worker) {
        workers.put(worker.id(), worker);
    }

    @Override
    public Optional<WorkerInstance> findWorker(String workerId) {
        return Optional.ofNullable(workers.get(workerId));
    }

    @Override
    public List<WorkerInstance> workersForRun(String runId) {
        return workers.values().stream()
                .filter(w -> w.runId().equals(runId))
                .sorted(Comparator.comparing(WorkerInstance::spawnedAt).thenComparing(WorkerInstance::id))
                .toList();
    }

    @Override
    public synchronized LogEntry appendLog(String runId, String taskId, String workerId, LogEntryKind kind,
                                           String message, Instant timestamp) {
        var entry = new LogEntry(nextSequence++, runId, taskId, workerId, kind, message, timestamp);
        log.add(entry);
        return entry;
    }

    @Override
    public synchronized List<LogEntry> logForRun(String runId) {
        return log.stream().filter(e -> e.runId().equals(runId)).toList();
    }

    @Override
    public synchronized List<LogEntry> logForTask(String runId, String taskId) {
        return log.stream()
                .filter(e -> e.runId().equals(runId) && e.taskId().equals(taskId))
                .toList();
    }

    @Override
    public synchronized List<LogEntry> logForTaskAllRuns(String taskId) {
        return log.stream().filter(e -> e.taskId().equals(taskId)).toList();
    }

    @Override
    public void recordAttempt(TaskAttempt attempt) {
        attempts.add(attempt);
    }

    @Override
    public List<TaskAttempt> attemptsForTask(String taskId) {
        return attempts.stream().filter(a -> a.taskId().equals(taskId)).toList();
    }
}
