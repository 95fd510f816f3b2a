package com.tasklane.core.persistence;

import com.tasklane.core.model.ExecutionRun;
import com.tasklane.core.model.LogEntry;
import com.tasklane.core.model.LogEntryKind;
import com.tasklane.core.model.Task;
import com.tasklane.core.model.TaskAttempt;
import com.tasklane.core.model.TaskList;
import com.tasklane.core.model.Wave;
import com.tasklane.core.model.WorkerInstance;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable surface for every record the engine reads or writes. All run progress must be
 * reconstructable from these rows: the coordinator holds no state that is not also stored here.
 * <p>
 * Rows are addressed by identifier and linked by foreign keys: task to list, run to list,
 * wave to run, worker to run / wave / task, log entry and attempt to run / task / worker.
 */
public interface ExecutionStore {

    // Task lists and tasks

    void saveTaskList(TaskList taskList);

    Optional<TaskList> findTaskList(String taskListId);

    List<TaskList> listTaskLists();

    void saveTask(String taskListId, Task task);

    Optional<Task> findTask(String taskId);

    /** Tasks owned by the list, in no particular order. */
    List<Task> tasksForList(String taskListId);

    // Runs and waves

    void saveRun(ExecutionRun run);

    Optional<ExecutionRun> findRun(String runId);

    /** Runs of a list, ordered by run number. */
    List<ExecutionRun> runsForList(String taskListId);

    /** Runs that are RUNNING or PAUSED, across all lists. */
    List<ExecutionRun> activeRuns();

    void saveWave(Wave wave);

    /** Waves of a run, ordered by wave number. */
    List<Wave> wavesForRun(String runId);

    // Workers

    void saveWorker(WorkerInstance worker);

    Optional<WorkerInstance> findWorker(String workerId);

    List<WorkerInstance> workersForRun(String runId);

    // Append-only execution log

    /**
     * Appends a log entry and assigns it the next sequence number. Entries are never updated.
     */
    LogEntry appendLog(String runId, String taskId, String workerId, LogEntryKind kind,
                       String message, Instant timestamp);

    /** Entries of a run in append order. */
    List<LogEntry> logForRun(String runId);

    /** Entries written for a task within one run, in append order. */
    List<LogEntry> logForTask(String runId, String taskId);

    /** Entries written for a task across every run, in append order. */
    List<LogEntry> logForTaskAllRuns(String taskId);

    // Attempt history

    void recordAttempt(TaskAttempt attempt);

    /** Attempts at a task across every run, oldest first. */
    List<TaskAttempt> attemptsForTask(String taskId);
}
