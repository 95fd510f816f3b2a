package com.tasklane.core.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.tasklane.core.error.StoreException;
import com.tasklane.core.model.ExecutionRun;
import com.tasklane.core.model.FailureReason;
import com.tasklane.core.model.LogEntry;
import com.tasklane.core.model.LogEntryKind;
import com.tasklane.core.model.RunStatus;
import com.tasklane.core.model.Task;
import com.tasklane.core.model.TaskAttempt;
import com.tasklane.core.model.TaskList;
import com.tasklane.core.model.TaskListProgress;
import com.tasklane.core.model.TaskListStatus;
import com.tasklane.core.model.Wave;
import com.tasklane.core.model.WaveStatus;
import com.tasklane.core.model.WorkerInstance;
import com.tasklane.core.model.WorkerResult;
import com.tasklane.core.model.WorkerStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * JDBC-backed {@link ExecutionStore}.
 * <p>
 * Scalar fields map to columns; list-valued fields (task IDs, files, checkpoints) and the task
 * body are stored as JSON text. Writes use update-then-insert so the same SQL runs on
 * PostgreSQL and H2. Tables are created by {@link #createTables()}.
 */
public class JdbcExecutionStore implements ExecutionStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcExecutionStore.class);

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};

    private static final String[] CREATE_TABLES_SQL = {
            """
            CREATE TABLE IF NOT EXISTS tl_task_lists (
                id                   VARCHAR(255) PRIMARY KEY,
                list_name            VARCHAR(1000),
                status               VARCHAR(32) NOT NULL,
                approved             BOOLEAN NOT NULL,
                max_parallel_workers INT NOT NULL,
                task_ids             VARCHAR(100000) NOT NULL,
                progress             VARCHAR(4000) NOT NULL,
                updated_at           TIMESTAMP
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS tl_tasks (
                id                 VARCHAR(255) PRIMARY KEY,
                task_list_id       VARCHAR(255) NOT NULL,
                status             VARCHAR(32) NOT NULL,
                assigned_worker_id VARCHAR(255),
                body               VARCHAR(100000) NOT NULL
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS tl_runs (
                id              VARCHAR(255) PRIMARY KEY,
                task_list_id    VARCHAR(255) NOT NULL,
                run_number      INT NOT NULL,
                status          VARCHAR(32) NOT NULL,
                tasks_total     INT NOT NULL,
                tasks_completed INT NOT NULL,
                tasks_failed    INT NOT NULL,
                tasks_blocked   INT NOT NULL,
                wave_count      INT NOT NULL,
                waves_completed INT NOT NULL,
                peak_workers    INT NOT NULL,
                failure_reason  VARCHAR(4000),
                started_at      TIMESTAMP,
                completed_at    TIMESTAMP
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS tl_waves (
                id              VARCHAR(255) PRIMARY KEY,
                run_id          VARCHAR(255) NOT NULL,
                wave_number     INT NOT NULL,
                status          VARCHAR(32) NOT NULL,
                task_ids        VARCHAR(100000) NOT NULL,
                completed_count INT NOT NULL,
                failed_count    INT NOT NULL,
                skipped_count   INT NOT NULL,
                started_at      TIMESTAMP,
                completed_at    TIMESTAMP
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS tl_workers (
                id                 VARCHAR(255) PRIMARY KEY,
                run_id             VARCHAR(255) NOT NULL,
                wave_id            VARCHAR(255) NOT NULL,
                task_id            VARCHAR(255) NOT NULL,
                attempt            INT NOT NULL,
                status             VARCHAR(32) NOT NULL,
                last_heartbeat_at  TIMESTAMP,
                missed_heartbeats  INT NOT NULL,
                progress_percent   INT NOT NULL,
                current_step       VARCHAR(4000),
                spawned_at         TIMESTAMP,
                terminated_at      TIMESTAMP,
                termination_reason VARCHAR(255)
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS tl_log_entries (
                seq        BIGINT PRIMARY KEY,
                run_id     VARCHAR(255) NOT NULL,
                task_id    VARCHAR(255) NOT NULL,
                worker_id  VARCHAR(255) NOT NULL,
                kind       VARCHAR(32) NOT NULL,
                message    VARCHAR(100000),
                created_at TIMESTAMP
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS tl_task_attempts (
                worker_id      VARCHAR(255) PRIMARY KEY,
                task_id        VARCHAR(255) NOT NULL,
                run_id         VARCHAR(255) NOT NULL,
                attempt        INT NOT NULL,
                outcome        VARCHAR(32) NOT NULL,
                reason         VARCHAR(32),
                last_error     VARCHAR(100000),
                files_modified VARCHAR(100000) NOT NULL,
                checkpoints    VARCHAR(100000) NOT NULL,
                finished_at    TIMESTAMP
            )
            """
    };

    private static final String LIST_COLUMNS =
            "id, list_name, status, approved, max_parallel_workers, task_ids, progress, updated_at";
    private static final String RUN_COLUMNS =
            "id, task_list_id, run_number, status, tasks_total, tasks_completed, tasks_failed, tasks_blocked, "
                    + "wave_count, waves_completed, peak_workers, failure_reason, started_at, completed_at";
    private static final String WAVE_COLUMNS =
            "id, run_id, wave_number, status, task_ids, completed_count, failed_count, skipped_count, started_at, completed_at";
    private static final String WORKER_COLUMNS =
            "id, run_id, wave_id, task_id, attempt, status, last_heartbeat_at, missed_heartbeats, progress_percent, "
                    + "current_step, spawned_at, terminated_at, termination_reason";
    private static final String LOG_COLUMNS = "seq, run_id, task_id, worker_id, kind, message, created_at";
    private static final String ATTEMPT_COLUMNS =
            "worker_id, task_id, run_id, attempt, outcome, reason, last_error, files_modified, checkpoints, finished_at";

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;
    private long nextSequence = 1;

    public JdbcExecutionStore(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    /**
     * Creates the store tables if they do not already exist and seeds the log sequence.
     * Should be called once during application startup.
     */
    public synchronized void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            for (String sql : CREATE_TABLES_SQL) {
                stmt.execute(sql);
            }
            try (ResultSet rs = stmt.executeQuery("SELECT MAX(seq) FROM tl_log_entries")) {
                if (rs.next()) {
                    nextSequence = rs.getLong(1) + 1;
                }
            }
        }
        log.info("Execution store tables ensured (next log sequence {})", nextSequence);
    }

    // ── Task lists and tasks ─────────────────────────────────────────────

    @Override
    public void saveTaskList(TaskList list) {
        upsert("tl_task_lists", LIST_COLUMNS, ps -> {
            ps.setString(1, list.name());
            ps.setString(2, list.status().name());
            ps.setBoolean(3, list.approved());
            ps.setInt(4, list.maxParallelWorkers());
            ps.setString(5, toJson(list.taskIds()));
            ps.setString(6, toJson(list.progress()));
            ps.setTimestamp(7, timestamp(list.updatedAt()));
            ps.setString(8, list.id());
        });
    }

    @Override
    public Optional<TaskList> findTaskList(String taskListId) {
        return queryOne("SELECT " + LIST_COLUMNS + " FROM tl_task_lists WHERE id = ?",
                ps -> ps.setString(1, taskListId), this::mapTaskList);
    }

    @Override
    public List<TaskList> listTaskLists() {
        return query("SELECT " + LIST_COLUMNS + " FROM tl_task_lists ORDER BY id", ps -> {}, this::mapTaskList);
    }

    @Override
    public void saveTask(String taskListId, Task task) {
        upsert("tl_tasks", "id, task_list_id, status, assigned_worker_id, body", ps -> {
            ps.setString(1, taskListId);
            ps.setString(2, task.status().name());
            ps.setString(3, task.assignedWorkerId());
            ps.setString(4, toJson(task));
            ps.setString(5, task.id());
        });
    }

    @Override
    public Optional<Task> findTask(String taskId) {
        return queryOne("SELECT body FROM tl_tasks WHERE id = ?",
                ps -> ps.setString(1, taskId), rs -> fromJson(rs.getString("body"), Task.class));
    }

    @Override
    public List<Task> tasksForList(String taskListId) {
        return query("SELECT body FROM tl_tasks WHERE task_list_id = ? ORDER BY id",
                ps -> ps.setString(1, taskListId), rs -> fromJson(rs.getString("body"), Task.class));
    }

    // ── Runs and waves ───────────────────────────────────────────────────

    @Override
    public void saveRun(ExecutionRun run) {
        upsert("tl_runs", RUN_COLUMNS, ps -> {
            ps.setString(1, run.taskListId());
            ps.setInt(2, run.runNumber());
            ps.setString(3, run.status().name());
            ps.setInt(4, run.tasksTotal());
            ps.setInt(5, run.tasksCompleted());
            ps.setInt(6, run.tasksFailed());
            ps.setInt(7, run.tasksBlocked());
            ps.setInt(8, run.waveCount());
            ps.setInt(9, run.wavesCompleted());
            ps.setInt(10, run.peakConcurrentWorkers());
            ps.setString(11, run.failureReason());
            ps.setTimestamp(12, timestamp(run.startedAt()));
            ps.setTimestamp(13, timestamp(run.completedAt()));
            ps.setString(14, run.id());
        });
    }

    @Override
    public Optional<ExecutionRun> findRun(String runId) {
        return queryOne("SELECT " + RUN_COLUMNS + " FROM tl_runs WHERE id = ?",
                ps -> ps.setString(1, runId), this::mapRun);
    }

    @Override
    public List<ExecutionRun> runsForList(String taskListId) {
        return query("SELECT " + RUN_COLUMNS + " FROM tl_runs WHERE task_list_id = ? ORDER BY run_number",
                ps -> ps.setString(1, taskListId), this::mapRun);
    }

    @Override
    public List<ExecutionRun> activeRuns() {
        return query("SELECT " + RUN_COLUMNS + " FROM tl_runs WHERE status IN (?, ?) ORDER BY started_at",
                ps -> {
                    ps.setString(1, RunStatus.RUNNING.name());
                    ps.setString(2, RunStatus.PAUSED.name());
                }, this::mapRun);
    }

    @Override
    public void saveWave(Wave wave) {
        upsert("tl_waves", WAVE_COLUMNS, ps -> {
            ps.setString(1, wave.runId());
            ps.setInt(2, wave.waveNumber());
            ps.setString(3, wave.status().name());
            ps.setString(4, toJson(wave.taskIds()));
            ps.setInt(5, wave.completedCount());
            ps.setInt(6, wave.failedCount());
            ps.setInt(7, wave.skippedCount());
            ps.setTimestamp(8, timestamp(wave.startedAt()));
            ps.setTimestamp(9, timestamp(wave.completedAt()));
            ps.setString(10, wave.id());
        });
    }

    @Override
    public List<Wave> wavesForRun(String runId) {
        return query("SELECT " + WAVE_COLUMNS + " FROM tl_waves WHERE run_id = ? ORDER BY wave_number",
                ps -> ps.setString(1, runId), rs -> new Wave(
                        rs.getString("id"),
                        rs.getString("run_id"),
                        rs.getInt("wave_number"),
                        WaveStatus.valueOf(rs.getString("status")),
                        fromJson(rs.getString("task_ids"), STRING_LIST),
                        rs.getInt("completed_count"),
                        rs.getInt("failed_count"),
                        rs.getInt("skipped_count"),
                        instant(rs, "started_at"),
                        instant(rs, "completed_at")));
    }

    // ── Workers ──────────────────────────────────────────────────────────

    @Override
    public void saveWorker(WorkerInstance worker) {
        upsert("tl_workers", WORKER_COLUMNS, ps -> {
            ps.setString(1, worker.runId());
            ps.setString(2, worker.waveId());
            ps.setString(3, worker.taskId());
            ps.setInt(4, worker.attempt());
            ps.setString(5, worker.status().name());
            ps.setTimestamp(6, timestamp(worker.lastHeartbeatAt()));
            ps.setInt(7, worker.missedHeartbeats());
            ps.setInt(8, worker.progressPercent());
            ps.setString(9, worker.currentStep());
            ps.setTimestamp(10, timestamp(worker.spawnedAt()));
            ps.setTimestamp(11, timestamp(worker.terminatedAt()));
            ps.setString(12, worker.terminationReason());
            ps.setString(13, worker.id());
        });
    }

    @Override
    public Optional<WorkerInstance> findWorker(String workerId) {
        return queryOne("SELECT " + WORKER_COLUMNS + " FROM tl_workers WHERE id = ?",
                ps -> ps.setString(1, workerId), this::mapWorker);
    }

    @Override
    public List<WorkerInstance> workersForRun(String runId) {
        return query("SELECT " + WORKER_COLUMNS + " FROM tl_workers WHERE run_id = ? ORDER BY spawned_at, id",
                ps -> ps.setString(1, runId), this::mapWorker);
    }

    // ── Execution log ────────────────────────────────────────────────────

    @Override
    public synchronized LogEntry appendLog(String runId, String taskId, String workerId, LogEntryKind kind,
                                           String message, Instant timestamp) {
        var entry = new LogEntry(nextSequence, runId, taskId, workerId, kind, message, timestamp);
        execute("INSERT INTO tl_log_entries (" + LOG_COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?)", ps -> {
            ps.setLong(1, entry.sequence());
            ps.setString(2, runId);
            ps.setString(3, taskId);
            ps.setString(4, workerId);
            ps.setString(5, kind.name());
            ps.setString(6, message);
            ps.setTimestamp(7, timestamp(timestamp));
        });
        nextSequence++;
        return entry;
    }

    @Override
    public List<LogEntry> logForRun(String runId) {
        return query("SELECT " + LOG_COLUMNS + " FROM tl_log_entries WHERE run_id = ? ORDER BY seq",
                ps -> ps.setString(1, runId), this::mapLogEntry);
    }

    @Override
    public List<LogEntry> logForTask(String runId, String taskId) {
        return query("SELECT " + LOG_COLUMNS + " FROM tl_log_entries WHERE run_id = ? AND task_id = ? ORDER BY seq",
                ps -> {
                    ps.setString(1, runId);
                    ps.setString(2, taskId);
                }, this::mapLogEntry);
    }

    @Override
    public List<LogEntry> logForTaskAllRuns(String taskId) {
        return query("SELECT " + LOG_COLUMNS + " FROM tl_log_entries WHERE task_id = ? ORDER BY seq",
                ps -> ps.setString(1, taskId), this::mapLogEntry);
    }

    // ── Attempts ─────────────────────────────────────────────────────────

    @Override
    public void recordAttempt(TaskAttempt attempt) {
        upsert("tl_task_attempts", ATTEMPT_COLUMNS, ps -> {
            ps.setString(1, attempt.taskId());
            ps.setString(2, attempt.runId());
            ps.setInt(3, attempt.attempt());
            ps.setString(4, attempt.outcome().name());
            ps.setString(5, attempt.reason() != null ? attempt.reason().name() : null);
            ps.setString(6, attempt.lastError());
            ps.setString(7, toJson(attempt.filesModified()));
            ps.setString(8, toJson(attempt.checkpoints()));
            ps.setTimestamp(9, timestamp(attempt.finishedAt()));
            ps.setString(10, attempt.workerId());
        });
    }

    @Override
    public List<TaskAttempt> attemptsForTask(String taskId) {
        return query("SELECT " + ATTEMPT_COLUMNS + " FROM tl_task_attempts WHERE task_id = ? ORDER BY finished_at, run_id, attempt",
                ps -> ps.setString(1, taskId), rs -> {
                    String reason = rs.getString("reason");
                    return new TaskAttempt(
                            rs.getString("task_id"),
                            rs.getString("run_id"),
                            rs.getString("worker_id"),
                            rs.getInt("attempt"),
                            WorkerResult.Outcome.valueOf(rs.getString("outcome")),
                            reason != null ? FailureReason.valueOf(reason) : null,
                            rs.getString("last_error"),
                            fromJson(rs.getString("files_modified"), STRING_LIST),
                            fromJson(rs.getString("checkpoints"), STRING_LIST),
                            instant(rs, "finished_at"));
                });
    }

    // ── Row mapping ──────────────────────────────────────────────────────

    private TaskList mapTaskList(ResultSet rs) throws SQLException {
        return new TaskList(
                rs.getString("id"),
                rs.getString("list_name"),
                TaskListStatus.valueOf(rs.getString("status")),
                rs.getBoolean("approved"),
                rs.getInt("max_parallel_workers"),
                fromJson(rs.getString("task_ids"), STRING_LIST),
                fromJson(rs.getString("progress"), TaskListProgress.class),
                instant(rs, "updated_at"));
    }

    private ExecutionRun mapRun(ResultSet rs) throws SQLException {
        return new ExecutionRun(
                rs.getString("id"),
                rs.getString("task_list_id"),
                rs.getInt("run_number"),
                RunStatus.valueOf(rs.getString("status")),
                rs.getInt("tasks_total"),
                rs.getInt("tasks_completed"),
                rs.getInt("tasks_failed"),
                rs.getInt("tasks_blocked"),
                rs.getInt("wave_count"),
                rs.getInt("waves_completed"),
                rs.getInt("peak_workers"),
                rs.getString("failure_reason"),
                instant(rs, "started_at"),
                instant(rs, "completed_at"));
    }

    private WorkerInstance mapWorker(ResultSet rs) throws SQLException {
        return new WorkerInstance(
                rs.getString("id"),
                rs.getString("run_id"),
                rs.getString("wave_id"),
                rs.getString("task_id"),
                rs.getInt("attempt"),
                WorkerStatus.valueOf(rs.getString("status")),
                instant(rs, "last_heartbeat_at"),
                rs.getInt("missed_heartbeats"),
                rs.getInt("progress_percent"),
                rs.getString("current_step"),
                instant(rs, "spawned_at"),
                instant(rs, "terminated_at"),
                rs.getString("termination_reason"));
    }

    private LogEntry mapLogEntry(ResultSet rs) throws SQLException {
        return new LogEntry(
                rs.getLong("seq"),
                rs.getString("run_id"),
                rs.getString("task_id"),
                rs.getString("worker_id"),
                LogEntryKind.valueOf(rs.getString("kind")),
                rs.getString("message"),
                instant(rs, "created_at"));
    }

    // ── JDBC helpers ─────────────────────────────────────────────────────

    @FunctionalInterface
    private interface Binder {
        void bind(PreparedStatement ps) throws SQLException;
    }

    @FunctionalInterface
    private interface RowMapper<T> {
        T map(ResultSet rs) throws SQLException;
    }

    /**
     * Binds parameters 1..n-1 to the non-key columns and parameter n to the key, in column order,
     * so the same binder serves both the UPDATE and the INSERT. The first column is the key.
     */
    private void upsert(String table, String columns, Binder binder) {
        String[] cols = columns.split(",\\s*");
        String key = cols[0];
        var sets = new ArrayList<String>();
        var insertCols = new ArrayList<String>();
        for (int i = 1; i < cols.length; i++) {
            sets.add(cols[i] + " = ?");
            insertCols.add(cols[i]);
        }
        insertCols.add(key);
        String update = "UPDATE " + table + " SET " + String.join(", ", sets) + " WHERE " + key + " = ?";
        String insert = "INSERT INTO " + table + " (" + String.join(", ", insertCols) + ") VALUES ("
                + String.join(", ", Collections.nCopies(cols.length, "?")) + ")";

        try (Connection conn = dataSource.getConnection()) {
            int updated;
            try (PreparedStatement ps = conn.prepareStatement(update)) {
                binder.bind(ps);
                updated = ps.executeUpdate();
            }
            if (updated == 0) {
                try (PreparedStatement ps = conn.prepareStatement(insert)) {
                    binder.bind(ps);
                    ps.executeUpdate();
                }
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to write " + table, e);
        }
    }

    private void execute(String sql, Binder binder) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            binder.bind(ps);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new StoreException("Failed to execute: " + sql, e);
        }
    }

    private <T> List<T> query(String sql, Binder binder, RowMapper<T> mapper) {
        var results = new ArrayList<T>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            binder.bind(ps);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    results.add(mapper.map(rs));
                }
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to query: " + sql, e);
        }
        return results;
    }

    private <T> Optional<T> queryOne(String sql, Binder binder, RowMapper<T> mapper) {
        var results = query(sql, binder, mapper);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    private static Timestamp timestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private static Instant instant(ResultSet rs, String column) throws SQLException {
        Timestamp ts = rs.getTimestamp(column);
        return ts != null ? ts.toInstant() : null;
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new StoreException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private <T> T fromJson(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new StoreException("Failed to deserialize " + type.getSimpleName(), e);
        }
    }

    private <T> T fromJson(String json, TypeReference<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new StoreException("Failed to deserialize JSON column", e);
        }
    }
}
