package com.tasklane.core.escalation;

import com.tasklane.core.engine.EngineProperties;
import com.tasklane.core.model.LogEntry;
import com.tasklane.core.model.LogEntryKind;
import com.tasklane.core.model.TaskAttempt;
import com.tasklane.core.model.WorkerResult;
import com.tasklane.core.persistence.ExecutionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Decides whether a repeatedly failing task is still making headway.
 *
 * <p>Progress is absent between the two most recent failed attempts when the last error text is
 * identical, the set of modified files is unchanged and no new checkpoint was recorded. Modified
 * files and checkpoints are taken from the attempt result and from the FILE_CHANGE / CHECKPOINT
 * entries the worker appended to the execution log. History spans every run of the task.
 */
@Service
public class ProgressAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(ProgressAnalyzer.class);

    /**
     * @param taskId              analysed task
     * @param consecutiveFailures trailing failed attempts, across runs; cancelled attempts are ignored
     * @param progressDetected    whether the last two failed attempts differ
     * @param oscillating         whether recent errors alternate A-B-A (informational only)
     * @param shouldRetry         a further attempt is worthwhile
     * @param shouldEscalate      the task should be blocked and handed to remediation
     * @param analysis            human-readable findings, carried on the escalation event
     */
    public record Analysis(
        String taskId,
        int consecutiveFailures,
        boolean progressDetected,
        boolean oscillating,
        boolean shouldRetry,
        boolean shouldEscalate,
        String analysis
    ) {}

    private final ExecutionStore store;
    private final int escalationThreshold;

    @Autowired
    public ProgressAnalyzer(ExecutionStore store, EngineProperties properties) {
        this(store, properties.getEscalationThreshold());
    }

    ProgressAnalyzer(ExecutionStore store, int escalationThreshold) {
        this.store = store;
        this.escalationThreshold = escalationThreshold;
    }

    public Analysis analyze(String taskId) {
        var failures = trailingFailures(store.attemptsForTask(taskId));
        int count = failures.size();
        boolean oscillating = isOscillating(failures);

        if (count < escalationThreshold) {
            return new Analysis(taskId, count, true, oscillating, true, false,
                    count + " consecutive failure(s), below escalation threshold " + escalationThreshold);
        }

        if (count < 2) {
            // nothing to compare against
            return new Analysis(taskId, count, false, false, false, true,
                    "1 failure with no earlier attempt to compare; last error: " + failures.get(0).lastError());
        }

        var taskLog = store.logForTaskAllRuns(taskId);
        TaskAttempt previous = failures.get(count - 2);
        TaskAttempt latest = failures.get(count - 1);

        boolean sameError = Objects.equals(normalize(previous.lastError()), normalize(latest.lastError()));
        Set<String> previousFiles = filesOf(previous, taskLog);
        Set<String> latestFiles = filesOf(latest, taskLog);
        boolean sameFiles = previousFiles.equals(latestFiles);
        Set<String> newCheckpoints = new HashSet<>(checkpointsOf(latest, taskLog));
        newCheckpoints.removeAll(checkpointsOf(previous, taskLog));

        boolean progress = !sameError || !sameFiles || !newCheckpoints.isEmpty();
        String text = describe(count, latest, sameError, sameFiles, newCheckpoints, oscillating);

        if (progress) {
            log.info("Task {} failed {} times but is still making progress: {}", taskId, count, text);
        } else {
            log.warn("Task {} shows no progress after {} failures: {}", taskId, count, text);
        }
        return new Analysis(taskId, count, progress, oscillating, progress, !progress, text);
    }

    private static List<TaskAttempt> trailingFailures(List<TaskAttempt> attempts) {
        var failures = new ArrayList<TaskAttempt>();
        for (var attempt : attempts) {
            if (attempt.outcome() == WorkerResult.Outcome.SUCCESS) {
                failures.clear();
            } else if (attempt.failed()) {
                failures.add(attempt);
            }
        }
        return failures;
    }

    // error[N] equals error[N-2] but differs from error[N-1]
    private static boolean isOscillating(List<TaskAttempt> failures) {
        for (int i = 2; i < failures.size(); i++) {
            String current = normalize(failures.get(i).lastError());
            String oneBack = normalize(failures.get(i - 1).lastError());
            String twoBack = normalize(failures.get(i - 2).lastError());
            if (Objects.equals(current, twoBack) && !Objects.equals(current, oneBack)) {
                return true;
            }
        }
        return false;
    }

    private static Set<String> filesOf(TaskAttempt attempt, List<LogEntry> taskLog) {
        var files = new HashSet<>(attempt.filesModified());
        for (var entry : taskLog) {
            if (entry.kind() == LogEntryKind.FILE_CHANGE && entry.workerId().equals(attempt.workerId())) {
                files.add(entry.message());
            }
        }
        return files;
    }

    private static Set<String> checkpointsOf(TaskAttempt attempt, List<LogEntry> taskLog) {
        var checkpoints = new HashSet<>(attempt.checkpoints());
        for (var entry : taskLog) {
            if (entry.kind() == LogEntryKind.CHECKPOINT && entry.workerId().equals(attempt.workerId())) {
                checkpoints.add(entry.message());
            }
        }
        return checkpoints;
    }

    private static String normalize(String error) {
        return error == null ? null : error.strip();
    }

    private static String describe(int count, TaskAttempt latest, boolean sameError, boolean sameFiles,
                                   Set<String> newCheckpoints, boolean oscillating) {
        var sb = new StringBuilder();
        sb.append(count).append(" consecutive failures");
        sb.append("; last error ").append(sameError ? "unchanged" : "changed");
        sb.append("; modified files ").append(sameFiles ? "unchanged" : "changed");
        sb.append("; ").append(newCheckpoints.isEmpty() ? "no new checkpoints" : newCheckpoints.size() + " new checkpoint(s)");
        if (oscillating) {
            sb.append("; errors alternate between attempts");
        }
        if (latest.lastError() != null) {
            sb.append("; last error: ").append(latest.lastError());
        }
        return sb.toString();
    }
}
