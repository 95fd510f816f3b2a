package com.tasklane.core.scheduler;

import com.tasklane.core.engine.EngineProperties;
import com.tasklane.core.model.Task;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;

/**
 * Deterministic priority score: {@code blockedCount * 20 + (quickWin ? 15 : 0) + deadlineBonus},
 * where the deadline bonus is 30 when the deadline falls within the configured window (overdue included).
 * Scores influence ordering only, never correctness.
 */
@Service
public class PriorityScorer {

    static final int BLOCKED_WEIGHT = 20;
    static final int QUICK_WIN_BONUS = 15;
    static final int DEADLINE_BONUS = 30;

    private final DependencyResolver resolver;
    private final Clock clock;
    private final Duration deadlineWindow;

    @Autowired
    public PriorityScorer(DependencyResolver resolver, Clock clock, EngineProperties properties) {
        this(resolver, clock, properties.getDeadlineWindowDays());
    }

    PriorityScorer(DependencyResolver resolver, Clock clock, int deadlineWindowDays) {
        this.resolver = resolver;
        this.clock = clock;
        this.deadlineWindow = Duration.ofDays(deadlineWindowDays);
    }

    public int score(Task task, Collection<Task> allTasks) {
        return score(task, resolver.transitiveDependents(task.id(), allTasks).size());
    }

    /**
     * Scores every task in one pass.
     */
    public Map<String, Integer> scores(Collection<Task> allTasks) {
        var counts = resolver.dependentCounts(allTasks);
        var scores = new HashMap<String, Integer>();
        for (var task : allTasks) {
            scores.put(task.id(), score(task, counts.getOrDefault(task.id(), 0)));
        }
        return scores;
    }

    public int blockedCount(Task task, Collection<Task> allTasks) {
        return resolver.transitiveDependents(task.id(), allTasks).size();
    }

    private int score(Task task, int blockedCount) {
        int score = blockedCount * BLOCKED_WEIGHT;
        if (task.quickWin()) {
            score += QUICK_WIN_BONUS;
        }
        if (isDeadlineNear(task.deadline())) {
            score += DEADLINE_BONUS;
        }
        return score;
    }

    private boolean isDeadlineNear(Instant deadline) {
        if (deadline == null) return false;
        return !deadline.isAfter(Instant.now(clock).plus(deadlineWindow));
    }
}
