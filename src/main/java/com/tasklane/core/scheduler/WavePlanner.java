package com.tasklane.core.scheduler;

import com.tasklane.core.error.ConflictUnresolvableException;
import com.tasklane.core.error.CycleDetectedException;
import com.tasklane.core.metrics.TasklaneMetrics;
import com.tasklane.core.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Partitions a task list into ordered waves.
 *
 * <p>Each iteration computes the ready set among tasks not yet assigned a wave, then greedily
 * fills the wave in priority order (score descending, task ID ascending), deferring any task that
 * conflicts with one already placed. Deferred tasks stay ready and seed the next wave. The first
 * candidate of every iteration is always placed, so N tasks need at most N waves.
 */
@Service
public class WavePlanner {

    private static final Logger log = LoggerFactory.getLogger(WavePlanner.class);

    /**
     * @param waveNumber 1-based
     * @param taskIds    members in dispatch order
     */
    public record PlannedWave(int waveNumber, List<String> taskIds) {
        public PlannedWave {
            taskIds = List.copyOf(taskIds);
        }
    }

    /**
     * @param waves       ordered waves
     * @param unplaceable tasks that can never become ready, mapped to the dependencies holding them
     * @param deferrals   number of times a ready task was pushed to a later wave by a conflict
     */
    public record WavePlan(List<PlannedWave> waves, Map<String, List<String>> unplaceable, int deferrals) {
        public WavePlan {
            waves = List.copyOf(waves);
            unplaceable = Map.copyOf(unplaceable);
        }

        public int taskCount() {
            return waves.stream().mapToInt(w -> w.taskIds().size()).sum();
        }

        /** Wave number for a task, or -1 when the task was not placed. */
        public int waveOf(String taskId) {
            for (var wave : waves) {
                if (wave.taskIds().contains(taskId)) return wave.waveNumber();
            }
            return -1;
        }
    }

    private final DependencyResolver resolver;
    private final FileConflictChecker conflictChecker;
    private final PriorityScorer scorer;
    private final TasklaneMetrics metrics;

    @Autowired
    public WavePlanner(DependencyResolver resolver, FileConflictChecker conflictChecker,
                       PriorityScorer scorer, @Autowired(required = false) TasklaneMetrics metrics) {
        this.resolver = resolver;
        this.conflictChecker = conflictChecker;
        this.scorer = scorer;
        this.metrics = metrics;
    }

    /**
     * Plans every task in {@code tasksToPlan}. Tasks in {@code allTasks} that are outside the plan
     * and already in a terminal-success state count as satisfied dependencies.
     *
     * @throws CycleDetectedException        if the tasks to plan contain a dependency cycle
     * @throws ConflictUnresolvableException if a task can never share a wave, even with itself
     */
    public WavePlan plan(List<Task> tasksToPlan, List<Task> allTasks) {
        long start = System.currentTimeMillis();

        var initial = resolver.resolve(tasksToPlan, satisfiedOutsidePlan(tasksToPlan, allTasks));
        if (initial.cycleDetected()) {
            throw new CycleDetectedException(initial.cyclicTaskIds());
        }
        for (var task : tasksToPlan) {
            if (task.conflictsWith().contains(task.id())) {
                throw new ConflictUnresolvableException("Task " + task.id() + " declares a conflict with itself");
            }
        }

        Map<String, Integer> scores = scorer.scores(allTasks.isEmpty() ? tasksToPlan : allTasks);
        Comparator<Task> byPriority = Comparator
                .comparing((Task t) -> scores.getOrDefault(t.id(), 0)).reversed()
                .thenComparing(Task::id);

        Set<String> satisfied = new HashSet<>(satisfiedOutsidePlan(tasksToPlan, allTasks));
        var unassigned = new ArrayList<>(tasksToPlan);
        var waves = new ArrayList<PlannedWave>();
        int deferrals = 0;

        while (!unassigned.isEmpty()) {
            var ready = new ArrayList<>(resolver.resolve(unassigned, satisfied).ready());
            if (ready.isEmpty()) {
                break;
            }
            ready.sort(byPriority);

            var placed = new ArrayList<Task>();
            var deferred = new ArrayList<String>();
            for (var candidate : ready) {
                Task blocker = firstExcluding(candidate, placed);
                if (blocker != null) {
                    log.debug("  {} conflicts with {} in wave {}, deferring", candidate.id(), blocker.id(), waves.size() + 1);
                    deferred.add(candidate.id());
                    if (metrics != null) metrics.recordConflictDeferral();
                    continue;
                }
                placed.add(candidate);
            }
            if (placed.isEmpty()) {
                throw new ConflictUnresolvableException("No ready task could be placed into wave "
                        + (waves.size() + 1) + " among " + ready.stream().map(Task::id).toList());
            }

            var ids = placed.stream().map(Task::id).toList();
            waves.add(new PlannedWave(waves.size() + 1, ids));
            satisfied.addAll(ids);
            unassigned.removeAll(placed);
            deferrals += deferred.size();
            if (!deferred.isEmpty()) {
                log.info("Wave {}: {} task(s) deferred to next wave due to conflicts: {}",
                        waves.size(), deferred.size(), deferred);
            }
        }

        var unplaceable = new LinkedHashMap<String, List<String>>();
        if (!unassigned.isEmpty()) {
            for (var task : unassigned) {
                unplaceable.put(task.id(), task.dependsOn().stream()
                        .filter(dep -> !satisfied.contains(dep))
                        .toList());
            }
            log.warn("{} task(s) cannot be placed into any wave: {}", unplaceable.size(), unplaceable);
        }

        long elapsed = System.currentTimeMillis() - start;
        if (metrics != null) metrics.recordPlanningDuration(elapsed);
        log.info("Planned {} task(s) into {} wave(s) in {}ms", tasksToPlan.size() - unassigned.size(), waves.size(), elapsed);
        return new WavePlan(waves, unplaceable, deferrals);
    }

    private Task firstExcluding(Task candidate, List<Task> placed) {
        for (var other : placed) {
            if (conflictChecker.excludes(candidate, other)) return other;
        }
        return null;
    }

    private static Set<String> satisfiedOutsidePlan(List<Task> tasksToPlan, List<Task> allTasks) {
        var planIds = new HashSet<String>();
        tasksToPlan.forEach(t -> planIds.add(t.id()));
        var satisfied = new HashSet<String>();
        for (var task : allTasks) {
            if (!planIds.contains(task.id()) && task.status().isTerminalSuccess()) {
                satisfied.add(task.id());
            }
        }
        return satisfied;
    }
}
