package com.tasklane.core.engine;

import com.tasklane.core.error.NotFoundException;
import com.tasklane.core.error.TaskListNotReadyException;
import com.tasklane.core.events.EventBus;
import com.tasklane.core.events.EventTypes;
import com.tasklane.core.model.Task;
import com.tasklane.core.model.TaskList;
import com.tasklane.core.model.TaskListProgress;
import com.tasklane.core.model.TaskListStatus;
import com.tasklane.core.model.TaskStatus;
import com.tasklane.core.persistence.ExecutionStore;
import com.tasklane.core.scheduler.DependencyResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.tasklane.core.model.TaskListStatus.*;

/**
 * The list-level view clients observe. Owns submission, readiness validation, approval,
 * status transitions and aggregate progress counters.
 */
@Service
public class TaskListStateMachine {

    private static final Logger log = LoggerFactory.getLogger(TaskListStateMachine.class);

    private static final Map<TaskListStatus, Set<TaskListStatus>> TRANSITIONS = new EnumMap<>(TaskListStatus.class);

    static {
        TRANSITIONS.put(DRAFT, EnumSet.of(READY, ARCHIVED));
        TRANSITIONS.put(READY, EnumSet.of(IN_PROGRESS, DRAFT, ARCHIVED));
        TRANSITIONS.put(IN_PROGRESS, EnumSet.of(PAUSED, COMPLETED, FAILED, READY));
        TRANSITIONS.put(PAUSED, EnumSet.of(IN_PROGRESS, READY, ARCHIVED));
        TRANSITIONS.put(COMPLETED, EnumSet.of(ARCHIVED));
        TRANSITIONS.put(FAILED, EnumSet.of(READY, ARCHIVED));
        TRANSITIONS.put(ARCHIVED, EnumSet.noneOf(TaskListStatus.class));
    }

    private final ExecutionStore store;
    private final DependencyResolver resolver;
    private final EventBus eventBus;
    private final Clock clock;

    public TaskListStateMachine(ExecutionStore store, DependencyResolver resolver, EventBus eventBus, Clock clock) {
        this.store = store;
        this.resolver = resolver;
        this.eventBus = eventBus;
        this.clock = clock;
    }

    public static boolean canTransition(TaskListStatus from, TaskListStatus to) {
        return TRANSITIONS.getOrDefault(from, Set.of()).contains(to);
    }

    /**
     * Stores a new list in DRAFT together with its member tasks. When the list declares no
     * member IDs, the order of {@code tasks} becomes the position order.
     *
     * @throws IllegalArgumentException on duplicate task IDs, members without a task, or a task
     *                                  that already belongs to another active list
     */
    public TaskList submit(TaskList list, List<Task> tasks) {
        var byId = new HashMap<String, Task>();
        for (var task : tasks) {
            if (byId.put(task.id(), task) != null) {
                throw new IllegalArgumentException("Duplicate task id " + task.id() + " in list " + list.id());
            }
        }
        List<String> memberIds = list.taskIds().isEmpty() ? tasks.stream().map(Task::id).toList() : list.taskIds();
        for (String id : memberIds) {
            if (!byId.containsKey(id)) {
                throw new IllegalArgumentException("List " + list.id() + " references unknown task " + id);
            }
        }
        if (store.findTaskList(list.id()).isPresent()) {
            throw new IllegalArgumentException("Task list " + list.id() + " already exists");
        }
        for (var other : store.listTaskLists()) {
            if (other.status() == ARCHIVED) continue;
            for (String id : memberIds) {
                if (other.taskIds().contains(id)) {
                    throw new IllegalArgumentException("Task " + id + " already belongs to active list " + other.id());
                }
            }
        }

        var now = clock.instant();
        var draft = new TaskList(list.id(), list.name(), DRAFT, false, list.maxParallelWorkers(),
                memberIds, TaskListProgress.empty(memberIds.size()), now);
        for (String id : memberIds) {
            Task task = byId.get(id);
            store.saveTask(list.id(), task.status() != null ? task : task.withStatus(TaskStatus.DRAFT));
        }
        store.saveTaskList(draft);
        log.info("Submitted task list {} ({} tasks)", list.id(), memberIds.size());
        return draft;
    }

    /**
     * Checks that every member task can be executed: no dependency cycle, every dependency known
     * and completable, required checks defined, no task in conflict with itself.
     */
    public ReadinessReport validate(String taskListId) {
        var list = get(taskListId);
        var tasks = tasks(taskListId);
        var problems = new ArrayList<String>();
        var memberIds = new HashSet<>(list.taskIds());
        var byId = new HashMap<String, Task>();
        tasks.forEach(t -> byId.put(t.id(), t));

        var resolution = resolver.resolve(tasks);
        if (resolution.cycleDetected()) {
            problems.add("dependency cycle among " + resolution.cyclicTaskIds());
        }
        for (var task : tasks) {
            for (String dep : task.dependsOn()) {
                if (memberIds.contains(dep)) {
                    if (byId.get(dep).status() == TaskStatus.SUPERSEDED) {
                        problems.add(task.id() + " depends on superseded task " + dep);
                    }
                } else if (store.findTask(dep).map(d -> !d.status().isTerminalSuccess()).orElse(true)) {
                    problems.add(task.id() + " depends on unknown or incomplete task " + dep);
                }
            }
            if (task.checks().isEmpty() && !task.status().isSettled()) {
                problems.add(task.id() + " has no checks defined");
            }
            if (task.conflictsWith().contains(task.id())) {
                problems.add(task.id() + " declares a conflict with itself");
            }
        }
        return new ReadinessReport(taskListId, problems, resolution.cyclicTaskIds());
    }

    /**
     * Approves a DRAFT list and moves it to READY. Member tasks in DRAFT become PENDING.
     *
     * @throws TaskListNotReadyException if validation reports any problem
     */
    public TaskList approve(String taskListId) {
        var list = get(taskListId);
        if (list.status() == READY && list.approved()) {
            return list;
        }
        var report = validate(taskListId);
        if (!report.isReady()) {
            throw new TaskListNotReadyException("Task list " + taskListId + " failed readiness validation", report.problems());
        }
        for (var task : tasks(taskListId)) {
            if (task.status() == TaskStatus.DRAFT) {
                store.saveTask(taskListId, task.withStatus(TaskStatus.PENDING));
            }
        }
        store.saveTaskList(list.withApproved(true, clock.instant()));
        return transition(taskListId, READY);
    }

    /**
     * Moves a list that has no RUNNING or PAUSED run. While a run is active the list status is
     * owned by the run coordinator.
     *
     * @throws IllegalStateException if a run is active or the transition is not allowed from the
     *                               current status
     */
    public TaskList transition(String taskListId, TaskListStatus target) {
        var active = store.activeRuns().stream()
                .filter(r -> r.taskListId().equals(taskListId))
                .findFirst();
        if (active.isPresent()) {
            throw new IllegalStateException("Task list " + taskListId + " has active run "
                    + active.get().id() + " (" + active.get().status() + ")");
        }
        return advance(taskListId, target);
    }

    public TaskList archive(String taskListId) {
        return transition(taskListId, ARCHIVED);
    }

    // Run coordinator path: no active-run check.
    TaskList advance(String taskListId, TaskListStatus target) {
        var list = get(taskListId);
        if (list.status() == target) {
            return list;
        }
        if (!canTransition(list.status(), target)) {
            throw new IllegalStateException("Task list " + taskListId + " cannot move from "
                    + list.status() + " to " + target);
        }
        if (target == READY && !list.approved()) {
            throw new IllegalStateException("Task list " + taskListId + " is not approved");
        }
        var updated = list.withStatus(target, clock.instant());
        if (target == DRAFT) {
            updated = updated.withApproved(false, updated.updatedAt());
        }
        store.saveTaskList(updated);
        log.info("Task list {} {} -> {}", taskListId, list.status(), target);
        eventBus.publish(EventTypes.LIST_STATUS_CHANGED, null, null,
                Map.of("taskListId", taskListId, "from", list.status().name(), "to", target.name()));
        return updated;
    }

    /**
     * Recomputes total / completed / failed / blocked counters from member task statuses.
     */
    public TaskList refreshProgress(String taskListId) {
        var list = get(taskListId);
        int completed = 0;
        int failed = 0;
        int blocked = 0;
        for (var task : tasks(taskListId)) {
            if (task.status().isTerminalSuccess()) completed++;
            else if (task.status() == TaskStatus.FAILED) failed++;
            else if (task.status() == TaskStatus.BLOCKED) blocked++;
        }
        var updated = list.withProgress(new TaskListProgress(list.taskIds().size(), completed, failed, blocked), clock.instant());
        store.saveTaskList(updated);
        return updated;
    }

    public TaskList get(String taskListId) {
        return store.findTaskList(taskListId).orElseThrow(() -> new NotFoundException("Task list", taskListId));
    }

    public List<TaskList> list() {
        return store.listTaskLists();
    }

    /**
     * Member tasks in position order.
     */
    public List<Task> tasks(String taskListId) {
        var list = get(taskListId);
        var byId = new HashMap<String, Task>();
        store.tasksForList(taskListId).forEach(t -> byId.put(t.id(), t));
        var ordered = new ArrayList<Task>();
        for (String id : list.taskIds()) {
            Task task = byId.get(id);
            if (task != null) ordered.add(task);
        }
        return ordered;
    }

    void updateTask(String taskListId, Task task) {
        store.saveTask(taskListId, task);
    }
}
