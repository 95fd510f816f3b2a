package com.tasklane.core.scheduler;

import com.tasklane.core.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Partitions tasks into ready and blocked sets based on their depends_on edges.
 *
 * <p>A dependency is satisfied when the referenced task is in a terminal-success state
 * or its ID is passed in {@code satisfiedIds} (e.g. tasks already placed in an earlier wave).
 * Dependency cycles are reported, never followed: every task on a cycle, and every task
 * downstream of one, is returned as permanently blocked.
 */
@Service
public class DependencyResolver {

    private static final Logger log = LoggerFactory.getLogger(DependencyResolver.class);

    /**
     * Result of a resolution pass.
     *
     * @param ready                tasks whose every dependency is satisfied, in input order
     * @param blocked              all other tasks, in input order
     * @param cyclicTaskIds        tasks that sit on a dependency cycle
     * @param permanentlyBlocked   cyclic tasks plus everything that transitively depends on them
     * @param missingDependencies  task ID to dependency IDs that are neither known nor satisfied
     */
    public record Resolution(
        List<Task> ready,
        List<Task> blocked,
        Set<String> cyclicTaskIds,
        Set<String> permanentlyBlocked,
        Map<String, List<String>> missingDependencies
    ) {
        public boolean cycleDetected() {
            return !cyclicTaskIds.isEmpty();
        }
    }

    public Resolution resolve(Collection<Task> tasks) {
        return resolve(tasks, Set.of());
    }

    public Resolution resolve(Collection<Task> tasks, Set<String> satisfiedIds) {
        var byId = index(tasks);
        Set<String> cyclic = findCyclicTasks(byId);
        Set<String> permanentlyBlocked = new HashSet<>(cyclic);
        for (String id : cyclic) {
            permanentlyBlocked.addAll(transitiveDependents(id, tasks));
        }

        var ready = new ArrayList<Task>();
        var blocked = new ArrayList<Task>();
        var missing = new LinkedHashMap<String, List<String>>();

        for (var task : tasks) {
            if (permanentlyBlocked.contains(task.id())) {
                blocked.add(task);
                continue;
            }
            boolean satisfied = true;
            for (String dep : task.dependsOn()) {
                if (satisfiedIds.contains(dep)) continue;
                Task depTask = byId.get(dep);
                if (depTask == null) {
                    missing.computeIfAbsent(task.id(), k -> new ArrayList<>()).add(dep);
                    satisfied = false;
                } else if (!depTask.status().isTerminalSuccess()) {
                    satisfied = false;
                }
            }
            if (satisfied) {
                ready.add(task);
            } else {
                blocked.add(task);
            }
        }

        if (!cyclic.isEmpty()) {
            log.warn("Dependency cycle among {}, {} task(s) permanently blocked", cyclic, permanentlyBlocked.size());
        }
        log.debug("resolve: {} ready, {} blocked", ready.size(), blocked.size());
        return new Resolution(List.copyOf(ready), List.copyOf(blocked),
                Set.copyOf(cyclic), Set.copyOf(permanentlyBlocked), Map.copyOf(missing));
    }

    /**
     * Returns the IDs of every task that directly or transitively depends on {@code taskId}.
     */
    public Set<String> transitiveDependents(String taskId, Collection<Task> tasks) {
        var dependents = reverseEdges(tasks);
        var result = new LinkedHashSet<String>();
        var queue = new ArrayDeque<String>();
        queue.add(taskId);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (String next : dependents.getOrDefault(current, List.of())) {
                if (!next.equals(taskId) && result.add(next)) {
                    queue.add(next);
                }
            }
        }
        return result;
    }

    /**
     * Counts direct and transitive dependents for every task in one pass over the graph.
     */
    public Map<String, Integer> dependentCounts(Collection<Task> tasks) {
        var counts = new HashMap<String, Integer>();
        for (var task : tasks) {
            counts.put(task.id(), transitiveDependents(task.id(), tasks).size());
        }
        return counts;
    }

    private Map<String, List<String>> reverseEdges(Collection<Task> tasks) {
        var dependents = new HashMap<String, List<String>>();
        for (var task : tasks) {
            for (String dep : task.dependsOn()) {
                dependents.computeIfAbsent(dep, k -> new ArrayList<>()).add(task.id());
            }
        }
        return dependents;
    }

    private static Map<String, Task> index(Collection<Task> tasks) {
        var byId = new LinkedHashMap<String, Task>();
        for (var task : tasks) {
            byId.put(task.id(), task);
        }
        return byId;
    }

    // Tarjan's strongly connected components; members of a component with more than
    // one node, or with a self edge, lie on a cycle.
    private Set<String> findCyclicTasks(Map<String, Task> byId) {
        var state = new TarjanState();
        for (String id : byId.keySet()) {
            if (!state.index.containsKey(id)) {
                strongConnect(id, byId, state);
            }
        }
        return state.cyclic;
    }

    private void strongConnect(String id, Map<String, Task> byId, TarjanState state) {
        state.index.put(id, state.counter);
        state.lowLink.put(id, state.counter);
        state.counter++;
        state.stack.push(id);
        state.onStack.add(id);

        for (String dep : byId.get(id).dependsOn()) {
            if (!byId.containsKey(dep)) continue;
            if (!state.index.containsKey(dep)) {
                strongConnect(dep, byId, state);
                state.lowLink.put(id, Math.min(state.lowLink.get(id), state.lowLink.get(dep)));
            } else if (state.onStack.contains(dep)) {
                state.lowLink.put(id, Math.min(state.lowLink.get(id), state.index.get(dep)));
            }
        }

        if (state.lowLink.get(id).equals(state.index.get(id))) {
            var component = new ArrayList<String>();
            String member;
            do {
                member = state.stack.pop();
                state.onStack.remove(member);
                component.add(member);
            } while (!member.equals(id));

            if (component.size() > 1 || byId.get(id).dependsOn().contains(id)) {
                state.cyclic.addAll(component);
            }
        }
    }

    private static final class TarjanState {
        private final Map<String, Integer> index = new HashMap<>();
        private final Map<String, Integer> lowLink = new HashMap<>();
        private final Deque<String> stack = new ArrayDeque<>();
        private final Set<String> onStack = new HashSet<>();
        private final Set<String> cyclic = new TreeSet<>();
        private int counter;
    }
}
