package com.tasklane.core.engine;

import java.util.List;
import java.util.Set;

/**
 * Result of validating a task list before approval or execution.
 *
 * @param taskListId    validated list
 * @param problems      human-readable readiness problems; empty when the list is ready
 * @param cyclicTaskIds tasks on a dependency cycle, if any
 */
public record ReadinessReport(String taskListId, List<String> problems, Set<String> cyclicTaskIds) {

    public ReadinessReport {
        problems = List.copyOf(problems);
        cyclicTaskIds = Set.copyOf(cyclicTaskIds);
    }

    public boolean isReady() {
        return problems.isEmpty();
    }

    public boolean cycleDetected() {
        return !cyclicTaskIds.isEmpty();
    }
}
