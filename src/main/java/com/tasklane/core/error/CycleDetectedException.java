package com.tasklane.core.error;

import java.util.Set;

/**
 * Thrown when depends_on edges form a cycle; a run is never started for such a list.
 */
public class CycleDetectedException extends TasklaneException {

    private final Set<String> cyclicTaskIds;

    public CycleDetectedException(Set<String> cyclicTaskIds) {
        super("Dependency cycle detected among tasks " + cyclicTaskIds);
        this.cyclicTaskIds = Set.copyOf(cyclicTaskIds);
    }

    public Set<String> cyclicTaskIds() {
        return cyclicTaskIds;
    }
}
