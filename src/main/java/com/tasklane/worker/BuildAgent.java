package com.tasklane.worker;

import com.tasklane.core.model.WorkerResult;

/**
 * The opaque unit of work the supervisor spawns for a task.
 * <p>
 * {@link #execute} blocks until the agent finishes and returns exactly one terminal result.
 * The supervisor terminates an agent by interrupting the executing thread; implementations must
 * release any external resources (processes, containers) and return or throw promptly when interrupted.
 */
public interface BuildAgent {

    WorkerResult execute(DispatchCommand command, WorkerChannel channel) throws InterruptedException;

    /** Short provider name used in logs and health output. */
    String name();

    /** Whether the agent is able to accept work. */
    default boolean isAvailable() {
        return true;
    }
}
