package com.tasklane.worker;

import com.tasklane.core.model.LogEntryKind;

/**
 * Callback surface a build agent uses while it runs. Bound to a single worker.
 */
public interface WorkerChannel {

    /**
     * Reports liveness. Must be called at least once per heartbeat interval while the agent works.
     *
     * @param progressPercent 0-100
     * @param currentStep     short description of the current step, nullable
     */
    void heartbeat(int progressPercent, String currentStep);

    /**
     * Appends an entry to the execution log under the worker's run and task.
     */
    void log(LogEntryKind kind, String message);
}
