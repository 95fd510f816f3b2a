package com.tasklane.worker;

import com.tasklane.core.model.Task;

import java.io.Serializable;

/**
 * Typed dispatch message sent to a build agent: one task plus the context needed to resume it.
 *
 * @param runId       owning run (isolation lane)
 * @param taskListId  owning task list
 * @param waveNumber  wave the task belongs to
 * @param workerId    worker executing this command
 * @param attempt     1-based attempt number within the run
 * @param task        the task to execute
 * @param resumption  log tail from earlier workers on this task in this run; empty on a first attempt
 */
public record DispatchCommand(
    String runId,
    String taskListId,
    int waveNumber,
    String workerId,
    int attempt,
    Task task,
    ResumptionContext resumption
) implements Serializable {

    public DispatchCommand {
        resumption = resumption != null ? resumption : ResumptionContext.empty(task.id());
    }
}
