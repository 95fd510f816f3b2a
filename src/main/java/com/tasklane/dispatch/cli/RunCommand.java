package com.tasklane.dispatch.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tasklane.core.engine.RunCoordinator;
import com.tasklane.core.engine.TaskListStateMachine;
import com.tasklane.core.error.TasklaneException;
import com.tasklane.core.events.EventBus;
import com.tasklane.core.model.RunStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeoutException;

/**
 * CLI command: tasklane run &lt;task-list.json&gt;
 * <p>
 * Submits a task list file, approves it, starts a run and streams wave and task progress
 * until the run finishes. Exit code 0 only when the run COMPLETED.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Execute a task list file")
@Component
public class RunCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RunCommand.class);

    @Parameters(index = "0", description = "Task list JSON file")
    private Path file;

    @Option(names = {"--timeout"}, description = "Minutes to wait for the run (default: ${DEFAULT-VALUE})",
            defaultValue = "120")
    private long timeoutMinutes;

    private final TaskListStateMachine taskLists;
    private final RunCoordinator coordinator;
    private final EventBus eventBus;
    private final ObjectMapper objectMapper;

    public RunCommand(TaskListStateMachine taskLists, RunCoordinator coordinator,
                      EventBus eventBus, ObjectMapper objectMapper) {
        this.taskLists = taskLists;
        this.coordinator = coordinator;
        this.eventBus = eventBus;
        this.objectMapper = objectMapper;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        String runId;
        EventBus.Subscription subscription = null;
        try {
            var request = TaskListFiles.read(objectMapper, file);
            var list = taskLists.submit(request.toTaskList(), request.toTasks());
            ConsoleOutput.info("Submitted task list " + list.id() + " (" + list.taskIds().size() + " tasks)");
            taskLists.approve(list.id());

            subscription = eventBus.subscribeAll(ConsoleOutput::event);
            var run = coordinator.startRun(list.id());
            runId = run.id();
            ConsoleOutput.info("Run " + runId + " started: " + run.tasksTotal() + " tasks in "
                    + run.waveCount() + " waves");

            var finished = coordinator.awaitRun(runId, Duration.ofMinutes(timeoutMinutes));
            ConsoleOutput.summary(coordinator.summary(runId));
            return finished.status() == RunStatus.COMPLETED ? 0 : 1;
        } catch (IOException e) {
            ConsoleOutput.error("Cannot read task list: " + e.getMessage());
            return 2;
        } catch (TasklaneException | IllegalArgumentException | IllegalStateException e) {
            ConsoleOutput.error(e.getMessage());
            return 2;
        } catch (TimeoutException e) {
            ConsoleOutput.error("Run did not finish within " + timeoutMinutes + " minutes");
            return 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ConsoleOutput.info("Interrupted.");
            return 130;
        } finally {
            if (subscription != null) {
                subscription.unsubscribe();
            }
            log.debug("Run command finished for {}", file);
        }
    }
}
