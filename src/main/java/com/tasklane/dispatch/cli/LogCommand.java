package com.tasklane.dispatch.cli;

import com.tasklane.core.engine.RunCoordinator;
import com.tasklane.core.error.NotFoundException;
import com.tasklane.core.model.LogEntryKind;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * CLI command: tasklane log &lt;run-id&gt; [--task id]
 * <p>
 * Prints a run's execution log in append order.
 */
@Command(name = "log", mixinStandardHelpOptions = true, description = "Show a run's execution log")
@Component
public class LogCommand implements Runnable {

    @Parameters(index = "0", description = "Run ID")
    private String runId;

    @Option(names = {"--task", "-t"}, description = "Only entries for this task")
    private String taskId;

    private final RunCoordinator coordinator;

    public LogCommand(RunCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        try {
            var entries = coordinator.log(runId, taskId);
            if (entries.isEmpty()) {
                ConsoleOutput.info("No log entries for run " + runId + (taskId != null ? " task " + taskId : ""));
                return;
            }
            for (var entry : entries) {
                String line = String.format("  [%d] %s %-12s %-10s %-14s %s", entry.sequence(), entry.timestamp(),
                        entry.taskId(), entry.workerId(), entry.kind(), entry.message());
                if (entry.kind() == LogEntryKind.ERROR || entry.kind() == LogEntryKind.FAILED
                        || entry.kind() == LogEntryKind.INTERRUPTED) {
                    ConsoleOutput.error(line.trim());
                } else {
                    System.out.println(line);
                }
            }
        } catch (NotFoundException e) {
            ConsoleOutput.error(e.getMessage());
        }
    }
}
