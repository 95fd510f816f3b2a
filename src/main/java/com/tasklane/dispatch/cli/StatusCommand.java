package com.tasklane.dispatch.cli;

import com.tasklane.core.engine.RunCoordinator;
import com.tasklane.core.engine.TaskListStateMachine;
import com.tasklane.core.error.NotFoundException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.stream.Stream;

/**
 * CLI command: tasklane status [run-id]
 * <p>
 * Without a run ID prints engine-wide status and every known task list. With a run ID prints the
 * run's waves and summary, or with {@code --watch} follows the run's events from a running server.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Show engine or run status")
@Component
public class StatusCommand implements Runnable {

    @Parameters(index = "0", arity = "0..1", description = "Run ID")
    private String runId;

    @Option(names = {"--watch", "-w"}, description = "Watch for live updates via SSE")
    private boolean watch;

    @Option(names = {"--port"}, description = "Server port for watch mode (default: ${DEFAULT-VALUE})",
            defaultValue = "8080")
    private int port;

    private final RunCoordinator coordinator;
    private final TaskListStateMachine taskLists;

    public StatusCommand(RunCoordinator coordinator, TaskListStateMachine taskLists) {
        this.coordinator = coordinator;
        this.taskLists = taskLists;
    }

    @Override
    public void run() {
        if (watch) {
            runWatchMode();
            return;
        }
        ConsoleOutput.printBanner();
        if (runId == null) {
            printEngineStatus();
            return;
        }

        try {
            var run = coordinator.getRun(runId);
            System.out.println();
            System.out.println("RUN " + run.id() + " (#" + run.runNumber() + ") of " + run.taskListId());
            System.out.printf("  %-6s %-10s %-5s %-5s %-5s %s%n", "WAVE", "STATUS", "DONE", "FAIL", "SKIP", "TASKS");
            System.out.println("  " + "-".repeat(64));
            for (var wave : coordinator.waves(runId)) {
                System.out.printf("  %-6d %-10s %-5d %-5d %-5d %s%n", wave.waveNumber(), wave.status(),
                        wave.completedCount(), wave.failedCount(), wave.skippedCount(),
                        ConsoleOutput.truncate(String.join(", ", wave.taskIds()), 40));
            }
            ConsoleOutput.summary(coordinator.summary(runId));
        } catch (NotFoundException e) {
            ConsoleOutput.error(e.getMessage());
        }
    }

    private void printEngineStatus() {
        var status = coordinator.status();
        ConsoleOutput.info(String.format("Active runs: %d | Running workers: %d | Free worker slots: %d",
                status.activeRuns(), status.runningWorkers(), status.availableWorkerSlots()));
        var lists = taskLists.list();
        if (lists.isEmpty()) {
            ConsoleOutput.info("No task lists.");
            return;
        }
        System.out.println();
        System.out.printf("  %-20s %-12s %-10s %s%n", "TASK LIST", "STATUS", "PROGRESS", "NAME");
        System.out.println("  " + "-".repeat(64));
        for (var list : lists) {
            var p = list.progress();
            System.out.printf("  %-20s %-12s %3d%%       %s%n", list.id(), list.status(),
                    p.percentComplete(), ConsoleOutput.truncate(list.name(), 30));
        }
    }

    private void runWatchMode() {
        ConsoleOutput.printBanner();
        if (runId == null) {
            ConsoleOutput.error("--watch needs a run ID");
            return;
        }
        ConsoleOutput.info("Watching run " + runId + " (connecting to localhost:" + port + ")...");
        System.out.println();

        URI uri = URI.create("http://localhost:" + port + "/api/v1/runs/" + runId + "/events");
        try {
            HttpClient client = HttpClient.newBuilder()
                    .connectTimeout(Duration.ofSeconds(5))
                    .build();
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(uri)
                    .header("Accept", "text/event-stream")
                    .GET()
                    .build();
            HttpResponse<Stream<String>> response = client.send(request, HttpResponse.BodyHandlers.ofLines());

            if (response.statusCode() == 404) {
                ConsoleOutput.error("Run not found: " + runId);
                return;
            }
            if (response.statusCode() != 200) {
                ConsoleOutput.error("Server returned HTTP " + response.statusCode());
                return;
            }

            final String[] currentEventType = {""};
            response.body().forEach(line -> {
                if (line.startsWith("event:")) {
                    currentEventType[0] = line.substring(6).trim();
                } else if (line.startsWith("data:")) {
                    String eventType = currentEventType[0].isEmpty() ? "message" : currentEventType[0];
                    ConsoleOutput.watchEvent(eventType, line.substring(5).trim());
                    currentEventType[0] = "";
                }
            });
            System.out.println();
            ConsoleOutput.info("Stream ended.");
        } catch (ConnectException e) {
            ConsoleOutput.error("Cannot connect to Tasklane server at localhost:" + port);
            ConsoleOutput.info("Start the server first: tasklane serve");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ConsoleOutput.info("Watch interrupted.");
        } catch (Exception e) {
            ConsoleOutput.error("Watch failed: " + e.getMessage());
        }
    }
}
