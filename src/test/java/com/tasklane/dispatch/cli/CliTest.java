package com.tasklane.dispatch.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.tasklane.core.engine.EngineProperties;
import com.tasklane.core.engine.RunCoordinator;
import com.tasklane.core.engine.TaskListStateMachine;
import com.tasklane.core.error.NotFoundException;
import com.tasklane.core.error.TaskListNotReadyException;
import com.tasklane.core.events.EventBus;
import com.tasklane.core.health.HealthCheckService;
import com.tasklane.core.health.HealthStatus;
import com.tasklane.core.model.ExecutionRun;
import com.tasklane.core.model.FailureKind;
import com.tasklane.core.model.LogEntry;
import com.tasklane.core.model.LogEntryKind;
import com.tasklane.core.model.RunStatus;
import com.tasklane.core.model.RunSummary;
import com.tasklane.core.model.TaskList;
import com.tasklane.core.model.TaskListStatus;
import com.tasklane.core.scheduler.DependencyResolver;
import com.tasklane.core.scheduler.FileConflictChecker;
import com.tasklane.core.scheduler.PriorityScorer;
import com.tasklane.core.scheduler.WavePlanner;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Tests for the Tasklane CLI command structure.
 * These exercise picocli directly without a Spring context.
 */
class CliTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private static final String WEB_APP = """
            {
              "id": "web",
              "name": "Web app",
              "max_parallel_workers": 2,
              "tasks": [
                {"id": "schema", "title": "Create schema", "checks": ["migrates"],
                 "file_impacts": [{"path": "db/schema.sql", "operation": "create"}]},
                {"id": "login", "title": "Login endpoint", "depends_on": ["schema"], "checks": ["tests pass"],
                 "file_impacts": [{"path": "server/auth.ts", "operation": "create"}]},
                {"id": "signup", "title": "Signup endpoint", "depends_on": ["schema"], "checks": ["tests pass"],
                 "file_impacts": [{"path": "server/auth.ts", "operation": "create"}]}
              ]
            }
            """;

    private record CliResult(int exitCode, String output) {}

    @TempDir
    Path tempDir;

    private ObjectMapper objectMapper;
    private TaskListStateMachine taskLists;
    private RunCoordinator coordinator;
    private HealthCheckService healthCheckService;
    private WavePlanner planner;
    private PriorityScorer scorer;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());
        taskLists = mock(TaskListStateMachine.class);
        coordinator = mock(RunCoordinator.class);
        healthCheckService = mock(HealthCheckService.class);

        var resolver = new DependencyResolver();
        scorer = new PriorityScorer(resolver, Clock.fixed(NOW, ZoneOffset.UTC), new EngineProperties());
        planner = new WavePlanner(resolver, new FileConflictChecker(), scorer, null);
    }

    private CommandLine.IFactory createFactory() {
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == RunCommand.class) {
                    return (K) new RunCommand(taskLists, coordinator, new EventBus(), objectMapper);
                }
                if (cls == PlanCommand.class) {
                    return (K) new PlanCommand(planner, scorer, objectMapper);
                }
                if (cls == StatusCommand.class) {
                    return (K) new StatusCommand(coordinator, taskLists);
                }
                if (cls == LogCommand.class) {
                    return (K) new LogCommand(coordinator);
                }
                if (cls == HealthCommand.class) {
                    return (K) new HealthCommand(healthCheckService);
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            int exitCode = new CommandLine(new TasklaneCommand(), createFactory()).execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    private Path writeTaskList(String json) throws IOException {
        Path file = tempDir.resolve("tasks.json");
        Files.writeString(file, json);
        return file;
    }

    private static ExecutionRun run(RunStatus status) {
        return new ExecutionRun("run-1", "web", 1, status, 3, 0, 0, 0, 3, 0, 0, null, NOW, null);
    }

    @Nested
    @DisplayName("Help output")
    class HelpTests {

        @Test
        @DisplayName("--help lists every subcommand")
        void helpListsSubcommands() {
            var result = execute("--help");
            assertEquals(0, result.exitCode());
            for (String sub : List.of("run", "plan", "status", "log", "health", "serve")) {
                assertTrue(result.output().contains(sub), "missing subcommand " + sub);
            }
        }

        @Test
        @DisplayName("--version prints the version")
        void version() {
            var result = execute("--version");
            assertTrue(result.output().contains("Tasklane 0.1.0"));
        }

        @Test
        @DisplayName("unknown subcommand fails")
        void unknownSubcommand() {
            assertNotEquals(0, execute("launch").exitCode());
        }
    }

    @Nested
    @DisplayName("plan")
    class PlanTests {

        @Test
        @DisplayName("prints waves with the CREATE conflict split across them")
        void printsWaves() throws IOException {
            var result = execute("plan", writeTaskList(WEB_APP).toString());

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("WAVE 1"));
            assertTrue(result.output().contains("WAVE 3"));
            assertTrue(result.output().contains("1 placement(s) deferred"));
        }

        @Test
        @DisplayName("missing dependency exits 1")
        void unplaceable() throws IOException {
            String json = """
                    {"id": "broken", "tasks": [
                      {"id": "a", "title": "A", "depends_on": ["ghost"], "checks": ["ok"]}
                    ]}
                    """;
            var result = execute("plan", writeTaskList(json).toString());

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("a can never run"));
        }

        @Test
        @DisplayName("missing file exits 2")
        void missingFile() {
            var result = execute("plan", tempDir.resolve("nope.json").toString());
            assertEquals(2, result.exitCode());
            assertTrue(result.output().contains("Cannot read task list"));
        }
    }

    @Nested
    @DisplayName("run")
    class RunTests {

        @Test
        @DisplayName("completed run exits 0 and prints the summary")
        void completed() throws Exception {
            var list = new TaskList("web", "Web app", TaskListStatus.DRAFT, false, 2,
                    List.of("schema", "login", "signup"), null, NOW);
            when(taskLists.submit(any(), any())).thenReturn(list);
            when(coordinator.startRun("web")).thenReturn(run(RunStatus.RUNNING));
            when(coordinator.awaitRun(eq("run-1"), any())).thenReturn(run(RunStatus.COMPLETED));
            when(coordinator.summary("run-1")).thenReturn(new RunSummary("run-1", "web", 1, RunStatus.COMPLETED,
                    List.of(1, 2, 3), List.of("schema", "login", "signup"), List.of(), null));

            var result = execute("run", writeTaskList(WEB_APP).toString());

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Submitted task list web (3 tasks)"));
            assertTrue(result.output().contains("Status: COMPLETED"));
        }

        @Test
        @DisplayName("failed run exits 1 and lists the failures")
        void failed() throws Exception {
            var list = new TaskList("web", "Web app", TaskListStatus.DRAFT, false, 2,
                    List.of("schema", "login", "signup"), null, NOW);
            when(taskLists.submit(any(), any())).thenReturn(list);
            when(coordinator.startRun("web")).thenReturn(run(RunStatus.RUNNING));
            when(coordinator.awaitRun(eq("run-1"), any())).thenReturn(run(RunStatus.FAILED));
            when(coordinator.summary("run-1")).thenReturn(new RunSummary("run-1", "web", 1, RunStatus.FAILED,
                    List.of(), List.of(), List.of(
                            new RunSummary.TaskFailure("schema", FailureKind.WORKER_FAILURE, "syntax error"),
                            new RunSummary.TaskFailure("login", FailureKind.DEPENDENCY_FAILED, "Blocked by schema")),
                    "1 task(s) failed"));

            var result = execute("run", writeTaskList(WEB_APP).toString());

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("Blocked by schema"));
        }

        @Test
        @DisplayName("unready list exits 2 before any run starts")
        void notReady() throws Exception {
            var list = new TaskList("web", "Web app", TaskListStatus.DRAFT, false, 2,
                    List.of("schema", "login", "signup"), null, NOW);
            when(taskLists.submit(any(), any())).thenReturn(list);
            when(taskLists.approve("web")).thenThrow(
                    new TaskListNotReadyException("Task list web failed readiness validation", List.of("cycle")));

            var result = execute("run", writeTaskList(WEB_APP).toString());

            assertEquals(2, result.exitCode());
            assertTrue(result.output().contains("failed readiness validation"));
        }
    }

    @Nested
    @DisplayName("status, log and health")
    class QueryTests {

        @Test
        @DisplayName("status without a run shows engine counters and lists")
        void engineStatus() {
            when(coordinator.status()).thenReturn(new RunCoordinator.EngineStatus(1, 2, 4, 0, 6));
            when(taskLists.list()).thenReturn(List.of(new TaskList("web", "Web app", TaskListStatus.IN_PROGRESS,
                    true, 2, List.of("schema"), null, NOW)));

            var result = execute("status");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Running workers: 2"));
            assertTrue(result.output().contains("IN_PROGRESS"));
        }

        @Test
        @DisplayName("status of an unknown run reports the error")
        void unknownRun() {
            when(coordinator.getRun("missing")).thenThrow(new NotFoundException("Run", "missing"));

            var result = execute("status", "missing");

            assertTrue(result.output().contains("missing"));
        }

        @Test
        @DisplayName("log prints entries in order")
        void log() {
            when(coordinator.log("run-1", null)).thenReturn(List.of(
                    new LogEntry(1, "run-1", "schema", "worker-1", LogEntryKind.SPAWNED, "attempt 1", NOW),
                    new LogEntry(2, "run-1", "schema", "worker-1", LogEntryKind.ERROR, "syntax error", NOW)));

            var result = execute("log", "run-1");

            String out = result.output();
            assertTrue(out.indexOf("attempt 1") < out.indexOf("syntax error"));
        }

        @Test
        @DisplayName("health exits 1 when a component is DOWN")
        void healthDown() {
            when(healthCheckService.checkAll()).thenReturn(List.of(
                    new HealthStatus("store", HealthStatus.Status.DEGRADED, "In-memory store", Map.of()),
                    new HealthStatus("workers", HealthStatus.Status.DOWN, "Build agent process is not available",
                            Map.of())));

            var result = execute("health");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("1 component(s) down; runs cannot be dispatched"));
            assertTrue(result.output().contains("In-memory store (degraded)"));
        }

        @Test
        @DisplayName("health exits 0 when everything is UP")
        void healthUp() {
            when(healthCheckService.checkAll()).thenReturn(List.of(
                    new HealthStatus("store", HealthStatus.Status.UP, "JDBC store", Map.of())));

            var result = execute("health");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Ready to run task lists"));
        }

        @Test
        @DisplayName("degraded components are reported but health still exits 0")
        void healthDegraded() {
            when(healthCheckService.checkAll()).thenReturn(List.of(
                    new HealthStatus("store", HealthStatus.Status.DEGRADED, "In-memory store", Map.of()),
                    new HealthStatus("workers", HealthStatus.Status.UP, "Build agent process available", Map.of())));

            var result = execute("health");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("1 component(s) degraded"));
        }
    }
}
