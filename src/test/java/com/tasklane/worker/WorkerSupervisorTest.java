package com.tasklane.worker;

import com.tasklane.core.error.NotFoundException;
import com.tasklane.core.events.EngineEvent;
import com.tasklane.core.events.EventBus;
import com.tasklane.core.events.EventTypes;
import com.tasklane.core.model.Effort;
import com.tasklane.core.model.ExecutionRun;
import com.tasklane.core.model.FailureReason;
import com.tasklane.core.model.LogEntry;
import com.tasklane.core.model.LogEntryKind;
import com.tasklane.core.model.RunStatus;
import com.tasklane.core.model.Task;
import com.tasklane.core.model.TaskStatus;
import com.tasklane.core.model.Wave;
import com.tasklane.core.model.WaveStatus;
import com.tasklane.core.model.WorkerResult;
import com.tasklane.core.model.WorkerStatus;
import com.tasklane.core.persistence.InMemoryExecutionStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link WorkerSupervisor}.
 */
class WorkerSupervisorTest {

    private static final Duration HEARTBEAT = Duration.ofSeconds(10);

    @FunctionalInterface
    interface Script {
        WorkerResult run(DispatchCommand command, WorkerChannel channel) throws InterruptedException;
    }

    static final class ScriptedAgent implements BuildAgent {
        volatile Script script;
        final List<DispatchCommand> received = new CopyOnWriteArrayList<>();

        @Override
        public WorkerResult execute(DispatchCommand command, WorkerChannel channel) throws InterruptedException {
            received.add(command);
            return script.run(command, channel);
        }

        @Override
        public String name() {
            return "scripted";
        }
    }

    private InMemoryExecutionStore store;
    private MutableClock clock;
    private ScriptedAgent agent;
    private EventBus eventBus;
    private List<EngineEvent> events;
    private WorkerSupervisor supervisor;

    private final ExecutionRun run = new ExecutionRun("run-1", "list-1", 1, RunStatus.RUNNING,
            1, 0, 0, 0, 1, 0, 0, null, Instant.parse("2026-03-01T10:00:00Z"), null);
    private final Wave wave = new Wave("wave-1", "run-1", 1, WaveStatus.RUNNING, List.of("task-1"),
            0, 0, 0, null, null);
    private final Task task = new Task("task-1", "Add login", null, TaskStatus.IN_PROGRESS, List.of(),
            List.of(), List.of(), List.of(), false, null, Effort.SMALL, null);

    @BeforeEach
    void setUp() {
        store = new InMemoryExecutionStore();
        clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        agent = new ScriptedAgent();
        eventBus = new EventBus();
        events = new CopyOnWriteArrayList<>();
        eventBus.subscribeAll(events::add);
        supervisor = new WorkerSupervisor(store, agent, eventBus, clock, null,
                HEARTBEAT, 3, Duration.ofMinutes(5), 3);
    }

    @AfterEach
    void tearDown() {
        supervisor.shutdown();
    }

    private static Script blockUntilInterrupted(CountDownLatch started) {
        return (command, channel) -> {
            started.countDown();
            new CountDownLatch(1).await();
            return WorkerResult.success(List.of(), List.of());
        };
    }

    private List<LogEntryKind> logKinds() {
        return store.logForTask("run-1", "task-1").stream().map(LogEntry::kind).toList();
    }

    @Test
    @DisplayName("successful agent settles with merged file changes")
    void successfulRun() throws Exception {
        agent.script = (command, channel) -> {
            channel.heartbeat(50, "writing");
            channel.log(LogEntryKind.FILE_CHANGE, "src/login.ts");
            channel.log(LogEntryKind.CHECKPOINT, "commit abc");
            return WorkerResult.success(List.of("src/routes.ts"), List.of());
        };

        var worker = supervisor.spawn(run, wave, task, 1);
        var result = supervisor.await(worker.id());

        assertTrue(result.isSuccess());
        assertEquals(List.of("src/routes.ts", "src/login.ts"), result.filesModified());
        assertEquals(List.of("commit abc"), result.checkpoints());
        assertEquals(List.of(LogEntryKind.SPAWNED, LogEntryKind.FILE_CHANGE, LogEntryKind.CHECKPOINT,
                LogEntryKind.COMPLETED), logKinds());

        var stored = store.findWorker(worker.id()).orElseThrow();
        assertEquals(WorkerStatus.TERMINATED, stored.status());
        assertEquals("completed", stored.terminationReason());
        assertEquals(1, store.attemptsForTask("task-1").size());
        assertEquals(0, supervisor.activeWorkerCount());
        assertTrue(events.stream().anyMatch(e -> e.eventType().equals(EventTypes.WORKER_SPAWNED)));
        assertTrue(events.stream().anyMatch(e -> e.eventType().equals(EventTypes.TASK_PROGRESS)));
    }

    @Test
    @DisplayName("agent crash is an infrastructure failure")
    void agentCrash() throws Exception {
        agent.script = (command, channel) -> {
            throw new IllegalStateException("container vanished");
        };

        var worker = supervisor.spawn(run, wave, task, 1);
        var result = supervisor.await(worker.id());

        assertEquals(FailureReason.INFRASTRUCTURE, result.reason());
        assertEquals("container vanished", result.lastError());
        assertEquals(LogEntryKind.FAILED, logKinds().get(logKinds().size() - 1));
    }

    @Nested
    @DisplayName("stuck detection")
    class StuckDetection {

        @Test
        @DisplayName("three missed heartbeats terminate the worker with TIMEOUT")
        void missedHeartbeats() throws Exception {
            var started = new CountDownLatch(1);
            agent.script = blockUntilInterrupted(started);
            var worker = supervisor.spawn(run, wave, task, 1);
            assertTrue(started.await(5, TimeUnit.SECONDS));

            clock.advance(HEARTBEAT.multipliedBy(2));
            assertTrue(supervisor.checkStuck().isEmpty());

            clock.advance(HEARTBEAT);
            assertEquals(List.of(worker.id()), supervisor.checkStuck());

            var result = supervisor.await(worker.id());
            assertEquals(WorkerResult.Outcome.FAILURE, result.outcome());
            assertEquals(FailureReason.TIMEOUT, result.reason());
            assertEquals(LogEntryKind.INTERRUPTED, logKinds().get(logKinds().size() - 1));
            assertEquals("timeout", store.findWorker(worker.id()).orElseThrow().terminationReason());
            assertTrue(events.stream().anyMatch(e -> e.eventType().equals(EventTypes.WORKER_STUCK)
                    && "missed_heartbeats".equals(e.payload().get("cause"))));
        }

        @Test
        @DisplayName("a heartbeat resets the missed counter")
        void heartbeatResets() throws Exception {
            var started = new CountDownLatch(1);
            agent.script = blockUntilInterrupted(started);
            var worker = supervisor.spawn(run, wave, task, 1);
            assertTrue(started.await(5, TimeUnit.SECONDS));

            clock.advance(HEARTBEAT.multipliedBy(2));
            assertTrue(supervisor.heartbeat(worker.id(), 30, "tests"));
            clock.advance(HEARTBEAT.multipliedBy(2));

            assertTrue(supervisor.checkStuck().isEmpty());
            var stored = store.findWorker(worker.id()).orElseThrow();
            assertEquals(2, stored.missedHeartbeats());
            assertEquals(30, stored.progressPercent());
            supervisor.terminate(worker.id(), WorkerSupervisor.Termination.CANCELLED, "test over");
        }

        @Test
        @DisplayName("wall-clock budget applies even with regular heartbeats")
        void wallClockBudget() throws Exception {
            var started = new CountDownLatch(1);
            agent.script = blockUntilInterrupted(started);
            var worker = supervisor.spawn(run, wave, task, 1);
            assertTrue(started.await(5, TimeUnit.SECONDS));

            for (int i = 0; i < 30; i++) {
                clock.advance(HEARTBEAT);
                supervisor.heartbeat(worker.id(), i, "looping");
            }

            assertEquals(List.of(worker.id()), supervisor.checkStuck());
            assertTrue(events.stream().anyMatch(e -> "wall_clock".equals(e.payload().get("cause"))));
        }
    }

    @Nested
    @DisplayName("termination")
    class Termination {

        @Test
        @DisplayName("cancel settles once and logs the cancellation")
        void cancel() throws Exception {
            var started = new CountDownLatch(1);
            agent.script = blockUntilInterrupted(started);
            var worker = supervisor.spawn(run, wave, task, 1);
            assertTrue(started.await(5, TimeUnit.SECONDS));

            assertTrue(supervisor.terminate(worker.id(), WorkerSupervisor.Termination.CANCELLED, "run cancelled"));
            assertFalse(supervisor.terminate(worker.id(), WorkerSupervisor.Termination.TIMEOUT, "late"));

            var result = supervisor.await(worker.id());
            assertEquals(WorkerResult.Outcome.CANCELLED, result.outcome());
            assertEquals(LogEntryKind.CANCELLED, logKinds().get(logKinds().size() - 1));
        }

        @Test
        @DisplayName("terminated worker ignores heartbeats and log appends")
        void inactiveWorker() throws Exception {
            var started = new CountDownLatch(1);
            agent.script = blockUntilInterrupted(started);
            var worker = supervisor.spawn(run, wave, task, 1);
            assertTrue(started.await(5, TimeUnit.SECONDS));
            supervisor.terminate(worker.id(), WorkerSupervisor.Termination.CANCELLED, "stop");

            assertFalse(supervisor.heartbeat(worker.id(), 90, "late"));
            assertTrue(supervisor.append(worker.id(), LogEntryKind.ACTION, "late").isEmpty());
        }

        @Test
        @DisplayName("unknown worker cannot append")
        void unknownWorker() {
            assertThrows(NotFoundException.class,
                    () -> supervisor.append("worker-missing", LogEntryKind.ACTION, "hello"));
            assertFalse(supervisor.heartbeat("worker-missing", 10, null));
        }
    }

    @Nested
    @DisplayName("resumption")
    class Resumption {

        @Test
        @DisplayName("replacement worker receives the bounded log tail")
        void replacementGetsTail() throws Exception {
            agent.script = (command, channel) -> {
                channel.log(LogEntryKind.ACTION, "edited login form");
                channel.log(LogEntryKind.ERROR, "TypeError: user is undefined");
                return WorkerResult.failure(FailureReason.ERROR, "TypeError: user is undefined");
            };
            var first = supervisor.spawn(run, wave, task, 1);
            supervisor.await(first.id());

            var seen = new AtomicReference<ResumptionContext>();
            agent.script = (command, channel) -> {
                seen.set(command.resumption());
                return WorkerResult.success(List.of(), List.of());
            };
            var second = supervisor.spawn(run, wave, task, 2);
            supervisor.await(second.id());

            var context = seen.get();
            assertEquals(3, context.entries().size());
            assertEquals(1, context.droppedEntries());
            assertEquals(LogEntryKind.FAILED, context.entries().get(2).kind());
            assertTrue(context.render().contains("TypeError: user is undefined"));
            assertEquals(LogEntryKind.RESUMED, store.logForTask("run-1", "task-1").stream()
                    .filter(e -> e.workerId().equals(second.id())).findFirst().orElseThrow().kind());
        }

        @Test
        @DisplayName("worker replacing a timed-out attempt sees everything it wrote")
        void replacementAfterTimeout() throws Exception {
            supervisor.shutdown();
            supervisor = new WorkerSupervisor(store, agent, eventBus, clock, null,
                    HEARTBEAT, 3, Duration.ofMinutes(5), 50);

            var started = new CountDownLatch(1);
            agent.script = (command, channel) -> {
                channel.log(LogEntryKind.ACTION, "opened auth module");
                channel.log(LogEntryKind.FILE_CHANGE, "src/login.ts");
                channel.log(LogEntryKind.CHECKPOINT, "commit 1a2b");
                started.countDown();
                new CountDownLatch(1).await();
                return WorkerResult.success(List.of(), List.of());
            };
            var first = supervisor.spawn(run, wave, task, 1);
            assertTrue(started.await(5, TimeUnit.SECONDS));

            clock.advance(HEARTBEAT.multipliedBy(3));
            assertEquals(List.of(first.id()), supervisor.checkStuck());
            var timedOut = supervisor.await(first.id());
            assertEquals(FailureReason.TIMEOUT, timedOut.reason());
            assertEquals(List.of("src/login.ts"), timedOut.filesModified());

            var written = store.logForTask("run-1", "task-1");
            var seen = new AtomicReference<ResumptionContext>();
            agent.script = (command, channel) -> {
                seen.set(command.resumption());
                return WorkerResult.success(List.of(), List.of());
            };
            var second = supervisor.spawn(run, wave, task, 2);
            assertTrue(supervisor.await(second.id()).isSuccess());

            var context = seen.get();
            assertEquals(0, context.droppedEntries());
            assertEquals(written, context.entries());
            assertEquals(List.of(LogEntryKind.SPAWNED, LogEntryKind.ACTION, LogEntryKind.FILE_CHANGE,
                    LogEntryKind.CHECKPOINT, LogEntryKind.INTERRUPTED),
                    context.entries().stream().map(LogEntry::kind).toList());
            assertTrue(context.render().contains("commit 1a2b"));
        }

        @Test
        @DisplayName("first attempt starts with an empty context")
        void firstAttemptEmpty() {
            assertTrue(supervisor.resumptionContext("run-1", "task-1").isEmpty());
        }
    }
}
