package com.tasklane.dispatch.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tasklane.core.engine.ReadinessReport;
import com.tasklane.core.engine.RunCoordinator;
import com.tasklane.core.engine.TaskListStateMachine;
import com.tasklane.core.error.CrossListConflictException;
import com.tasklane.core.error.CycleDetectedException;
import com.tasklane.core.error.NotFoundException;
import com.tasklane.core.error.RunAlreadyActiveException;
import com.tasklane.core.error.TaskListNotReadyException;
import com.tasklane.core.model.Effort;
import com.tasklane.core.model.ExecutionRun;
import com.tasklane.core.model.FailureKind;
import com.tasklane.core.model.LogEntry;
import com.tasklane.core.model.LogEntryKind;
import com.tasklane.core.model.RunStatus;
import com.tasklane.core.model.RunSummary;
import com.tasklane.core.model.Task;
import com.tasklane.core.model.TaskList;
import com.tasklane.core.model.TaskListStatus;
import com.tasklane.core.model.TaskStatus;
import com.tasklane.core.scheduler.WavePlanner;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.hamcrest.Matchers.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(TaskListController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class TaskListControllerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockitoBean
    private TaskListStateMachine taskLists;

    @MockitoBean
    private RunCoordinator coordinator;

    @MockitoBean
    private SseStreamingService sseStreamingService;

    private static TaskList list(TaskListStatus status) {
        return new TaskList("web", "Web app", status, status != TaskListStatus.DRAFT, 3,
                List.of("create-schema", "create-api"), null, NOW);
    }

    private static List<Task> tasks(TaskStatus status) {
        return List.of(
                new Task("create-schema", "Create schema", null, status, List.of(), List.of(), List.of(),
                        List.of("migrates"), false, null, Effort.SMALL, null),
                new Task("create-api", "Create API", null, status, List.of(), List.of("create-schema"), List.of(),
                        List.of("tests pass"), false, null, Effort.MEDIUM, null));
    }

    private static ExecutionRun run(RunStatus status) {
        return new ExecutionRun("run-1", "web", 1, status, 2, 0, 0, 0, 2, 0, 0, null, NOW, null);
    }

    // ── Task lists ───────────────────────────────────────────────────

    @Test
    @DisplayName("POST /task-lists returns 201 with the draft list")
    void submit() throws Exception {
        when(taskLists.submit(any(), any())).thenReturn(list(TaskListStatus.DRAFT));
        when(taskLists.tasks("web")).thenReturn(tasks(TaskStatus.DRAFT));

        String body = """
                {
                  "id": "web",
                  "name": "Web app",
                  "max_parallel_workers": 3,
                  "tasks": [
                    {"id": "create-schema", "title": "Create schema", "checks": ["migrates"],
                     "file_impacts": [{"path": "db/schema.sql", "operation": "create"}]},
                    {"id": "create-api", "title": "Create API", "depends_on": ["create-schema"],
                     "checks": ["tests pass"], "quick_win": true, "effort": "medium"}
                  ]
                }
                """;

        mockMvc.perform(post("/api/v1/task-lists")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value("web"))
                .andExpect(jsonPath("$.status").value("DRAFT"))
                .andExpect(jsonPath("$.max_parallel_workers").value(3))
                .andExpect(jsonPath("$.tasks", hasSize(2)))
                .andExpect(jsonPath("$.tasks[1].depends_on[0]").value("create-schema"));
    }

    @Test
    @DisplayName("POST /task-lists with duplicate IDs returns 400")
    void submitRejected() throws Exception {
        when(taskLists.submit(any(), any())).thenThrow(new IllegalArgumentException("Duplicate task id a in list web"));

        String body = objectMapper.writeValueAsString(Map.of("id", "web", "tasks", List.of()));

        mockMvc.perform(post("/api/v1/task-lists")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value(containsString("Duplicate")));
    }

    @Test
    @DisplayName("POST /task-lists with malformed JSON returns 400")
    void malformedBody() throws Exception {
        mockMvc.perform(post("/api/v1/task-lists")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("GET /task-lists/{id} for unknown list returns 404")
    void unknownList() throws Exception {
        when(taskLists.get("missing")).thenThrow(new NotFoundException("Task list", "missing"));

        mockMvc.perform(get("/api/v1/task-lists/missing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value(containsString("missing")));
    }

    @Test
    @DisplayName("POST /task-lists/{id}/validate returns the readiness report")
    void validate() throws Exception {
        when(taskLists.validate("web")).thenReturn(
                new ReadinessReport("web", List.of("create-api has no checks defined"), Set.of()));

        mockMvc.perform(post("/api/v1/task-lists/web/validate"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.problems[0]").value("create-api has no checks defined"))
                .andExpect(jsonPath("$.ready").value(false));
    }

    @Test
    @DisplayName("POST /task-lists/{id}/approve for unready list returns 400 with problems")
    void approveNotReady() throws Exception {
        when(taskLists.approve("web")).thenThrow(
                new TaskListNotReadyException("Task list web failed readiness validation", List.of("cycle")));

        mockMvc.perform(post("/api/v1/task-lists/web/approve"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.problems[0]").value("cycle"));
    }

    @Test
    @DisplayName("POST /task-lists/{id}/reopen moves a failed list back to READY")
    void reopen() throws Exception {
        when(taskLists.transition("web", TaskListStatus.READY)).thenReturn(list(TaskListStatus.READY));
        when(taskLists.tasks("web")).thenReturn(tasks(TaskStatus.PENDING));

        mockMvc.perform(post("/api/v1/task-lists/web/reopen"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("READY"));
    }

    @Test
    @DisplayName("POST /task-lists/{id}/reopen refuses targets other than READY and DRAFT")
    void reopenRejectsOtherTargets() throws Exception {
        mockMvc.perform(post("/api/v1/task-lists/web/reopen").param("target", "COMPLETED"))
                .andExpect(status().isBadRequest());
        mockMvc.perform(post("/api/v1/task-lists/web/reopen").param("target", "in_progress"))
                .andExpect(status().isBadRequest());

        verify(taskLists, never()).transition(any(), any());
    }

    @Test
    @DisplayName("POST /task-lists/{id}/archive while a run is active returns 409")
    void archiveWhileRunning() throws Exception {
        when(taskLists.archive("web")).thenThrow(
                new IllegalStateException("Task list web has active run run-1 (RUNNING)"));

        mockMvc.perform(post("/api/v1/task-lists/web/archive"))
                .andExpect(status().isConflict());
    }

    @Test
    @DisplayName("GET /task-lists/{id}/plan returns the wave preview")
    void plan() throws Exception {
        when(coordinator.previewPlan("web")).thenReturn(new WavePlanner.WavePlan(
                List.of(new WavePlanner.PlannedWave(1, List.of("create-schema")),
                        new WavePlanner.PlannedWave(2, List.of("create-api"))),
                Map.of(), 0));

        mockMvc.perform(get("/api/v1/task-lists/web/plan"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.waves", hasSize(2)))
                .andExpect(jsonPath("$.waves[1].taskIds[0]").value("create-api"));
    }

    // ── Runs ─────────────────────────────────────────────────────────

    @Test
    @DisplayName("POST /task-lists/{id}/runs returns 202 with the run")
    void startRun() throws Exception {
        when(coordinator.startRun("web")).thenReturn(run(RunStatus.RUNNING));

        mockMvc.perform(post("/api/v1/task-lists/web/runs"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.id").value("run-1"))
                .andExpect(jsonPath("$.status").value("RUNNING"));
    }

    @Test
    @DisplayName("starting a second run returns 409 with the active run")
    void startRunConflict() throws Exception {
        when(coordinator.startRun("web")).thenThrow(new RunAlreadyActiveException("web", "run-1"));

        mockMvc.perform(post("/api/v1/task-lists/web/runs"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.active_run_id").value("run-1"));
    }

    @Test
    @DisplayName("cross-list file conflict returns 409 with the paths")
    void crossListConflict() throws Exception {
        when(coordinator.startRun("web")).thenThrow(
                new CrossListConflictException("web", "mobile", List.of("server/auth.ts")));

        mockMvc.perform(post("/api/v1/task-lists/web/runs"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.conflicting_paths[0]").value("server/auth.ts"));
    }

    @Test
    @DisplayName("dependency cycle returns 400 with the cyclic tasks")
    void cycle() throws Exception {
        when(coordinator.startRun("web")).thenThrow(new CycleDetectedException(Set.of("a", "b")));

        mockMvc.perform(post("/api/v1/task-lists/web/runs"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.cyclic_task_ids", hasSize(2)));
    }

    @Test
    @DisplayName("POST /runs/{id}/cancel on finished run returns 409")
    void cancelFinished() throws Exception {
        when(coordinator.cancelRun("run-1")).thenThrow(new IllegalStateException("Run run-1 is already COMPLETED"));

        mockMvc.perform(post("/api/v1/runs/run-1/cancel"))
                .andExpect(status().isConflict());
    }

    @Test
    @DisplayName("POST /runs/{id}/pause returns the run")
    void pause() throws Exception {
        when(coordinator.pauseRun("run-1")).thenReturn(run(RunStatus.RUNNING));

        mockMvc.perform(post("/api/v1/runs/run-1/pause"))
                .andExpect(status().isOk());
        verify(coordinator).pauseRun("run-1");
    }

    @Test
    @DisplayName("GET /runs/{id}/summary lists failures with their kind")
    void summary() throws Exception {
        when(coordinator.summary("run-1")).thenReturn(new RunSummary("run-1", "web", 1, RunStatus.FAILED,
                List.of(1), List.of("create-schema"),
                List.of(new RunSummary.TaskFailure("create-api", FailureKind.WORKER_FAILURE, "tests failed")),
                "1 task(s) failed, 0 blocked"));

        mockMvc.perform(get("/api/v1/runs/run-1/summary"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("FAILED"))
                .andExpect(jsonPath("$.failures[0].kind").value("WORKER_FAILURE"))
                .andExpect(jsonPath("$.completedTaskIds[0]").value("create-schema"));
    }

    @Test
    @DisplayName("GET /runs/{id}/log filters by task")
    void log() throws Exception {
        when(coordinator.log("run-1", "create-api")).thenReturn(List.of(
                new LogEntry(7, "run-1", "create-api", "worker-1", LogEntryKind.ERROR, "TypeError", NOW)));

        mockMvc.perform(get("/api/v1/runs/run-1/log").param("task_id", "create-api"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].kind").value("ERROR"));
    }

    @Test
    @DisplayName("GET /runs/{id}/events for unknown run returns 404")
    void eventsUnknownRun() throws Exception {
        when(coordinator.getRun("missing")).thenThrow(new NotFoundException("Run", "missing"));

        mockMvc.perform(get("/api/v1/runs/missing/events"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("GET /runs/{id}/events opens an SSE stream")
    void events() throws Exception {
        when(coordinator.getRun("run-1")).thenReturn(run(RunStatus.RUNNING));
        when(sseStreamingService.createEmitter(eq("run-1"))).thenReturn(new SseEmitter());

        mockMvc.perform(get("/api/v1/runs/run-1/events"))
                .andExpect(request().asyncStarted());
    }

    // ── Engine ───────────────────────────────────────────────────────

    @Test
    @DisplayName("GET /tasks/{id}/blocked-by lists dependents")
    void blockedBy() throws Exception {
        when(coordinator.blockedBy("create-schema")).thenReturn(new LinkedHashSet<>(List.of("create-api")));

        mockMvc.perform(get("/api/v1/tasks/create-schema/blocked-by"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.blocked_tasks[0]").value("create-api"));
    }

    @Test
    @DisplayName("GET /status reports engine activity")
    void engineStatus() throws Exception {
        when(coordinator.status()).thenReturn(new RunCoordinator.EngineStatus(1, 2, 5, 0, 8));

        mockMvc.perform(get("/api/v1/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.runningWorkers").value(2))
                .andExpect(jsonPath("$.availableWorkerSlots").value(8));
    }
}
