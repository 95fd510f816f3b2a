package com.tasklane.dispatch.api;

import com.tasklane.core.engine.ReadinessReport;
import com.tasklane.core.engine.RunCoordinator;
import com.tasklane.core.engine.TaskListStateMachine;
import com.tasklane.core.model.ExecutionRun;
import com.tasklane.core.model.LogEntry;
import com.tasklane.core.model.RunSummary;
import com.tasklane.core.model.TaskListStatus;
import com.tasklane.core.model.Wave;
import com.tasklane.core.model.WorkerInstance;
import com.tasklane.core.scheduler.WavePlanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * REST controller for task list and run lifecycle operations.
 */
@RestController
@RequestMapping("/api/v1")
public class TaskListController {

    private static final Logger log = LoggerFactory.getLogger(TaskListController.class);

    private final TaskListStateMachine taskLists;
    private final RunCoordinator coordinator;
    private final SseStreamingService sseStreamingService;

    public TaskListController(TaskListStateMachine taskLists,
                              RunCoordinator coordinator,
                              SseStreamingService sseStreamingService) {
        this.taskLists = taskLists;
        this.coordinator = coordinator;
        this.sseStreamingService = sseStreamingService;
    }

    // ── Task lists ───────────────────────────────────────────────────────

    /**
     * POST /api/v1/task-lists: Submit a new task list in DRAFT.
     */
    @PostMapping("/task-lists")
    public ResponseEntity<TaskListResponse> submit(@RequestBody TaskListRequest request) {
        var list = taskLists.submit(request.toTaskList(), request.toTasks());
        log.info("Accepted task list {} with {} tasks", list.id(), list.taskIds().size());
        return ResponseEntity.status(201).body(TaskListResponse.of(list, taskLists.tasks(list.id())));
    }

    @GetMapping("/task-lists")
    public ResponseEntity<List<TaskListResponse>> listTaskLists() {
        return ResponseEntity.ok(taskLists.list().stream()
                .map(l -> TaskListResponse.of(l, taskLists.tasks(l.id())))
                .toList());
    }

    @GetMapping("/task-lists/{id}")
    public ResponseEntity<TaskListResponse> getTaskList(@PathVariable String id) {
        return ResponseEntity.ok(TaskListResponse.of(taskLists.get(id), taskLists.tasks(id)));
    }

    @PostMapping("/task-lists/{id}/validate")
    public ResponseEntity<ReadinessReport> validate(@PathVariable String id) {
        return ResponseEntity.ok(taskLists.validate(id));
    }

    @PostMapping("/task-lists/{id}/approve")
    public ResponseEntity<TaskListResponse> approve(@PathVariable String id) {
        var list = taskLists.approve(id);
        return ResponseEntity.ok(TaskListResponse.of(list, taskLists.tasks(id)));
    }

    /**
     * POST /api/v1/task-lists/{id}/reopen: Move a list back to READY for another run, or to DRAFT
     * for editing. Only those two targets are accepted.
     */
    @PostMapping("/task-lists/{id}/reopen")
    public ResponseEntity<TaskListResponse> reopen(@PathVariable String id,
                                                   @RequestParam(defaultValue = "READY") String target) {
        TaskListStatus status = switch (target.toUpperCase()) {
            case "READY" -> TaskListStatus.READY;
            case "DRAFT" -> TaskListStatus.DRAFT;
            default -> throw new IllegalArgumentException("Reopen target must be READY or DRAFT, got " + target);
        };
        var list = taskLists.transition(id, status);
        return ResponseEntity.ok(TaskListResponse.of(list, taskLists.tasks(id)));
    }

    @PostMapping("/task-lists/{id}/archive")
    public ResponseEntity<TaskListResponse> archive(@PathVariable String id) {
        var list = taskLists.archive(id);
        return ResponseEntity.ok(TaskListResponse.of(list, taskLists.tasks(id)));
    }

    /**
     * GET /api/v1/task-lists/{id}/plan: Wave preview for the list's unsettled tasks; no run is created.
     */
    @GetMapping("/task-lists/{id}/plan")
    public ResponseEntity<WavePlanner.WavePlan> plan(@PathVariable String id) {
        return ResponseEntity.ok(coordinator.previewPlan(id));
    }

    // ── Runs ─────────────────────────────────────────────────────────────

    /**
     * POST /api/v1/task-lists/{id}/runs: Start a run. Waves execute asynchronously.
     */
    @PostMapping("/task-lists/{id}/runs")
    public ResponseEntity<ExecutionRun> startRun(@PathVariable String id) {
        var run = coordinator.startRun(id);
        return ResponseEntity.accepted().body(run);
    }

    @GetMapping("/task-lists/{id}/runs")
    public ResponseEntity<List<ExecutionRun>> runs(@PathVariable String id) {
        taskLists.get(id);
        return ResponseEntity.ok(coordinator.runsFor(id));
    }

    @GetMapping("/runs/{runId}")
    public ResponseEntity<ExecutionRun> getRun(@PathVariable String runId) {
        return ResponseEntity.ok(coordinator.getRun(runId));
    }

    @PostMapping("/runs/{runId}/pause")
    public ResponseEntity<ExecutionRun> pause(@PathVariable String runId) {
        return ResponseEntity.ok(coordinator.pauseRun(runId));
    }

    @PostMapping("/runs/{runId}/resume")
    public ResponseEntity<ExecutionRun> resume(@PathVariable String runId) {
        return ResponseEntity.ok(coordinator.resumeRun(runId));
    }

    @PostMapping("/runs/{runId}/cancel")
    public ResponseEntity<ExecutionRun> cancel(@PathVariable String runId) {
        log.info("Cancel requested for run {}", runId);
        return ResponseEntity.ok(coordinator.cancelRun(runId));
    }

    @GetMapping("/runs/{runId}/summary")
    public ResponseEntity<RunSummary> summary(@PathVariable String runId) {
        return ResponseEntity.ok(coordinator.summary(runId));
    }

    @GetMapping("/runs/{runId}/waves")
    public ResponseEntity<List<Wave>> waves(@PathVariable String runId) {
        return ResponseEntity.ok(coordinator.waves(runId));
    }

    @GetMapping("/runs/{runId}/workers")
    public ResponseEntity<List<WorkerInstance>> workers(@PathVariable String runId) {
        return ResponseEntity.ok(coordinator.workers(runId));
    }

    @GetMapping("/runs/{runId}/log")
    public ResponseEntity<List<LogEntry>> executionLog(@PathVariable String runId,
                                                       @RequestParam(name = "task_id", required = false) String taskId) {
        return ResponseEntity.ok(coordinator.log(runId, taskId));
    }

    /**
     * GET /api/v1/runs/{runId}/events: SSE stream of the run's events.
     */
    @GetMapping(value = "/runs/{runId}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public ResponseEntity<SseEmitter> streamEvents(@PathVariable String runId) {
        coordinator.getRun(runId);
        return ResponseEntity.ok(sseStreamingService.createEmitter(runId));
    }

    @GetMapping(value = "/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public ResponseEntity<SseEmitter> streamAllEvents() {
        return ResponseEntity.ok(sseStreamingService.createGlobalEmitter());
    }

    // ── Engine ───────────────────────────────────────────────────────────

    @GetMapping("/tasks/{taskId}/blocked-by")
    public ResponseEntity<Map<String, Object>> blockedBy(@PathVariable String taskId) {
        Set<String> dependents = coordinator.blockedBy(taskId);
        return ResponseEntity.ok(Map.of("task_id", taskId, "blocked_tasks", dependents));
    }

    @GetMapping("/status")
    public ResponseEntity<RunCoordinator.EngineStatus> status() {
        return ResponseEntity.ok(coordinator.status());
    }
}
