package com.tasklane.dispatch.api;

import com.tasklane.core.model.LogEntryKind;
import com.tasklane.worker.WorkerSupervisor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Internal API endpoints used by remote build agents to report liveness and execution log lines
 * for the worker they run as.
 */
@RestController
@RequestMapping("/api/internal/workers")
public class InternalApiController {

    private static final Logger log = LoggerFactory.getLogger(InternalApiController.class);

    private final WorkerSupervisor supervisor;

    public InternalApiController(WorkerSupervisor supervisor) {
        this.supervisor = supervisor;
    }

    @PostMapping("/{workerId}/heartbeat")
    public ResponseEntity<Map<String, Object>> heartbeat(@PathVariable String workerId,
                                                         @RequestBody WorkerCallbackRequest request) {
        int progress = request.progressPercent() != null ? request.progressPercent() : 0;
        boolean accepted = supervisor.heartbeat(workerId, progress, request.currentStep());
        if (!accepted) {
            log.debug("Heartbeat from inactive worker {} ignored", workerId);
            return ResponseEntity.status(410).body(Map.of("worker_id", workerId, "accepted", false));
        }
        return ResponseEntity.ok(Map.of("worker_id", workerId, "accepted", true));
    }

    @PostMapping("/{workerId}/log")
    public ResponseEntity<Map<String, Object>> append(@PathVariable String workerId,
                                                      @RequestBody WorkerCallbackRequest request) {
        if (request.message() == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "message is required"));
        }
        LogEntryKind kind = request.kind() != null ? LogEntryKind.valueOf(request.kind().toUpperCase()) : LogEntryKind.ACTION;
        return supervisor.append(workerId, kind, request.message())
                .<ResponseEntity<Map<String, Object>>>map(entry -> ResponseEntity.ok(
                        Map.of("worker_id", workerId, "sequence", entry.sequence())))
                .orElseGet(() -> ResponseEntity.status(410).body(Map.of("worker_id", workerId, "accepted", false)));
    }
}
