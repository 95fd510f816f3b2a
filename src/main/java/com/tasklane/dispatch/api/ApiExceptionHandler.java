package com.tasklane.dispatch.api;

import com.tasklane.core.error.CapacityExceededException;
import com.tasklane.core.error.ConflictUnresolvableException;
import com.tasklane.core.error.CrossListConflictException;
import com.tasklane.core.error.CycleDetectedException;
import com.tasklane.core.error.NotFoundException;
import com.tasklane.core.error.RunAlreadyActiveException;
import com.tasklane.core.error.TaskListNotReadyException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps engine exceptions to HTTP status codes: unknown resources 404, rejected input 400,
 * requests that clash with current state 409.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(NotFoundException ex) {
        return error(HttpStatus.NOT_FOUND, ex.getMessage(), Map.of());
    }

    @ExceptionHandler(TaskListNotReadyException.class)
    public ResponseEntity<Map<String, Object>> handleNotReady(TaskListNotReadyException ex) {
        return error(HttpStatus.BAD_REQUEST, ex.getMessage(), Map.of("problems", ex.problems()));
    }

    @ExceptionHandler(CycleDetectedException.class)
    public ResponseEntity<Map<String, Object>> handleCycle(CycleDetectedException ex) {
        return error(HttpStatus.BAD_REQUEST, ex.getMessage(), Map.of("cyclic_task_ids", ex.cyclicTaskIds()));
    }

    @ExceptionHandler({ConflictUnresolvableException.class, IllegalArgumentException.class,
            HttpMessageNotReadableException.class})
    public ResponseEntity<Map<String, Object>> handleBadRequest(Exception ex) {
        return error(HttpStatus.BAD_REQUEST, ex.getMessage(), Map.of());
    }

    @ExceptionHandler(RunAlreadyActiveException.class)
    public ResponseEntity<Map<String, Object>> handleAlreadyActive(RunAlreadyActiveException ex) {
        return error(HttpStatus.CONFLICT, ex.getMessage(), Map.of("active_run_id", ex.activeRunId()));
    }

    @ExceptionHandler(CrossListConflictException.class)
    public ResponseEntity<Map<String, Object>> handleCrossList(CrossListConflictException ex) {
        return error(HttpStatus.CONFLICT, ex.getMessage(), Map.of("conflicting_paths", ex.conflictingPaths()));
    }

    @ExceptionHandler({CapacityExceededException.class, IllegalStateException.class})
    public ResponseEntity<Map<String, Object>> handleConflict(RuntimeException ex) {
        log.debug("Request rejected: {}", ex.getMessage());
        return error(HttpStatus.CONFLICT, ex.getMessage(), Map.of());
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String message,
                                                             Map<String, Object> details) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", message);
        body.putAll(details);
        return ResponseEntity.status(status).body(body);
    }
}
