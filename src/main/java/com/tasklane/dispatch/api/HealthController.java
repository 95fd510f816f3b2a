package com.tasklane.dispatch.api;

import com.tasklane.core.health.HealthCheckService;
import com.tasklane.core.health.HealthStatus;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reports whether the engine can accept and drive runs: the execution store, its database and
 * the build agent behind the worker supervisor.
 */
@RestController
@RequestMapping("/api/v1/health")
public class HealthController {

    private final HealthCheckService healthCheckService;

    public HealthController(@Autowired(required = false) HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    /**
     * GET /api/v1/health: 503 when any component is DOWN, otherwise 200. An in-memory store or a
     * missing DataSource is DEGRADED and still serves runs.
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> health() {
        List<HealthStatus> checks = healthCheckService != null ? healthCheckService.checkAll() : List.of();
        boolean down = healthCheckService == null
                || checks.stream().anyMatch(c -> c.status() == HealthStatus.Status.DOWN);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", down ? "DOWN" : "UP");
        body.put("components", components(checks));
        return ResponseEntity.status(down ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.OK).body(body);
    }

    private static Map<String, Object> components(List<HealthStatus> checks) {
        Map<String, Object> components = new LinkedHashMap<>();
        for (var check : checks) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("status", check.status().name());
            entry.put("detail", check.detail());
            if (!check.metadata().isEmpty()) {
                entry.put("metadata", check.metadata());
            }
            components.put(check.component(), entry);
        }
        return components;
    }
}
