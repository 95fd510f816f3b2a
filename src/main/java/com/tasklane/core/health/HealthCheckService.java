package com.tasklane.core.health;

import com.tasklane.core.persistence.ExecutionStore;
import com.tasklane.core.persistence.InMemoryExecutionStore;
import com.tasklane.worker.WorkerSupervisor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import javax.sql.DataSource;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final ExecutionStore store;
    private final WorkerSupervisor supervisor;
    private final DataSource dataSource;

    public HealthCheckService(
            @Autowired(required = false) ExecutionStore store,
            @Autowired(required = false) WorkerSupervisor supervisor,
            @Autowired(required = false) DataSource dataSource) {
        this.store = store;
        this.supervisor = supervisor;
        this.dataSource = dataSource;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkStore());
        results.add(checkDatabase());
        results.add(checkWorkers());
        return results;
    }

    private HealthStatus checkStore() {
        if (store == null) {
            return new HealthStatus("store", HealthStatus.Status.DOWN,
                    "No execution store configured", Map.of());
        }
        if (store instanceof InMemoryExecutionStore) {
            return new HealthStatus("store", HealthStatus.Status.DEGRADED,
                    "In-memory store; runs are lost on restart", Map.of("type", "memory"));
        }
        return new HealthStatus("store", HealthStatus.Status.UP,
                "Execution store available (" + store.getClass().getSimpleName() + ")",
                Map.of("type", "jdbc"));
    }

    private HealthStatus checkDatabase() {
        if (dataSource == null) {
            return new HealthStatus("database", HealthStatus.Status.DEGRADED,
                    "No DataSource configured", Map.of());
        }
        try (var conn = dataSource.getConnection()) {
            if (conn.isValid(5)) {
                return new HealthStatus("database", HealthStatus.Status.UP,
                        "Database connection valid", Map.of());
            }
            return new HealthStatus("database", HealthStatus.Status.DOWN,
                    "Database connection invalid", Map.of());
        } catch (Exception e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return new HealthStatus("database", HealthStatus.Status.DOWN,
                    "Database error: " + e.getMessage(), Map.of());
        }
    }

    private HealthStatus checkWorkers() {
        if (supervisor == null) {
            return new HealthStatus("workers", HealthStatus.Status.DOWN,
                    "No worker supervisor configured", Map.of());
        }
        var metadata = Map.of("agent", supervisor.agentName(),
                "active", String.valueOf(supervisor.activeWorkerCount()));
        if (!supervisor.isAgentAvailable()) {
            return new HealthStatus("workers", HealthStatus.Status.DOWN,
                    "Build agent " + supervisor.agentName() + " is not available", metadata);
        }
        return new HealthStatus("workers", HealthStatus.Status.UP,
                "Build agent " + supervisor.agentName() + " available", metadata);
    }
}
