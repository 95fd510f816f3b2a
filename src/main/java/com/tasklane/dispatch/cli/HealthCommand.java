package com.tasklane.dispatch.cli;

import com.tasklane.core.health.HealthCheckService;
import com.tasklane.core.health.HealthStatus;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.concurrent.Callable;

/**
 * tasklane health: prints the store, database and build agent checks. Exits 1 when any of them
 * is DOWN, since no run could be driven; DEGRADED components are reported but exit 0.
 */
@Command(name = "health", mixinStandardHelpOptions = true,
        description = "Check the execution store, database and build agent")
@Component
public class HealthCommand implements Callable<Integer> {

    private final HealthCheckService healthCheckService;

    public HealthCommand(@Autowired(required = false) HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        if (healthCheckService == null) {
            ConsoleOutput.error("Health checks are not configured");
            return 1;
        }

        int down = 0;
        int degraded = 0;
        for (var check : healthCheckService.checkAll()) {
            String line = String.format("%-9s %s", check.component(), check.detail());
            if (check.status() == HealthStatus.Status.DOWN) {
                ConsoleOutput.error(line);
                down++;
            } else if (check.status() == HealthStatus.Status.DEGRADED) {
                ConsoleOutput.info(line + " (degraded)");
                degraded++;
            } else {
                ConsoleOutput.success(line);
            }
        }

        System.out.println("──────────────────────────────────");
        if (down > 0) {
            ConsoleOutput.error(down + " component(s) down; runs cannot be dispatched");
            return 1;
        }
        if (degraded > 0) {
            ConsoleOutput.info("Ready to run task lists, " + degraded + " component(s) degraded");
        } else {
            ConsoleOutput.success("Ready to run task lists");
        }
        return 0;
    }
}
