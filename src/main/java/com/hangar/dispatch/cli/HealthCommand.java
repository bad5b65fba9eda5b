package com.hangar.dispatch.cli;

import com.hangar.core.health.HealthCheckService;
import com.hangar.core.health.HealthStatus;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: hangar health
 * <p>
 * Runs all health checks and exits with status 1 when a component is down.
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check system health")
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
            ConsoleOutput.error("Health check service not available");
            return CliRunner.EXIT_FAILURE;
        }

        List<HealthStatus> checks = healthCheckService.checkAll();
        for (HealthStatus check : checks) {
            String label = check.component() + ": " + check.detail();
            switch (check.status()) {
                case UP -> ConsoleOutput.success(label);
                case DEGRADED -> ConsoleOutput.warn(label);
                case DOWN -> ConsoleOutput.error(label);
            }
        }

        System.out.println(ConsoleOutput.DIVIDER);
        switch (HealthStatus.overall(checks)) {
            case DOWN -> {
                ConsoleOutput.error("Overall: one or more components down");
                return CliRunner.EXIT_FAILURE;
            }
            case DEGRADED -> ConsoleOutput.warn("Overall: degraded");
            case UP -> ConsoleOutput.success("Overall: all systems operational");
        }
        return 0;
    }
}
