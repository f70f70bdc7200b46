package com.agrigrid.dispatch.cli;

import com.agrigrid.core.health.HealthCheckService;
import com.agrigrid.core.health.HealthStatus;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: agrigrid health [--brief]
 * <p>
 * Checks the simulation engine, the worker roster and the planner backlog. Each component
 * prints its figures (tick and resets, per-worker state, queued and active tasks) unless
 * {@code --brief} is given. Exits with 1 when any component is DOWN.
 */
@Command(name = "health", mixinStandardHelpOptions = true,
        description = "Check engine, worker and planner health")
@Component
public class HealthCommand implements Callable<Integer> {

    @Option(names = {"--brief", "-b"}, description = "Print one line per component without its figures")
    private boolean brief;

    private final HealthCheckService healthCheckService;

    public HealthCommand(@Autowired(required = false) HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        if (healthCheckService == null) {
            ConsoleOutput.error("Health check service not available");
            return 1;
        }

        List<HealthStatus> checks = healthCheckService.checkAll();
        checks.forEach(check -> ConsoleOutput.healthCheck(check, !brief));

        long down = checks.stream().filter(HealthStatus::isDown).count();
        long degraded = checks.stream().filter(c -> c.status() == HealthStatus.Status.DEGRADED).count();

        System.out.println("──────────────────────────────────");
        if (down > 0) {
            ConsoleOutput.error("Farm DOWN: " + down + " component(s) down");
            return 1;
        }
        if (degraded > 0) {
            ConsoleOutput.warn("Farm DEGRADED: " + degraded + " component(s) need attention");
        } else {
            ConsoleOutput.success("Farm UP: engine, workers and planner operational");
        }
        return 0;
    }
}
