package com.supplyguard.dispatch.cli;

import com.supplyguard.core.health.HealthCheckService;
import com.supplyguard.core.health.HealthStatus;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.concurrent.Callable;

/**
 * CLI command: supplyguard health
 * <p>
 * Exits non-zero when any component is down. A degraded component, such as
 * disabled AI analysis, is reported but does not fail the check.
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check system health")
@Component
public class HealthCommand implements Callable<Integer> {

    private final HealthCheckService healthCheckService;

    public HealthCommand(HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        boolean anyDown = false;
        boolean anyDegraded = false;
        for (HealthStatus check : healthCheckService.checkAll()) {
            String label = check.component() + ": " + check.detail();
            if (!check.metadata().isEmpty()) {
                label += " " + check.metadata();
            }
            switch (check.status()) {
                case UP -> ConsoleOutput.success(label);
                case DOWN -> {
                    ConsoleOutput.error(label);
                    anyDown = true;
                }
                case DEGRADED -> {
                    ConsoleOutput.info(label);
                    anyDegraded = true;
                }
            }
        }

        System.out.println("──────────────────────────────────");
        if (anyDown) {
            ConsoleOutput.error("Overall: one or more components down");
            return 1;
        }
        if (anyDegraded) {
            ConsoleOutput.info("Overall: operational with degraded components");
        } else {
            ConsoleOutput.success("Overall: all systems operational");
        }
        return 0;
    }
}
