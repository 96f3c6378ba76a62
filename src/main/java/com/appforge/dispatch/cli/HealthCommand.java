package com.appforge.dispatch.cli;

import com.appforge.core.health.HealthCheckService;
import com.appforge.core.health.HealthStatus;
import com.appforge.core.provider.ProviderHealthRegistry;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: appforge health
 * <p>
 * Runs every health check and prints the provider circuit table.
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check system health")
@Component
public class HealthCommand implements Runnable {

    private final HealthCheckService healthCheckService;
    private final ProviderHealthRegistry providerHealth;

    public HealthCommand(HealthCheckService healthCheckService, ProviderHealthRegistry providerHealth) {
        this.healthCheckService = healthCheckService;
        this.providerHealth = providerHealth;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        var checks = healthCheckService.checkAll();
        for (var check : checks) {
            String label = check.component() + ": " + check.detail();
            switch (check.status()) {
                case UP -> ConsoleOutput.success(label);
                case DOWN -> ConsoleOutput.error(label);
                case DEGRADED -> ConsoleOutput.warn(label);
            }
        }
        boolean allUp = checks.stream().allMatch(HealthStatus::isUp);

        var snapshots = providerHealth.snapshots();
        if (!snapshots.isEmpty()) {
            System.out.println();
            System.out.println("PROVIDERS:");
            snapshots.forEach(ConsoleOutput::providerHealth);
        }

        System.out.println("──────────────────────────────────");
        if (allUp) {
            ConsoleOutput.success("Overall: all systems operational");
        } else {
            ConsoleOutput.error("Overall: one or more components degraded or down");
        }
    }
}
