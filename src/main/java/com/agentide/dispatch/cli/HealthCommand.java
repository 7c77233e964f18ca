package com.agentide.dispatch.cli;

import com.agentide.core.health.HealthCheckService;
import com.agentide.core.health.HealthStatus;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.concurrent.Callable;
import java.util.stream.Collectors;

/**
 * {@code agentide health}: prints each component check with its metadata. Exits 1 when a
 * component is DOWN.
 */
@Command(name = "health", mixinStandardHelpOptions = true,
        description = "Show engine health: graph step ceiling, checkpoint durability, session slots")
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
            return 1;
        }

        var report = healthCheckService.check();
        for (HealthStatus check : report.components()) {
            String line = "[" + check.status() + "] " + check.detail();
            if (check.status() == HealthStatus.Status.DOWN) {
                ConsoleOutput.error(check.component() + " " + line);
            } else {
                ConsoleOutput.component(check.component(), line);
            }
            if (!check.metadata().isEmpty()) {
                ConsoleOutput.info("  " + formatMetadata(check));
            }
        }
        ConsoleOutput.rule();
        if (report.serving()) {
            ConsoleOutput.success("Overall: " + report.status());
            return 0;
        }
        ConsoleOutput.error("Overall: " + report.status());
        return 1;
    }

    static String formatMetadata(HealthStatus check) {
        return check.metadata().entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(" "));
    }
}
