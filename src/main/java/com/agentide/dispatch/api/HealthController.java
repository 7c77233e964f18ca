package com.agentide.dispatch.api;

import com.agentide.core.health.HealthCheckService;
import com.agentide.core.health.HealthReport;
import com.agentide.core.health.HealthStatus;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * GET /api/v1/health. Answers 503 only when a component is DOWN; a DEGRADED engine (in-memory
 * checkpoints, all session slots busy) still serves requests and answers 200.
 */
@RestController
@RequestMapping("/api/v1/health")
public class HealthController {

    private final HealthCheckService healthCheckService;

    public HealthController(@Autowired(required = false) HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @GetMapping
    public ResponseEntity<HealthReport> health() {
        HealthReport report = healthCheckService == null
                ? HealthReport.of(List.of(HealthStatus.down("health", "Health check service not available")))
                : healthCheckService.check();
        return ResponseEntity.status(report.serving() ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE)
                .body(report);
    }
}
