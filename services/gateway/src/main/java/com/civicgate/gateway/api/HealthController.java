package com.civicgate.gateway.api;

import com.civicgate.observability.HealthCheckRegistry;
import com.civicgate.observability.HealthReport;
import com.civicgate.observability.HealthStatus;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Gateway health: {@code HEALTHY} with both telemetry sinks working, {@code DEGRADED} while
 * the session database is unavailable. Only {@code UNHEALTHY} answers 503.
 */
@RestController
@RequestMapping("/api/v1")
public class HealthController {

    private final HealthCheckRegistry healthChecks;

    public HealthController(HealthCheckRegistry healthChecks) {
        this.healthChecks = healthChecks;
    }

    @GetMapping("/health")
    public ResponseEntity<HealthReport> health() {
        HealthReport report = healthChecks.checkAll();
        HttpStatus status = report.status() == HealthStatus.UNHEALTHY ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.OK;
        return ResponseEntity.status(status).body(report);
    }
}
