package com.hangar.dispatch.api;

import com.hangar.core.health.HealthCheckService;
import com.hangar.core.health.HealthStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller for system health status.
 */
@RestController
@RequestMapping("/api/v1/health")
public class HealthController {

    private final HealthCheckService healthCheckService;

    public HealthController(HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    /**
     * GET /api/v1/health: 200 unless a component is DOWN, then 503.
     * A DEGRADED component is reported but keeps the overall 200.
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> health() {
        List<HealthStatus> checks = healthCheckService.checkAll();

        Map<String, Object> components = new LinkedHashMap<>();
        for (HealthStatus check : checks) {
            Map<String, Object> component = new LinkedHashMap<>();
            component.put("status", check.status().name());
            component.put("detail", check.detail());
            if (!check.metadata().isEmpty()) {
                component.put("metadata", check.metadata());
            }
            components.put(check.component(), component);
        }

        HealthStatus.Status overall = HealthStatus.overall(checks);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", overall.name());
        body.put("components", components);

        return ResponseEntity.status(overall == HealthStatus.Status.DOWN ? 503 : 200).body(body);
    }
}
