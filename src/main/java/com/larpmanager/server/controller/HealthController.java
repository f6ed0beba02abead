package com.larpmanager.server.controller;

import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.larpmanager.server.database.DatabaseHealth;
import com.larpmanager.server.service.HealthService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Health routes for load balancers and orchestrators.
 *
 * Endpoints:
 * - GET /health: static service identity
 * - GET /health/live: liveness, never touches the database
 * - GET /health/db: database probe, 503 when unhealthy
 * - GET /health/ready: readiness, 503 when the database is not usable
 */
@Slf4j
@RestController
@RequestMapping("/health")
@RequiredArgsConstructor
@Tag(name = "Health", description = "Liveness, readiness and database health")
public class HealthController {

    private final HealthService healthService;

    @GetMapping
    @Operation(summary = "Basic health check")
    public Map<String, Object> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "healthy");
        body.put("service", HealthService.SERVICE_NAME);
        body.put("version", HealthService.VERSION);
        return body;
    }

    @GetMapping("/live")
    @Operation(summary = "Liveness check")
    public Map<String, Object> live() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "alive");
        body.put("service", HealthService.SERVICE_NAME);
        return body;
    }

    /**
     * Database health with pool statistics.
     *
     * Example response:
     * <pre>
     * {
     *   "status": "healthy",
     *   "database": {
     *     "status": "healthy",
     *     "test_query": true,
     *     "schema_exists": true,
     *     "pool_stats": {"pool_size": 20, "checked_in": 3, "checked_out": 1, ...},
     *     "error": null
     *   }
     * }
     * </pre>
     *
     * @return 200 when healthy, 503 otherwise
     */
    @GetMapping("/db")
    @Operation(summary = "Database health check")
    public ResponseEntity<Map<String, Object>> database() {
        DatabaseHealth health = healthService.checkDatabase();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", health.status().value());
        body.put("database", health);

        return ResponseEntity
            .status(health.isHealthy() ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE)
            .body(body);
    }

    @GetMapping("/ready")
    @Operation(summary = "Readiness check")
    public ResponseEntity<Map<String, Object>> ready() {
        DatabaseHealth health = healthService.checkDatabase();

        Map<String, Object> body = new LinkedHashMap<>();
        if (!healthService.isReady(health)) {
            log.warn("Readiness check failed: {}", health.error());
            body.put("status", "not_ready");
            body.put("reason", health.isHealthy() ? "Database schema missing" : "Database not healthy");
            body.put("database", health);
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
        }

        body.put("status", "ready");
        body.put("service", HealthService.SERVICE_NAME);
        body.put("database", health);
        return ResponseEntity.ok(body);
    }
}
