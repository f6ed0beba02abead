package com.larpmanager.server.service;

import org.springframework.stereotype.Service;

import com.larpmanager.server.database.DatabaseHealth;
import com.larpmanager.server.database.DatabaseManager;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Service behind the health routes.
 *
 * Liveness never touches the database. Database health and readiness both
 * run the manager's probe; readiness additionally requires the application
 * schema to exist.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HealthService {

    public static final String SERVICE_NAME = "larp-manager-server";
    public static final String VERSION = "1.0.0";

    private final DatabaseManager databaseManager;

    /**
     * Probes the database.
     *
     * @return the probe result, unhealthy on any failure
     */
    public DatabaseHealth checkDatabase() {
        try {
            return databaseManager.healthCheck();
        } catch (RuntimeException e) {
            log.error("Database health check failed: {}", e.getMessage(), e);
            return DatabaseHealth.unhealthy(String.valueOf(e.getMessage()));
        }
    }

    /**
     * Whether the server can take traffic.
     *
     * @param health a probe result from {@link #checkDatabase()}
     * @return true if the database is healthy and the schema exists
     */
    public boolean isReady(DatabaseHealth health) {
        return health.isHealthy() && Boolean.TRUE.equals(health.schemaExists());
    }
}
