package com.larpmanager.server.database;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import lombok.RequiredArgsConstructor;

/**
 * Reports the {@code database} component of {@code /actuator/health}.
 */
@Component
@RequiredArgsConstructor
public class DatabaseHealthIndicator implements HealthIndicator {

    private final DatabaseManager databaseManager;

    @Override
    public Health health() {
        DatabaseHealth result = databaseManager.healthCheck();

        if (!result.isHealthy()) {
            return Health.down()
                .withDetail("error", result.error())
                .build();
        }

        PoolStats pool = result.poolStats();
        return Health.up()
            .withDetail("pool", DatabaseManager.POOL_NAME)
            .withDetail("testQuery", result.testQuery())
            .withDetail("schemaExists", result.schemaExists())
            .withDetail("activeConnections", pool.checkedOut())
            .withDetail("idleConnections", pool.checkedIn())
            .withDetail("threadsAwaitingConnection", pool.pending())
            .build();
    }
}
