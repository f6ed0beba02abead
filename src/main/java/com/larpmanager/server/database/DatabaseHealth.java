package com.larpmanager.server.database;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Result of {@link DatabaseManager#healthCheck()}.
 *
 * <p>Serialized with snake_case keys:
 * <pre>
 * {
 *   "status": "healthy",
 *   "test_query": true,
 *   "schema_exists": true,
 *   "pool_stats": {"pool_size": 20, "checked_in": 1, ...},
 *   "error": null
 * }
 * </pre>
 *
 * @param status overall verdict
 * @param testQuery whether {@code SELECT 1} returned 1, null if not attempted
 * @param schemaExists whether the application schema exists, null if not checked
 * @param poolStats pool counters, null when unhealthy
 * @param error failure description when unhealthy
 */
public record DatabaseHealth(
    @JsonProperty("status") Status status,
    @JsonProperty("test_query") Boolean testQuery,
    @JsonProperty("schema_exists") Boolean schemaExists,
    @JsonProperty("pool_stats") PoolStats poolStats,
    @JsonProperty("error") String error
) {

    public enum Status {
        HEALTHY,
        UNHEALTHY;

        @JsonValue
        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public static DatabaseHealth healthy(boolean testQuery, boolean schemaExists, PoolStats poolStats) {
        return new DatabaseHealth(Status.HEALTHY, testQuery, schemaExists, poolStats, null);
    }

    public static DatabaseHealth unhealthy(String error) {
        return new DatabaseHealth(Status.UNHEALTHY, null, null, null, error);
    }

    @JsonIgnore
    public boolean isHealthy() {
        return status == Status.HEALTHY;
    }
}
