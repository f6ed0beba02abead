package com.larpmanager.server.util;

import org.springframework.stereotype.Component;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;

/**
 * Helper for the server's custom database metrics.
 *
 * Metrics exposed via Prometheus at /actuator/prometheus:
 * - database.session.count (counter): unit-of-work outcomes
 * - database.raw_sql.count (counter): administrative statement outcomes
 * - database.health.check (counter): health probe verdicts
 *
 * HikariCP publishes its own pool gauges (hikaricp.connections.*) into the
 * same registry.
 *
 * All metrics carry the common tags configured in ObservabilityConfig.
 *
 * @see com.larpmanager.server.config.ObservabilityConfig
 */
@Component
@RequiredArgsConstructor
public class MetricsHelper {

    private final MeterRegistry meterRegistry;

    // Metric names
    private static final String SESSION_COUNT = "database.session.count";
    private static final String RAW_SQL_COUNT = "database.raw_sql.count";
    private static final String HEALTH_CHECK = "database.health.check";

    /**
     * Registry the helper writes to. The connection pool registers its gauges here.
     *
     * @return the meter registry
     */
    public MeterRegistry getMeterRegistry() {
        return meterRegistry;
    }

    /**
     * Records how a session ended.
     *
     * Tags:
     * - outcome: committed/rolled_back
     *
     * @param committed true if the transaction committed
     */
    public void recordSession(boolean committed) {
        Counter.builder(SESSION_COUNT)
            .description("Database sessions by transaction outcome")
            .tag("outcome", committed ? "committed" : "rolled_back")
            .register(meterRegistry)
            .increment();
    }

    /**
     * Records a raw SQL execution.
     *
     * Tags:
     * - outcome: success/failure
     *
     * @param success whether the statement succeeded
     */
    public void recordRawSql(boolean success) {
        Counter.builder(RAW_SQL_COUNT)
            .description("Administrative SQL statements by outcome")
            .tag("outcome", success ? "success" : "failure")
            .register(meterRegistry)
            .increment();
    }

    /**
     * Records a database health probe verdict.
     *
     * @param status healthy/unhealthy
     */
    public void recordHealthCheck(String status) {
        Counter.builder(HEALTH_CHECK)
            .description("Database health probes by verdict")
            .tag("status", status)
            .register(meterRegistry)
            .increment();
    }
}
