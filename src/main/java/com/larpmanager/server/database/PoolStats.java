package com.larpmanager.server.database;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.zaxxer.hikari.HikariPoolMXBean;

/**
 * Point-in-time view of the connection pool.
 *
 * @param poolSize configured core size
 * @param checkedIn idle connections ready to hand out
 * @param checkedOut connections currently borrowed
 * @param overflow open connections above the core size
 * @param invalid open connections neither idle nor borrowed (being evicted or reserved)
 * @param pending threads waiting for a connection
 */
public record PoolStats(
    @JsonProperty("pool_size") int poolSize,
    @JsonProperty("checked_in") int checkedIn,
    @JsonProperty("checked_out") int checkedOut,
    @JsonProperty("overflow") int overflow,
    @JsonProperty("invalid") int invalid,
    @JsonProperty("pending") int pending
) {

    /**
     * Reads the live counters of a HikariCP pool.
     *
     * @param pool the pool MXBean, null before the pool has started
     * @param poolSize configured core size
     * @return the snapshot; all counters are zero when {@code pool} is null
     */
    public static PoolStats from(HikariPoolMXBean pool, int poolSize) {
        if (pool == null) {
            return new PoolStats(poolSize, 0, 0, 0, 0, 0);
        }
        int idle = pool.getIdleConnections();
        int active = pool.getActiveConnections();
        int total = pool.getTotalConnections();
        return new PoolStats(
            poolSize,
            idle,
            active,
            Math.max(0, total - poolSize),
            Math.max(0, total - active - idle),
            pool.getThreadsAwaitingConnection());
    }
}
