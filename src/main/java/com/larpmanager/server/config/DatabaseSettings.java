package com.larpmanager.server.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

/**
 * Connection and pool knobs, bound from the {@code DATABASE_*} variables.
 *
 * <p>Pool sizing maps onto HikariCP as follows:
 * <ul>
 *   <li>{@code poolSize}: minimum idle connections kept open</li>
 *   <li>{@code poolSize + maxOverflow}: maximum pool size</li>
 *   <li>{@code poolTimeout}: seconds a caller waits for a connection</li>
 *   <li>{@code poolRecycle}: seconds before a connection is retired</li>
 * </ul>
 *
 * @param url JDBC URL of the backing store
 * @param username database user
 * @param password database password
 * @param poolSize core pool size
 * @param maxOverflow connections allowed above the core size
 * @param poolTimeout acquisition timeout in seconds
 * @param poolRecycle maximum connection lifetime in seconds
 */
public record DatabaseSettings(
    @NotBlank @Pattern(regexp = "^jdbc:.+", message = "must be a JDBC URL") String url,
    String username,
    String password,
    @Min(1) int poolSize,
    @Min(0) int maxOverflow,
    @Min(1) int poolTimeout,
    @Min(30) int poolRecycle
) {

    public int maximumPoolSize() {
        return poolSize + maxOverflow;
    }

    public long poolTimeoutMillis() {
        return poolTimeout * 1000L;
    }

    public long poolRecycleMillis() {
        return poolRecycle * 1000L;
    }

    // Keep the password out of logs and actuator output.
    @Override
    public String toString() {
        return "DatabaseSettings[url=" + url + ", username=" + username
            + ", poolSize=" + poolSize + ", maxOverflow=" + maxOverflow
            + ", poolTimeout=" + poolTimeout + ", poolRecycle=" + poolRecycle + "]";
    }
}
