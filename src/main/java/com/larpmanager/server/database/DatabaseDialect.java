package com.larpmanager.server.database;

import java.util.Locale;
import java.util.Optional;

/**
 * Backing stores the manager knows how to bootstrap without a live connection.
 *
 * <p>The dialect is picked from the JDBC URL prefix so Hibernate never has to
 * connect just to discover it. Unknown URLs fall back to Hibernate's own
 * detection, which does need the database up.
 */
public enum DatabaseDialect {

    POSTGRESQL("jdbc:postgresql:", "org.hibernate.dialect.PostgreSQLDialect", true),
    H2("jdbc:h2:", "org.hibernate.dialect.H2Dialect", false);

    private final String urlPrefix;
    private final String hibernateDialect;
    private final boolean uuidExtension;

    DatabaseDialect(String urlPrefix, String hibernateDialect, boolean uuidExtension) {
        this.urlPrefix = urlPrefix;
        this.hibernateDialect = hibernateDialect;
        this.uuidExtension = uuidExtension;
    }

    /** Fully qualified Hibernate dialect class name. */
    public String hibernateDialect() {
        return hibernateDialect;
    }

    /**
     * Whether UUID generation must be enabled through the {@code uuid-ossp} extension.
     */
    public boolean requiresUuidExtension() {
        return uuidExtension;
    }

    /**
     * Resolves the dialect for a JDBC URL.
     *
     * @param jdbcUrl the configured URL, may be null
     * @return the dialect, or empty if the URL names another store
     */
    public static Optional<DatabaseDialect> fromUrl(String jdbcUrl) {
        if (jdbcUrl == null) {
            return Optional.empty();
        }
        String url = jdbcUrl.trim().toLowerCase(Locale.ROOT);
        for (DatabaseDialect dialect : values()) {
            if (url.startsWith(dialect.urlPrefix)) {
                return Optional.of(dialect);
            }
        }
        return Optional.empty();
    }
}
