package com.larpmanager.server.database;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;

import org.hibernate.Session;
import org.hibernate.SessionFactory;
import org.hibernate.Transaction;
import org.hibernate.boot.MetadataSources;
import org.hibernate.boot.registry.StandardServiceRegistry;
import org.hibernate.boot.registry.StandardServiceRegistryBuilder;
import org.hibernate.cfg.AvailableSettings;
import org.hibernate.resource.transaction.spi.TransactionStatus;

import com.larpmanager.server.config.AppSettings;
import com.larpmanager.server.config.DatabaseSettings;
import com.larpmanager.server.domain.BaseEntity;
import com.larpmanager.server.domain.SchemaNamingStrategy;
import com.larpmanager.server.util.MetricsHelper;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

import lombok.extern.slf4j.Slf4j;

/**
 * Owns the connection pool and the Hibernate session factory.
 *
 * <p>Lifecycle:
 * <pre>
 *   Uninitialized --initialize()--&gt; Initialized --close()--&gt; Uninitialized
 * </pre>
 * Both transitions are idempotent: a repeated call logs a warning and returns.
 * The manager can be initialized again after it was closed.
 *
 * <p>{@code initialize()} does not need the database to be reachable. The pool
 * opens connections in the background and {@link #healthCheck()} reports an
 * unreachable store instead.
 *
 * <p>Thread safety: {@code initialize()} and {@code close()} are synchronized.
 * Every other operation reads one volatile snapshot of the handles and takes
 * no lock, so a concurrent {@code close()} makes in-flight callers fail with
 * a pool error rather than block.
 *
 * <p>Pool configuration (HikariCP):
 * <ul>
 *   <li>minimumIdle = pool size</li>
 *   <li>maximumPoolSize = pool size + max overflow</li>
 *   <li>connectionTimeout = pool timeout</li>
 *   <li>maxLifetime = pool recycle</li>
 *   <li>auto-commit off, every unit of work runs in an explicit transaction</li>
 * </ul>
 *
 * @see DatabaseHealth
 * @see RawSqlResult
 */
@Slf4j
public class DatabaseManager implements AutoCloseable {

    public static final String POOL_NAME = "LarpManagerPool";

    private static final String ALLOW_JDBC_METADATA_ACCESS = "hibernate.boot.allow_jdbc_metadata_access";

    private static final String NOT_INITIALIZED = "Database not initialized";

    private static final String TEST_QUERY = "SELECT 1";

    private static final String SCHEMA_EXISTS_QUERY =
        "SELECT schema_name FROM information_schema.schemata WHERE LOWER(schema_name) = ?";

    private final AppSettings settings;
    private final MetricsHelper metrics;
    private final List<Class<?>> entityClasses;
    private final DatabaseDialect dialect;

    private volatile Handles handles;

    /**
     * Both handles are published together so a reader never sees one without the other.
     */
    private record Handles(HikariDataSource dataSource, SessionFactory sessionFactory) {
    }

    /**
     * Creates an uninitialized manager.
     *
     * @param settings application settings
     * @param metrics metrics helper, or null to skip metrics
     * @param entityClasses annotated entity classes to map
     */
    public DatabaseManager(AppSettings settings, MetricsHelper metrics, Collection<Class<?>> entityClasses) {
        this.settings = settings;
        this.metrics = metrics;
        this.entityClasses = List.copyOf(entityClasses);
        this.dialect = DatabaseDialect.fromUrl(settings.getDatabase().url()).orElse(null);
    }

    public DatabaseManager(AppSettings settings) {
        this(settings, null, List.of());
    }

    // =========================================================================
    // Lifecycle
    // =========================================================================

    /**
     * Creates the connection pool and the session factory.
     *
     * Does nothing if already initialized.
     *
     * @throws DatabaseException if the pool or the session factory cannot be built
     */
    public synchronized void initialize() {
        if (handles != null) {
            log.warn("Database already initialized");
            return;
        }

        DatabaseSettings database = settings.getDatabase();
        log.info("Initializing database connection pool: pool={}, size={}, maxOverflow={}, dialect={}",
            POOL_NAME, database.poolSize(), database.maxOverflow(), dialect);

        HikariDataSource dataSource;
        try {
            dataSource = new HikariDataSource(hikariConfig(database));
        } catch (RuntimeException e) {
            throw new DatabaseException("Failed to create connection pool: " + describe(e), e);
        }

        SessionFactory sessionFactory;
        try {
            sessionFactory = buildSessionFactory(dataSource);
        } catch (RuntimeException e) {
            dataSource.close();
            throw new DatabaseException("Failed to build session factory: " + describe(e), e);
        }

        handles = new Handles(dataSource, sessionFactory);
        log.info("Database connection initialized: pool={}, max={}, entities={}",
            POOL_NAME, database.maximumPoolSize(), entityClasses.size());
    }

    /**
     * Closes the session factory, then the connection pool.
     *
     * Does nothing if not initialized. The pool is closed even if closing the
     * session factory fails.
     */
    @Override
    public synchronized void close() {
        Handles current = handles;
        if (current == null) {
            log.warn("Database not initialized, nothing to close");
            return;
        }

        handles = null;
        log.info("Closing database connections");
        try {
            current.sessionFactory().close();
        } finally {
            current.dataSource().close();
        }
        log.info("Database connections closed");
    }

    public boolean isInitialized() {
        return handles != null;
    }

    /**
     * Returns the pooled connection source.
     *
     * @return the HikariCP data source
     * @throws DatabaseNotInitializedException if not initialized
     */
    public HikariDataSource getEngine() {
        return requireInitialized().dataSource();
    }

    // =========================================================================
    // Sessions
    // =========================================================================

    /**
     * Runs a unit of work in a transactional session.
     *
     * On normal return the transaction commits, unless it was marked
     * rollback-only or already ended by the callback. If the callback throws,
     * the transaction rolls back and the same exception propagates. The
     * session is closed on every path.
     *
     * @param callback the work to run
     * @param <T> result type
     * @param <E> checked exception the work may throw
     * @return the callback's result
     * @throws E whatever the callback throws
     * @throws DatabaseNotInitializedException if not initialized
     */
    public <T, E extends Exception> T withSession(SessionCallback<T, E> callback) throws E {
        Handles current = requireInitialized();
        boolean completed = false;
        boolean committed = false;

        try (Session session = current.sessionFactory().openSession()) {
            Transaction transaction = session.beginTransaction();
            try {
                T result = callback.doInSession(session);
                committed = complete(transaction);
                completed = true;
                return result;
            } finally {
                if (!completed) {
                    rollbackQuietly(transaction);
                }
                recordSession(committed);
            }
        }
    }

    private static boolean complete(Transaction transaction) {
        TransactionStatus status = transaction.getStatus();
        if (!status.canRollback()) {
            // Ended by the callback itself
            return status == TransactionStatus.COMMITTED;
        }
        if (status == TransactionStatus.ACTIVE && !transaction.getRollbackOnly()) {
            transaction.commit();
            return true;
        }
        log.debug("Transaction marked rollback-only, rolling back");
        transaction.rollback();
        return false;
    }

    // Only runs while another exception is already propagating.
    private static void rollbackQuietly(Transaction transaction) {
        try {
            if (transaction.getStatus().canRollback()) {
                transaction.rollback();
                log.debug("Session rolled back after error");
            }
        } catch (RuntimeException e) {
            log.warn("Rollback failed after session error: {}", describe(e));
        }
    }

    // =========================================================================
    // Schema and raw SQL
    // =========================================================================

    /**
     * Creates the application schema and, on PostgreSQL, the {@code uuid-ossp} extension.
     *
     * Both statements are idempotent and run in one transaction.
     *
     * @throws DatabaseNotInitializedException if not initialized
     * @throws SchemaBootstrapException if a statement fails
     */
    public void createSchema() {
        Handles current = requireInitialized();

        try (Connection connection = current.dataSource().getConnection()) {
            try (Statement statement = connection.createStatement()) {
                statement.execute("CREATE SCHEMA IF NOT EXISTS " + BaseEntity.SCHEMA);
                if (dialect != null && dialect.requiresUuidExtension()) {
                    statement.execute("CREATE EXTENSION IF NOT EXISTS \"uuid-ossp\"");
                }
                connection.commit();
            } catch (SQLException e) {
                rollbackAfter(connection, e);
                throw e;
            }
        } catch (SQLException e) {
            log.error("Failed to create database schema {}: {}", BaseEntity.SCHEMA, e.getMessage());
            throw new SchemaBootstrapException(
                "Failed to create schema " + BaseEntity.SCHEMA + ": " + describe(e), e);
        }

        log.info("Database schema ready: {}", BaseEntity.SCHEMA);
    }

    /**
     * Executes one SQL statement on its own connection and transaction.
     *
     * Administrative use only. Statement failures are returned, not thrown.
     *
     * @param sql the statement
     * @return rows for queries, an update count otherwise, or the error
     * @throws DatabaseNotInitializedException if not initialized
     */
    public RawSqlResult executeRaw(String sql) {
        Handles current = requireInitialized();

        RawSqlResult result;
        if (sql == null || sql.isBlank()) {
            result = RawSqlResult.failure("SQL statement must not be blank");
        } else {
            try (Connection connection = current.dataSource().getConnection()) {
                try (Statement statement = connection.createStatement()) {
                    result = statement.execute(sql)
                        ? RawSqlResult.ofRows(readRows(statement))
                        : RawSqlResult.ofUpdateCount(statement.getUpdateCount());
                    connection.commit();
                } catch (SQLException e) {
                    rollbackAfter(connection, e);
                    throw e;
                }
            } catch (SQLException e) {
                log.error("Raw SQL execution failed: {}", e.getMessage());
                result = RawSqlResult.failure(describe(e));
            }
        }

        if (metrics != null) {
            metrics.recordRawSql(result.success());
        }
        return result;
    }

    private static List<List<Object>> readRows(Statement statement) throws SQLException {
        List<List<Object>> rows = new ArrayList<>();
        try (ResultSet resultSet = statement.getResultSet()) {
            ResultSetMetaData metaData = resultSet.getMetaData();
            int columns = metaData.getColumnCount();
            while (resultSet.next()) {
                List<Object> row = new ArrayList<>(columns);
                for (int i = 1; i <= columns; i++) {
                    row.add(resultSet.getObject(i));
                }
                rows.add(row);
            }
        }
        return rows;
    }

    // =========================================================================
    // Health
    // =========================================================================

    /**
     * Probes the backing store.
     *
     * Runs {@code SELECT 1}, looks the application schema up in
     * {@code information_schema} and reads the pool counters. Never throws:
     * every failure is reported as an unhealthy result.
     *
     * @return the probe result
     */
    public DatabaseHealth healthCheck() {
        DatabaseHealth health = probe();
        if (metrics != null) {
            metrics.recordHealthCheck(health.status().value());
        }
        return health;
    }

    private DatabaseHealth probe() {
        Handles current = handles;
        if (current == null) {
            return DatabaseHealth.unhealthy(NOT_INITIALIZED);
        }

        try (Connection connection = current.dataSource().getConnection()) {
            boolean testQuery;
            boolean schemaExists;
            try {
                testQuery = runTestQuery(connection);
                schemaExists = schemaExists(connection);
                connection.commit();
            } catch (SQLException e) {
                rollbackAfter(connection, e);
                throw e;
            }
            PoolStats poolStats = PoolStats.from(
                current.dataSource().getHikariPoolMXBean(),
                settings.getDatabase().poolSize());
            return DatabaseHealth.healthy(testQuery, schemaExists, poolStats);
        } catch (Exception e) {
            log.error("Database health check failed: {}", describe(e));
            return DatabaseHealth.unhealthy(describe(e));
        }
    }

    private static boolean runTestQuery(Connection connection) throws SQLException {
        try (Statement statement = connection.createStatement();
             ResultSet resultSet = statement.executeQuery(TEST_QUERY)) {
            return resultSet.next() && resultSet.getInt(1) == 1;
        }
    }

    private static boolean schemaExists(Connection connection) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(SCHEMA_EXISTS_QUERY)) {
            statement.setString(1, BaseEntity.SCHEMA.toLowerCase(Locale.ROOT));
            try (ResultSet resultSet = statement.executeQuery()) {
                return resultSet.next();
            }
        }
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    private Handles requireInitialized() {
        Handles current = handles;
        if (current == null) {
            throw new DatabaseNotInitializedException();
        }
        return current;
    }

    private HikariConfig hikariConfig(DatabaseSettings database) {
        HikariConfig config = new HikariConfig();
        config.setPoolName(POOL_NAME);
        config.setJdbcUrl(database.url());
        config.setUsername(database.username());
        config.setPassword(database.password());

        config.setMinimumIdle(database.poolSize());
        config.setMaximumPoolSize(database.maximumPoolSize());
        config.setConnectionTimeout(database.poolTimeoutMillis());
        config.setMaxLifetime(database.poolRecycleMillis());

        // Start even when the database is down; health reports it instead
        config.setInitializationFailTimeout(-1);

        config.setAutoCommit(false);

        if (metrics != null) {
            config.setMetricRegistry(metrics.getMeterRegistry());
        }
        return config;
    }

    private SessionFactory buildSessionFactory(HikariDataSource dataSource) {
        StandardServiceRegistryBuilder registryBuilder = new StandardServiceRegistryBuilder()
            .applySetting(AvailableSettings.DATASOURCE, dataSource)
            .applySetting(AvailableSettings.CONNECTION_PROVIDER_DISABLES_AUTOCOMMIT, true)
            .applySetting(AvailableSettings.DEFAULT_SCHEMA, BaseEntity.SCHEMA)
            .applySetting(AvailableSettings.SHOW_SQL, settings.isDebug())
            .applySetting(AvailableSettings.FORMAT_SQL, settings.isDebug());

        // A known dialect means Hibernate never has to connect during bootstrap
        if (dialect != null) {
            registryBuilder
                .applySetting(AvailableSettings.DIALECT, dialect.hibernateDialect())
                .applySetting(ALLOW_JDBC_METADATA_ACCESS, false);
        }

        StandardServiceRegistry registry = registryBuilder.build();
        try {
            MetadataSources sources = new MetadataSources(registry);
            entityClasses.forEach(sources::addAnnotatedClass);
            return sources.getMetadataBuilder()
                .applyPhysicalNamingStrategy(new SchemaNamingStrategy())
                .build()
                .buildSessionFactory();
        } catch (RuntimeException e) {
            StandardServiceRegistryBuilder.destroy(registry);
            throw e;
        }
    }

    private void recordSession(boolean committed) {
        if (metrics != null) {
            metrics.recordSession(committed);
        }
    }

    private static void rollbackAfter(Connection connection, SQLException failure) {
        try {
            connection.rollback();
        } catch (SQLException e) {
            failure.addSuppressed(e);
        }
    }

    private static String describe(Throwable e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }
}
