package com.larpmanager.server.config;

import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import com.larpmanager.server.database.DatabaseManager;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Opens the database before the web server accepts requests and closes it
 * after the web server has stopped.
 *
 * A failure while starting closes whatever was opened and aborts application
 * startup.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DatabaseLifecycle implements SmartLifecycle {

    /** Lower than the web server's phase: start first, stop last. */
    static final int PHASE = 0;

    private final DatabaseManager databaseManager;
    private final AppSettings settings;

    @Override
    public void start() {
        log.info("Starting {} ({})", settings.getProjectName(), settings.getEnvironment().value());
        try {
            databaseManager.initialize();
            databaseManager.createSchema();
        } catch (RuntimeException e) {
            log.error("Failed to start application: {}", e.getMessage());
            // Startup aborts before stop() is ever called
            databaseManager.close();
            throw e;
        }
        log.info("Database initialized successfully");
    }

    @Override
    public void stop() {
        log.info("Shutting down {}", settings.getProjectName());
        databaseManager.close();
    }

    @Override
    public boolean isRunning() {
        return databaseManager.isInitialized();
    }

    @Override
    public int getPhase() {
        return PHASE;
    }
}
