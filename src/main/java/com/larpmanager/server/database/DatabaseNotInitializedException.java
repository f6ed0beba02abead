package com.larpmanager.server.database;

/**
 * Thrown when an operation needs the connection pool before
 * {@link DatabaseManager#initialize()} has run, or after {@link DatabaseManager#close()}.
 */
public class DatabaseNotInitializedException extends DatabaseException {

    public static final String MESSAGE = "Database not initialized. Call initialize() first.";

    public DatabaseNotInitializedException() {
        super(MESSAGE);
    }
}
