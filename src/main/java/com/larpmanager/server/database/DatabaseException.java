package com.larpmanager.server.database;

/**
 * Base type for failures raised by {@link DatabaseManager}.
 */
public class DatabaseException extends RuntimeException {

    public DatabaseException(String message) {
        super(message);
    }

    public DatabaseException(String message, Throwable cause) {
        super(message, cause);
    }
}
