package com.larpmanager.server.database;

/**
 * Thrown when the application schema (or a required extension) cannot be created.
 */
public class SchemaBootstrapException extends DatabaseException {

    public SchemaBootstrapException(String message, Throwable cause) {
        super(message, cause);
    }
}
