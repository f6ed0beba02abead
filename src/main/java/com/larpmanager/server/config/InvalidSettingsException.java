package com.larpmanager.server.config;

/**
 * Thrown while settings are being constructed when a value is outside its
 * allowed set (environment name, log level, log format).
 *
 * Spring reports it as a bind failure, which aborts startup.
 */
public class InvalidSettingsException extends RuntimeException {

    public InvalidSettingsException(String message) {
        super(message);
    }
}
