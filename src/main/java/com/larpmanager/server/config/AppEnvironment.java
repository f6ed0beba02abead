package com.larpmanager.server.config;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Deployment environment the server runs in.
 */
public enum AppEnvironment {

    DEVELOPMENT,
    STAGING,
    PRODUCTION,
    TESTING;

    /**
     * Lower-case name as it appears in configuration and logs.
     *
     * @return the normalized name, e.g. {@code production}
     */
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses an environment name case-insensitively.
     *
     * @param raw the configured value
     * @return the matching environment
     * @throws InvalidSettingsException if the value names no known environment
     */
    public static AppEnvironment parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new InvalidSettingsException("Environment must not be blank. Allowed: " + allowed());
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT);
        for (AppEnvironment environment : values()) {
            if (environment.name().equals(normalized)) {
                return environment;
            }
        }
        throw new InvalidSettingsException(
            "Invalid environment '" + raw + "'. Allowed: " + allowed());
    }

    private static String allowed() {
        return Arrays.stream(values())
            .map(AppEnvironment::value)
            .collect(Collectors.joining(", "));
    }
}
