package com.larpmanager.server.config;

import java.util.Locale;
import java.util.Set;

/**
 * Log level and output format, bound from {@code LOG_LEVEL} and {@code LOG_FORMAT}.
 *
 * <p>The level is normalized to upper case and the format to lower case.
 *
 * @param level one of DEBUG, INFO, WARNING, ERROR, CRITICAL
 * @param format {@code json} or {@code text}
 */
public record LoggingSettings(String level, String format) {

    public static final Set<String> LEVELS = Set.of("DEBUG", "INFO", "WARNING", "ERROR", "CRITICAL");
    public static final Set<String> FORMATS = Set.of("json", "text");

    public LoggingSettings {
        level = level == null ? "" : level.trim().toUpperCase(Locale.ROOT);
        if (!LEVELS.contains(level)) {
            throw new InvalidSettingsException(
                "Invalid log level '" + level + "'. Allowed: DEBUG, INFO, WARNING, ERROR, CRITICAL");
        }
        format = format == null ? "" : format.trim().toLowerCase(Locale.ROOT);
        if (!FORMATS.contains(format)) {
            throw new InvalidSettingsException(
                "Invalid log format '" + format + "'. Allowed: json, text");
        }
    }

    public boolean isJson() {
        return "json".equals(format);
    }
}
