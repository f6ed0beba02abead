package com.larpmanager.server.config;

import jakarta.annotation.PostConstruct;

import org.springframework.boot.logging.LogLevel;
import org.springframework.boot.logging.LoggingSystem;
import org.springframework.context.annotation.Configuration;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Applies {@code larp.logging.level} to the logging system.
 *
 * Level names follow the operator-facing vocabulary
 * (DEBUG, INFO, WARNING, ERROR, CRITICAL) and are mapped onto Logback's.
 * The output format (json/text) is selected in logback-spring.xml.
 *
 * In debug mode Spring MVC request handling logs at DEBUG; otherwise the
 * embedded Tomcat is quieted to WARN.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class LoggingConfig {

    static final String APPLICATION_LOGGER = "com.larpmanager";

    private final AppSettings settings;
    private final LoggingSystem loggingSystem;

    @PostConstruct
    void applyLogLevels() {
        LogLevel level = toLogLevel(settings.getLogging().level());

        loggingSystem.setLogLevel(LoggingSystem.ROOT_LOGGER_NAME, level);
        loggingSystem.setLogLevel(APPLICATION_LOGGER, level);

        if (settings.isDebug()) {
            loggingSystem.setLogLevel("org.springframework.web", LogLevel.DEBUG);
        } else {
            loggingSystem.setLogLevel("org.apache.catalina", LogLevel.WARN);
            loggingSystem.setLogLevel("org.apache.coyote", LogLevel.WARN);
        }

        log.info("Logging configured: level={}, format={}, debug={}",
            settings.getLogging().level(), settings.getLogging().format(), settings.isDebug());
    }

    /**
     * Maps a configured level name onto a Spring Boot {@link LogLevel}.
     *
     * @param level normalized level name
     * @return the matching log level
     */
    static LogLevel toLogLevel(String level) {
        switch (level) {
            case "DEBUG":
                return LogLevel.DEBUG;
            case "WARNING":
                return LogLevel.WARN;
            case "ERROR":
            case "CRITICAL":
                return LogLevel.ERROR;
            default:
                return LogLevel.INFO;
        }
    }
}
