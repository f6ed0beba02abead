package com.larpmanager.server.config;

import java.util.Locale;
import java.util.Map;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.context.config.ConfigDataEnvironmentPostProcessor;
import org.springframework.boot.env.EnvironmentPostProcessor;
import org.springframework.core.Ordered;
import org.springframework.core.env.ConfigurableEnvironment;
import org.springframework.core.env.MapPropertySource;

/**
 * Resolves the console appender used by logback-spring.xml from
 * {@code larp.logging.format}.
 *
 * Logback is configured before {@link AppSettings} is bound, so the format is
 * normalized here the same way {@link LoggingSettings} does it. Anything other
 * than {@code text} selects the JSON appender, which keeps startup failures
 * for a bad format visible.
 */
public class LoggingFormatEnvironmentPostProcessor implements EnvironmentPostProcessor, Ordered {

    static final String FORMAT_PROPERTY = "larp.logging.format";
    static final String APPENDER_PROPERTY = "larp.logging.console-appender";
    static final String PROPERTY_SOURCE_NAME = "larpLoggingAppender";

    static final String TEXT_APPENDER = "CONSOLE_text";
    static final String JSON_APPENDER = "CONSOLE_json";

    @Override
    public void postProcessEnvironment(ConfigurableEnvironment environment, SpringApplication application) {
        String appender = appenderFor(environment.getProperty(FORMAT_PROPERTY));
        environment.getPropertySources().addFirst(
            new MapPropertySource(PROPERTY_SOURCE_NAME, Map.of(APPENDER_PROPERTY, appender)));
    }

    static String appenderFor(String format) {
        if (format != null && "text".equals(format.trim().toLowerCase(Locale.ROOT))) {
            return TEXT_APPENDER;
        }
        return JSON_APPENDER;
    }

    /** After application.yml and the profile files are loaded. */
    @Override
    public int getOrder() {
        return ConfigDataEnvironmentPostProcessor.ORDER + 1;
    }
}
