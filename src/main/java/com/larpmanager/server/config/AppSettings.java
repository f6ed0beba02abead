package com.larpmanager.server.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import lombok.Getter;
import lombok.ToString;

/**
 * Immutable application settings, bound once at startup.
 *
 * <p>Values come from {@code application.yml}, which maps every key onto an
 * environment variable with a default (for example
 * {@code larp.database.pool-size: ${DATABASE_POOL_SIZE:20}}). An optional
 * {@code .env} file in the working directory supplies the same variable
 * names; real environment variables win over it.
 *
 * <p>Construction fails with {@link InvalidSettingsException} for an unknown
 * environment name, log level or log format. Range violations are reported
 * by Bean Validation. Either way Spring aborts startup.
 *
 * @see DatabaseSettings
 * @see SecuritySettings
 * @see LoggingSettings
 */
@Getter
@ToString
@Validated
@ConfigurationProperties(prefix = "larp")
public class AppSettings {

    @NotBlank
    private final String projectName;

    private final boolean debug;

    @NotNull
    private final AppEnvironment environment;

    @NotBlank
    @Pattern(regexp = "^/.*", message = "must start with '/'")
    private final String apiV1Prefix;

    @Valid
    @NotNull
    private final CorsSettings cors;

    @Valid
    @NotNull
    private final DatabaseSettings database;

    @Valid
    @NotNull
    private final SecuritySettings security;

    @Valid
    @NotNull
    private final LoggingSettings logging;

    public AppSettings(
            String projectName,
            boolean debug,
            String environment,
            String apiV1Prefix,
            CorsSettings cors,
            DatabaseSettings database,
            SecuritySettings security,
            LoggingSettings logging) {
        this.projectName = projectName;
        this.debug = debug;
        this.environment = AppEnvironment.parse(environment);
        this.apiV1Prefix = apiV1Prefix;
        this.cors = cors;
        this.database = database;
        this.security = security;
        this.logging = logging;
    }

    public boolean isDevelopment() {
        return environment == AppEnvironment.DEVELOPMENT;
    }

    public boolean isProduction() {
        return environment == AppEnvironment.PRODUCTION;
    }

    public boolean isTesting() {
        return environment == AppEnvironment.TESTING;
    }
}
