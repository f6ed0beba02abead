package com.larpmanager.server.config;

import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.config.MeterFilter;
import lombok.extern.slf4j.Slf4j;

/**
 * Micrometer setup shared by every meter of the server.
 *
 * Meters exposed at /actuator/prometheus:
 * - hikaricp.connections.* for the LarpManagerPool
 * - database.session.count, database.raw_sql.count, database.health.check
 * - http.server.requests and the JVM defaults
 *
 * @see com.larpmanager.server.util.MetricsHelper
 */
@Slf4j
@Configuration
public class ObservabilityConfig {

    /** Distinct {@code uri} values kept on HTTP request meters. */
    static final int MAX_HTTP_URIS = 100;

    /**
     * Tags every meter with {@code application} and {@code environment}.
     *
     * @param environment Spring environment, for {@code spring.application.name}
     * @param settings application settings, for the deployment environment
     * @return registry customizer
     */
    @Bean
    public MeterRegistryCustomizer<MeterRegistry> metricsCommonTags(Environment environment, AppSettings settings) {
        Tags tags = commonTags(environment.getProperty("spring.application.name", "larp-manager-server"), settings);
        log.info("Metrics common tags: {}", tags);
        return registry -> registry.config().commonTags(tags);
    }

    static Tags commonTags(String applicationName, AppSettings settings) {
        return Tags.of(
            "application", applicationName,
            "environment", settings.getEnvironment().value());
    }

    /**
     * Stops recording new HTTP request meters once {@value #MAX_HTTP_URIS}
     * URIs are known. Requests to unmapped paths would otherwise grow the
     * registry without bound.
     *
     * @return meter filter
     */
    @Bean
    public MeterFilter httpUriCardinalityLimit() {
        return MeterFilter.maximumAllowableTags("http.server.requests", "uri", MAX_HTTP_URIS, MeterFilter.deny());
    }
}
