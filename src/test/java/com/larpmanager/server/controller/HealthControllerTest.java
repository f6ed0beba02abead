package com.larpmanager.server.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.matchesPattern;
import static org.hamcrest.Matchers.notNullValue;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.options;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.UUID;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import com.larpmanager.server.database.DatabaseManager;
import com.larpmanager.server.util.CorrelationIdFilter;

import io.micrometer.core.instrument.MeterRegistry;

/**
 * HTTP surface against a running context backed by H2.
 *
 * Tests verify that:
 * - /health and /health/live answer without touching the database
 * - /health/db and /health/ready report the initialized, schema-ready database
 * - API routes are rejected with a JSON 401
 * - Correlation IDs are echoed or generated
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class HealthControllerTest {

    private static final String UUID_PATTERN =
        "[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private DatabaseManager databaseManager;

    @Autowired
    private MeterRegistry meterRegistry;

    // =========================================================================
    // Health routes
    // =========================================================================

    @Test
    void health_ShouldReturnServiceIdentity() throws Exception {
        mockMvc.perform(get("/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("healthy"))
            .andExpect(jsonPath("$.service").value("larp-manager-server"))
            .andExpect(jsonPath("$.version").value("1.0.0"));
    }

    @Test
    void live_ShouldReturnAlive() throws Exception {
        mockMvc.perform(get("/health/live"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("alive"))
            .andExpect(jsonPath("$.service").value("larp-manager-server"));
    }

    @Test
    void database_Initialized_ShouldReportHealthyWithSnakeCasePoolStats() throws Exception {
        mockMvc.perform(get("/health/db"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("healthy"))
            .andExpect(jsonPath("$.database.status").value("healthy"))
            .andExpect(jsonPath("$.database.test_query").value(true))
            .andExpect(jsonPath("$.database.schema_exists").value(true))
            .andExpect(jsonPath("$.database.pool_stats.pool_size").value(2))
            .andExpect(jsonPath("$.database.pool_stats.checked_in", greaterThanOrEqualTo(0)))
            .andExpect(jsonPath("$.database.pool_stats.checked_out").value(0))
            .andExpect(jsonPath("$.database.pool_stats.pending").value(0));
    }

    @Test
    void ready_SchemaCreatedAtStartup_ShouldReportReady() throws Exception {
        mockMvc.perform(get("/health/ready"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("ready"))
            .andExpect(jsonPath("$.service").value("larp-manager-server"))
            .andExpect(jsonPath("$.database.status").value("healthy"));
    }

    @Test
    void startup_ShouldHaveInitializedTheDatabase() {
        assertThat(databaseManager.isInitialized()).isTrue();
    }

    @Test
    void actuatorHealth_ShouldIncludeDatabaseComponent() throws Exception {
        mockMvc.perform(get("/actuator/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.components.database.status").value("UP"))
            .andExpect(jsonPath("$.components.database.details.pool").value(DatabaseManager.POOL_NAME))
            .andExpect(jsonPath("$.components.database.details.schemaExists").value(true));
    }

    @Test
    void metrics_ShouldCarryCommonTagsAndProbeCounters() throws Exception {
        // Given
        mockMvc.perform(get("/health/db")).andExpect(status().isOk());

        // Then
        assertThat(meterRegistry.get("hikaricp.connections.max")
                .tag("pool", DatabaseManager.POOL_NAME)
                .tag("application", "larp-manager-server")
                .tag("environment", "testing")
                .gauge().value())
            .isEqualTo(4.0);
        assertThat(meterRegistry.get("database.health.check").tag("status", "healthy").counter().count())
            .isGreaterThanOrEqualTo(1.0);
    }

    // =========================================================================
    // Security
    // =========================================================================

    @Test
    void apiRoute_Unauthenticated_ShouldReturnJson401() throws Exception {
        mockMvc.perform(get("/api/v1/games"))
            .andExpect(status().isUnauthorized())
            .andExpect(jsonPath("$.status").value(401))
            .andExpect(jsonPath("$.error").value("Unauthorized"))
            .andExpect(jsonPath("$.detail").value("Authentication not yet implemented"))
            .andExpect(jsonPath("$.path").value("/api/v1/games"))
            .andExpect(jsonPath("$.correlationId", notNullValue()));
    }

    @Test
    void cors_PreflightFromConfiguredOrigin_ShouldBeAllowed() throws Exception {
        mockMvc.perform(options("/health")
                .header(HttpHeaders.ORIGIN, "http://localhost:3000")
                .header(HttpHeaders.ACCESS_CONTROL_REQUEST_METHOD, "GET"))
            .andExpect(status().isOk())
            .andExpect(header().string(HttpHeaders.ACCESS_CONTROL_ALLOW_ORIGIN, "http://localhost:3000"))
            .andExpect(header().string(HttpHeaders.ACCESS_CONTROL_ALLOW_CREDENTIALS, "true"));
    }

    @Test
    void cors_PreflightFromUnknownOrigin_ShouldBeRejected() throws Exception {
        mockMvc.perform(options("/health")
                .header(HttpHeaders.ORIGIN, "http://evil.example.com")
                .header(HttpHeaders.ACCESS_CONTROL_REQUEST_METHOD, "GET"))
            .andExpect(status().isForbidden());
    }

    // =========================================================================
    // Correlation ID
    // =========================================================================

    @Test
    void correlationId_ProvidedByClient_ShouldBeEchoed() throws Exception {
        String correlationId = UUID.randomUUID().toString();

        mockMvc.perform(get("/health").header(CorrelationIdFilter.CORRELATION_ID_HEADER, correlationId))
            .andExpect(status().isOk())
            .andExpect(header().string(CorrelationIdFilter.CORRELATION_ID_HEADER, correlationId));
    }

    @Test
    void correlationId_Missing_ShouldBeGenerated() throws Exception {
        MvcResult result = mockMvc.perform(get("/health/live"))
            .andExpect(status().isOk())
            .andExpect(header().string(CorrelationIdFilter.CORRELATION_ID_HEADER, matchesPattern(UUID_PATTERN)))
            .andReturn();

        assertThat(result.getResponse().getHeader(CorrelationIdFilter.CORRELATION_ID_HEADER)).isNotBlank();
    }
}
