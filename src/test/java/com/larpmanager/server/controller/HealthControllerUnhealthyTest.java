package com.larpmanager.server.controller;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import com.larpmanager.server.database.DatabaseHealth;
import com.larpmanager.server.database.DatabaseManager;
import com.larpmanager.server.database.PoolStats;

/**
 * Health routes when the database is down or not yet bootstrapped.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class HealthControllerUnhealthyTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private DatabaseManager databaseManager;

    @Test
    void database_Unhealthy_ShouldReturn503WithError() throws Exception {
        // Given
        when(databaseManager.healthCheck()).thenReturn(DatabaseHealth.unhealthy("Connection refused"));

        // When / Then
        mockMvc.perform(get("/health/db"))
            .andExpect(status().isServiceUnavailable())
            .andExpect(jsonPath("$.status").value("unhealthy"))
            .andExpect(jsonPath("$.database.status").value("unhealthy"))
            .andExpect(jsonPath("$.database.error").value("Connection refused"));
    }

    @Test
    void ready_Unhealthy_ShouldReturn503NotReady() throws Exception {
        // Given
        when(databaseManager.healthCheck()).thenReturn(DatabaseHealth.unhealthy("Connection refused"));

        // When / Then
        mockMvc.perform(get("/health/ready"))
            .andExpect(status().isServiceUnavailable())
            .andExpect(jsonPath("$.status").value("not_ready"))
            .andExpect(jsonPath("$.reason").value("Database not healthy"))
            .andExpect(jsonPath("$.database.error").value("Connection refused"));
    }

    @Test
    void ready_SchemaMissing_ShouldReturn503NotReady() throws Exception {
        // Given
        when(databaseManager.healthCheck())
            .thenReturn(DatabaseHealth.healthy(true, false, new PoolStats(2, 2, 0, 0, 0, 0)));

        // When / Then
        mockMvc.perform(get("/health/ready"))
            .andExpect(status().isServiceUnavailable())
            .andExpect(jsonPath("$.status").value("not_ready"))
            .andExpect(jsonPath("$.reason").value("Database schema missing"));
    }

    @Test
    void database_ProbeThrows_ShouldStillAnswer503() throws Exception {
        // Given
        when(databaseManager.healthCheck()).thenThrow(new IllegalStateException("pool exploded"));

        // When / Then
        mockMvc.perform(get("/health/db"))
            .andExpect(status().isServiceUnavailable())
            .andExpect(jsonPath("$.database.error").value("pool exploded"));
    }

    @Test
    void live_ShouldNotDependOnTheDatabase() throws Exception {
        // Given
        when(databaseManager.healthCheck()).thenThrow(new IllegalStateException("must not be called"));

        // When / Then
        mockMvc.perform(get("/health/live"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("alive"));
    }
}
