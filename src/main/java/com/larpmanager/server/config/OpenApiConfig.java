package com.larpmanager.server.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.larpmanager.server.service.HealthService;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;

/**
 * API documentation metadata.
 *
 * The docs routes themselves are switched on only in debug mode
 * (see {@code springdoc.*} in application.yml).
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI larpManagerOpenApi(AppSettings settings) {
        return new OpenAPI().info(new Info()
            .title(settings.getProjectName())
            .description("A comprehensive LARP (Live Action Role Playing) management system")
            .version(HealthService.VERSION));
    }
}
