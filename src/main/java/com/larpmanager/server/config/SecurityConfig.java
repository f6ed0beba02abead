package com.larpmanager.server.config;

import java.util.List;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.Customizer;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.CorsConfigurationSource;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;

import com.larpmanager.server.util.CorrelationIdFilter;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Security configuration.
 *
 * Current setup:
 * - Health, actuator and API docs routes are public
 * - Everything under the API prefix requires authentication, which is not
 *   implemented yet, so those routes answer 401
 * - Stateless session management, no login form or HTTP basic
 * - CORS policy taken from {@code larp.cors.*}
 */
@Slf4j
@Configuration
@EnableWebSecurity
@RequiredArgsConstructor
public class SecurityConfig {

    private final AppSettings settings;
    private final RestAuthenticationEntryPoint authenticationEntryPoint;

    /**
     * Configures HTTP security for the application.
     *
     * @param http HttpSecurity builder
     * @return configured SecurityFilterChain
     * @throws Exception if configuration fails
     */
    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        String apiPattern = settings.getApiV1Prefix() + "/**";
        log.info("Configuring security filter chain: protected={}", apiPattern);

        http
            .csrf(AbstractHttpConfigurer::disable)
            .cors(Customizer.withDefaults())

            .authorizeHttpRequests(auth -> auth
                .requestMatchers("/health", "/health/**").permitAll()
                .requestMatchers("/actuator/**").permitAll()
                .requestMatchers("/v3/api-docs/**", "/swagger-ui/**", "/swagger-ui.html").permitAll()
                .requestMatchers(apiPattern).authenticated()
                .anyRequest().permitAll()
            )

            .sessionManagement(session -> session
                .sessionCreationPolicy(SessionCreationPolicy.STATELESS)
            )

            .exceptionHandling(handler -> handler
                .authenticationEntryPoint(authenticationEntryPoint)
            )

            .formLogin(AbstractHttpConfigurer::disable)
            .httpBasic(AbstractHttpConfigurer::disable)
            .logout(AbstractHttpConfigurer::disable);

        if (settings.isProduction() && settings.getSecurity().usesDefaultSecret()) {
            log.warn("SECURITY_SECRET_KEY still has its default value in production");
        }

        return http.build();
    }

    /**
     * Cross-origin policy from settings.
     *
     * Origins are registered as patterns so that a wildcard origin still
     * works together with credentials.
     *
     * @return CORS configuration for all routes
     */
    @Bean
    public CorsConfigurationSource corsConfigurationSource() {
        CorsSettings cors = settings.getCors();

        CorsConfiguration config = new CorsConfiguration();
        config.setAllowedOriginPatterns(cors.origins());
        config.setAllowCredentials(cors.allowCredentials());
        config.setAllowedMethods(cors.allowMethods());
        config.setAllowedHeaders(cors.allowHeaders());
        config.setExposedHeaders(List.of(CorrelationIdFilter.CORRELATION_ID_HEADER));

        UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
        source.registerCorsConfiguration("/**", config);
        return source;
    }
}
