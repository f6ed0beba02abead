package com.larpmanager.server.util;

import java.io.IOException;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import lombok.extern.slf4j.Slf4j;

/**
 * Tags every request with a correlation ID.
 *
 * Per request:
 * 1. Reuses the {@code X-Correlation-ID} request header when it holds a UUID
 * 2. Otherwise generates a random one
 * 3. Puts it in the MDC under {@value #CORRELATION_ID_MDC_KEY}, where
 *    logback-spring.xml and the error bodies pick it up
 * 4. Returns it in the {@code X-Correlation-ID} response header
 *
 * Runs first in the filter chain, so even requests rejected by Spring
 * Security carry the header.
 *
 * @see GlobalExceptionHandler#createErrorBody
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";

    /** Referenced by logback-spring.xml. */
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";

    private static final int CANONICAL_UUID_LENGTH = 36;

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response,
            FilterChain chain) throws ServletException, IOException {

        String correlationId = resolve(request.getHeader(CORRELATION_ID_HEADER));
        MDC.put(CORRELATION_ID_MDC_KEY, correlationId);
        response.setHeader(CORRELATION_ID_HEADER, correlationId);

        long started = System.nanoTime();
        try {
            chain.doFilter(request, response);
        } finally {
            log.debug("{} {} -> {} ({} ms)", request.getMethod(), request.getRequestURI(),
                response.getStatus(), TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started));
            MDC.remove(CORRELATION_ID_MDC_KEY);
        }
    }

    /**
     * Picks the correlation ID for a request.
     *
     * @param header the incoming header value, may be null
     * @return the trimmed header if it is a canonical UUID, else a new random UUID
     */
    static String resolve(String header) {
        if (header != null && !header.isBlank()) {
            String candidate = header.trim();
            if (candidate.length() == CANONICAL_UUID_LENGTH) {
                try {
                    UUID.fromString(candidate);
                    return candidate;
                } catch (IllegalArgumentException e) {
                    log.debug("Malformed correlation ID {}: {}", candidate, e.getMessage());
                }
            }
            log.warn("Ignoring invalid {} header: {}", CORRELATION_ID_HEADER, candidate);
        }
        return UUID.randomUUID().toString();
    }

    /**
     * Correlation ID of the request the current thread is serving.
     *
     * @return the ID, or null outside a request
     */
    public static String getCurrentCorrelationId() {
        return MDC.get(CORRELATION_ID_MDC_KEY);
    }
}
