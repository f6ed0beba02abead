package com.larpmanager.server.util;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import jakarta.servlet.http.HttpServletRequest;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import com.larpmanager.server.config.AppSettings;
import com.larpmanager.server.database.DatabaseNotInitializedException;
import com.larpmanager.server.exception.ApiException;
import com.larpmanager.server.exception.ValidationException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Global exception handler for REST controllers.
 *
 * Error response format:
 * <pre>
 * {
 *   "timestamp": "2026-10-19T10:30:00Z",
 *   "status": 404,
 *   "error": "Not Found",
 *   "detail": "Game with identifier '42' not found",
 *   "path": "/api/v1/games/42",
 *   "correlationId": "550e8400-e29b-41d4-a716-446655440000"
 * }
 * </pre>
 *
 * Unexpected errors only expose their message and type when debug is on.
 *
 * @see com.larpmanager.server.util.CorrelationIdFilter
 */
@Slf4j
@RestControllerAdvice
@RequiredArgsConstructor
public class GlobalExceptionHandler {

    static final String INTERNAL_ERROR = "Internal server error";
    static final String GENERIC_DETAIL = "An unexpected error occurred";

    private final AppSettings settings;

    /**
     * Handles the API error hierarchy: renders the exception's own status and detail.
     *
     * @param ex the exception
     * @param request the HTTP request
     * @return error response with the exception's status
     */
    @ExceptionHandler(ApiException.class)
    public ResponseEntity<Map<String, Object>> handleApiException(
            ApiException ex,
            HttpServletRequest request) {

        log.warn("API error {}: {}", ex.getStatus().value(), ex.getDetail());

        Map<String, Object> body = createErrorBody(
            ex.getStatus(), ex.getStatus().getReasonPhrase(), ex.getDetail(), request.getRequestURI());
        if (ex instanceof ValidationException && ((ValidationException) ex).getField() != null) {
            body.put("field", ((ValidationException) ex).getField());
        }

        return new ResponseEntity<>(body, ex.getStatus());
    }

    /**
     * Handles validation errors (e.g., @Valid annotation failures).
     *
     * @param ex the exception
     * @param request the HTTP request
     * @return error response with HTTP 400
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidationException(
            MethodArgumentNotValidException ex,
            HttpServletRequest request) {

        log.warn("Validation exception: {}", ex.getMessage());

        Map<String, String> fieldErrors = new LinkedHashMap<>();
        ex.getBindingResult().getFieldErrors().forEach(error ->
            fieldErrors.putIfAbsent(error.getField(), error.getDefaultMessage()));

        Map<String, Object> body = createErrorBody(
            HttpStatus.BAD_REQUEST,
            HttpStatus.BAD_REQUEST.getReasonPhrase(),
            "Validation failed",
            request.getRequestURI());
        body.put("fields", fieldErrors);

        return new ResponseEntity<>(body, HttpStatus.BAD_REQUEST);
    }

    /**
     * Handles requests that reach the database before it was initialized.
     *
     * HTTP 503 Service Unavailable - the server is starting or shutting down
     *
     * @param ex the exception
     * @param request the HTTP request
     * @return error response with HTTP 503
     */
    @ExceptionHandler(DatabaseNotInitializedException.class)
    public ResponseEntity<Map<String, Object>> handleDatabaseNotInitialized(
            DatabaseNotInitializedException ex,
            HttpServletRequest request) {

        log.error("Database unavailable: {}", ex.getMessage());

        Map<String, Object> body = createErrorBody(
            HttpStatus.SERVICE_UNAVAILABLE,
            HttpStatus.SERVICE_UNAVAILABLE.getReasonPhrase(),
            "Database not available",
            request.getRequestURI());

        return new ResponseEntity<>(body, HttpStatus.SERVICE_UNAVAILABLE);
    }

    /**
     * Handles all other uncaught exceptions.
     *
     * HTTP 500 Internal Server Error - indicates server-side error
     *
     * @param ex the exception
     * @param request the HTTP request
     * @return error response with HTTP 500
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(
            Exception ex,
            HttpServletRequest request) {

        log.error("Unhandled exception: {}", ex.getMessage(), ex);

        Map<String, Object> body;
        if (settings.isDebug()) {
            body = createErrorBody(
                HttpStatus.INTERNAL_SERVER_ERROR, INTERNAL_ERROR, String.valueOf(ex.getMessage()),
                request.getRequestURI());
            body.put("type", ex.getClass().getSimpleName());
        } else {
            body = createErrorBody(
                HttpStatus.INTERNAL_SERVER_ERROR, INTERNAL_ERROR, GENERIC_DETAIL, request.getRequestURI());
        }

        return new ResponseEntity<>(body, HttpStatus.INTERNAL_SERVER_ERROR);
    }

    /**
     * Creates a standardized error response body.
     *
     * @param status the HTTP status
     * @param error short error title
     * @param detail the error detail
     * @param path the request path
     * @return mutable error response map
     */
    public static Map<String, Object> createErrorBody(
            HttpStatus status, String error, String detail, String path) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timestamp", Instant.now().toString());
        body.put("status", status.value());
        body.put("error", error);
        body.put("detail", detail);
        body.put("path", path);
        body.put("correlationId", CorrelationIdFilter.getCurrentCorrelationId());
        return body;
    }
}
