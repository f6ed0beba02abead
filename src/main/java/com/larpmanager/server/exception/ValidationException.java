package com.larpmanager.server.exception;

import org.springframework.http.HttpStatus;

/**
 * Request data failed validation (HTTP 400).
 */
public class ValidationException extends ApiException {

    private final String field;

    public ValidationException(String detail) {
        this(detail, null);
    }

    public ValidationException(String detail, String field) {
        super(HttpStatus.BAD_REQUEST, detail);
        this.field = field;
    }

    /** Offending field, or null when the error is not tied to one. */
    public String getField() {
        return field;
    }
}
