package com.larpmanager.server.exception;

import org.springframework.http.HttpStatus;

/**
 * Base class for errors that map directly onto an HTTP response.
 *
 * The global exception handler renders {@link #getStatus()} and
 * {@link #getDetail()} without logging a stack trace.
 */
public class ApiException extends RuntimeException {

    private final HttpStatus status;
    private final String detail;

    public ApiException(HttpStatus status, String detail) {
        super(detail);
        this.status = status;
        this.detail = detail;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getDetail() {
        return detail;
    }
}
