package com.larpmanager.server.exception;

import org.springframework.http.HttpStatus;

/**
 * Caller is authenticated but lacks permission (HTTP 403).
 */
public class ForbiddenException extends ApiException {

    public static final String DEFAULT_DETAIL = "Insufficient permissions";

    public ForbiddenException() {
        this(DEFAULT_DETAIL);
    }

    public ForbiddenException(String detail) {
        super(HttpStatus.FORBIDDEN, detail);
    }
}
