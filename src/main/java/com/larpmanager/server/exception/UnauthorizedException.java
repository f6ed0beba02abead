package com.larpmanager.server.exception;

import org.springframework.http.HttpStatus;

/**
 * Authentication missing or invalid (HTTP 401).
 */
public class UnauthorizedException extends ApiException {

    public static final String DEFAULT_DETAIL = "Authentication required";

    public UnauthorizedException() {
        this(DEFAULT_DETAIL);
    }

    public UnauthorizedException(String detail) {
        super(HttpStatus.UNAUTHORIZED, detail);
    }
}
