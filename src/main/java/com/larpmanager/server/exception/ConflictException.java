package com.larpmanager.server.exception;

import org.springframework.http.HttpStatus;

/**
 * Request conflicts with the current state of a resource (HTTP 409).
 */
public class ConflictException extends ApiException {

    public ConflictException(String detail) {
        super(HttpStatus.CONFLICT, detail);
    }
}
