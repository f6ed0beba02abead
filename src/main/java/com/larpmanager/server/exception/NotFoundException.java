package com.larpmanager.server.exception;

import org.springframework.http.HttpStatus;

/**
 * Requested resource does not exist (HTTP 404).
 */
public class NotFoundException extends ApiException {

    private final String resource;
    private final String identifier;

    public NotFoundException(String resource, Object identifier) {
        super(HttpStatus.NOT_FOUND, resource + " with identifier '" + identifier + "' not found");
        this.resource = resource;
        this.identifier = String.valueOf(identifier);
    }

    public String getResource() {
        return resource;
    }

    public String getIdentifier() {
        return identifier;
    }
}
