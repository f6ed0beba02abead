package com.larpmanager.server.config;

import java.util.List;

/**
 * Cross-origin policy applied to every route.
 *
 * @param origins allowed origins
 * @param allowCredentials whether cookies and auth headers may be sent
 * @param allowMethods allowed HTTP methods, {@code *} for any
 * @param allowHeaders allowed request headers, {@code *} for any
 */
public record CorsSettings(
    List<String> origins,
    boolean allowCredentials,
    List<String> allowMethods,
    List<String> allowHeaders
) {

    public CorsSettings {
        origins = origins == null ? List.of() : List.copyOf(origins);
        allowMethods = allowMethods == null ? List.of("*") : List.copyOf(allowMethods);
        allowHeaders = allowHeaders == null ? List.of("*") : List.copyOf(allowHeaders);
    }
}
