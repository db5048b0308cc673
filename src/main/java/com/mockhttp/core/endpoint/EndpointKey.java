package com.mockhttp.core.endpoint;

import java.util.Objects;

/**
 * Identity of an endpoint: HTTP method plus path pattern, rendered as {@code "GET /path"}.
 */
public record EndpointKey(HttpMethod method, String path) {

    public EndpointKey {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(path, "path");
        if (!path.startsWith("/")) {
            throw new IllegalArgumentException("Path pattern must start with '/': " + path);
        }
    }

    @Override
    public String toString() {
        return method + " " + path;
    }
}
