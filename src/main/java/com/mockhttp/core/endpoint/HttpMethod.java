package com.mockhttp.core.endpoint;

/**
 * HTTP methods an endpoint can be registered for.
 */
public enum HttpMethod {
    GET,
    POST,
    PUT,
    PATCH,
    DELETE,
    HEAD,
    OPTIONS
}
