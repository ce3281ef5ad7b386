package io.mcpcompat.server.core;

/**
 * HTTP methods understood by the router. Anything else is answered with 405.
 */
public enum HttpMethod {
    GET,
    POST,
    PUT,
    DELETE,
    HEAD,
    OPTIONS,
    PATCH
}
