package io.mcpcompat.server.core;

import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Framework-neutral request abstraction.
 *
 * <p>The body is read fully by the HTTP adapter; the router needs to inspect it before choosing a transport.
 */
public final class ServerRequest {
    private static final byte[] NO_BODY = new byte[0];

    private final HttpMethod method;
    private final URI uri;
    private final Map<String, List<String>> headers;
    private final byte[] body;

    public ServerRequest(HttpMethod method, URI uri, Map<String, List<String>> headers, byte[] body) {
        this.method = Objects.requireNonNull(method, "method");
        this.uri = Objects.requireNonNull(uri, "uri");
        this.headers = Objects.requireNonNull(headers, "headers");
        this.body = body == null ? NO_BODY : body;
    }

    public HttpMethod method() {
        return method;
    }

    public URI uri() {
        return uri;
    }

    public Map<String, List<String>> headers() {
        return headers;
    }

    /**
     * Request body; empty, never null.
     */
    public byte[] body() {
        return body;
    }
}
