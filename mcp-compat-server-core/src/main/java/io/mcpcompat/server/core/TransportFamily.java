package io.mcpcompat.server.core;

import io.mcpcompat.core.Protocol;

/**
 * The two HTTP transport generations served side by side.
 */
public enum TransportFamily {
    /** Single multiplexed endpoint, session id in the {@code Mcp-Session-Id} header. */
    STREAMABLE(Protocol.VERSION_STREAMABLE),
    /** Stream endpoint plus message endpoint, session id in the {@code sessionId} query parameter. */
    LEGACY_SSE(Protocol.VERSION_LEGACY_SSE);

    private final String protocolVersion;

    TransportFamily(String protocolVersion) {
        this.protocolVersion = protocolVersion;
    }

    public String protocolVersion() {
        return protocolVersion;
    }
}
