package io.mcpcompat.core;

import java.util.Objects;

/**
 * Base class for router and transport exceptions.
 *
 * <p>Subclasses are specific to the error condition and preserve the original cause when applicable.
 */
public abstract class McpCompatException extends RuntimeException {

    protected McpCompatException(String message) {
        super(message);
    }

    protected McpCompatException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Raised when a request cannot be classified against the session registry.
     * Terminal for that request only; the registry is never mutated.
     */
    public static class RoutingRejected extends McpCompatException {
        private final ErrorKind kind;

        public RoutingRejected(ErrorKind kind) {
            super(Objects.requireNonNull(kind, "kind").message());
            this.kind = kind;
        }

        public ErrorKind kind() {
            return kind;
        }
    }

    /**
     * Raised when a {@code Last-Event-ID} value cannot be parsed.
     */
    public static class InvalidEventId extends McpCompatException {
        public InvalidEventId(String message) {
            super(message);
        }
    }

    /**
     * Raised when a generated session id is already registered.
     */
    public static class SessionCollision extends McpCompatException {
        public SessionCollision(String sessionId) {
            super("session id already registered: " + sessionId);
        }
    }

    /**
     * Raised when a transport receives a message before it was bound to a protocol server.
     */
    public static class TransportNotConnected extends McpCompatException {
        public TransportNotConnected(String sessionId) {
            super("transport not connected to a protocol server: " + sessionId);
        }
    }
}
