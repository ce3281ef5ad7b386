package io.mcpcompat.server.core;

import io.mcpcompat.core.JsonRpcMessage;

/**
 * One live transport instance, owned by exactly one session.
 *
 * <p>The set of implementations is closed so that routing can dispatch exhaustively on the family.
 */
public sealed interface Transport extends AutoCloseable permits StreamableTransport, LegacySseTransport {

    String sessionId();

    TransportFamily family();

    /**
     * Bind the protocol server. Must be called once, before any client message is processed.
     *
     * @throws IllegalStateException if a handler is already bound
     */
    void connect(MessageHandler handler);

    /**
     * Deliver a server-initiated message to the client. Dropped once the transport is closed.
     */
    void send(JsonRpcMessage message);

    /**
     * Register a listener fired exactly once when the transport closes. Fires immediately if already closed.
     */
    void onClose(Runnable listener);

    boolean isClosed();

    /**
     * Write a keep-alive comment on every open stream.
     */
    void heartbeat();

    /**
     * Idempotent. Completes open streams and fires close listeners.
     */
    @Override
    void close();
}
