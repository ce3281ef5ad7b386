package io.mcpcompat.server.core;

import io.mcpcompat.core.JsonRpcError;
import io.mcpcompat.core.JsonRpcMessage;
import io.mcpcompat.core.McpCompatException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Handler binding and close-listener bookkeeping shared by both transports.
 */
final class TransportLifecycle {
    private static final Logger log = LoggerFactory.getLogger(TransportLifecycle.class);

    private final String sessionId;
    private final AtomicBoolean closed = new AtomicBoolean();
    private final AtomicReference<MessageHandler> handler = new AtomicReference<>();
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();

    TransportLifecycle(String sessionId) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
    }

    void bind(MessageHandler h) {
        Objects.requireNonNull(h, "handler");
        if (!handler.compareAndSet(null, h)) {
            throw new IllegalStateException("transport already connected: " + sessionId);
        }
    }

    MessageHandler handler() {
        MessageHandler h = handler.get();
        if (h == null) throw new McpCompatException.TransportNotConnected(sessionId);
        return h;
    }

    /**
     * Hand a client message to the bound handler. Handler failures on a request become an internal error
     * response for that request; failures on anything else are logged.
     *
     * @throws McpCompatException.TransportNotConnected if no handler is bound
     */
    CompletableFuture<Optional<JsonRpcMessage.Response>> dispatch(JsonRpcMessage message) {
        MessageHandler h = handler();
        CompletableFuture<Optional<JsonRpcMessage.Response>> result;
        try {
            result = h.handle(message);
        } catch (RuntimeException e) {
            result = CompletableFuture.failedFuture(e);
        }
        return result.exceptionally(err -> {
            if (message instanceof JsonRpcMessage.Request request) {
                log.warn("Handler failed on {} for session {}", request.method(), sessionId, err);
                return Optional.of(JsonRpcMessage.Response.failure(request.id(),
                        JsonRpcError.of(JsonRpcError.INTERNAL_ERROR, "Internal error")));
            }
            log.warn("Handler failed for session {}", sessionId, err);
            return Optional.empty();
        });
    }

    boolean isClosed() {
        return closed.get();
    }

    /**
     * @return true for the caller that actually closed
     */
    boolean markClosed() {
        return closed.compareAndSet(false, true);
    }

    void onClose(Runnable listener) {
        Objects.requireNonNull(listener, "listener");
        listeners.add(listener);
        if (closed.get() && listeners.remove(listener)) {
            run(listener);
        }
    }

    void fireClosed() {
        for (Runnable listener : listeners) {
            if (listeners.remove(listener)) {
                run(listener);
            }
        }
    }

    private void run(Runnable listener) {
        try {
            listener.run();
        } catch (RuntimeException e) {
            log.warn("Close listener failed for session {}", sessionId, e);
        }
    }
}
