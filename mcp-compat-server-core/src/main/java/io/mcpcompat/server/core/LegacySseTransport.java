package io.mcpcompat.server.core;

import io.mcpcompat.core.Headers;
import io.mcpcompat.core.JsonException;
import io.mcpcompat.core.JsonRpcCodec;
import io.mcpcompat.core.JsonRpcMessage;
import io.mcpcompat.core.Protocol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Transport for the two-endpoint protocol generation: one long-lived SSE stream opened by {@code GET} and
 * client messages POSTed to a separate endpoint named in the stream's first event.
 *
 * <p>Responses are never returned on the POST; they are pushed on the stream. When the client drops the
 * stream the transport closes.
 */
public final class LegacySseTransport implements Transport {
    private static final Logger log = LoggerFactory.getLogger(LegacySseTransport.class);

    private final String sessionId;
    private final String messagesPath;
    private final JsonRpcCodec codec;
    private final TransportLifecycle lifecycle;
    private final AtomicReference<SseChannel> channel = new AtomicReference<>();

    /**
     * @param sessionId id assigned by the session manager
     * @param messagesPath path clients POST messages to
     * @param codec JSON-RPC codec
     */
    public LegacySseTransport(String sessionId, String messagesPath, JsonRpcCodec codec) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        this.messagesPath = Objects.requireNonNull(messagesPath, "messagesPath");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.lifecycle = new TransportLifecycle(sessionId);
    }

    @Override
    public String sessionId() {
        return sessionId;
    }

    @Override
    public TransportFamily family() {
        return TransportFamily.LEGACY_SSE;
    }

    @Override
    public void connect(MessageHandler handler) {
        lifecycle.bind(handler);
    }

    @Override
    public boolean isClosed() {
        return lifecycle.isClosed();
    }

    @Override
    public void onClose(Runnable listener) {
        lifecycle.onClose(listener);
    }

    /**
     * Start the event stream. The first event tells the client where to POST its messages.
     *
     * @throws IllegalStateException if the stream was already opened or the transport is closed
     */
    public ServerResponse open() {
        if (lifecycle.isClosed()) throw new IllegalStateException("transport closed: " + sessionId);
        SseChannel ch = new SseChannel();
        if (!channel.compareAndSet(null, ch)) {
            throw new IllegalStateException("SSE stream already started for session " + sessionId);
        }
        ch.onCancel(() -> {
            log.debug("SSE client disconnected, closing session {}", sessionId);
            close();
        });
        ch.emit(SseFrame.event(Protocol.EVENT_ENDPOINT, endpoint()));
        return new ServerResponse(200, new ResponseBody.Sse(ch))
                .header(Protocol.H_CONTENT_TYPE, Protocol.CT_EVENT_STREAM)
                .header(Protocol.H_CACHE_CONTROL, "no-cache")
                .header(Protocol.H_CONNECTION, "keep-alive");
    }

    /**
     * Value of the {@code endpoint} event.
     */
    String endpoint() {
        return messagesPath + "?" + Protocol.Q_SESSION_ID + "="
                + URLEncoder.encode(sessionId, StandardCharsets.UTF_8);
    }

    /**
     * Accept one client message POSTed to the message endpoint. Any response goes out on the stream.
     */
    public ServerResponse handlePostMessage(ServerRequest req) {
        SseChannel ch = channel.get();
        if (ch == null || !ch.isOpen()) {
            return text(500, "SSE connection not established");
        }
        String contentType = Headers.normalizeMediaType(
                Headers.firstValue(req.headers(), Protocol.H_CONTENT_TYPE).orElse(null));
        if (!Protocol.CT_JSON.equals(contentType)) {
            return text(400, "Unsupported content-type: " + contentType);
        }
        JsonRpcMessage message;
        try {
            message = codec.readMessage(req.body());
        } catch (JsonException e) {
            log.debug("Invalid message for session {}: {}", sessionId, e.getMessage());
            return text(400, "Invalid message: " + e.getMessage());
        }
        lifecycle.dispatch(message).thenAccept(r -> r.ifPresent(this::send));
        return text(202, "Accepted");
    }

    @Override
    public void send(JsonRpcMessage message) {
        Objects.requireNonNull(message, "message");
        SseChannel ch = channel.get();
        if (lifecycle.isClosed() || ch == null) {
            log.debug("Dropping message for session {}: stream not open", sessionId);
            return;
        }
        String payload;
        try {
            payload = codec.write(message);
        } catch (JsonException e) {
            log.error("Failed to serialize message for session {}", sessionId, e);
            return;
        }
        ch.emit(SseFrame.event(Protocol.EVENT_MESSAGE, payload));
    }

    @Override
    public void heartbeat() {
        SseChannel ch = channel.get();
        if (ch != null && !lifecycle.isClosed()) ch.emit(SseFrame.comment("ping"));
    }

    @Override
    public void close() {
        if (!lifecycle.markClosed()) return;
        SseChannel ch = channel.get();
        if (ch != null) ch.complete();
        log.debug("Legacy SSE transport closed for session {}", sessionId);
        lifecycle.fireClosed();
    }

    private static ServerResponse text(int status, String message) {
        return new ServerResponse(status, new ResponseBody.Bytes(message.getBytes(StandardCharsets.UTF_8)))
                .header(Protocol.H_CONTENT_TYPE, Protocol.CT_TEXT);
    }
}
