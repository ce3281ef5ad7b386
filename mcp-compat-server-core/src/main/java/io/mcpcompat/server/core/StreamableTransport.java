package io.mcpcompat.server.core;

import com.fasterxml.jackson.databind.JsonNode;
import io.mcpcompat.core.EventId;
import io.mcpcompat.core.Headers;
import io.mcpcompat.core.JsonException;
import io.mcpcompat.core.JsonRpcCodec;
import io.mcpcompat.core.JsonRpcError;
import io.mcpcompat.core.JsonRpcMessage;
import io.mcpcompat.core.McpCompatException;
import io.mcpcompat.core.Protocol;
import io.mcpcompat.server.spi.ResumableEventStore;
import io.mcpcompat.server.spi.StoredEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Transport for the single-endpoint protocol generation ({@code GET}/{@code POST}/{@code DELETE} on one path).
 *
 * <p>Each POST carrying requests gets its own SSE stream scope that closes after the last response; the
 * standalone GET stream carries server-initiated messages. Every event is appended to the session's
 * {@link ResumableEventStore} before it is written, so a client reconnecting with {@code Last-Event-ID}
 * receives exactly the events it missed on that scope.
 *
 * <p>Safe for concurrent requests of one session. Store appends and stream attachment happen under one lock
 * so a replay never races with a live append on the same scope.
 */
public final class StreamableTransport implements Transport {
    private static final Logger log = LoggerFactory.getLogger(StreamableTransport.class);

    /** Scope of the standalone GET stream. */
    static final String STANDALONE_STREAM = "_GET_stream";

    private final String sessionId;
    private final ResumableEventStore store;
    private final JsonRpcCodec codec;
    private final boolean jsonResponse;
    private final TransportLifecycle lifecycle;

    private final AtomicBoolean initializeSeen = new AtomicBoolean();
    private final AtomicReference<JsonNode> initializeRequestId = new AtomicReference<>();
    private final CompletableFuture<String> initialization = new CompletableFuture<>();

    private final Map<String, SseChannel> streams = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> pending = new ConcurrentHashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    /**
     * @param sessionId id assigned by the session manager
     * @param store event log for this session only
     * @param codec JSON-RPC codec
     * @param jsonResponse answer POSTed requests with a plain JSON body instead of an SSE stream
     */
    public StreamableTransport(String sessionId, ResumableEventStore store, JsonRpcCodec codec, boolean jsonResponse) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        this.store = Objects.requireNonNull(store, "store");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.jsonResponse = jsonResponse;
        this.lifecycle = new TransportLifecycle(sessionId);
    }

    @Override
    public String sessionId() {
        return sessionId;
    }

    @Override
    public TransportFamily family() {
        return TransportFamily.STREAMABLE;
    }

    @Override
    public void connect(MessageHandler handler) {
        lifecycle.bind(handler);
    }

    /**
     * Completes with the session id once the initialize request has been answered successfully; completes
     * exceptionally if it was answered with an error or the transport closed first.
     */
    public CompletableFuture<String> initialization() {
        return initialization;
    }

    public boolean isInitialized() {
        return initialization.isDone() && !initialization.isCompletedExceptionally();
    }

    @Override
    public boolean isClosed() {
        return lifecycle.isClosed();
    }

    @Override
    public void onClose(Runnable listener) {
        lifecycle.onClose(listener);
    }

    public ServerResponse handle(ServerRequest req) {
        return switch (req.method()) {
            case POST -> handlePost(req);
            case GET -> handleGet(req);
            case DELETE -> handleDelete(req);
            default -> error(405, JsonRpcError.SERVER_ERROR, "Method not allowed.")
                    .header(Protocol.H_ALLOW, "GET, POST, DELETE");
        };
    }

    private ServerResponse handlePost(ServerRequest req) {
        Optional<String> accept = Headers.firstValue(req.headers(), Protocol.H_ACCEPT);
        if (!Headers.accepts(accept, Protocol.CT_JSON) || !Headers.accepts(accept, Protocol.CT_EVENT_STREAM)) {
            return error(406, JsonRpcError.SERVER_ERROR,
                    "Not Acceptable: Client must accept both application/json and text/event-stream");
        }
        String contentType = Headers.normalizeMediaType(
                Headers.firstValue(req.headers(), Protocol.H_CONTENT_TYPE).orElse(null));
        if (!Protocol.CT_JSON.equals(contentType)) {
            return error(415, JsonRpcError.SERVER_ERROR,
                    "Unsupported Media Type: Content-Type must be application/json");
        }

        List<JsonRpcMessage> messages;
        try {
            messages = codec.readMessages(req.body());
        } catch (JsonException e) {
            log.debug("Unparseable POST body for session {}: {}", sessionId, e.getMessage());
            return error(400, JsonRpcError.PARSE_ERROR, "Parse error");
        }

        boolean initializing = messages.stream().anyMatch(JsonRpcCodec::isInitializeRequest);
        if (initializing) {
            if (messages.size() > 1) {
                return error(400, JsonRpcError.INVALID_REQUEST,
                        "Invalid Request: Only one initialization request is allowed");
            }
            if (!initializeSeen.compareAndSet(false, true)) {
                return error(400, JsonRpcError.INVALID_REQUEST, "Invalid Request: Server already initialized");
            }
            initializeRequestId.set(((JsonRpcMessage.Request) messages.get(0)).id());
        } else {
            Optional<ServerResponse> rejected = validateSession(req);
            if (rejected.isPresent()) return rejected.get();
        }

        List<JsonRpcMessage.Request> requests = new ArrayList<>();
        for (JsonRpcMessage m : messages) {
            if (m instanceof JsonRpcMessage.Request r) requests.add(r);
        }

        if (requests.isEmpty()) {
            for (JsonRpcMessage m : messages) {
                lifecycle.dispatch(m);
            }
            return withSession(new ServerResponse(202, new ResponseBody.Empty()));
        }

        return jsonResponse ? respondJson(messages) : respondSse(messages, requests);
    }

    private ServerResponse respondJson(List<JsonRpcMessage> messages) {
        List<CompletableFuture<Optional<JsonRpcMessage.Response>>> futures = new ArrayList<>(messages.size());
        for (JsonRpcMessage m : messages) {
            futures.add(lifecycle.dispatch(m).thenApply(r -> {
                r.ifPresent(this::trackInitialization);
                return r;
            }));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0])).join();

        List<JsonRpcMessage.Response> responses = new ArrayList<>();
        for (CompletableFuture<Optional<JsonRpcMessage.Response>> f : futures) {
            f.join().ifPresent(responses::add);
        }
        byte[] body;
        try {
            body = responses.size() == 1 ? codec.writeBytes(responses.get(0)) : codec.writeBatch(responses);
        } catch (JsonException e) {
            throw new IllegalStateException("failed to serialize responses", e);
        }
        return withSession(new ServerResponse(200, new ResponseBody.Bytes(body))
                .header(Protocol.H_CONTENT_TYPE, Protocol.CT_JSON));
    }

    private ServerResponse respondSse(List<JsonRpcMessage> messages, List<JsonRpcMessage.Request> requests) {
        String scope = UUID.randomUUID().toString();
        SseChannel channel = new SseChannel();
        pending.put(scope, new AtomicInteger(requests.size()));
        streams.put(scope, channel);
        channel.onCancel(() -> streams.remove(scope, channel));

        // the scope travels with each request: retried ids may be in flight on several streams at once
        for (JsonRpcMessage m : messages) {
            lifecycle.dispatch(m).thenAccept(r -> r.ifPresent(response -> deliverResponse(scope, response)));
        }
        return sseResponse(channel);
    }

    private ServerResponse handleGet(ServerRequest req) {
        Optional<String> accept = Headers.firstValue(req.headers(), Protocol.H_ACCEPT);
        if (!Headers.accepts(accept, Protocol.CT_EVENT_STREAM)) {
            return error(406, JsonRpcError.SERVER_ERROR, "Not Acceptable: Client must accept text/event-stream");
        }
        Optional<ServerResponse> rejected = validateSession(req);
        if (rejected.isPresent()) return rejected.get();

        Optional<String> lastEventId = Headers.nonBlank(req.headers(), Protocol.H_LAST_EVENT_ID);
        if (lastEventId.isPresent()) {
            EventId resumeFrom;
            try {
                resumeFrom = EventId.parse(lastEventId.get());
            } catch (McpCompatException.InvalidEventId e) {
                return error(400, JsonRpcError.SERVER_ERROR, "Bad Request: Invalid Last-Event-ID");
            }
            return resume(resumeFrom);
        }

        SseChannel channel = new SseChannel();
        SseChannel existing = streams.putIfAbsent(STANDALONE_STREAM, channel);
        if (existing != null && (existing.isOpen() || !streams.replace(STANDALONE_STREAM, existing, channel))) {
            return error(409, JsonRpcError.SERVER_ERROR, "Conflict: Only one SSE stream is allowed per session");
        }
        channel.onCancel(() -> streams.remove(STANDALONE_STREAM, channel));
        log.debug("Standalone SSE stream opened for session {}", sessionId);
        return sseResponse(channel);
    }

    private ServerResponse resume(EventId from) {
        String scope = from.scope();
        SseChannel channel = new SseChannel();
        SseChannel replaced = null;
        int replayed = 0;
        lock.lock();
        try {
            for (StoredEvent event : store.replayAfter(scope, from.sequence())) {
                channel.offer(frame(event.eventId(), event.payload()));
                replayed++;
            }
            if (STANDALONE_STREAM.equals(scope) || pending.containsKey(scope)) {
                replaced = streams.put(scope, channel);
                channel.onCancel(() -> streams.remove(scope, channel));
            } else {
                channel.complete();
            }
        } finally {
            lock.unlock();
        }
        if (replaced != null) replaced.complete();
        channel.flush();
        log.debug("Replayed {} events on scope {} for session {}", replayed, scope, sessionId);
        return sseResponse(channel);
    }

    private ServerResponse handleDelete(ServerRequest req) {
        Optional<ServerResponse> rejected = validateSession(req);
        if (rejected.isPresent()) return rejected.get();
        close();
        return new ServerResponse(200, new ResponseBody.Empty());
    }

    private Optional<ServerResponse> validateSession(ServerRequest req) {
        if (!initializeSeen.get()) {
            return Optional.of(error(400, JsonRpcError.SERVER_ERROR, "Bad Request: Server not initialized"));
        }
        Optional<String> header = Headers.nonBlank(req.headers(), Protocol.H_MCP_SESSION_ID);
        if (header.isEmpty()) {
            return Optional.of(error(400, JsonRpcError.SERVER_ERROR, "Bad Request: Mcp-Session-Id header is required"));
        }
        if (!sessionId.equals(header.get())) {
            return Optional.of(error(404, -32001, "Session not found"));
        }
        return Optional.empty();
    }

    @Override
    public void send(JsonRpcMessage message) {
        Objects.requireNonNull(message, "message");
        if (lifecycle.isClosed()) {
            log.debug("Dropping message for closed session {}", sessionId);
            return;
        }
        if (message instanceof JsonRpcMessage.Response response) {
            log.debug("No stream waiting for response {} in session {}", response.id(), sessionId);
            trackInitialization(response);
        } else {
            // kept in the store even with no stream attached so a reconnect can replay it
            appendAndEmit(STANDALONE_STREAM, message);
        }
    }

    private void deliverResponse(String scope, JsonRpcMessage.Response response) {
        appendAndEmit(scope, response);
        AtomicInteger left = pending.get(scope);
        if (left != null && left.decrementAndGet() == 0) {
            SseChannel channel;
            lock.lock();
            try {
                pending.remove(scope);
                channel = streams.remove(scope);
            } finally {
                lock.unlock();
            }
            if (channel != null) channel.complete();
        }
        // after emission: a refused initialize closes the transport from this callback
        trackInitialization(response);
    }

    private void trackInitialization(JsonRpcMessage.Response response) {
        if (initialization.isDone() || !response.id().equals(initializeRequestId.get())) return;
        if (response.isError()) {
            initialization.completeExceptionally(
                    new IllegalStateException("initialize refused: " + response.error().message()));
        } else {
            log.debug("Session {} initialized", sessionId);
            initialization.complete(sessionId);
        }
    }

    private void appendAndEmit(String scope, JsonRpcMessage message) {
        String payload;
        try {
            payload = codec.write(message);
        } catch (JsonException e) {
            log.error("Failed to serialize message for session {}", sessionId, e);
            return;
        }
        SseChannel channel;
        lock.lock();
        try {
            long seq = store.append(scope, payload);
            channel = streams.get(scope);
            if (channel != null) channel.offer(frame(new EventId(scope, seq), payload));
        } finally {
            lock.unlock();
        }
        if (channel != null) channel.flush();
    }

    @Override
    public void heartbeat() {
        if (lifecycle.isClosed()) return;
        for (SseChannel channel : streams.values()) {
            channel.emit(SseFrame.comment("ping"));
        }
    }

    @Override
    public void close() {
        if (!lifecycle.markClosed()) return;
        List<SseChannel> open;
        lock.lock();
        try {
            open = new ArrayList<>(streams.values());
            streams.clear();
            pending.clear();
        } finally {
            lock.unlock();
        }
        for (SseChannel channel : open) {
            channel.complete();
        }
        initialization.completeExceptionally(new IllegalStateException("transport closed"));
        try {
            store.purge();
        } finally {
            log.debug("Streamable transport closed for session {}", sessionId);
            lifecycle.fireClosed();
        }
    }

    private static SseFrame frame(EventId id, String payload) {
        return SseFrame.event(id.value(), Protocol.EVENT_MESSAGE, payload);
    }

    private ServerResponse sseResponse(SseChannel channel) {
        return withSession(new ServerResponse(200, new ResponseBody.Sse(channel))
                .header(Protocol.H_CONTENT_TYPE, Protocol.CT_EVENT_STREAM)
                .header(Protocol.H_CACHE_CONTROL, "no-cache")
                .header(Protocol.H_CONNECTION, "keep-alive"));
    }

    private ServerResponse error(int status, int code, String message) {
        return withSession(ErrorEnvelope.of(status, JsonRpcError.of(code, message), codec));
    }

    private ServerResponse withSession(ServerResponse resp) {
        if (initializeSeen.get()) resp.header(Protocol.H_MCP_SESSION_ID, sessionId);
        return resp;
    }
}
