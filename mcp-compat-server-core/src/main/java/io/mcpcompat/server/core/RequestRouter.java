package io.mcpcompat.server.core;

import io.mcpcompat.core.ErrorKind;
import io.mcpcompat.core.Headers;
import io.mcpcompat.core.JsonRpcCodec;
import io.mcpcompat.core.McpCompatException;
import io.mcpcompat.core.Protocol;
import io.mcpcompat.server.spi.InMemoryEventStore;
import io.mcpcompat.server.spi.ResumableEventStore;
import io.mcpcompat.server.spi.ToolDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Framework-neutral entry point serving both transport generations on one server.
 *
 * <p>Classifies every request against the {@link SessionRegistry}: traffic for a registered session goes to
 * the transport created when the session was established, new sessions are created on an initialize POST
 * (Streamable) or a stream GET (legacy), and everything else is rejected with a JSON-RPC error envelope.
 * Rejections never touch the registry.
 *
 * <p>Use {@link #builder(SessionRegistry, List)}:
 * <pre>{@code
 * RequestRouter router = RequestRouter.builder(registry, tools)
 *     .jsonResponse(false)
 *     .heartbeatInterval(Duration.ofSeconds(15))
 *     .build();
 * }</pre>
 */
public final class RequestRouter implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(RequestRouter.class);

    private final SessionRegistry registry;
    private final SessionManager sessions;
    private final JsonRpcCodec codec;
    private final String streamablePath;
    private final String ssePath;
    private final String messagesPath;
    private final AtomicBoolean acceptingSessions = new AtomicBoolean(true);

    public static Builder builder(SessionRegistry registry, List<ToolDefinition> tools) {
        return new Builder(registry, tools);
    }

    private RequestRouter(Builder b) {
        this.registry = b.registry;
        this.codec = b.codec != null ? b.codec : new JsonRpcCodec();
        this.streamablePath = b.streamablePath;
        this.ssePath = b.ssePath;
        this.messagesPath = b.messagesPath;
        ProtocolServer.ServerInfo info = b.serverInfo;
        List<ToolDefinition> tools = b.tools;
        JsonRpcCodec c = this.codec;
        this.sessions = new SessionManager(
                registry,
                () -> new ProtocolServer(info, tools, c),
                b.sessionIdGenerator,
                b.eventStoreFactory,
                codec,
                b.jsonResponse,
                messagesPath,
                b.heartbeatInterval);
    }

    /**
     * Builder for {@link RequestRouter}.
     */
    public static final class Builder {
        private final SessionRegistry registry;
        private final List<ToolDefinition> tools;
        private ProtocolServer.ServerInfo serverInfo = ProtocolServer.ServerInfo.DEFAULT;
        private String streamablePath = Protocol.PATH_STREAMABLE;
        private String ssePath = Protocol.PATH_SSE;
        private String messagesPath = Protocol.PATH_MESSAGES;
        private boolean jsonResponse;
        private Supplier<String> sessionIdGenerator = () -> UUID.randomUUID().toString();
        private Supplier<? extends ResumableEventStore> eventStoreFactory = InMemoryEventStore::new;
        private Duration heartbeatInterval = Duration.ofSeconds(15);
        private JsonRpcCodec codec;

        private Builder(SessionRegistry registry, List<ToolDefinition> tools) {
            this.registry = Objects.requireNonNull(registry, "registry");
            this.tools = List.copyOf(Objects.requireNonNull(tools, "tools"));
        }

        /** Name and version reported on initialize. Default: jsm-mcp-server 1.0.0. */
        public Builder serverInfo(ProtocolServer.ServerInfo serverInfo) {
            this.serverInfo = Objects.requireNonNull(serverInfo, "serverInfo");
            return this;
        }

        /** Default: {@code /mcp}. */
        public Builder streamablePath(String path) {
            this.streamablePath = requirePath(path);
            return this;
        }

        /** Default: {@code /sse}. */
        public Builder ssePath(String path) {
            this.ssePath = requirePath(path);
            return this;
        }

        /** Default: {@code /messages}. */
        public Builder messagesPath(String path) {
            this.messagesPath = requirePath(path);
            return this;
        }

        /** Answer Streamable POSTs with {@code application/json} instead of an SSE stream. Default: false. */
        public Builder jsonResponse(boolean jsonResponse) {
            this.jsonResponse = jsonResponse;
            return this;
        }

        /** Session id source. Default: random UUIDs. */
        public Builder sessionIdGenerator(Supplier<String> generator) {
            this.sessionIdGenerator = Objects.requireNonNull(generator, "generator");
            return this;
        }

        /** Creates the event store of each Streamable session. Default: unbounded {@link InMemoryEventStore}. */
        public Builder eventStoreFactory(Supplier<? extends ResumableEventStore> factory) {
            this.eventStoreFactory = Objects.requireNonNull(factory, "factory");
            return this;
        }

        /** Keep-alive comment interval on open streams; {@link Duration#ZERO} disables it. Default: 15 seconds. */
        public Builder heartbeatInterval(Duration interval) {
            this.heartbeatInterval = Objects.requireNonNull(interval, "interval");
            return this;
        }

        public Builder codec(JsonRpcCodec codec) {
            this.codec = codec;
            return this;
        }

        public RequestRouter build() {
            if (streamablePath.equals(ssePath) || streamablePath.equals(messagesPath) || ssePath.equals(messagesPath)) {
                throw new IllegalArgumentException("endpoint paths must be distinct");
            }
            return new RequestRouter(this);
        }

        private static String requirePath(String path) {
            Objects.requireNonNull(path, "path");
            if (!path.startsWith("/")) throw new IllegalArgumentException("path must start with '/': " + path);
            return path;
        }
    }

    public SessionRegistry registry() {
        return registry;
    }

    /**
     * Refuse new sessions from now on with 503; traffic for registered sessions is still served.
     * Called before the registry is drained on shutdown.
     */
    public void stopAcceptingSessions() {
        if (acceptingSessions.compareAndSet(true, false)) {
            log.info("No longer accepting new sessions");
        }
    }

    private void requireAcceptingSessions() {
        if (!acceptingSessions.get()) {
            throw new McpCompatException.RoutingRejected(ErrorKind.SHUTTING_DOWN);
        }
    }

    /**
     * Route one request. Never throws: failures are answered with an error envelope.
     */
    public ServerResponse handle(ServerRequest req) {
        String path = req.uri().getPath();
        try {
            if (streamablePath.equals(path)) return handleStreamable(req);
            if (ssePath.equals(path)) return handleSse(req);
            if (messagesPath.equals(path)) return handleMessages(req);
            return new ServerResponse(404, new ResponseBody.Empty());
        } catch (McpCompatException.RoutingRejected rejected) {
            log.debug("Rejected {} {}: {}", req.method(), path, rejected.kind());
            return ErrorEnvelope.of(rejected.kind(), codec);
        } catch (RuntimeException e) {
            Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
            log.error("Error handling {} {}", req.method(), path, cause);
            return ErrorEnvelope.of(ErrorKind.INTERNAL_ERROR, codec);
        }
    }

    private ServerResponse handleStreamable(ServerRequest req) {
        Optional<String> sessionId = Headers.nonBlank(req.headers(), Protocol.H_MCP_SESSION_ID);
        if (sessionId.isPresent()) {
            Optional<Session> session = registry.lookup(sessionId.get());
            if (session.isPresent()) {
                return session.get().fold(
                        streamable -> streamable.handle(req),
                        legacy -> {
                            throw new McpCompatException.RoutingRejected(ErrorKind.WRONG_TRANSPORT_FOR_SESSION);
                        });
            }
            throw new McpCompatException.RoutingRejected(ErrorKind.INVALID_SESSION);
        }

        if (req.method() == HttpMethod.POST && codec.initializeRequest(req.body()).isPresent()) {
            if (QueryString.nonBlank(req.uri(), Protocol.Q_TOKEN).isEmpty()) {
                throw new McpCompatException.RoutingRejected(ErrorKind.MISSING_TOKEN);
            }
            requireAcceptingSessions();
            log.debug("Initialize request with token present, creating Streamable session");
            return sessions.openStreamable(req).join().response();
        }
        throw new McpCompatException.RoutingRejected(ErrorKind.INVALID_SESSION);
    }

    private ServerResponse handleSse(ServerRequest req) {
        if (req.method() != HttpMethod.GET) return methodNotAllowed("GET");
        requireAcceptingSessions();
        log.debug("Received GET request to {} (legacy SSE transport)", ssePath);
        return sessions.openLegacy().join().response();
    }

    private ServerResponse handleMessages(ServerRequest req) {
        if (req.method() != HttpMethod.POST) return methodNotAllowed("POST");
        Optional<Session> session = QueryString.nonBlank(req.uri(), Protocol.Q_SESSION_ID).flatMap(registry::lookup);
        if (session.isEmpty()) {
            throw new McpCompatException.RoutingRejected(ErrorKind.WRONG_TRANSPORT_FOR_SESSION);
        }
        return session.get().fold(
                streamable -> {
                    throw new McpCompatException.RoutingRejected(ErrorKind.WRONG_TRANSPORT_FOR_SESSION);
                },
                legacy -> legacy.handlePostMessage(req));
    }

    private static ServerResponse methodNotAllowed(String allow) {
        return new ServerResponse(405, new ResponseBody.Empty()).header(Protocol.H_ALLOW, allow);
    }

    @Override
    public void close() {
        sessions.close();
    }
}
