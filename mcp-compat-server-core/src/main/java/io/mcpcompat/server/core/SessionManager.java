package io.mcpcompat.server.core;

import io.mcpcompat.core.JsonRpcCodec;
import io.mcpcompat.core.McpCompatException;
import io.mcpcompat.server.spi.ResumableEventStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Creates sessions of either family and keeps the registry in step with transport lifetimes.
 *
 * <p>Streamable sessions are created in two phases: the transport and its protocol server exist while the
 * initialize exchange runs, and the session is registered only once initialization succeeded. A session is
 * removed from the registry by its own close listener, conditionally, so a stale listener never evicts a
 * different session.
 */
public final class SessionManager implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SessionManager.class);

    /**
     * Outcome of opening a session.
     *
     * @param session the registered session; empty if the protocol server refused initialization
     * @param response HTTP response for the request that opened the session
     */
    public record Opened(Optional<Session> session, ServerResponse response) {
        public Opened {
            Objects.requireNonNull(session, "session");
            Objects.requireNonNull(response, "response");
        }
    }

    private final SessionRegistry registry;
    private final Supplier<ProtocolServer> servers;
    private final Supplier<String> idGenerator;
    private final Supplier<? extends ResumableEventStore> eventStores;
    private final JsonRpcCodec codec;
    private final boolean jsonResponse;
    private final String messagesPath;
    private final ScheduledExecutorService heartbeats;

    /**
     * @param registry shared session registry
     * @param servers creates a fresh protocol server per session
     * @param idGenerator session id source; ids must be unique for the process lifetime
     * @param eventStores creates one event store per Streamable session
     * @param codec JSON-RPC codec
     * @param jsonResponse answer Streamable POSTs with JSON bodies instead of SSE
     * @param messagesPath message endpoint advertised to legacy clients
     * @param heartbeat keep-alive interval for open streams; zero disables it
     */
    public SessionManager(SessionRegistry registry,
                          Supplier<ProtocolServer> servers,
                          Supplier<String> idGenerator,
                          Supplier<? extends ResumableEventStore> eventStores,
                          JsonRpcCodec codec,
                          boolean jsonResponse,
                          String messagesPath,
                          Duration heartbeat) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.servers = Objects.requireNonNull(servers, "servers");
        this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator");
        this.eventStores = Objects.requireNonNull(eventStores, "eventStores");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.jsonResponse = jsonResponse;
        this.messagesPath = Objects.requireNonNull(messagesPath, "messagesPath");
        Objects.requireNonNull(heartbeat, "heartbeat");
        if (heartbeat.isNegative()) throw new IllegalArgumentException("heartbeat must not be negative");

        if (heartbeat.isZero()) {
            this.heartbeats = null;
        } else {
            this.heartbeats = Threads.newScheduler("mcp-heartbeat");
            long millis = heartbeat.toMillis();
            heartbeats.scheduleAtFixedRate(this::beat, millis, millis, TimeUnit.MILLISECONDS);
        }
    }

    /**
     * Create a Streamable session from an initialize request.
     *
     * @return completes once the initialize exchange finished; fails with
     *         {@link McpCompatException.SessionCollision} if the generated id is taken
     */
    public CompletableFuture<Opened> openStreamable(ServerRequest initRequest) {
        String id = idGenerator.get();
        StreamableTransport transport = new StreamableTransport(id, eventStores.get(), codec, jsonResponse);
        servers.get().connect(transport);

        ServerResponse response;
        try {
            response = transport.handle(initRequest);
        } catch (RuntimeException e) {
            transport.close();
            return CompletableFuture.failedFuture(e);
        }
        if (response.status() >= 400) {
            // rejected before the initialize request reached the protocol server
            transport.close();
            return CompletableFuture.completedFuture(new Opened(Optional.empty(), response));
        }

        return transport.initialization().handle((sessionId, err) -> {
            if (err != null) {
                log.debug("Initialization refused for candidate session {}", id);
                transport.close();
                return new Opened(Optional.empty(), response);
            }
            Session session = register(new Session.Streamable(id, transport));
            log.info("Streamable session initialized: {}", id);
            return new Opened(Optional.of(session), response);
        });
    }

    /**
     * Create a legacy SSE session and start its event stream.
     */
    public CompletableFuture<Opened> openLegacy() {
        String id = idGenerator.get();
        LegacySseTransport transport = new LegacySseTransport(id, messagesPath, codec);
        servers.get().connect(transport);
        try {
            Session session = register(new Session.LegacySse(id, transport));
            ServerResponse response = transport.open();
            log.info("Legacy SSE session established: {}", id);
            return CompletableFuture.completedFuture(new Opened(Optional.of(session), response));
        } catch (RuntimeException e) {
            transport.close();
            return CompletableFuture.failedFuture(e);
        }
    }

    private Session register(Session session) {
        if (!registry.insert(session)) {
            session.transport().close();
            throw new McpCompatException.SessionCollision(session.id());
        }
        session.transport().onClose(() -> {
            if (registry.remove(session)) {
                log.info("Session {} closed, removed from registry", session.id());
            }
        });
        return session;
    }

    private void beat() {
        registry.forEach(session -> {
            try {
                session.transport().heartbeat();
            } catch (RuntimeException e) {
                log.debug("Heartbeat failed for session {}", session.id(), e);
            }
        });
    }

    @Override
    public void close() {
        if (heartbeats != null) heartbeats.shutdownNow();
    }
}
