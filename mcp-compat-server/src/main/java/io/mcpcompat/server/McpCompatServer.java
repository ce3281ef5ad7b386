package io.mcpcompat.server;

import io.javalin.Javalin;
import io.mcpcompat.core.JsonRpcCodec;
import io.mcpcompat.core.Protocol;
import io.mcpcompat.server.core.RequestRouter;
import io.mcpcompat.server.core.SessionRegistry;
import io.mcpcompat.server.core.ShutdownCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runnable server exposing both transport generations on one port.
 *
 * <pre>
 * /mcp       GET | POST | DELETE   Streamable HTTP (2025-03-26)
 * /sse       GET                   HTTP + SSE stream (2024-11-05)
 * /messages  POST                  HTTP + SSE messages (2024-11-05)
 * </pre>
 */
public final class McpCompatServer implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(McpCompatServer.class);

    private final ServerConfig config;
    private final SessionRegistry registry = new SessionRegistry();
    private final RequestRouter router;
    private final ShutdownCoordinator coordinator;
    private final Javalin app;
    private final AtomicBoolean closed = new AtomicBoolean();

    public McpCompatServer(ServerConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        JsonRpcCodec codec = new JsonRpcCodec();
        this.router = RequestRouter.builder(registry, Tools.all())
                .streamablePath(config.streamablePath())
                .ssePath(config.ssePath())
                .messagesPath(config.messagesPath())
                .jsonResponse(config.jsonResponse())
                .heartbeatInterval(config.heartbeatInterval())
                .codec(codec)
                .build();
        this.coordinator = new ShutdownCoordinator(registry, config.shutdownTimeout());

        JavalinAdapter adapter = new JavalinAdapter(router, codec);
        this.app = Javalin.create(cfg -> cfg.showJavalinBanner = false);
        // every verb reaches the router so it can answer 405 with an Allow header
        for (String path : new String[] {config.streamablePath(), config.ssePath(), config.messagesPath()}) {
            app.get(path, adapter);
            app.post(path, adapter);
            app.put(path, adapter);
            app.patch(path, adapter);
            app.delete(path, adapter);
            app.head(path, adapter);
            app.options(path, adapter);
        }
    }

    public McpCompatServer start() {
        app.start(config.port());
        log.info("MCP compat server listening on port {}", port());
        log.info("Supported transport options:\n"
                        + "1. Streamable HTTP (protocol version {})\n"
                        + "   Endpoint: {} (GET/POST/DELETE)\n"
                        + "   Initialize with POST {}?{}=<token>, then send {} on every request\n"
                        + "2. HTTP + SSE (protocol version {})\n"
                        + "   Endpoints: {} (GET) and {} (POST)\n"
                        + "   Open the stream with GET {}, then POST to {}?{}=<id>",
                Protocol.VERSION_STREAMABLE, config.streamablePath(), config.streamablePath(), Protocol.Q_TOKEN,
                Protocol.H_MCP_SESSION_ID, Protocol.VERSION_LEGACY_SSE, config.ssePath(), config.messagesPath(),
                config.ssePath(), config.messagesPath(), Protocol.Q_SESSION_ID);
        return this;
    }

    /**
     * Actual listening port; differs from the configured one when that was 0.
     */
    public int port() {
        return app.port();
    }

    public SessionRegistry registry() {
        return registry;
    }

    /**
     * Refuse new sessions, close every session, then stop accepting requests. Idempotent.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;
        log.info("Shutting down server...");
        router.stopAcceptingSessions();
        coordinator.drain();
        app.stop();
        // a session opened while the first drain ran
        if (!registry.isEmpty()) coordinator.drain();
        router.close();
        log.info("Server shutdown complete");
    }

    public static void main(String[] args) {
        ServerConfig config;
        try {
            config = ServerConfig.load();
        } catch (IllegalArgumentException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            System.exit(2);
            return;
        }
        log.debug("Starting with {}", config);
        McpCompatServer server = new McpCompatServer(config).start();

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                server.close();
            } catch (RuntimeException e) {
                log.error("Error during shutdown", e);
            }
            // a signal-initiated stop still reports success once sessions are drained
            Runtime.getRuntime().halt(0);
        }, "mcp-shutdown-hook"));
    }
}
