package io.mcpcompat.server.core;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.mcpcompat.core.JsonRpcCodec;
import io.mcpcompat.core.JsonRpcError;
import io.mcpcompat.core.JsonRpcMessage;
import io.mcpcompat.core.Protocol;
import io.mcpcompat.server.spi.LogLevel;
import io.mcpcompat.server.spi.ParamSchema;
import io.mcpcompat.server.spi.ToolArguments;
import io.mcpcompat.server.spi.ToolContext;
import io.mcpcompat.server.spi.ToolDefinition;
import io.mcpcompat.server.spi.ToolResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Server side of the protocol for one session: lifecycle, ping, tool listing and dispatch, and logging.
 *
 * <p>A fresh instance is bound to every transport. Tool definitions are shared and must be thread-safe.
 */
public final class ProtocolServer implements MessageHandler {
    private static final Logger log = LoggerFactory.getLogger(ProtocolServer.class);

    private static final TypeReference<Map<String, Object>> ARGUMENTS = new TypeReference<>() {};

    /**
     * Name and version reported in the initialize result.
     */
    public record ServerInfo(String name, String version) {
        public static final ServerInfo DEFAULT = new ServerInfo("jsm-mcp-server", "1.0.0");

        public ServerInfo {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(version, "version");
        }
    }

    private final ServerInfo serverInfo;
    private final Map<String, ToolDefinition> tools;
    private final JsonRpcCodec codec;
    private final AtomicReference<Transport> transport = new AtomicReference<>();
    private volatile LogLevel minLevel = LogLevel.INFO;
    private volatile String negotiatedVersion;

    public ProtocolServer(ServerInfo serverInfo, List<ToolDefinition> tools, JsonRpcCodec codec) {
        this.serverInfo = Objects.requireNonNull(serverInfo, "serverInfo");
        this.codec = Objects.requireNonNull(codec, "codec");
        Map<String, ToolDefinition> byName = new LinkedHashMap<>();
        for (ToolDefinition tool : tools) {
            if (byName.putIfAbsent(tool.name(), tool) != null) {
                throw new IllegalArgumentException("duplicate tool: " + tool.name());
            }
        }
        this.tools = byName;
    }

    /**
     * Bind to a transport; the transport delivers client messages to this server from then on.
     */
    public void connect(Transport t) {
        Objects.requireNonNull(t, "transport");
        if (!transport.compareAndSet(null, t)) {
            throw new IllegalStateException("protocol server already connected");
        }
        t.connect(this);
    }

    /**
     * Protocol version agreed during initialize, empty before.
     */
    public Optional<String> negotiatedVersion() {
        return Optional.ofNullable(negotiatedVersion);
    }

    public LogLevel logLevel() {
        return minLevel;
    }

    @Override
    public CompletableFuture<Optional<JsonRpcMessage.Response>> handle(JsonRpcMessage message) {
        if (message instanceof JsonRpcMessage.Request request) {
            return handleRequest(request).thenApply(Optional::of);
        }
        if (message instanceof JsonRpcMessage.Notification notification) {
            if (Protocol.M_INITIALIZED.equals(notification.method())) {
                log.debug("Client finished initialization on session {}", sessionId());
            } else {
                log.debug("Ignoring notification {}", notification.method());
            }
        }
        // responses to server requests are not expected; nothing is ever asked of the client
        return CompletableFuture.completedFuture(Optional.empty());
    }

    private CompletableFuture<JsonRpcMessage.Response> handleRequest(JsonRpcMessage.Request request) {
        JsonNode id = request.id();
        return switch (request.method()) {
            case Protocol.M_INITIALIZE -> done(JsonRpcMessage.Response.success(id, initialize(request.params())));
            case Protocol.M_PING -> done(JsonRpcMessage.Response.success(id, mapper().createObjectNode()));
            case Protocol.M_TOOLS_LIST -> done(JsonRpcMessage.Response.success(id, listTools()));
            case Protocol.M_TOOLS_CALL -> callTool(id, request.params());
            case Protocol.M_LOGGING_SET_LEVEL -> done(setLevel(id, request.params()));
            default -> done(JsonRpcMessage.Response.failure(id,
                    JsonRpcError.of(JsonRpcError.METHOD_NOT_FOUND, "Method not found")));
        };
    }

    private ObjectNode initialize(JsonNode params) {
        String requested = params == null ? null : params.path("protocolVersion").asText(null);
        String version = requested != null && Protocol.SUPPORTED_VERSIONS.contains(requested)
                ? requested
                : Protocol.LATEST_VERSION;
        negotiatedVersion = version;
        log.debug("Negotiated protocol version {} (requested {})", version, requested);

        ObjectNode result = mapper().createObjectNode();
        result.put("protocolVersion", version);
        ObjectNode capabilities = result.putObject("capabilities");
        capabilities.putObject("logging");
        capabilities.putObject("tools").put("listChanged", false);
        ObjectNode info = result.putObject("serverInfo");
        info.put("name", serverInfo.name());
        info.put("version", serverInfo.version());
        return result;
    }

    private ObjectNode listTools() {
        ObjectNode result = mapper().createObjectNode();
        ArrayNode list = result.putArray("tools");
        for (ToolDefinition tool : tools.values()) {
            ObjectNode node = list.addObject();
            node.put("name", tool.name());
            node.put("description", tool.description());
            node.set("inputSchema", inputSchema(tool.params()));
        }
        return result;
    }

    private ObjectNode inputSchema(ParamSchema schema) {
        ObjectNode node = mapper().createObjectNode();
        node.put("type", "object");
        ObjectNode properties = node.putObject("properties");
        ArrayNode required = mapper().createArrayNode();
        for (ParamSchema.Param p : schema.params()) {
            ObjectNode prop = properties.putObject(p.name());
            prop.put("type", p.type().jsonType());
            if (p.description() != null) prop.put("description", p.description());
            if (p.required()) required.add(p.name());
        }
        if (!required.isEmpty()) node.set("required", required);
        node.put("additionalProperties", false);
        node.put("$schema", "http://json-schema.org/draft-07/schema#");
        return node;
    }

    private CompletableFuture<JsonRpcMessage.Response> callTool(JsonNode id, JsonNode params) {
        String name = params == null ? null : params.path("name").asText(null);
        if (name == null) {
            return done(invalidParams(id, "Missing tool name"));
        }
        ToolDefinition tool = tools.get(name);
        if (tool == null) {
            return done(invalidParams(id, "Tool " + name + " not found"));
        }
        JsonNode rawArgs = params.get("arguments");
        if (rawArgs != null && !rawArgs.isNull() && !rawArgs.isObject()) {
            return done(invalidParams(id, "Invalid arguments for tool " + name + ": arguments must be an object"));
        }
        Map<String, Object> args = rawArgs == null || rawArgs.isNull()
                ? Map.of()
                : mapper().convertValue(rawArgs, ARGUMENTS);
        List<String> violations = tool.params().validate(args);
        if (!violations.isEmpty()) {
            return done(invalidParams(id, "Invalid arguments for tool " + name + ": " + String.join(", ", violations)));
        }

        CompletableFuture<ToolResult> call;
        try {
            call = Objects.requireNonNull(tool.handler().call(new ToolArguments(args), new SessionToolContext()),
                    "tool handler returned null");
        } catch (RuntimeException e) {
            call = CompletableFuture.failedFuture(e);
        }
        return call
                .exceptionally(err -> {
                    Throwable cause = err instanceof CompletionException && err.getCause() != null ? err.getCause() : err;
                    log.warn("Tool {} failed on session {}", name, sessionId(), cause);
                    return ToolResult.error(String.valueOf(cause.getMessage()));
                })
                .thenApply(result -> JsonRpcMessage.Response.success(id, render(result)));
    }

    private ObjectNode render(ToolResult result) {
        ObjectNode node = mapper().createObjectNode();
        ArrayNode content = node.putArray("content");
        for (ToolResult.Content item : result.content()) {
            ObjectNode c = content.addObject();
            c.put("type", item.type());
            if (item instanceof ToolResult.Content.Text text) c.put("text", text.text());
        }
        if (result.isError()) node.put("isError", true);
        return node;
    }

    private JsonRpcMessage.Response setLevel(JsonNode id, JsonNode params) {
        String requested = params == null ? null : params.path("level").asText(null);
        Optional<LogLevel> level = LogLevel.fromWireName(requested);
        if (level.isEmpty()) {
            return invalidParams(id, "Invalid log level: " + requested);
        }
        minLevel = level.get();
        return JsonRpcMessage.Response.success(id, mapper().createObjectNode());
    }

    /**
     * Send a {@code notifications/message} to the client if {@code level} passes the selected threshold.
     */
    public void log(LogLevel level, String message) {
        Objects.requireNonNull(level, "level");
        Transport t = transport.get();
        if (t == null || !level.isAtLeast(minLevel)) return;
        ObjectNode params = mapper().createObjectNode();
        params.put("level", level.wireName());
        params.put("logger", serverInfo.name());
        params.put("data", message);
        t.send(new JsonRpcMessage.Notification(Protocol.M_LOG_MESSAGE, params));
    }

    private String sessionId() {
        Transport t = transport.get();
        return t == null ? "<unbound>" : t.sessionId();
    }

    private ObjectMapper mapper() {
        return codec.mapper();
    }

    private static JsonRpcMessage.Response invalidParams(JsonNode id, String message) {
        return JsonRpcMessage.Response.failure(id, JsonRpcError.of(JsonRpcError.INVALID_PARAMS, message));
    }

    private static <T> CompletableFuture<T> done(T value) {
        return CompletableFuture.completedFuture(value);
    }

    private final class SessionToolContext implements ToolContext {
        @Override
        public String sessionId() {
            return ProtocolServer.this.sessionId();
        }

        @Override
        public void log(LogLevel level, String message) {
            ProtocolServer.this.log(level, message);
        }
    }
}
