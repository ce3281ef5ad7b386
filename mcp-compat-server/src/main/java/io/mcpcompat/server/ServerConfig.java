package io.mcpcompat.server;

import io.mcpcompat.core.Protocol;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;

/**
 * Server settings. Each key is read from a system property ({@code mcp.port}), then from the matching
 * environment variable ({@code MCP_PORT}), then falls back to its default.
 */
public final class ServerConfig {

    static final String PORT = "mcp.port";
    static final String STREAMABLE_PATH = "mcp.streamable-path";
    static final String SSE_PATH = "mcp.sse-path";
    static final String MESSAGES_PATH = "mcp.messages-path";
    static final String JSON_RESPONSE = "mcp.json-response";
    static final String HEARTBEAT_SECONDS = "mcp.heartbeat-seconds";
    static final String SHUTDOWN_TIMEOUT_SECONDS = "mcp.shutdown-timeout-seconds";

    private final int port;
    private final String streamablePath;
    private final String ssePath;
    private final String messagesPath;
    private final boolean jsonResponse;
    private final Duration heartbeatInterval;
    private final Duration shutdownTimeout;

    private ServerConfig(Properties props, Map<String, String> env) {
        this.port = intValue(props, env, PORT, 3000, 0, 65535);
        this.streamablePath = path(props, env, STREAMABLE_PATH, Protocol.PATH_STREAMABLE);
        this.ssePath = path(props, env, SSE_PATH, Protocol.PATH_SSE);
        this.messagesPath = path(props, env, MESSAGES_PATH, Protocol.PATH_MESSAGES);
        this.jsonResponse = boolValue(props, env, JSON_RESPONSE, false);
        this.heartbeatInterval = Duration.ofSeconds(intValue(props, env, HEARTBEAT_SECONDS, 15, 0, Integer.MAX_VALUE));
        this.shutdownTimeout = Duration.ofSeconds(intValue(props, env, SHUTDOWN_TIMEOUT_SECONDS, 10, 1, Integer.MAX_VALUE));
    }

    public static ServerConfig load() {
        return from(System.getProperties(), System.getenv());
    }

    /**
     * @throws IllegalArgumentException if a value is present but invalid
     */
    public static ServerConfig from(Properties props, Map<String, String> env) {
        return new ServerConfig(Objects.requireNonNull(props, "props"), Objects.requireNonNull(env, "env"));
    }

    public int port() {
        return port;
    }

    public String streamablePath() {
        return streamablePath;
    }

    public String ssePath() {
        return ssePath;
    }

    public String messagesPath() {
        return messagesPath;
    }

    public boolean jsonResponse() {
        return jsonResponse;
    }

    public Duration heartbeatInterval() {
        return heartbeatInterval;
    }

    public Duration shutdownTimeout() {
        return shutdownTimeout;
    }

    static String envName(String key) {
        return key.toUpperCase(Locale.ROOT).replace('.', '_').replace('-', '_');
    }

    private static String raw(Properties props, Map<String, String> env, String key) {
        String v = props.getProperty(key);
        if (v == null || v.isBlank()) v = env.get(envName(key));
        return v == null || v.isBlank() ? null : v.trim();
    }

    private static int intValue(Properties props, Map<String, String> env, String key, int def, int min, int max) {
        String v = raw(props, env, key);
        if (v == null) return def;
        int parsed;
        try {
            parsed = Integer.parseInt(v);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer: " + v, e);
        }
        if (parsed < min || parsed > max) {
            throw new IllegalArgumentException(key + " must be between " + min + " and " + max + ": " + v);
        }
        return parsed;
    }

    private static boolean boolValue(Properties props, Map<String, String> env, String key, boolean def) {
        String v = raw(props, env, key);
        if (v == null) return def;
        return switch (v.toLowerCase(Locale.ROOT)) {
            case "true" -> true;
            case "false" -> false;
            default -> throw new IllegalArgumentException(key + " must be true or false: " + v);
        };
    }

    private static String path(Properties props, Map<String, String> env, String key, String def) {
        String v = raw(props, env, key);
        if (v == null) return def;
        if (!v.startsWith("/")) throw new IllegalArgumentException(key + " must start with '/': " + v);
        return v;
    }

    @Override
    public String toString() {
        return "ServerConfig{port=" + port + ", streamablePath=" + streamablePath + ", ssePath=" + ssePath
                + ", messagesPath=" + messagesPath + ", jsonResponse=" + jsonResponse
                + ", heartbeatInterval=" + heartbeatInterval + ", shutdownTimeout=" + shutdownTimeout + "}";
    }
}
