package io.mcpcompat.core;

import java.util.List;

/**
 * MCP HTTP transport constants (header names, query keys, paths and well-known values).
 *
 * <p>This module intentionally contains no HTTP server bindings. It only models protocol-level concerns
 * shared by both transport families.
 */
public final class Protocol {
    private Protocol() {}

    // Protocol versions
    public static final String VERSION_STREAMABLE = "2025-03-26";
    public static final String VERSION_LEGACY_SSE = "2024-11-05";
    public static final String LATEST_VERSION = VERSION_STREAMABLE;
    public static final List<String> SUPPORTED_VERSIONS = List.of(VERSION_STREAMABLE, VERSION_LEGACY_SSE);

    // Default endpoint paths
    public static final String PATH_STREAMABLE = "/mcp";
    public static final String PATH_SSE = "/sse";
    public static final String PATH_MESSAGES = "/messages";

    // Query parameter keys
    public static final String Q_TOKEN = "token";
    public static final String Q_SESSION_ID = "sessionId";

    // MCP headers
    public static final String H_MCP_SESSION_ID = "Mcp-Session-Id";
    public static final String H_LAST_EVENT_ID = "Last-Event-ID";

    // HTTP headers
    public static final String H_CONTENT_TYPE = "Content-Type";
    public static final String H_ACCEPT = "Accept";
    public static final String H_CACHE_CONTROL = "Cache-Control";
    public static final String H_CONNECTION = "Connection";
    public static final String H_ALLOW = "Allow";

    // Content types
    public static final String CT_JSON = "application/json";
    public static final String CT_EVENT_STREAM = "text/event-stream";
    public static final String CT_TEXT = "text/plain; charset=utf-8";

    // SSE event names
    public static final String EVENT_MESSAGE = "message";
    public static final String EVENT_ENDPOINT = "endpoint";

    // JSON-RPC methods
    public static final String M_INITIALIZE = "initialize";
    public static final String M_INITIALIZED = "notifications/initialized";
    public static final String M_PING = "ping";
    public static final String M_TOOLS_LIST = "tools/list";
    public static final String M_TOOLS_CALL = "tools/call";
    public static final String M_LOGGING_SET_LEVEL = "logging/setLevel";
    public static final String M_LOG_MESSAGE = "notifications/message";

    public static final String JSONRPC_VERSION = "2.0";
}
