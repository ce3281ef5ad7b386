package io.mcpcompat.server.spi;

/**
 * Per-call view of the session a tool runs in.
 */
public interface ToolContext {

    /**
     * Id of the session issuing the call.
     */
    String sessionId();

    /**
     * Send a log notification to the client if {@code level} passes the client-selected threshold.
     */
    void log(LogLevel level, String message);
}
