package io.mcpcompat.server.spi;

import java.util.concurrent.CompletableFuture;

/**
 * Asynchronous implementation of a tool.
 */
@FunctionalInterface
public interface ToolHandler {

    /**
     * @param arguments arguments, already validated against the tool's {@link ParamSchema}
     * @param context session-scoped context
     * @return future completing with the result; exceptional completion is reported as an error result
     */
    CompletableFuture<ToolResult> call(ToolArguments arguments, ToolContext context);
}
