package io.mcpcompat.server;

import io.mcpcompat.server.spi.ParamSchema;
import io.mcpcompat.server.spi.ToolDefinition;
import io.mcpcompat.server.spi.ToolResult;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Tools registered on every session.
 */
public final class Tools {
    private Tools() {}

    /** Greets {@code name}. */
    public static final ToolDefinition FAKE = new ToolDefinition(
            "fake",
            "Fake tool",
            ParamSchema.builder().string("name").build(),
            (args, ctx) -> CompletableFuture.completedFuture(ToolResult.text("Hello " + args.string("name") + "!")));

    public static List<ToolDefinition> all() {
        return List.of(FAKE);
    }
}
