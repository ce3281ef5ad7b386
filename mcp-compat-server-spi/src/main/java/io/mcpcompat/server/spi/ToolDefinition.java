package io.mcpcompat.server.spi;

import java.util.Objects;

/**
 * A named operation exposed through {@code tools/list} and {@code tools/call}.
 *
 * @param name unique tool name
 * @param description human-readable description
 * @param params declared input parameters
 * @param handler implementation
 */
public record ToolDefinition(String name, String description, ParamSchema params, ToolHandler handler) {
    public ToolDefinition {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) throw new IllegalArgumentException("tool name must not be blank");
        description = description == null ? "" : description;
        params = params == null ? ParamSchema.empty() : params;
        Objects.requireNonNull(handler, "handler");
    }
}
