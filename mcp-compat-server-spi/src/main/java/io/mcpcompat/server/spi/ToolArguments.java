package io.mcpcompat.server.spi;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Validated arguments of a tool call.
 */
public final class ToolArguments {
    private final Map<String, Object> values;

    public ToolArguments(Map<String, Object> values) {
        this.values = values == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public Map<String, Object> asMap() {
        return values;
    }

    public Optional<Object> get(String name) {
        return Optional.ofNullable(values.get(name));
    }

    /**
     * @throws IllegalArgumentException if the argument is absent or not a string
     */
    public String string(String name) {
        Object v = values.get(name);
        if (!(v instanceof String)) throw new IllegalArgumentException("argument " + name + " is not a string");
        return (String) v;
    }

    public Optional<String> optionalString(String name) {
        Object v = values.get(name);
        return v instanceof String ? Optional.of((String) v) : Optional.empty();
    }
}
