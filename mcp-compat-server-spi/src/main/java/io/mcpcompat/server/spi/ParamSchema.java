package io.mcpcompat.server.spi;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Declared input parameters of a tool.
 *
 * <p>Rendered as a JSON Schema object by the protocol server and used to validate call arguments before
 * the handler runs. Arguments not declared here are ignored.
 */
public final class ParamSchema {

    public enum Type {
        STRING("string"),
        NUMBER("number"),
        INTEGER("integer"),
        BOOLEAN("boolean");

        private final String jsonType;

        Type(String jsonType) {
            this.jsonType = jsonType;
        }

        public String jsonType() {
            return jsonType;
        }

        boolean accepts(Object value) {
            return switch (this) {
                case STRING -> value instanceof String;
                case NUMBER -> value instanceof Number;
                case INTEGER -> value instanceof Integer || value instanceof Long
                        || value instanceof java.math.BigInteger;
                case BOOLEAN -> value instanceof Boolean;
            };
        }
    }

    /**
     * One declared parameter.
     */
    public record Param(String name, Type type, boolean required, String description) {
        public Param {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(type, "type");
        }
    }

    private static final ParamSchema EMPTY = new ParamSchema(List.of());

    private final List<Param> params;

    private ParamSchema(List<Param> params) {
        this.params = List.copyOf(params);
    }

    public static ParamSchema empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<Param> params() {
        return params;
    }

    /**
     * Check arguments against the declared parameters.
     *
     * @return violation messages; empty when the arguments are acceptable
     */
    public List<String> validate(Map<String, Object> arguments) {
        Map<String, Object> args = arguments == null ? Map.of() : arguments;
        List<String> violations = new ArrayList<>();
        for (Param p : params) {
            Object value = args.get(p.name());
            if (value == null) {
                if (p.required()) violations.add("missing required argument: " + p.name());
                continue;
            }
            if (!p.type().accepts(value)) {
                violations.add("argument " + p.name() + " must be of type " + p.type().jsonType());
            }
        }
        return violations;
    }

    public static final class Builder {
        private final Map<String, Param> params = new LinkedHashMap<>();

        private Builder() {}

        public Builder string(String name) {
            return add(new Param(name, Type.STRING, true, null));
        }

        public Builder optionalString(String name) {
            return add(new Param(name, Type.STRING, false, null));
        }

        public Builder param(String name, Type type, boolean required, String description) {
            return add(new Param(name, type, required, description));
        }

        private Builder add(Param p) {
            if (params.putIfAbsent(p.name(), p) != null) {
                throw new IllegalArgumentException("duplicate parameter: " + p.name());
            }
            return this;
        }

        public ParamSchema build() {
            return new ParamSchema(new ArrayList<>(params.values()));
        }
    }
}
