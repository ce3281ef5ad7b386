package io.mcpcompat.core;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Jackson-based reader and writer for JSON-RPC 2.0 messages.
 *
 * <p>Thread-safe once constructed; one instance is normally shared by the whole server.
 */
public final class JsonRpcCodec {
    private final ObjectMapper mapper;

    /**
     * Creates a codec with the default ObjectMapper.
     */
    public JsonRpcCodec() {
        this(new ObjectMapper(new JsonFactory()));
    }

    /**
     * Creates a codec with a custom ObjectMapper.
     * @param mapper the ObjectMapper to use
     */
    public JsonRpcCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    /**
     * Returns the underlying ObjectMapper, used to build params and results.
     */
    public ObjectMapper mapper() {
        return mapper;
    }

    /**
     * Reads a single message or a batch.
     *
     * @param body request body
     * @return messages in body order; a single message yields a one-element list
     * @throws JsonException if the body is not JSON or contains an invalid message
     */
    public List<JsonRpcMessage> readMessages(byte[] body) throws JsonException {
        JsonNode root = readTree(body);
        if (root.isArray()) {
            if (root.isEmpty()) throw new JsonException("empty batch");
            List<JsonRpcMessage> out = new ArrayList<>(root.size());
            for (JsonNode element : root) {
                out.add(toMessage(element));
            }
            return out;
        }
        return List.of(toMessage(root));
    }

    /**
     * Reads exactly one message; batches are rejected.
     */
    public JsonRpcMessage readMessage(byte[] body) throws JsonException {
        JsonNode root = readTree(body);
        if (root.isArray()) throw new JsonException("batch not supported here");
        return toMessage(root);
    }

    /**
     * Returns the initialize request carried by {@code body}, if the body is exactly one well-formed
     * {@code initialize} request. Never throws: malformed bodies simply yield empty.
     */
    public Optional<JsonRpcMessage.Request> initializeRequest(byte[] body) {
        if (body == null || body.length == 0) return Optional.empty();
        try {
            JsonNode root = readTree(body);
            if (root.isArray()) return Optional.empty();
            JsonRpcMessage message = toMessage(root);
            if (message instanceof JsonRpcMessage.Request request && isInitializeRequest(request)) {
                return Optional.of(request);
            }
            return Optional.empty();
        } catch (JsonException e) {
            return Optional.empty();
        }
    }

    /**
     * An initialize request names the method and carries a protocol version, client info and capabilities.
     */
    public static boolean isInitializeRequest(JsonRpcMessage message) {
        if (!(message instanceof JsonRpcMessage.Request request)) return false;
        if (!Protocol.M_INITIALIZE.equals(request.method())) return false;
        JsonNode params = request.params();
        return params != null
                && params.isObject()
                && params.path("protocolVersion").isTextual()
                && params.path("capabilities").isObject()
                && params.path("clientInfo").isObject();
    }

    public String write(JsonRpcMessage message) throws JsonException {
        try {
            return mapper.writeValueAsString(toNode(message));
        } catch (Exception e) {
            throw new JsonException("Failed to serialize JSON-RPC message", e);
        }
    }

    public byte[] writeBytes(JsonRpcMessage message) throws JsonException {
        try {
            return mapper.writeValueAsBytes(toNode(message));
        } catch (Exception e) {
            throw new JsonException("Failed to serialize JSON-RPC message", e);
        }
    }

    /**
     * Writes messages as a JSON array.
     */
    public byte[] writeBatch(List<? extends JsonRpcMessage> messages) throws JsonException {
        ArrayNode array = mapper.createArrayNode();
        for (JsonRpcMessage m : messages) {
            array.add(toNode(m));
        }
        try {
            return mapper.writeValueAsBytes(array);
        } catch (Exception e) {
            throw new JsonException("Failed to serialize JSON-RPC batch", e);
        }
    }

    public ObjectNode toNode(JsonRpcMessage message) {
        ObjectNode node = mapper.createObjectNode();
        node.put("jsonrpc", Protocol.JSONRPC_VERSION);
        if (message instanceof JsonRpcMessage.Request r) {
            node.set("id", r.id());
            node.put("method", r.method());
            if (r.params() != null) node.set("params", r.params());
        } else if (message instanceof JsonRpcMessage.Notification n) {
            node.put("method", n.method());
            if (n.params() != null) node.set("params", n.params());
        } else if (message instanceof JsonRpcMessage.Response r) {
            if (r.isError()) {
                ObjectNode error = node.putObject("error");
                error.put("code", r.error().code());
                error.put("message", r.error().message());
                if (r.error().data() != null) error.set("data", r.error().data());
            } else {
                node.set("result", r.result());
            }
            node.set("id", r.id());
        }
        return node;
    }

    private JsonNode readTree(byte[] body) throws JsonException {
        if (body == null || body.length == 0) throw new JsonException("empty body");
        try {
            JsonNode root = mapper.readTree(body);
            if (root == null || root.isMissingNode()) throw new JsonException("empty body");
            return root;
        } catch (JsonException e) {
            throw e;
        } catch (Exception e) {
            throw new JsonException("Failed to parse JSON", e);
        }
    }

    private static JsonRpcMessage toMessage(JsonNode node) throws JsonException {
        if (!node.isObject()) throw new JsonException("JSON-RPC message must be an object");
        if (!Protocol.JSONRPC_VERSION.equals(node.path("jsonrpc").asText(null))) {
            throw new JsonException("unsupported jsonrpc version");
        }
        JsonNode id = node.get("id");
        if (id != null && !(id.isTextual() || id.isIntegralNumber() || id.isNull())) {
            throw new JsonException("id must be a string or an integer");
        }

        JsonNode method = node.get("method");
        if (method != null) {
            if (!method.isTextual()) throw new JsonException("method must be a string");
            JsonNode params = node.get("params");
            if (id == null) return new JsonRpcMessage.Notification(method.asText(), params);
            if (id.isNull()) throw new JsonException("request id must not be null");
            return new JsonRpcMessage.Request(id, method.asText(), params);
        }

        if (id != null && (node.has("result") || node.has("error"))) {
            if (node.has("error")) {
                JsonNode error = node.get("error");
                if (!error.isObject() || !error.path("code").isInt()) {
                    throw new JsonException("malformed error object");
                }
                return JsonRpcMessage.Response.failure(id, new JsonRpcError(
                        error.get("code").asInt(), error.path("message").asText(""), error.get("data")));
            }
            return JsonRpcMessage.Response.success(id, node.get("result"));
        }
        throw new JsonException("not a JSON-RPC request, notification or response");
    }
}
