package io.mcpcompat.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

import java.util.Objects;

/**
 * JSON-RPC 2.0 messages exchanged over both transport families.
 *
 * <p>Ids are kept as raw JSON nodes (string or number) so they round-trip unchanged.
 */
public sealed interface JsonRpcMessage permits JsonRpcMessage.Request, JsonRpcMessage.Notification, JsonRpcMessage.Response {

    /**
     * A call expecting a response.
     *
     * @param id request id (string or number)
     * @param method method name
     * @param params parameters (may be null)
     */
    record Request(JsonNode id, String method, JsonNode params) implements JsonRpcMessage {
        public Request {
            Objects.requireNonNull(id, "id");
            Objects.requireNonNull(method, "method");
        }
    }

    /**
     * A one-way message.
     *
     * @param method method name
     * @param params parameters (may be null)
     */
    record Notification(String method, JsonNode params) implements JsonRpcMessage {
        public Notification {
            Objects.requireNonNull(method, "method");
        }
    }

    /**
     * A result or an error for a previous request.
     *
     * @param id id of the request answered; {@code null} JSON when the request could not be identified
     * @param result result on success (null on error)
     * @param error error on failure (null on success)
     */
    record Response(JsonNode id, JsonNode result, JsonRpcError error) implements JsonRpcMessage {
        public Response {
            id = id == null ? NullNode.getInstance() : id;
            if ((result == null) == (error == null)) {
                throw new IllegalArgumentException("exactly one of result or error must be set");
            }
        }

        public static Response success(JsonNode id, JsonNode result) {
            return new Response(id, result, null);
        }

        public static Response failure(JsonNode id, JsonRpcError error) {
            return new Response(id, null, error);
        }

        public boolean isError() {
            return error != null;
        }
    }
}
