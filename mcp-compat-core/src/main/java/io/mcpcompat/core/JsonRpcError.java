package io.mcpcompat.core;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * JSON-RPC 2.0 error object.
 *
 * @param code error code
 * @param message short description
 * @param data optional additional information (may be null)
 */
public record JsonRpcError(int code, String message, JsonNode data) {

    public static final int PARSE_ERROR = -32700;
    public static final int INVALID_REQUEST = -32600;
    public static final int METHOD_NOT_FOUND = -32601;
    public static final int INVALID_PARAMS = -32602;
    public static final int INTERNAL_ERROR = -32603;
    /** Implementation-defined server error, used for transport and session failures. */
    public static final int SERVER_ERROR = -32000;

    public JsonRpcError {
        message = message == null ? "" : message;
    }

    public static JsonRpcError of(int code, String message) {
        return new JsonRpcError(code, message, null);
    }
}
