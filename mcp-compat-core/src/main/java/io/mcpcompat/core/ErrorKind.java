package io.mcpcompat.core;

/**
 * Router-level error taxonomy with the HTTP status, JSON-RPC code and message reported in the error envelope.
 */
public enum ErrorKind {
    MISSING_TOKEN(400, JsonRpcError.SERVER_ERROR, "Bad Request: No token provided"),
    WRONG_TRANSPORT_FOR_SESSION(400, JsonRpcError.SERVER_ERROR,
            "Bad Request: Session exists but uses a different transport protocol"),
    INVALID_SESSION(400, JsonRpcError.SERVER_ERROR, "Bad Request: No valid session ID provided"),
    INTERNAL_ERROR(500, JsonRpcError.INTERNAL_ERROR, "Internal server error"),
    SHUTTING_DOWN(503, JsonRpcError.SERVER_ERROR, "Service Unavailable: Server is shutting down");

    private final int httpStatus;
    private final int code;
    private final String message;

    ErrorKind(int httpStatus, int code, String message) {
        this.httpStatus = httpStatus;
        this.code = code;
        this.message = message;
    }

    public int httpStatus() {
        return httpStatus;
    }

    public int code() {
        return code;
    }

    public String message() {
        return message;
    }

    public JsonRpcError toError() {
        return new JsonRpcError(code, message, null);
    }
}
