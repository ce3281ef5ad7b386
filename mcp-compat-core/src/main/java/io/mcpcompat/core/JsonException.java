package io.mcpcompat.core;

/**
 * Raised when a payload is not valid JSON or not a valid JSON-RPC message.
 */
public class JsonException extends Exception {
    public JsonException(String message) {
        super(message);
    }

    public JsonException(String message, Throwable cause) {
        super(message, cause);
    }
}
