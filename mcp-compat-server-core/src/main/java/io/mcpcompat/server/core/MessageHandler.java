package io.mcpcompat.server.core;

import io.mcpcompat.core.JsonRpcMessage;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Receives client messages from a transport.
 */
@FunctionalInterface
public interface MessageHandler {

    /**
     * @param message request, notification or response from the client
     * @return the response to send back for a request; empty for notifications and responses
     */
    CompletableFuture<Optional<JsonRpcMessage.Response>> handle(JsonRpcMessage message);
}
