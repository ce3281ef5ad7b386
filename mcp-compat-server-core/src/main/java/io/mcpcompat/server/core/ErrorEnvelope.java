package io.mcpcompat.server.core;

import io.mcpcompat.core.ErrorKind;
import io.mcpcompat.core.JsonException;
import io.mcpcompat.core.JsonRpcCodec;
import io.mcpcompat.core.JsonRpcError;
import io.mcpcompat.core.JsonRpcMessage;
import io.mcpcompat.core.Protocol;

import java.nio.charset.StandardCharsets;

/**
 * JSON-RPC error responses sent outside of any request context ({@code "id": null}).
 */
public final class ErrorEnvelope {
    private ErrorEnvelope() {}

    public static ServerResponse of(ErrorKind kind, JsonRpcCodec codec) {
        return of(kind.httpStatus(), kind.toError(), codec);
    }

    public static ServerResponse of(int status, JsonRpcError error, JsonRpcCodec codec) {
        byte[] body;
        try {
            body = codec.writeBytes(JsonRpcMessage.Response.failure(null, error));
        } catch (JsonException e) {
            // the envelope has no user data; this only fails if the mapper itself is broken
            body = ("{\"jsonrpc\":\"2.0\",\"error\":{\"code\":" + error.code()
                    + ",\"message\":\"Internal server error\"},\"id\":null}").getBytes(StandardCharsets.UTF_8);
        }
        return new ServerResponse(status, new ResponseBody.Bytes(body))
                .header(Protocol.H_CONTENT_TYPE, Protocol.CT_JSON);
    }
}
