package io.mcpcompat.server.core;

import io.mcpcompat.core.JsonRpcCodec;
import io.mcpcompat.server.spi.ParamSchema;
import io.mcpcompat.server.spi.ToolDefinition;
import io.mcpcompat.server.spi.ToolResult;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Request builders and shared test data.
 */
final class Fixtures {
    private Fixtures() {}

    static final JsonRpcCodec CODEC = new JsonRpcCodec();

    static final String ACCEPT_BOTH = "application/json, text/event-stream";

    static final String INIT = initialize(1, "2025-03-26");

    static final ToolDefinition FAKE = new ToolDefinition(
            "fake",
            "Fake tool",
            ParamSchema.builder().string("name").build(),
            (args, ctx) -> CompletableFuture.completedFuture(ToolResult.text("Hello " + args.string("name") + "!")));

    static final List<ToolDefinition> TOOLS = List.of(FAKE);

    static String initialize(int id, String version) {
        return "{\"jsonrpc\":\"2.0\",\"id\":" + id + ",\"method\":\"initialize\",\"params\":{"
                + "\"protocolVersion\":\"" + version + "\",\"capabilities\":{},"
                + "\"clientInfo\":{\"name\":\"test-client\",\"version\":\"1.0.0\"}}}";
    }

    static String request(int id, String method, String paramsJson) {
        return "{\"jsonrpc\":\"2.0\",\"id\":" + id + ",\"method\":\"" + method + "\""
                + (paramsJson == null ? "" : ",\"params\":" + paramsJson) + "}";
    }

    static String notification(String method) {
        return "{\"jsonrpc\":\"2.0\",\"method\":\"" + method + "\"}";
    }

    static ServerRequest post(String uri, String body, String... headers) {
        return new ServerRequest(HttpMethod.POST, URI.create("http://localhost" + uri), headers(headers),
                body == null ? null : body.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * POST with the headers a conforming Streamable client sends.
     */
    static ServerRequest streamablePost(String uri, String body, String... extraHeaders) {
        String[] all = new String[extraHeaders.length + 4];
        all[0] = "Accept";
        all[1] = ACCEPT_BOTH;
        all[2] = "Content-Type";
        all[3] = "application/json";
        System.arraycopy(extraHeaders, 0, all, 4, extraHeaders.length);
        return post(uri, body, all);
    }

    static ServerRequest get(String uri, String... headers) {
        return new ServerRequest(HttpMethod.GET, URI.create("http://localhost" + uri), headers(headers), null);
    }

    static ServerRequest request(HttpMethod method, String uri, String... headers) {
        return new ServerRequest(method, URI.create("http://localhost" + uri), headers(headers), null);
    }

    static Map<String, List<String>> headers(String... kv) {
        Map<String, List<String>> map = new LinkedHashMap<>();
        for (int i = 0; i + 1 < kv.length; i += 2) {
            map.put(kv[i], List.of(kv[i + 1]));
        }
        return map;
    }

    static String bodyText(ServerResponse resp) {
        if (resp.body() instanceof ResponseBody.Bytes bytes) {
            return new String(bytes.bytes(), StandardCharsets.UTF_8);
        }
        return "";
    }

    static RecordingSubscriber subscribe(ServerResponse resp) {
        if (!(resp.body() instanceof ResponseBody.Sse sse)) {
            throw new AssertionError("expected an SSE body, got " + resp.body());
        }
        RecordingSubscriber subscriber = new RecordingSubscriber();
        sse.publisher().subscribe(subscriber);
        return subscriber;
    }
}
