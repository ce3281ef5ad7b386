package io.mcpcompat.server.core;

import com.fasterxml.jackson.databind.JsonNode;
import io.mcpcompat.core.JsonException;
import io.mcpcompat.core.JsonRpcMessage;
import io.mcpcompat.server.spi.LogLevel;
import io.mcpcompat.server.spi.ParamSchema;
import io.mcpcompat.server.spi.ToolDefinition;
import io.mcpcompat.server.spi.ToolResult;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static io.mcpcompat.server.core.Fixtures.CODEC;
import static io.mcpcompat.server.core.Fixtures.TOOLS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProtocolServerTest {

    private final ProtocolServer server = new ProtocolServer(ProtocolServer.ServerInfo.DEFAULT, TOOLS, CODEC);

    private JsonRpcMessage.Response call(String json) throws JsonException {
        JsonRpcMessage message = CODEC.readMessage(json.getBytes(StandardCharsets.UTF_8));
        Optional<JsonRpcMessage.Response> response = server.handle(message).join();
        assertThat(response).isPresent();
        return response.get();
    }

    @Test
    void initializeEchoesSupportedVersionAndReportsServerInfo() throws Exception {
        JsonNode result = call(Fixtures.initialize(1, "2024-11-05")).result();

        assertThat(result.path("protocolVersion").asText()).isEqualTo("2024-11-05");
        assertThat(result.path("serverInfo").path("name").asText()).isEqualTo("jsm-mcp-server");
        assertThat(result.path("serverInfo").path("version").asText()).isEqualTo("1.0.0");
        assertThat(result.path("capabilities").has("logging")).isTrue();
        assertThat(result.path("capabilities").has("tools")).isTrue();
        assertThat(server.negotiatedVersion()).contains("2024-11-05");
    }

    @Test
    void initializeFallsBackToLatestForUnknownVersion() throws Exception {
        JsonNode result = call(Fixtures.initialize(1, "1999-01-01")).result();

        assertThat(result.path("protocolVersion").asText()).isEqualTo("2025-03-26");
    }

    @Test
    void pingAnswersWithEmptyObject() throws Exception {
        JsonRpcMessage.Response response = call(Fixtures.request(4, "ping", null));

        assertThat(response.isError()).isFalse();
        assertThat(response.result().isEmpty()).isTrue();
        assertThat(response.id().asInt()).isEqualTo(4);
    }

    @Test
    void listsToolsWithInputSchema() throws Exception {
        JsonNode tools = call(Fixtures.request(2, "tools/list", "{}")).result().path("tools");

        assertThat(tools.size()).isEqualTo(1);
        JsonNode fake = tools.get(0);
        assertThat(fake.path("name").asText()).isEqualTo("fake");
        assertThat(fake.path("inputSchema").path("type").asText()).isEqualTo("object");
        assertThat(fake.path("inputSchema").path("properties").path("name").path("type").asText()).isEqualTo("string");
        assertThat(fake.path("inputSchema").path("required").get(0).asText()).isEqualTo("name");
    }

    @Test
    void callsTool() throws Exception {
        JsonNode result = call(Fixtures.request(3, "tools/call",
                "{\"name\":\"fake\",\"arguments\":{\"name\":\"John\"}}")).result();

        assertThat(result.path("content").get(0).path("type").asText()).isEqualTo("text");
        assertThat(result.path("content").get(0).path("text").asText()).isEqualTo("Hello John!");
        assertThat(result.has("isError")).isFalse();
    }

    @Test
    void rejectsUnknownToolAndInvalidArguments() throws Exception {
        JsonRpcMessage.Response unknown = call(Fixtures.request(3, "tools/call", "{\"name\":\"nope\"}"));
        assertThat(unknown.error().code()).isEqualTo(-32602);

        JsonRpcMessage.Response missing = call(Fixtures.request(3, "tools/call", "{\"name\":\"fake\",\"arguments\":{}}"));
        assertThat(missing.error().code()).isEqualTo(-32602);
        assertThat(missing.error().message()).contains("missing required argument: name");

        JsonRpcMessage.Response wrongType = call(Fixtures.request(3, "tools/call",
                "{\"name\":\"fake\",\"arguments\":{\"name\":42}}"));
        assertThat(wrongType.error().message()).contains("argument name must be of type string");
    }

    @Test
    void failingToolYieldsErrorResult() throws Exception {
        ToolDefinition broken = new ToolDefinition("broken", "always fails", ParamSchema.empty(),
                (args, ctx) -> CompletableFuture.failedFuture(new IllegalStateException("backend down")));
        ToolDefinition throwing = new ToolDefinition("throwing", "throws", ParamSchema.empty(),
                (args, ctx) -> {
                    throw new IllegalArgumentException("bad input");
                });
        ProtocolServer s = new ProtocolServer(ProtocolServer.ServerInfo.DEFAULT, List.of(broken, throwing), CODEC);

        JsonNode result = s.handle(CODEC.readMessage(
                Fixtures.request(1, "tools/call", "{\"name\":\"broken\"}").getBytes(StandardCharsets.UTF_8)))
                .join().orElseThrow().result();
        assertThat(result.path("isError").asBoolean()).isTrue();
        assertThat(result.path("content").get(0).path("text").asText()).isEqualTo("backend down");

        JsonNode thrown = s.handle(CODEC.readMessage(
                Fixtures.request(2, "tools/call", "{\"name\":\"throwing\"}").getBytes(StandardCharsets.UTF_8)))
                .join().orElseThrow().result();
        assertThat(thrown.path("isError").asBoolean()).isTrue();
    }

    @Test
    void unknownMethodIsMethodNotFound() throws Exception {
        JsonRpcMessage.Response response = call(Fixtures.request(9, "resources/list", null));

        assertThat(response.error().code()).isEqualTo(-32601);
    }

    @Test
    void notificationsProduceNoResponse() throws Exception {
        JsonRpcMessage message = CODEC.readMessage(
                Fixtures.notification("notifications/initialized").getBytes(StandardCharsets.UTF_8));

        assertThat(server.handle(message).join()).isEmpty();
    }

    @Test
    void setLevelFiltersLogNotifications() throws Exception {
        LegacySseTransport transport = new LegacySseTransport("log-session", "/messages", CODEC);
        server.connect(transport);
        RecordingSubscriber stream = Fixtures.subscribe(transport.open());

        assertThat(call(Fixtures.request(1, "logging/setLevel", "{\"level\":\"warning\"}")).isError()).isFalse();
        assertThat(server.logLevel()).isEqualTo(LogLevel.WARNING);

        server.log(LogLevel.INFO, "quiet");
        server.log(LogLevel.ERROR, "loud");

        List<SseFrame> messages = stream.messages();
        // endpoint event plus the one notification that passed the threshold
        assertThat(messages).hasSize(2);
        assertThat(messages.get(1).data()).contains("notifications/message").contains("loud").contains("\"error\"");
    }

    @Test
    void setLevelRejectsUnknownLevel() throws Exception {
        assertThat(call(Fixtures.request(1, "logging/setLevel", "{\"level\":\"loud\"}")).error().code())
                .isEqualTo(-32602);
    }

    @Test
    void toolContextSeesTheSession() throws Exception {
        ToolDefinition whoami = new ToolDefinition("whoami", "", ParamSchema.empty(),
                (args, ctx) -> CompletableFuture.completedFuture(ToolResult.text(ctx.sessionId())));
        ProtocolServer s = new ProtocolServer(ProtocolServer.ServerInfo.DEFAULT, List.of(whoami), CODEC);
        s.connect(new LegacySseTransport("abc", "/messages", CODEC));

        JsonNode result = s.handle(CODEC.readMessage(
                Fixtures.request(1, "tools/call", "{\"name\":\"whoami\"}").getBytes(StandardCharsets.UTF_8)))
                .join().orElseThrow().result();

        assertThat(result.path("content").get(0).path("text").asText()).isEqualTo("abc");
    }

    @Test
    void connectsOnlyOnce() {
        server.connect(new LegacySseTransport("one", "/messages", CODEC));

        assertThatThrownBy(() -> server.connect(new LegacySseTransport("two", "/messages", CODEC)))
                .isInstanceOf(IllegalStateException.class);
    }
}
