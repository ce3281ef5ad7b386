package io.mcpcompat.server.core;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static io.mcpcompat.server.core.Fixtures.CODEC;
import static io.mcpcompat.server.core.Fixtures.TOOLS;
import static io.mcpcompat.server.core.Fixtures.bodyText;
import static io.mcpcompat.server.core.Fixtures.post;
import static io.mcpcompat.server.core.Fixtures.subscribe;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LegacySseTransportTest {

    private LegacySseTransport connected(String id) {
        LegacySseTransport t = new LegacySseTransport(id, "/messages", CODEC);
        new ProtocolServer(ProtocolServer.ServerInfo.DEFAULT, TOOLS, CODEC).connect(t);
        return t;
    }

    @Test
    void firstEventNamesTheMessageEndpoint() {
        LegacySseTransport t = connected("abc 1");

        ServerResponse resp = t.open();
        RecordingSubscriber stream = subscribe(resp);

        assertThat(resp.status()).isEqualTo(200);
        assertThat(resp.firstHeader("Content-Type")).contains("text/event-stream");
        assertThat(stream.messages()).singleElement().satisfies(frame -> {
            assertThat(frame.event()).isEqualTo("endpoint");
            assertThat(frame.data()).isEqualTo("/messages?sessionId=abc+1");
        });
    }

    @Test
    void responsesArePushedOnTheStream() {
        LegacySseTransport t = connected("s");
        RecordingSubscriber stream = subscribe(t.open());

        ServerResponse init = t.handlePostMessage(post("/messages?sessionId=s", Fixtures.initialize(1, "2024-11-05"),
                "Content-Type", "application/json"));
        ServerResponse call = t.handlePostMessage(post("/messages?sessionId=s",
                Fixtures.request(2, "tools/call", "{\"name\":\"fake\",\"arguments\":{\"name\":\"Ann\"}}"),
                "Content-Type", "application/json"));

        assertThat(init.status()).isEqualTo(202);
        assertThat(bodyText(call)).isEqualTo("Accepted");
        List<SseFrame> frames = stream.messages();
        assertThat(frames).hasSize(3);
        assertThat(frames.get(1).event()).isEqualTo("message");
        assertThat(frames.get(1).data()).contains("\"protocolVersion\":\"2024-11-05\"");
        assertThat(frames.get(2).data()).contains("Hello Ann!");
    }

    @Test
    void postBeforeStreamIsOpenFails() {
        LegacySseTransport t = connected("s");

        ServerResponse resp = t.handlePostMessage(post("/messages?sessionId=s", Fixtures.request(1, "ping", null),
                "Content-Type", "application/json"));

        assertThat(resp.status()).isEqualTo(500);
        assertThat(bodyText(resp)).isEqualTo("SSE connection not established");
    }

    @Test
    void rejectsNonJsonAndMalformedMessages() {
        LegacySseTransport t = connected("s");
        subscribe(t.open());

        assertThat(t.handlePostMessage(post("/messages?sessionId=s", "{}", "Content-Type", "text/plain")).status())
                .isEqualTo(400);
        ServerResponse malformed = t.handlePostMessage(post("/messages?sessionId=s", "{oops",
                "Content-Type", "application/json"));
        assertThat(malformed.status()).isEqualTo(400);
        assertThat(bodyText(malformed)).startsWith("Invalid message");
    }

    @Test
    void clientDisconnectClosesTheTransport() {
        LegacySseTransport t = connected("s");
        AtomicInteger closed = new AtomicInteger();
        t.onClose(closed::incrementAndGet);
        RecordingSubscriber stream = subscribe(t.open());

        stream.cancel();

        assertThat(t.isClosed()).isTrue();
        assertThat(closed).hasValue(1);
    }

    @Test
    void closeCompletesTheStreamOnce() {
        LegacySseTransport t = connected("s");
        AtomicInteger closed = new AtomicInteger();
        t.onClose(closed::incrementAndGet);
        RecordingSubscriber stream = subscribe(t.open());

        t.close();
        t.close();

        assertThat(stream.isCompleted()).isTrue();
        assertThat(closed).hasValue(1);
    }

    @Test
    void streamOpensOnlyOnce() {
        LegacySseTransport t = connected("s");
        t.open();

        assertThatThrownBy(t::open).isInstanceOf(IllegalStateException.class);
    }
}
