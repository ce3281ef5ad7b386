package io.mcpcompat.server.core;

import io.mcpcompat.server.spi.InMemoryEventStore;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static io.mcpcompat.server.core.Fixtures.CODEC;
import static org.assertj.core.api.Assertions.assertThat;

class SessionRegistryTest {

    private static Session streamable(String id) {
        return new Session.Streamable(id, new StreamableTransport(id, new InMemoryEventStore(), CODEC, false));
    }

    private static Session legacy(String id) {
        return new Session.LegacySse(id, new LegacySseTransport(id, "/messages", CODEC));
    }

    @Test
    void firstWriterWins() {
        SessionRegistry registry = new SessionRegistry();
        Session first = streamable("a");
        Session second = legacy("a");

        assertThat(registry.insert(first)).isTrue();
        assertThat(registry.insert(second)).isFalse();

        assertThat(registry.lookup("a")).containsSame(first);
        assertThat(registry.size()).isEqualTo(1);
    }

    @Test
    void removeByIdIsIdempotent() {
        SessionRegistry registry = new SessionRegistry();
        registry.insert(streamable("a"));

        assertThat(registry.remove("a")).isPresent();
        assertThat(registry.remove("a")).isEmpty();
        assertThat(registry.isEmpty()).isTrue();
    }

    @Test
    void conditionalRemoveKeepsADifferentSessionUnderTheSameId() {
        SessionRegistry registry = new SessionRegistry();
        Session stale = streamable("a");
        Session current = streamable("a");
        registry.insert(current);

        assertThat(registry.remove(stale)).isFalse();
        assertThat(registry.lookup("a")).containsSame(current);
        assertThat(registry.remove(current)).isTrue();
        assertThat(registry.remove(current)).isFalse();
    }

    @Test
    void foldDispatchesOnFamily() {
        assertThat(streamable("s").<String>fold(t -> "streamable:" + t.sessionId(), t -> "legacy"))
                .isEqualTo("streamable:s");
        assertThat(legacy("l").<String>fold(t -> "streamable", t -> "legacy:" + t.sessionId()))
                .isEqualTo("legacy:l");
        assertThat(legacy("l").family()).isEqualTo(TransportFamily.LEGACY_SSE);
    }

    @Test
    void forEachIteratesOverASnapshotThatToleratesRemoval() {
        SessionRegistry registry = new SessionRegistry();
        registry.insert(streamable("a"));
        registry.insert(legacy("b"));

        List<String> visited = new ArrayList<>();
        registry.forEach(s -> {
            visited.add(s.id());
            registry.remove(s.id());
        });

        assertThat(visited).containsExactlyInAnyOrder("a", "b");
        assertThat(registry.isEmpty()).isTrue();
    }

    @Test
    void lookupOfNullIsEmpty() {
        assertThat(new SessionRegistry().lookup(null)).isEmpty();
    }
}
