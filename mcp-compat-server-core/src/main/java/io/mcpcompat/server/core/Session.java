package io.mcpcompat.server.core;

import java.util.Objects;
import java.util.function.Function;

/**
 * A registered session: its id plus the transport created when it was established.
 *
 * <p>Routing dispatches with {@link #fold(Function, Function)} so that adding a family is a compile error
 * everywhere a session is consumed.
 */
public sealed interface Session permits Session.Streamable, Session.LegacySse {

    String id();

    Transport transport();

    TransportFamily family();

    <R> R fold(Function<? super StreamableTransport, ? extends R> onStreamable,
               Function<? super LegacySseTransport, ? extends R> onLegacy);

    record Streamable(String id, StreamableTransport transport) implements Session {
        public Streamable {
            Objects.requireNonNull(id, "id");
            Objects.requireNonNull(transport, "transport");
        }

        @Override
        public TransportFamily family() {
            return TransportFamily.STREAMABLE;
        }

        @Override
        public <R> R fold(Function<? super StreamableTransport, ? extends R> onStreamable,
                          Function<? super LegacySseTransport, ? extends R> onLegacy) {
            return onStreamable.apply(transport);
        }
    }

    record LegacySse(String id, LegacySseTransport transport) implements Session {
        public LegacySse {
            Objects.requireNonNull(id, "id");
            Objects.requireNonNull(transport, "transport");
        }

        @Override
        public TransportFamily family() {
            return TransportFamily.LEGACY_SSE;
        }

        @Override
        public <R> R fold(Function<? super StreamableTransport, ? extends R> onStreamable,
                          Function<? super LegacySseTransport, ? extends R> onLegacy) {
            return onLegacy.apply(transport);
        }
    }
}
