package io.mcpcompat.server.spi;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryEventStoreTest {

    @Test
    void sequenceNumbersIncreasePerScope() {
        InMemoryEventStore store = new InMemoryEventStore();

        long a1 = store.append("a", "e1");
        long b1 = store.append("b", "e2");
        long a2 = store.append("a", "e3");

        assertThat(a2).isGreaterThan(a1);
        assertThat(b1).isGreaterThan(a1).isLessThan(a2);
    }

    @Test
    void replayReturnsEventsStrictlyAfterLastSeenInAppendOrder() {
        InMemoryEventStore store = new InMemoryEventStore();
        long first = store.append("s", "one");
        store.append("other", "noise");
        store.append("s", "two");
        store.append("s", "three");

        List<StoredEvent> replayed = store.replayAfter("s", first);

        assertThat(replayed).extracting(StoredEvent::payload).containsExactly("two", "three");
        assertThat(replayed).extracting(StoredEvent::scope).containsOnly("s");
    }

    @Test
    void replayIsRestartable() {
        InMemoryEventStore store = new InMemoryEventStore();
        store.append("s", "one");
        store.append("s", "two");

        assertThat(store.replayAfter("s", 0)).isEqualTo(store.replayAfter("s", 0));
    }

    @Test
    void replayOfUnknownScopeOrPastTailIsEmpty() {
        InMemoryEventStore store = new InMemoryEventStore();
        long last = store.append("s", "one");

        assertThat(store.replayAfter("missing", 0)).isEmpty();
        assertThat(store.replayAfter("s", last)).isEmpty();
    }

    @Test
    void boundedStoreEvictsOldestFirst() {
        InMemoryEventStore store = new InMemoryEventStore(2);
        store.append("s", "one");
        store.append("s", "two");
        store.append("s", "three");

        assertThat(store.size("s")).isEqualTo(2);
        assertThat(store.replayAfter("s", 0)).extracting(StoredEvent::payload).containsExactly("two", "three");
    }

    @Test
    void purgeDropsAllScopes() {
        InMemoryEventStore store = new InMemoryEventStore();
        store.append("a", "one");
        store.append("b", "two");

        store.purge();

        assertThat(store.replayAfter("a", 0)).isEmpty();
        assertThat(store.replayAfter("b", 0)).isEmpty();
    }

    @Test
    void concurrentAppendsGetDistinctSequenceNumbers() throws Exception {
        InMemoryEventStore store = new InMemoryEventStore();
        ExecutorService pool = Executors.newFixedThreadPool(4);
        ConcurrentLinkedQueue<Long> seen = new ConcurrentLinkedQueue<>();
        CountDownLatch start = new CountDownLatch(1);
        try {
            for (int t = 0; t < 4; t++) {
                pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < 250; i++) {
                        seen.add(store.append("s", "e"));
                    }
                    return null;
                });
            }
            start.countDown();
        } finally {
            pool.shutdown();
            assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
        }

        assertThat(new ArrayList<>(seen)).doesNotHaveDuplicates().hasSize(1000);
        List<StoredEvent> all = store.replayAfter("s", 0);
        assertThat(all).extracting(StoredEvent::sequence).isSorted();
    }
}
