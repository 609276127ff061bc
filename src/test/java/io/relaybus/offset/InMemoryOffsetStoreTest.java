package io.relaybus.offset;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

final class InMemoryOffsetStoreTest {

    @Test
    void commitsAreKeptPerTopicGroupAndPartition() {
        final InMemoryOffsetStore store = new InMemoryOffsetStore();

        store.commit("orders", "g1", 0, 5L);
        store.commit("orders", "g1", 20, 7L); // forces partition array growth
        store.commit("orders", "g2", 1, 9L);

        assertEquals(5L, store.fetch("orders", "g1", 0));
        assertEquals(7L, store.fetch("orders", "g1", 20));
        assertEquals(9L, store.fetch("orders", "g2", 1));
        assertEquals(0L, store.fetch("orders", "g2", 0));
        assertEquals(0L, store.fetch("payments", "g1", 0));
    }

    @Test
    void commitsNeverMoveBackwards() {
        final InMemoryOffsetStore store = new InMemoryOffsetStore();

        assertTrue(store.commit("t", "g", 0, 10L));
        assertFalse(store.commit("t", "g", 0, 4L));
        assertFalse(store.commit("t", "g", 0, 10L));

        assertEquals(10L, store.fetch("t", "g", 0));
    }

    @Test
    void initializeOnlySeedsUnsetPartitions() {
        final InMemoryOffsetStore store = new InMemoryOffsetStore();

        store.initialize("t", "g", 0, 3L);
        store.commit("t", "g", 1, 8L);
        store.initialize("t", "g", 1, 2L);
        store.initialize("t", "g", 0, 6L);

        assertEquals(3L, store.fetch("t", "g", 0));
        assertEquals(8L, store.fetch("t", "g", 1));
    }

    @Test
    void removeForgetsTheGroup() {
        final InMemoryOffsetStore store = new InMemoryOffsetStore();
        store.commit("t", "g", 0, 4L);
        store.commit("t", "other", 0, 2L);

        store.remove("t", "g");

        assertEquals(0L, store.fetch("t", "g", 0));
        assertEquals(2L, store.fetch("t", "other", 0));
    }

    @Test
    void concurrentCommitsKeepTheHighestOffset() throws Exception {
        final InMemoryOffsetStore store = new InMemoryOffsetStore();
        final ExecutorService pool = Executors.newFixedThreadPool(4);
        final CountDownLatch done = new CountDownLatch(1_000);

        IntStream.range(0, 1_000).forEach(i -> pool.submit(() -> {
            store.commit("t", "g", i % 4, i);
            done.countDown();
        }));

        assertTrue(done.await(5, TimeUnit.SECONDS));
        pool.shutdownNow();

        assertEquals(996L, store.fetch("t", "g", 0));
        assertEquals(999L, store.fetch("t", "g", 3));
    }
}
