package io.relaybus.cluster.partitioner.impl;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

final class KeyHashPartitionerTest {

    private final KeyHashPartitioner partitioner = new KeyHashPartitioner();

    @Test
    void emptyOrNullKeyGoesToPartitionZero() {
        assertEquals(0, partitioner.selectPartition(null, 8));
        assertEquals(0, partitioner.selectPartition(new byte[0], 8));
    }

    @Test
    void sameKeyAlwaysSamePartition() {
        final byte[] key = "customer-42".getBytes(StandardCharsets.UTF_8);
        final int first = partitioner.selectPartition(key, 16);

        for (int i = 0; i < 100; i++) {
            assertEquals(first, new KeyHashPartitioner().selectPartition(key.clone(), 16));
        }
    }

    @Test
    void indexIsAlwaysInRange() {
        for (int i = 0; i < 1_000; i++) {
            final byte[] key = ("k" + i).getBytes(StandardCharsets.UTF_8);
            final int p = partitioner.selectPartition(key, 7);
            assertTrue(p >= 0 && p < 7, "partition " + p + " out of range");
        }
    }

    @Test
    void singlePartitionTakesEverything() {
        assertEquals(0, partitioner.selectPartition("anything".getBytes(StandardCharsets.UTF_8), 1));
    }
}
