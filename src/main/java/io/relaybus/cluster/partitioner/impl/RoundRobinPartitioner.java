package io.relaybus.cluster.partitioner.impl;

import io.relaybus.cluster.partitioner.Partitioner;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@code RoundRobinPartitioner} spreads keyless events evenly across partitions by publish count.
 * <p>
 * Keyed events still go through {@link KeyHashPartitioner} so per-key ordering holds. The counter is
 * per instance; the bus creates one instance per topic, which makes the sequence deterministic per topic.
 * </p>
 */
public final class RoundRobinPartitioner implements Partitioner {

    private final AtomicInteger counter = new AtomicInteger(0);
    private final KeyHashPartitioner keyed = new KeyHashPartitioner();

    @Override
    public int selectPartition(final byte[] key, final int totalPartitions) {
        if (key != null && key.length > 0) {
            return keyed.selectPartition(key, totalPartitions);
        }

        final int idx = counter.getAndIncrement();

        // floorMod handles wrap and negative values safely
        return Math.floorMod(idx, totalPartitions);
    }
}
