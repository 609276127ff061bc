package io.relaybus.cluster.partitioner.impl;

import io.relaybus.cluster.partitioner.Partitioner;

import java.util.Arrays;

/**
 * {@code KeyHashPartitioner} assigns events to partitions based on the hash of their routing key, so all
 * events with the same key land in the same partition and are delivered in publish order.
 * <p>
 * If the key is {@code null} or empty, partition 0 is selected. The hash is {@link Arrays#hashCode(byte[])}
 * over the key bytes, which depends only on the bytes themselves and is therefore stable across process
 * restarts. {@link Math#floorMod(int, int)} keeps the index non-negative.
 * </p>
 */
public final class KeyHashPartitioner implements Partitioner {

    @Override
    public int selectPartition(final byte[] key, final int totalPartitions) {
        if (key == null || key.length == 0) {
            return 0;
        }

        return Math.floorMod(Arrays.hashCode(key), totalPartitions);
    }
}
