package io.relaybus.cluster.partitioner;

/**
 * The {@code Partitioner} interface defines a strategy for determining which partition an event should be routed to.
 * Implementations provide different partitioning algorithms, such as key-based hashing or round-robin assignment.
 * <p>
 * The bus keeps one partitioner instance per topic, so stateful strategies are deterministic per topic.
 * </p>
 */
public interface Partitioner {
    /**
     * Selects the partition index for an event based on its routing key and the total number of partitions.
     *
     * @param key             the routing key as UTF-8 bytes (may be empty or null)
     * @param totalPartitions total number of partitions of the topic, always at least 1
     * @return the partition index in the range [0..totalPartitions)
     */
    int selectPartition(byte[] key, int totalPartitions);
}
