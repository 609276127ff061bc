package io.relaybus.core.model;

import io.relaybus.cluster.partitioner.Partitioner;
import io.relaybus.error.NotFoundException;
import io.relaybus.ledger.PartitionLog;
import lombok.Getter;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * A named, partitioned event stream. Configuration is fixed at creation; only the state and the
 * counters of its partitions change afterwards.
 */
@Getter
public final class Topic {
    private final String topicId;
    private final String name;
    private final Duration retention;
    private final boolean compaction;
    private final Instant createdAt;
    private final List<PartitionLog> partitions;
    private final Partitioner partitioner;

    private volatile TopicState state = TopicState.ACTIVE;

    public Topic(final String name,
                 final int partitionCount,
                 final Duration retention,
                 final boolean compaction,
                 final Partitioner partitioner,
                 final Instant createdAt) {
        if (partitionCount < 1) {
            throw new IllegalArgumentException("topic " + name + " needs at least one partition, got " + partitionCount);
        }
        this.topicId = "topic-" + UUID.randomUUID();
        this.name = Objects.requireNonNull(name, "name");
        this.retention = Objects.requireNonNull(retention, "retention");
        this.compaction = compaction;
        this.partitioner = Objects.requireNonNull(partitioner, "partitioner");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");

        final List<PartitionLog> logs = new ArrayList<>(partitionCount);
        for (int i = 0; i < partitionCount; i++) {
            logs.add(new PartitionLog(name, i));
        }
        this.partitions = List.copyOf(logs);
    }

    public int partitionCount() {
        return partitions.size();
    }

    /** @throws NotFoundException if the topic has no such partition */
    public PartitionLog partition(final int partition) {
        if (partition < 0 || partition >= partitions.size()) {
            throw new NotFoundException("partition", name + "/" + partition);
        }
        return partitions.get(partition);
    }

    /** Routes a key to its partition index. */
    public int partitionFor(final String key) {
        final byte[] bytes = key == null ? null : key.getBytes(StandardCharsets.UTF_8);
        return partitioner.selectPartition(bytes, partitions.size());
    }

    public boolean isActive() {
        return state == TopicState.ACTIVE;
    }

    public void state(final TopicState state) {
        this.state = Objects.requireNonNull(state, "state");
    }

    public long messageCount() {
        return partitions.stream().mapToLong(PartitionLog::messageCount).sum();
    }

    public long bytesTotal() {
        return partitions.stream().mapToLong(PartitionLog::bytesTotal).sum();
    }
}
