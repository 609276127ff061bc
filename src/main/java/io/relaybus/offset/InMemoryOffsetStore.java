package io.relaybus.offset;

import java.util.Arrays;
import java.util.concurrent.ConcurrentHashMap;

/*
 * In-memory OffsetStore.
 *
 * topicMap: topic -> TopicState
 * TopicState.groups: group -> PartitionOffsets
 * PartitionOffsets.offsets: long[] indexed by partition, -1 meaning "never set"
 *
 * Commits on one (topic, group) pair serialize on its PartitionOffsets; unrelated groups never contend.
 */
public final class InMemoryOffsetStore implements OffsetStore {

    private static final long UNSET = -1L;

    private static final class TopicState {
        final ConcurrentHashMap<String, PartitionOffsets> groups = new ConcurrentHashMap<>();
    }

    private static final class PartitionOffsets {
        private long[] offsets = newArray(16);

        synchronized long get(final int partition) {
            return (partition >= 0 && partition < offsets.length) ? offsets[partition] : UNSET;
        }

        synchronized boolean advance(final int partition, final long value) {
            ensureCapacity(partition + 1);
            if (value <= offsets[partition]) {
                return false;
            }
            offsets[partition] = value;
            return true;
        }

        synchronized void setIfUnset(final int partition, final long value) {
            ensureCapacity(partition + 1);
            if (offsets[partition] == UNSET) {
                offsets[partition] = value;
            }
        }

        private void ensureCapacity(final int minSize) {
            if (offsets.length >= minSize) return;
            int newSize = offsets.length;
            while (newSize < minSize) {
                newSize <<= 1;
            }
            final long[] bigger = newArray(newSize);
            System.arraycopy(offsets, 0, bigger, 0, offsets.length);
            offsets = bigger;
        }

        private static long[] newArray(final int size) {
            final long[] arr = new long[size];
            Arrays.fill(arr, UNSET);
            return arr;
        }
    }

    private final ConcurrentHashMap<String, TopicState> topicMap = new ConcurrentHashMap<>();

    private PartitionOffsets partitionOffsets(final String topic, final String group) {
        return topicMap.computeIfAbsent(topic, t -> new TopicState())
                .groups.computeIfAbsent(group, g -> new PartitionOffsets());
    }

    @Override
    public boolean commit(final String topic, final String group, final int partition, final long offset) {
        if (partition < 0) throw new IllegalArgumentException("partition must be >= 0");
        if (offset < 0) throw new IllegalArgumentException("offset must be >= 0");
        return partitionOffsets(topic, group).advance(partition, offset);
    }

    @Override
    public long fetch(final String topic, final String group, final int partition) {
        final TopicState ts = topicMap.get(topic);
        if (ts == null) return 0L;
        final PartitionOffsets po = ts.groups.get(group);
        if (po == null) return 0L;
        final long value = po.get(partition);
        return value == UNSET ? 0L : value;
    }

    @Override
    public void initialize(final String topic, final String group, final int partition, final long offset) {
        if (partition < 0) throw new IllegalArgumentException("partition must be >= 0");
        partitionOffsets(topic, group).setIfUnset(partition, offset);
    }

    @Override
    public void remove(final String topic, final String group) {
        final TopicState ts = topicMap.get(topic);
        if (ts != null) {
            ts.groups.remove(group);
        }
    }
}
