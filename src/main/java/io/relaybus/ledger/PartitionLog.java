package io.relaybus.ledger;

import io.relaybus.core.model.Event;
import lombok.Getter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.LongAdder;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.LongFunction;

/**
 * Append-only event log of a single topic partition.
 * <p>
 * {@code highWatermark} is the next offset to assign, {@code lowWatermark} the oldest retained offset.
 * Appends take the partition lock, so two appends to the same partition complete with offsets in call
 * order. Reads never take the lock and never mutate state.
 * </p>
 */
public final class PartitionLog {

    @Getter private final String topic;
    @Getter private final int partition;

    private final ConcurrentSkipListMap<Long, Event> log = new ConcurrentSkipListMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    private volatile long lowWatermark;
    private volatile long highWatermark;

    private final LongAdder messageCount = new LongAdder();
    private final LongAdder bytesTotal = new LongAdder();

    public PartitionLog(final String topic, final int partition) {
        if (partition < 0) throw new IllegalArgumentException("partition must be >= 0");
        this.topic = topic;
        this.partition = partition;
    }

    /**
     * Appends the event built by {@code factory} at the current high watermark.
     *
     * @param factory receives the assigned offset and returns the event to store
     * @return the stored event
     */
    public Event append(final LongFunction<Event> factory) {
        return append(factory, Function.identity());
    }

    /**
     * Appends the event built by {@code factory} and runs {@code onAppended} before releasing the partition
     * lock, so whatever {@code onAppended} records for this partition is recorded in offset order.
     * {@code onAppended} must not block or call back into the bus.
     */
    public <R> R append(final LongFunction<Event> factory, final Function<Event, R> onAppended) {
        lock.lock();
        try {
            final long offset = highWatermark;
            final Event event = factory.apply(offset);
            if (event.offset() != offset || event.partition() != partition) {
                throw new IllegalStateException("event " + event.eventId() + " built for "
                        + event.partition() + "@" + event.offset() + " but slot is " + partition + "@" + offset);
            }

            log.put(offset, event);
            highWatermark = offset + 1;
            messageCount.increment();
            bytesTotal.add(event.sizeBytes());

            return onAppended.apply(event);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the retained events with {@code fromOffset <= offset <= toOffsetInclusive}, in offset order.
     * A {@code fromOffset} below the low watermark starts at the oldest retained event; a null upper bound
     * reads up to the high watermark.
     */
    public List<Event> read(final long fromOffset, final Long toOffsetInclusive) {
        final long hwm = highWatermark;
        final long from = Math.max(fromOffset, lowWatermark);
        final long to = toOffsetInclusive == null ? hwm - 1 : Math.min(toOffsetInclusive, hwm - 1);
        if (from > to) {
            return List.of();
        }
        return List.copyOf(log.subMap(from, true, to, true).values());
    }

    public Event get(final long offset) {
        return log.get(offset);
    }

    /**
     * Drops events older than {@code cutoff} from the head of the log and advances the low watermark.
     *
     * @return number of events removed
     */
    public int truncateOlderThan(final Instant cutoff) {
        lock.lock();
        try {
            int removed = 0;
            final Iterator<Map.Entry<Long, Event>> it = log.entrySet().iterator();
            while (it.hasNext()) {
                final Event head = it.next().getValue();
                if (!head.timestamp().isBefore(cutoff)) break;
                it.remove();
                removed++;
            }
            refreshLowWatermark();
            return removed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Keeps only the newest event per routing key. Keyless events are never compacted away and the
     * offsets of kept events do not change.
     *
     * @return number of events removed
     */
    public int compact() {
        lock.lock();
        try {
            final Map<String, Long> latest = new HashMap<>();
            for (final Event e : log.values()) {
                if (e.hasKey()) latest.put(e.key(), e.offset());
            }

            final List<Long> superseded = new ArrayList<>();
            for (final Event e : log.values()) {
                if (e.hasKey() && latest.get(e.key()) != e.offset()) superseded.add(e.offset());
            }
            superseded.forEach(log::remove);

            refreshLowWatermark();
            return superseded.size();
        } finally {
            lock.unlock();
        }
    }

    private void refreshLowWatermark() {
        final Map.Entry<Long, Event> first = log.firstEntry();
        lowWatermark = first == null ? highWatermark : first.getKey();
    }

    public long lowWatermark() {
        return lowWatermark;
    }

    public long highWatermark() {
        return highWatermark;
    }

    public long messageCount() {
        return messageCount.sum();
    }

    public long bytesTotal() {
        return bytesTotal.sum();
    }

    public int retainedCount() {
        return log.size();
    }
}
