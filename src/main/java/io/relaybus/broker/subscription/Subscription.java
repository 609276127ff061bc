package io.relaybus.broker.subscription;

import io.relaybus.core.model.Event;
import lombok.AccessLevel;
import lombok.Getter;

import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.LongAdder;

/**
 * A registered consumer of one topic.
 * <p>
 * Committed offsets are exclusive (the next offset to process) and only move forward. Offset and batch
 * bookkeeping is guarded by the subscription's own monitor; counters are lock-free.
 * </p>
 */
@Getter
public final class Subscription {

    /* Event ids remembered for EXACTLY_ONCE de-duplication. */
    private static final int HANDLED_ID_WINDOW = 10_000;

    private final String subscriptionId;
    private final String name;
    private final String topic;
    private final String consumerGroup;
    private final DeliveryMode deliveryMode;
    private final AckMode ackMode;
    private final int ackBatchSize;
    private final Set<String> eventTypes;
    private final String keyFilter;
    private final EventHandler handler;
    private final Instant createdAt;

    private volatile SubscriptionState state = SubscriptionState.ACTIVE;

    @Getter(AccessLevel.NONE)
    private final Map<Integer, Long> committedOffsets = new HashMap<>();
    @Getter(AccessLevel.NONE)
    private final Map<Integer, Integer> uncommittedInBatch = new HashMap<>();
    @Getter(AccessLevel.NONE)
    private final Map<String, Boolean> handledIds = new LinkedHashMap<>(16, 0.75f, false) {
        @Override
        protected boolean removeEldestEntry(final Map.Entry<String, Boolean> eldest) {
            return size() > HANDLED_ID_WINDOW;
        }
    };

    @Getter(AccessLevel.NONE)
    private final LongAdder received = new LongAdder();
    @Getter(AccessLevel.NONE)
    private final LongAdder acknowledged = new LongAdder();
    @Getter(AccessLevel.NONE)
    private final LongAdder rejected = new LongAdder();

    public Subscription(final SubscriptionRequest request, final Instant createdAt) {
        Objects.requireNonNull(request, "request");
        if (request.getAckBatchSize() < 1) {
            throw new IllegalArgumentException("ackBatchSize must be >= 1");
        }
        this.subscriptionId = "sub-" + UUID.randomUUID();
        this.name = request.getName();
        this.topic = request.getTopic();
        this.consumerGroup = request.getConsumerGroup() == null ? "" : request.getConsumerGroup();
        this.deliveryMode = request.getDeliveryMode();
        this.ackMode = request.getAckMode();
        this.ackBatchSize = request.getAckBatchSize();
        this.eventTypes = Set.copyOf(request.getEventTypes());
        this.keyFilter = request.getKeyFilter() == null ? "" : request.getKeyFilter();
        this.handler = request.getHandler();
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
    }

    public boolean isActive() {
        return state == SubscriptionState.ACTIVE;
    }

    public boolean isGrouped() {
        return !consumerGroup.isEmpty();
    }

    public void state(final SubscriptionState state) {
        this.state = Objects.requireNonNull(state, "state");
    }

    /** Event-type and key-substring filters. */
    public boolean matches(final Event event) {
        if (!eventTypes.isEmpty() && !eventTypes.contains(event.type())) {
            return false;
        }
        return keyFilter.isEmpty() || event.key().contains(keyFilter);
    }

    /** Seeds the committed offset of a partition this subscription has never committed on. */
    public synchronized void initializeOffset(final int partition, final long offset) {
        committedOffsets.putIfAbsent(partition, offset);
    }

    /**
     * Records that everything up to and including {@code offset} was processed.
     *
     * @return true if the committed offset moved forward; acknowledging an older offset is a no-op
     */
    public synchronized boolean commit(final int partition, final long offset) {
        final long current = committedOffsets.getOrDefault(partition, 0L);
        if (offset < current) {
            return false;
        }
        committedOffsets.put(partition, offset + 1);
        uncommittedInBatch.remove(partition);
        acknowledged.increment();
        return true;
    }

    /**
     * Counts a handled event towards the partition's batch.
     *
     * @return true when the batch is full and should be committed
     */
    public synchronized boolean batchTick(final int partition) {
        final int pending = uncommittedInBatch.merge(partition, 1, Integer::sum);
        return pending >= ackBatchSize;
    }

    public synchronized long committedOffset(final int partition) {
        return committedOffsets.getOrDefault(partition, 0L);
    }

    public synchronized Map<Integer, Long> committedOffsets() {
        return Map.copyOf(committedOffsets);
    }

    /** @return false if the event id was already handled and must not be handed over again */
    public synchronized boolean markHandled(final String eventId) {
        return handledIds.put(eventId, Boolean.TRUE) == null;
    }

    public synchronized boolean wasHandled(final String eventId) {
        return handledIds.containsKey(eventId);
    }

    public void recordReceived() {
        received.increment();
    }

    public void recordRejected() {
        rejected.increment();
    }

    public long received() {
        return received.sum();
    }

    public long acknowledged() {
        return acknowledged.sum();
    }

    public long rejected() {
        return rejected.sum();
    }
}
