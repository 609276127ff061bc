package io.relaybus.deadletter;

import lombok.AccessLevel;
import lombok.Getter;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * A bounded holding area for failed deliveries. {@code messageCount} counts live messages (pending or
 * processing) and {@code liveMessageIds} lists them in capture order; the {@code total*} counters are
 * cumulative.
 */
@Getter
public final class DeadLetterQueue {
    private final String queueId;
    private final String name;
    private final String sourceTopic;
    private final String sourceConsumerGroup;
    private final int maxSize;
    private final Duration retention;
    private final RetryStrategy retryStrategy;
    private final int maxRetries;
    private final Instant createdAt;

    private volatile DeadLetterQueueState state = DeadLetterQueueState.ACTIVE;
    private volatile Instant lastActivity;

    @Getter(AccessLevel.NONE) private final AtomicLong messageCount = new AtomicLong();
    @Getter(AccessLevel.NONE) private final LongAdder totalReceived = new LongAdder();
    @Getter(AccessLevel.NONE) private final LongAdder totalReprocessed = new LongAdder();
    @Getter(AccessLevel.NONE) private final LongAdder totalDiscarded = new LongAdder();
    @Getter(AccessLevel.NONE) private final LongAdder totalExpired = new LongAdder();
    @Getter(AccessLevel.NONE) private final ConcurrentLinkedQueue<String> liveMessageIds = new ConcurrentLinkedQueue<>();

    DeadLetterQueue(final DeadLetterQueueSpec spec, final Instant createdAt) {
        Objects.requireNonNull(spec, "spec");
        if (spec.getMaxSize() < 1) throw new IllegalArgumentException("maxSize must be >= 1");
        if (spec.getMaxRetries() < 0) throw new IllegalArgumentException("maxRetries must be >= 0");

        this.queueId = "dlq-" + UUID.randomUUID();
        this.name = spec.getName();
        this.sourceTopic = spec.getSourceTopic() == null ? "" : spec.getSourceTopic();
        this.sourceConsumerGroup = spec.getSourceConsumerGroup() == null ? "" : spec.getSourceConsumerGroup();
        this.maxSize = spec.getMaxSize();
        this.retention = Objects.requireNonNull(spec.getRetention(), "retention");
        this.retryStrategy = Objects.requireNonNull(spec.getRetryStrategy(), "retryStrategy");
        this.maxRetries = spec.getMaxRetries();
        this.createdAt = createdAt;
        this.lastActivity = createdAt;
    }

    public boolean isActive() {
        return state == DeadLetterQueueState.ACTIVE;
    }

    void state(final DeadLetterQueueState state) {
        this.state = Objects.requireNonNull(state, "state");
    }

    /** Claims a slot for a new message, or returns false if the queue is full. */
    boolean tryReserve() {
        while (true) {
            final long current = messageCount.get();
            if (current >= maxSize) return false;
            if (messageCount.compareAndSet(current, current + 1)) return true;
        }
    }

    void accepted(final String messageId, final Instant now) {
        liveMessageIds.add(messageId);
        totalReceived.increment();
        lastActivity = now;
    }

    void reprocessed(final String messageId, final Instant now) {
        release(messageId);
        totalReprocessed.increment();
        lastActivity = now;
    }

    void discarded(final String messageId, final Instant now) {
        release(messageId);
        totalDiscarded.increment();
        lastActivity = now;
    }

    void expired(final String messageId, final Instant now) {
        release(messageId);
        totalExpired.increment();
        lastActivity = now;
    }

    private void release(final String messageId) {
        if (liveMessageIds.remove(messageId)) {
            messageCount.decrementAndGet();
        }
    }

    /** Ids of the pending and processing messages, oldest first. */
    List<String> liveMessageIds() {
        return List.copyOf(liveMessageIds);
    }

    public long messageCount() {
        return messageCount.get();
    }

    public long totalReceived() {
        return totalReceived.sum();
    }

    public long totalReprocessed() {
        return totalReprocessed.sum();
    }

    public long totalDiscarded() {
        return totalDiscarded.sum();
    }

    public long totalExpired() {
        return totalExpired.sum();
    }
}
