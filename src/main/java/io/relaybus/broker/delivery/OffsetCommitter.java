package io.relaybus.broker.delivery;

import io.relaybus.broker.subscription.DeliveryMode;
import io.relaybus.broker.subscription.Subscription;
import io.relaybus.core.model.Event;
import io.relaybus.core.model.Topic;
import io.relaybus.error.InvalidStateException;
import io.relaybus.offset.OffsetStore;
import io.relaybus.registry.TopicRegistry;

import java.util.Objects;

/**
 * Commits consumed offsets for subscriptions and, for grouped subscriptions, for their group.
 * <p>
 * Shared by live delivery and by dead-letter redelivery so both follow the same ack-mode rules.
 * </p>
 */
public final class OffsetCommitter {
    private final TopicRegistry topics;
    private final OffsetStore offsets;

    public OffsetCommitter(final TopicRegistry topics, final OffsetStore offsets) {
        this.topics = Objects.requireNonNull(topics, "topics");
        this.offsets = Objects.requireNonNull(offsets, "offsets");
    }

    /**
     * Marks everything up to and including {@code offset} as processed.
     *
     * @return true if the subscription's committed offset moved forward
     * @throws InvalidStateException               if {@code offset} has not been appended yet
     * @throws io.relaybus.error.NotFoundException if the topic or partition does not exist
     */
    public boolean acknowledge(final Subscription sub, final int partition, final long offset) {
        final Topic topic = topics.require(sub.getTopic());
        final long hwm = topic.partition(partition).highWatermark();
        if (offset < 0 || offset >= hwm) {
            throw new InvalidStateException("offset " + offset + " is outside " + sub.getTopic() + "/" + partition
                    + " (high watermark " + hwm + ")");
        }

        final boolean advanced = sub.commit(partition, offset);
        if (advanced && sub.isGrouped()) {
            offsets.commit(sub.getTopic(), sub.getConsumerGroup(), partition, offset + 1);
        }
        return advanced;
    }

    /** Commits ahead of the handler when the subscription accepts losing events. */
    void beforeHandling(final Subscription sub, final Event event) {
        if (sub.getDeliveryMode() == DeliveryMode.AT_MOST_ONCE) {
            acknowledge(sub, event.partition(), event.offset());
        }
    }

    /** Applies the subscription's ack mode once the handler returned normally. */
    void afterHandled(final Subscription sub, final Event event) {
        switch (sub.getAckMode()) {
            case AUTO -> acknowledge(sub, event.partition(), event.offset());
            case BATCH -> {
                if (sub.batchTick(event.partition())) {
                    acknowledge(sub, event.partition(), event.offset());
                }
            }
            case MANUAL -> {
                // left to the caller
            }
        }
    }
}
