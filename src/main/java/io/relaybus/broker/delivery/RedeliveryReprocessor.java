package io.relaybus.broker.delivery;

import io.relaybus.broker.subscription.DeliveryMode;
import io.relaybus.broker.subscription.Subscription;
import io.relaybus.broker.subscription.SubscriptionRegistry;
import io.relaybus.core.model.Event;
import io.relaybus.deadletter.DeadLetterMessage;
import io.relaybus.deadletter.Reprocessor;
import io.relaybus.error.InvalidStateException;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;

/**
 * Retries a dead-lettered event by handing it back to the subscription whose handler rejected it.
 * A successful redelivery is committed under the subscription's ack mode like a live delivery.
 */
@Slf4j
public final class RedeliveryReprocessor implements Reprocessor {
    private final SubscriptionRegistry subscriptions;
    private final OffsetCommitter committer;

    public RedeliveryReprocessor(final SubscriptionRegistry subscriptions, final OffsetCommitter committer) {
        this.subscriptions = Objects.requireNonNull(subscriptions, "subscriptions");
        this.committer = Objects.requireNonNull(committer, "committer");
    }

    @Override
    public void reprocess(final DeadLetterMessage message) throws Exception {
        final Event event = message.originalEvent()
                .orElseThrow(() -> new InvalidStateException(
                        "message " + message.getMessageId() + " was captured without an event, nothing to redeliver"));
        final Subscription sub = subscriptions.find(message.getSubscriptionId())
                .orElseThrow(() -> new InvalidStateException(
                        "subscription '" + message.getSubscriptionId() + "' of message " + message.getMessageId() + " is gone"));
        if (!sub.isActive()) {
            throw new InvalidStateException("subscription " + sub.getSubscriptionId() + " is " + sub.getState());
        }

        if (sub.getDeliveryMode() == DeliveryMode.EXACTLY_ONCE && sub.wasHandled(event.eventId())) {
            log.debug("Event {} already handled by {}, skipping redelivery", event.eventId(), sub.getSubscriptionId());
            return;
        }

        log.debug("Redelivering {}/{}@{} to {}", event.topic(), event.partition(), event.offset(), sub.getSubscriptionId());
        sub.getHandler().handle(event);
        sub.recordReceived();
        if (sub.getDeliveryMode() == DeliveryMode.EXACTLY_ONCE) {
            sub.markHandled(event.eventId());
        }
        committer.afterHandled(sub, event);
    }
}
