package io.relaybus.broker.delivery;

import io.relaybus.broker.subscription.DeliveryMode;
import io.relaybus.broker.subscription.Subscription;
import io.relaybus.core.model.Event;
import io.relaybus.deadletter.DeadLetterMessage;
import io.relaybus.deadletter.DeadLetterQueue;
import io.relaybus.deadletter.DeadLetterQueueManager;
import io.relaybus.deadletter.FailedDelivery;
import io.relaybus.error.EventBusException;
import lombok.extern.slf4j.Slf4j;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Objects;
import java.util.Optional;

/**
 * Sends events whose handler failed to the dead-letter queue bound to their topic and group.
 * <p>
 * Resolution order: a queue bound to (topic, group), then a queue bound to the topic with no group, then a
 * queue named {@code <topic>.DLQ}.
 * </p>
 */
@Slf4j
public final class DeadLetterRouter {
    public static final String DLQ_SUFFIX = ".DLQ";

    private final DeadLetterQueueManager deadLetters;

    public DeadLetterRouter(final DeadLetterQueueManager deadLetters) {
        this.deadLetters = Objects.requireNonNull(deadLetters, "deadLetters");
    }

    public Optional<DeadLetterQueue> resolve(final String topic, final String consumerGroup) {
        DeadLetterQueue topicWide = null;
        for (final DeadLetterQueue q : deadLetters.queues()) {
            if (!q.getSourceTopic().equals(topic)) continue;
            if (!consumerGroup.isEmpty() && q.getSourceConsumerGroup().equals(consumerGroup)) {
                return Optional.of(q);
            }
            if (q.getSourceConsumerGroup().isEmpty() && topicWide == null) {
                topicWide = q;
            }
        }
        if (topicWide != null) {
            return Optional.of(topicWide);
        }
        return deadLetters.queue(topic + DLQ_SUFFIX);
    }

    /**
     * Captures a delivery whose handler threw.
     *
     * @return the captured message, or empty when no queue takes it
     */
    public Optional<DeadLetterMessage> route(final Subscription sub,
                                             final Event event,
                                             final Throwable error,
                                             final String errorCode) {
        return route(sub, event, describe(error), errorCode, stackTrace(error));
    }

    /** Captures a delivery the consumer rejected explicitly. */
    public Optional<DeadLetterMessage> route(final Subscription sub,
                                             final Event event,
                                             final String errorMessage,
                                             final String errorCode) {
        return route(sub, event, errorMessage, errorCode, "");
    }

    private Optional<DeadLetterMessage> route(final Subscription sub,
                                              final Event event,
                                              final String errorMessage,
                                              final String errorCode,
                                              final String stackTrace) {
        final Optional<DeadLetterQueue> queue = resolve(event.topic(), sub.getConsumerGroup());
        if (queue.isEmpty()) {
            log.warn("No dead-letter queue for {}/{}@{} (subscription {}), dropping failure: {}",
                    event.topic(), event.partition(), event.offset(), sub.getSubscriptionId(), errorMessage);
            return Optional.empty();
        }

        final FailedDelivery failure = FailedDelivery.forEvent(event)
                .errorMessage(errorMessage == null ? "unknown error" : errorMessage)
                .errorCode(errorCode == null ? "" : errorCode)
                .stackTrace(stackTrace)
                .sourceService(sub.getName())
                .consumerGroup(sub.getConsumerGroup())
                .subscriptionId(sub.getSubscriptionId())
                .retryable(sub.getDeliveryMode() != DeliveryMode.AT_MOST_ONCE)
                .build();

        try {
            return Optional.of(deadLetters.capture(queue.get().getName(), failure));
        } catch (final EventBusException e) {
            log.warn("Dead-letter capture into {} failed for {}/{}@{}: {}",
                    queue.get().getName(), event.topic(), event.partition(), event.offset(), e.getMessage());
            return Optional.empty();
        }
    }

    static String describe(final Throwable error) {
        if (error == null) return "unknown error";
        return error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
    }

    private static String stackTrace(final Throwable error) {
        if (error == null) return "";
        final StringWriter out = new StringWriter();
        error.printStackTrace(new PrintWriter(out));
        return out.toString();
    }
}
