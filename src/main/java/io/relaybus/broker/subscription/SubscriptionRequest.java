package io.relaybus.broker.subscription;

import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;

import java.util.Set;

/**
 * Parameters of a new subscription. Only {@code topic}, {@code name} and {@code handler} are required.
 */
@Getter
@Builder
public final class SubscriptionRequest {
    @NonNull private final String topic;
    @NonNull private final String name;
    @NonNull private final EventHandler handler;

    /** Empty for a standalone subscription. */
    @Builder.Default private final String consumerGroup = "";
    @Builder.Default private final DeliveryMode deliveryMode = DeliveryMode.AT_LEAST_ONCE;
    @Builder.Default private final AckMode ackMode = AckMode.MANUAL;
    @Builder.Default private final int ackBatchSize = 10;

    /** Event types to accept; empty accepts every type. */
    @Builder.Default private final Set<String> eventTypes = Set.of();

    /** Substring the routing key must contain; empty accepts every key. */
    @Builder.Default private final String keyFilter = "";
}
