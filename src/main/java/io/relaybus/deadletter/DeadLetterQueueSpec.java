package io.relaybus.deadletter;

import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;

import java.time.Duration;

/** Creation parameters of a dead-letter queue. */
@Getter
@Builder
public final class DeadLetterQueueSpec {
    @NonNull private final String name;

    /** Topic whose failures land here; empty for a queue fed only by explicit captures. */
    @Builder.Default private final String sourceTopic = "";
    /** Consumer group whose failures land here; empty matches standalone subscriptions and any group. */
    @Builder.Default private final String sourceConsumerGroup = "";

    @Builder.Default private final int maxSize = 10_000;
    @Builder.Default private final Duration retention = Duration.ofHours(168);
    @Builder.Default private final RetryStrategy retryStrategy = RetryStrategy.EXPONENTIAL;
    @Builder.Default private final int maxRetries = 3;
}
