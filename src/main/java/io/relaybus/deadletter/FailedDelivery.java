package io.relaybus.deadletter;

import io.relaybus.core.model.Event;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;

import java.util.Map;

/**
 * Everything the dead-letter manager records about one failure. Built either from an {@link Event}
 * ({@link #forEvent(Event)}) or from raw fields for failures that never went through the bus.
 */
@Getter
@Builder
public final class FailedDelivery {
    /** Null for raw captures. */
    private final Event event;

    @NonNull private final String topic;
    @Builder.Default private final int partition = 0;
    @Builder.Default private final long offset = 0L;
    @Builder.Default private final String key = "";
    @Builder.Default private final byte[] payload = new byte[0];
    @Builder.Default private final Map<String, String> headers = Map.of();

    @NonNull private final String errorMessage;
    @Builder.Default private final String errorCode = "";
    @Builder.Default private final String stackTrace = "";
    @Builder.Default private final String sourceService = "";
    @Builder.Default private final String consumerGroup = "";
    /** Subscription whose handler failed, empty for raw captures. */
    @Builder.Default private final String subscriptionId = "";
    /** False pins the message's retry cap to zero: it can be inspected and discarded, never retried. */
    @Builder.Default private final boolean retryable = true;

    /** Starts a builder pre-filled with the event's routing identity, payload and headers. */
    public static FailedDeliveryBuilder forEvent(final Event event) {
        return FailedDelivery.builder()
                .event(event)
                .topic(event.topic())
                .partition(event.partition())
                .offset(event.offset())
                .key(event.key())
                .payload(event.payload())
                .headers(event.headers());
    }
}
