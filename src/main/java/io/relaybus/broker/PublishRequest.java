package io.relaybus.broker;

import io.relaybus.core.model.EventPriority;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;

import java.time.Duration;
import java.util.Map;

/**
 * Everything a publisher supplies; the bus fills in identity, partition, offset and timestamp.
 */
@Getter
@Builder
public final class PublishRequest {
    @NonNull private final String topic;
    @NonNull private final String type;
    @Builder.Default private final byte[] payload = new byte[0];
    /** Routing key; empty routes to the topic's partitioner default. */
    @Builder.Default private final String key = "";
    @Builder.Default private final Map<String, String> headers = Map.of();
    @Builder.Default private final EventPriority priority = EventPriority.NORMAL;
    @Builder.Default private final String source = "";
    @Builder.Default private final String correlationId = "";
    @Builder.Default private final String causationId = "";
    /** Time to live; null for events that never expire. */
    private final Duration ttl;
}
