package io.relaybus.core.model;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * An event appended to a topic partition. Immutable once created: the payload is copied on the way in
 * and on the way out, headers are an unmodifiable copy.
 *
 * @param key       routing key, empty when the event was published without one
 * @param expiresAt may be null when the event never expires
 */
public record Event(String eventId,
                    String topic,
                    int partition,
                    long offset,
                    String type,
                    String key,
                    byte[] payload,
                    Map<String, String> headers,
                    EventPriority priority,
                    String source,
                    String correlationId,
                    String causationId,
                    Instant timestamp,
                    Instant expiresAt) {

    public Event {
        Objects.requireNonNull(eventId, "eventId");
        Objects.requireNonNull(topic, "topic");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(timestamp, "timestamp");
        if (partition < 0) throw new IllegalArgumentException("partition must be >= 0");
        if (offset < 0) throw new IllegalArgumentException("offset must be >= 0");

        key = key == null ? "" : key;
        payload = payload == null ? new byte[0] : payload.clone();
        headers = headers == null ? Map.of() : Map.copyOf(headers);
        priority = priority == null ? EventPriority.NORMAL : priority;
        source = source == null ? "" : source;
        correlationId = correlationId == null ? "" : correlationId;
        causationId = causationId == null ? "" : causationId;
    }

    @Override
    public byte[] payload() {
        return payload.clone();
    }

    public String payloadAsString() {
        return new String(payload, StandardCharsets.UTF_8);
    }

    public int sizeBytes() {
        return payload.length;
    }

    public boolean hasKey() {
        return !key.isEmpty();
    }

    public boolean isExpired(final Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }
}
