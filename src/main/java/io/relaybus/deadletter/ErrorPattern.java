package io.relaybus.deadletter;

import java.time.Instant;
import java.util.HashSet;
import java.util.Set;
import java.util.UUID;

/**
 * Occurrences of one (error code, category) pair across all queues. Used for trend analysis only.
 */
public final class ErrorPattern {

    public record Key(String errorCode, ErrorCategory category) {
    }

    /** Point-in-time copy handed out to readers. */
    public record Summary(String patternId,
                          String errorCode,
                          ErrorCategory category,
                          long occurrences,
                          Instant firstSeen,
                          Instant lastSeen,
                          Set<String> affectedServices,
                          Set<String> affectedTopics) {
    }

    private final String patternId = "pat-" + UUID.randomUUID();
    private final Key key;
    private final Instant firstSeen;

    private long occurrences;
    private Instant lastSeen;
    private final Set<String> affectedServices = new HashSet<>();
    private final Set<String> affectedTopics = new HashSet<>();

    ErrorPattern(final Key key, final Instant firstSeen) {
        this.key = key;
        this.firstSeen = firstSeen;
        this.lastSeen = firstSeen;
    }

    synchronized void record(final String service, final String topic, final Instant now) {
        occurrences++;
        lastSeen = now;
        if (service != null && !service.isEmpty()) affectedServices.add(service);
        if (topic != null && !topic.isEmpty()) affectedTopics.add(topic);
    }

    public synchronized Summary summary() {
        return new Summary(patternId, key.errorCode(), key.category(), occurrences, firstSeen, lastSeen,
                Set.copyOf(affectedServices), Set.copyOf(affectedTopics));
    }

    public synchronized long occurrences() {
        return occurrences;
    }
}
