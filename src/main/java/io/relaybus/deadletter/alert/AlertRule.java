package io.relaybus.deadletter.alert;

import lombok.Getter;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Threshold on a dead-letter queue's live message count.
 * <p>
 * {@code triggered} is recomputed on every evaluation and only reflects whether the queue is currently
 * over the threshold. A notification fires when the queue is over the threshold and the rule either never
 * fired or its cooldown has elapsed since the last firing.
 * </p>
 */
public final class AlertRule {
    @Getter private final String ruleId = "alert-" + UUID.randomUUID();
    @Getter private final String name;
    @Getter private final String queueName;
    @Getter private final long threshold;
    @Getter private final Duration cooldown;
    @Getter private final List<String> channels;

    private volatile boolean enabled = true;
    private boolean triggered;
    private Instant lastTriggered;

    public AlertRule(final String name,
                     final String queueName,
                     final long threshold,
                     final Duration cooldown,
                     final List<String> channels) {
        if (threshold < 1) throw new IllegalArgumentException("threshold must be >= 1");
        this.name = Objects.requireNonNull(name, "name");
        this.queueName = Objects.requireNonNull(queueName, "queueName");
        this.threshold = threshold;
        this.cooldown = Objects.requireNonNull(cooldown, "cooldown");
        this.channels = channels == null ? List.of() : List.copyOf(channels);
    }

    /**
     * Re-evaluates the rule against the queue's current live count.
     *
     * @return true if a notification should be sent now
     */
    public synchronized boolean evaluate(final long pendingCount, final Instant now) {
        if (!enabled || pendingCount < threshold) {
            triggered = false;
            return false;
        }

        triggered = true;
        if (lastTriggered == null || Duration.between(lastTriggered, now).compareTo(cooldown) > 0) {
            lastTriggered = now;
            return true;
        }
        return false;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void enabled(final boolean enabled) {
        this.enabled = enabled;
    }

    public synchronized boolean isTriggered() {
        return triggered;
    }

    public synchronized Optional<Instant> lastTriggered() {
        return Optional.ofNullable(lastTriggered);
    }
}
