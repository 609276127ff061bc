package io.relaybus.broker.subscription;

import io.relaybus.error.NotFoundException;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Holds every subscription, indexed by id and by topic. The per-topic lists keep registration order,
 * which is the fan-out order.
 */
public final class SubscriptionRegistry {
    private final ConcurrentMap<String, Subscription> byId = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, CopyOnWriteArrayList<Subscription>> byTopic = new ConcurrentHashMap<>();

    public void register(final Subscription subscription) {
        byId.put(subscription.getSubscriptionId(), subscription);
        byTopic.computeIfAbsent(subscription.getTopic(), t -> new CopyOnWriteArrayList<>()).add(subscription);
    }

    public Optional<Subscription> find(final String subscriptionId) {
        return Optional.ofNullable(byId.get(subscriptionId));
    }

    public Subscription require(final String subscriptionId) {
        final Subscription sub = byId.get(subscriptionId);
        if (sub == null) throw new NotFoundException("subscription", subscriptionId);
        return sub;
    }

    public boolean isActive(final String subscriptionId) {
        final Subscription sub = byId.get(subscriptionId);
        return sub != null && sub.isActive();
    }

    public List<Subscription> forTopic(final String topic) {
        final List<Subscription> subs = byTopic.get(topic);
        return subs == null ? List.of() : Collections.unmodifiableList(subs);
    }

    public Subscription remove(final String subscriptionId) {
        final Subscription removed = byId.remove(subscriptionId);
        if (removed == null) throw new NotFoundException("subscription", subscriptionId);
        final List<Subscription> subs = byTopic.get(removed.getTopic());
        if (subs != null) subs.remove(removed);
        return removed;
    }

    public Collection<Subscription> all() {
        return Collections.unmodifiableCollection(byId.values());
    }
}
