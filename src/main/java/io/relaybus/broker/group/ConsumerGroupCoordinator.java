package io.relaybus.broker.group;

import io.relaybus.error.InvalidStateException;
import io.relaybus.error.NotFoundException;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Predicate;

/**
 * Assigns the partitions of a group's topic to its active members and reassigns them whenever membership
 * or member activity changes.
 * <p>
 * Assignment is round-robin over members ordered by subscription id: partition {@code i} goes to
 * {@code members[i mod n]}. The same member set always yields the same assignment, and every partition
 * has exactly one owner while the group has at least one active member.
 * </p>
 */
@Slf4j
public final class ConsumerGroupCoordinator {
    private final ConcurrentMap<String, ConsumerGroup> groups = new ConcurrentHashMap<>();
    private final Predicate<String> memberActive;
    private final Clock clock;

    /**
     * @param memberActive tells whether a member subscription currently takes deliveries; inactive
     *                     members stay in the group but own no partitions
     */
    public ConsumerGroupCoordinator(final Predicate<String> memberActive, final Clock clock) {
        this.memberActive = Objects.requireNonNull(memberActive, "memberActive");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Adds a member, creating the group on first use, and rebalances.
     *
     * @throws InvalidStateException if the group already exists for a different topic
     */
    public ConsumerGroup join(final String group,
                              final String topic,
                              final int partitionCount,
                              final String subscriptionId) {
        final ConsumerGroup g = groups.computeIfAbsent(group,
                name -> new ConsumerGroup(name, topic, partitionCount, clock.instant()));
        if (!g.getTopic().equals(topic)) {
            throw new InvalidStateException("consumer group " + group + " is bound to topic "
                    + g.getTopic() + ", cannot join it for " + topic);
        }

        synchronized (g) {
            g.addMember(subscriptionId);
            rebalance(g);
        }
        log.debug("Subscription {} joined group {} (generation {})", subscriptionId, group, g.generation());
        return g;
    }

    /** Removes a member and rebalances the remaining ones. Unknown members are ignored. */
    public void leave(final String group, final String subscriptionId) {
        final ConsumerGroup g = require(group);
        synchronized (g) {
            if (g.removeMember(subscriptionId)) {
                rebalance(g);
            }
        }
        log.debug("Subscription {} left group {} (generation {})", subscriptionId, group, g.generation());
    }

    /** Recomputes the assignment of the named group and bumps its generation. */
    public ConsumerGroup rebalance(final String group) {
        final ConsumerGroup g = require(group);
        synchronized (g) {
            rebalance(g);
        }
        return g;
    }

    private void rebalance(final ConsumerGroup g) {
        final List<String> active = new ArrayList<>();
        for (final String member : g.orderedMembers()) {
            if (memberActive.test(member)) active.add(member);
        }

        g.install(roundRobin(active, g.getPartitionCount()));
        log.debug("Rebalanced group {} on {}: generation {}, assignments {}",
                g.getName(), g.getTopic(), g.generation(), g.assignments());
    }

    /**
     * Pure round-robin assignment.
     *
     * @param members members in a stable order
     * @return member to partitions, empty when there are no members
     */
    static Map<String, List<Integer>> roundRobin(final List<String> members, final int partitionCount) {
        if (members.isEmpty()) {
            return Map.of();
        }

        final Map<String, List<Integer>> plan = new LinkedHashMap<>();
        for (final String member : members) {
            plan.put(member, new ArrayList<>());
        }
        for (int p = 0; p < partitionCount; p++) {
            plan.get(members.get(p % members.size())).add(p);
        }

        final Map<String, List<Integer>> frozen = new LinkedHashMap<>();
        plan.forEach((member, partitions) -> frozen.put(member, List.copyOf(partitions)));
        return Collections.unmodifiableMap(frozen);
    }

    public boolean owns(final String group, final String subscriptionId, final int partition) {
        final ConsumerGroup g = groups.get(group);
        return g != null && g.owns(subscriptionId, partition);
    }

    public Optional<ConsumerGroup> group(final String name) {
        return Optional.ofNullable(groups.get(name));
    }

    public ConsumerGroup require(final String name) {
        final ConsumerGroup g = groups.get(name);
        if (g == null) throw new NotFoundException("consumer group", name);
        return g;
    }

    public Collection<ConsumerGroup> groups() {
        return Collections.unmodifiableCollection(groups.values());
    }

    /** Drops every group bound to the topic. */
    public List<ConsumerGroup> removeForTopic(final String topic) {
        final List<ConsumerGroup> removed = new ArrayList<>();
        groups.values().removeIf(g -> {
            if (g.getTopic().equals(topic)) {
                removed.add(g);
                return true;
            }
            return false;
        });
        return removed;
    }
}
