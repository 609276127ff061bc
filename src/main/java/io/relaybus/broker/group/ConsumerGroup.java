package io.relaybus.broker.group;

import lombok.Getter;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Membership and partition assignment of one consumer group. A group is bound to a single topic.
 * <p>
 * Mutations go through {@link ConsumerGroupCoordinator} under the group's monitor. The assignment map is
 * replaced wholesale on every rebalance, so readers always see one complete generation.
 * </p>
 */
public final class ConsumerGroup {
    @Getter private final String name;
    @Getter private final String topic;
    @Getter private final int partitionCount;
    @Getter private final Instant createdAt;

    private final TreeSet<String> members = new TreeSet<>();

    private volatile Map<String, List<Integer>> assignments = Map.of();
    private volatile long generation;

    ConsumerGroup(final String name, final String topic, final int partitionCount, final Instant createdAt) {
        this.name = name;
        this.topic = topic;
        this.partitionCount = partitionCount;
        this.createdAt = createdAt;
    }

    synchronized boolean addMember(final String subscriptionId) {
        return members.add(subscriptionId);
    }

    synchronized boolean removeMember(final String subscriptionId) {
        return members.remove(subscriptionId);
    }

    synchronized Set<String> membersSnapshot() {
        return Set.copyOf(members);
    }

    /** Members ordered by subscription id. */
    synchronized List<String> orderedMembers() {
        return List.copyOf(members);
    }

    void install(final Map<String, List<Integer>> next) {
        assignments = next;
        generation++;
    }

    public Set<String> members() {
        return membersSnapshot();
    }

    public Map<String, List<Integer>> assignments() {
        return assignments;
    }

    public List<Integer> assignment(final String subscriptionId) {
        return assignments.getOrDefault(subscriptionId, List.of());
    }

    public boolean owns(final String subscriptionId, final int partition) {
        return assignment(subscriptionId).contains(partition);
    }

    public long generation() {
        return generation;
    }

    public synchronized boolean isEmpty() {
        return members.isEmpty();
    }
}
