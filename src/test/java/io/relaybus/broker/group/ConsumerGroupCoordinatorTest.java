package io.relaybus.broker.group;

import io.relaybus.error.InvalidStateException;
import io.relaybus.error.NotFoundException;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

final class ConsumerGroupCoordinatorTest {

    private final Set<String> inactive = new HashSet<>();
    private final ConsumerGroupCoordinator coordinator =
            new ConsumerGroupCoordinator(id -> !inactive.contains(id), Clock.systemUTC());

    private static void assertIsPartitionOf(final Map<String, List<Integer>> assignments, final int partitionCount) {
        final List<Integer> all = new ArrayList<>();
        assignments.values().forEach(all::addAll);
        all.sort(Integer::compare);

        final List<Integer> expected = new ArrayList<>();
        for (int p = 0; p < partitionCount; p++) expected.add(p);
        assertEquals(expected, all, "every partition must have exactly one owner");
    }

    @Test
    void threeMembersOnSixPartitionsThenOneLeaves() {
        coordinator.join("g", "orders", 6, "sub-a");
        coordinator.join("g", "orders", 6, "sub-b");
        final ConsumerGroup group = coordinator.join("g", "orders", 6, "sub-c");

        assertEquals(List.of(0, 3), group.assignment("sub-a"));
        assertEquals(List.of(1, 4), group.assignment("sub-b"));
        assertEquals(List.of(2, 5), group.assignment("sub-c"));
        assertIsPartitionOf(group.assignments(), 6);
        final long before = group.generation();

        coordinator.leave("g", "sub-b");

        assertEquals(3, group.assignment("sub-a").size());
        assertEquals(3, group.assignment("sub-c").size());
        assertTrue(group.assignment("sub-b").isEmpty());
        assertIsPartitionOf(group.assignments(), 6);
        assertTrue(group.generation() > before);
    }

    @Test
    void rebalanceIsDeterministicAndBumpsGeneration() {
        coordinator.join("g", "t", 5, "sub-2");
        coordinator.join("g", "t", 5, "sub-1");
        final ConsumerGroup group = coordinator.group("g").orElseThrow();
        final Map<String, List<Integer>> first = group.assignments();
        final long generation = group.generation();

        coordinator.rebalance("g");

        assertEquals(first, group.assignments());
        assertEquals(generation + 1, group.generation());
    }

    @Test
    void membersAreOrderedBySubscriptionId() {
        coordinator.join("g", "t", 3, "sub-z");
        coordinator.join("g", "t", 3, "sub-a");

        final ConsumerGroup group = coordinator.require("g");
        assertEquals(List.of(0, 2), group.assignment("sub-a"));
        assertEquals(List.of(1), group.assignment("sub-z"));
    }

    @Test
    void moreMembersThanPartitionsLeavesSomeIdle() {
        for (int i = 0; i < 4; i++) coordinator.join("g", "t", 2, "sub-" + i);

        final ConsumerGroup group = coordinator.require("g");
        assertIsPartitionOf(group.assignments(), 2);
        assertTrue(group.assignment("sub-2").isEmpty());
        assertTrue(group.assignment("sub-3").isEmpty());
    }

    @Test
    void lastMemberLeavingClearsAssignments() {
        coordinator.join("g", "t", 3, "sub-a");
        coordinator.leave("g", "sub-a");

        final ConsumerGroup group = coordinator.require("g");
        assertTrue(group.isEmpty());
        assertTrue(group.assignments().isEmpty());
        assertFalse(coordinator.owns("g", "sub-a", 0));
    }

    @Test
    void inactiveMembersOwnNothing() {
        coordinator.join("g", "t", 4, "sub-a");
        coordinator.join("g", "t", 4, "sub-b");

        inactive.add("sub-a");
        final ConsumerGroup group = coordinator.rebalance("g");

        assertEquals(List.of(0, 1, 2, 3), group.assignment("sub-b"));
        assertTrue(group.assignment("sub-a").isEmpty());
        assertEquals(Set.of("sub-a", "sub-b"), group.members());
    }

    @Test
    void groupIsBoundToOneTopic() {
        coordinator.join("g", "orders", 2, "sub-a");

        assertThrows(InvalidStateException.class, () -> coordinator.join("g", "payments", 2, "sub-b"));
        assertEquals(Set.of("sub-a"), coordinator.require("g").members());
    }

    @Test
    void unknownGroupIsNotFound() {
        assertThrows(NotFoundException.class, () -> coordinator.rebalance("missing"));
        assertFalse(coordinator.owns("missing", "sub-a", 0));
    }

    @Test
    void removeForTopicDropsOnlyThatTopicsGroups() {
        coordinator.join("g1", "orders", 2, "sub-a");
        coordinator.join("g2", "payments", 2, "sub-b");

        assertEquals(1, coordinator.removeForTopic("orders").size());
        assertTrue(coordinator.group("g1").isEmpty());
        assertTrue(coordinator.group("g2").isPresent());
    }

    @Test
    void roundRobinOfNoMembersIsEmpty() {
        assertTrue(ConsumerGroupCoordinator.roundRobin(List.of(), 4).isEmpty());
    }
}
