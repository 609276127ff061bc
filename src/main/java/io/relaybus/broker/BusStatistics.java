package io.relaybus.broker;

import io.relaybus.deadletter.DeadLetterStatistics;

/**
 * Bus-wide counters. {@code eventsPublished} and {@code bytesPublished} are cumulative over live topics and
 * are not reduced by retention.
 */
public record BusStatistics(int topics,
                            int partitions,
                            int subscriptions,
                            int activeSubscriptions,
                            int consumerGroups,
                            long eventsPublished,
                            long bytesPublished,
                            long delivered,
                            long rejected,
                            long deadLettered,
                            DeadLetterStatistics deadLetters) {
}
