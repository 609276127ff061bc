package io.relaybus.broker;

import io.relaybus.core.model.TopicState;

import java.util.List;

public record TopicStatistics(String name,
                              TopicState state,
                              int partitionCount,
                              long messageCount,
                              long bytesTotal,
                              int subscriptions,
                              List<Partition> partitions) {

    public record Partition(int partition, long lowWatermark, long highWatermark, int retained) {
    }
}
