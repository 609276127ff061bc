package io.relaybus.config.impl;

import io.relaybus.deadletter.DeadLetterQueueSpec;
import io.relaybus.deadletter.RetryStrategy;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Duration;

/**
 * One entry of the {@code deadLetterQueues} list in bus.yaml.
 */
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public final class DeadLetterQueueConfig {
    private String name;
    private String sourceTopic;
    private String sourceConsumerGroup;
    private int maxSize;
    private long retentionHours;
    private String retryStrategy;
    private int maxRetries;

    public DeadLetterQueueSpec toSpec() {
        return DeadLetterQueueSpec.builder()
                .name(name)
                .sourceTopic(sourceTopic)
                .sourceConsumerGroup(sourceConsumerGroup)
                .maxSize(maxSize)
                .retention(Duration.ofHours(retentionHours))
                .retryStrategy(RetryStrategy.parse(retryStrategy))
                .maxRetries(maxRetries)
                .build();
    }
}
