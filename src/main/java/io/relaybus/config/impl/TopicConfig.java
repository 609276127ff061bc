package io.relaybus.config.impl;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * One entry of the {@code topics} list in bus.yaml.
 */
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public final class TopicConfig {
    private String name;
    private int partitions;
    private long retentionHours;
    private boolean compaction;
}
