package io.relaybus.config.impl;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.List;

/**
 * One entry of the {@code alertRules} list in bus.yaml.
 */
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public final class AlertRuleConfig {
    private String name;
    private String queue;
    private long threshold;
    private long cooldownMinutes;
    private List<String> channels;
}
