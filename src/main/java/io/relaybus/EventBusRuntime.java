package io.relaybus;

import io.relaybus.broker.EventBus;
import io.relaybus.config.impl.AlertRuleConfig;
import io.relaybus.config.impl.BusConfig;
import io.relaybus.config.impl.DeadLetterQueueConfig;
import io.relaybus.config.impl.TopicConfig;
import io.relaybus.config.type.ConfigLoader;
import io.relaybus.deadletter.alert.AlertNotifier;
import io.relaybus.deadletter.alert.LoggingAlertNotifier;
import io.relaybus.retention.RetentionManager;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

/**
 * Starts an {@link EventBus} from configuration: declares the configured topics, dead-letter queues and
 * alert rules, then runs the background retention and retry sweeps until closed.
 */
@Slf4j
public final class EventBusRuntime implements AutoCloseable {
    @Getter private final EventBus bus;
    @Getter private final RetentionManager retention;

    private EventBusRuntime(final EventBus bus, final RetentionManager retention) {
        this.bus = bus;
        this.retention = retention;
    }

    public static EventBusRuntime start(final String configPath) throws IOException {
        return start(ConfigLoader.load(configPath), Clock.systemUTC());
    }

    public static EventBusRuntime start(final BusConfig cfg, final Clock clock) {
        return start(cfg, clock, new LoggingAlertNotifier());
    }

    public static EventBusRuntime start(final BusConfig cfg, final Clock clock, final AlertNotifier notifier) {
        Objects.requireNonNull(cfg, "cfg");

        final EventBus bus = EventBus.builder()
                .clock(clock)
                .retryPolicy(cfg.getRetryPolicy())
                .alertNotifier(notifier)
                .build();

        for (final TopicConfig t : cfg.getTopics()) {
            bus.createTopic(t.getName(), t.getPartitions(), Duration.ofHours(t.getRetentionHours()), t.isCompaction());
        }
        for (final DeadLetterQueueConfig q : cfg.getDeadLetterQueues()) {
            bus.getDeadLetters().createQueue(q.toSpec());
        }
        for (final AlertRuleConfig r : cfg.getAlertRules()) {
            bus.getDeadLetters().createAlertRule(r.getName(), r.getQueue(), r.getThreshold(),
                    Duration.ofMinutes(r.getCooldownMinutes()), r.getChannels());
        }

        final RetentionManager retention = new RetentionManager(
                bus.getTopics(),
                bus.getDeadLetters(),
                clock,
                Duration.ofSeconds(cfg.getRetentionSweepSeconds()),
                Duration.ofSeconds(cfg.getRetrySweepSeconds()),
                cfg.getRetryBatchSize());
        retention.start();

        log.info("Event bus started with {} topics, {} dead-letter queues, {} alert rules",
                cfg.getTopics().size(), cfg.getDeadLetterQueues().size(), cfg.getAlertRules().size());
        return new EventBusRuntime(bus, retention);
    }

    @Override
    public void close() {
        retention.close();
        log.info("Event bus stopped");
    }
}
