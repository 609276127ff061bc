package io.relaybus.config.impl;

import io.relaybus.deadletter.RetryPolicy;
import lombok.Getter;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Immutable config holder loaded from bus.yaml. Every key is optional.
 */
@Getter
public final class BusConfig {
    public static final int DEFAULT_RETENTION_SWEEP_SECONDS = 60;
    public static final int DEFAULT_RETRY_SWEEP_SECONDS = 5;
    public static final int DEFAULT_RETRY_BATCH_SIZE = 100;
    public static final long DEFAULT_RETENTION_HOURS = 168;
    public static final int DEFAULT_DLQ_MAX_SIZE = 10_000;
    public static final int DEFAULT_DLQ_MAX_RETRIES = 3;
    public static final long DEFAULT_ALERT_COOLDOWN_MINUTES = 15;

    private int retentionSweepSeconds = DEFAULT_RETENTION_SWEEP_SECONDS;
    private int retrySweepSeconds = DEFAULT_RETRY_SWEEP_SECONDS;
    private int retryBatchSize = DEFAULT_RETRY_BATCH_SIZE;
    private RetryPolicy retryPolicy = RetryPolicy.defaults();
    private List<TopicConfig> topics = List.of();
    private List<DeadLetterQueueConfig> deadLetterQueues = List.of();
    private List<AlertRuleConfig> alertRules = List.of();

    /** Configuration with every default and nothing declared. */
    public static BusConfig defaults() {
        return new BusConfig();
    }

    public static BusConfig load(final String path) throws IOException {
        try (InputStream in = Files.newInputStream(Paths.get(path))) {
            return load(in);
        }
    }

    @SuppressWarnings("unchecked")
    public static BusConfig load(final InputStream in) {
        final Map<String, Object> m = new Yaml().load(in);
        final BusConfig cfg = new BusConfig();
        if (m == null) {
            return cfg;
        }

        cfg.retentionSweepSeconds = intValue(m, "retentionSweepSeconds", DEFAULT_RETENTION_SWEEP_SECONDS);
        cfg.retrySweepSeconds = intValue(m, "retrySweepSeconds", DEFAULT_RETRY_SWEEP_SECONDS);
        cfg.retryBatchSize = intValue(m, "retryBatchSize", DEFAULT_RETRY_BATCH_SIZE);

        final Map<String, Object> retry = (Map<String, Object>) m.get("retry");
        if (retry != null) {
            final RetryPolicy d = RetryPolicy.defaults();
            cfg.retryPolicy = new RetryPolicy(
                    seconds(retry, "linearStepSeconds", d.linearStep()),
                    seconds(retry, "exponentialBaseSeconds", d.exponentialBase()),
                    seconds(retry, "exponentialMaxSeconds", d.exponentialMax()),
                    seconds(retry, "customDelaySeconds", d.customDelay()));
        }

        final List<TopicConfig> topics = new ArrayList<>();
        for (final Map<String, Object> t : list(m, "topics")) {
            topics.add(new TopicConfig(
                    (String) t.get("name"),
                    intValue(t, "partitions", 1),
                    longValue(t, "retentionHours", DEFAULT_RETENTION_HOURS),
                    (Boolean) t.getOrDefault("compaction", false)));
        }
        cfg.topics = List.copyOf(topics);

        final List<DeadLetterQueueConfig> queues = new ArrayList<>();
        for (final Map<String, Object> q : list(m, "deadLetterQueues")) {
            queues.add(new DeadLetterQueueConfig(
                    (String) q.get("name"),
                    (String) q.getOrDefault("sourceTopic", ""),
                    (String) q.getOrDefault("sourceConsumerGroup", ""),
                    intValue(q, "maxSize", DEFAULT_DLQ_MAX_SIZE),
                    longValue(q, "retentionHours", DEFAULT_RETENTION_HOURS),
                    (String) q.getOrDefault("retryStrategy", "exponential"),
                    intValue(q, "maxRetries", DEFAULT_DLQ_MAX_RETRIES)));
        }
        cfg.deadLetterQueues = List.copyOf(queues);

        final List<AlertRuleConfig> rules = new ArrayList<>();
        for (final Map<String, Object> r : list(m, "alertRules")) {
            rules.add(new AlertRuleConfig(
                    (String) r.get("name"),
                    (String) r.get("queue"),
                    longValue(r, "threshold", 1),
                    longValue(r, "cooldownMinutes", DEFAULT_ALERT_COOLDOWN_MINUTES),
                    (List<String>) r.getOrDefault("channels", List.of())));
        }
        cfg.alertRules = List.copyOf(rules);

        return cfg;
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> list(final Map<String, Object> m, final String key) {
        final Object v = m.get(key);
        return v == null ? List.of() : (List<Map<String, Object>>) v;
    }

    private static int intValue(final Map<String, Object> m, final String key, final int def) {
        final Object v = m.get(key);
        return v == null ? def : ((Number) v).intValue();
    }

    private static long longValue(final Map<String, Object> m, final String key, final long def) {
        final Object v = m.get(key);
        return v == null ? def : ((Number) v).longValue();
    }

    private static Duration seconds(final Map<String, Object> m, final String key, final Duration def) {
        final Object v = m.get(key);
        return v == null ? def : Duration.ofSeconds(((Number) v).longValue());
    }
}
