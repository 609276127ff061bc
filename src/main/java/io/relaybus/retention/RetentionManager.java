package io.relaybus.retention;

import io.relaybus.core.model.Topic;
import io.relaybus.deadletter.DeadLetterQueueManager;
import io.relaybus.deadletter.RetrySummary;
import io.relaybus.ledger.PartitionLog;
import io.relaybus.registry.TopicRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Background job that periodically:
 * - drops events older than their topic's retention from the head of every partition
 * - compacts topics created with compaction enabled
 * - expires dead-letter messages past their retention deadline
 * - retries dead-letter messages whose next retry time has come
 */
@Slf4j
public final class RetentionManager implements AutoCloseable {
    private final TopicRegistry topics;
    private final DeadLetterQueueManager deadLetters;
    private final Clock clock;
    private final Duration sweepInterval;
    private final Duration retryInterval;
    private final int retryBatchSize;

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        final Thread t = new Thread(r, "relaybus-retention");
        t.setDaemon(true);
        return t;
    });

    public RetentionManager(final TopicRegistry topics,
                            final DeadLetterQueueManager deadLetters,
                            final Clock clock,
                            final Duration sweepInterval,
                            final Duration retryInterval,
                            final int retryBatchSize) {
        if (retryBatchSize < 1) throw new IllegalArgumentException("retryBatchSize must be >= 1");
        this.topics = Objects.requireNonNull(topics, "topics");
        this.deadLetters = Objects.requireNonNull(deadLetters, "deadLetters");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.sweepInterval = requirePositive(sweepInterval, "sweepInterval");
        this.retryInterval = requirePositive(retryInterval, "retryInterval");
        this.retryBatchSize = retryBatchSize;
    }

    private static Duration requirePositive(final Duration d, final String name) {
        Objects.requireNonNull(d, name);
        if (d.isZero() || d.isNegative()) throw new IllegalArgumentException(name + " must be positive");
        return d;
    }

    public void start() {
        scheduler.scheduleAtFixedRate(this::sweep,
                sweepInterval.toMillis(), sweepInterval.toMillis(), TimeUnit.MILLISECONDS);
        scheduler.scheduleAtFixedRate(this::retry,
                retryInterval.toMillis(), retryInterval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("Retention sweep every {}, dead-letter retries every {} (batch {})",
                sweepInterval, retryInterval, retryBatchSize);
    }

    private void sweep() {
        try {
            runOnce();
        } catch (final Throwable t) {
            log.error("Retention sweep failed", t);
        }
    }

    private void retry() {
        try {
            final RetrySummary summary = deadLetters.retryDue(retryBatchSize);
            if (summary.attempted() > 0) {
                log.info("Dead-letter retry sweep: {} reprocessed, {} not", summary.success(), summary.failed());
            }
        } catch (final Throwable t) {
            log.error("Dead-letter retry sweep failed", t);
        }
    }

    /**
     * One retention pass over every topic plus dead-letter expiry.
     *
     * @return number of events removed from partition logs
     */
    public int runOnce() {
        final Instant now = clock.instant();
        int removed = 0;

        for (final Topic topic : topics.topics()) {
            final Instant cutoff = now.minus(topic.getRetention());
            for (final PartitionLog partition : topic.getPartitions()) {
                final int truncated = partition.truncateOlderThan(cutoff);
                final int compacted = topic.isCompaction() ? partition.compact() : 0;
                if (truncated + compacted > 0) {
                    log.info("Retention on {}/{}: {} expired, {} compacted, low watermark {}",
                            topic.getName(), partition.getPartition(), truncated, compacted, partition.lowWatermark());
                }
                removed += truncated + compacted;
            }
        }

        deadLetters.expireOverdue();
        return removed;
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
    }
}
