package io.relaybus.broker.subscription;

public enum AckMode {
    /** Commit right after the handler returns. */
    AUTO,
    /** Commit only on an explicit acknowledge call. */
    MANUAL,
    /** Commit once per {@code ackBatchSize} handled events on a partition. */
    BATCH
}
