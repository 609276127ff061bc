package io.relaybus.deadletter;

/**
 * Lifecycle of a dead-letter message:
 * {@code PENDING -> PROCESSING -> (REPROCESSED | PENDING | DISCARDED | EXPIRED)}.
 */
public enum MessageState {
    PENDING,
    PROCESSING,
    REPROCESSED,
    DISCARDED,
    EXPIRED;

    /** Terminal states never transition again. */
    public boolean isTerminal() {
        return this == REPROCESSED || this == DISCARDED || this == EXPIRED;
    }
}
