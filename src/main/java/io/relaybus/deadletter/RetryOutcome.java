package io.relaybus.deadletter;

/** Result of a single retry attempt. Only {@link #REPROCESSED} counts as success. */
public enum RetryOutcome {
    REPROCESSED,
    /** Reprocessing threw; the message is pending again with a new {@code nextRetryAt}. */
    FAILED,
    /** The message was not pending (already reprocessed, discarded or expired). */
    NOT_PENDING,
    /** Another retry of the same message is running. */
    IN_FLIGHT,
    /** The message has used up its retries and waits for a manual discard or expiry. */
    EXHAUSTED;

    public boolean isSuccess() {
        return this == REPROCESSED;
    }
}
