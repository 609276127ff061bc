package io.relaybus.broker.subscription;

/**
 * Delivery guarantee of a subscription. The mode changes when offsets are committed and whether failed
 * events may be redelivered from the dead-letter queue; it never changes how events reach the handler.
 */
public enum DeliveryMode {
    /** Offset committed before the handler runs; failed events are dead-lettered for inspection only. */
    AT_MOST_ONCE,
    /** Failed events are dead-lettered and may be redelivered; handlers must be idempotent. */
    AT_LEAST_ONCE,
    /** Like {@link #AT_LEAST_ONCE}, but an event id the handler already accepted is never handed to it again. */
    EXACTLY_ONCE
}
