package io.relaybus.deadletter;

/** Only {@link #ACTIVE} queues accept new captures. */
public enum DeadLetterQueueState {
    ACTIVE,
    PAUSED,
    DRAINING,
    DISABLED
}
