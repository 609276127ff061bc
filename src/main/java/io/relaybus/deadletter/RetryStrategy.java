package io.relaybus.deadletter;

import java.util.Locale;

public enum RetryStrategy {
    IMMEDIATE,
    LINEAR,
    EXPONENTIAL,
    /** Fixed operator-supplied delay, see {@link RetryPolicy#customDelay()}. */
    CUSTOM;

    /** Case-insensitive lookup used by configuration files. */
    public static RetryStrategy parse(final String value) {
        return RetryStrategy.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
