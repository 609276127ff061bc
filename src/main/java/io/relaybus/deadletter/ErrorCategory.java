package io.relaybus.deadletter;

public enum ErrorCategory {
    TRANSIENT,
    PERMANENT,
    VALIDATION,
    TIMEOUT,
    CAPACITY,
    UNKNOWN
}
