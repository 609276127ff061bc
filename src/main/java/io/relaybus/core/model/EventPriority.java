package io.relaybus.core.model;

public enum EventPriority {
    LOW,
    NORMAL,
    HIGH,
    CRITICAL
}
