package io.relaybus.core.model;

/** Lifecycle of a topic. Only {@link #ACTIVE} topics accept publishes. */
public enum TopicState {
    ACTIVE,
    PAUSED,
    DELETED
}
