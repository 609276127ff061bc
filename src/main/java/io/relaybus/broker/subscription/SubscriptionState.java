package io.relaybus.broker.subscription;

public enum SubscriptionState {
    ACTIVE,
    PAUSED,
    /** The subscription's topic was deleted. */
    EXPIRED
}
