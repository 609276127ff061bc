package io.relaybus.broker.subscription;

import io.relaybus.core.model.Event;

/**
 * Subscriber callback. Returning normally acknowledges receipt; throwing rejects the event and sends it to
 * the dead-letter queue.
 */
@FunctionalInterface
public interface EventHandler {
    void handle(Event event) throws Exception;
}
