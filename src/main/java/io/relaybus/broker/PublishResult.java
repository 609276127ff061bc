package io.relaybus.broker;

import io.relaybus.core.model.Event;

/**
 * Outcome of one publish.
 *
 * @param delivered        subscriptions whose handler returned normally
 * @param rejected         subscriptions whose handler threw
 * @param deadLettered     rejected deliveries captured into a dead-letter queue
 * @param captureFailures  rejected deliveries no dead-letter queue accepted
 * @param deferred         the event was appended from inside a handler while its partition was being delivered
 *                         by another call; it is delivered, in offset order, once that call reaches it, and the
 *                         counts here are zero
 */
public record PublishResult(Event event,
                            int delivered,
                            int rejected,
                            int deadLettered,
                            int captureFailures,
                            boolean deferred) {

    public static PublishResult delivered(final Event event,
                                          final int delivered,
                                          final int rejected,
                                          final int deadLettered,
                                          final int captureFailures) {
        return new PublishResult(event, delivered, rejected, deadLettered, captureFailures, false);
    }

    public static PublishResult deferred(final Event event) {
        return new PublishResult(event, 0, 0, 0, 0, true);
    }

    public long offset() {
        return event.offset();
    }

    public int partition() {
        return event.partition();
    }
}
