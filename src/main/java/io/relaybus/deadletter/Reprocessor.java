package io.relaybus.deadletter;

/**
 * Re-executes the work that originally failed for a dead-letter message. Returning normally means the
 * message was handled; throwing leaves it pending for a later retry.
 */
@FunctionalInterface
public interface Reprocessor {
    void reprocess(DeadLetterMessage message) throws Exception;
}
