package io.relaybus.deadletter.alert;

/**
 * Receives alert triggers. Delivery is fire-and-forget: a notifier that throws is logged and ignored,
 * it never fails the capture that triggered it.
 */
@FunctionalInterface
public interface AlertNotifier {
    void deliver(String ruleName, String queueName, long pendingCount);
}
