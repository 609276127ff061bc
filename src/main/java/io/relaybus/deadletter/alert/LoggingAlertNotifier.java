package io.relaybus.deadletter.alert;

import lombok.extern.slf4j.Slf4j;

/** Default notifier: writes every trigger to the log. */
@Slf4j
public final class LoggingAlertNotifier implements AlertNotifier {

    @Override
    public void deliver(final String ruleName, final String queueName, final long pendingCount) {
        log.warn("Alert {} triggered: dead-letter queue {} holds {} pending messages", ruleName, queueName, pendingCount);
    }
}
