package io.relaybus.deadletter;

/**
 * @param reprocessRate percentage of received messages that were reprocessed, 0 when nothing was received
 */
public record DeadLetterStatistics(int queuesTotal,
                                   int queuesActive,
                                   long messagesTotal,
                                   long messagesPending,
                                   long messagesProcessing,
                                   long messagesReprocessed,
                                   long messagesDiscarded,
                                   long messagesExpired,
                                   long totalReceived,
                                   long totalReprocessed,
                                   double reprocessRate,
                                   int alertRules,
                                   int errorPatterns) {
}
