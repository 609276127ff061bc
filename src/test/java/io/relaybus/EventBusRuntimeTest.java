package io.relaybus;

import io.relaybus.broker.subscription.SubscriptionRequest;
import io.relaybus.config.impl.BusConfig;
import io.relaybus.deadletter.DeadLetterQueue;
import io.relaybus.deadletter.RetryStrategy;
import io.relaybus.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.io.InputStream;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

final class EventBusRuntimeTest {

    @Test
    void declaresEverythingFromTheSampleConfig() throws Exception {
        final BusConfig cfg;
        try (InputStream in = getClass().getResourceAsStream("/bus.yaml")) {
            assertNotNull(in, "bus.yaml test resource");
            cfg = BusConfig.load(in);
        }
        final List<String> alerts = new ArrayList<>();

        try (EventBusRuntime runtime = EventBusRuntime.start(cfg, MutableClock.startingAt("2024-01-01T00:00:00Z"),
                (rule, queue, pending) -> alerts.add(rule))) {
            assertEquals(4, runtime.getBus().getTopics().require("orders").partitionCount());
            assertEquals(Duration.ofHours(24), runtime.getBus().getTopics().require("orders").getRetention());
            assertTrue(runtime.getBus().getTopics().require("profiles").isCompaction());

            final DeadLetterQueue dlq = runtime.getBus().getDeadLetters().requireQueue("orders.DLQ");
            assertEquals(RetryStrategy.EXPONENTIAL, dlq.getRetryStrategy());
            assertEquals(3, dlq.getMaxRetries());

            runtime.getBus().subscribe(SubscriptionRequest.builder()
                    .topic("orders").name("broken").handler(e -> {
                        throw new IllegalStateException("boom");
                    }).build());
            runtime.getBus().publish("orders", "order.created", "{}", "o-1");
            runtime.getBus().publish("orders", "order.created", "{}", "o-2");

            assertEquals(2, dlq.messageCount());
            assertEquals(List.of("orders-dlq-depth"), alerts);
        }
    }
}
