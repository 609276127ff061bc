package io.relaybus.deadletter.alert;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

final class AlertRuleTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    @Test
    void firesOnceThenWaitsForCooldown() {
        final AlertRule rule = new AlertRule("depth", "q", 5, Duration.ofMinutes(15), List.of("ops"));

        assertFalse(rule.evaluate(4, T0));
        assertTrue(rule.evaluate(5, T0));
        assertEquals(T0, rule.lastTriggered().orElseThrow());
        assertFalse(rule.evaluate(9, T0.plus(Duration.ofMinutes(15))));
        assertTrue(rule.evaluate(9, T0.plus(Duration.ofMinutes(16))));
    }

    @Test
    void triggeredIsRecomputedEachTime() {
        final AlertRule rule = new AlertRule("depth", "q", 2, Duration.ofHours(1), List.of());

        rule.evaluate(3, T0);
        assertTrue(rule.isTriggered());

        rule.evaluate(1, T0.plusSeconds(1));
        assertFalse(rule.isTriggered());
        assertEquals(T0, rule.lastTriggered().orElseThrow());
    }

    @Test
    void disabledRuleNeverFires() {
        final AlertRule rule = new AlertRule("depth", "q", 1, Duration.ZERO, List.of());
        rule.enabled(false);

        assertFalse(rule.evaluate(100, T0));
        assertFalse(rule.isTriggered());
        assertTrue(rule.lastTriggered().isEmpty());
    }

    @Test
    void thresholdMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new AlertRule("r", "q", 0, Duration.ZERO, List.of()));
    }
}
