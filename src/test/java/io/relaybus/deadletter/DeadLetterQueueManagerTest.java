package io.relaybus.deadletter;

import io.relaybus.core.model.Event;
import io.relaybus.error.CapacityExceededException;
import io.relaybus.error.DuplicateException;
import io.relaybus.error.EventBusException;
import io.relaybus.error.InvalidStateException;
import io.relaybus.error.NotFoundException;
import io.relaybus.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

final class DeadLetterQueueManagerTest {

    private MutableClock clock;
    private volatile Reprocessor behaviour;
    private final List<String> alerts = new ArrayList<>();
    private DeadLetterQueueManager manager;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-03-01T12:00:00Z");
        behaviour = m -> {
            throw new IllegalStateException("downstream still unavailable");
        };
        manager = new DeadLetterQueueManager(clock, RetryPolicy.defaults(),
                m -> behaviour.reprocess(m),
                (rule, queue, pending) -> alerts.add(rule + ":" + queue + ":" + pending));
        manager.createQueue(DeadLetterQueueSpec.builder().name("orders.DLQ").sourceTopic("orders").build());
    }

    private Event event(final long offset, final String payload) {
        return new Event("evt-" + offset, "orders", 1, offset, "order.created", "order-" + offset,
                payload.getBytes(), Map.of("h", "v"), null, "checkout", null, null, clock.instant(), null);
    }

    private DeadLetterMessage capture(final String error) {
        return manager.capture("orders.DLQ", event(0, "{}"), error, "E", "billing");
    }

    @Test
    void timeoutMessageRetriedThreeTimesThenDiscarded() {
        final DeadLetterMessage msg = capture("Connection timeout to database");
        final DeadLetterQueue queue = manager.requireQueue("orders.DLQ");
        assertEquals(ErrorCategory.TIMEOUT, msg.getErrorCategory());
        assertEquals(1, queue.messageCount());

        for (int i = 0; i < 3; i++) {
            assertEquals(RetryOutcome.FAILED, manager.retry(msg.getMessageId()));
        }
        assertEquals(MessageState.PENDING, msg.state());
        assertEquals(3, msg.retryCount());
        assertEquals(RetryOutcome.EXHAUSTED, manager.retry(msg.getMessageId()));
        assertEquals(3, msg.retryCount());

        assertTrue(manager.discard(msg.getMessageId(), "poison"));
        assertEquals(MessageState.DISCARDED, msg.state());
        assertEquals(0, queue.messageCount());
        assertEquals(1, queue.totalDiscarded());
        assertEquals("poison", msg.discardReason().orElseThrow());
    }

    @Test
    void capturedMessageCopiesTheEvent() {
        final DeadLetterMessage msg = manager.capture("orders.DLQ", event(7, "{\"id\":7}"), "boom", "E1", "billing");

        assertEquals("orders", msg.getOriginalTopic());
        assertEquals(1, msg.getOriginalPartition());
        assertEquals(7, msg.getOriginalOffset());
        assertEquals("order-7", msg.getOriginalKey());
        assertEquals("{\"id\":7}", msg.payloadAsString());
        assertEquals(Map.of("h", "v"), msg.getHeaders());
        assertEquals(3, msg.getMaxRetries());
        assertEquals(clock.instant().plus(Duration.ofHours(168)), msg.getExpiresAt());
        assertEquals("evt-7", msg.originalEvent().orElseThrow().eventId());
    }

    @Test
    void failedRetrySchedulesExponentialBackoff() {
        final DeadLetterMessage msg = capture("boom");
        final Instant start = clock.instant();

        manager.retry(msg.getMessageId());
        assertEquals(start.plusSeconds(10), msg.nextRetryAt().orElseThrow());
        assertEquals("downstream still unavailable", msg.lastRetryError().orElseThrow());

        manager.retry(msg.getMessageId());
        assertEquals(start.plusSeconds(20), msg.nextRetryAt().orElseThrow());
    }

    @Test
    void successfulRetryReprocessesAndFreesTheSlot() {
        final DeadLetterMessage msg = capture("boom");
        behaviour = m -> { };

        assertEquals(RetryOutcome.REPROCESSED, manager.retry(msg.getMessageId()));

        final DeadLetterQueue queue = manager.requireQueue("orders.DLQ");
        assertEquals(MessageState.REPROCESSED, msg.state());
        assertEquals(0, queue.messageCount());
        assertEquals(1, queue.totalReprocessed());
        assertEquals(RetryOutcome.NOT_PENDING, manager.retry(msg.getMessageId()));
        assertFalse(manager.discard(msg.getMessageId(), "too late"));
    }

    @Test
    void concurrentRetryOfSameMessageIsRefused() throws Exception {
        final DeadLetterMessage msg = capture("boom");
        final CountDownLatch entered = new CountDownLatch(1);
        final CountDownLatch release = new CountDownLatch(1);
        behaviour = m -> {
            entered.countDown();
            assertTrue(release.await(5, TimeUnit.SECONDS));
        };

        final ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            final Future<RetryOutcome> first = pool.submit(() -> manager.retry(msg.getMessageId()));
            assertTrue(entered.await(5, TimeUnit.SECONDS));

            assertEquals(MessageState.PROCESSING, msg.state());
            assertEquals(RetryOutcome.IN_FLIGHT, manager.retry(msg.getMessageId()));
            assertFalse(manager.discard(msg.getMessageId(), "while in flight"));

            release.countDown();
            assertEquals(RetryOutcome.REPROCESSED, first.get(5, TimeUnit.SECONDS));
        } finally {
            pool.shutdownNow();
        }
        assertEquals(1, msg.retryCount());
    }

    @Test
    void discardedMessageNeverComesBack() {
        final DeadLetterMessage msg = capture("boom");
        behaviour = m -> { };

        assertTrue(manager.discard(msg.getMessageId(), "operator"));

        assertEquals(RetryOutcome.NOT_PENDING, manager.retry(msg.getMessageId()));
        assertFalse(manager.discard(msg.getMessageId(), "again"));
        assertEquals(0, manager.expireOverdue());
        clock.advance(Duration.ofDays(30));
        assertEquals(0, manager.expireOverdue());
        assertEquals(MessageState.DISCARDED, msg.state());
        assertEquals(0, msg.retryCount());
    }

    @Test
    void fullQueueRejectsCaptures() {
        manager.createQueue(DeadLetterQueueSpec.builder().name("small").maxSize(2).build());
        final DeadLetterMessage first = manager.capture("small", event(0, "a"), "x", "", "");
        manager.capture("small", event(1, "b"), "x", "", "");

        final CapacityExceededException full = assertThrows(CapacityExceededException.class,
                () -> manager.capture("small", event(2, "c"), "x", "", ""));
        assertEquals(2, full.getCapacity());
        assertEquals(EventBusException.Kind.CAPACITY_EXCEEDED, full.getKind());

        manager.discard(first.getMessageId(), "make room");
        manager.capture("small", event(2, "c"), "x", "", "");
        assertEquals(2, manager.requireQueue("small").messageCount());
    }

    @Test
    void onlyActiveQueuesAcceptCaptures() {
        manager.pauseQueue("orders.DLQ");
        assertThrows(InvalidStateException.class, () -> capture("x"));

        manager.drainQueue("orders.DLQ");
        assertThrows(InvalidStateException.class, () -> capture("x"));

        manager.resumeQueue("orders.DLQ");
        capture("x");

        assertThrows(NotFoundException.class, () -> manager.capture("missing", event(0, "a"), "x", "", ""));
    }

    @Test
    void unknownMessageIsNotFound() {
        assertThrows(NotFoundException.class, () -> manager.retry("dlm-missing"));
        assertThrows(NotFoundException.class, () -> manager.discard("dlm-missing", "x"));
    }

    @Test
    void duplicateQueueNameIsRejected() {
        assertThrows(DuplicateException.class,
                () -> manager.createQueue(DeadLetterQueueSpec.builder().name("orders.DLQ").build()));
    }

    @Test
    void nonRetryableFailureCannotBeRetried() {
        final DeadLetterMessage msg = manager.capture("orders.DLQ", FailedDelivery.builder()
                .topic("orders")
                .errorMessage("Validation failed: amount required")
                .retryable(false)
                .build());

        assertEquals(0, msg.getMaxRetries());
        assertEquals(ErrorCategory.VALIDATION, msg.getErrorCategory());
        assertEquals(RetryOutcome.EXHAUSTED, manager.retry(msg.getMessageId()));
        assertTrue(msg.originalEvent().isEmpty());
    }

    @Test
    void errorFromReprocessorPutsMessageBackToPending() {
        final DeadLetterMessage msg = capture("boom");
        final Instant start = clock.instant();
        behaviour = m -> {
            throw new AssertionError("reprocessor bug");
        };

        assertThrows(AssertionError.class, () -> manager.retry(msg.getMessageId()));

        assertEquals(MessageState.PENDING, msg.state());
        assertEquals(1, msg.retryCount());
        assertEquals(start.plusSeconds(10), msg.nextRetryAt().orElseThrow());
        assertEquals("reprocessor bug", msg.lastRetryError().orElseThrow());
        assertEquals(1, manager.requireQueue("orders.DLQ").messageCount());

        behaviour = m -> { };
        assertEquals(RetryOutcome.REPROCESSED, manager.retry(msg.getMessageId()));
        assertEquals(0, manager.requireQueue("orders.DLQ").messageCount());
    }

    @Test
    void retryAllPendingPassesOverExhaustedMessages() {
        manager.createQueue(DeadLetterQueueSpec.builder().name("once").maxRetries(1).build());
        final DeadLetterMessage poison = manager.capture("once", event(0, "a"), "x", "", "");
        final DeadLetterMessage next = manager.capture("once", event(1, "b"), "x", "", "");
        manager.retry(poison.getMessageId());
        assertTrue(poison.isExhausted());

        final RetrySummary summary = manager.retryAllPending("once", 1);

        assertEquals(1, summary.attempted());
        assertEquals(1, next.retryCount());
        assertEquals(1, poison.retryCount());
    }

    @Test
    void settledMessagesLeaveTheQueueIndexAndArePurgedAfterRetention() {
        manager.createQueue(DeadLetterQueueSpec.builder().name("short").retention(Duration.ofHours(1)).build());
        final DeadLetterMessage discarded = manager.capture("short", event(0, "a"), "x", "", "");
        final DeadLetterMessage reprocessed = manager.capture("short", event(1, "b"), "x", "", "");
        final DeadLetterMessage left = manager.capture("short", event(2, "c"), "x", "", "");
        final DeadLetterQueue queue = manager.requireQueue("short");

        manager.discard(discarded.getMessageId(), "operator");
        behaviour = m -> { };
        manager.retry(reprocessed.getMessageId());

        assertEquals(List.of(left.getMessageId()), queue.liveMessageIds());
        assertEquals(3, manager.queueMessages("short", null, 10).size());

        clock.advance(Duration.ofHours(1));
        assertEquals(1, manager.expireOverdue());

        assertTrue(queue.liveMessageIds().isEmpty());
        assertTrue(manager.message(discarded.getMessageId()).isEmpty());
        assertTrue(manager.message(reprocessed.getMessageId()).isEmpty());
        assertEquals(MessageState.EXPIRED, manager.message(left.getMessageId()).orElseThrow().state());
        assertEquals(1, queue.totalDiscarded());
        assertEquals(1, queue.totalReprocessed());

        clock.advance(Duration.ofHours(1));
        assertEquals(0, manager.expireOverdue());
        assertTrue(manager.queueMessages("short", null, 10).isEmpty());
        assertThrows(NotFoundException.class, () -> manager.retry(left.getMessageId()));
    }

    @Test
    void retryAllPendingHonoursBatchSize() {
        behaviour = m -> {
            if (m.payloadAsString().startsWith("bad")) throw new IllegalStateException("still bad");
        };
        for (int i = 0; i < 5; i++) {
            manager.capture("orders.DLQ", event(i, i % 2 == 0 ? "good" : "bad"), "x", "", "");
        }

        final RetrySummary first = manager.retryAllPending("orders.DLQ", 3);
        assertEquals(3, first.attempted());
        assertEquals(2, first.success());
        assertEquals(1, first.failed());

        final RetrySummary rest = manager.retryAllPending("orders.DLQ", 10);
        assertEquals(3, rest.attempted());
        assertEquals(1, rest.success());
        assertEquals(2, manager.requireQueue("orders.DLQ").messageCount());
    }

    @Test
    void retryDueOnlyPicksMessagesWhoseBackoffElapsed() {
        final DeadLetterMessage a = capture("boom");
        capture("boom");
        manager.retry(a.getMessageId());

        final RetrySummary now = manager.retryDue(10);
        assertEquals(1, now.attempted());

        clock.advance(Duration.ofSeconds(11));
        final RetrySummary later = manager.retryDue(10);
        assertEquals(2, later.attempted());
        assertEquals(2, a.retryCount());
    }

    @Test
    void overdueMessagesExpire() {
        manager.createQueue(DeadLetterQueueSpec.builder().name("short").retention(Duration.ofHours(1)).build());
        final DeadLetterMessage msg = manager.capture("short", event(0, "a"), "x", "", "");

        clock.advance(Duration.ofMinutes(59));
        assertEquals(0, manager.expireOverdue());

        clock.advance(Duration.ofMinutes(1));
        assertEquals(1, manager.expireOverdue());

        final DeadLetterQueue queue = manager.requireQueue("short");
        assertEquals(MessageState.EXPIRED, msg.state());
        assertEquals(0, queue.messageCount());
        assertEquals(1, queue.totalExpired());
        assertFalse(manager.discard(msg.getMessageId(), "late"));
    }

    @Test
    void errorAnalysisGroupsByCategoryServiceAndPattern() {
        for (int i = 0; i < 3; i++) {
            manager.capture("orders.DLQ", event(i, "a"), "Request timed out", "DB_TIMEOUT", "billing");
        }
        manager.capture("orders.DLQ", event(3, "b"), "invalid payload", "VAL", "intake");

        final ErrorAnalysis analysis = manager.errorAnalysis();

        assertEquals(4, analysis.totalMessages());
        assertEquals(3L, analysis.byCategory().get(ErrorCategory.TIMEOUT));
        assertEquals(1L, analysis.byCategory().get(ErrorCategory.VALIDATION));
        assertEquals(Map.of("billing", 3L, "intake", 1L), analysis.byService());
        assertEquals(2, analysis.patternsCount());

        final ErrorPattern.Summary top = analysis.topPatterns().get(0);
        assertEquals("DB_TIMEOUT", top.errorCode());
        assertEquals(3, top.occurrences());
        assertTrue(top.affectedTopics().contains("orders"));
    }

    @Test
    void statisticsReflectMessageStates() {
        final DeadLetterMessage a = capture("boom");
        final DeadLetterMessage b = capture("boom");
        capture("boom");
        manager.discard(a.getMessageId(), "x");
        behaviour = m -> { };
        manager.retry(b.getMessageId());

        final DeadLetterStatistics stats = manager.statistics();

        assertEquals(1, stats.queuesTotal());
        assertEquals(3, stats.messagesTotal());
        assertEquals(1, stats.messagesPending());
        assertEquals(1, stats.messagesDiscarded());
        assertEquals(1, stats.messagesReprocessed());
        assertEquals(3, stats.totalReceived());
        assertEquals(1, stats.totalReprocessed());
        assertEquals(100.0 / 3, stats.reprocessRate(), 1e-9);
    }

    @Test
    void queueMessagesFiltersByState() {
        final DeadLetterMessage a = capture("boom");
        capture("boom");
        manager.discard(a.getMessageId(), "x");

        assertEquals(2, manager.queueMessages("orders.DLQ", null, 10).size());
        assertEquals(1, manager.queueMessages("orders.DLQ", MessageState.PENDING, 10).size());
        assertEquals(a.getMessageId(),
                manager.queueMessages("orders.DLQ", MessageState.DISCARDED, 10).get(0).getMessageId());
        assertEquals(1, manager.queueMessages("orders.DLQ", null, 1).size());
    }

    @Test
    void alertFiresAtThresholdAndRespectsCooldown() {
        manager.createAlertRule("depth", "orders.DLQ", 2, Duration.ofMinutes(10), List.of("ops"));

        final DeadLetterMessage first = capture("x");
        assertTrue(alerts.isEmpty());

        capture("x");
        assertEquals(List.of("depth:orders.DLQ:2"), alerts);
        assertTrue(manager.alertRule("depth").orElseThrow().isTriggered());

        capture("x");
        assertEquals(1, alerts.size());

        clock.advance(Duration.ofMinutes(11));
        capture("x");
        assertEquals(2, alerts.size());

        manager.discard(first.getMessageId(), "x");
        assertEquals(2, alerts.size());
        assertTrue(manager.alertRule("depth").orElseThrow().isTriggered());
    }

    @Test
    void triggeredFlagClearsWhenQueueDrops() {
        manager.createAlertRule("depth", "orders.DLQ", 1, Duration.ofMinutes(10), List.of());
        final DeadLetterMessage msg = capture("x");
        assertTrue(manager.alertRule("depth").orElseThrow().isTriggered());

        manager.discard(msg.getMessageId(), "x");

        assertFalse(manager.alertRule("depth").orElseThrow().isTriggered());
    }

    @Test
    void failingNotifierDoesNotFailCapture() {
        final DeadLetterQueueManager noisy = new DeadLetterQueueManager(clock, RetryPolicy.defaults(),
                m -> { }, (rule, queue, pending) -> {
                    throw new IllegalStateException("pager down");
                });
        noisy.createQueue(DeadLetterQueueSpec.builder().name("q").build());
        noisy.createAlertRule("any", "q", 1, Duration.ZERO, List.of());

        noisy.capture("q", event(0, "a"), "x", "", "");

        assertEquals(1, noisy.requireQueue("q").messageCount());
    }

    @Test
    void alertRuleNeedsExistingQueueAndUniqueName() {
        assertThrows(NotFoundException.class,
                () -> manager.createAlertRule("r", "missing", 1, Duration.ZERO, List.of()));
        manager.createAlertRule("r", "orders.DLQ", 1, Duration.ZERO, List.of());
        assertThrows(DuplicateException.class,
                () -> manager.createAlertRule("r", "orders.DLQ", 1, Duration.ZERO, List.of()));
    }
}
