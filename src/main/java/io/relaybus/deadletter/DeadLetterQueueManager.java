package io.relaybus.deadletter;

import io.relaybus.core.model.Event;
import io.relaybus.deadletter.alert.AlertNotifier;
import io.relaybus.deadletter.alert.AlertRule;
import io.relaybus.error.CapacityExceededException;
import io.relaybus.error.DuplicateException;
import io.relaybus.error.InvalidStateException;
import io.relaybus.error.NotFoundException;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Captures failed deliveries into named dead-letter queues and drives their retry, discard and expiry.
 * <p>
 * Each message has a single owner at a time: a retry first claims the message id in the in-flight set and
 * releases it in a {@code finally} block, so two retries of the same message never overlap. The
 * reprocessing action runs without holding any lock.
 * </p>
 * <p>
 * Reprocessed, discarded and expired messages leave their queue's live index at once and are purged from
 * the manager one queue retention period after they were processed.
 * </p>
 */
@Slf4j
public final class DeadLetterQueueManager {
    private static final int TOP_PATTERNS = 5;

    private final ConcurrentMap<String, DeadLetterQueue> queues = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, DeadLetterMessage> messages = new ConcurrentHashMap<>();
    private final ConcurrentMap<ErrorPattern.Key, ErrorPattern> patterns = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, AlertRule> alertRules = new ConcurrentHashMap<>();
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();
    private final AtomicLong captureSequence = new AtomicLong();

    private final Clock clock;
    private final RetryPolicy retryPolicy;
    private final Reprocessor reprocessor;
    private final AlertNotifier notifier;

    public DeadLetterQueueManager(final Clock clock,
                                  final RetryPolicy retryPolicy,
                                  final Reprocessor reprocessor,
                                  final AlertNotifier notifier) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
        this.reprocessor = Objects.requireNonNull(reprocessor, "reprocessor");
        this.notifier = Objects.requireNonNull(notifier, "notifier");
    }

    /* ---- queues ---- */

    public DeadLetterQueue createQueue(final DeadLetterQueueSpec spec) {
        final DeadLetterQueue queue = new DeadLetterQueue(spec, clock.instant());
        if (queues.putIfAbsent(queue.getName(), queue) != null) {
            throw new DuplicateException("dead-letter queue", queue.getName());
        }
        log.info("Created dead-letter queue {} for topic '{}' group '{}' (max {}, {} retries, {})",
                queue.getName(), queue.getSourceTopic(), queue.getSourceConsumerGroup(),
                queue.getMaxSize(), queue.getMaxRetries(), queue.getRetryStrategy());
        return queue;
    }

    public Optional<DeadLetterQueue> queue(final String name) {
        return Optional.ofNullable(queues.get(name));
    }

    public DeadLetterQueue requireQueue(final String name) {
        final DeadLetterQueue queue = queues.get(name);
        if (queue == null) throw new NotFoundException("dead-letter queue", name);
        return queue;
    }

    public Collection<DeadLetterQueue> queues() {
        return Collections.unmodifiableCollection(queues.values());
    }

    public void pauseQueue(final String name) {
        transition(name, DeadLetterQueueState.PAUSED);
    }

    public void resumeQueue(final String name) {
        transition(name, DeadLetterQueueState.ACTIVE);
    }

    /** Stops new captures while the existing messages are retried or discarded. */
    public void drainQueue(final String name) {
        transition(name, DeadLetterQueueState.DRAINING);
    }

    public void disableQueue(final String name) {
        transition(name, DeadLetterQueueState.DISABLED);
    }

    private void transition(final String name, final DeadLetterQueueState target) {
        requireQueue(name).state(target);
        log.info("Dead-letter queue {} is now {}", name, target);
    }

    /* ---- capture ---- */

    public DeadLetterMessage capture(final String queueName,
                                     final Event event,
                                     final String errorMessage,
                                     final String errorCode,
                                     final String sourceService) {
        Objects.requireNonNull(event, "event");
        return capture(queueName, FailedDelivery.forEvent(event)
                .errorMessage(errorMessage)
                .errorCode(errorCode)
                .sourceService(sourceService)
                .build());
    }

    /**
     * Stores a failed delivery in the named queue.
     *
     * @throws NotFoundException          if the queue does not exist
     * @throws InvalidStateException      if the queue is not active
     * @throws CapacityExceededException  if the queue already holds {@code maxSize} live messages
     */
    public DeadLetterMessage capture(final String queueName, final FailedDelivery failure) {
        Objects.requireNonNull(failure, "failure");
        final DeadLetterQueue queue = requireQueue(queueName);
        if (!queue.isActive()) {
            throw new InvalidStateException("dead-letter queue " + queueName + " is not active (" + queue.getState() + ")");
        }
        if (!queue.tryReserve()) {
            throw new CapacityExceededException("dead-letter queue " + queueName, queue.getMaxSize());
        }

        final Instant now = clock.instant();
        final ErrorCategory category = ErrorClassifier.classify(failure.getErrorMessage());
        final int maxRetries = failure.isRetryable() ? queue.getMaxRetries() : 0;
        final DeadLetterMessage message = new DeadLetterMessage(
                captureSequence.getAndIncrement(), queueName, failure, category, maxRetries, now, now.plus(queue.getRetention()));

        messages.put(message.getMessageId(), message);
        queue.accepted(message.getMessageId(), now);

        trackPattern(message, now);
        evaluateAlerts(queue);

        log.warn("Captured {} into {} from {}:{}@{} ({}: {})",
                message.getMessageId(), queueName, message.getOriginalTopic(), message.getOriginalPartition(),
                message.getOriginalOffset(), category, message.getErrorMessage());
        return message;
    }

    private void trackPattern(final DeadLetterMessage message, final Instant now) {
        final ErrorPattern.Key key = new ErrorPattern.Key(message.getErrorCode(), message.getErrorCategory());
        patterns.computeIfAbsent(key, k -> new ErrorPattern(k, now))
                .record(message.getSourceService(), message.getOriginalTopic(), now);
    }

    /* ---- retry ---- */

    /**
     * Retries one message through the reprocessor.
     *
     * @throws NotFoundException if no message has this id
     */
    public RetryOutcome retry(final String messageId) {
        final DeadLetterMessage message = requireMessage(messageId);

        if (!inFlight.add(messageId)) {
            return RetryOutcome.IN_FLIGHT;
        }
        try {
            final Instant started = clock.instant();
            if (!message.beginRetry(started)) {
                return message.state() == MessageState.PENDING ? RetryOutcome.EXHAUSTED : RetryOutcome.NOT_PENDING;
            }

            try {
                reprocessor.reprocess(message);
            } catch (final Exception e) {
                if (e instanceof InterruptedException) {
                    Thread.currentThread().interrupt();
                }
                scheduleNextAttempt(message, e);
                return RetryOutcome.FAILED;
            } catch (final Error e) {
                scheduleNextAttempt(message, e);
                throw e;
            }

            final Instant now = clock.instant();
            if (message.completeRetry(now)) {
                final DeadLetterQueue queue = queues.get(message.getQueueName());
                if (queue != null) {
                    queue.reprocessed(messageId, now);
                    evaluateAlerts(queue);
                }
                log.info("Reprocessed {} from {} after {} attempt(s)", messageId, message.getQueueName(), message.retryCount());
            }
            return RetryOutcome.REPROCESSED;
        } finally {
            inFlight.remove(messageId);
        }
    }

    /** Returns a failed attempt to {@code PENDING} with its next retry time set by the queue's strategy. */
    private void scheduleNextAttempt(final DeadLetterMessage message, final Throwable failure) {
        final Instant now = clock.instant();
        final DeadLetterQueue queue = queues.get(message.getQueueName());
        final RetryStrategy strategy = queue == null ? RetryStrategy.EXPONENTIAL : queue.getRetryStrategy();
        final Duration delay = retryPolicy.delay(strategy, message.retryCount());
        message.failRetry(now.plus(delay), describe(failure));

        log.debug("Retry {} of {} failed, next attempt after {}: {}",
                message.retryCount(), message.getMessageId(), delay, describe(failure));
    }

    /**
     * Retries up to {@code batchSize} pending messages of the queue, oldest first. Messages with no retries
     * left are passed over.
     */
    public RetrySummary retryAllPending(final String queueName, final int batchSize) {
        if (batchSize < 1) throw new IllegalArgumentException("batchSize must be >= 1");
        final DeadLetterQueue queue = requireQueue(queueName);

        final List<String> pending = new ArrayList<>();
        for (final String id : queue.liveMessageIds()) {
            final DeadLetterMessage m = messages.get(id);
            if (m != null && m.state() == MessageState.PENDING && !m.isExhausted()) {
                pending.add(id);
                if (pending.size() >= batchSize) break;
            }
        }
        return retryAll(pending);
    }

    /** Retries up to {@code batchSize} pending messages, across all queues, whose next retry time has come. */
    public RetrySummary retryDue(final int batchSize) {
        if (batchSize < 1) throw new IllegalArgumentException("batchSize must be >= 1");
        final Instant now = clock.instant();

        final List<String> due = new ArrayList<>();
        for (final DeadLetterQueue queue : queues.values()) {
            if (queue.getState() == DeadLetterQueueState.DISABLED || queue.getState() == DeadLetterQueueState.PAUSED) {
                continue;
            }
            for (final String id : queue.liveMessageIds()) {
                final DeadLetterMessage m = messages.get(id);
                if (m != null && m.isDue(now)) {
                    due.add(id);
                    if (due.size() >= batchSize) return retryAll(due);
                }
            }
        }
        return retryAll(due);
    }

    private RetrySummary retryAll(final List<String> ids) {
        int success = 0;
        int failed = 0;
        for (final String id : ids) {
            if (retry(id).isSuccess()) {
                success++;
            } else {
                failed++;
            }
        }
        return new RetrySummary(success, failed);
    }

    /* ---- discard / expiry ---- */

    /**
     * Discards a pending message for good.
     *
     * @return false if the message is being retried or is already reprocessed, discarded or expired
     * @throws NotFoundException if no message has this id
     */
    public boolean discard(final String messageId, final String reason) {
        final DeadLetterMessage message = requireMessage(messageId);
        if (inFlight.contains(messageId)) {
            return false;
        }

        final Instant now = clock.instant();
        if (!message.discard(reason, now)) {
            return false;
        }

        final DeadLetterQueue queue = queues.get(message.getQueueName());
        if (queue != null) {
            queue.discarded(messageId, now);
            evaluateAlerts(queue);
        }
        log.info("Discarded {} from {}: {}", messageId, message.getQueueName(), reason);
        return true;
    }

    /**
     * Moves pending messages past their retention deadline to {@link MessageState#EXPIRED}, then purges
     * terminal messages processed more than one queue retention period ago.
     *
     * @return number of messages expired
     */
    public int expireOverdue() {
        final Instant now = clock.instant();
        int expired = 0;
        int purged = 0;
        for (final DeadLetterMessage message : messages.values()) {
            final String id = message.getMessageId();
            if (inFlight.contains(id)) continue;

            final DeadLetterQueue queue = queues.get(message.getQueueName());
            if (message.expireIfDue(now)) {
                if (queue != null) {
                    queue.expired(id, now);
                    evaluateAlerts(queue);
                }
                expired++;
            } else if (message.isPurgeable(now, queue == null ? Duration.ZERO : queue.getRetention())) {
                messages.remove(id);
                purged++;
            }
        }
        if (expired > 0 || purged > 0) {
            log.info("Expired {} and purged {} dead-letter messages", expired, purged);
        }
        return expired;
    }

    /* ---- alerting ---- */

    public AlertRule createAlertRule(final String name,
                                     final String queueName,
                                     final long threshold,
                                     final Duration cooldown,
                                     final List<String> channels) {
        final DeadLetterQueue queue = requireQueue(queueName);
        final AlertRule rule = new AlertRule(name, queueName, threshold, cooldown, channels);
        if (alertRules.putIfAbsent(name, rule) != null) {
            throw new DuplicateException("alert rule", name);
        }
        evaluate(rule, queue);
        return rule;
    }

    public Optional<AlertRule> alertRule(final String name) {
        return Optional.ofNullable(alertRules.get(name));
    }

    public Collection<AlertRule> alertRules() {
        return Collections.unmodifiableCollection(alertRules.values());
    }

    private void evaluateAlerts(final DeadLetterQueue queue) {
        for (final AlertRule rule : alertRules.values()) {
            if (rule.getQueueName().equals(queue.getName())) {
                evaluate(rule, queue);
            }
        }
    }

    private void evaluate(final AlertRule rule, final DeadLetterQueue queue) {
        final long pending = queue.messageCount();
        if (!rule.evaluate(pending, clock.instant())) {
            return;
        }
        try {
            notifier.deliver(rule.getName(), queue.getName(), pending);
        } catch (final RuntimeException e) {
            log.warn("Alert notifier failed for rule {} on {}", rule.getName(), queue.getName(), e);
        }
    }

    /* ---- read-only accessors ---- */

    public Optional<DeadLetterMessage> message(final String messageId) {
        return Optional.ofNullable(messages.get(messageId));
    }

    private DeadLetterMessage requireMessage(final String messageId) {
        final DeadLetterMessage message = messages.get(messageId);
        if (message == null) throw new NotFoundException("dead-letter message", messageId);
        return message;
    }

    /**
     * Messages of a queue in capture order. Pending and processing messages come from the queue's live index;
     * other states scan the retained history.
     *
     * @param state null for every state
     */
    public List<DeadLetterMessage> queueMessages(final String queueName, final MessageState state, final int limit) {
        final DeadLetterQueue queue = requireQueue(queueName);
        final List<DeadLetterMessage> out = new ArrayList<>();
        if (state != null && !state.isTerminal()) {
            for (final String id : queue.liveMessageIds()) {
                if (out.size() >= limit) break;
                final DeadLetterMessage m = messages.get(id);
                if (m != null && m.state() == state) out.add(m);
            }
            return out;
        }

        return messages.values().stream()
                .filter(m -> m.getQueueName().equals(queueName))
                .filter(m -> state == null || m.state() == state)
                .sorted(Comparator.comparingLong(DeadLetterMessage::getSequence))
                .limit(limit)
                .toList();
    }

    public ErrorAnalysis errorAnalysis() {
        final Map<ErrorCategory, Long> byCategory = new EnumMap<>(ErrorCategory.class);
        final Map<String, Long> byService = new TreeMap<>();
        for (final DeadLetterMessage m : messages.values()) {
            byCategory.merge(m.getErrorCategory(), 1L, Long::sum);
            if (!m.getSourceService().isEmpty()) {
                byService.merge(m.getSourceService(), 1L, Long::sum);
            }
        }

        final List<ErrorPattern.Summary> top = patterns.values().stream()
                .map(ErrorPattern::summary)
                .sorted(Comparator.comparingLong(ErrorPattern.Summary::occurrences).reversed())
                .limit(TOP_PATTERNS)
                .toList();

        return new ErrorAnalysis(messages.size(), Collections.unmodifiableMap(byCategory),
                Collections.unmodifiableMap(byService), patterns.size(), top);
    }

    public DeadLetterStatistics statistics() {
        final Map<MessageState, Long> byState = new EnumMap<>(MessageState.class);
        for (final DeadLetterMessage m : messages.values()) {
            byState.merge(m.state(), 1L, Long::sum);
        }

        int active = 0;
        long received = 0;
        long reprocessed = 0;
        for (final DeadLetterQueue q : queues.values()) {
            if (q.isActive()) active++;
            received += q.totalReceived();
            reprocessed += q.totalReprocessed();
        }
        final double rate = received > 0 ? reprocessed * 100.0 / received : 0.0;

        return new DeadLetterStatistics(
                queues.size(),
                active,
                messages.size(),
                byState.getOrDefault(MessageState.PENDING, 0L),
                byState.getOrDefault(MessageState.PROCESSING, 0L),
                byState.getOrDefault(MessageState.REPROCESSED, 0L),
                byState.getOrDefault(MessageState.DISCARDED, 0L),
                byState.getOrDefault(MessageState.EXPIRED, 0L),
                received,
                reprocessed,
                rate,
                alertRules.size(),
                patterns.size());
    }

    private static String describe(final Throwable e) {
        return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    }
}
