package io.relaybus.deadletter;

import io.relaybus.core.model.Event;
import lombok.AccessLevel;
import lombok.Getter;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * A failed delivery held in a dead-letter queue.
 * <p>
 * Identity, payload and error details are fixed at capture. State and retry bookkeeping change only through
 * the transition methods, which run under the message's monitor. Terminal states are final.
 * </p>
 */
@Getter
public final class DeadLetterMessage {
    private final String messageId;
    private final String queueName;
    /** Capture order across all queues of one manager. */
    private final long sequence;

    private final String originalTopic;
    private final int originalPartition;
    private final long originalOffset;
    private final String originalKey;
    @Getter(AccessLevel.NONE) private final byte[] payload;
    private final Map<String, String> headers;
    @Getter(AccessLevel.NONE) private final Event originalEvent;

    private final String errorMessage;
    private final String errorCode;
    private final ErrorCategory errorCategory;
    private final String stackTrace;

    private final String sourceService;
    private final String consumerGroup;
    private final String subscriptionId;

    private final int maxRetries;
    private final Instant failedAt;
    private final Instant expiresAt;

    @Getter(AccessLevel.NONE) private MessageState state = MessageState.PENDING;
    @Getter(AccessLevel.NONE) private int retryCount;
    @Getter(AccessLevel.NONE) private Instant lastRetryAt;
    @Getter(AccessLevel.NONE) private Instant nextRetryAt;
    @Getter(AccessLevel.NONE) private Instant processedAt;
    @Getter(AccessLevel.NONE) private String discardReason;
    @Getter(AccessLevel.NONE) private String lastRetryError;

    DeadLetterMessage(final long sequence,
                      final String queueName,
                      final FailedDelivery failure,
                      final ErrorCategory category,
                      final int maxRetries,
                      final Instant failedAt,
                      final Instant expiresAt) {
        this.messageId = "dlm-" + UUID.randomUUID();
        this.sequence = sequence;
        this.queueName = queueName;
        this.originalTopic = failure.getTopic();
        this.originalPartition = failure.getPartition();
        this.originalOffset = failure.getOffset();
        this.originalKey = failure.getKey() == null ? "" : failure.getKey();
        this.payload = failure.getPayload() == null ? new byte[0] : failure.getPayload().clone();
        this.headers = failure.getHeaders() == null ? Map.of() : Map.copyOf(failure.getHeaders());
        this.originalEvent = failure.getEvent();
        this.errorMessage = failure.getErrorMessage();
        this.errorCode = failure.getErrorCode() == null ? "" : failure.getErrorCode();
        this.errorCategory = category;
        this.stackTrace = failure.getStackTrace() == null ? "" : failure.getStackTrace();
        this.sourceService = failure.getSourceService() == null ? "" : failure.getSourceService();
        this.consumerGroup = failure.getConsumerGroup() == null ? "" : failure.getConsumerGroup();
        this.subscriptionId = failure.getSubscriptionId() == null ? "" : failure.getSubscriptionId();
        this.maxRetries = maxRetries;
        this.failedAt = failedAt;
        this.expiresAt = expiresAt;
    }

    public byte[] payload() {
        return payload.clone();
    }

    public String payloadAsString() {
        return new String(payload, StandardCharsets.UTF_8);
    }

    /** The event as it was appended, when the failure came from the bus. */
    public Optional<Event> originalEvent() {
        return Optional.ofNullable(originalEvent);
    }

    /* ---- transitions ---- */

    /**
     * Moves a pending message with retries left to {@code PROCESSING} and counts the attempt.
     *
     * @return false if the message is not pending or has no retries left
     */
    synchronized boolean beginRetry(final Instant now) {
        if (state != MessageState.PENDING || retryCount >= maxRetries) {
            return false;
        }
        state = MessageState.PROCESSING;
        retryCount++;
        lastRetryAt = now;
        return true;
    }

    synchronized boolean completeRetry(final Instant now) {
        if (state != MessageState.PROCESSING) return false;
        state = MessageState.REPROCESSED;
        processedAt = now;
        nextRetryAt = null;
        lastRetryError = null;
        return true;
    }

    synchronized void failRetry(final Instant nextRetry, final String error) {
        if (state != MessageState.PROCESSING) return;
        state = MessageState.PENDING;
        nextRetryAt = nextRetry;
        lastRetryError = error;
    }

    /** @return false if the message is in flight or already terminal */
    synchronized boolean discard(final String reason, final Instant now) {
        if (state != MessageState.PENDING) return false;
        state = MessageState.DISCARDED;
        discardReason = reason == null ? "" : reason;
        processedAt = now;
        nextRetryAt = null;
        return true;
    }

    synchronized boolean expireIfDue(final Instant now) {
        if (state != MessageState.PENDING || expiresAt == null || now.isBefore(expiresAt)) return false;
        state = MessageState.EXPIRED;
        processedAt = now;
        nextRetryAt = null;
        return true;
    }

    synchronized boolean isDue(final Instant now) {
        return state == MessageState.PENDING
                && retryCount < maxRetries
                && (nextRetryAt == null || !now.isBefore(nextRetryAt));
    }

    /** True once a terminal message has been kept for {@code retention} after it was processed. */
    synchronized boolean isPurgeable(final Instant now, final Duration retention) {
        return state.isTerminal() && processedAt != null && !now.isBefore(processedAt.plus(retention));
    }

    /* ---- accessors for mutable state ---- */

    public synchronized MessageState state() {
        return state;
    }

    public synchronized int retryCount() {
        return retryCount;
    }

    public synchronized boolean isExhausted() {
        return retryCount >= maxRetries;
    }

    public synchronized Optional<Instant> lastRetryAt() {
        return Optional.ofNullable(lastRetryAt);
    }

    public synchronized Optional<Instant> nextRetryAt() {
        return Optional.ofNullable(nextRetryAt);
    }

    public synchronized Optional<Instant> processedAt() {
        return Optional.ofNullable(processedAt);
    }

    public synchronized Optional<String> discardReason() {
        return Optional.ofNullable(discardReason);
    }

    public synchronized Optional<String> lastRetryError() {
        return Optional.ofNullable(lastRetryError);
    }
}
