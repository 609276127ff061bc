package io.relaybus.deadletter;

import java.time.Duration;
import java.util.Objects;

/**
 * Backoff between dead-letter retries.
 * <ul>
 *   <li>immediate: 0</li>
 *   <li>linear: {@code linearStep * retryCount}</li>
 *   <li>exponential: {@code min(exponentialBase * 2^retryCount, exponentialMax)}</li>
 *   <li>custom: {@code customDelay}</li>
 * </ul>
 */
public record RetryPolicy(Duration linearStep,
                          Duration exponentialBase,
                          Duration exponentialMax,
                          Duration customDelay) {

    public RetryPolicy {
        Objects.requireNonNull(linearStep, "linearStep");
        Objects.requireNonNull(exponentialBase, "exponentialBase");
        Objects.requireNonNull(exponentialMax, "exponentialMax");
        Objects.requireNonNull(customDelay, "customDelay");
        if (linearStep.isNegative() || exponentialBase.isNegative()
                || exponentialMax.isNegative() || customDelay.isNegative()) {
            throw new IllegalArgumentException("retry delays must not be negative");
        }
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(Duration.ofSeconds(10), Duration.ofSeconds(5),
                Duration.ofSeconds(300), Duration.ofSeconds(30));
    }

    public Duration delay(final RetryStrategy strategy, final int retryCount) {
        if (retryCount < 0) throw new IllegalArgumentException("retryCount must be >= 0");

        return switch (strategy) {
            case IMMEDIATE -> Duration.ZERO;
            case LINEAR -> linearStep.multipliedBy(retryCount);
            case EXPONENTIAL -> exponential(retryCount);
            case CUSTOM -> customDelay;
        };
    }

    private Duration exponential(final int retryCount) {
        // 2^30 times any sane base is far past the cap already
        final int shift = Math.min(retryCount, 30);
        final Duration raw = exponentialBase.multipliedBy(1L << shift);
        return raw.compareTo(exponentialMax) > 0 ? exponentialMax : raw;
    }
}
