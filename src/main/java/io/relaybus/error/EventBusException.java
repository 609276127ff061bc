package io.relaybus.error;

import lombok.Getter;

/**
 * Base type for every failure the bus reports to its callers.
 * <p>
 * Callers that need to branch on the failure switch over {@link #getKind()} rather than
 * catching each subclass.
 * </p>
 */
@Getter
public abstract class EventBusException extends RuntimeException {

    public enum Kind {
        NOT_FOUND,
        INVALID_STATE,
        CAPACITY_EXCEEDED,
        DUPLICATE
    }

    private final Kind kind;

    protected EventBusException(final Kind kind, final String message) {
        super(message);
        this.kind = kind;
    }

    protected EventBusException(final Kind kind, final String message, final Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
