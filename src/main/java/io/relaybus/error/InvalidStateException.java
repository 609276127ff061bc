package io.relaybus.error;

/** The target exists but is not in a state that allows the requested operation. */
public final class InvalidStateException extends EventBusException {

    public InvalidStateException(final String message) {
        super(Kind.INVALID_STATE, message);
    }

    public InvalidStateException(final String message, final Throwable cause) {
        super(Kind.INVALID_STATE, message, cause);
    }
}
