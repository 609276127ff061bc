package io.relaybus.error;

/** Raised when a name that must be unique (topic, dead-letter queue, alert rule) is registered twice. */
public final class DuplicateException extends EventBusException {

    public DuplicateException(final String entity, final String name) {
        super(Kind.DUPLICATE, entity + " already exists: " + name);
    }
}
