package io.relaybus.error;

/** A topic, queue, message, group or subscription that the caller named does not exist. */
public final class NotFoundException extends EventBusException {

    public NotFoundException(final String entity, final String id) {
        super(Kind.NOT_FOUND, entity + " not found: " + id);
    }
}
