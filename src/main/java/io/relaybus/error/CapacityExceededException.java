package io.relaybus.error;

import lombok.Getter;

@Getter
public final class CapacityExceededException extends EventBusException {
    private final long capacity;

    public CapacityExceededException(final String target, final long capacity) {
        super(Kind.CAPACITY_EXCEEDED, target + " is full (capacity " + capacity + ")");
        this.capacity = capacity;
    }
}
