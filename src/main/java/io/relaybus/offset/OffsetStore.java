package io.relaybus.offset;

/**
 * Committed-offset store for consumer groups. A committed offset is exclusive: it is the next offset the
 * group has yet to process on that partition.
 */
public interface OffsetStore {

    /**
     * Advances the committed offset if {@code offset} is greater than the current one.
     *
     * @return true if the stored value moved forward
     */
    boolean commit(String topic, String group, int partition, long offset);

    /** Returns the committed offset, or 0 when nothing was committed. */
    long fetch(String topic, String group, int partition);

    /** Seeds the committed offset for a partition the group has never committed on. */
    void initialize(String topic, String group, int partition, long offset);

    /** Forgets every offset of the group on the topic. */
    void remove(String topic, String group);
}
