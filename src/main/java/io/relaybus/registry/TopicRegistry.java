package io.relaybus.registry;

import io.relaybus.cluster.partitioner.Partitioner;
import io.relaybus.cluster.partitioner.impl.KeyHashPartitioner;
import io.relaybus.core.model.Topic;
import io.relaybus.core.model.TopicState;
import io.relaybus.error.DuplicateException;
import io.relaybus.error.InvalidStateException;
import io.relaybus.error.NotFoundException;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.Collections;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Supplier;

/**
 * Registry of topics and their partition logs.
 */
@Slf4j
public final class TopicRegistry {
    private final ConcurrentMap<String, Topic> topics = new ConcurrentHashMap<>();
    private final Supplier<Partitioner> partitioners;
    private final Clock clock;

    private TopicRegistry(final Supplier<Partitioner> partitioners, final Clock clock) {
        this.partitioners = Objects.requireNonNull(partitioners, "partitioners");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a topic with {@code partitions} empty partition logs.
     *
     * @throws DuplicateException       if a topic with this name already exists
     * @throws IllegalArgumentException if {@code partitions < 1}
     */
    public Topic createTopic(final String name,
                             final int partitions,
                             final Duration retention,
                             final boolean compaction) {
        Objects.requireNonNull(name, "name");
        final Topic fresh = new Topic(name, partitions, retention, compaction, partitioners.get(), clock.instant());

        if (topics.putIfAbsent(name, fresh) != null) {
            throw new DuplicateException("topic", name);
        }
        log.info("Created topic {} with {} partitions (retention {}, compaction {})",
                name, partitions, retention, compaction);
        return fresh;
    }

    public boolean contains(final String topic) {
        return topics.containsKey(topic);
    }

    public Optional<Topic> topic(final String name) {
        return Optional.ofNullable(topics.get(name));
    }

    public Topic require(final String name) {
        final Topic topic = topics.get(name);
        if (topic == null) throw new NotFoundException("topic", name);
        return topic;
    }

    /**
     * @throws NotFoundException     if the topic does not exist
     * @throws InvalidStateException if the topic exists but is not active
     */
    public Topic requireActive(final String name) {
        final Topic topic = require(name);
        if (!topic.isActive()) {
            throw new InvalidStateException("topic " + name + " is not active (" + topic.getState() + ")");
        }
        return topic;
    }

    public Set<String> listTopics() {
        return Collections.unmodifiableSet(topics.keySet());
    }

    public Collection<Topic> topics() {
        return Collections.unmodifiableCollection(topics.values());
    }

    public void pauseTopic(final String name) {
        transition(name, TopicState.PAUSED);
    }

    public void resumeTopic(final String name) {
        transition(name, TopicState.ACTIVE);
    }

    /** Removes the topic; its retained events are dropped with it. */
    public Topic deleteTopic(final String name) {
        final Topic removed = topics.remove(name);
        if (removed == null) throw new NotFoundException("topic", name);
        removed.state(TopicState.DELETED);
        log.info("Deleted topic {}", name);
        return removed;
    }

    private void transition(final String name, final TopicState target) {
        final Topic topic = require(name);
        topic.state(target);
        log.info("Topic {} is now {}", name, target);
    }

    public static final class Builder {
        private Supplier<Partitioner> partitioners = KeyHashPartitioner::new;
        private Clock clock = Clock.systemUTC();

        /** Factory invoked once per topic, so stateful partitioners stay per topic. */
        public Builder partitioners(final Supplier<Partitioner> partitioners) {
            this.partitioners = partitioners;
            return this;
        }

        public Builder clock(final Clock clock) {
            this.clock = clock;
            return this;
        }

        public TopicRegistry build() {
            return new TopicRegistry(partitioners, clock);
        }
    }
}
