package io.relaybus.broker;

import io.relaybus.broker.delivery.DeadLetterRouter;
import io.relaybus.broker.delivery.DeliveryEngine;
import io.relaybus.broker.delivery.OffsetCommitter;
import io.relaybus.broker.delivery.RedeliveryReprocessor;
import io.relaybus.broker.group.ConsumerGroup;
import io.relaybus.broker.group.ConsumerGroupCoordinator;
import io.relaybus.broker.subscription.Subscription;
import io.relaybus.broker.subscription.SubscriptionRegistry;
import io.relaybus.broker.subscription.SubscriptionRequest;
import io.relaybus.broker.subscription.SubscriptionState;
import io.relaybus.cluster.partitioner.Partitioner;
import io.relaybus.cluster.partitioner.impl.KeyHashPartitioner;
import io.relaybus.core.model.Event;
import io.relaybus.core.model.EventPriority;
import io.relaybus.core.model.Topic;
import io.relaybus.deadletter.DeadLetterMessage;
import io.relaybus.deadletter.DeadLetterQueueManager;
import io.relaybus.deadletter.Reprocessor;
import io.relaybus.deadletter.RetryPolicy;
import io.relaybus.deadletter.alert.AlertNotifier;
import io.relaybus.deadletter.alert.LoggingAlertNotifier;
import io.relaybus.error.InvalidStateException;
import io.relaybus.ledger.PartitionLog;
import io.relaybus.offset.InMemoryOffsetStore;
import io.relaybus.offset.OffsetStore;
import io.relaybus.registry.TopicRegistry;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * In-process partitioned event bus: topics, publish and fan-out, consumer groups, offsets, replay and
 * dead-letter handling behind one entry point.
 */
@Slf4j
@Getter
public final class EventBus {
    public static final Duration DEFAULT_RETENTION = Duration.ofHours(168);

    private final Clock clock;
    private final TopicRegistry topics;
    private final SubscriptionRegistry subscriptions;
    private final ConsumerGroupCoordinator groups;
    private final OffsetStore offsets;
    private final DeadLetterQueueManager deadLetters;

    @Getter(AccessLevel.NONE) private final OffsetCommitter committer;
    @Getter(AccessLevel.NONE) private final DeadLetterRouter router;
    @Getter(AccessLevel.NONE) private final DeliveryEngine engine;

    private EventBus(final Builder b) {
        this.clock = b.clock;
        this.topics = TopicRegistry.builder().partitioners(b.partitioners).clock(b.clock).build();
        this.subscriptions = new SubscriptionRegistry();
        this.groups = new ConsumerGroupCoordinator(subscriptions::isActive, b.clock);
        this.offsets = b.offsetStore;
        this.committer = new OffsetCommitter(topics, offsets);

        final Reprocessor reprocessor = b.reprocessor != null
                ? b.reprocessor
                : new RedeliveryReprocessor(subscriptions, committer);
        this.deadLetters = new DeadLetterQueueManager(b.clock, b.retryPolicy, reprocessor, b.alertNotifier);
        this.router = new DeadLetterRouter(deadLetters);
        this.engine = new DeliveryEngine(subscriptions, groups, committer, router);
    }

    public static Builder builder() {
        return new Builder();
    }

    /* ---- topics ---- */

    public Topic createTopic(final String name, final int partitions) {
        return createTopic(name, partitions, DEFAULT_RETENTION, false);
    }

    public Topic createTopic(final String name, final int partitions, final Duration retention, final boolean compaction) {
        return topics.createTopic(name, partitions, retention, compaction);
    }

    public void pauseTopic(final String name) {
        topics.pauseTopic(name);
    }

    public void resumeTopic(final String name) {
        topics.resumeTopic(name);
    }

    /** Deletes the topic, expires its subscriptions and drops its consumer groups and their offsets. */
    public void deleteTopic(final String name) {
        engine.release(topics.deleteTopic(name));
        for (final Subscription sub : subscriptions.forTopic(name)) {
            sub.state(SubscriptionState.EXPIRED);
        }
        for (final ConsumerGroup g : groups.removeForTopic(name)) {
            offsets.remove(name, g.getName());
        }
    }

    /* ---- publish ---- */

    /**
     * Appends an event and delivers it synchronously to every matching subscription. A publish made from inside
     * a handler may instead return a {@linkplain PublishResult#deferred() deferred} result when its partition is
     * being delivered by another call.
     *
     * @throws io.relaybus.error.NotFoundException if the topic does not exist
     * @throws InvalidStateException               if the topic is paused
     */
    public PublishResult publish(final PublishRequest request) {
        Objects.requireNonNull(request, "request");
        final Topic topic = topics.requireActive(request.getTopic());
        final int partition = topic.partitionFor(request.getKey());

        final Instant now = clock.instant();
        final Instant expiresAt = request.getTtl() == null ? null : now.plus(request.getTtl());
        final String eventId = "evt-" + UUID.randomUUID();

        return engine.publish(topic, partition, offset -> new Event(
                eventId,
                topic.getName(),
                partition,
                offset,
                request.getType(),
                request.getKey(),
                request.getPayload(),
                request.getHeaders(),
                request.getPriority(),
                request.getSource(),
                request.getCorrelationId(),
                request.getCausationId(),
                now,
                expiresAt));
    }

    public PublishResult publish(final String topic,
                                 final String type,
                                 final byte[] payload,
                                 final String key,
                                 final Map<String, String> headers,
                                 final EventPriority priority) {
        return publish(PublishRequest.builder()
                .topic(topic)
                .type(type)
                .payload(payload == null ? new byte[0] : payload)
                .key(key == null ? "" : key)
                .headers(headers == null ? Map.of() : headers)
                .priority(priority == null ? EventPriority.NORMAL : priority)
                .build());
    }

    public PublishResult publish(final String topic, final String type, final String payload, final String key) {
        return publish(topic, type, payload.getBytes(StandardCharsets.UTF_8), key, Map.of(), EventPriority.NORMAL);
    }

    /* ---- subscriptions ---- */

    /**
     * Registers a subscription positioned at the current end of every partition. A grouped subscription
     * joins its group, which rebalances.
     *
     * @throws io.relaybus.error.NotFoundException if the topic does not exist
     * @throws InvalidStateException               if the group is bound to another topic
     */
    public Subscription subscribe(final SubscriptionRequest request) {
        Objects.requireNonNull(request, "request");
        final Topic topic = topics.require(request.getTopic());
        final Subscription sub = new Subscription(request, clock.instant());

        if (sub.isGrouped()) {
            groups.group(sub.getConsumerGroup())
                    .filter(g -> !g.getTopic().equals(topic.getName()))
                    .ifPresent(g -> {
                        throw new InvalidStateException("consumer group " + g.getName()
                                + " is bound to topic " + g.getTopic());
                    });
        }

        for (final PartitionLog p : topic.getPartitions()) {
            final long hwm = p.highWatermark();
            sub.initializeOffset(p.getPartition(), hwm);
            if (sub.isGrouped()) {
                offsets.initialize(topic.getName(), sub.getConsumerGroup(), p.getPartition(), hwm);
            }
        }

        subscriptions.register(sub);
        if (sub.isGrouped()) {
            groups.join(sub.getConsumerGroup(), topic.getName(), topic.partitionCount(), sub.getSubscriptionId());
        }

        log.info("Subscription {} ({}) on {} group '{}' {} / {}", sub.getSubscriptionId(), sub.getName(),
                topic.getName(), sub.getConsumerGroup(), sub.getDeliveryMode(), sub.getAckMode());
        return sub;
    }

    public void unsubscribe(final String subscriptionId) {
        final Subscription sub = subscriptions.remove(subscriptionId);
        sub.state(SubscriptionState.EXPIRED);
        if (sub.isGrouped() && groups.group(sub.getConsumerGroup()).isPresent()) {
            groups.leave(sub.getConsumerGroup(), subscriptionId);
        }
        log.info("Subscription {} removed", subscriptionId);
    }

    /** Stops deliveries to the subscription; a grouped member hands its partitions to the others. */
    public void pauseSubscription(final String subscriptionId) {
        final Subscription sub = subscriptions.require(subscriptionId);
        requireNotExpired(sub);
        sub.state(SubscriptionState.PAUSED);
        rebalanceIfGrouped(sub);
    }

    public void resumeSubscription(final String subscriptionId) {
        final Subscription sub = subscriptions.require(subscriptionId);
        requireNotExpired(sub);
        sub.state(SubscriptionState.ACTIVE);
        rebalanceIfGrouped(sub);
    }

    private static void requireNotExpired(final Subscription sub) {
        if (sub.getState() == SubscriptionState.EXPIRED) {
            throw new InvalidStateException("subscription " + sub.getSubscriptionId() + " has expired");
        }
    }

    private void rebalanceIfGrouped(final Subscription sub) {
        if (sub.isGrouped() && groups.group(sub.getConsumerGroup()).isPresent()) {
            groups.rebalance(sub.getConsumerGroup());
        }
    }

    /**
     * Commits everything up to and including {@code offset}.
     *
     * @return false when the offset is older than what is already committed
     */
    public boolean acknowledge(final String subscriptionId, final int partition, final long offset) {
        return committer.acknowledge(subscriptions.require(subscriptionId), partition, offset);
    }

    /** Rejects an event on behalf of the consumer and dead-letters it. */
    public Optional<DeadLetterMessage> reject(final String subscriptionId, final Event event, final String reason) {
        final Subscription sub = subscriptions.require(subscriptionId);
        Objects.requireNonNull(event, "event");
        sub.recordRejected();
        return router.route(sub, event, reason, "REJECTED");
    }

    /* ---- offsets, lag, replay ---- */

    /** Reads back retained events of one partition, {@code toOffsetInclusive} null meaning up to the end. */
    public List<Event> replay(final String topic, final int partition, final long fromOffset, final Long toOffsetInclusive) {
        return topics.require(topic).partition(partition).read(fromOffset, toOffsetInclusive);
    }

    /** High watermark minus the group's committed offset. */
    public long lag(final String group, final int partition) {
        final ConsumerGroup g = groups.require(group);
        final long hwm = topics.require(g.getTopic()).partition(partition).highWatermark();
        return hwm - offsets.fetch(g.getTopic(), group, partition);
    }

    public Map<Integer, Long> consumerLag(final String group) {
        final ConsumerGroup g = groups.require(group);
        final Map<Integer, Long> lag = new TreeMap<>();
        for (int p = 0; p < g.getPartitionCount(); p++) {
            lag.put(p, lag(group, p));
        }
        return Collections.unmodifiableMap(lag);
    }

    public long subscriptionLag(final String subscriptionId, final int partition) {
        final Subscription sub = subscriptions.require(subscriptionId);
        final long hwm = topics.require(sub.getTopic()).partition(partition).highWatermark();
        return hwm - sub.committedOffset(partition);
    }

    /* ---- statistics ---- */

    public BusStatistics statistics() {
        int partitions = 0;
        long events = 0;
        long bytes = 0;
        for (final Topic t : topics.topics()) {
            partitions += t.partitionCount();
            events += t.messageCount();
            bytes += t.bytesTotal();
        }

        int active = 0;
        for (final Subscription s : subscriptions.all()) {
            if (s.isActive()) active++;
        }

        return new BusStatistics(
                topics.topics().size(),
                partitions,
                subscriptions.all().size(),
                active,
                groups.groups().size(),
                events,
                bytes,
                engine.totalDelivered(),
                engine.totalRejected(),
                engine.totalDeadLettered(),
                deadLetters.statistics());
    }

    public TopicStatistics topicStatistics(final String name) {
        final Topic topic = topics.require(name);
        final List<TopicStatistics.Partition> parts = new ArrayList<>(topic.partitionCount());
        for (final PartitionLog p : topic.getPartitions()) {
            parts.add(new TopicStatistics.Partition(p.getPartition(), p.lowWatermark(), p.highWatermark(), p.retainedCount()));
        }
        return new TopicStatistics(topic.getName(), topic.getState(), topic.partitionCount(), topic.messageCount(),
                topic.bytesTotal(), subscriptions.forTopic(name).size(), List.copyOf(parts));
    }

    public static final class Builder {
        private Clock clock = Clock.systemUTC();
        private Supplier<Partitioner> partitioners = KeyHashPartitioner::new;
        private RetryPolicy retryPolicy = RetryPolicy.defaults();
        private AlertNotifier alertNotifier = new LoggingAlertNotifier();
        private OffsetStore offsetStore = new InMemoryOffsetStore();
        private Reprocessor reprocessor;

        public Builder clock(final Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        /** Partitioner factory, invoked once per topic. */
        public Builder partitioners(final Supplier<Partitioner> partitioners) {
            this.partitioners = Objects.requireNonNull(partitioners, "partitioners");
            return this;
        }

        public Builder retryPolicy(final RetryPolicy retryPolicy) {
            this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
            return this;
        }

        public Builder alertNotifier(final AlertNotifier alertNotifier) {
            this.alertNotifier = Objects.requireNonNull(alertNotifier, "alertNotifier");
            return this;
        }

        public Builder offsetStore(final OffsetStore offsetStore) {
            this.offsetStore = Objects.requireNonNull(offsetStore, "offsetStore");
            return this;
        }

        /** Replaces redelivery to the failing subscription as the dead-letter retry action. */
        public Builder reprocessor(final Reprocessor reprocessor) {
            this.reprocessor = reprocessor;
            return this;
        }

        public EventBus build() {
            return new EventBus(this);
        }
    }
}
