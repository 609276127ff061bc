package io.relaybus.broker.delivery;

import io.relaybus.broker.PublishResult;
import io.relaybus.broker.group.ConsumerGroupCoordinator;
import io.relaybus.broker.subscription.DeliveryMode;
import io.relaybus.broker.subscription.Subscription;
import io.relaybus.broker.subscription.SubscriptionRegistry;
import io.relaybus.core.model.Event;
import io.relaybus.core.model.Topic;
import io.relaybus.ledger.PartitionLog;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.LongFunction;

/**
 * Appends published events and fans them out to the topic's subscriptions.
 * <p>
 * The append lock covers only offset assignment and queueing; fan-out runs after it is released, through
 * the partition's {@link PartitionDispatcher}, so every owning subscription still sees a partition's events
 * in offset order and handlers are free to publish to any partition. Handler failures never stop the
 * fan-out: they are counted and routed to a dead-letter queue, and an {@link Error} is rethrown only once
 * every other subscription has been served.
 * </p>
 */
@Slf4j
public final class DeliveryEngine {
    private static final String HANDLER_ERROR_CODE = "HANDLER_ERROR";

    private final SubscriptionRegistry subscriptions;
    private final ConsumerGroupCoordinator groups;
    private final OffsetCommitter committer;
    private final DeadLetterRouter router;

    private final ConcurrentMap<PartitionLog, PartitionDispatcher> dispatchers = new ConcurrentHashMap<>();

    private final LongAdder delivered = new LongAdder();
    private final LongAdder rejected = new LongAdder();
    private final LongAdder deadLettered = new LongAdder();

    public DeliveryEngine(final SubscriptionRegistry subscriptions,
                          final ConsumerGroupCoordinator groups,
                          final OffsetCommitter committer,
                          final DeadLetterRouter router) {
        this.subscriptions = Objects.requireNonNull(subscriptions, "subscriptions");
        this.groups = Objects.requireNonNull(groups, "groups");
        this.committer = Objects.requireNonNull(committer, "committer");
        this.router = Objects.requireNonNull(router, "router");
    }

    /**
     * Appends the event built by {@code factory} to the partition and delivers it.
     *
     * @param factory receives the assigned offset
     */
    public PublishResult publish(final Topic topic, final int partition, final LongFunction<Event> factory) {
        final PartitionLog partitionLog = topic.partition(partition);
        final PartitionDispatcher dispatcher = dispatchers.computeIfAbsent(partitionLog, l -> new PartitionDispatcher(this::fanOut));
        return dispatcher.dispatch(partitionLog.append(factory, dispatcher::enqueue));
    }

    /** Drops the dispatchers of a deleted topic. */
    public void release(final Topic topic) {
        for (int p = 0; p < topic.partitionCount(); p++) {
            dispatchers.remove(topic.partition(p));
        }
    }

    private PublishResult fanOut(final Event event) {
        int ok = 0;
        int failed = 0;
        int captured = 0;
        int lost = 0;
        Error fatal = null;

        for (final Subscription sub : subscriptions.forTopic(event.topic())) {
            if (!sub.isActive() || !sub.matches(event)) continue;
            if (sub.isGrouped() && !groups.owns(sub.getConsumerGroup(), sub.getSubscriptionId(), event.partition())) {
                continue;
            }
            if (sub.getDeliveryMode() == DeliveryMode.EXACTLY_ONCE && sub.wasHandled(event.eventId())) {
                continue;
            }

            try {
                committer.beforeHandling(sub, event);
                sub.getHandler().handle(event);
                sub.recordReceived();
                if (sub.getDeliveryMode() == DeliveryMode.EXACTLY_ONCE) {
                    sub.markHandled(event.eventId());
                }
                committer.afterHandled(sub, event);
                ok++;
            } catch (final Throwable e) {
                if (e instanceof InterruptedException) {
                    Thread.currentThread().interrupt();
                }
                if (e instanceof Error error) {
                    if (fatal == null) {
                        fatal = error;
                    } else {
                        fatal.addSuppressed(error);
                    }
                }
                failed++;
                sub.recordRejected();
                log.debug("Subscription {} failed on {}/{}@{}: {}", sub.getSubscriptionId(),
                        event.topic(), event.partition(), event.offset(), DeadLetterRouter.describe(e));

                if (router.route(sub, event, e, HANDLER_ERROR_CODE).isPresent()) {
                    captured++;
                } else {
                    lost++;
                }
            }
        }

        delivered.add(ok);
        rejected.add(failed);
        deadLettered.add(captured);
        log.debug("Published {} to {}/{}@{}: {} delivered, {} rejected", event.eventId(),
                event.topic(), event.partition(), event.offset(), ok, failed);
        if (fatal != null) {
            throw fatal;
        }
        return PublishResult.delivered(event, ok, failed, captured, lost);
    }

    public long totalDelivered() {
        return delivered.sum();
    }

    public long totalRejected() {
        return rejected.sum();
    }

    public long totalDeadLettered() {
        return deadLettered.sum();
    }
}
