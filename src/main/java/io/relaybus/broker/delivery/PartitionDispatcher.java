package io.relaybus.broker.delivery;

import io.relaybus.broker.PublishResult;
import io.relaybus.core.model.Event;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * Delivers one partition's appended events in offset order without holding the append lock.
 * <p>
 * Events are queued under the partition lock, so the queue order is the offset order. Whichever publishing
 * thread wins the {@code draining} flag delivers everything queued, including events other threads appended,
 * and completes their results. A thread that is already delivering never waits for another partition's
 * drainer: a publish made from inside a handler that cannot drain returns a deferred result instead. Only
 * threads that are not delivering ever wait, and they wait only on drainers, which never wait themselves.
 * </p>
 */
@Slf4j
final class PartitionDispatcher {
    private static final ThreadLocal<int[]> DRAIN_DEPTH = ThreadLocal.withInitial(() -> new int[1]);

    private final ConcurrentLinkedQueue<Ticket> queue = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean draining = new AtomicBoolean();
    private final Function<Event, PublishResult> fanOut;

    PartitionDispatcher(final Function<Event, PublishResult> fanOut) {
        this.fanOut = Objects.requireNonNull(fanOut, "fanOut");
    }

    /** Must run under the partition append lock. */
    Ticket enqueue(final Event event) {
        final Ticket ticket = new Ticket(event, new CompletableFuture<>());
        queue.add(ticket);
        return ticket;
    }

    /** Drains the queue if no other thread is, then returns the ticket's result. */
    PublishResult dispatch(final Ticket ticket) {
        drain();

        if (!ticket.result().isDone() && isDelivering()) {
            log.debug("Deferring {} on {}/{}: partition is being delivered", ticket.event().eventId(),
                    ticket.event().topic(), ticket.event().partition());
            return PublishResult.deferred(ticket.event());
        }
        try {
            return ticket.result().join();
        } catch (final CompletionException e) {
            final Throwable cause = e.getCause();
            if (cause instanceof Error error) throw error;
            if (cause instanceof RuntimeException runtime) throw runtime;
            throw e;
        }
    }

    private void drain() {
        final int[] depth = DRAIN_DEPTH.get();
        while (!queue.isEmpty() && draining.compareAndSet(false, true)) {
            depth[0]++;
            try {
                Ticket next;
                while ((next = queue.poll()) != null) {
                    deliver(next);
                }
            } finally {
                depth[0]--;
                draining.set(false);
            }
        }
    }

    private void deliver(final Ticket ticket) {
        try {
            ticket.result().complete(fanOut.apply(ticket.event()));
        } catch (final Throwable t) {
            log.error("Delivery of {} on {}/{}@{} failed", ticket.event().eventId(), ticket.event().topic(),
                    ticket.event().partition(), ticket.event().offset(), t);
            ticket.result().completeExceptionally(t);
        }
    }

    private static boolean isDelivering() {
        return DRAIN_DEPTH.get()[0] > 0;
    }

    record Ticket(Event event, CompletableFuture<PublishResult> result) {
    }
}
