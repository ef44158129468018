package com.vantage.fanout;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.FluxSink;
import reactor.core.scheduler.Scheduler;

import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * One consumer attached to one channel.
 *
 * Messages accepted by the filter land in a {@link DropOldestBuffer}; a
 * dedicated scheduler worker drains the buffer into the {@link #messages()}
 * stream as far as downstream demand allows. The publisher only ever touches
 * the buffer, so a slow consumer loses its oldest messages instead of slowing
 * anyone else down.
 *
 * The stream can be subscribed to once. Cancelling it, calling {@link #close()}
 * or {@link FanoutEngine#unsubscribe(EventSubscription)} all detach the
 * subscription, release the buffer and complete the stream.
 */
public class EventSubscription<M> implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(EventSubscription.class);

    private final String id;
    private final EventChannel<M> channel;
    private final SubscriberContext context;
    private final SubscriptionFilter<? super M> filter;
    private final DropOldestBuffer<M> buffer;
    private final Scheduler.Worker worker;
    private final Consumer<EventSubscription<?>> detach;
    private final Flux<M> messages;

    private final AtomicBoolean consumed = new AtomicBoolean();
    private final AtomicBoolean closed = new AtomicBoolean();
    private final AtomicInteger drainRequests = new AtomicInteger();
    private volatile FluxSink<M> sink;

    EventSubscription(String id, EventChannel<M> channel, SubscriberContext context,
                      SubscriptionFilter<? super M> filter, int bufferCapacity,
                      Scheduler scheduler, Consumer<EventSubscription<?>> detach) {
        this.id = id;
        this.channel = channel;
        this.context = context;
        this.filter = filter;
        this.buffer = new DropOldestBuffer<>(bufferCapacity);
        this.worker = scheduler.createWorker();
        this.detach = detach;
        this.messages = Flux.create(this::attach, FluxSink.OverflowStrategy.BUFFER);
    }

    /**
     * The lazy, non-restartable message stream. A second subscriber receives
     * an {@link IllegalStateException}.
     */
    public Flux<M> messages() {
        return messages;
    }

    public String getId() {
        return id;
    }

    public EventChannel<M> getChannel() {
        return channel;
    }

    public SubscriberContext getContext() {
        return context;
    }

    public long droppedCount() {
        return buffer.droppedCount();
    }

    public int pendingCount() {
        return buffer.size();
    }

    public boolean isClosed() {
        return closed.get();
    }

    boolean accepts(M message) {
        return filter.test(message, context);
    }

    /**
     * Buffers a message for delivery. A subscription closed before or while
     * the message is buffered reports {@link OfferResult#CLOSED}.
     */
    OfferResult offer(M message) {
        if (closed.get()) {
            return OfferResult.CLOSED;
        }
        boolean evicted = buffer.offer(message);
        if (closed.get()) {
            buffer.clear();
            return OfferResult.CLOSED;
        }
        if (evicted) {
            logger.debug("Subscription {} on {} dropped its oldest message", id, channel.getName());
        }
        scheduleDrain();
        return evicted ? OfferResult.ACCEPTED_WITH_DROP : OfferResult.ACCEPTED;
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        detach.accept(this);
        buffer.clear();
        worker.dispose();
        FluxSink<M> current = sink;
        if (current != null) {
            current.complete();
        }
        logger.debug("Subscription {} on {} closed", id, channel.getName());
    }

    private void attach(FluxSink<M> newSink) {
        if (!consumed.compareAndSet(false, true)) {
            newSink.error(new IllegalStateException("Subscription " + id + " stream can only be consumed once"));
            return;
        }
        if (closed.get()) {
            newSink.complete();
            return;
        }
        this.sink = newSink;
        newSink.onDispose(this::close);
        newSink.onRequest(requested -> scheduleDrain());
        scheduleDrain();
    }

    private void scheduleDrain() {
        if (sink == null || closed.get()) {
            return;
        }
        if (drainRequests.getAndIncrement() == 0) {
            try {
                worker.schedule(this::drain);
            } catch (RejectedExecutionException e) {
                drainRequests.set(0);
                logger.debug("Subscription {} worker rejected drain after close: {}", id, e.getMessage());
            }
        }
    }

    private void drain() {
        int missed = 1;
        do {
            FluxSink<M> current = sink;
            while (current != null && !closed.get() && current.requestedFromDownstream() > 0) {
                M next = buffer.poll();
                if (next == null) {
                    break;
                }
                current.next(next);
            }
            missed = drainRequests.addAndGet(-missed);
        } while (missed != 0);
    }
}
