package com.vantage.fanout;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.scheduler.Scheduler;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process publish/subscribe with per-subscriber filters and buffers.
 *
 * Channels are created on first use and keep no history: a message published
 * while nobody listens is gone, and a new subscriber only sees messages
 * published after it attached. Delivery is at-most-once. For a single
 * publisher on a single channel every subscriber sees messages in publish
 * order; nothing is promised across channels.
 *
 * {@link #publish} evaluates each subscriber's filter on the caller's thread
 * and hands accepted messages to that subscriber's bounded buffer. It never
 * waits on a consumer. A filter that throws is logged, counted and treated as
 * a non-match.
 *
 * Instances are plain objects wired through the constructor. Tests create as
 * many isolated engines as they need.
 */
public class FanoutEngine {

    private static final Logger logger = LoggerFactory.getLogger(FanoutEngine.class);

    private final ConcurrentMap<String, ChannelState> channels = new ConcurrentHashMap<>();
    private final int bufferCapacity;
    private final Scheduler deliveryScheduler;
    private final FanoutMetrics metrics;
    private final AtomicLong sequence = new AtomicLong();

    public FanoutEngine(int bufferCapacity, Scheduler deliveryScheduler, FanoutMetrics metrics) {
        if (bufferCapacity < 1) {
            throw new IllegalArgumentException("Subscriber buffer capacity must be positive, got " + bufferCapacity);
        }
        this.bufferCapacity = bufferCapacity;
        this.deliveryScheduler = deliveryScheduler;
        this.metrics = metrics;
    }

    /**
     * Delivers a message to every current subscriber of the channel whose filter accepts it.
     *
     * @return the number of subscribers the message was handed to
     * @throws IllegalArgumentException if the message is null or does not match the channel type
     */
    public <M> int publish(EventChannel<M> channel, M message) {
        if (message == null) {
            throw new IllegalArgumentException("Cannot publish a null message on " + channel.getName());
        }
        if (!channel.getMessageType().isInstance(message)) {
            throw new IllegalArgumentException("Channel " + channel.getName() + " carries "
                    + channel.getMessageType().getSimpleName() + ", got " + message.getClass().getSimpleName());
        }
        ChannelState state = stateFor(channel);
        metrics.published(channel.getName());

        int delivered = 0;
        for (EventSubscription<?> candidate : state.subscriptions) {
            @SuppressWarnings("unchecked")
            EventSubscription<M> subscription = (EventSubscription<M>) candidate;
            if (!matches(subscription, message)) {
                continue;
            }
            try {
                OfferResult result = subscription.offer(message);
                if (result == OfferResult.CLOSED) {
                    logger.debug("Subscription {} on {} closed before delivery", subscription.getId(),
                            channel.getName());
                    continue;
                }
                if (result == OfferResult.ACCEPTED_WITH_DROP) {
                    metrics.dropped(channel.getName());
                }
                metrics.delivered(channel.getName());
                delivered++;
            } catch (RuntimeException e) {
                metrics.deliveryError(channel.getName());
                logger.error("Delivery to subscription {} on {} failed", subscription.getId(), channel.getName(), e);
            }
        }
        logger.debug("Published to {}: {} of {} subscribers accepted",
                channel.getName(), delivered, state.subscriptions.size());
        return delivered;
    }

    /**
     * Attaches a new subscriber. Messages are buffered from this moment on,
     * even before {@link EventSubscription#messages()} is consumed.
     */
    public <M> EventSubscription<M> subscribe(EventChannel<M> channel, SubscriberContext context,
                                              SubscriptionFilter<? super M> filter) {
        if (context == null) {
            throw new IllegalArgumentException("Subscriber context must not be null");
        }
        if (filter == null) {
            throw new IllegalArgumentException("Subscription filter must not be null");
        }
        ChannelState state = stateFor(channel);
        String id = channel.getName() + "-" + sequence.incrementAndGet();
        EventSubscription<M> subscription = new EventSubscription<>(id, channel, context, filter,
                bufferCapacity, deliveryScheduler, detached -> state.subscriptions.remove(detached));
        state.subscriptions.add(subscription);
        logger.debug("Subscriber {} attached to {} as {}", context.getSubscriberId(), channel.getName(), id);
        return subscription;
    }

    /**
     * Detaches a subscription. Idempotent.
     */
    public void unsubscribe(EventSubscription<?> subscription) {
        if (subscription != null) {
            subscription.close();
        }
    }

    public int subscriberCount(EventChannel<?> channel) {
        ChannelState state = channels.get(channel.getName());
        return state == null ? 0 : state.subscriptions.size();
    }

    private <M> boolean matches(EventSubscription<M> subscription, M message) {
        try {
            return subscription.accepts(message);
        } catch (RuntimeException e) {
            metrics.filterError(subscription.getChannel().getName());
            logger.warn("Filter of subscription {} on {} threw {}; message not delivered",
                    subscription.getId(), subscription.getChannel().getName(), e.toString());
            return false;
        }
    }

    private ChannelState stateFor(EventChannel<?> channel) {
        ChannelState state = channels.computeIfAbsent(channel.getName(), name -> {
            logger.debug("Creating channel {}", channel);
            return new ChannelState(channel.getMessageType());
        });
        if (!state.messageType.equals(channel.getMessageType())) {
            throw new IllegalArgumentException("Channel " + channel.getName() + " is bound to "
                    + state.messageType.getSimpleName() + ", not " + channel.getMessageType().getSimpleName());
        }
        return state;
    }

    private static final class ChannelState {
        private final Class<?> messageType;
        private final List<EventSubscription<?>> subscriptions = new CopyOnWriteArrayList<>();

        private ChannelState(Class<?> messageType) {
            this.messageType = messageType;
        }
    }
}
