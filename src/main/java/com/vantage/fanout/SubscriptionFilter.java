package com.vantage.fanout;

/**
 * Per-subscriber delivery predicate.
 *
 * Evaluated once per (message, subscriber) pair on the publishing thread, so
 * it must be fast and must not mutate the message or the context. An exception
 * thrown here counts as "do not deliver".
 */
@FunctionalInterface
public interface SubscriptionFilter<M> {

    boolean test(M message, SubscriberContext context);

    static <M> SubscriptionFilter<M> acceptAll() {
        return (message, context) -> true;
    }

    default SubscriptionFilter<M> and(SubscriptionFilter<? super M> other) {
        return (message, context) -> test(message, context) && other.test(message, context);
    }
}
