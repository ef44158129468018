package com.vantage.fanout;

/**
 * Outcome of handing one message to one subscription.
 */
enum OfferResult {
    ACCEPTED,
    /** Accepted, and the oldest buffered message was evicted to make room. */
    ACCEPTED_WITH_DROP,
    /** The subscription was already closed; nothing was buffered. */
    CLOSED
}
