package com.vantage.error;

import java.time.Duration;

/**
 * A downstream call exceeded its deadline.
 *
 * Handled like {@link UpstreamFailureException} everywhere, but kept as a
 * separate type so callers can apply their own retry or backoff policy.
 */
public class UpstreamTimeoutException extends UpstreamFailureException {

    private final Duration timeout;

    public UpstreamTimeoutException(String source, Duration timeout) {
        super(source, "Call to " + source + " timed out after " + timeout.toMillis() + "ms");
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
