package com.vantage.error;

/**
 * Signals that a downstream store or bus could not serve a request.
 *
 * The source name identifies the loader or store that failed (for example
 * {@code security-event-by-id}). Clients only ever see a generic
 * "temporarily unavailable" message; the source and cause are kept for logs.
 */
public class UpstreamFailureException extends RuntimeException {

    private final String source;

    public UpstreamFailureException(String source, String message) {
        super(message);
        this.source = source;
    }

    public UpstreamFailureException(String source, String message, Throwable cause) {
        super(message, cause);
        this.source = source;
    }

    public String getSource() {
        return source;
    }
}
