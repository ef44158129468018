package com.vantage.loader;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Thrown by a fetcher when a batch succeeded for some keys and failed for others.
 *
 * Only the keys in {@link #getFailures()} are completed exceptionally; the
 * resolved values are delivered to their callers and keys in neither map are
 * treated as not found.
 */
public class PartialBatchFailureException extends RuntimeException {

    private final Map<?, ?> resolved;
    private final Map<?, ? extends Throwable> failures;

    public PartialBatchFailureException(Map<?, ?> resolved, Map<?, ? extends Throwable> failures) {
        super(failures.size() + " key(s) failed in an otherwise successful batch");
        this.resolved = Collections.unmodifiableMap(new HashMap<>(resolved));
        this.failures = Collections.unmodifiableMap(new HashMap<>(failures));
    }

    public Map<?, ?> getResolved() {
        return resolved;
    }

    public Map<?, ? extends Throwable> getFailures() {
        return failures;
    }
}
