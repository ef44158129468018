package com.vantage.loader;

import java.time.Duration;
import java.util.List;

/**
 * Declares a named loader: its downstream fetcher, how many keys go into one
 * downstream call, and how long that call may take.
 *
 * Definitions are immutable and process-wide; every {@link LoaderScope} builds
 * its own cache from them. Use {@link #single} for one-to-one lookups (absent
 * keys resolve to {@code null}) and {@link #grouped} for one-to-many lookups
 * (absent keys resolve to an empty list).
 */
public final class LoaderDefinition<K, V> {

    public static final int DEFAULT_MAX_BATCH_SIZE = 100;

    private final String name;
    private final BatchFetcher<K, V> fetcher;
    private final V absentValue;
    private final int maxBatchSize;
    private final Duration timeout;

    private LoaderDefinition(String name, BatchFetcher<K, V> fetcher, V absentValue, int maxBatchSize, Duration timeout) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Loader name must not be blank");
        }
        if (fetcher == null) {
            throw new IllegalArgumentException("Loader " + name + " needs a fetcher");
        }
        if (maxBatchSize < 1) {
            throw new IllegalArgumentException("Max batch size must be positive, got " + maxBatchSize);
        }
        if (timeout != null && (timeout.isZero() || timeout.isNegative())) {
            throw new IllegalArgumentException("Timeout must be positive, got " + timeout);
        }
        this.name = name;
        this.fetcher = fetcher;
        this.absentValue = absentValue;
        this.maxBatchSize = maxBatchSize;
        this.timeout = timeout;
    }

    public static <K, V> LoaderDefinition<K, V> single(String name, BatchFetcher<K, V> fetcher) {
        return new LoaderDefinition<>(name, fetcher, null, DEFAULT_MAX_BATCH_SIZE, null);
    }

    public static <K, V> LoaderDefinition<K, List<V>> grouped(String name, GroupedBatchFetcher<K, V> fetcher) {
        BatchFetcher<K, List<V>> adapter = fetcher::fetchGroupedByKeys;
        return new LoaderDefinition<K, List<V>>(name, adapter, List.of(), DEFAULT_MAX_BATCH_SIZE, null);
    }

    public LoaderDefinition<K, V> withMaxBatchSize(int maxBatchSize) {
        return new LoaderDefinition<>(name, fetcher, absentValue, maxBatchSize, timeout);
    }

    public LoaderDefinition<K, V> withTimeout(Duration timeout) {
        return new LoaderDefinition<>(name, fetcher, absentValue, maxBatchSize, timeout);
    }

    public String getName() {
        return name;
    }

    public BatchFetcher<K, V> getFetcher() {
        return fetcher;
    }

    /**
     * Value handed to callers whose key the downstream did not return.
     */
    public V getAbsentValue() {
        return absentValue;
    }

    public int getMaxBatchSize() {
        return maxBatchSize;
    }

    /**
     * @return the per-call deadline, or null to use the scope factory default
     */
    public Duration getTimeout() {
        return timeout;
    }

    @Override
    public String toString() {
        return "LoaderDefinition{name=" + name + ", maxBatchSize=" + maxBatchSize + ", timeout=" + timeout + "}";
    }
}
