package com.vantage.loader;

import com.vantage.error.UpstreamFailureException;
import com.vantage.error.UpstreamTimeoutException;
import com.vantage.error.ValidationException;
import com.vantage.invalidation.InvalidatableCache;
import io.micrometer.core.instrument.Timer;
import org.dataloader.DataLoader;
import org.dataloader.DataLoaderFactory;
import org.dataloader.DataLoaderOptions;
import org.dataloader.Try;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Request-scoped loader for one {@link LoaderDefinition}.
 *
 * Wraps a java-dataloader {@link DataLoader}. Keys requested between two
 * dispatches form one batch window: duplicates share a single future, and the
 * distinct keys are fetched in downstream calls of at most
 * {@code maxBatchSize} keys. Resolved values, including "not found", stay
 * cached until {@link #clear(Object)} or {@link #clearAll()}.
 *
 * Each downstream call runs on the loader executor under the definition's
 * deadline. If a call fails, every key in it fails with the same
 * {@link UpstreamFailureException} and none of those keys are cached, so a
 * later load goes downstream again. Retrying is up to the caller.
 */
public class RequestLoader<K, V> implements InvalidatableCache<K> {

    private static final Logger logger = LoggerFactory.getLogger(RequestLoader.class);

    private final LoaderDefinition<K, V> definition;
    private final Executor executor;
    private final Duration timeout;
    private final LoaderMetrics metrics;
    private final DataLoader<K, V> dataLoader;
    private volatile boolean closed;

    RequestLoader(LoaderDefinition<K, V> definition, Executor executor, Duration timeout, LoaderMetrics metrics) {
        this.definition = definition;
        this.executor = executor;
        this.timeout = timeout;
        this.metrics = metrics;
        DataLoaderOptions options = DataLoaderOptions.newOptions()
                .setMaxBatchSize(definition.getMaxBatchSize())
                .setCachingExceptionsEnabled(false);
        this.dataLoader = DataLoaderFactory.newMappedDataLoaderWithTry(this::loadBatch, options);
    }

    /**
     * Queues a key in the current batch window.
     *
     * @throws ValidationException if the key is null or a blank string
     */
    public CompletableFuture<V> load(K key) {
        ensureOpen();
        validateKey(key);
        return dataLoader.load(key);
    }

    /**
     * Queues several keys. The resulting list has the same length and order as
     * {@code keys}, with the absent value standing in for keys not found.
     *
     * The future fails as soon as any key fails. Callers that must keep the
     * resolved siblings of a failed key use {@link #loadManyTry(List)}.
     */
    public CompletableFuture<List<V>> loadMany(List<K> keys) {
        List<CompletableFuture<V>> futures = queueAll(keys);
        return CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .thenApply(ignored -> {
                    List<V> values = new ArrayList<>(futures.size());
                    for (CompletableFuture<V> future : futures) {
                        values.add(future.join());
                    }
                    return values;
                });
    }

    /**
     * Queues several keys and reports each position on its own. Entry
     * {@code i} holds the value (or the absent value) for {@code keys[i]}, or
     * the failure of that key alone. The returned future itself never fails.
     */
    public CompletableFuture<List<Try<V>>> loadManyTry(List<K> keys) {
        List<CompletableFuture<V>> futures = queueAll(keys);
        List<CompletableFuture<Try<V>>> outcomes = new ArrayList<>(futures.size());
        for (CompletableFuture<V> future : futures) {
            outcomes.add(future.handle((value, error) -> error == null
                    ? Try.succeeded(value)
                    : Try.<V>failed(unwrap(error))));
        }
        return CompletableFuture.allOf(outcomes.toArray(new CompletableFuture[0]))
                .thenApply(ignored -> {
                    List<Try<V>> entries = new ArrayList<>(outcomes.size());
                    for (CompletableFuture<Try<V>> outcome : outcomes) {
                        entries.add(outcome.join());
                    }
                    return entries;
                });
    }

    private List<CompletableFuture<V>> queueAll(List<K> keys) {
        ensureOpen();
        if (keys == null) {
            throw new ValidationException("keys", "Key list must not be null");
        }
        keys.forEach(this::validateKey);

        List<CompletableFuture<V>> futures = new ArrayList<>(keys.size());
        for (K key : keys) {
            futures.add(dataLoader.load(key));
        }
        return futures;
    }

    /**
     * Closes the current batch window and issues its downstream calls.
     */
    public void dispatch() {
        ensureOpen();
        dataLoader.dispatch();
    }

    @Override
    public void clear(K key) {
        dataLoader.clear(key);
    }

    @Override
    public void clearAll() {
        dataLoader.clearAll();
    }

    public String getName() {
        return definition.getName();
    }

    DataLoader<K, V> dataLoader() {
        return dataLoader;
    }

    void close() {
        closed = true;
        dataLoader.clearAll();
    }

    private CompletionStage<Map<K, Try<V>>> loadBatch(Set<K> keys) {
        String name = definition.getName();
        List<K> keyList = new ArrayList<>(keys);
        logger.debug("Loader {} dispatching batch of {} keys", name, keyList.size());
        metrics.recordBatch(name, keyList.size());
        Timer.Sample sample = metrics.startTimer();

        CompletableFuture<Map<K, Try<V>>> result = new CompletableFuture<>();
        CompletableFuture.supplyAsync(() -> definition.getFetcher().fetchByKeys(keyList), executor)
                .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .whenComplete((values, error) -> {
                    metrics.stopTimer(sample, name);
                    if (error == null) {
                        result.complete(toTries(keyList, values, Map.of()));
                        return;
                    }
                    Throwable cause = unwrap(error);
                    if (cause instanceof PartialBatchFailureException) {
                        PartialBatchFailureException partial = (PartialBatchFailureException) cause;
                        logger.warn("Loader {} batch partially failed: {} of {} keys errored",
                                name, partial.getFailures().size(), keyList.size());
                        metrics.recordKeyFailures(name, partial.getFailures().size());
                        result.complete(toTries(keyList, partial.getResolved(), partial.getFailures()));
                        return;
                    }
                    result.completeExceptionally(translate(cause));
                });
        return result;
    }

    @SuppressWarnings("unchecked")
    private Map<K, Try<V>> toTries(List<K> keys, Map<?, ?> values, Map<?, ? extends Throwable> failures) {
        Map<K, Try<V>> tries = new LinkedHashMap<>();
        for (K key : keys) {
            Throwable failure = failures.get(key);
            if (failure != null) {
                tries.put(key, Try.failed(asUpstreamFailure(failure)));
                continue;
            }
            V value = values == null ? null : (V) values.get(key);
            tries.put(key, Try.succeeded(value == null ? definition.getAbsentValue() : value));
        }
        return tries;
    }

    private UpstreamFailureException translate(Throwable cause) {
        String name = definition.getName();
        if (cause instanceof TimeoutException) {
            logger.warn("Loader {} batch timed out after {}ms", name, timeout.toMillis());
            metrics.recordBatchTimeout(name);
            return new UpstreamTimeoutException(name, timeout);
        }
        logger.warn("Loader {} batch failed: {}", name, cause.getMessage(), cause);
        metrics.recordBatchFailure(name);
        return asUpstreamFailure(cause);
    }

    private UpstreamFailureException asUpstreamFailure(Throwable cause) {
        if (cause instanceof UpstreamFailureException) {
            return (UpstreamFailureException) cause;
        }
        return new UpstreamFailureException(definition.getName(),
                "Downstream fetch for " + definition.getName() + " failed", cause);
    }

    private void validateKey(K key) {
        if (key == null) {
            throw new ValidationException("key", "Loader " + definition.getName() + " does not accept null keys");
        }
        if (key instanceof String && ((String) key).isBlank()) {
            throw new ValidationException("key", "Loader " + definition.getName() + " does not accept blank keys");
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Loader " + definition.getName() + " belongs to a closed scope");
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
