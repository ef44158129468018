package com.vantage.loader;

import com.vantage.invalidation.CacheInvalidationBus;
import org.dataloader.DataLoaderRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Executor;

/**
 * The cache lifetime of one logical request.
 *
 * A scope holds one {@link RequestLoader} per catalog definition, all backed by
 * a single {@link DataLoaderRegistry}, plus a request-scoped
 * {@link CacheInvalidationBus} on which every loader is registered under its
 * definition name. Scopes are never shared between requests: each one is
 * opened by {@link LoaderScopeFactory#openScope()} and discarded with
 * {@link #close()}.
 *
 * For GraphQL executions the scope travels in the GraphQL context under
 * {@link #CONTEXT_KEY}, and graphql-java dispatches its loaders at the end of
 * every execution level. Code outside a GraphQL execution calls
 * {@link #dispatch()} to close the batch window explicitly.
 */
public class LoaderScope implements AutoCloseable {

    public static final String CONTEXT_KEY = "vantage.loaderScope";

    private static final Logger logger = LoggerFactory.getLogger(LoaderScope.class);

    private final String id;
    private final Map<String, RequestLoader<?, ?>> loaders = new LinkedHashMap<>();
    private final DataLoaderRegistry registry = new DataLoaderRegistry();
    private final CacheInvalidationBus invalidationBus;
    private volatile boolean closed;

    LoaderScope(String id, LoaderCatalog catalog, Executor executor, Duration defaultTimeout,
                LoaderMetrics metrics, CacheInvalidationBus processBus) {
        this.id = id;
        this.invalidationBus = new CacheInvalidationBus("request-" + id, processBus);
        for (LoaderDefinition<?, ?> definition : catalog.definitions()) {
            register(definition, executor, defaultTimeout, metrics);
        }
    }

    private <K, V> void register(LoaderDefinition<K, V> definition, Executor executor,
                                 Duration defaultTimeout, LoaderMetrics metrics) {
        Duration timeout = definition.getTimeout() != null ? definition.getTimeout() : defaultTimeout;
        RequestLoader<K, V> loader = new RequestLoader<>(definition, executor, timeout, metrics);
        loaders.put(definition.getName(), loader);
        registry.register(definition.getName(), loader.dataLoader());
        invalidationBus.registerCache(definition.getName(), loader);
    }

    /**
     * Returns the loader registered under {@code name}.
     *
     * @throws IllegalArgumentException if no definition carries that name
     */
    @SuppressWarnings("unchecked")
    public <K, V> RequestLoader<K, V> loader(String name) {
        ensureOpen();
        RequestLoader<?, ?> loader = loaders.get(name);
        if (loader == null) {
            throw new IllegalArgumentException("Unknown loader: " + name);
        }
        return (RequestLoader<K, V>) loader;
    }

    /**
     * Dispatches the pending batch window of every loader in this scope.
     */
    public void dispatch() {
        ensureOpen();
        registry.dispatchAll();
    }

    public CacheInvalidationBus invalidation() {
        return invalidationBus;
    }

    public DataLoaderRegistry registry() {
        return registry;
    }

    public Map<String, RequestLoader<?, ?>> loaders() {
        return Collections.unmodifiableMap(loaders);
    }

    public String getId() {
        return id;
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Drops every cached entry. Later loads through this scope fail with
     * {@link IllegalStateException}. Calling close twice is harmless.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        loaders.values().forEach(RequestLoader::close);
        logger.debug("Closed loader scope {}", id);
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Loader scope " + id + " is closed");
        }
    }
}
