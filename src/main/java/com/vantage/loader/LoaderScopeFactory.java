package com.vantage.loader;

import com.vantage.invalidation.CacheInvalidationBus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Opens a fresh {@link LoaderScope} per request.
 */
public class LoaderScopeFactory {

    private static final Logger logger = LoggerFactory.getLogger(LoaderScopeFactory.class);

    private final LoaderCatalog catalog;
    private final Executor executor;
    private final Duration defaultTimeout;
    private final LoaderMetrics metrics;
    private final CacheInvalidationBus processBus;
    private final AtomicLong sequence = new AtomicLong();

    public LoaderScopeFactory(LoaderCatalog catalog, Executor executor, Duration defaultTimeout,
                              LoaderMetrics metrics, CacheInvalidationBus processBus) {
        this.catalog = catalog;
        this.executor = executor;
        this.defaultTimeout = defaultTimeout;
        this.metrics = metrics;
        this.processBus = processBus;
    }

    public LoaderScope openScope() {
        String id = Long.toString(sequence.incrementAndGet());
        logger.debug("Opening loader scope {} with {} loaders", id, catalog.size());
        return new LoaderScope(id, catalog, executor, defaultTimeout, metrics, processBus);
    }
}
