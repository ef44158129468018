package com.vantage.config;

import com.vantage.correlation.CorrelationGraphWalker;
import com.vantage.correlation.MissingScorePolicy;
import com.vantage.correlation.WalkerSettings;
import com.vantage.fanout.FanoutEngine;
import com.vantage.fanout.FanoutMetrics;
import com.vantage.invalidation.CacheInvalidationBus;
import com.vantage.loader.LoaderCatalog;
import com.vantage.loader.LoaderDefinition;
import com.vantage.loader.LoaderMetrics;
import com.vantage.loader.LoaderScopeFactory;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the batching, fan-out and correlation core.
 *
 * Every tunable has a default so the application starts with an empty
 * {@code vantage} section.
 */
@Configuration
public class CoreConfig {

    private static final Logger logger = LoggerFactory.getLogger(CoreConfig.class);

    @Value("${vantage.loader.timeout-ms:1000}")
    private long loaderTimeoutMs;

    @Value("${vantage.loader.executor-threads:16}")
    private int loaderThreads;

    @Value("${vantage.fanout.buffer-capacity:256}")
    private int fanoutBufferCapacity;

    @Value("${vantage.correlation.max-depth-limit:5}")
    private int maxDepthLimit;

    @Value("${vantage.correlation.max-nodes:500}")
    private int maxNodes;

    @Value("${vantage.correlation.missing-score-policy:REJECT}")
    private MissingScorePolicy missingScorePolicy;

    @Value("${vantage.correlation.default-score:0.5}")
    private double defaultScore;

    @Bean(destroyMethod = "shutdown")
    public ExecutorService loaderExecutor() {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "vantage-loader-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        logger.info("Starting loader executor with {} threads", loaderThreads);
        return Executors.newFixedThreadPool(loaderThreads, threadFactory);
    }

    @Bean
    public LoaderMetrics loaderMetrics(MeterRegistry meterRegistry) {
        return new LoaderMetrics(meterRegistry);
    }

    @Bean
    public LoaderCatalog loaderCatalog(List<LoaderDefinition<?, ?>> definitions) {
        LoaderCatalog catalog = new LoaderCatalog(definitions);
        logger.info("Loader catalog holds {} definitions", catalog.size());
        return catalog;
    }

    @Bean
    public CacheInvalidationBus processCacheBus() {
        return new CacheInvalidationBus("process");
    }

    @Bean
    public LoaderScopeFactory loaderScopeFactory(LoaderCatalog catalog,
                                                 @Qualifier("loaderExecutor") ExecutorService loaderExecutor,
                                                 LoaderMetrics loaderMetrics,
                                                 @Qualifier("processCacheBus") CacheInvalidationBus processCacheBus) {
        return new LoaderScopeFactory(catalog, loaderExecutor, Duration.ofMillis(loaderTimeoutMs),
                loaderMetrics, processCacheBus);
    }

    @Bean(destroyMethod = "dispose")
    public Scheduler fanoutScheduler() {
        return Schedulers.newBoundedElastic(Schedulers.DEFAULT_BOUNDED_ELASTIC_SIZE,
                Schedulers.DEFAULT_BOUNDED_ELASTIC_QUEUESIZE, "vantage-fanout");
    }

    @Bean
    public FanoutEngine fanoutEngine(@Qualifier("fanoutScheduler") Scheduler fanoutScheduler, MeterRegistry meterRegistry) {
        logger.info("Fan-out buffer capacity per subscriber: {}", fanoutBufferCapacity);
        return new FanoutEngine(fanoutBufferCapacity, fanoutScheduler, new FanoutMetrics(meterRegistry));
    }

    @Bean
    public WalkerSettings walkerSettings() {
        return new WalkerSettings(maxDepthLimit, maxNodes, missingScorePolicy, defaultScore);
    }

    @Bean
    public CorrelationGraphWalker correlationGraphWalker(LoaderScopeFactory loaderScopeFactory,
                                                        WalkerSettings walkerSettings,
                                                        MeterRegistry meterRegistry) {
        return new CorrelationGraphWalker(loaderScopeFactory, walkerSettings, meterRegistry);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
