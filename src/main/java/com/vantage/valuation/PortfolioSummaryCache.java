package com.vantage.valuation;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.vantage.domain.PortfolioSummary;
import com.vantage.invalidation.CacheInvalidationBus;
import com.vantage.invalidation.CaffeineCacheHandle;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Process-wide cache of the portfolio summary aggregate.
 *
 * The aggregate scans every current valuation, so it is shared between
 * requests and only recomputed after it expires or a valuation write
 * invalidates it through the process bus under {@link #CACHE_NAME}.
 */
@Component
public class PortfolioSummaryCache {

    public static final String CACHE_NAME = "portfolio-summary";
    static final String KEY = "all";

    private final Cache<String, PortfolioSummary> cache;

    public PortfolioSummaryCache(@Qualifier("processCacheBus") CacheInvalidationBus processBus,
                                 @Value("${vantage.valuation.summary-ttl-seconds:300}") long ttlSeconds) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(1)
                .expireAfterWrite(Duration.ofSeconds(ttlSeconds))
                .build();
        processBus.registerCache(CACHE_NAME, new CaffeineCacheHandle<>(cache));
    }

    public PortfolioSummary get(Supplier<PortfolioSummary> compute) {
        return cache.get(KEY, key -> compute.get());
    }
}
