package com.vantage.invalidation;

import com.github.benmanes.caffeine.cache.Cache;

/**
 * Exposes a process-level Caffeine cache to the invalidation bus.
 */
public class CaffeineCacheHandle<K> implements InvalidatableCache<K> {

    private final Cache<K, ?> cache;

    public CaffeineCacheHandle(Cache<K, ?> cache) {
        this.cache = cache;
    }

    @Override
    public void clear(K key) {
        cache.invalidate(key);
    }

    @Override
    public void clearAll() {
        cache.invalidateAll();
    }
}
