package com.vantage.invalidation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Registry of named caches that write paths evict after a successful mutation.
 *
 * A bus is either process-scoped (long-lived caches such as the portfolio
 * summary) or request-scoped (one per {@link com.vantage.loader.LoaderScope}).
 * A request bus may delegate to a process bus: an eviction by name reaches the
 * local registration and the parent registration of the same name.
 *
 * Evictions run synchronously on the calling thread, so once
 * {@link #invalidate(String, Object)} returns, no later read can observe the
 * stale entry. The bus never infers related caches; callers name every cache
 * an entity change affects. Unknown names are rejected because they always
 * indicate a wiring mistake.
 */
public class CacheInvalidationBus {

    private static final Logger logger = LoggerFactory.getLogger(CacheInvalidationBus.class);

    private final String scopeName;
    private final CacheInvalidationBus parent;
    private final ConcurrentMap<String, InvalidatableCache<?>> caches = new ConcurrentHashMap<>();

    public CacheInvalidationBus(String scopeName) {
        this(scopeName, null);
    }

    public CacheInvalidationBus(String scopeName, CacheInvalidationBus parent) {
        this.scopeName = scopeName;
        this.parent = parent;
    }

    /**
     * Registers a cache under a name unique within this bus.
     *
     * @throws IllegalArgumentException if the name is blank or already taken
     */
    public void registerCache(String name, InvalidatableCache<?> cache) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Cache name must not be blank");
        }
        if (cache == null) {
            throw new IllegalArgumentException("Cache handle must not be null");
        }
        InvalidatableCache<?> existing = caches.putIfAbsent(name, cache);
        if (existing != null) {
            throw new IllegalArgumentException("Cache '" + name + "' is already registered on bus " + scopeName);
        }
        logger.debug("Registered cache {} on bus {}", name, scopeName);
    }

    /**
     * Evicts one key from the named cache here and in the parent bus.
     *
     * @throws IllegalArgumentException if neither this bus nor its parent knows the name
     */
    public <K> void invalidate(String name, K key) {
        if (key == null) {
            throw new IllegalArgumentException("Cannot invalidate a null key in cache " + name);
        }
        boolean found = clearLocal(name, key);
        if (parent != null) {
            found |= parent.clearLocal(name, key);
        }
        if (!found) {
            throw unknownCache(name);
        }
        logger.debug("Invalidated {}:{} on bus {}", name, key, scopeName);
    }

    /**
     * Evicts every entry of the named cache here and in the parent bus.
     */
    public void invalidateAll(String name) {
        boolean found = clearAllLocal(name);
        if (parent != null) {
            found |= parent.clearAllLocal(name);
        }
        if (!found) {
            throw unknownCache(name);
        }
        logger.debug("Invalidated all entries of {} on bus {}", name, scopeName);
    }

    public boolean isRegistered(String name) {
        return caches.containsKey(name) || (parent != null && parent.isRegistered(name));
    }

    public Set<String> registeredNames() {
        return Set.copyOf(caches.keySet());
    }

    @SuppressWarnings("unchecked")
    private <K> boolean clearLocal(String name, K key) {
        InvalidatableCache<K> cache = (InvalidatableCache<K>) caches.get(name);
        if (cache == null) {
            return false;
        }
        cache.clear(key);
        return true;
    }

    private boolean clearAllLocal(String name) {
        InvalidatableCache<?> cache = caches.get(name);
        if (cache == null) {
            return false;
        }
        cache.clearAll();
        return true;
    }

    private IllegalArgumentException unknownCache(String name) {
        return new IllegalArgumentException("No cache named '" + name + "' is registered on bus " + scopeName);
    }
}
