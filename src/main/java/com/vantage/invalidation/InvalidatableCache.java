package com.vantage.invalidation;

/**
 * A cache that can evict single keys or everything it holds.
 *
 * @param <K> the key type
 */
public interface InvalidatableCache<K> {

    void clear(K key);

    void clearAll();
}
