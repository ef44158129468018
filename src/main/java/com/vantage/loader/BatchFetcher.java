package com.vantage.loader;

import java.util.List;
import java.util.Map;

/**
 * Downstream contract for one-to-one loaders.
 *
 * Implementations must accept keys in any order and return a map keyed by the
 * requested keys. A key missing from the map is treated as "not found".
 * To report that only some keys failed, throw {@link PartialBatchFailureException}.
 */
@FunctionalInterface
public interface BatchFetcher<K, V> {

    Map<K, V> fetchByKeys(List<K> keys);
}
