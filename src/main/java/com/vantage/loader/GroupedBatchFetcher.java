package com.vantage.loader;

import java.util.List;
import java.util.Map;

/**
 * Downstream contract for one-to-many loaders. Keys without rows may be omitted
 * from the result; they resolve to an empty list.
 */
@FunctionalInterface
public interface GroupedBatchFetcher<K, V> {

    Map<K, List<V>> fetchGroupedByKeys(List<K> keys);
}
