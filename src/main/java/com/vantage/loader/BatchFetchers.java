package com.vantage.loader;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Adapters from list-returning repository queries to the batch fetch contracts.
 *
 * Repositories usually answer {@code WHERE id IN (...)} with rows in whatever
 * order the database picks; these helpers re-key the rows so the loader can
 * line them up with the requested keys.
 */
public final class BatchFetchers {

    private BatchFetchers() {
    }

    /**
     * Indexes rows by key. When the downstream returns duplicates the first row wins.
     */
    public static <K, V> BatchFetcher<K, V> indexedBy(Function<List<K>, List<V>> query, Function<V, K> keyExtractor) {
        return keys -> {
            Map<K, V> byKey = new LinkedHashMap<>();
            for (V row : query.apply(keys)) {
                byKey.putIfAbsent(keyExtractor.apply(row), row);
            }
            return byKey;
        };
    }

    /**
     * Groups rows by key, keeping the downstream row order inside each group.
     */
    public static <K, V> GroupedBatchFetcher<K, V> groupedBy(Function<List<K>, List<V>> query, Function<V, K> keyExtractor) {
        return keys -> {
            Map<K, List<V>> grouped = new LinkedHashMap<>();
            for (V row : query.apply(keys)) {
                grouped.computeIfAbsent(keyExtractor.apply(row), k -> new ArrayList<>()).add(row);
            }
            return grouped;
        };
    }
}
