package com.vantage.loader;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * All loader definitions known to the process, keyed by name.
 */
public class LoaderCatalog {

    private final Map<String, LoaderDefinition<?, ?>> definitions = new LinkedHashMap<>();

    public LoaderCatalog(List<LoaderDefinition<?, ?>> definitions) {
        for (LoaderDefinition<?, ?> definition : definitions) {
            LoaderDefinition<?, ?> previous = this.definitions.putIfAbsent(definition.getName(), definition);
            if (previous != null) {
                throw new IllegalArgumentException("Duplicate loader name: " + definition.getName());
            }
        }
    }

    public Collection<LoaderDefinition<?, ?>> definitions() {
        return Collections.unmodifiableCollection(definitions.values());
    }

    public int size() {
        return definitions.size();
    }
}
