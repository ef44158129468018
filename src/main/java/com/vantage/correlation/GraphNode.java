package com.vantage.correlation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Node details as stored in the graph store.
 */
public class GraphNode {

    private final String id;
    private final String type;
    private final Map<String, Object> attributes;

    public GraphNode(String id, String type, Map<String, Object> attributes) {
        this.id = Objects.requireNonNull(id, "id");
        this.type = type;
        this.attributes = attributes == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public String getId() {
        return id;
    }

    public String getType() {
        return type;
    }

    public Map<String, Object> getAttributes() {
        return attributes;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof GraphNode)) {
            return false;
        }
        GraphNode other = (GraphNode) o;
        return id.equals(other.id) && Objects.equals(type, other.type) && attributes.equals(other.attributes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, type, attributes);
    }
}
