package com.vantage.correlation;

import java.util.Map;

/**
 * A node in a walk result, annotated with its position relative to the seed.
 *
 * {@code parentId} and {@code pathScore} describe the strongest path from the
 * seed: the product of edge scores along the chosen parent chain. The seed has
 * no parent and a path score of 1.0.
 */
public class CorrelationNode {

    private final String id;
    private final String type;
    private final Map<String, Object> attributes;
    private final int depth;
    private final String parentId;
    private final double pathScore;

    public CorrelationNode(String id, String type, Map<String, Object> attributes,
                           int depth, String parentId, double pathScore) {
        this.id = id;
        this.type = type;
        this.attributes = attributes == null ? Map.of() : attributes;
        this.depth = depth;
        this.parentId = parentId;
        this.pathScore = pathScore;
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

    public int getDepth() {
        return depth;
    }

    public String getParentId() {
        return parentId;
    }

    public double getPathScore() {
        return pathScore;
    }

    @Override
    public String toString() {
        return "CorrelationNode{id=" + id + ", depth=" + depth + ", parentId=" + parentId + "}";
    }
}
