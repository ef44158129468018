package com.vantage.correlation;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only access to the external correlation graph.
 *
 * Both reads are idempotent and side-effect free. Relationships must be
 * returned in store insertion order, which the walker uses as its final
 * tie-break. Implementations backed by a query language should override the
 * batch variants to answer a whole frontier in one round trip.
 */
public interface GraphStore {

    List<GraphRelationship> neighbors(String nodeId);

    /**
     * @return the node, or null when the store does not know the id
     */
    GraphNode nodeDetails(String nodeId);

    default Map<String, List<GraphRelationship>> neighborsOf(List<String> nodeIds) {
        Map<String, List<GraphRelationship>> result = new LinkedHashMap<>();
        for (String nodeId : nodeIds) {
            result.put(nodeId, neighbors(nodeId));
        }
        return result;
    }

    default Map<String, GraphNode> nodeDetailsOf(List<String> nodeIds) {
        Map<String, GraphNode> result = new LinkedHashMap<>();
        for (String nodeId : nodeIds) {
            GraphNode node = nodeDetails(nodeId);
            if (node != null) {
                result.put(nodeId, node);
            }
        }
        return result;
    }
}
