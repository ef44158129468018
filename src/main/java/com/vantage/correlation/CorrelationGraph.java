package com.vantage.correlation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The scored subgraph returned by {@link CorrelationGraphWalker}.
 *
 * Nodes are listed in discovery order and edges in the order they were
 * examined, so two walks over the same graph snapshot produce equal lists.
 */
public class CorrelationGraph {

    private final String seedId;
    private final List<CorrelationNode> nodes;
    private final List<CorrelationEdge> edges;
    private final TraversalMetadata metadata;
    private final Map<String, CorrelationNode> nodesById = new LinkedHashMap<>();

    public CorrelationGraph(String seedId, List<CorrelationNode> nodes, List<CorrelationEdge> edges,
                            TraversalMetadata metadata) {
        this.seedId = seedId;
        this.nodes = Collections.unmodifiableList(new ArrayList<>(nodes));
        this.edges = Collections.unmodifiableList(new ArrayList<>(edges));
        this.metadata = metadata;
        for (CorrelationNode node : nodes) {
            nodesById.put(node.getId(), node);
        }
    }

    public String getSeedId() {
        return seedId;
    }

    public List<CorrelationNode> getNodes() {
        return nodes;
    }

    public List<CorrelationEdge> getEdges() {
        return edges;
    }

    public TraversalMetadata getMetadata() {
        return metadata;
    }

    public CorrelationNode node(String id) {
        return nodesById.get(id);
    }

    /**
     * Reconstructs the strongest path from the seed to {@code id}.
     *
     * @return the edges from seed to target, empty for the seed itself or an unknown id
     */
    public List<CorrelationEdge> pathTo(String id) {
        CorrelationNode current = nodesById.get(id);
        if (current == null) {
            return List.of();
        }
        List<CorrelationEdge> path = new ArrayList<>();
        while (current != null && current.getParentId() != null) {
            CorrelationEdge edge = strongestEdge(current.getParentId(), current.getId());
            if (edge == null) {
                break;
            }
            path.add(edge);
            current = nodesById.get(current.getParentId());
        }
        Collections.reverse(path);
        return path;
    }

    private CorrelationEdge strongestEdge(String sourceId, String targetId) {
        CorrelationEdge best = null;
        for (CorrelationEdge edge : edges) {
            if (edge.getSourceId().equals(sourceId) && edge.getTargetId().equals(targetId)
                    && (best == null || edge.getScore() > best.getScore())) {
                best = edge;
            }
        }
        return best;
    }
}
