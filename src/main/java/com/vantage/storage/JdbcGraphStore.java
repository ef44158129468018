package com.vantage.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vantage.correlation.GraphNode;
import com.vantage.correlation.GraphRelationship;
import com.vantage.correlation.GraphStore;
import org.springframework.dao.DataRetrievalFailureException;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Graph store backed by the {@code correlation_nodes} and {@code correlation_edges} tables.
 *
 * Edges come back ordered by their insertion sequence so that walks are
 * reproducible. Attributes and evidence are stored as JSON text.
 */
@Repository
public class JdbcGraphStore implements GraphStore {

    private static final TypeReference<Map<String, Object>> ATTRIBUTES = new TypeReference<>() {
    };
    private static final TypeReference<List<String>> EVIDENCE = new TypeReference<>() {
    };

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public JdbcGraphStore(NamedParameterJdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public List<GraphRelationship> neighbors(String nodeId) {
        return neighborsOf(List.of(nodeId)).getOrDefault(nodeId, List.of());
    }

    @Override
    public GraphNode nodeDetails(String nodeId) {
        return nodeDetailsOf(List.of(nodeId)).get(nodeId);
    }

    @Override
    public Map<String, List<GraphRelationship>> neighborsOf(List<String> nodeIds) {
        Map<String, List<GraphRelationship>> bySource = new LinkedHashMap<>();
        if (nodeIds.isEmpty()) {
            return bySource;
        }
        jdbcTemplate.query("SELECT source_id, target_id, relationship_type, score, evidence FROM correlation_edges"
                        + " WHERE source_id IN (:ids) ORDER BY seq",
                Map.of("ids", nodeIds),
                rs -> {
                    GraphRelationship relationship = new GraphRelationship(
                            rs.getString("source_id"),
                            rs.getString("target_id"),
                            rs.getString("relationship_type"),
                            rs.getObject("score", Double.class),
                            readJson(rs.getString("evidence"), EVIDENCE, List.of()));
                    bySource.computeIfAbsent(relationship.getSourceId(), k -> new ArrayList<>()).add(relationship);
                });
        return bySource;
    }

    @Override
    public Map<String, GraphNode> nodeDetailsOf(List<String> nodeIds) {
        Map<String, GraphNode> nodes = new LinkedHashMap<>();
        if (nodeIds.isEmpty()) {
            return nodes;
        }
        jdbcTemplate.query("SELECT id, node_type, attributes FROM correlation_nodes WHERE id IN (:ids)",
                Map.of("ids", nodeIds),
                rs -> {
                    String id = rs.getString("id");
                    nodes.put(id, new GraphNode(id, rs.getString("node_type"),
                            readJson(rs.getString("attributes"), ATTRIBUTES, Map.of())));
                });
        return nodes;
    }

    private <T> T readJson(String json, TypeReference<T> type, T fallback) {
        if (json == null || json.isBlank()) {
            return fallback;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new DataRetrievalFailureException("Unreadable JSON column in correlation graph", e);
        }
    }
}
