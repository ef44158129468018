package com.vantage.correlation;

import com.vantage.error.ValidationException;
import com.vantage.invalidation.CacheInvalidationBus;
import com.vantage.loader.LoaderCatalog;
import com.vantage.loader.LoaderMetrics;
import com.vantage.loader.LoaderScopeFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.offset;

@DisplayName("CorrelationGraphWalker")
class CorrelationGraphWalkerTest {

    /**
     * Graph store over in-memory adjacency lists.
     */
    private static class InMemoryGraphStore implements GraphStore {
        private final Map<String, List<GraphRelationship>> edges = new LinkedHashMap<>();
        private final Map<String, GraphNode> nodes = new LinkedHashMap<>();
        private final Set<String> failing = new HashSet<>();
        private final AtomicInteger neighborCalls = new AtomicInteger();
        private long delayMs;

        InMemoryGraphStore edge(String source, String target, Double score) {
            edges.computeIfAbsent(source, k -> new ArrayList<>())
                    .add(new GraphRelationship(source, target, "RELATED", score, List.of("shared-ip")));
            return this;
        }

        InMemoryGraphStore node(String id, String type) {
            nodes.put(id, new GraphNode(id, type, Map.of("label", id)));
            return this;
        }

        @Override
        public List<GraphRelationship> neighbors(String nodeId) {
            neighborCalls.incrementAndGet();
            if (failing.contains(nodeId)) {
                throw new IllegalStateException("graph shard for " + nodeId + " is down");
            }
            if (delayMs > 0) {
                try {
                    Thread.sleep(delayMs);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            return edges.getOrDefault(nodeId, List.of());
        }

        @Override
        public GraphNode nodeDetails(String nodeId) {
            return nodes.get(nodeId);
        }
    }

    private InMemoryGraphStore store;
    private SimpleMeterRegistry meterRegistry;

    @BeforeEach
    void setUp() {
        store = new InMemoryGraphStore();
        meterRegistry = new SimpleMeterRegistry();
    }

    private CorrelationGraphWalker walker(WalkerSettings settings) {
        return walker(settings, Runnable::run, 1000);
    }

    private CorrelationGraphWalker walker(WalkerSettings settings, Executor executor, long timeoutMs) {
        CorrelationLoaders loaders = new CorrelationLoaders();
        LoaderCatalog catalog = new LoaderCatalog(List.of(
                loaders.correlationNeighborsLoader(store, timeoutMs),
                loaders.correlationNodeLoader(store, timeoutMs)));
        LoaderScopeFactory factory = new LoaderScopeFactory(catalog, executor, Duration.ofSeconds(1),
                new LoaderMetrics(meterRegistry), new CacheInvalidationBus("process"));
        return new CorrelationGraphWalker(factory, settings, meterRegistry);
    }

    private static List<String> nodeIds(CorrelationGraph graph) {
        List<String> ids = new ArrayList<>();
        graph.getNodes().forEach(node -> ids.add(node.getId()));
        return ids;
    }

    private static List<String> edgeKeys(CorrelationGraph graph) {
        List<String> keys = new ArrayList<>();
        graph.getEdges().forEach(edge -> keys.add(edge.getSourceId() + "->" + edge.getTargetId()));
        return keys;
    }

    @Test
    @DisplayName("should keep edges above the threshold and never re-expand the seed")
    void shouldWalkScoredGraph() {
        // Given
        store.edge("S", "A", 0.9).edge("S", "B", 0.5).edge("A", "C", 0.8).edge("C", "S", 0.6)
                .node("S", "EVENT").node("A", "IP").node("C", "HOST");

        // When
        CorrelationGraph graph = walker(WalkerSettings.defaults()).walk("S", 2, 0.7);

        // Then
        assertThat(nodeIds(graph)).containsExactly("S", "A", "C");
        assertThat(edgeKeys(graph)).containsExactly("S->A", "A->C");
        assertThat(graph.node("C").getDepth()).isEqualTo(2);
        assertThat(graph.node("C").getParentId()).isEqualTo("A");
        assertThat(graph.node("C").getPathScore()).isCloseTo(0.72, offset(1e-9));
        assertThat(graph.node("A").getType()).isEqualTo("IP");
        assertThat(graph.getMetadata().getEdgesExamined()).isEqualTo(3);
        assertThat(graph.getMetadata().getEdgesBelowThreshold()).isEqualTo(1);
        assertThat(graph.getMetadata().getMaxDepthReached()).isEqualTo(2);
        assertThat(graph.getMetadata().isIncomplete()).isFalse();
        assertThat(graph.pathTo("C")).extracting(CorrelationEdge::getSourceId).containsExactly("S", "A");
    }

    @Test
    @DisplayName("should return only the seed for depth zero without reading neighbors")
    void shouldReturnSeedOnlyForDepthZero() {
        // Given
        store.edge("S", "A", 0.9).node("S", "EVENT");

        // When
        CorrelationGraph graph = walker(WalkerSettings.defaults()).walk("S", 0, 0.5);

        // Then
        assertThat(nodeIds(graph)).containsExactly("S");
        assertThat(graph.getEdges()).isEmpty();
        assertThat(store.neighborCalls.get()).isZero();
    }

    @Test
    @DisplayName("should expand each node once in diamonds and cycles but keep cross edges")
    void shouldHandleDiamondsAndCycles() {
        // Given
        store.edge("S", "A", 0.9).edge("S", "B", 0.8)
                .edge("A", "D", 0.9).edge("B", "D", 0.95)
                .edge("D", "S", 0.9);

        // When
        CorrelationGraph graph = walker(WalkerSettings.defaults()).walk("S", 3, 0.5);

        // Then
        assertThat(nodeIds(graph)).containsExactly("S", "A", "B", "D");
        assertThat(edgeKeys(graph)).containsExactly("S->A", "S->B", "A->D", "B->D", "D->S");
        assertThat(graph.getMetadata().getNodesExpanded()).isEqualTo(4);
        assertThat(graph.node("D").getParentId()).isEqualTo("A");
        assertThat(graph.node("S").getParentId()).isNull();
        assertThat(graph.node("S").getType()).isEqualTo(CorrelationGraphWalker.UNKNOWN_TYPE);
    }

    @Test
    @DisplayName("should pick the parent on the strongest path at the same depth")
    void shouldPreferStrongestPathParent() {
        // Given
        store.edge("S", "A", 0.9).edge("S", "B", 0.9)
                .edge("A", "D", 0.9).edge("B", "D", 0.95);

        // When
        CorrelationGraph graph = walker(WalkerSettings.defaults()).walk("S", 2, 0.5);

        // Then
        assertThat(graph.node("D").getParentId()).isEqualTo("B");
        assertThat(graph.node("D").getPathScore()).isCloseTo(0.855, offset(1e-9));
    }

    @Test
    @DisplayName("should produce identical results for identical walks")
    void shouldBeDeterministic() {
        // Given
        store.edge("S", "A", 0.9).edge("S", "B", 0.8).edge("A", "C", 0.75).edge("B", "C", 0.9).edge("C", "E", 0.99);
        CorrelationGraphWalker walker = walker(WalkerSettings.defaults());

        // When
        CorrelationGraph first = walker.walk("S", 4, 0.7);
        CorrelationGraph second = walker.walk("S", 4, 0.7);

        // Then
        assertThat(nodeIds(second)).isEqualTo(nodeIds(first));
        assertThat(second.getEdges()).isEqualTo(first.getEdges());
    }

    @Test
    @DisplayName("should return a partial graph when the store fails mid-walk")
    void shouldReturnPartialResultOnFailure() {
        // Given
        store.edge("S", "A", 0.9).edge("S", "B", 0.9).edge("A", "C", 0.9);
        store.failing.add("A");

        // When
        CorrelationGraph graph = walker(WalkerSettings.defaults()).walk("S", 3, 0.5);

        // Then
        assertThat(nodeIds(graph)).containsExactly("S", "A", "B");
        assertThat(graph.getMetadata().isIncomplete()).isTrue();
        assertThat(graph.getMetadata().getIncompleteReason()).isEqualTo(IncompleteReason.UPSTREAM_FAILURE);
        assertThat(graph.getMetadata().getFailedNodeIds()).containsExactlyInAnyOrder("A", "B");
        assertThat(meterRegistry.get("vantage.correlation.walk.incomplete").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should mark the walk incomplete when the store exceeds its deadline")
    void shouldReturnPartialResultOnTimeout() {
        // Given
        store.edge("S", "A", 0.9);
        store.delayMs = 500;
        ExecutorService executor = Executors.newCachedThreadPool();
        try {
            // When
            CorrelationGraph graph = walker(WalkerSettings.defaults(), executor, 50).walk("S", 2, 0.5);

            // Then
            assertThat(graph.getMetadata().isIncomplete()).isTrue();
            assertThat(graph.getMetadata().getIncompleteReason()).isEqualTo(IncompleteReason.UPSTREAM_TIMEOUT);
            assertThat(graph.getMetadata().getFailedNodeIds()).contains("S");
            assertThat(nodeIds(graph)).containsExactly("S");
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("should reject edges without a score unless a default score is configured")
    void shouldApplyMissingScorePolicy() {
        // Given
        store.edge("S", "A", null).edge("S", "B", Double.NaN).edge("S", "C", 0.9);

        // When
        CorrelationGraph rejected = walker(WalkerSettings.defaults()).walk("S", 1, 0.5);
        CorrelationGraph defaulted = walker(new WalkerSettings(5, 500, MissingScorePolicy.DEFAULT_SCORE, 0.6))
                .walk("S", 1, 0.5);

        // Then
        assertThat(nodeIds(rejected)).containsExactly("S", "C");
        assertThat(rejected.getMetadata().getEdgesMissingScore()).isEqualTo(2);
        assertThat(nodeIds(defaulted)).containsExactly("S", "A", "C");
        assertThat(defaulted.getMetadata().getEdgesMissingScore()).isEqualTo(1);
        assertThat(defaulted.getEdges().get(0).getScore()).isEqualTo(0.6);
    }

    @Test
    @DisplayName("should stop adding nodes at the node limit")
    void shouldStopAtNodeLimit() {
        // Given
        store.edge("S", "A", 0.9).edge("S", "B", 0.9).edge("S", "C", 0.9).edge("S", "D", 0.9);

        // When
        CorrelationGraph graph = walker(new WalkerSettings(5, 3, MissingScorePolicy.REJECT, 0.5)).walk("S", 2, 0.5);

        // Then
        assertThat(nodeIds(graph)).containsExactly("S", "A", "B");
        assertThat(graph.getMetadata().isIncomplete()).isTrue();
        assertThat(graph.getMetadata().getIncompleteReason()).isEqualTo(IncompleteReason.NODE_LIMIT);
    }

    @Test
    @DisplayName("should validate arguments before touching the store")
    void shouldValidateArguments() {
        CorrelationGraphWalker walker = walker(WalkerSettings.defaults());

        assertThatThrownBy(() -> walker.walk(" ", 2, 0.5)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> walker.walk("S", -1, 0.5)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> walker.walk("S", 6, 0.5))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("at most 5");
        assertThatThrownBy(() -> walker.walk("S", 2, 1.5)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> walker.walk("S", 2, Double.NaN)).isInstanceOf(ValidationException.class);
        assertThat(store.neighborCalls.get()).isZero();
    }
}
