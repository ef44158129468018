package com.vantage.correlation;

import com.vantage.error.UpstreamFailureException;
import com.vantage.error.UpstreamTimeoutException;
import com.vantage.error.ValidationException;
import com.vantage.loader.LoaderScope;
import com.vantage.loader.LoaderScopeFactory;
import com.vantage.loader.RequestLoader;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Bounded breadth-first walk that turns a seed entity into a scored correlation subgraph.
 *
 * Algorithm:
 * 1. Validate the arguments before touching the store.
 * 2. Expand the frontier one depth level at a time. The outgoing relationships
 *    of the whole level are fetched through the neighbors loader in one batch.
 * 3. Drop edges scored below {@code minScore} (or without a usable score, see
 *    {@link MissingScorePolicy}). Every surviving edge is recorded, but only
 *    unvisited targets join the next frontier, so each node is expanded at
 *    most once no matter how many paths reach it.
 * 4. Stop when {@code maxDepth} levels have been expanded, the frontier is
 *    empty, or the node cap is hit.
 * 5. Hydrate node details through the request's node loader.
 *
 * A node's parent is the predecessor on its strongest path: smaller depth
 * first, then higher path score, then the first edge the store returned.
 *
 * When the store fails or times out mid-walk the walker does not throw. It
 * returns what it has gathered with {@link TraversalMetadata#isIncomplete()}
 * set, plus the ids of the nodes it could not expand.
 */
public class CorrelationGraphWalker {

    private static final Logger logger = LoggerFactory.getLogger(CorrelationGraphWalker.class);

    static final String UNKNOWN_TYPE = "UNKNOWN";

    private final LoaderScopeFactory scopeFactory;
    private final WalkerSettings settings;
    private final MeterRegistry meterRegistry;
    private final Timer walkTimer;
    private final Counter incompleteCounter;

    public CorrelationGraphWalker(LoaderScopeFactory scopeFactory, WalkerSettings settings, MeterRegistry meterRegistry) {
        this.scopeFactory = scopeFactory;
        this.settings = settings;
        this.meterRegistry = meterRegistry;
        this.walkTimer = Timer.builder("vantage.correlation.walk.latency")
                .description("Duration of correlation graph walks")
                .register(meterRegistry);
        this.incompleteCounter = Counter.builder("vantage.correlation.walk.incomplete")
                .description("Walks that returned a partial subgraph")
                .register(meterRegistry);
    }

    /**
     * Walks in a private loader scope that is closed before returning.
     */
    public CorrelationGraph walk(String seedId, int maxDepth, double minScore) {
        validate(seedId, maxDepth, minScore);
        try (LoaderScope scope = scopeFactory.openScope()) {
            return walk(seedId, maxDepth, minScore, scope);
        }
    }

    /**
     * Walks using the caller's loader scope, sharing its node cache with the
     * rest of the request.
     *
     * @throws ValidationException if the seed is blank, the depth is negative or
     *                             above the configured limit, or the score is outside [0, 1]
     */
    public CorrelationGraph walk(String seedId, int maxDepth, double minScore, LoaderScope scope) {
        validate(seedId, maxDepth, minScore);
        Timer.Sample sample = Timer.start(meterRegistry);
        long started = System.nanoTime();

        TraversalMetadata metadata = new TraversalMetadata();
        metadata.setRequestedDepth(maxDepth);
        metadata.setMinScore(minScore);

        Map<String, Visit> visits = new LinkedHashMap<>();
        List<CorrelationEdge> edges = new ArrayList<>();
        Set<String> failedNodes = new LinkedHashSet<>();
        visits.put(seedId, new Visit(0, null, 1.0));

        List<String> frontier = List.of(seedId);
        int depth = 0;
        boolean nodeLimitReached = false;

        RequestLoader<String, List<GraphRelationship>> neighbors = CorrelationLoaders.neighbors(scope);
        while (!frontier.isEmpty() && depth < maxDepth && !nodeLimitReached) {
            List<CompletableFuture<List<GraphRelationship>>> pending = new ArrayList<>(frontier.size());
            for (String nodeId : frontier) {
                pending.add(neighbors.load(nodeId));
            }
            neighbors.dispatch();

            List<String> next = new ArrayList<>();
            for (int i = 0; i < frontier.size(); i++) {
                String nodeId = frontier.get(i);
                List<GraphRelationship> relationships = await(pending.get(i), nodeId, metadata, failedNodes);
                if (relationships == null) {
                    continue;
                }
                metadata.setNodesExpanded(metadata.getNodesExpanded() + 1);
                Visit source = visits.get(nodeId);

                for (GraphRelationship relationship : relationships) {
                    metadata.setEdgesExamined(metadata.getEdgesExamined() + 1);
                    Double score = usableScore(relationship, metadata);
                    if (score == null) {
                        continue;
                    }
                    if (score < minScore) {
                        metadata.setEdgesBelowThreshold(metadata.getEdgesBelowThreshold() + 1);
                        continue;
                    }

                    String targetId = relationship.getTargetId();
                    double pathScore = source.pathScore * score;
                    Visit target = visits.get(targetId);
                    if (target == null) {
                        if (visits.size() >= settings.getMaxNodes()) {
                            nodeLimitReached = true;
                            metadata.markIncomplete(IncompleteReason.NODE_LIMIT);
                            continue;
                        }
                        visits.put(targetId, new Visit(depth + 1, nodeId, pathScore));
                        next.add(targetId);
                    } else if (target.depth == depth + 1 && pathScore > target.pathScore) {
                        target.parentId = nodeId;
                        target.pathScore = pathScore;
                    }
                    edges.add(new CorrelationEdge(nodeId, targetId, relationship.getRelationshipType(),
                            score, relationship.getEvidence()));
                }
            }
            frontier = next;
            depth++;
        }

        List<CorrelationNode> nodes = hydrate(visits, scope, metadata, failedNodes);

        int deepest = 0;
        for (Visit visit : visits.values()) {
            deepest = Math.max(deepest, visit.depth);
        }
        metadata.setMaxDepthReached(deepest);
        metadata.setFailedNodeIds(new ArrayList<>(failedNodes));
        metadata.setElapsedMs((System.nanoTime() - started) / 1_000_000);
        sample.stop(walkTimer);

        if (metadata.isIncomplete()) {
            incompleteCounter.increment();
            logger.warn("Correlation walk from {} incomplete ({}): {} nodes, {} edges, failed nodes {}",
                    seedId, metadata.getIncompleteReason(), nodes.size(), edges.size(), failedNodes);
        } else {
            logger.debug("Correlation walk from {} depth={} minScore={} returned {} nodes, {} edges",
                    seedId, maxDepth, minScore, nodes.size(), edges.size());
        }
        return new CorrelationGraph(seedId, nodes, edges, metadata);
    }

    private List<CorrelationNode> hydrate(Map<String, Visit> visits, LoaderScope scope,
                                          TraversalMetadata metadata, Set<String> failedNodes) {
        RequestLoader<String, GraphNode> nodeLoader = CorrelationLoaders.nodes(scope);
        Map<String, CompletableFuture<GraphNode>> pending = new LinkedHashMap<>();
        for (String id : visits.keySet()) {
            pending.put(id, nodeLoader.load(id));
        }
        nodeLoader.dispatch();

        List<CorrelationNode> nodes = new ArrayList<>(visits.size());
        for (Map.Entry<String, Visit> entry : visits.entrySet()) {
            String id = entry.getKey();
            Visit visit = entry.getValue();
            GraphNode details = null;
            try {
                details = pending.get(id).join();
            } catch (CompletionException e) {
                if (!(e.getCause() instanceof UpstreamFailureException)) {
                    throw e;
                }
                metadata.markIncomplete(IncompleteReason.HYDRATION_FAILED);
                failedNodes.add(id);
                logger.debug("Could not hydrate correlation node {}: {}", id, e.getCause().getMessage());
            }
            String type = details != null && details.getType() != null ? details.getType() : UNKNOWN_TYPE;
            Map<String, Object> attributes = details != null ? details.getAttributes() : Map.of();
            nodes.add(new CorrelationNode(id, type, attributes, visit.depth, visit.parentId, visit.pathScore));
        }
        return nodes;
    }

    private List<GraphRelationship> await(CompletableFuture<List<GraphRelationship>> future, String nodeId,
                                          TraversalMetadata metadata, Set<String> failedNodes) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (!(cause instanceof UpstreamFailureException)) {
                throw e;
            }
            metadata.markIncomplete(cause instanceof UpstreamTimeoutException
                    ? IncompleteReason.UPSTREAM_TIMEOUT
                    : IncompleteReason.UPSTREAM_FAILURE);
            failedNodes.add(nodeId);
            logger.debug("Could not expand correlation node {}: {}", nodeId, cause.getMessage());
            return null;
        }
    }

    private Double usableScore(GraphRelationship relationship, TraversalMetadata metadata) {
        Double score = relationship.getScore();
        if (score == null && settings.getMissingScorePolicy() == MissingScorePolicy.DEFAULT_SCORE) {
            return settings.getDefaultScore();
        }
        if (score == null || score.isNaN() || score < 0.0 || score > 1.0) {
            metadata.setEdgesMissingScore(metadata.getEdgesMissingScore() + 1);
            return null;
        }
        return score;
    }

    /**
     * Checks walk arguments without touching the store.
     *
     * @throws ValidationException describing the first invalid argument
     */
    public void validate(String seedId, int maxDepth, double minScore) {
        if (seedId == null || seedId.isBlank()) {
            throw new ValidationException("seedId", "Seed id must not be empty");
        }
        if (maxDepth < 0) {
            throw new ValidationException("maxDepth", "maxDepth must not be negative, got " + maxDepth);
        }
        if (maxDepth > settings.getMaxDepthLimit()) {
            throw new ValidationException("maxDepth",
                    "maxDepth must be at most " + settings.getMaxDepthLimit() + ", got " + maxDepth);
        }
        if (Double.isNaN(minScore) || minScore < 0.0 || minScore > 1.0) {
            throw new ValidationException("minScore", "minScore must be within [0, 1], got " + minScore);
        }
    }

    private static final class Visit {
        private final int depth;
        private String parentId;
        private double pathScore;

        private Visit(int depth, String parentId, double pathScore) {
            this.depth = depth;
            this.parentId = parentId;
            this.pathScore = pathScore;
        }
    }
}
