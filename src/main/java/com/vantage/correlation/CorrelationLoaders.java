package com.vantage.correlation;

import com.vantage.loader.LoaderDefinition;
import com.vantage.loader.LoaderScope;
import com.vantage.loader.RequestLoader;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.List;

/**
 * Loaders the correlation walker reads the graph store through.
 */
@Configuration
public class CorrelationLoaders {

    public static final String NEIGHBORS_BY_NODE = "correlation-neighbors-by-node";
    public static final String NODE_BY_ID = "correlation-node-by-id";

    @Bean
    public LoaderDefinition<String, List<GraphRelationship>> correlationNeighborsLoader(
            GraphStore graphStore,
            @Value("${vantage.correlation.timeout-ms:2000}") long timeoutMs) {
        return LoaderDefinition.<String, GraphRelationship>grouped(NEIGHBORS_BY_NODE, graphStore::neighborsOf)
                .withMaxBatchSize(200)
                .withTimeout(Duration.ofMillis(timeoutMs));
    }

    @Bean
    public LoaderDefinition<String, GraphNode> correlationNodeLoader(
            GraphStore graphStore,
            @Value("${vantage.correlation.timeout-ms:2000}") long timeoutMs) {
        return LoaderDefinition.<String, GraphNode>single(NODE_BY_ID, graphStore::nodeDetailsOf)
                .withMaxBatchSize(200)
                .withTimeout(Duration.ofMillis(timeoutMs));
    }

    static RequestLoader<String, List<GraphRelationship>> neighbors(LoaderScope scope) {
        return scope.loader(NEIGHBORS_BY_NODE);
    }

    static RequestLoader<String, GraphNode> nodes(LoaderScope scope) {
        return scope.loader(NODE_BY_ID);
    }
}
