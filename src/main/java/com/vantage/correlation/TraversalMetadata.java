package com.vantage.correlation;

import java.util.ArrayList;
import java.util.List;

/**
 * Bookkeeping for one walk. {@code incomplete} is set whenever the result does
 * not cover everything reachable within the requested depth.
 */
public class TraversalMetadata {

    private String algorithm = "BFS";
    private int requestedDepth;
    private int maxDepthReached;
    private double minScore;
    private int nodesExpanded;
    private int edgesExamined;
    private int edgesBelowThreshold;
    private int edgesMissingScore;
    private boolean incomplete;
    private IncompleteReason incompleteReason;
    private List<String> failedNodeIds = new ArrayList<>();
    private long elapsedMs;

    public String getAlgorithm() {
        return algorithm;
    }

    public void setAlgorithm(String algorithm) {
        this.algorithm = algorithm;
    }

    public int getRequestedDepth() {
        return requestedDepth;
    }

    public void setRequestedDepth(int requestedDepth) {
        this.requestedDepth = requestedDepth;
    }

    public int getMaxDepthReached() {
        return maxDepthReached;
    }

    public void setMaxDepthReached(int maxDepthReached) {
        this.maxDepthReached = maxDepthReached;
    }

    public double getMinScore() {
        return minScore;
    }

    public void setMinScore(double minScore) {
        this.minScore = minScore;
    }

    public int getNodesExpanded() {
        return nodesExpanded;
    }

    public void setNodesExpanded(int nodesExpanded) {
        this.nodesExpanded = nodesExpanded;
    }

    public int getEdgesExamined() {
        return edgesExamined;
    }

    public void setEdgesExamined(int edgesExamined) {
        this.edgesExamined = edgesExamined;
    }

    public int getEdgesBelowThreshold() {
        return edgesBelowThreshold;
    }

    public void setEdgesBelowThreshold(int edgesBelowThreshold) {
        this.edgesBelowThreshold = edgesBelowThreshold;
    }

    /**
     * Edges dropped because their score was missing or outside [0, 1].
     */
    public int getEdgesMissingScore() {
        return edgesMissingScore;
    }

    public void setEdgesMissingScore(int edgesMissingScore) {
        this.edgesMissingScore = edgesMissingScore;
    }

    public boolean isIncomplete() {
        return incomplete;
    }

    public void setIncomplete(boolean incomplete) {
        this.incomplete = incomplete;
    }

    public IncompleteReason getIncompleteReason() {
        return incompleteReason;
    }

    public void setIncompleteReason(IncompleteReason incompleteReason) {
        this.incompleteReason = incompleteReason;
    }

    public List<String> getFailedNodeIds() {
        return failedNodeIds;
    }

    public void setFailedNodeIds(List<String> failedNodeIds) {
        this.failedNodeIds = failedNodeIds;
    }

    public long getElapsedMs() {
        return elapsedMs;
    }

    public void setElapsedMs(long elapsedMs) {
        this.elapsedMs = elapsedMs;
    }

    /**
     * Marks the walk incomplete. The first reason recorded wins.
     */
    public void markIncomplete(IncompleteReason reason) {
        this.incomplete = true;
        if (this.incompleteReason == null) {
            this.incompleteReason = reason;
        }
    }
}
