package com.vantage.correlation;

/**
 * Why a walk returned only part of the reachable subgraph.
 */
public enum IncompleteReason {
    UPSTREAM_FAILURE,
    UPSTREAM_TIMEOUT,
    NODE_LIMIT,
    HYDRATION_FAILED
}
