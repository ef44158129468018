package com.vantage.correlation;

/**
 * Limits and policies applied to every correlation walk.
 */
public class WalkerSettings {

    private final int maxDepthLimit;
    private final int maxNodes;
    private final MissingScorePolicy missingScorePolicy;
    private final double defaultScore;

    public WalkerSettings(int maxDepthLimit, int maxNodes, MissingScorePolicy missingScorePolicy, double defaultScore) {
        if (maxDepthLimit < 0) {
            throw new IllegalArgumentException("maxDepthLimit must not be negative");
        }
        if (maxNodes < 1) {
            throw new IllegalArgumentException("maxNodes must be positive");
        }
        if (defaultScore < 0.0 || defaultScore > 1.0) {
            throw new IllegalArgumentException("defaultScore must be within [0, 1]");
        }
        this.maxDepthLimit = maxDepthLimit;
        this.maxNodes = maxNodes;
        this.missingScorePolicy = missingScorePolicy == null ? MissingScorePolicy.REJECT : missingScorePolicy;
        this.defaultScore = defaultScore;
    }

    public static WalkerSettings defaults() {
        return new WalkerSettings(5, 500, MissingScorePolicy.REJECT, 0.5);
    }

    public int getMaxDepthLimit() {
        return maxDepthLimit;
    }

    public int getMaxNodes() {
        return maxNodes;
    }

    public MissingScorePolicy getMissingScorePolicy() {
        return missingScorePolicy;
    }

    public double getDefaultScore() {
        return defaultScore;
    }
}
