package com.vantage.correlation;

/**
 * What the walker does with a relationship that carries no score.
 */
public enum MissingScorePolicy {
    /** Drop the edge and count it in the traversal metadata. */
    REJECT,
    /** Use the configured default score. */
    DEFAULT_SCORE
}
