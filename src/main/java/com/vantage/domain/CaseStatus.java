package com.vantage.domain;

/**
 * Lifecycle of a security case.
 */
public enum CaseStatus {
    OPEN,
    IN_PROGRESS,
    RESOLVED,
    CLOSED
}
