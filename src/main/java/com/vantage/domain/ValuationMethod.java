package com.vantage.domain;

/**
 * How a valuation figure was obtained.
 */
public enum ValuationMethod {
    APPRAISAL,
    MARKET_COMPARISON,
    INSURANCE,
    AUTOMATED,
    MANUAL
}
