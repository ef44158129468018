package com.vantage.security;

/**
 * Fine-grained permissions carried in the caller's token.
 */
public enum Permission {
    READ_SECURITY_EVENTS,
    INGEST_EVENTS,
    UPDATE_EVENTS,
    DELETE_EVENTS,
    READ_CASES,
    CREATE_CASES,
    ASSIGN_CASES,
    READ_IOCS,
    CREATE_IOCS,
    WHITELIST_IOCS,
    READ_CORRELATIONS,
    READ_VALUATIONS,
    WRITE_VALUATIONS,
    RECORD_PRICES
}
