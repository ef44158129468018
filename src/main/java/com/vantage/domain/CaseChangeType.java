package com.vantage.domain;

public enum CaseChangeType {
    CREATED,
    ASSIGNED
}
