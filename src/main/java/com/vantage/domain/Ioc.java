package com.vantage.domain;

import java.time.OffsetDateTime;

/**
 * Indicator of compromise extracted from one or more security events.
 */
public class Ioc {

    private String id;
    private String tenantId;
    private String type; // ip, domain, hash, url
    private String value;
    private Double confidence;
    private boolean whitelisted;
    private String whitelistReason;
    private OffsetDateTime firstSeen;
    private OffsetDateTime lastSeen;

    public Ioc() {
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getTenantId() {
        return tenantId;
    }

    public void setTenantId(String tenantId) {
        this.tenantId = tenantId;
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public String getValue() {
        return value;
    }

    public void setValue(String value) {
        this.value = value;
    }

    public Double getConfidence() {
        return confidence;
    }

    public void setConfidence(Double confidence) {
        this.confidence = confidence;
    }

    public boolean isWhitelisted() {
        return whitelisted;
    }

    public void setWhitelisted(boolean whitelisted) {
        this.whitelisted = whitelisted;
    }

    public String getWhitelistReason() {
        return whitelistReason;
    }

    public void setWhitelistReason(String whitelistReason) {
        this.whitelistReason = whitelistReason;
    }

    public OffsetDateTime getFirstSeen() {
        return firstSeen;
    }

    public void setFirstSeen(OffsetDateTime firstSeen) {
        this.firstSeen = firstSeen;
    }

    public OffsetDateTime getLastSeen() {
        return lastSeen;
    }

    public void setLastSeen(OffsetDateTime lastSeen) {
        this.lastSeen = lastSeen;
    }
}
