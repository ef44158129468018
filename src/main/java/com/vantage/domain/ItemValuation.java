package com.vantage.domain;

import java.time.OffsetDateTime;

public class ItemValuation {

    private String id;
    private String itemId;
    private double value;
    private String currency;
    private ValuationMethod method;
    private Double confidence; // 0.0-1.0
    private String notes;
    private String valuedBy;
    private OffsetDateTime valuedAt;

    public ItemValuation() {
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getItemId() {
        return itemId;
    }

    public void setItemId(String itemId) {
        this.itemId = itemId;
    }

    public double getValue() {
        return value;
    }

    public void setValue(double value) {
        this.value = value;
    }

    public String getCurrency() {
        return currency;
    }

    public void setCurrency(String currency) {
        this.currency = currency;
    }

    public ValuationMethod getMethod() {
        return method;
    }

    public void setMethod(ValuationMethod method) {
        this.method = method;
    }

    public Double getConfidence() {
        return confidence;
    }

    public void setConfidence(Double confidence) {
        this.confidence = confidence;
    }

    public String getNotes() {
        return notes;
    }

    public void setNotes(String notes) {
        this.notes = notes;
    }

    public String getValuedBy() {
        return valuedBy;
    }

    public void setValuedBy(String valuedBy) {
        this.valuedBy = valuedBy;
    }

    public OffsetDateTime getValuedAt() {
        return valuedAt;
    }

    public void setValuedAt(OffsetDateTime valuedAt) {
        this.valuedAt = valuedAt;
    }
}
