package com.vantage.domain;

import java.time.OffsetDateTime;

public class ValuationUpdate {

    private String itemId;
    private ItemValuation valuation;
    private Double previousValue; // null for a first valuation
    private double newValue;
    private String changeReason;
    private String updatedBy;
    private OffsetDateTime updatedAt;

    public ValuationUpdate() {
    }

    public String getItemId() {
        return itemId;
    }

    public void setItemId(String itemId) {
        this.itemId = itemId;
    }

    public ItemValuation getValuation() {
        return valuation;
    }

    public void setValuation(ItemValuation valuation) {
        this.valuation = valuation;
    }

    public Double getPreviousValue() {
        return previousValue;
    }

    public void setPreviousValue(Double previousValue) {
        this.previousValue = previousValue;
    }

    public double getNewValue() {
        return newValue;
    }

    public void setNewValue(double newValue) {
        this.newValue = newValue;
    }

    public String getChangeReason() {
        return changeReason;
    }

    public void setChangeReason(String changeReason) {
        this.changeReason = changeReason;
    }

    public String getUpdatedBy() {
        return updatedBy;
    }

    public void setUpdatedBy(String updatedBy) {
        this.updatedBy = updatedBy;
    }

    public OffsetDateTime getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(OffsetDateTime updatedAt) {
        this.updatedAt = updatedAt;
    }
}
