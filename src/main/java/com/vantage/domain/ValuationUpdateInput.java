package com.vantage.domain;

/**
 * Partial update of a valuation; null fields are left unchanged.
 */
public class ValuationUpdateInput {

    private Double value;
    private Double confidence;
    private ValuationMethod method;
    private String notes;

    public Double getValue() {
        return value;
    }

    public void setValue(Double value) {
        this.value = value;
    }

    public Double getConfidence() {
        return confidence;
    }

    public void setConfidence(Double confidence) {
        this.confidence = confidence;
    }

    public ValuationMethod getMethod() {
        return method;
    }

    public void setMethod(ValuationMethod method) {
        this.method = method;
    }

    public String getNotes() {
        return notes;
    }

    public void setNotes(String notes) {
        this.notes = notes;
    }
}
