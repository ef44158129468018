package com.vantage.domain;

/**
 * Partial update of a security event; null fields are left unchanged.
 */
public class SecurityEventUpdate {

    private Severity severity;
    private Double riskScore;
    private String message;

    public Severity getSeverity() {
        return severity;
    }

    public void setSeverity(Severity severity) {
        this.severity = severity;
    }

    public Double getRiskScore() {
        return riskScore;
    }

    public void setRiskScore(Double riskScore) {
        this.riskScore = riskScore;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }
}
