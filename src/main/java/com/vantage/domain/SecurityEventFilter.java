package com.vantage.domain;

import java.util.List;

/**
 * Optional criteria for the live security event stream. An unset criterion matches everything.
 */
public class SecurityEventFilter {

    private List<Severity> severities;
    private Double riskScoreThreshold;
    private List<String> deviceVendors;

    public List<Severity> getSeverities() {
        return severities;
    }

    public void setSeverities(List<Severity> severities) {
        this.severities = severities;
    }

    public Double getRiskScoreThreshold() {
        return riskScoreThreshold;
    }

    public void setRiskScoreThreshold(Double riskScoreThreshold) {
        this.riskScoreThreshold = riskScoreThreshold;
    }

    public List<String> getDeviceVendors() {
        return deviceVendors;
    }

    public void setDeviceVendors(List<String> deviceVendors) {
        this.deviceVendors = deviceVendors;
    }

    public boolean matches(SecurityEvent event) {
        if (severities != null && !severities.isEmpty() && !severities.contains(event.getSeverity())) {
            return false;
        }
        if (riskScoreThreshold != null
                && (event.getRiskScore() == null || event.getRiskScore() < riskScoreThreshold)) {
            return false;
        }
        return deviceVendors == null || deviceVendors.isEmpty() || deviceVendors.contains(event.getDeviceVendor());
    }
}
