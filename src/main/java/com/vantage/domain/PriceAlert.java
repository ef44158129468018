package com.vantage.domain;

import java.time.OffsetDateTime;

/**
 * Published when a recorded price moves by at least the alert threshold
 * against the previous price of the same type.
 */
public class PriceAlert {

    private String itemId;
    private PriceAlertType alertType;
    private double previousPrice;
    private double currentPrice;
    private double changePercent;
    private String message;
    private OffsetDateTime triggeredAt;

    public PriceAlert() {
    }

    public String getItemId() {
        return itemId;
    }

    public void setItemId(String itemId) {
        this.itemId = itemId;
    }

    public PriceAlertType getAlertType() {
        return alertType;
    }

    public void setAlertType(PriceAlertType alertType) {
        this.alertType = alertType;
    }

    public double getPreviousPrice() {
        return previousPrice;
    }

    public void setPreviousPrice(double previousPrice) {
        this.previousPrice = previousPrice;
    }

    public double getCurrentPrice() {
        return currentPrice;
    }

    public void setCurrentPrice(double currentPrice) {
        this.currentPrice = currentPrice;
    }

    public double getChangePercent() {
        return changePercent;
    }

    public void setChangePercent(double changePercent) {
        this.changePercent = changePercent;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    public OffsetDateTime getTriggeredAt() {
        return triggeredAt;
    }

    public void setTriggeredAt(OffsetDateTime triggeredAt) {
        this.triggeredAt = triggeredAt;
    }
}
