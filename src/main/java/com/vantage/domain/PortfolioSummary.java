package com.vantage.domain;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Aggregate of current valuations across all items.
 */
public class PortfolioSummary {

    private double totalValue;
    private int itemCount;
    private int valuedItemCount;
    private List<CategoryValue> valueByCategory = new ArrayList<>();
    private OffsetDateTime computedAt;

    public PortfolioSummary() {
    }

    public double getTotalValue() {
        return totalValue;
    }

    public void setTotalValue(double totalValue) {
        this.totalValue = totalValue;
    }

    public int getItemCount() {
        return itemCount;
    }

    public void setItemCount(int itemCount) {
        this.itemCount = itemCount;
    }

    public int getValuedItemCount() {
        return valuedItemCount;
    }

    public void setValuedItemCount(int valuedItemCount) {
        this.valuedItemCount = valuedItemCount;
    }

    public List<CategoryValue> getValueByCategory() {
        return valueByCategory;
    }

    public void setValueByCategory(List<CategoryValue> valueByCategory) {
        this.valueByCategory = valueByCategory;
    }

    public OffsetDateTime getComputedAt() {
        return computedAt;
    }

    public void setComputedAt(OffsetDateTime computedAt) {
        this.computedAt = computedAt;
    }
}
