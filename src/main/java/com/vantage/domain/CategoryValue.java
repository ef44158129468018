package com.vantage.domain;

public class CategoryValue {

    private String category;
    private double value;
    private int itemCount;

    public CategoryValue() {
    }

    public CategoryValue(String category, double value, int itemCount) {
        this.category = category;
        this.value = value;
        this.itemCount = itemCount;
    }

    public String getCategory() {
        return category;
    }

    public void setCategory(String category) {
        this.category = category;
    }

    public double getValue() {
        return value;
    }

    public void setValue(double value) {
        this.value = value;
    }

    public int getItemCount() {
        return itemCount;
    }

    public void setItemCount(int itemCount) {
        this.itemCount = itemCount;
    }
}
