package com.vantage.domain;

public enum PriceAlertType {
    PRICE_SPIKE,
    PRICE_DROP
}
