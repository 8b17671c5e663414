package com.mouse.oneup.enums;

public enum PricingStatus {
    PRICED,
    INSUFFICIENT_DATA
}
