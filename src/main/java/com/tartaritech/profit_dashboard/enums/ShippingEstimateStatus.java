package com.tartaritech.profit_dashboard.enums;

public enum ShippingEstimateStatus {
    NOT_CALCULATED,
    CALCULATED,
    NO_RULE_MATCHED,
    MISCONFIGURED_RULE
}
