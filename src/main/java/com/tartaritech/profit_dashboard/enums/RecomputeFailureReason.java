package com.tartaritech.profit_dashboard.enums;

public enum RecomputeFailureReason {
    NOT_FOUND,
    MISCONFIGURED_RULE,
    ERROR
}
