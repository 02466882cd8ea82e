package com.tartaritech.profit_dashboard.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum MatchOperator {

    CONTAINS("contains"),
    EQUALS("equals"),
    STARTS_WITH("starts_with"),
    ENDS_WITH("ends_with");

    private final String value;

    MatchOperator(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean test(String fieldValue, String matchValue) {
        switch (this) {
            case CONTAINS:
                return fieldValue.contains(matchValue);
            case EQUALS:
                return fieldValue.equals(matchValue);
            case STARTS_WITH:
                return fieldValue.startsWith(matchValue);
            case ENDS_WITH:
                return fieldValue.endsWith(matchValue);
            default:
                return false;
        }
    }

    @JsonCreator
    public static MatchOperator fromValue(String value) {
        for (MatchOperator operator : values()) {
            if (operator.value.equalsIgnoreCase(value) || operator.name().equalsIgnoreCase(value)) {
                return operator;
            }
        }
        throw new IllegalArgumentException("Unknown match operator: " + value);
    }
}
