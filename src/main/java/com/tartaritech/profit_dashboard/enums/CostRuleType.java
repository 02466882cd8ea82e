package com.tartaritech.profit_dashboard.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Strategy used to turn a matched shipping rule into a cost.
 * Each type reads exactly one parameter of the cost rule.
 */
public enum CostRuleType {

    FIXED("fixed", "base_cost"),
    PER_ITEM("per_item", "per_item_cost"),
    PERCENTAGE("percentage", "percentage"),
    BASED_ON_SHIPPING_CHARGED("based_on_shipping_charged", "adjustment");

    private final String value;
    private final String requiredParameter;

    CostRuleType(String value, String requiredParameter) {
        this.value = value;
        this.requiredParameter = requiredParameter;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public String getRequiredParameter() {
        return requiredParameter;
    }

    @JsonCreator
    public static CostRuleType fromValue(String value) {
        for (CostRuleType type : values()) {
            if (type.value.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown cost rule type: " + value);
    }
}
