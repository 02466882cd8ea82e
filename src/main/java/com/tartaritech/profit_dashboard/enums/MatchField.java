package com.tartaritech.profit_dashboard.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Line item attribute a shipping rule is evaluated against.
 */
public enum MatchField {

    PRODUCT_TITLE("product_title"),
    VARIANT_TITLE("variant_title");

    private final String value;

    MatchField(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static MatchField fromValue(String value) {
        for (MatchField field : values()) {
            if (field.value.equalsIgnoreCase(value) || field.name().equalsIgnoreCase(value)) {
                return field;
            }
        }
        throw new IllegalArgumentException("Unknown match field: " + value);
    }
}
