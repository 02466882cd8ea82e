package com.tartaritech.profit_dashboard.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum MetricSource {

    GOOGLE_ADS("google_ads", true),
    META_ADS("meta_ads", true),
    SHOPIFY("shopify", false);

    private final String value;
    private final boolean adSource;

    MetricSource(String value, boolean adSource) {
        this.value = value;
        this.adSource = adSource;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isAdSource() {
        return adSource;
    }

    @JsonCreator
    public static MetricSource fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Metric source is required");
        }
        for (MetricSource source : values()) {
            if (source.value.equalsIgnoreCase(value) || source.name().equalsIgnoreCase(value)) {
                return source;
            }
        }
        throw new IllegalArgumentException("Unknown metric source: " + value);
    }
}
