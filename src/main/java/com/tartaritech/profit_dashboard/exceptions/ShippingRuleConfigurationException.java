package com.tartaritech.profit_dashboard.exceptions;

/**
 * Raised when a shipping profile's cost rule lacks the parameter its type requires.
 */
public class ShippingRuleConfigurationException extends RuntimeException {

    private final Long profileId;

    public ShippingRuleConfigurationException(Long profileId, String message) {
        super(message);
        this.profileId = profileId;
    }

    public Long getProfileId() {
        return profileId;
    }
}
