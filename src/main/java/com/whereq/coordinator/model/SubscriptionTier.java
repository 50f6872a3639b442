package com.whereq.coordinator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Subscription tiers gating quality ceilings and node pools
 */
public enum SubscriptionTier {
    FREE("free"),
    STANDARD("standard"),
    PREMIUM("premium");

    private final String value;

    SubscriptionTier(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static SubscriptionTier fromValue(String value) {
        for (SubscriptionTier tier : values()) {
            if (tier.value.equalsIgnoreCase(value)) {
                return tier;
            }
        }
        throw new IllegalArgumentException("Unknown subscription tier: " + value);
    }
}
