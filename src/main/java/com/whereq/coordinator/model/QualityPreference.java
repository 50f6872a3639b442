package com.whereq.coordinator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Caller's declared trade-off between result quality and turnaround time
 */
public enum QualityPreference {
    QUALITY("quality", 0.8),
    BALANCED("balanced", 0.5),
    SPEED("speed", 0.2);

    private final String value;
    private final double score;

    QualityPreference(String value, double score) {
        this.value = value;
        this.score = score;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public double getScore() {
        return score;
    }

    @JsonCreator
    public static QualityPreference fromValue(String value) {
        for (QualityPreference preference : values()) {
            if (preference.value.equalsIgnoreCase(value)) {
                return preference;
            }
        }
        throw new IllegalArgumentException("Unknown quality preference: " + value);
    }
}
