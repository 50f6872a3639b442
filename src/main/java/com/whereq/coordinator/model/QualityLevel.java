package com.whereq.coordinator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Discrete quality tier controlling model size and compute spent on a request.
 * Declaration order is the ordering: LOW &lt; MEDIUM &lt; HIGH.
 */
public enum QualityLevel {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high");

    private final String value;

    QualityLevel(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isAbove(QualityLevel other) {
        return compareTo(other) > 0;
    }

    /**
     * Lower of the two levels
     */
    public static QualityLevel min(QualityLevel a, QualityLevel b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    @JsonCreator
    public static QualityLevel fromValue(String value) {
        for (QualityLevel level : values()) {
            if (level.value.equalsIgnoreCase(value)) {
                return level;
            }
        }
        throw new IllegalArgumentException("Unknown quality level: " + value);
    }
}
