package com.whereq.coordinator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Pipeline stages a workflow node can belong to
 */
public enum ProcessingStage {
    PREPARATION("preparation"),
    ANALYSIS("analysis"),
    PREPROCESSING("preprocessing"),
    INFERENCE("inference"),
    POSTPROCESSING("postprocessing"),
    CONVERSION("conversion"),
    CLEANUP("cleanup");

    private final String value;

    ProcessingStage(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static ProcessingStage fromValue(String value) {
        for (ProcessingStage stage : values()) {
            if (stage.value.equalsIgnoreCase(value)) {
                return stage;
            }
        }
        throw new IllegalArgumentException("Unknown processing stage: " + value);
    }

    /**
     * Derive the stage from a node's template name, e.g. "run-inference" → INFERENCE.
     *
     * @return matching stage, or null when the name does not identify one
     */
    public static ProcessingStage fromTemplateName(String templateName) {
        if (templateName == null) {
            return null;
        }
        String name = templateName.toLowerCase();
        for (ProcessingStage stage : values()) {
            if (name.contains(stage.value)) {
                return stage;
            }
        }
        return null;
    }
}
