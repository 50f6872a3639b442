package com.whereq.coordinator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Workflow lifecycle phases as reported by the execution engine
 *
 * Transitions:
 * Pending → Running → {Succeeded, Failed, Error}
 */
public enum WorkflowPhase {
    /**
     * Accepted, not yet scheduled on the cluster
     */
    PENDING("Pending", 0),

    /**
     * At least one node executing
     */
    RUNNING("Running", 1),

    /**
     * Completed successfully
     */
    SUCCEEDED("Succeeded", 2),

    /**
     * A step failed or the workflow was cancelled
     */
    FAILED("Failed", 2),

    /**
     * Infrastructure error, including submission that never reached the engine
     */
    ERROR("Error", 2);

    private final String value;
    private final int rank;

    WorkflowPhase(String value, int rank) {
        this.value = value;
        this.rank = rank;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Position in the lifecycle; reconciliation never moves to a lower rank
     */
    public int getRank() {
        return rank;
    }

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == ERROR;
    }

    @JsonCreator
    public static WorkflowPhase fromValue(String value) {
        for (WorkflowPhase phase : values()) {
            if (phase.value.equalsIgnoreCase(value)) {
                return phase;
            }
        }
        throw new IllegalArgumentException("Unknown workflow phase: " + value);
    }

    /**
     * Map an engine phase string, tolerating node-only phases and blanks.
     */
    public static WorkflowPhase fromEngine(String phase) {
        if (phase == null || phase.isBlank()) {
            return PENDING;
        }
        return switch (phase) {
            case "Running" -> RUNNING;
            case "Succeeded", "Skipped", "Omitted" -> SUCCEEDED;
            case "Failed" -> FAILED;
            case "Error" -> ERROR;
            default -> PENDING;
        };
    }
}
