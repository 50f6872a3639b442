package com.whereq.coordinator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Request priority and the Kubernetes priority class it maps to.
 * The priority class decides preemption ordering on the cluster.
 */
public enum WorkflowPriority {
    CRITICAL("critical", "system-critical"),
    HIGH("high", "interactive"),
    MEDIUM("medium", "medium-priority-batch"),
    LOW("low", "low-priority-batch"),
    BACKGROUND("background", "maintenance");

    private final String value;
    private final String priorityClassName;

    WorkflowPriority(String value, String priorityClassName) {
        this.value = value;
        this.priorityClassName = priorityClassName;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public String getPriorityClassName() {
        return priorityClassName;
    }

    /**
     * Critical and high priority work is never shrunk under cluster load
     */
    public boolean isProtected() {
        return this == CRITICAL || this == HIGH;
    }

    @JsonCreator
    public static WorkflowPriority fromValue(String value) {
        for (WorkflowPriority priority : values()) {
            if (priority.value.equalsIgnoreCase(value)) {
                return priority;
            }
        }
        throw new IllegalArgumentException("Unknown priority: " + value);
    }
}
