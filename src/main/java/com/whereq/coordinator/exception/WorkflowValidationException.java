package com.whereq.coordinator.exception;

/**
 * Malformed workflow request, rejected before any allocation
 */
public class WorkflowValidationException extends CoordinatorException {
    public WorkflowValidationException(String message) {
        super(message, null, "validation", null);
    }
}
