package com.whereq.coordinator.exception;

import lombok.Getter;

/**
 * Base for coordinator failures. Carries the workflow and the stage it failed in
 * so callers get actionable context without a stack trace.
 */
@Getter
public class CoordinatorException extends RuntimeException {

    private final String workflowId;
    private final String stage;

    public CoordinatorException(String message) {
        this(message, null, null, null);
    }

    public CoordinatorException(String message, Throwable cause) {
        this(message, null, null, cause);
    }

    public CoordinatorException(String message, String workflowId, String stage, Throwable cause) {
        super(message, cause);
        this.workflowId = workflowId;
        this.stage = stage;
    }
}
