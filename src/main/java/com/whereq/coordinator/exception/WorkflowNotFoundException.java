package com.whereq.coordinator.exception;

/**
 * No status record exists for the workflow id
 */
public class WorkflowNotFoundException extends CoordinatorException {
    public WorkflowNotFoundException(String workflowId) {
        super("Workflow not found: " + workflowId, workflowId, null, null);
    }
}
