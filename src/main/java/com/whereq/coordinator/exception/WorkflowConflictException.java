package com.whereq.coordinator.exception;

/**
 * The workflow is in a state that does not allow the requested change,
 * such as cancelling a workflow that already finished
 */
public class WorkflowConflictException extends CoordinatorException {
    public WorkflowConflictException(String workflowId, String message) {
        super(message, workflowId, "cancellation", null);
    }
}
