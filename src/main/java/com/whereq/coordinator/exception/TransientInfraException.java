package com.whereq.coordinator.exception;

/**
 * Execution engine, cluster or autoscaling API temporarily unreachable. Retried.
 */
public class TransientInfraException extends CoordinatorException {
    public TransientInfraException(String message) {
        super(message);
    }

    public TransientInfraException(String message, Throwable cause) {
        super(message, cause);
    }
}
