package com.whereq.coordinator.exception;

import lombok.Getter;

/**
 * The execution engine or cluster API refused the call (4xx). Not retried.
 */
@Getter
public class EngineRejectedException extends CoordinatorException {

    private final int statusCode;

    public EngineRejectedException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }
}
