package com.whereq.coordinator.dto;

import com.whereq.coordinator.exception.CoordinatorException;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Error body returned to callers. Carries context, never stack detail.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ErrorResponse {
    private String error;
    private String message;
    private String workflowId;
    private String stage;
    private Instant timestamp;

    public static ErrorResponse of(String error, String message) {
        return ErrorResponse.builder()
            .error(error)
            .message(message)
            .timestamp(Instant.now())
            .build();
    }

    public static ErrorResponse of(String error, CoordinatorException e) {
        return ErrorResponse.builder()
            .error(error)
            .message(e.getMessage())
            .workflowId(e.getWorkflowId())
            .stage(e.getStage())
            .timestamp(Instant.now())
            .build();
    }
}
