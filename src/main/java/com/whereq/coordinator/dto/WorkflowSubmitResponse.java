package com.whereq.coordinator.dto;

import com.whereq.coordinator.model.QualityLevel;
import com.whereq.coordinator.model.WorkflowPhase;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Response for workflow creation
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkflowSubmitResponse {
    /**
     * Assigned workflow identifier; for a cache hit, the workflow that produced the result
     */
    private String workflowId;

    /**
     * Current workflow status
     */
    private WorkflowPhase status;

    private QualityLevel qualityLevel;

    /**
     * True when served from the result cache or attached to an identical in-flight workflow
     */
    private boolean cached;

    private Instant submittedAt;

    /**
     * Failed stage (if submission failed)
     */
    private String stage;

    /**
     * Error message (if submission failed)
     */
    private String errorMessage;

    /**
     * Highest quality the caller's tier permits (quota rejections only)
     */
    private QualityLevel permittedQuality;

    /**
     * Create error response
     */
    public static WorkflowSubmitResponse error(String message) {
        return WorkflowSubmitResponse.builder()
            .status(WorkflowPhase.ERROR)
            .errorMessage(message)
            .submittedAt(Instant.now())
            .build();
    }
}
