package com.whereq.coordinator.dto;

import com.whereq.coordinator.model.WorkflowPhase;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Response for workflow cancellation
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkflowCancellationResponse {
    private String workflowId;

    /**
     * Status after cancellation (Failed)
     */
    private WorkflowPhase status;

    private Instant cancelledAt;

    private String message;
}
