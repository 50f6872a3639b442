package com.whereq.coordinator.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.whereq.coordinator.model.WorkflowStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One reading of a workflow from the execution engine
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EngineObservation {
    /**
     * Status fields as seen by the engine; merged into the stored record
     */
    private WorkflowStatus status;

    /**
     * Workflow outputs, present once the workflow succeeded
     */
    private JsonNode outputs;
}
