package com.whereq.coordinator.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;

/**
 * One step of a workflow as reported by the execution engine
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class WorkflowNode implements Serializable {
    private static final long serialVersionUID = 1L;

    private String id;
    private String name;
    private ProcessingStage stage;
    private WorkflowPhase phase;
    private String message;
    private int progress;
    private Instant startedAt;
    private Instant finishedAt;

    /**
     * Fold a newer observation into this node without moving it backwards.
     */
    public WorkflowNode merge(WorkflowNode observed) {
        if (phase != null && phase.isTerminal()) {
            return this;
        }
        WorkflowPhase nextPhase = phase;
        if (observed.getPhase() != null && (phase == null || observed.getPhase().getRank() >= phase.getRank())) {
            nextPhase = observed.getPhase();
        }
        return toBuilder()
            .phase(nextPhase)
            .stage(stage != null ? stage : observed.getStage())
            .progress(Math.max(progress, observed.getProgress()))
            .message(observed.getMessage() != null ? observed.getMessage() : message)
            .startedAt(startedAt != null ? startedAt : observed.getStartedAt())
            .finishedAt(nextPhase != null && nextPhase.isTerminal() ? observed.getFinishedAt() : null)
            .build();
    }
}
