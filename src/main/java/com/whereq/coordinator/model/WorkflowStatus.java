package com.whereq.coordinator.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.whereq.coordinator.dto.WorkflowRequest;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.jackson.Jacksonized;

import java.io.Serializable;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Lifecycle record of one workflow.
 *
 * Created at submission and changed only through {@link #mergeObserved} and
 * {@link #terminate}, both of which return a new copy. There are no setters;
 * once the status is terminal the record is frozen.
 *
 * @author WhereQ Inc.
 */
@Getter
@ToString
@EqualsAndHashCode
@Jacksonized
@Builder(toBuilder = true)
public class WorkflowStatus implements Serializable {
    private static final long serialVersionUID = 1L;

    private String id;
    private String type;
    private String userId;
    private QualityLevel qualityLevel;

    @Builder.Default
    private WorkflowPhase status = WorkflowPhase.PENDING;

    /**
     * 0 - 100
     */
    private int progress;

    private Instant createdAt;
    private Instant startedAt;
    private Instant finishedAt;
    private Long durationSeconds;
    private Instant estimatedCompletionTime;

    @Builder.Default
    private List<WorkflowNode> nodes = new ArrayList<>();

    private String errorMessage;

    /**
     * Stage that failed (submission, execution, cancellation, polling)
     */
    private String failedStage;

    private boolean cached;
    private String cacheKey;

    private ResourceAllocation allocation;

    /**
     * Request as accepted, kept so a failed submission can be inspected or replayed
     */
    private WorkflowRequest request;

    @JsonIgnore
    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }

    /**
     * Merge an engine observation. Phase rank and progress never decrease,
     * and a terminal record is returned unchanged.
     *
     * @param observed status derived from the engine
     * @param now time used when the engine reports no finish time
     * @return merged copy, or this when already terminal
     */
    public WorkflowStatus mergeObserved(WorkflowStatus observed, Instant now) {
        if (isTerminal()) {
            return this;
        }

        WorkflowPhase nextPhase = status;
        if (observed.getStatus() != null && (status == null || observed.getStatus().getRank() >= status.getRank())) {
            nextPhase = observed.getStatus();
        }

        WorkflowStatus merged = toBuilder()
            .status(nextPhase)
            .progress(Math.max(progress, observed.getProgress()))
            .startedAt(startedAt != null ? startedAt : observed.getStartedAt())
            .estimatedCompletionTime(observed.getEstimatedCompletionTime() != null
                ? observed.getEstimatedCompletionTime() : estimatedCompletionTime)
            .errorMessage(observed.getErrorMessage() != null ? observed.getErrorMessage() : errorMessage)
            .nodes(mergeNodes(nodes, observed.getNodes()))
            .build();

        if (merged.isTerminal()) {
            merged.finish(observed.getFinishedAt() != null ? observed.getFinishedAt() : now);
            if (merged.getStatus() == WorkflowPhase.SUCCEEDED) {
                merged.progress = 100;
            } else if (merged.getFailedStage() == null) {
                merged.failedStage = "execution";
            }
        }
        return merged;
    }

    /**
     * Force a terminal state (cancellation, exhausted submission, lost workflow).
     *
     * @return terminal copy, or this when already terminal
     */
    public WorkflowStatus terminate(WorkflowPhase phase, String stage, String message, Instant now) {
        if (isTerminal()) {
            return this;
        }
        if (!phase.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal phase: " + phase);
        }
        WorkflowStatus terminated = toBuilder()
            .status(phase)
            .failedStage(stage)
            .errorMessage(message)
            .build();
        terminated.finish(now);
        return terminated;
    }

    private void finish(Instant finished) {
        this.finishedAt = finished;
        this.estimatedCompletionTime = null;
        Instant from = startedAt != null ? startedAt : createdAt;
        if (from != null && finished != null) {
            this.durationSeconds = Math.max(0, Duration.between(from, finished).toSeconds());
        }
    }

    private static List<WorkflowNode> mergeNodes(List<WorkflowNode> current, List<WorkflowNode> observed) {
        Map<String, WorkflowNode> byId = new LinkedHashMap<>();
        if (current != null) {
            current.forEach(node -> byId.put(node.getId(), node));
        }
        if (observed != null) {
            observed.forEach(node -> byId.merge(node.getId(), node, WorkflowNode::merge));
        }
        return new ArrayList<>(byId.values());
    }
}
