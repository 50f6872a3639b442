package com.whereq.coordinator.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;

/**
 * Per-workflow metrics record, appended to the history once the workflow finishes
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkflowMetrics {
    private String workflowId;
    private String type;
    private QualityLevel qualityLevel;

    /**
     * Seconds spent per stage
     */
    @Builder.Default
    private Map<ProcessingStage, Double> stageDurations = new EnumMap<>(ProcessingStage.class);

    private ResourceAllocation allocation;
    private int errorCount;

    /**
     * Cache hit ratio of the workflow type at completion time
     */
    private double cacheHitRatio;

    private boolean success;
    private Long durationSeconds;
    private Instant recordedAt;
}
