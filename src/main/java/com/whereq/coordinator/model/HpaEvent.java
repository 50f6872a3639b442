package com.whereq.coordinator.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Scaling activity observed on a HorizontalPodAutoscaler
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HpaEvent {
    public static final String SCALE_UP = "scale-up";
    public static final String SCALE_DOWN = "scale-down";
    public static final String NO_SCALE = "no-scale";
    public static final String LIMITED_SCALE = "limited-scale";

    private String workload;
    private String eventType;
    private int currentReplicas;
    private int desiredReplicas;

    /**
     * Replicas the workload actually runs
     */
    private int actualReplicas;
    private int minReplicas;
    private int maxReplicas;

    private String triggerMetric;
    private Double triggerValue;
    private Double triggerThreshold;

    /**
     * Why the HPA could not reach its desired count, when limited
     */
    private String limitingFactor;

    private Instant timestamp;
}
