package com.whereq.coordinator.cluster;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Status of a HorizontalPodAutoscaler
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HpaStatus {
    private String workload;
    private int currentReplicas;
    private int desiredReplicas;
    private int minReplicas;
    private int maxReplicas;

    /**
     * ScalingLimited condition is true
     */
    private boolean scalingLimited;

    private String limitedReason;

    @Builder.Default
    private List<MetricValue> metrics = new ArrayList<>();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class MetricValue {
        private String name;
        private Double current;
        private Double target;
    }
}
