package com.whereq.coordinator.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;
import java.util.TreeMap;

/**
 * Processing statistics per workflow type since startup
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkflowStats {
    @Builder.Default
    private Map<String, Long> counts = new TreeMap<>();

    /**
     * Mean duration of recent completions, in seconds
     */
    @Builder.Default
    private Map<String, Double> averageTimes = new TreeMap<>();

    @Builder.Default
    private Map<String, Double> cacheHitRates = new TreeMap<>();

    @Builder.Default
    private Map<String, Double> errorRates = new TreeMap<>();

    private int activeCount;
}
