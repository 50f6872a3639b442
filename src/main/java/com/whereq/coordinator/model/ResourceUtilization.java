package com.whereq.coordinator.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Cluster-wide utilization, each ratio in [0, 1]
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ResourceUtilization {
    private static final double UNKNOWN = 0.5;

    private double cpu;
    private double memory;
    private double gpu;
    private int nodeCount;
    private Instant sampledAt;

    /**
     * True when no sample could be taken and the values are defaults
     */
    private boolean fallback;

    public double maxUtilization() {
        return Math.max(cpu, Math.max(memory, gpu));
    }

    public static ResourceUtilization unknown(Instant now) {
        return ResourceUtilization.builder()
            .cpu(UNKNOWN)
            .memory(UNKNOWN)
            .gpu(UNKNOWN)
            .sampledAt(now)
            .fallback(true)
            .build();
    }
}
