package com.whereq.coordinator.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Capacity and usage of one cluster node
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NodeMetrics {
    private String name;

    @Builder.Default
    private Map<String, String> labels = new LinkedHashMap<>();

    private long cpuCapacityMillis;
    private long cpuUsageMillis;
    private long memoryCapacityBytes;
    private long memoryUsageBytes;
    private int gpuCapacity;
    private boolean ready;

    public double cpuUtilization() {
        return cpuCapacityMillis > 0 ? (double) cpuUsageMillis / cpuCapacityMillis : 0.0;
    }

    public double memoryUtilization() {
        return memoryCapacityBytes > 0 ? (double) memoryUsageBytes / memoryCapacityBytes : 0.0;
    }
}
