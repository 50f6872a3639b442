package com.whereq.coordinator.cluster;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Replica counts of a workload's scale subresource
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkloadScale {
    private String workload;

    /**
     * Replicas currently running
     */
    private int currentReplicas;

    /**
     * Replicas requested, including pending ones
     */
    private int desiredReplicas;
}
