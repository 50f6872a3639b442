package com.whereq.coordinator.cluster;

import reactor.core.publisher.Mono;

/**
 * Autoscaling API: replica counts and directives per workload
 */
public interface AutoscalerClient {
    /**
     * Read current and desired replicas of a workload
     */
    Mono<WorkloadScale> getScale(String workload);

    /**
     * Set the desired replica count of a workload
     */
    Mono<Void> setReplicas(String workload, int replicas);

    /**
     * Read the HorizontalPodAutoscaler attached to a workload
     */
    Mono<HpaStatus> getHpaStatus(String workload);
}
