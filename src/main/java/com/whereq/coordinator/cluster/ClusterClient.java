package com.whereq.coordinator.cluster;

import com.whereq.coordinator.model.NodeMetrics;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Read access to cluster nodes and their current usage
 */
public interface ClusterClient {
    /**
     * Capacity and usage of every node
     *
     * @return Mono with node metrics; usage is zero for nodes without a metrics sample
     */
    Mono<List<NodeMetrics>> getNodeMetrics();
}
