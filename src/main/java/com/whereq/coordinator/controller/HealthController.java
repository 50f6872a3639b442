package com.whereq.coordinator.controller;

import com.whereq.coordinator.monitoring.MonitoringService;
import com.whereq.coordinator.resource.ResourceManager;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.Map;

/**
 * Health check controller to verify service and cluster status.
 *
 * @author WhereQ Inc.
 */
@RestController
@RequestMapping("/api/v1/health")
@Tag(name = "Health", description = "Service health check endpoints")
public class HealthController {

    @Autowired
    private ResourceManager resourceManager;

    @Autowired
    private MonitoringService monitoringService;

    @GetMapping
    @Operation(summary = "Health check", description = "Check if the service is running and the cluster is observable")
    public Mono<ResponseEntity<Map<String, Object>>> health() {
        return resourceManager.getResourceUtilization()
                .map(utilization -> {
                    Map<String, Object> health = baseHealth();

                    Map<String, Object> cluster = new HashMap<>();
                    cluster.put("status", utilization.isFallback() ? "DEGRADED" : "CONNECTED");
                    cluster.put("nodes", utilization.getNodeCount());
                    cluster.put("cpu", utilization.getCpu());
                    cluster.put("memory", utilization.getMemory());
                    cluster.put("gpu", utilization.getGpu());
                    cluster.put("sampledAt", utilization.getSampledAt());

                    health.put("cluster", cluster);
                    return ResponseEntity.ok(health);
                })
                .onErrorResume(e -> {
                    Map<String, Object> health = baseHealth();

                    Map<String, String> cluster = new HashMap<>();
                    cluster.put("status", "ERROR");
                    cluster.put("error", e.getMessage());
                    health.put("cluster", cluster);

                    return Mono.just(ResponseEntity.ok(health));
                });
    }

    private Map<String, Object> baseHealth() {
        Map<String, Object> health = new HashMap<>();
        health.put("status", "UP");
        health.put("service", "whereq-coordinator");
        health.put("activeWorkflows", monitoringService.getActiveCount());
        health.put("reservations", resourceManager.getReservationCount());
        return health;
    }
}
