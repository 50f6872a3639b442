package com.whereq.coordinator.controller;

import com.whereq.coordinator.dto.WorkflowStats;
import com.whereq.coordinator.monitoring.MonitoringService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/monitoring")
@Tag(name = "Monitoring", description = "Workflow processing statistics")
public class MonitoringController {

    @Autowired
    private MonitoringService monitoringService;

    @GetMapping("/stats")
    @Operation(summary = "Processing statistics", description = "Counts, average time, cache hit and error rates per workflow type")
    public Mono<ResponseEntity<WorkflowStats>> stats() {
        return Mono.fromSupplier(monitoringService::getStats)
            .map(ResponseEntity::ok);
    }
}
