package com.whereq.coordinator.controller;

import com.whereq.coordinator.dto.ErrorResponse;
import com.whereq.coordinator.dto.ScalingEventRequest;
import com.whereq.coordinator.dto.ScalingSignalRequest;
import com.whereq.coordinator.model.HpaEvent;
import com.whereq.coordinator.model.ScalingDirective;
import com.whereq.coordinator.model.ScalingSignal;
import com.whereq.coordinator.scaling.HpaEventLogger;
import com.whereq.coordinator.scaling.PredictiveScalingService;
import com.whereq.coordinator.scaling.ScalingDependenciesService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;

/**
 * Scaling signals, decisions and HPA activity
 *
 * @author WhereQ Inc.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/scaling")
@Tag(name = "Scaling", description = "Predictive scaling, dependency propagation and HPA events")
public class ScalingController {

    @Autowired
    private PredictiveScalingService predictiveScalingService;

    @Autowired
    private ScalingDependenciesService dependenciesService;

    @Autowired
    private HpaEventLogger hpaEventLogger;

    @PostMapping("/signals/{workload}")
    @Operation(summary = "Record load signal", description = "Feed a load observation to the forecaster of a workload")
    public Mono<ResponseEntity<Object>> recordSignal(@PathVariable String workload,
                                                     @Valid @RequestBody ScalingSignalRequest request) {
        ScalingSignal signal = ScalingSignal.builder()
            .metric(request.getMetric())
            .value(request.getValue())
            .timestamp(request.getTimestamp() != null ? request.getTimestamp() : Instant.now())
            .build();

        return predictiveScalingService.recordSignal(workload, signal)
            .thenReturn(ResponseEntity.status(HttpStatus.ACCEPTED).<Object>build())
            .onErrorResume(IllegalArgumentException.class, e -> Mono.just(ResponseEntity
                .status(HttpStatus.NOT_FOUND)
                .<Object>body(ErrorResponse.of("unknown_workload", e.getMessage()))))
            .onErrorResume(Exception.class, e -> {
                log.error("Failed to record signal for {}", workload, e);
                return Mono.just(ResponseEntity
                    .status(HttpStatus.SERVICE_UNAVAILABLE)
                    .<Object>body(ErrorResponse.of("store_unavailable", e.getMessage())));
            });
    }

    @GetMapping("/decisions")
    @Operation(summary = "Recent scaling decisions", description = "Applied scaling directives, newest first")
    public Mono<ResponseEntity<List<ScalingDirective>>> decisions(
            @RequestParam(value = "limit", defaultValue = "50") int limit) {
        return Mono.fromSupplier(() -> predictiveScalingService.getRecentDecisions(limit))
            .map(ResponseEntity::ok);
    }

    /**
     * Propagate a scaling change made outside the coordinator to dependent workloads
     */
    @PostMapping("/events")
    @Operation(summary = "Propagate scaling event", description = "Scale the workloads required by a workload that changed size")
    public Mono<ResponseEntity<List<ScalingDirective>>> scalingEvent(@Valid @RequestBody ScalingEventRequest request) {
        log.info("Scaling event for {}: {} -> {}", request.getWorkload(), request.getFromReplicas(), request.getToReplicas());

        return dependenciesService.onScalingEvent(request.getWorkload(), request.getFromReplicas(), request.getToReplicas())
            .map(ResponseEntity::ok)
            .onErrorResume(Exception.class, e -> {
                log.error("Scaling propagation for {} failed", request.getWorkload(), e);
                return Mono.just(ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build());
            });
    }

    @GetMapping("/hpa-events")
    @Operation(summary = "Recent HPA events", description = "Scaling events observed on HorizontalPodAutoscalers, newest first")
    public Mono<ResponseEntity<List<HpaEvent>>> hpaEvents(
            @RequestParam(value = "workload", required = false) String workload,
            @RequestParam(value = "limit", defaultValue = "100") int limit) {
        return hpaEventLogger.getRecentEvents(workload, limit)
            .collectList()
            .map(ResponseEntity::ok)
            .onErrorResume(e -> {
                log.error("Failed to read HPA events", e);
                return Mono.just(ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build());
            });
    }
}
