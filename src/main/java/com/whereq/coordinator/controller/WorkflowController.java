package com.whereq.coordinator.controller;

import com.whereq.coordinator.dto.WorkflowCancellationResponse;
import com.whereq.coordinator.dto.WorkflowRequest;
import com.whereq.coordinator.dto.WorkflowSubmitResponse;
import com.whereq.coordinator.exception.QuotaExceededException;
import com.whereq.coordinator.exception.WorkflowConflictException;
import com.whereq.coordinator.exception.WorkflowNotFoundException;
import com.whereq.coordinator.exception.WorkflowValidationException;
import com.whereq.coordinator.model.WorkflowPhase;
import com.whereq.coordinator.model.WorkflowStatus;
import com.whereq.coordinator.service.CoordinatorService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.List;

/**
 * Workflow submission, status and cancellation
 *
 * @author WhereQ Inc.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/workflows")
@Tag(name = "Workflows", description = "Submit, inspect and cancel ML workflows")
public class WorkflowController {

    @Autowired
    private CoordinatorService coordinatorService;

    /**
     * Submit a workflow
     *
     * @param request workflow request
     * @return Mono with 202 Accepted, or 503 when the engine could not take the workflow
     */
    @PostMapping
    @Operation(summary = "Submit workflow",
        description = "Assess quality, allocate resources and submit a workflow, or return a cached result")
    public Mono<ResponseEntity<WorkflowSubmitResponse>> createWorkflow(@Valid @RequestBody WorkflowRequest request) {
        log.info("Received {} workflow from user {}: tier={}, quality={}",
            request.getType(), request.getUserId(), request.getSubscriptionTier(), request.getQualityTarget());

        return coordinatorService.createWorkflow(request)
            .map(response -> {
                if (response.getStatus() == WorkflowPhase.ERROR) {
                    return ResponseEntity
                        .status(HttpStatus.SERVICE_UNAVAILABLE)
                        .body(response);
                }
                return ResponseEntity
                    .status(HttpStatus.ACCEPTED)
                    .location(URI.create("/api/v1/workflows/" + response.getWorkflowId()))
                    .body(response);
            })
            .onErrorResume(WorkflowValidationException.class, e -> {
                log.warn("Validation error: {}", e.getMessage());
                WorkflowSubmitResponse body = WorkflowSubmitResponse.error(e.getMessage());
                body.setStage(e.getStage());
                return Mono.just(ResponseEntity.badRequest().body(body));
            })
            .onErrorResume(QuotaExceededException.class, e -> {
                log.warn("Quota exceeded: {}", e.getMessage());
                WorkflowSubmitResponse body = WorkflowSubmitResponse.error(e.getMessage());
                body.setStage(e.getStage());
                body.setPermittedQuality(e.getPermittedQuality());
                return Mono.just(ResponseEntity.status(HttpStatus.FORBIDDEN).body(body));
            })
            .onErrorResume(Exception.class, e -> {
                log.error("Unexpected error during workflow submission", e);
                return Mono.just(ResponseEntity
                    .status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(WorkflowSubmitResponse.error("Internal server error")));
            });
    }

    @GetMapping("/{workflowId}")
    @Operation(summary = "Get workflow status", description = "Status, progress and nodes of a workflow")
    public Mono<ResponseEntity<WorkflowStatus>> getWorkflow(@PathVariable String workflowId) {
        return coordinatorService.getWorkflow(workflowId)
            .map(ResponseEntity::ok)
            .onErrorResume(WorkflowNotFoundException.class, e -> Mono.just(ResponseEntity.notFound().build()))
            .onErrorResume(Exception.class, e -> {
                log.error("Error reading workflow {}", workflowId, e);
                return Mono.just(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).build());
            });
    }

    /**
     * Cancel a workflow
     *
     * @param workflowId workflow identifier
     * @return Mono with the cancellation response; 404 unknown, 409 already finished
     */
    @DeleteMapping("/{workflowId}")
    @Operation(summary = "Cancel workflow", description = "Terminate a workflow that has not finished")
    public Mono<ResponseEntity<WorkflowCancellationResponse>> cancelWorkflow(@PathVariable String workflowId) {
        log.info("Cancellation request for workflow {}", workflowId);

        return coordinatorService.cancelWorkflow(workflowId)
            .map(ResponseEntity::ok)
            .onErrorResume(WorkflowNotFoundException.class, e -> Mono.just(ResponseEntity.notFound().build()))
            .onErrorResume(WorkflowConflictException.class, e -> {
                log.warn("Invalid state for cancellation: {}", e.getMessage());
                return Mono.just(ResponseEntity
                    .status(HttpStatus.CONFLICT)
                    .body(WorkflowCancellationResponse.builder()
                        .workflowId(workflowId)
                        .message(e.getMessage())
                        .build()));
            })
            .onErrorResume(Exception.class, e -> {
                log.error("Error cancelling workflow {}", workflowId, e);
                return Mono.just(ResponseEntity
                    .status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(WorkflowCancellationResponse.builder()
                        .workflowId(workflowId)
                        .message(e.getMessage())
                        .build()));
            });
    }

    @GetMapping
    @Operation(summary = "List active workflows", description = "Workflows that have not finished, optionally for one user")
    public Mono<ResponseEntity<List<WorkflowStatus>>> listActiveWorkflows(
            @RequestParam(value = "userId", required = false) String userId) {
        return coordinatorService.listActiveWorkflows(userId)
            .collectList()
            .map(ResponseEntity::ok);
    }
}
