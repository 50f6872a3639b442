package com.whereq.coordinator.controller;

import com.whereq.coordinator.dto.WorkflowCancellationResponse;
import com.whereq.coordinator.dto.WorkflowRequest;
import com.whereq.coordinator.dto.WorkflowSubmitResponse;
import com.whereq.coordinator.exception.QuotaExceededException;
import com.whereq.coordinator.exception.WorkflowConflictException;
import com.whereq.coordinator.exception.WorkflowNotFoundException;
import com.whereq.coordinator.exception.WorkflowValidationException;
import com.whereq.coordinator.model.QualityLevel;
import com.whereq.coordinator.model.WorkflowPhase;
import com.whereq.coordinator.model.WorkflowStatus;
import com.whereq.coordinator.service.CoordinatorService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@WebFluxTest(WorkflowController.class)
class WorkflowControllerTest {

    private static final String BODY = """
        {
          "type": "room-layout",
          "userId": "user-1",
          "subscriptionTier": "standard",
          "qualityTarget": "medium",
          "parameters": {"room-type": "kitchen"}
        }
        """;

    @Autowired
    private WebTestClient webTestClient;

    @MockBean
    private CoordinatorService coordinatorService;

    @Test
    void acceptedWorkflowReturns202WithLocation() {
        when(coordinatorService.createWorkflow(any(WorkflowRequest.class))).thenReturn(Mono.just(
            WorkflowSubmitResponse.builder()
                .workflowId("wf-1")
                .status(WorkflowPhase.PENDING)
                .qualityLevel(QualityLevel.MEDIUM)
                .submittedAt(Instant.parse("2024-05-01T10:00:00Z"))
                .build()));

        webTestClient.post().uri("/api/v1/workflows")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(BODY)
            .exchange()
            .expectStatus().isAccepted()
            .expectHeader().location("/api/v1/workflows/wf-1")
            .expectBody()
            .jsonPath("$.workflowId").isEqualTo("wf-1")
            .jsonPath("$.status").isEqualTo("Pending")
            .jsonPath("$.qualityLevel").isEqualTo("medium")
            .jsonPath("$.cached").isEqualTo(false);
    }

    @Test
    void missingRequiredFieldIsABadRequest() {
        webTestClient.post().uri("/api/v1/workflows")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue("{\"type\": \"room-layout\", \"subscriptionTier\": \"free\"}")
            .exchange()
            .expectStatus().isBadRequest();

        verifyNoInteractions(coordinatorService);
    }

    @Test
    void validationErrorIsABadRequest() {
        when(coordinatorService.createWorkflow(any(WorkflowRequest.class)))
            .thenReturn(Mono.error(new WorkflowValidationException("Invalid quality target: ultra")));

        webTestClient.post().uri("/api/v1/workflows")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(BODY)
            .exchange()
            .expectStatus().isBadRequest()
            .expectBody()
            .jsonPath("$.status").isEqualTo("Error")
            .jsonPath("$.stage").isEqualTo("validation")
            .jsonPath("$.errorMessage").isEqualTo("Invalid quality target: ultra");
    }

    @Test
    void quotaRejectionIsForbiddenAndNamesThePermittedQuality() {
        when(coordinatorService.createWorkflow(any(WorkflowRequest.class)))
            .thenReturn(Mono.error(new QuotaExceededException("Tier standard does not permit high", QualityLevel.MEDIUM)));

        webTestClient.post().uri("/api/v1/workflows")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(BODY)
            .exchange()
            .expectStatus().isForbidden()
            .expectBody()
            .jsonPath("$.stage").isEqualTo("quota")
            .jsonPath("$.permittedQuality").isEqualTo("medium");
    }

    @Test
    void failedSubmissionIsServiceUnavailable() {
        when(coordinatorService.createWorkflow(any(WorkflowRequest.class))).thenReturn(Mono.just(
            WorkflowSubmitResponse.builder()
                .workflowId("wf-2")
                .status(WorkflowPhase.ERROR)
                .stage("submission")
                .errorMessage("argo unreachable")
                .build()));

        webTestClient.post().uri("/api/v1/workflows")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(BODY)
            .exchange()
            .expectStatus().isEqualTo(503)
            .expectBody()
            .jsonPath("$.workflowId").isEqualTo("wf-2")
            .jsonPath("$.stage").isEqualTo("submission");
    }

    @Test
    void unknownWorkflowIsNotFound() {
        when(coordinatorService.getWorkflow("wf-missing"))
            .thenReturn(Mono.error(new WorkflowNotFoundException("wf-missing")));
        when(coordinatorService.cancelWorkflow("wf-missing"))
            .thenReturn(Mono.error(new WorkflowNotFoundException("wf-missing")));

        webTestClient.get().uri("/api/v1/workflows/wf-missing").exchange().expectStatus().isNotFound();
        webTestClient.delete().uri("/api/v1/workflows/wf-missing").exchange().expectStatus().isNotFound();
    }

    @Test
    void workflowStatusIsReturned() {
        when(coordinatorService.getWorkflow("wf-1")).thenReturn(Mono.just(WorkflowStatus.builder()
            .id("wf-1")
            .type("room-layout")
            .status(WorkflowPhase.RUNNING)
            .progress(40)
            .build()));

        webTestClient.get().uri("/api/v1/workflows/wf-1")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.status").isEqualTo("Running")
            .jsonPath("$.progress").isEqualTo(40);
    }

    @Test
    void cancellingAFinishedWorkflowIsAConflict() {
        when(coordinatorService.cancelWorkflow("wf-1"))
            .thenReturn(Mono.error(new WorkflowConflictException("wf-1",
                "Cannot cancel workflow in terminal status: Succeeded")));

        webTestClient.delete().uri("/api/v1/workflows/wf-1")
            .exchange()
            .expectStatus().isEqualTo(409)
            .expectBody()
            .jsonPath("$.message").isEqualTo("Cannot cancel workflow in terminal status: Succeeded");
    }

    @Test
    void unexpectedCancellationFailureIsNotAConflict() {
        when(coordinatorService.cancelWorkflow("wf-1"))
            .thenReturn(Mono.error(new IllegalStateException("scheduler shut down")));

        webTestClient.delete().uri("/api/v1/workflows/wf-1")
            .exchange()
            .expectStatus().isEqualTo(503);
    }

    @Test
    void cancellation() {
        when(coordinatorService.cancelWorkflow("wf-1")).thenReturn(Mono.just(WorkflowCancellationResponse.builder()
            .workflowId("wf-1")
            .status(WorkflowPhase.FAILED)
            .message("Workflow cancelled")
            .build()));

        webTestClient.delete().uri("/api/v1/workflows/wf-1")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.status").isEqualTo("Failed");
    }

    @Test
    void activeWorkflowsAreListed() {
        when(coordinatorService.listActiveWorkflows("user-1")).thenReturn(Flux.just(
            WorkflowStatus.builder().id("wf-1").userId("user-1").status(WorkflowPhase.RUNNING).build()));

        webTestClient.get().uri("/api/v1/workflows?userId=user-1")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$[0].id").isEqualTo("wf-1")
            .jsonPath("$[1]").doesNotExist();
    }
}
