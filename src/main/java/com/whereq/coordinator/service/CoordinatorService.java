package com.whereq.coordinator.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.whereq.coordinator.cache.CacheManager;
import com.whereq.coordinator.config.CoordinatorProperties;
import com.whereq.coordinator.dto.WorkflowCancellationResponse;
import com.whereq.coordinator.dto.WorkflowRequest;
import com.whereq.coordinator.dto.WorkflowSubmitResponse;
import com.whereq.coordinator.engine.EngineObservation;
import com.whereq.coordinator.engine.WorkflowEngineClient;
import com.whereq.coordinator.engine.WorkflowManifestBuilder;
import com.whereq.coordinator.exception.EngineRejectedException;
import com.whereq.coordinator.exception.RemoteCallErrors;
import com.whereq.coordinator.exception.WorkflowConflictException;
import com.whereq.coordinator.exception.WorkflowValidationException;
import com.whereq.coordinator.model.CachedWorkflowResult;
import com.whereq.coordinator.model.ProcessingStage;
import com.whereq.coordinator.model.QualityAssessment;
import com.whereq.coordinator.model.QualityLevel;
import com.whereq.coordinator.model.ResourceAllocation;
import com.whereq.coordinator.model.RetryPolicy;
import com.whereq.coordinator.model.SubscriptionTier;
import com.whereq.coordinator.model.WorkflowMetrics;
import com.whereq.coordinator.model.WorkflowNode;
import com.whereq.coordinator.model.WorkflowPhase;
import com.whereq.coordinator.model.WorkflowPriority;
import com.whereq.coordinator.model.WorkflowStatus;
import com.whereq.coordinator.monitoring.MonitoringService;
import com.whereq.coordinator.quality.QualityManager;
import com.whereq.coordinator.resource.ResourceManager;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Workflow intake and lifecycle.
 *
 * A request is validated, assessed for quality, given a resource allocation, checked
 * against the result cache and submitted to the execution engine. Submitted workflows
 * are polled until terminal; at that point their reservation and in-flight claim are
 * released, the cache is filled and completion metrics are recorded.
 *
 * @author WhereQ Inc.
 */
@Slf4j
@Service
public class CoordinatorService implements WorkflowStatusPoller.PollHandler {

    static final String STAGE_SUBMISSION = "submission";
    static final String STAGE_CANCELLATION = "cancellation";
    static final String STAGE_POLLING = "polling";
    static final String CANCELLED_MESSAGE = "Cancelled";

    private static final Pattern TYPE_PATTERN = Pattern.compile("[a-z0-9][a-z0-9-]*");
    private static final Set<String> INTERACTIVE_TYPES = Set.of("preview", "quick-analysis", "real-time");

    private final QualityManager qualityManager;
    private final ResourceManager resourceManager;
    private final CacheManager cacheManager;
    private final MonitoringService monitoringService;
    private final WorkflowStatusTracker statusTracker;
    private final WorkflowEngineClient engineClient;
    private final WorkflowManifestBuilder manifestBuilder;
    private final Clock clock;
    private final RetryPolicy engineRetry;
    private final Duration pollTimeout;
    private final WorkflowStatusPoller poller;

    public CoordinatorService(QualityManager qualityManager,
                              ResourceManager resourceManager,
                              CacheManager cacheManager,
                              MonitoringService monitoringService,
                              WorkflowStatusTracker statusTracker,
                              WorkflowEngineClient engineClient,
                              WorkflowManifestBuilder manifestBuilder,
                              CoordinatorProperties properties,
                              Clock clock) {
        this.qualityManager = qualityManager;
        this.resourceManager = resourceManager;
        this.cacheManager = cacheManager;
        this.monitoringService = monitoringService;
        this.statusTracker = statusTracker;
        this.engineClient = engineClient;
        this.manifestBuilder = manifestBuilder;
        this.clock = clock;

        CoordinatorProperties.EngineConfig engine = properties.getEngine();
        this.engineRetry = engine.getRetry();
        this.pollTimeout = engine.getTimeout().multipliedBy(2);
        this.poller = new WorkflowStatusPoller(this, engine.getPollInterval(),
            engine.getPollerThreads(), engine.getMaxPollFailures());
    }

    @PostConstruct
    public void start() {
        poller.start();
        statusTracker.recoverActive()
            .subscribe(
                status -> {
                    if (status.getAllocation() != null) {
                        resourceManager.reserve(status.getId(), status.getAllocation());
                    }
                    if (status.getCacheKey() != null) {
                        cacheManager.claimInFlight(status.getCacheKey(), status.getId());
                    }
                    monitoringService.startWorkflow(status.getId(), status.getType());
                    poller.schedule(status.getId());
                },
                e -> log.warn("Could not recover in-flight workflows: {}", e.getMessage()));
    }

    @PreDestroy
    public void stop() {
        poller.close();
    }

    /**
     * Create and submit a workflow.
     *
     * Validation and quota failures are signalled as errors. Once the request passed
     * them, the returned response always carries a workflow id: a submission that fails
     * after its retries yields a response in status Error.
     *
     * @param request workflow request
     * @return Mono with the submission response
     */
    public Mono<WorkflowSubmitResponse> createWorkflow(WorkflowRequest request) {
        Instant receivedAt = clock.instant();

        return Mono.fromCallable(() -> validate(request))
            .flatMap(accepted -> qualityManager.assessQuality(accepted)
                .flatMap(assessment -> route(accepted, assessment, receivedAt)))
            .doOnSuccess(response -> log.info("Workflow {} for user {}: status={}, cached={}",
                response.getWorkflowId(), request.getUserId(), response.getStatus(), response.isCached()))
            .doOnError(e -> log.warn("Workflow request of user {} rejected: {}",
                request != null ? request.getUserId() : null, e.getMessage()));
    }

    /**
     * Current status of a workflow. A live workflow is refreshed from the engine first;
     * when the engine cannot be reached the stored status is returned.
     *
     * @param workflowId workflow identifier
     * @return Mono with the status; errors with WorkflowNotFoundException
     */
    public Mono<WorkflowStatus> getWorkflow(String workflowId) {
        return statusTracker.get(workflowId)
            .flatMap(stored -> {
                if (stored.isTerminal()) {
                    return Mono.just(stored);
                }
                return refresh(workflowId)
                    .onErrorResume(e -> {
                        log.debug("Engine refresh of workflow {} failed, returning stored status: {}",
                            workflowId, e.getMessage());
                        return statusTracker.get(workflowId);
                    });
            });
    }

    /**
     * Cancel a workflow that is not yet terminal
     *
     * @param workflowId workflow identifier
     * @return Mono with the cancellation response; errors with WorkflowNotFoundException,
     *         or WorkflowConflictException when the workflow already finished
     */
    public Mono<WorkflowCancellationResponse> cancelWorkflow(String workflowId) {
        return statusTracker.get(workflowId)
            .flatMap(current -> {
                if (current.isTerminal()) {
                    return Mono.error(new WorkflowConflictException(workflowId,
                        "Cannot cancel workflow in terminal status: " + current.getStatus().getValue()));
                }
                return engineClient.terminate(workflowId)
                    .onErrorResume(EngineRejectedException.class, e -> {
                        log.warn("Engine did not terminate workflow {}: {}", workflowId, e.getMessage());
                        return Mono.empty();
                    })
                    .then(statusTracker.update(workflowId, status -> status.terminate(
                        WorkflowPhase.FAILED, STAGE_CANCELLATION, CANCELLED_MESSAGE, clock.instant())));
            })
            .flatMap(transition -> {
                if (!transition.becameTerminal()) {
                    return Mono.error(new WorkflowConflictException(workflowId, "Workflow " + workflowId
                        + " finished before it could be cancelled"));
                }
                WorkflowStatus cancelled = transition.getCurrent();
                releaseWorkflow(cancelled);
                monitoringService.recordWorkflowCancellation(workflowId, cancelled.getType());
                return Mono.just(WorkflowCancellationResponse.builder()
                    .workflowId(workflowId)
                    .status(cancelled.getStatus())
                    .cancelledAt(cancelled.getFinishedAt())
                    .message("Workflow cancelled")
                    .build());
            })
            .doOnSuccess(response -> log.info("Workflow {} cancelled", workflowId))
            .doOnError(e -> log.warn("Failed to cancel workflow {}: {}", workflowId, e.getMessage()));
    }

    /**
     * Workflows that have not finished
     *
     * @param userId owner filter, null for all users
     */
    public Flux<WorkflowStatus> listActiveWorkflows(String userId) {
        return Flux.fromIterable(statusTracker.listActive(userId));
    }

    @Override
    public boolean poll(String workflowId) {
        WorkflowStatus status = refresh(workflowId).block(pollTimeout);
        return status == null || status.isTerminal();
    }

    @Override
    public void onPollingAbandoned(String workflowId, Throwable lastError) {
        String message = "Status polling failed: " + lastError.getMessage();
        statusTracker.update(workflowId, status -> status.terminate(
                WorkflowPhase.ERROR, STAGE_POLLING, message, clock.instant()))
            .filter(WorkflowStatusTracker.Transition::becameTerminal)
            .subscribe(
                transition -> onTerminal(transition.getCurrent(), null),
                e -> log.error("Failed to mark workflow {} as lost", workflowId, e));
    }

    /**
     * Read the engine's view of a workflow and merge it into the stored record
     */
    Mono<WorkflowStatus> refresh(String workflowId) {
        return engineClient.getWorkflow(workflowId)
            .flatMap(observation -> applyObservation(workflowId, observation));
    }

    private Mono<WorkflowStatus> applyObservation(String workflowId, EngineObservation observation) {
        return statusTracker.update(workflowId, status -> status.mergeObserved(observation.getStatus(), clock.instant()))
            .map(transition -> {
                if (transition.becameTerminal()) {
                    onTerminal(transition.getCurrent(), observation.getOutputs());
                }
                return transition.getCurrent();
            });
    }

    /**
     * Validate a request and fill in derived fields. Nothing is recorded for a rejected request.
     */
    WorkflowRequest validate(WorkflowRequest request) {
        if (request == null) {
            throw new WorkflowValidationException("Request body is required");
        }
        if (request.getType() == null || !TYPE_PATTERN.matcher(request.getType()).matches()) {
            throw new WorkflowValidationException("Workflow type must match " + TYPE_PATTERN.pattern());
        }
        if (request.getUserId() == null || request.getUserId().isBlank()) {
            throw new WorkflowValidationException("User id is required");
        }
        if (request.getSubscriptionTier() == null) {
            throw new WorkflowValidationException("Subscription tier is required");
        }
        try {
            request.explicitQualityTarget();
        } catch (IllegalArgumentException e) {
            throw new WorkflowValidationException("Invalid quality target: " + request.getQualityTarget());
        }

        WorkflowRequest accepted = request.snapshot();
        if (accepted.getPriority() == null) {
            accepted.setPriority(derivePriority(accepted.getType(), accepted.getSubscriptionTier()));
        }
        if (accepted.getQualityTarget() == null || accepted.getQualityTarget().isBlank()) {
            accepted.setQualityTarget(WorkflowRequest.QUALITY_AUTO);
        }
        return accepted;
    }

    static WorkflowPriority derivePriority(String type, SubscriptionTier tier) {
        if (INTERACTIVE_TYPES.contains(type)) {
            return WorkflowPriority.HIGH;
        }
        return switch (tier) {
            case PREMIUM -> WorkflowPriority.HIGH;
            case STANDARD -> WorkflowPriority.MEDIUM;
            case FREE -> WorkflowPriority.LOW;
        };
    }

    private Mono<WorkflowSubmitResponse> route(WorkflowRequest request, QualityAssessment assessment, Instant receivedAt) {
        QualityLevel level = assessment.getQualityLevel();
        ResourceAllocation allocation = resourceManager.allocateResources(
            level, request.getPriority(), request.getSubscriptionTier());
        resourceManager.validateAllocation(allocation, request.getSubscriptionTier());

        monitoringService.recordQualityLevel(request.getType(), level, assessment.isClamped());
        qualityManager.recordQualitySelection(request.getType(), level).subscribe();

        String workflowId = "wf-" + UUID.randomUUID();
        if (!request.isCacheable()) {
            return submit(workflowId, request, level, allocation, null, receivedAt);
        }

        String cacheKey;
        try {
            cacheKey = cacheManager.generateCacheKey(request, level);
        } catch (IllegalArgumentException e) {
            return Mono.error(new WorkflowValidationException(e.getMessage()));
        }

        return cacheManager.get(cacheKey)
            .flatMap(hit -> cachedResponse(request, hit.getWorkflowId(), level, hit))
            .switchIfEmpty(Mono.defer(() -> {
                Optional<String> owner = cacheManager.claimInFlight(cacheKey, workflowId);
                if (owner.isPresent()) {
                    log.info("Request of user {} attached to in-flight workflow {}", request.getUserId(), owner.get());
                    return cachedResponse(request, owner.get(), level, null);
                }
                monitoringService.recordCacheResult(request.getType(), false);
                return submit(workflowId, request, level, allocation, cacheKey, receivedAt);
            }));
    }

    private Mono<WorkflowSubmitResponse> cachedResponse(WorkflowRequest request, String workflowId,
                                                        QualityLevel level, CachedWorkflowResult hit) {
        monitoringService.recordCacheResult(request.getType(), true);
        return statusTracker.get(workflowId)
            .map(WorkflowStatus::getStatus)
            .onErrorResume(e -> Mono.just(hit != null ? WorkflowPhase.SUCCEEDED : WorkflowPhase.PENDING))
            .map(status -> WorkflowSubmitResponse.builder()
                .workflowId(workflowId)
                .status(status)
                .qualityLevel(level)
                .cached(true)
                .submittedAt(clock.instant())
                .build());
    }

    private Mono<WorkflowSubmitResponse> submit(String workflowId, WorkflowRequest request, QualityLevel level,
                                                ResourceAllocation allocation, String cacheKey, Instant receivedAt) {
        WorkflowStatus pending = WorkflowStatus.builder()
            .id(workflowId)
            .type(request.getType())
            .userId(request.getUserId())
            .qualityLevel(level)
            .status(WorkflowPhase.PENDING)
            .createdAt(receivedAt)
            .cacheKey(cacheKey)
            .allocation(allocation)
            .request(request)
            .build();

        monitoringService.startWorkflow(workflowId, request.getType());

        return statusTracker.create(pending)
            .then(Mono.fromCallable(() -> manifestBuilder.build(workflowId, request, level, allocation)))
            .flatMap(manifest -> engineClient.submit(manifest)
                .retryWhen(engineRetry.toRetrySpec(RemoteCallErrors::isTransient))
                .onErrorResume(CoordinatorService::isAlreadyExists, e -> confirmExisting(workflowId, e)))
            .map(engineName -> {
                resourceManager.reserve(workflowId, allocation);
                monitoringService.recordWorkflowCreation(workflowId, request.getType(), level,
                    Duration.between(receivedAt, clock.instant()));
                monitoringService.recordResourceAllocation(request.getType(), allocation);
                poller.schedule(workflowId);
                return WorkflowSubmitResponse.builder()
                    .workflowId(workflowId)
                    .status(WorkflowPhase.PENDING)
                    .qualityLevel(level)
                    .cached(false)
                    .submittedAt(receivedAt)
                    .build();
            })
            .onErrorResume(e -> failSubmission(pending, e));
    }

    /**
     * The engine refused a submit because the name is taken. Names are unique per
     * request, so an earlier attempt that timed out on our side got through; the
     * workflow is adopted once the engine confirms it exists.
     */
    private Mono<String> confirmExisting(String workflowId, Throwable conflict) {
        log.warn("Engine already has workflow {}, confirming an earlier submit attempt", workflowId);
        return engineClient.getWorkflow(workflowId)
            .map(observation -> workflowId)
            .switchIfEmpty(Mono.error(conflict))
            .onErrorMap(e -> e != conflict, e -> conflict);
    }

    static boolean isAlreadyExists(Throwable error) {
        return error instanceof EngineRejectedException rejected && rejected.getStatusCode() == 409;
    }

    private Mono<WorkflowSubmitResponse> failSubmission(WorkflowStatus pending, Throwable error) {
        String workflowId = pending.getId();
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        log.error("Submission of workflow {} failed: {}", workflowId, message, error);

        cacheManager.releaseInFlight(pending.getCacheKey(), workflowId);
        monitoringService.recordWorkflowError(workflowId, pending.getType(), STAGE_SUBMISSION, message);
        monitoringService.recordWorkflowCompletion(workflowId, pending.getType(), WorkflowPhase.ERROR, Duration.ZERO);

        WorkflowSubmitResponse response = WorkflowSubmitResponse.builder()
            .workflowId(workflowId)
            .status(WorkflowPhase.ERROR)
            .qualityLevel(pending.getQualityLevel())
            .cached(false)
            .submittedAt(pending.getCreatedAt())
            .stage(STAGE_SUBMISSION)
            .errorMessage(message)
            .build();

        return statusTracker.update(workflowId, status -> status.terminate(
                WorkflowPhase.ERROR, STAGE_SUBMISSION, message, clock.instant()))
            .thenReturn(response)
            .onErrorResume(e -> {
                log.error("Could not record failed submission of workflow {}", workflowId, e);
                return Mono.just(response);
            });
    }

    /**
     * Release everything a finished workflow held and record its outcome
     */
    private void onTerminal(WorkflowStatus status, JsonNode outputs) {
        String workflowId = status.getId();
        boolean success = status.getStatus() == WorkflowPhase.SUCCEEDED;
        try {
            boolean cacheResult = success && status.getCacheKey() != null
                && (status.getRequest() == null || status.getRequest().isCacheable());

            if (cacheResult) {
                // the in-flight claim covers identical requests until the result is readable
                releaseExecution(status);
                cacheManager.set(status.getCacheKey(), workflowId, outputs, null)
                    .doFinally(signal -> cacheManager.releaseInFlight(status.getCacheKey(), workflowId))
                    .subscribe(
                        v -> { },
                        e -> log.warn("Failed to cache result of workflow {}: {}", workflowId, e.getMessage()));
            } else {
                releaseWorkflow(status);
            }

            Map<ProcessingStage, Double> stageDurations = stageDurations(status);
            stageDurations.forEach((stage, seconds) -> monitoringService.recordStageDuration(
                status.getType(), stage, Duration.ofMillis(Math.round(seconds * 1000))));

            Duration duration = status.getDurationSeconds() != null
                ? Duration.ofSeconds(status.getDurationSeconds()) : null;
            monitoringService.recordWorkflowCompletion(workflowId, status.getType(), status.getStatus(), duration);
            if (!success) {
                monitoringService.recordWorkflowError(workflowId, status.getType(),
                    status.getFailedStage(), status.getErrorMessage());
            }

            qualityManager.recordOutcome(status.getType(), success).subscribe();

            monitoringService.recordWorkflowMetrics(WorkflowMetrics.builder()
                .workflowId(workflowId)
                .type(status.getType())
                .qualityLevel(status.getQualityLevel())
                .stageDurations(stageDurations)
                .allocation(status.getAllocation())
                .errorCount(success ? 0 : 1)
                .cacheHitRatio(monitoringService.getCacheHitRatio(status.getType()))
                .success(success)
                .durationSeconds(status.getDurationSeconds())
                .recordedAt(clock.instant())
                .build());

            log.info("Workflow {} finished with {} after {} s", workflowId,
                status.getStatus().getValue(), status.getDurationSeconds());
        } catch (RuntimeException e) {
            log.error("Completion handling of workflow {} incomplete", workflowId, e);
        }
    }

    private void releaseWorkflow(WorkflowStatus status) {
        releaseExecution(status);
        cacheManager.releaseInFlight(status.getCacheKey(), status.getId());
    }

    private void releaseExecution(WorkflowStatus status) {
        poller.cancel(status.getId());
        resourceManager.release(status.getId());
    }

    private static Map<ProcessingStage, Double> stageDurations(WorkflowStatus status) {
        Map<ProcessingStage, Double> durations = new EnumMap<>(ProcessingStage.class);
        if (status.getNodes() == null) {
            return durations;
        }
        for (WorkflowNode node : status.getNodes()) {
            if (node.getStage() != null && node.getStartedAt() != null && node.getFinishedAt() != null) {
                double seconds = Duration.between(node.getStartedAt(), node.getFinishedAt()).toMillis() / 1000.0;
                durations.merge(node.getStage(), Math.max(0, seconds), Double::sum);
            }
        }
        return durations;
    }

    WorkflowStatusPoller getPoller() {
        return poller;
    }
}
