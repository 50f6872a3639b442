package com.whereq.coordinator.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.whereq.coordinator.MutableClock;
import com.whereq.coordinator.cache.CacheManager;
import com.whereq.coordinator.cluster.ClusterClient;
import com.whereq.coordinator.config.CoordinatorProperties;
import com.whereq.coordinator.dto.WorkflowRequest;
import com.whereq.coordinator.dto.WorkflowSubmitResponse;
import com.whereq.coordinator.engine.EngineObservation;
import com.whereq.coordinator.engine.WorkflowEngineClient;
import com.whereq.coordinator.engine.WorkflowManifestBuilder;
import com.whereq.coordinator.exception.EngineRejectedException;
import com.whereq.coordinator.exception.TransientInfraException;
import com.whereq.coordinator.exception.WorkflowConflictException;
import com.whereq.coordinator.exception.WorkflowNotFoundException;
import com.whereq.coordinator.exception.WorkflowValidationException;
import com.whereq.coordinator.model.NodeMetrics;
import com.whereq.coordinator.model.QualityLevel;
import com.whereq.coordinator.model.SubscriptionTier;
import com.whereq.coordinator.model.WorkflowPhase;
import com.whereq.coordinator.model.WorkflowPriority;
import com.whereq.coordinator.model.WorkflowStatus;
import com.whereq.coordinator.monitoring.MonitoringService;
import com.whereq.coordinator.quality.InputComplexityAnalyzer;
import com.whereq.coordinator.quality.QualityManager;
import com.whereq.coordinator.resource.ResourceManager;
import com.whereq.coordinator.store.InMemoryKeyValueStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class CoordinatorServiceTest {

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    private CoordinatorProperties properties;
    private InMemoryKeyValueStore store;
    private MutableClock clock;
    private SimpleMeterRegistry meterRegistry;
    private WorkflowEngineClient engineClient;
    private ResourceManager resourceManager;
    private CacheManager cacheManager;
    private WorkflowStatusTracker statusTracker;
    private CoordinatorService service;

    @BeforeEach
    void setUp() {
        properties = new CoordinatorProperties();
        CoordinatorProperties.EngineConfig engine = properties.getEngine();
        engine.getRetry().setInitialIntervalMs(1);
        engine.getRetry().setMaxIntervalMs(5);
        engine.setPollInterval(Duration.ofHours(1));

        store = new InMemoryKeyValueStore();
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        meterRegistry = new SimpleMeterRegistry();
        engineClient = mock(WorkflowEngineClient.class);

        ClusterClient idleCluster = () -> Mono.just(List.of(NodeMetrics.builder()
            .name("node-1")
            .cpuCapacityMillis(8000)
            .memoryCapacityBytes(32L * 1024 * 1024 * 1024)
            .ready(true)
            .build()));
        resourceManager = new ResourceManager(properties, idleCluster, meterRegistry, clock);
        QualityManager qualityManager = new QualityManager(properties, resourceManager, new InputComplexityAnalyzer(),
            store, objectMapper, clock);
        cacheManager = new CacheManager(store, objectMapper, clock, properties);
        MonitoringService monitoringService = new MonitoringService(meterRegistry, store, objectMapper, clock, properties);
        statusTracker = new WorkflowStatusTracker(store, objectMapper, properties);

        service = new CoordinatorService(qualityManager, resourceManager, cacheManager, monitoringService,
            statusTracker, engineClient, new WorkflowManifestBuilder(objectMapper, properties), properties, clock);
    }

    @AfterEach
    void tearDown() {
        service.stop();
    }

    @Test
    void submittedWorkflowIsPendingAndPolled() {
        when(engineClient.submit(any())).thenReturn(Mono.just("accepted"));

        WorkflowSubmitResponse response = service.createWorkflow(request()).block();

        assertThat(response.getStatus()).isEqualTo(WorkflowPhase.PENDING);
        assertThat(response.getQualityLevel()).isEqualTo(QualityLevel.MEDIUM);
        assertThat(response.isCached()).isFalse();
        assertThat(response.getWorkflowId()).startsWith("wf-");

        ArgumentCaptor<ObjectNode> manifest = ArgumentCaptor.forClass(ObjectNode.class);
        verify(engineClient).submit(manifest.capture());
        assertThat(manifest.getValue().path("metadata").path("name").asText()).isEqualTo(response.getWorkflowId());
        assertThat(manifest.getValue().path("spec").path("workflowTemplateRef").path("name").asText())
            .isEqualTo("room-layout");

        WorkflowStatus stored = statusTracker.get(response.getWorkflowId()).block();
        assertThat(stored.getRequest().getPriority()).isEqualTo(WorkflowPriority.MEDIUM);
        assertThat(resourceManager.getReservationCount()).isEqualTo(1);
        assertThat(service.getPoller().isScheduled(response.getWorkflowId())).isTrue();
        assertThat(meterRegistry.get("coordinator.workflows.created").counter().count()).isEqualTo(1.0);
    }

    @Test
    void identicalRequestAttachesToTheInFlightWorkflow() {
        when(engineClient.submit(any())).thenReturn(Mono.just("accepted"));

        WorkflowSubmitResponse first = service.createWorkflow(request()).block();
        WorkflowSubmitResponse second = service.createWorkflow(request()).block();

        verify(engineClient, times(1)).submit(any());
        assertThat(second.getWorkflowId()).isEqualTo(first.getWorkflowId());
        assertThat(second.isCached()).isTrue();
        assertThat(second.getStatus()).isEqualTo(WorkflowPhase.PENDING);
        assertThat(meterRegistry.get("coordinator.cache.requests").tag("result", "hit").counter().count())
            .isEqualTo(1.0);
    }

    @Test
    void cachingCanBeDisabledPerRequest() {
        when(engineClient.submit(any())).thenReturn(Mono.just("accepted"));
        WorkflowRequest uncached = request();
        uncached.setEnableCaching(false);

        service.createWorkflow(uncached).block();
        service.createWorkflow(uncached).block();

        verify(engineClient, times(2)).submit(any());
    }

    @Test
    void transientSubmitFailuresAreRetriedThenReportedAsError() {
        AtomicInteger attempts = new AtomicInteger();
        when(engineClient.submit(any())).thenReturn(Mono.defer(() -> {
            attempts.incrementAndGet();
            return Mono.error(new TransientInfraException("argo unreachable"));
        }));

        WorkflowSubmitResponse response = service.createWorkflow(request()).block();

        assertThat(attempts.get()).isEqualTo(3);
        assertThat(response.getStatus()).isEqualTo(WorkflowPhase.ERROR);
        assertThat(response.getStage()).isEqualTo(CoordinatorService.STAGE_SUBMISSION);
        assertThat(response.getErrorMessage()).isEqualTo("argo unreachable");
        assertThat(response.getWorkflowId()).isNotNull();

        WorkflowStatus stored = statusTracker.get(response.getWorkflowId()).block();
        assertThat(stored.getStatus()).isEqualTo(WorkflowPhase.ERROR);
        assertThat(stored.getFailedStage()).isEqualTo(CoordinatorService.STAGE_SUBMISSION);
        assertThat(stored.getRequest().getType()).isEqualTo("room-layout");
        assertThat(resourceManager.getReservationCount()).isZero();
        assertThat(cacheManager.claimInFlight(stored.getCacheKey(), "wf-next")).isEmpty();
    }

    @Test
    void rejectedSubmitIsNotRetried() {
        AtomicInteger attempts = new AtomicInteger();
        when(engineClient.submit(any())).thenReturn(Mono.defer(() -> {
            attempts.incrementAndGet();
            return Mono.error(new EngineRejectedException("template room-layout not found", 404));
        }));

        StepVerifier.create(service.createWorkflow(request()))
            .assertNext(response -> assertThat(response.getStatus()).isEqualTo(WorkflowPhase.ERROR))
            .verifyComplete();

        assertThat(attempts.get()).isEqualTo(1);
    }

    @Test
    void submitThatAlreadyReachedTheEngineIsAdopted() {
        AtomicInteger attempts = new AtomicInteger();
        when(engineClient.submit(any())).thenReturn(Mono.defer(() -> attempts.incrementAndGet() == 1
            ? Mono.error(new TransientInfraException("timeout"))
            : Mono.error(new EngineRejectedException("workflow already exists", 409))));
        when(engineClient.getWorkflow(anyString())).thenReturn(Mono.just(observation(WorkflowPhase.RUNNING)));

        WorkflowSubmitResponse response = service.createWorkflow(request()).block();

        assertThat(attempts.get()).isEqualTo(2);
        assertThat(response.getStatus()).isEqualTo(WorkflowPhase.PENDING);
        assertThat(response.getStage()).isNull();
        verify(engineClient).getWorkflow(response.getWorkflowId());
        assertThat(statusTracker.get(response.getWorkflowId()).block().isTerminal()).isFalse();
        assertThat(resourceManager.getReservationCount()).isEqualTo(1);
        assertThat(service.getPoller().isScheduled(response.getWorkflowId())).isTrue();
    }

    @Test
    void unconfirmedNameConflictIsASubmissionError() {
        AtomicInteger attempts = new AtomicInteger();
        when(engineClient.submit(any())).thenReturn(Mono.defer(() -> attempts.incrementAndGet() == 1
            ? Mono.error(new TransientInfraException("timeout"))
            : Mono.error(new EngineRejectedException("workflow already exists", 409))));
        when(engineClient.getWorkflow(anyString())).thenReturn(Mono.error(new TransientInfraException("timeout")));

        WorkflowSubmitResponse response = service.createWorkflow(request()).block();

        assertThat(response.getStatus()).isEqualTo(WorkflowPhase.ERROR);
        assertThat(response.getStage()).isEqualTo(CoordinatorService.STAGE_SUBMISSION);
        assertThat(response.getErrorMessage()).isEqualTo("workflow already exists");
        assertThat(resourceManager.getReservationCount()).isZero();
        assertThat(service.getPoller().isScheduled(response.getWorkflowId())).isFalse();
    }

    @Test
    void invalidRequestsAreRejectedBeforeAnythingIsRecorded() {
        WorkflowRequest badType = request();
        badType.setType("Room Layout");
        WorkflowRequest noTier = request();
        noTier.setSubscriptionTier(null);
        WorkflowRequest badTarget = request();
        badTarget.setQualityTarget("ultra");

        for (WorkflowRequest invalid : List.of(badType, noTier, badTarget)) {
            StepVerifier.create(service.createWorkflow(invalid))
                .expectError(WorkflowValidationException.class)
                .verify();
        }
        StepVerifier.create(service.createWorkflow(null))
            .expectError(WorkflowValidationException.class)
            .verify();

        verifyNoInteractions(engineClient);
        assertThat(statusTracker.listActive(null)).isEmpty();
    }

    @Test
    void priorityIsDerivedFromTypeAndTier() {
        assertThat(CoordinatorService.derivePriority("preview", SubscriptionTier.FREE)).isEqualTo(WorkflowPriority.HIGH);
        assertThat(CoordinatorService.derivePriority("room-layout", SubscriptionTier.PREMIUM))
            .isEqualTo(WorkflowPriority.HIGH);
        assertThat(CoordinatorService.derivePriority("room-layout", SubscriptionTier.STANDARD))
            .isEqualTo(WorkflowPriority.MEDIUM);
        assertThat(CoordinatorService.derivePriority("room-layout", SubscriptionTier.FREE))
            .isEqualTo(WorkflowPriority.LOW);
    }

    @Test
    void succeededWorkflowFillsTheCache() {
        when(engineClient.submit(any())).thenReturn(Mono.just("accepted"));
        String workflowId = service.createWorkflow(request()).block().getWorkflowId();

        ObjectNode outputs = objectMapper.createObjectNode().put("layout", "s3://results/layout.json");
        clock.advance(Duration.ofSeconds(90));
        when(engineClient.getWorkflow(workflowId)).thenReturn(Mono.just(EngineObservation.builder()
            .status(WorkflowStatus.builder().status(WorkflowPhase.SUCCEEDED).progress(100).build())
            .outputs(outputs)
            .build()));

        StepVerifier.create(service.getWorkflow(workflowId))
            .assertNext(status -> {
                assertThat(status.getStatus()).isEqualTo(WorkflowPhase.SUCCEEDED);
                assertThat(status.getDurationSeconds()).isEqualTo(90L);
            })
            .verifyComplete();

        assertThat(resourceManager.getReservationCount()).isZero();
        assertThat(service.getPoller().isScheduled(workflowId)).isFalse();

        WorkflowSubmitResponse repeat = service.createWorkflow(request()).block();
        assertThat(repeat.isCached()).isTrue();
        assertThat(repeat.getWorkflowId()).isEqualTo(workflowId);
        assertThat(repeat.getStatus()).isEqualTo(WorkflowPhase.SUCCEEDED);
        verify(engineClient, times(1)).submit(any());
    }

    @Test
    void cachedResultIsNotSharedWithALowerTier() {
        when(engineClient.submit(any())).thenReturn(Mono.just("accepted"));
        WorkflowRequest premium = request();
        premium.setSubscriptionTier(SubscriptionTier.PREMIUM);
        premium.setQualityTarget("high");
        WorkflowSubmitResponse first = service.createWorkflow(premium).block();
        assertThat(first.getQualityLevel()).isEqualTo(QualityLevel.HIGH);

        when(engineClient.getWorkflow(first.getWorkflowId())).thenReturn(Mono.just(EngineObservation.builder()
            .status(WorkflowStatus.builder().status(WorkflowPhase.SUCCEEDED).progress(100).build())
            .outputs(objectMapper.createObjectNode().put("layout", "s3://results/high.json"))
            .build()));
        service.getWorkflow(first.getWorkflowId()).block();

        WorkflowRequest free = request();
        free.setSubscriptionTier(SubscriptionTier.FREE);
        free.setQualityTarget("high");
        WorkflowSubmitResponse second = service.createWorkflow(free).block();

        assertThat(second.isCached()).isFalse();
        assertThat(second.getQualityLevel()).isEqualTo(QualityLevel.LOW);
        assertThat(second.getWorkflowId()).isNotEqualTo(first.getWorkflowId());
        verify(engineClient, times(2)).submit(any());

        WorkflowSubmitResponse premiumAgain = service.createWorkflow(premium).block();
        assertThat(premiumAgain.isCached()).isTrue();
        assertThat(premiumAgain.getWorkflowId()).isEqualTo(first.getWorkflowId());
    }

    @Test
    void identicalRequestAttachesWhileTheResultIsBeingCached() {
        when(engineClient.submit(any())).thenReturn(Mono.just("accepted"));
        String workflowId = service.createWorkflow(request()).block().getWorkflowId();
        String cacheKey = statusTracker.get(workflowId).block().getCacheKey();

        store.holdWrites(properties.getCache().getKeyPrefix());
        when(engineClient.getWorkflow(workflowId)).thenReturn(Mono.just(EngineObservation.builder()
            .status(WorkflowStatus.builder().status(WorkflowPhase.SUCCEEDED).progress(100).build())
            .outputs(objectMapper.createObjectNode().put("layout", "s3://results/layout.json"))
            .build()));
        service.getWorkflow(workflowId).block();
        assertThat(cacheManager.get(cacheKey).blockOptional()).isEmpty();

        WorkflowSubmitResponse repeat = service.createWorkflow(request()).block();

        assertThat(repeat.isCached()).isTrue();
        assertThat(repeat.getWorkflowId()).isEqualTo(workflowId);
        assertThat(repeat.getStatus()).isEqualTo(WorkflowPhase.SUCCEEDED);
        verify(engineClient, times(1)).submit(any());

        store.releaseWrites();
        await().atMost(Duration.ofSeconds(5)).until(() -> cacheManager.get(cacheKey).blockOptional().isPresent());
        assertThat(cacheManager.claimInFlight(cacheKey, "wf-next")).isEmpty();
    }

    @Test
    void storedStatusIsReturnedWhenTheEngineIsUnreachable() {
        when(engineClient.submit(any())).thenReturn(Mono.just("accepted"));
        String workflowId = service.createWorkflow(request()).block().getWorkflowId();
        when(engineClient.getWorkflow(workflowId)).thenReturn(Mono.error(new TransientInfraException("timeout")));

        StepVerifier.create(service.getWorkflow(workflowId))
            .assertNext(status -> assertThat(status.getStatus()).isEqualTo(WorkflowPhase.PENDING))
            .verifyComplete();
        StepVerifier.create(service.getWorkflow("wf-unknown"))
            .expectError(WorkflowNotFoundException.class)
            .verify();
    }

    @Test
    void cancellationMarksTheWorkflowFailed() {
        when(engineClient.submit(any())).thenReturn(Mono.just("accepted"));
        when(engineClient.terminate(any())).thenReturn(Mono.empty());
        String workflowId = service.createWorkflow(request()).block().getWorkflowId();

        StepVerifier.create(service.cancelWorkflow(workflowId))
            .assertNext(response -> {
                assertThat(response.getStatus()).isEqualTo(WorkflowPhase.FAILED);
                assertThat(response.getCancelledAt()).isEqualTo(clock.instant());
            })
            .verifyComplete();

        WorkflowStatus stored = statusTracker.get(workflowId).block();
        assertThat(stored.getFailedStage()).isEqualTo(CoordinatorService.STAGE_CANCELLATION);
        assertThat(stored.getErrorMessage()).isEqualTo(CoordinatorService.CANCELLED_MESSAGE);
        assertThat(resourceManager.getReservationCount()).isZero();
        assertThat(service.getPoller().isScheduled(workflowId)).isFalse();

        StepVerifier.create(service.cancelWorkflow(workflowId))
            .expectError(WorkflowConflictException.class)
            .verify();
        verify(engineClient, times(1)).terminate(workflowId);
    }

    @Test
    void engineRefusingTerminationStillCancels() {
        when(engineClient.submit(any())).thenReturn(Mono.just("accepted"));
        when(engineClient.terminate(any())).thenReturn(Mono.error(new EngineRejectedException("gone", 404)));
        String workflowId = service.createWorkflow(request()).block().getWorkflowId();

        StepVerifier.create(service.cancelWorkflow(workflowId))
            .assertNext(response -> assertThat(response.getStatus()).isEqualTo(WorkflowPhase.FAILED))
            .verifyComplete();
    }

    @Test
    void unreachableEngineFailsCancellation() {
        when(engineClient.submit(any())).thenReturn(Mono.just("accepted"));
        when(engineClient.terminate(any())).thenReturn(Mono.error(new TransientInfraException("timeout")));
        String workflowId = service.createWorkflow(request()).block().getWorkflowId();

        StepVerifier.create(service.cancelWorkflow(workflowId))
            .expectError(TransientInfraException.class)
            .verify();

        assertThat(statusTracker.get(workflowId).block().getStatus()).isEqualTo(WorkflowPhase.PENDING);
    }

    @Test
    void pollReportsTerminalState() throws Exception {
        when(engineClient.submit(any())).thenReturn(Mono.just("accepted"));
        String workflowId = service.createWorkflow(request()).block().getWorkflowId();
        when(engineClient.getWorkflow(workflowId)).thenReturn(
            Mono.just(observation(WorkflowPhase.RUNNING)),
            Mono.just(observation(WorkflowPhase.FAILED)));

        assertThat(service.poll(workflowId)).isFalse();
        assertThat(service.poll(workflowId)).isTrue();

        WorkflowStatus stored = statusTracker.get(workflowId).block();
        assertThat(stored.getStatus()).isEqualTo(WorkflowPhase.FAILED);
        assertThat(stored.getFailedStage()).isEqualTo("execution");
        assertThat(meterRegistry.get("coordinator.workflows.completed").tag("status", "failed").counter().count())
            .isEqualTo(1.0);
    }

    @Test
    void abandonedPollingMarksTheWorkflowLost() {
        when(engineClient.submit(any())).thenReturn(Mono.just("accepted"));
        String workflowId = service.createWorkflow(request()).block().getWorkflowId();

        service.onPollingAbandoned(workflowId, new TransientInfraException("argo unreachable"));

        await().atMost(Duration.ofSeconds(5)).untilAsserted(() -> {
            WorkflowStatus stored = statusTracker.get(workflowId).block();
            assertThat(stored.getStatus()).isEqualTo(WorkflowPhase.ERROR);
            assertThat(stored.getFailedStage()).isEqualTo(CoordinatorService.STAGE_POLLING);
            assertThat(stored.getErrorMessage()).contains("argo unreachable");
        });
        assertThat(resourceManager.getReservationCount()).isZero();
    }

    @Test
    void activeWorkflowsAreListedPerUser() {
        when(engineClient.submit(any())).thenReturn(Mono.just("accepted"));
        service.createWorkflow(request()).block();
        WorkflowRequest other = request();
        other.setUserId("user-2");
        other.getParameters().put("room-size", "small");
        service.createWorkflow(other).block();

        StepVerifier.create(service.listActiveWorkflows("user-2").collectList())
            .assertNext(list -> assertThat(list).extracting(WorkflowStatus::getUserId).containsExactly("user-2"))
            .verifyComplete();
        StepVerifier.create(service.listActiveWorkflows(null).count()).expectNext(2L).verifyComplete();
        verify(engineClient, never()).terminate(any());
    }

    private static EngineObservation observation(WorkflowPhase phase) {
        return EngineObservation.builder()
            .status(WorkflowStatus.builder().status(phase).progress(50).build())
            .build();
    }

    private static WorkflowRequest request() {
        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("room-type", "kitchen");
        parameters.put("room-size", "large");
        return WorkflowRequest.builder()
            .type("room-layout")
            .userId("user-1")
            .subscriptionTier(SubscriptionTier.STANDARD)
            .qualityTarget("medium")
            .parameters(parameters)
            .build();
    }
}
