package com.whereq.coordinator.monitoring;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.coordinator.MutableClock;
import com.whereq.coordinator.config.CoordinatorProperties;
import com.whereq.coordinator.dto.WorkflowStats;
import com.whereq.coordinator.model.ProcessingStage;
import com.whereq.coordinator.model.QualityLevel;
import com.whereq.coordinator.model.ResourceAllocation;
import com.whereq.coordinator.model.ScalingDirective;
import com.whereq.coordinator.model.WorkflowMetrics;
import com.whereq.coordinator.model.WorkflowPhase;
import com.whereq.coordinator.store.InMemoryKeyValueStore;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.offset;
import static org.awaitility.Awaitility.await;

class MonitoringServiceTest {

    private SimpleMeterRegistry meterRegistry;
    private InMemoryKeyValueStore store;
    private MutableClock clock;
    private MonitoringService monitoringService;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        store = new InMemoryKeyValueStore();
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        monitoringService = new MonitoringService(meterRegistry, store, new ObjectMapper().findAndRegisterModules(),
            clock, new CoordinatorProperties());
        monitoringService.initialize();
    }

    @Test
    void workflowLifecycleIsCounted() {
        monitoringService.startWorkflow("wf-1", "room-layout");
        monitoringService.recordWorkflowCreation("wf-1", "room-layout", QualityLevel.MEDIUM, Duration.ofMillis(120));
        assertThat(meterRegistry.get("coordinator.workflows.active").gauge().value()).isEqualTo(1.0);

        clock.advance(Duration.ofSeconds(30));
        monitoringService.recordWorkflowCompletion("wf-1", "room-layout", WorkflowPhase.SUCCEEDED, null);

        assertThat(meterRegistry.get("coordinator.workflows.created")
            .tag("type", "room-layout").tag("quality", "medium").counter().count()).isEqualTo(1.0);
        assertThat(meterRegistry.get("coordinator.workflows.completed")
            .tag("status", "succeeded").counter().count()).isEqualTo(1.0);
        assertThat(meterRegistry.get("coordinator.workflows.duration").timer().totalTime(TimeUnit.SECONDS))
            .isEqualTo(30.0);
        assertThat(monitoringService.getActiveCount()).isZero();

        WorkflowStats stats = monitoringService.getStats();
        assertThat(stats.getCounts()).containsEntry("room-layout", 1L);
        assertThat(stats.getAverageTimes()).containsEntry("room-layout", 30.0);
        assertThat(stats.getErrorRates()).containsEntry("room-layout", 0.0);
    }

    @Test
    void cacheHitRatioIsHitsOverLookups() {
        monitoringService.recordCacheResult("room-layout", false);
        monitoringService.recordCacheResult("room-layout", true);
        monitoringService.recordCacheResult("room-layout", true);
        monitoringService.recordCacheResult("room-layout", true);

        assertThat(monitoringService.getCacheHitRatio("room-layout")).isEqualTo(0.75);
        assertThat(monitoringService.getCacheHitRatio("material-recognition")).isZero();
        assertThat(meterRegistry.get("coordinator.cache.requests").tag("result", "hit").counter().count()).isEqualTo(3.0);
    }

    @Test
    void errorsAreCategorized() {
        monitoringService.startWorkflow("wf-2", "room-layout");
        monitoringService.recordWorkflowError("wf-2", "room-layout", "submission", "Request timed out after 10s");

        assertThat(meterRegistry.get("coordinator.workflows.errors")
            .tag("stage", "submission").tag("category", "timeout").counter().count()).isEqualTo(1.0);
        assertThat(monitoringService.getStats().getErrorRates()).containsEntry("room-layout", 1.0);
    }

    @Test
    void categorizeError() {
        assertThat(MonitoringService.categorizeError(null)).isEqualTo("unknown");
        assertThat(MonitoringService.categorizeError("Connection timeout")).isEqualTo("timeout");
        assertThat(MonitoringService.categorizeError("GPU resources unavailable")).isEqualTo("resource_limit");
        assertThat(MonitoringService.categorizeError("exceeded quota")).isEqualTo("resource_limit");
        assertThat(MonitoringService.categorizeError("403 Forbidden")).isEqualTo("permission");
        assertThat(MonitoringService.categorizeError("template not found")).isEqualTo("not_found");
        assertThat(MonitoringService.categorizeError("invalid parameter")).isEqualTo("validation");
        assertThat(MonitoringService.categorizeError("segfault")).isEqualTo("unknown");
    }

    @Test
    void allocationIsRecordedInBaseUnits() {
        monitoringService.recordResourceAllocation("room-layout", ResourceAllocation.builder()
            .cpu("2").memory("1Gi").gpu(1).nodePool("gpu").build());

        assertThat(meterRegistry.get("coordinator.resources.allocated.cpu").summary().totalAmount()).isEqualTo(2000.0);
        assertThat(meterRegistry.get("coordinator.resources.allocated.memory").summary().totalAmount())
            .isCloseTo(1024.0 * 1024 * 1024, offset(0.5));
        assertThat(meterRegistry.get("coordinator.resources.allocated").tag("node_pool", "gpu").counter().count())
            .isEqualTo(1.0);
    }

    @Test
    void badInputNeverThrows() {
        assertThatCode(() -> {
            monitoringService.recordResourceAllocation("room-layout", ResourceAllocation.builder().cpu("lots").build());
            monitoringService.recordWorkflowCompletion("wf-x", null, null, null);
            monitoringService.recordQualityLevel("", null, false);
            monitoringService.recordScalingError(null, "tick");
        }).doesNotThrowAnyException();

        assertThat(monitoringService.getStats().getCounts()).doesNotContainKey("");
    }

    @Test
    void metricsHistoryIsAppendedInTheBackground() {
        monitoringService.recordWorkflowMetrics(WorkflowMetrics.builder().workflowId("wf-1").type("room-layout").build());

        await().atMost(Duration.ofSeconds(5))
            .untilAsserted(() -> assertThat(store.list(MonitoringService.METRICS_HISTORY_KEY)).hasSize(1));
    }

    @Test
    void meterNamesAndTagKeysMatchTheGoldenList() throws Exception {
        monitoringService.startWorkflow("wf-1", "room-layout");
        monitoringService.recordWorkflowCreation("wf-1", "room-layout", QualityLevel.HIGH, Duration.ofMillis(50));
        monitoringService.recordWorkflowCompletion("wf-1", "room-layout", WorkflowPhase.SUCCEEDED, Duration.ofSeconds(5));
        monitoringService.recordWorkflowCancellation("wf-2", "room-layout");
        monitoringService.recordWorkflowError("wf-3", "room-layout", "execution", "OOMKilled");
        monitoringService.recordQualityLevel("room-layout", QualityLevel.LOW, true);
        monitoringService.recordResourceAllocation("room-layout", ResourceAllocation.builder()
            .cpu("500m").memory("512Mi").gpu(0).nodePool("general").build());
        monitoringService.recordCacheResult("room-layout", true);
        monitoringService.recordStageDuration("room-layout", ProcessingStage.INFERENCE, Duration.ofSeconds(2));
        monitoringService.recordWorkflowMetrics(WorkflowMetrics.builder().workflowId("wf-1").type("room-layout").build());
        monitoringService.recordScalingDirective(ScalingDirective.builder()
            .workload("inference-worker")
            .fromReplicas(2)
            .toReplicas(4)
            .direction(ScalingDirective.Direction.SCALE_UP)
            .source(ScalingDirective.Source.PREDICTIVE)
            .build());
        monitoringService.recordScalingError("inference-worker", "patch");
        monitoringService.recordHpaEvent("inference-worker", "scale_up");

        Map<String, String> meters = new TreeMap<>();
        meterRegistry.getMeters().forEach(meter -> meters.put(meter.getId().getName(),
            meter.getId().getTags().stream().map(Tag::getKey).sorted().collect(Collectors.joining(", ", "[", "]"))));
        List<String> actual = meters.entrySet().stream()
            .map(entry -> entry.getKey() + " " + entry.getValue())
            .collect(Collectors.toList());

        assertThat(actual).containsExactlyElementsOf(golden("/monitoring/meters.golden"));
    }

    @Test
    void storeFailureDoesNotSurface() {
        store.setFailing(true);

        assertThatCode(() -> monitoringService.recordWorkflowMetrics(WorkflowMetrics.builder().workflowId("wf-1").build()))
            .doesNotThrowAnyException();
    }

    private static List<String> golden(String resource) throws IOException {
        try (InputStream in = MonitoringServiceTest.class.getResourceAsStream(resource)) {
            assertThat(in).as("resource %s", resource).isNotNull();
            return new String(in.readAllBytes(), StandardCharsets.UTF_8).lines()
                .filter(line -> !line.isBlank())
                .collect(Collectors.toList());
        }
    }
}
