package com.whereq.coordinator.monitoring;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.coordinator.config.CoordinatorProperties;
import com.whereq.coordinator.dto.WorkflowStats;
import com.whereq.coordinator.model.ProcessingStage;
import com.whereq.coordinator.model.QualityLevel;
import com.whereq.coordinator.model.ResourceAllocation;
import com.whereq.coordinator.model.ScalingDirective;
import com.whereq.coordinator.model.WorkflowMetrics;
import com.whereq.coordinator.model.WorkflowPhase;
import com.whereq.coordinator.resource.QuantityParser;
import com.whereq.coordinator.store.KeyValueStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Locale;
import java.util.OptionalDouble;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Workflow lifecycle metrics.
 *
 * Meters use stable names under "coordinator." with fixed tag keys and are scraped
 * through the Prometheus actuator endpoint. No method here throws: a failure
 * while recording is logged and dropped.
 *
 * @author WhereQ Inc.
 */
@Slf4j
@Service
public class MonitoringService {

    static final String METRICS_HISTORY_KEY = "coordinator:metrics:history";

    private static final String UNKNOWN = "unknown";

    private final MeterRegistry meterRegistry;
    private final KeyValueStore store;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final CoordinatorProperties.MonitoringConfig config;

    private final ConcurrentHashMap<String, Instant> activeWorkflows = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, TypeStats> typeStats = new ConcurrentHashMap<>();

    public MonitoringService(MeterRegistry meterRegistry, KeyValueStore store, ObjectMapper objectMapper,
                             Clock clock, CoordinatorProperties properties) {
        this.meterRegistry = meterRegistry;
        this.store = store;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.config = properties.getMonitoring();
    }

    @PostConstruct
    public void initialize() {
        Gauge.builder("coordinator.workflows.active", activeWorkflows::size)
            .description("Workflows submitted and not yet finished")
            .register(meterRegistry);

        log.info("Monitoring service initialized");
    }

    /**
     * Start tracking a workflow
     */
    public void startWorkflow(String workflowId, String type) {
        try {
            activeWorkflows.put(workflowId, clock.instant());
            stats(type).count.incrementAndGet();
            log.debug("Workflow {} of type {} started", workflowId, type);
        } catch (RuntimeException e) {
            log.warn("Failed to record start of workflow {}: {}", workflowId, e.getMessage());
        }
    }

    /**
     * Record a workflow accepted by the engine
     *
     * @param submitLatency time from intake to engine acceptance
     */
    public void recordWorkflowCreation(String workflowId, String type, QualityLevel quality, Duration submitLatency) {
        try {
            Counter.builder("coordinator.workflows.created")
                .description("Workflows submitted to the execution engine")
                .tag("type", tag(type))
                .tag("quality", quality != null ? quality.getValue() : UNKNOWN)
                .register(meterRegistry)
                .increment();

            Timer.builder("coordinator.workflows.submission")
                .description("Time from intake to engine acceptance")
                .tag("type", tag(type))
                .register(meterRegistry)
                .record(submitLatency);

            log.debug("Workflow {} created in {} ms", workflowId, submitLatency.toMillis());
        } catch (RuntimeException e) {
            log.warn("Failed to record creation of workflow {}: {}", workflowId, e.getMessage());
        }
    }

    /**
     * Record a workflow reaching a terminal phase
     */
    public void recordWorkflowCompletion(String workflowId, String type, WorkflowPhase phase, Duration duration) {
        try {
            String status = phase != null ? phase.getValue().toLowerCase(Locale.ROOT) : UNKNOWN;
            Instant startedAt = activeWorkflows.remove(workflowId);
            Duration elapsed = duration != null ? duration
                : startedAt != null ? Duration.between(startedAt, clock.instant()) : Duration.ZERO;

            Counter.builder("coordinator.workflows.completed")
                .description("Workflows that reached a terminal phase")
                .tag("type", tag(type))
                .tag("status", status)
                .register(meterRegistry)
                .increment();

            Timer.builder("coordinator.workflows.duration")
                .description("Workflow duration from start to terminal phase")
                .tag("type", tag(type))
                .tag("status", status)
                .register(meterRegistry)
                .record(elapsed);

            stats(type).addCompletion(elapsed.toMillis(), config.getCompletionTimesPerType());
            log.debug("Workflow {} completed with {} after {} s", workflowId, status, elapsed.toSeconds());
        } catch (RuntimeException e) {
            log.warn("Failed to record completion of workflow {}: {}", workflowId, e.getMessage());
        }
    }

    public void recordWorkflowCancellation(String workflowId, String type) {
        try {
            activeWorkflows.remove(workflowId);
            Counter.builder("coordinator.workflows.cancelled")
                .description("Workflows cancelled by their owner")
                .tag("type", tag(type))
                .register(meterRegistry)
                .increment();
            log.debug("Workflow {} cancelled", workflowId);
        } catch (RuntimeException e) {
            log.warn("Failed to record cancellation of workflow {}: {}", workflowId, e.getMessage());
        }
    }

    /**
     * Record a failure, categorized from its message
     *
     * @param stage lifecycle stage that failed (submission, execution, polling, ...)
     */
    public void recordWorkflowError(String workflowId, String type, String stage, String message) {
        try {
            String category = categorizeError(message);
            Counter.builder("coordinator.workflows.errors")
                .description("Workflow failures by stage and category")
                .tag("type", tag(type))
                .tag("stage", stage != null ? stage : UNKNOWN)
                .tag("category", category)
                .register(meterRegistry)
                .increment();

            stats(type).errors.incrementAndGet();
            log.debug("Workflow {} error in {} categorized as {}", workflowId, stage, category);
        } catch (RuntimeException e) {
            log.warn("Failed to record error of workflow {}: {}", workflowId, e.getMessage());
        }
    }

    public void recordQualityLevel(String type, QualityLevel level, boolean clamped) {
        try {
            Counter.builder("coordinator.quality.selected")
                .description("Resolved quality levels")
                .tag("type", tag(type))
                .tag("quality", level != null ? level.getValue() : UNKNOWN)
                .tag("clamped", String.valueOf(clamped))
                .register(meterRegistry)
                .increment();
        } catch (RuntimeException e) {
            log.warn("Failed to record quality level for {}: {}", type, e.getMessage());
        }
    }

    public void recordResourceAllocation(String type, ResourceAllocation allocation) {
        try {
            String pool = allocation.getNodePool() != null ? allocation.getNodePool() : UNKNOWN;
            Counter.builder("coordinator.resources.allocated")
                .description("Allocations by node pool")
                .tag("type", tag(type))
                .tag("node_pool", pool)
                .register(meterRegistry)
                .increment();

            DistributionSummary.builder("coordinator.resources.allocated.cpu")
                .description("Allocated CPU per workflow")
                .baseUnit("millicores")
                .tag("type", tag(type))
                .register(meterRegistry)
                .record(QuantityParser.parseCpuMillis(allocation.getCpu()));

            DistributionSummary.builder("coordinator.resources.allocated.memory")
                .description("Allocated memory per workflow")
                .baseUnit("bytes")
                .tag("type", tag(type))
                .register(meterRegistry)
                .record(QuantityParser.parseMemoryBytes(allocation.getMemory()));

            DistributionSummary.builder("coordinator.resources.allocated.gpu")
                .description("Allocated GPUs per workflow")
                .tag("type", tag(type))
                .register(meterRegistry)
                .record(allocation.getGpu());
        } catch (RuntimeException e) {
            log.warn("Failed to record allocation for {}: {}", type, e.getMessage());
        }
    }

    public void recordCacheResult(String type, boolean hit) {
        try {
            Counter.builder("coordinator.cache.requests")
                .description("Result cache lookups")
                .tag("type", tag(type))
                .tag("result", hit ? "hit" : "miss")
                .register(meterRegistry)
                .increment();

            TypeStats stats = stats(type);
            stats.cacheLookups.incrementAndGet();
            if (hit) {
                stats.cacheHits.incrementAndGet();
            }
        } catch (RuntimeException e) {
            log.warn("Failed to record cache result for {}: {}", type, e.getMessage());
        }
    }

    public void recordStageDuration(String type, ProcessingStage stage, Duration duration) {
        try {
            Timer.builder("coordinator.workflows.stage.duration")
                .description("Time spent per processing stage")
                .tag("type", tag(type))
                .tag("stage", stage != null ? stage.getValue() : UNKNOWN)
                .register(meterRegistry)
                .record(duration);
        } catch (RuntimeException e) {
            log.warn("Failed to record stage duration for {}: {}", type, e.getMessage());
        }
    }

    /**
     * Append a workflow's metrics record to the history. Returns immediately.
     */
    public void recordWorkflowMetrics(WorkflowMetrics metrics) {
        try {
            Mono.fromCallable(() -> objectMapper.writeValueAsString(metrics))
                .flatMap(json -> store.listPush(METRICS_HISTORY_KEY, json, config.getHistoryMaxEntries(), null))
                .subscribeOn(Schedulers.boundedElastic())
                .subscribe(
                    size -> log.debug("Stored metrics of workflow {}", metrics.getWorkflowId()),
                    e -> log.warn("Failed to store metrics of workflow {}: {}", metrics.getWorkflowId(), e.getMessage()));
        } catch (RuntimeException e) {
            log.warn("Failed to record metrics of workflow {}: {}", metrics.getWorkflowId(), e.getMessage());
        }
    }

    public void recordScalingDirective(ScalingDirective directive) {
        try {
            Counter.builder("coordinator.scaling.directives")
                .description("Scaling directives applied")
                .tag("workload", directive.getWorkload())
                .tag("direction", directive.getDirection().name().toLowerCase(Locale.ROOT))
                .tag("source", directive.getSource().name().toLowerCase(Locale.ROOT))
                .register(meterRegistry)
                .increment();
        } catch (RuntimeException e) {
            log.warn("Failed to record scaling directive: {}", e.getMessage());
        }
    }

    /**
     * Record an autoscaling API call that failed after its retries
     */
    public void recordScalingError(String workload, String operation) {
        try {
            Counter.builder("coordinator.scaling.errors")
                .description("Autoscaling calls that failed after retries")
                .tag("workload", workload != null ? workload : UNKNOWN)
                .tag("operation", operation)
                .register(meterRegistry)
                .increment();
        } catch (RuntimeException e) {
            log.warn("Failed to record scaling error for {}: {}", workload, e.getMessage());
        }
    }

    public void recordHpaEvent(String workload, String eventType) {
        try {
            Counter.builder("coordinator.hpa.events")
                .description("Scaling events observed on HorizontalPodAutoscalers")
                .tag("workload", workload != null ? workload : UNKNOWN)
                .tag("type", eventType != null ? eventType : UNKNOWN)
                .register(meterRegistry)
                .increment();
        } catch (RuntimeException e) {
            log.warn("Failed to record HPA event for {}: {}", workload, e.getMessage());
        }
    }

    /**
     * Share of cache lookups for the type that hit
     */
    public double getCacheHitRatio(String type) {
        TypeStats stats = typeStats.get(tag(type));
        if (stats == null || stats.cacheLookups.get() == 0) {
            return 0.0;
        }
        return (double) stats.cacheHits.get() / stats.cacheLookups.get();
    }

    public int getActiveCount() {
        return activeWorkflows.size();
    }

    /**
     * Statistics snapshot per workflow type
     */
    public WorkflowStats getStats() {
        WorkflowStats result = WorkflowStats.builder()
            .activeCount(activeWorkflows.size())
            .build();
        typeStats.forEach((type, stats) -> {
            long count = stats.count.get();
            result.getCounts().put(type, count);
            stats.averageMillis().ifPresent(avg -> result.getAverageTimes().put(type, avg / 1000.0));
            long lookups = stats.cacheLookups.get();
            result.getCacheHitRates().put(type, lookups > 0 ? (double) stats.cacheHits.get() / lookups : 0.0);
            result.getErrorRates().put(type, count > 0 ? (double) stats.errors.get() / count : 0.0);
        });
        return result;
    }

    /**
     * Map an error message onto a fixed category
     */
    static String categorizeError(String message) {
        if (message == null) {
            return UNKNOWN;
        }
        String lower = message.toLowerCase(Locale.ROOT);
        if (lower.contains("timeout") || lower.contains("timed out")) {
            return "timeout";
        }
        if (lower.contains("resource") && (lower.contains("unavailable") || lower.contains("exceeded"))
                || lower.contains("quota")) {
            return "resource_limit";
        }
        if (lower.contains("permission") || lower.contains("unauthorized") || lower.contains("forbidden")) {
            return "permission";
        }
        if (lower.contains("not found")) {
            return "not_found";
        }
        if (lower.contains("invalid") || lower.contains("validation")) {
            return "validation";
        }
        return UNKNOWN;
    }

    private TypeStats stats(String type) {
        return typeStats.computeIfAbsent(tag(type), t -> new TypeStats());
    }

    private static String tag(String value) {
        return value != null && !value.isBlank() ? value : UNKNOWN;
    }

    private static class TypeStats {
        private final AtomicLong count = new AtomicLong();
        private final AtomicLong errors = new AtomicLong();
        private final AtomicLong cacheHits = new AtomicLong();
        private final AtomicLong cacheLookups = new AtomicLong();
        private final Deque<Long> completionMillis = new ArrayDeque<>();

        synchronized void addCompletion(long millis, int limit) {
            completionMillis.addLast(millis);
            while (completionMillis.size() > limit) {
                completionMillis.removeFirst();
            }
        }

        synchronized OptionalDouble averageMillis() {
            return completionMillis.stream().mapToLong(Long::longValue).average();
        }
    }
}
