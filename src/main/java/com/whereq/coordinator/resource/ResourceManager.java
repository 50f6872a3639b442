package com.whereq.coordinator.resource;

import com.whereq.coordinator.cluster.ClusterClient;
import com.whereq.coordinator.config.CoordinatorProperties;
import com.whereq.coordinator.exception.QuotaExceededException;
import com.whereq.coordinator.model.NodeMetrics;
import com.whereq.coordinator.model.QualityLevel;
import com.whereq.coordinator.model.ResourceAllocation;
import com.whereq.coordinator.model.ResourceUtilization;
import com.whereq.coordinator.model.SubscriptionTier;
import com.whereq.coordinator.model.Toleration;
import com.whereq.coordinator.model.WorkflowPriority;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Translates quality, priority and subscription tier into a concrete allocation,
 * and tracks cluster utilization and the resources reserved by running workflows.
 *
 * @author WhereQ Inc.
 */
@Slf4j
@Service
public class ResourceManager {

    private static final double MEDIUM_PRIORITY_FACTOR = 0.75;
    private static final double LOW_PRIORITY_FACTOR = 0.5;

    private final CoordinatorProperties.ResourceConfig config;
    private final Duration utilizationCacheTtl;
    private final ClusterClient clusterClient;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    private final AtomicReference<ClusterSnapshot> latest = new AtomicReference<>();
    private final AtomicReference<Mono<ClusterSnapshot>> refreshInFlight = new AtomicReference<>();
    private final ConcurrentHashMap<String, ResourceAllocation> reservations = new ConcurrentHashMap<>();

    public ResourceManager(CoordinatorProperties properties, ClusterClient clusterClient,
                           MeterRegistry meterRegistry, Clock clock) {
        this.config = properties.getResources();
        this.utilizationCacheTtl = properties.getCluster().getUtilizationCacheTtl();
        this.clusterClient = clusterClient;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    @PostConstruct
    public void initialize() {
        Gauge.builder("coordinator.resources.cpu.utilization", () -> latestUtilization().getCpu())
            .description("Cluster CPU utilization ratio from the last sample")
            .register(meterRegistry);

        Gauge.builder("coordinator.resources.memory.utilization", () -> latestUtilization().getMemory())
            .description("Cluster memory utilization ratio from the last sample")
            .register(meterRegistry);

        Gauge.builder("coordinator.resources.gpu.utilization", () -> latestUtilization().getGpu())
            .description("Share of cluster GPUs reserved by running workflows")
            .register(meterRegistry);

        Gauge.builder("coordinator.resources.reservations", reservations::size)
            .description("Workflows holding a resource reservation")
            .register(meterRegistry);

        log.info("ResourceManager initialized: profiles={}, node pools={}, high load threshold={}",
            config.getProfiles().keySet(), config.getNodePools().keySet(), config.getHighLoadThreshold());
    }

    /**
     * Allocate using the last utilization sample without waiting for the cluster
     */
    public ResourceAllocation allocateResources(QualityLevel level, WorkflowPriority priority, SubscriptionTier tier) {
        return allocateResources(level, priority, tier, latestUtilization());
    }

    /**
     * Allocate resources for a workflow.
     *
     * The quality profile gives the base tuple. Under high load, lower priorities
     * are shrunk and the free tier falls back to the low profile. The node pool is
     * always one the tier may use.
     *
     * @param level resolved quality level
     * @param priority request priority, medium when null
     * @param tier subscription tier, treated as the most restricted tier when null
     * @param utilization cluster utilization sample
     * @return allocation
     */
    public ResourceAllocation allocateResources(QualityLevel level, WorkflowPriority priority,
                                                SubscriptionTier tier, ResourceUtilization utilization) {
        WorkflowPriority effectivePriority = priority != null ? priority : WorkflowPriority.MEDIUM;
        CoordinatorProperties.Profile profile = profile(level);

        long cpuMillis = QuantityParser.parseCpuMillis(profile.getCpu());
        long memoryBytes = QuantityParser.parseMemoryBytes(profile.getMemory());
        int gpu = profile.getGpu();

        double threshold = config.getHighLoadThreshold();
        boolean highLoad = utilization != null && utilization.maxUtilization() > threshold;

        if (highLoad) {
            if (tier == null || tier == SubscriptionTier.FREE) {
                CoordinatorProperties.Profile low = profile(QualityLevel.LOW);
                cpuMillis = Math.min(cpuMillis, QuantityParser.parseCpuMillis(low.getCpu()));
                memoryBytes = Math.min(memoryBytes, QuantityParser.parseMemoryBytes(low.getMemory()));
                gpu = Math.min(gpu, low.getGpu());
            } else if (!effectivePriority.isProtected()) {
                double factor = effectivePriority == WorkflowPriority.MEDIUM ? MEDIUM_PRIORITY_FACTOR : LOW_PRIORITY_FACTOR;
                if (utilization.getCpu() > threshold) {
                    cpuMillis = (long) (cpuMillis * factor);
                }
                if (utilization.getMemory() > threshold) {
                    memoryBytes = (long) (memoryBytes * factor);
                }
                if (factor == LOW_PRIORITY_FACTOR && utilization.getGpu() > threshold && level != QualityLevel.HIGH) {
                    gpu = 0;
                }
            }
            log.debug("High cluster load (cpu={}, memory={}, gpu={}): {}/{} allocation reduced to {}m, {} bytes, {} GPU",
                utilization.getCpu(), utilization.getMemory(), utilization.getGpu(),
                level, effectivePriority, cpuMillis, memoryBytes, gpu);
        }

        cpuMillis = Math.max(cpuMillis, QuantityParser.parseCpuMillis(config.getMinimumCpu()));
        memoryBytes = Math.max(memoryBytes, QuantityParser.parseMemoryBytes(config.getMinimumMemory()));

        String poolName = selectNodePool(profile.getNodePool(), gpu > 0, tier);
        CoordinatorProperties.NodePool pool = config.getNodePools().get(poolName);
        if (pool == null || !pool.isGpu()) {
            gpu = 0;
        }

        Map<String, String> selector = pool != null ? new LinkedHashMap<>(pool.getSelector()) : new LinkedHashMap<>();
        List<Toleration> tolerations = new ArrayList<>();
        if (pool != null) {
            pool.getTolerations().forEach(t -> tolerations.add(t.toBuilder().build()));
        }

        return ResourceAllocation.builder()
            .cpu(QuantityParser.formatCpu(cpuMillis))
            .memory(QuantityParser.formatMemory(memoryBytes))
            .gpu(gpu)
            .nodePool(poolName)
            .nodeSelector(selector)
            .tolerations(tolerations)
            .priorityClassName(effectivePriority.getPriorityClassName())
            .priorityValue(getPriorityValue(level, tier))
            .qualityLevel(level)
            .build();
    }

    /**
     * Whether the tier may run at the level. Unknown tiers only get low.
     */
    public boolean validateQualityForSubscription(QualityLevel level, SubscriptionTier tier) {
        return allowedQualities(tier).contains(level);
    }

    /**
     * Reject allocations targeting a node pool outside the tier
     *
     * @throws QuotaExceededException when the pool is not eligible
     */
    public void validateAllocation(ResourceAllocation allocation, SubscriptionTier tier) {
        if (!eligiblePools(tier).contains(allocation.getNodePool())) {
            throw new QuotaExceededException("Node pool " + allocation.getNodePool()
                + " is not available for tier " + tier, getHighestAllowedQuality(tier));
        }
    }

    public QualityLevel getHighestAllowedQuality(SubscriptionTier tier) {
        return allowedQualities(tier).stream()
            .max(Comparator.naturalOrder())
            .orElse(QualityLevel.LOW);
    }

    /**
     * Scheduler priority value; 0 when the tier may not run at the level
     */
    public int getPriorityValue(QualityLevel level, SubscriptionTier tier) {
        Map<QualityLevel, Integer> values = tier != null ? config.getPriorityValues().get(tier) : null;
        if (values == null) {
            return config.getDefaultPriorityValue();
        }
        return values.getOrDefault(level, 0);
    }

    /**
     * Cluster utilization, sampled at most once per cache window.
     * Concurrent callers share one refresh; failures return the last known values.
     */
    public Mono<ResourceUtilization> getResourceUtilization() {
        return snapshot().map(ClusterSnapshot::getUtilization);
    }

    public Mono<List<NodeMetrics>> getNodeMetrics() {
        return snapshot().map(ClusterSnapshot::getNodes);
    }

    /**
     * Last utilization sample without triggering a refresh
     */
    public ResourceUtilization latestUtilization() {
        ClusterSnapshot snapshot = latest.get();
        return snapshot != null ? snapshot.getUtilization() : ResourceUtilization.unknown(clock.instant());
    }

    /**
     * Reserve resources for a workflow
     *
     * @param workflowId workflow identifier
     * @param allocation allocation submitted with the workflow
     */
    public void reserve(String workflowId, ResourceAllocation allocation) {
        reservations.put(workflowId, allocation);
        log.info("Reserved resources for workflow {}: cpu={}, memory={}, gpu={}, pool={}",
            workflowId, allocation.getCpu(), allocation.getMemory(), allocation.getGpu(), allocation.getNodePool());
    }

    /**
     * Release resources for a finished workflow
     *
     * @param workflowId workflow identifier
     */
    public void release(String workflowId) {
        ResourceAllocation released = reservations.remove(workflowId);
        if (released != null) {
            log.info("Released resources for workflow {}: cpu={}, memory={}, gpu={}",
                workflowId, released.getCpu(), released.getMemory(), released.getGpu());
        } else {
            log.debug("No reservation held by workflow {}", workflowId);
        }
    }

    public int reservedGpus() {
        return reservations.values().stream().mapToInt(ResourceAllocation::getGpu).sum();
    }

    public int getReservationCount() {
        return reservations.size();
    }

    private Mono<ClusterSnapshot> snapshot() {
        ClusterSnapshot current = latest.get();
        if (current != null && !isStale(current)) {
            return Mono.just(current);
        }
        return refresh();
    }

    private Mono<ClusterSnapshot> refresh() {
        Mono<ClusterSnapshot> pending = refreshInFlight.get();
        if (pending != null) {
            return pending;
        }
        Mono<ClusterSnapshot> created = clusterClient.getNodeMetrics()
            .map(this::summarize)
            .onErrorResume(e -> {
                log.warn("Cluster utilization unavailable, using last known values: {}", e.getMessage());
                return Mono.just(fallbackSnapshot());
            })
            .doOnNext(latest::set)
            .doFinally(signal -> refreshInFlight.set(null))
            .cache();
        if (refreshInFlight.compareAndSet(null, created)) {
            return created;
        }
        Mono<ClusterSnapshot> winner = refreshInFlight.get();
        return winner != null ? winner : created;
    }

    private boolean isStale(ClusterSnapshot snapshot) {
        return !clock.instant().isBefore(snapshot.getSampledAt().plus(utilizationCacheTtl));
    }

    private ClusterSnapshot summarize(List<NodeMetrics> nodes) {
        long cpuCapacity = 0;
        long cpuUsage = 0;
        long memoryCapacity = 0;
        long memoryUsage = 0;
        int gpuCapacity = 0;
        int readyNodes = 0;
        for (NodeMetrics node : nodes) {
            if (!node.isReady()) {
                continue;
            }
            readyNodes++;
            cpuCapacity += node.getCpuCapacityMillis();
            cpuUsage += node.getCpuUsageMillis();
            memoryCapacity += node.getMemoryCapacityBytes();
            memoryUsage += node.getMemoryUsageBytes();
            gpuCapacity += node.getGpuCapacity();
        }

        Instant now = clock.instant();
        ResourceUtilization utilization = ResourceUtilization.builder()
            .cpu(ratio(cpuUsage, cpuCapacity))
            .memory(ratio(memoryUsage, memoryCapacity))
            // metrics-server does not report GPU usage; count what this coordinator has reserved
            .gpu(ratio(reservedGpus(), gpuCapacity))
            .nodeCount(readyNodes)
            .sampledAt(now)
            .fallback(false)
            .build();

        log.debug("Cluster utilization sampled: cpu={}, memory={}, gpu={}, nodes={}",
            utilization.getCpu(), utilization.getMemory(), utilization.getGpu(), readyNodes);
        return new ClusterSnapshot(utilization, List.copyOf(nodes), now);
    }

    private ClusterSnapshot fallbackSnapshot() {
        Instant now = clock.instant();
        ClusterSnapshot previous = latest.get();
        if (previous != null) {
            return new ClusterSnapshot(previous.getUtilization().toBuilder().fallback(true).build(),
                previous.getNodes(), now);
        }
        return new ClusterSnapshot(ResourceUtilization.unknown(now), List.of(), now);
    }

    private static double ratio(long used, long capacity) {
        return capacity > 0 ? Math.min(1.0, (double) used / capacity) : 0.0;
    }

    private CoordinatorProperties.Profile profile(QualityLevel level) {
        CoordinatorProperties.Profile profile = config.getProfiles().get(level);
        if (profile == null) {
            throw new IllegalStateException("No resource profile configured for quality " + level);
        }
        return profile;
    }

    /**
     * Best pool the tier may use: the wanted pool if eligible, otherwise the most
     * capable eligible pool not above it. GPU work prefers GPU pools.
     */
    private String selectNodePool(String wanted, boolean needsGpu, SubscriptionTier tier) {
        List<String> eligible = eligiblePools(tier);
        if (eligible.contains(wanted) && (needsGpu || !isGpuPool(wanted))) {
            return wanted;
        }
        int wantedRank = Optional.ofNullable(config.getNodePools().get(wanted))
            .map(CoordinatorProperties.NodePool::getRank)
            .orElse(Integer.MAX_VALUE);

        Comparator<String> byRank = Comparator.comparingInt(name -> config.getNodePools().get(name).getRank());
        List<String> known = eligible.stream()
            .filter(config.getNodePools()::containsKey)
            .toList();

        Optional<String> match = known.stream()
            .filter(name -> isGpuPool(name) == needsGpu)
            .filter(name -> config.getNodePools().get(name).getRank() <= wantedRank)
            .max(byRank);
        return match.or(() -> known.stream().filter(name -> !isGpuPool(name)).min(byRank))
            .or(() -> known.stream().min(byRank))
            .orElseThrow(() -> new QuotaExceededException("No node pool available for tier " + tier,
                getHighestAllowedQuality(tier)));
    }

    private boolean isGpuPool(String name) {
        CoordinatorProperties.NodePool pool = config.getNodePools().get(name);
        return pool != null && pool.isGpu();
    }

    private List<String> eligiblePools(SubscriptionTier tier) {
        List<String> pools = tier != null ? config.getTierNodePools().get(tier) : null;
        if (pools == null) {
            pools = config.getTierNodePools().get(SubscriptionTier.FREE);
        }
        return pools != null ? pools : List.of();
    }

    private List<QualityLevel> allowedQualities(SubscriptionTier tier) {
        List<QualityLevel> levels = tier != null ? config.getTierQualities().get(tier) : null;
        return levels != null ? levels : List.of(QualityLevel.LOW);
    }

    @Getter
    @AllArgsConstructor
    private static class ClusterSnapshot {
        private final ResourceUtilization utilization;
        private final List<NodeMetrics> nodes;
        private final Instant sampledAt;
    }
}
