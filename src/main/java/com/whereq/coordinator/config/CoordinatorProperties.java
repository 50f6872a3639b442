package com.whereq.coordinator.config;

import com.whereq.coordinator.model.QualityLevel;
import com.whereq.coordinator.model.RetryPolicy;
import com.whereq.coordinator.model.SubscriptionTier;
import com.whereq.coordinator.model.Toleration;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for the workflow coordinator.
 *
 * Defaults below are starting points that need empirical tuning per cluster,
 * application.yml overrides them.
 *
 * @author WhereQ Inc.
 */
@Configuration
@ConfigurationProperties(prefix = "coordinator")
@Data
public class CoordinatorProperties {

    private EngineConfig engine = new EngineConfig();
    private ClusterConfig cluster = new ClusterConfig();
    private QualityConfig quality = new QualityConfig();
    private ResourceConfig resources = new ResourceConfig();
    private CacheConfig cache = new CacheConfig();
    private StatusConfig status = new StatusConfig();
    private MonitoringConfig monitoring = new MonitoringConfig();
    private SchedulingConfig scheduling = new SchedulingConfig();
    private ScalingConfig scaling = new ScalingConfig();

    @Data
    public static class EngineConfig {
        /**
         * Argo server base URL.
         */
        private String baseUrl = "http://argo-server.argo:2746";

        private String namespace = "default";

        /**
         * Bearer token for the Argo server, empty for none.
         */
        private String authToken;

        private String serviceAccountName = "workflow-runner";

        private Duration timeout = Duration.ofSeconds(10);

        private RetryPolicy retry = RetryPolicy.defaultPolicy();

        /**
         * Interval between status polls of one in-flight workflow.
         */
        private Duration pollInterval = Duration.ofSeconds(5);

        /**
         * Worker threads executing status polls.
         */
        private int pollerThreads = 4;

        /**
         * Consecutive failed polls after which a workflow is marked Error.
         */
        private int maxPollFailures = 10;
    }

    @Data
    public static class ClusterConfig {
        /**
         * Kubernetes API server base URL.
         */
        private String baseUrl = "https://kubernetes.default.svc";

        /**
         * Namespace of the scaled deployments and HPAs.
         */
        private String namespace = "default";

        private String authToken;

        private Duration timeout = Duration.ofSeconds(5);

        /**
         * How long a utilization sample is reused before the cluster is polled again.
         */
        private Duration utilizationCacheTtl = Duration.ofSeconds(5);

        /**
         * Extended resource counted as GPU capacity on nodes.
         */
        private String gpuResourceName = "nvidia.com/gpu";
    }

    @Data
    public static class QualityConfig {
        /**
         * Aggregate score at or above which the level is high.
         */
        private double highThreshold = 0.7;

        /**
         * Aggregate score at or above which the level is medium.
         */
        private double mediumThreshold = 0.4;

        /**
         * Reject explicit targets above the tier ceiling instead of lowering them.
         */
        private boolean strictTierEnforcement = false;

        private Weights weights = new Weights();

        /**
         * Expiry of the per-type selection counters.
         */
        private Duration historyTtl = Duration.ofDays(30);

        /**
         * Length of the rolling selection list per type.
         */
        private int historyMaxEntries = 1000;
    }

    @Data
    public static class Weights {
        private double input = 0.25;
        private double resources = 0.3;
        private double subscription = 0.3;
        private double history = 0.1;
        private double preference = 0.05;
        private double extension = 0.1;
    }

    @Data
    public static class ResourceConfig {
        /**
         * Base allocation per quality level.
         */
        private Map<QualityLevel, Profile> profiles = defaultProfiles();

        /**
         * Node pools by name, with the labels and tolerations that target them.
         */
        private Map<String, NodePool> nodePools = defaultNodePools();

        /**
         * Node pools each tier may schedule onto.
         */
        private Map<SubscriptionTier, List<String>> tierNodePools = defaultTierNodePools();

        /**
         * Quality levels each tier may request.
         */
        private Map<SubscriptionTier, List<QualityLevel>> tierQualities = defaultTierQualities();

        /**
         * Scheduler priority value per tier and quality level.
         */
        private Map<SubscriptionTier, Map<QualityLevel, Integer>> priorityValues = defaultPriorityValues();

        private int defaultPriorityValue = 10;

        /**
         * Utilization ratio above which allocations are reduced.
         */
        private double highLoadThreshold = 0.8;

        private String minimumCpu = "100m";

        private String minimumMemory = "256Mi";
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Profile {
        private String cpu;
        private String memory;
        private int gpu;
        private String nodePool;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class NodePool {
        private Map<String, String> selector = new LinkedHashMap<>();
        private List<Toleration> tolerations = new ArrayList<>();
        private boolean gpu;

        /**
         * Higher rank means more capable hardware.
         */
        private int rank;
    }

    @Data
    public static class CacheConfig {
        private Duration defaultTtl = Duration.ofHours(24);

        /**
         * Store key prefix; the cache key itself is workflow:{type}:{hash}.
         */
        private String keyPrefix = "coordinator:cache:";
    }

    @Data
    public static class StatusConfig {
        private Duration ttl = Duration.ofDays(7);
    }

    @Data
    public static class MonitoringConfig {
        /**
         * Length of the stored WorkflowMetrics history.
         */
        private int historyMaxEntries = 1000;

        /**
         * Completion times kept per type for averages.
         */
        private int completionTimesPerType = 100;
    }

    @Data
    public static class SchedulingConfig {
        /**
         * Run the status poller and the periodic scaling services.
         */
        private boolean enabled = true;
    }

    @Data
    public static class ScalingConfig {
        /**
         * Scaled workloads, keyed by deployment name.
         */
        private Map<String, Workload> workloads = new LinkedHashMap<>();

        private PredictiveConfig predictive = new PredictiveConfig();
        private DependenciesConfig dependencies = new DependenciesConfig();
        private HpaEventsConfig hpaEvents = new HpaEventsConfig();

        /**
         * Retry policy for autoscaling API calls.
         */
        private RetryPolicy retry = RetryPolicy.defaultPolicy();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Workload {
        private int minReplicas = 1;
        private int maxReplicas = 10;

        /**
         * Load one replica absorbs, in signal units.
         */
        private double capacityPerReplica = 5.0;

        /**
         * Workflow types served by this workload; their in-flight count is its queue depth.
         */
        private List<String> workflowTypes = new ArrayList<>();
    }

    @Data
    public static class PredictiveConfig {
        private boolean enabled = false;

        private Duration tickInterval = Duration.ofSeconds(30);

        /**
         * moving-average or seasonal-naive.
         */
        private String forecaster = "moving-average";

        /**
         * Signals fed to the forecaster.
         */
        private int window = 20;

        /**
         * Period in ticks for the seasonal forecaster.
         */
        private int seasonLength = 12;

        /**
         * Forecast must exceed capacity by this fraction to scale up.
         */
        private double scaleUpMargin = 0.1;

        /**
         * Forecast must stay this fraction below capacity to count as a low tick.
         */
        private double scaleDownMargin = 0.3;

        /**
         * Consecutive low ticks required before scaling down.
         */
        private int scaleDownTicks = 3;

        /**
         * Append the in-flight workflow count as a queue-depth signal each tick.
         */
        private boolean sampleQueueDepth = true;

        private int signalHistoryMax = 500;

        private int decisionHistoryMax = 200;
    }

    @Data
    public static class DependenciesConfig {
        private boolean enabled = false;

        private List<Dependency> edges = new ArrayList<>();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Dependency {
        /**
         * Dependent workload.
         */
        private String workload;

        /**
         * Workload it requires.
         */
        private String requires;

        /**
         * Replicas of the required workload per replica of the dependent, relative to current.
         */
        private double ratio = 1.0;
    }

    @Data
    public static class HpaEventsConfig {
        private boolean enabled = false;

        private Duration interval = Duration.ofSeconds(30);

        /**
         * Minimum gap between two stored events of one workload.
         */
        private Duration minEventGap = Duration.ofMinutes(5);

        private int maxEventsPerWorkload = 100;

        private int maxEvents = 1000;
    }

    private static Map<QualityLevel, Profile> defaultProfiles() {
        Map<QualityLevel, Profile> profiles = new EnumMap<>(QualityLevel.class);
        profiles.put(QualityLevel.LOW, new Profile("500m", "2Gi", 0, "general"));
        profiles.put(QualityLevel.MEDIUM, new Profile("2000m", "8Gi", 1, "gpu"));
        profiles.put(QualityLevel.HIGH, new Profile("4000m", "16Gi", 2, "gpu-high-end"));
        return profiles;
    }

    private static Map<String, NodePool> defaultNodePools() {
        Map<String, NodePool> pools = new LinkedHashMap<>();
        pools.put("general", new NodePool(
            new LinkedHashMap<>(Map.of("node-type", "cpu-optimized")),
            new ArrayList<>(List.of(Toleration.builder().key("node-type").operator("Exists").build())),
            false, 0));
        pools.put("gpu", new NodePool(
            new LinkedHashMap<>(Map.of("node-type", "gpu-optimized", "gpu-type", "nvidia-t4")),
            new ArrayList<>(List.of(Toleration.builder().key("nvidia.com/gpu").operator("Exists").build())),
            true, 1));
        pools.put("gpu-high-end", new NodePool(
            new LinkedHashMap<>(Map.of("node-type", "gpu-optimized", "gpu-type", "nvidia-a100")),
            new ArrayList<>(List.of(Toleration.builder().key("nvidia.com/gpu").operator("Exists").build())),
            true, 2));
        return pools;
    }

    private static Map<SubscriptionTier, List<String>> defaultTierNodePools() {
        Map<SubscriptionTier, List<String>> tiers = new EnumMap<>(SubscriptionTier.class);
        tiers.put(SubscriptionTier.FREE, new ArrayList<>(List.of("general")));
        tiers.put(SubscriptionTier.STANDARD, new ArrayList<>(List.of("general", "gpu")));
        tiers.put(SubscriptionTier.PREMIUM, new ArrayList<>(List.of("general", "gpu", "gpu-high-end")));
        return tiers;
    }

    private static Map<SubscriptionTier, List<QualityLevel>> defaultTierQualities() {
        Map<SubscriptionTier, List<QualityLevel>> tiers = new EnumMap<>(SubscriptionTier.class);
        tiers.put(SubscriptionTier.FREE, new ArrayList<>(List.of(QualityLevel.LOW)));
        tiers.put(SubscriptionTier.STANDARD, new ArrayList<>(List.of(QualityLevel.LOW, QualityLevel.MEDIUM)));
        tiers.put(SubscriptionTier.PREMIUM, new ArrayList<>(List.of(QualityLevel.LOW, QualityLevel.MEDIUM, QualityLevel.HIGH)));
        return tiers;
    }

    private static Map<SubscriptionTier, Map<QualityLevel, Integer>> defaultPriorityValues() {
        Map<SubscriptionTier, Map<QualityLevel, Integer>> values = new EnumMap<>(SubscriptionTier.class);
        values.put(SubscriptionTier.FREE, new EnumMap<>(Map.of(QualityLevel.LOW, 10)));
        values.put(SubscriptionTier.STANDARD, new EnumMap<>(Map.of(QualityLevel.LOW, 30, QualityLevel.MEDIUM, 20)));
        values.put(SubscriptionTier.PREMIUM, new EnumMap<>(Map.of(
            QualityLevel.LOW, 50, QualityLevel.MEDIUM, 40, QualityLevel.HIGH, 30)));
        return values;
    }
}
