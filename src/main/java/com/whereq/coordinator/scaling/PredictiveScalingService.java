package com.whereq.coordinator.scaling;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.coordinator.cluster.AutoscalerClient;
import com.whereq.coordinator.cluster.WorkloadScale;
import com.whereq.coordinator.config.CoordinatorProperties;
import com.whereq.coordinator.exception.RemoteCallErrors;
import com.whereq.coordinator.model.RetryPolicy;
import com.whereq.coordinator.model.ScalingDirective;
import com.whereq.coordinator.model.ScalingSignal;
import com.whereq.coordinator.monitoring.MonitoringService;
import com.whereq.coordinator.service.WorkflowStatusTracker;
import com.whereq.coordinator.store.KeyValueStore;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Forecast-driven scaling of the configured workloads.
 *
 * Each tick samples queue depth, forecasts the next load from the recent signal
 * window and compares it with the capacity of the replicas already requested. A
 * forecast above capacity plus the scale-up margin scales up immediately; one below
 * capacity minus the scale-down margin must persist for several ticks before the
 * workload is scaled down.
 *
 * @author WhereQ Inc.
 */
@Slf4j
@Service
public class PredictiveScalingService {

    static final String SIGNAL_KEY_PREFIX = "coordinator:scaling:signals:";

    public enum State {
        STOPPED,
        RUNNING
    }

    private final CoordinatorProperties.ScalingConfig config;
    private final CoordinatorProperties.PredictiveConfig predictive;
    private final boolean schedulingEnabled;
    private final AutoscalerClient autoscalerClient;
    private final KeyValueStore store;
    private final ObjectMapper objectMapper;
    private final MonitoringService monitoringService;
    private final WorkflowStatusTracker statusTracker;
    private final ScalingDependenciesService dependenciesService;
    private final ScalingDecisionHistory decisionHistory;
    private final Clock clock;
    private final LoadForecaster forecaster;
    private final RetryPolicy retryPolicy;

    private final AtomicReference<State> state = new AtomicReference<>(State.STOPPED);
    private final Map<String, Integer> lowTicks = new ConcurrentHashMap<>();
    private ScheduledExecutorService scheduler;

    public PredictiveScalingService(CoordinatorProperties properties,
                                    AutoscalerClient autoscalerClient,
                                    KeyValueStore store,
                                    ObjectMapper objectMapper,
                                    MonitoringService monitoringService,
                                    WorkflowStatusTracker statusTracker,
                                    ScalingDependenciesService dependenciesService,
                                    ScalingDecisionHistory decisionHistory,
                                    Clock clock) {
        this.config = properties.getScaling();
        this.predictive = config.getPredictive();
        this.schedulingEnabled = properties.getScheduling().isEnabled();
        this.autoscalerClient = autoscalerClient;
        this.store = store;
        this.objectMapper = objectMapper;
        this.monitoringService = monitoringService;
        this.statusTracker = statusTracker;
        this.dependenciesService = dependenciesService;
        this.decisionHistory = decisionHistory;
        this.clock = clock;
        this.forecaster = createForecaster(predictive);
        this.retryPolicy = config.getRetry();
    }

    static LoadForecaster createForecaster(CoordinatorProperties.PredictiveConfig predictive) {
        return switch (predictive.getForecaster()) {
            case MovingAverageForecaster.NAME -> new MovingAverageForecaster(predictive.getWindow());
            case SeasonalNaiveForecaster.NAME -> new SeasonalNaiveForecaster(predictive.getSeasonLength());
            default -> throw new IllegalArgumentException("Unknown forecaster: " + predictive.getForecaster());
        };
    }

    @PostConstruct
    public void initialize() {
        if (predictive.isEnabled() && schedulingEnabled) {
            start();
        } else {
            log.info("Predictive scaling disabled");
        }
    }

    public synchronized void start() {
        if (!state.compareAndSet(State.STOPPED, State.RUNNING)) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "predictive-scaling");
            thread.setDaemon(true);
            return thread;
        });
        long interval = predictive.getTickInterval().toMillis();
        scheduler.scheduleWithFixedDelay(this::tick, interval, interval, TimeUnit.MILLISECONDS);
        log.info("Predictive scaling started: forecaster={}, interval={}, workloads={}",
            forecaster.name(), predictive.getTickInterval(), config.getWorkloads().keySet());
    }

    /**
     * Stop ticking. A running tick is allowed to finish.
     */
    @PreDestroy
    public synchronized void close() {
        if (!state.compareAndSet(State.RUNNING, State.STOPPED)) {
            return;
        }
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(10, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Predictive scaling stopped");
    }

    public State getState() {
        return state.get();
    }

    /**
     * One pass over every watched workload. Never throws.
     */
    void tick() {
        try {
            Flux.fromIterable(config.getWorkloads().keySet())
                .concatMap(this::tickWorkload)
                .then()
                .block(predictive.getTickInterval().multipliedBy(2));
        } catch (RuntimeException e) {
            log.error("Predictive scaling tick failed", e);
        }
    }

    /**
     * Sample, forecast and possibly scale one workload
     *
     * @return Mono with the applied directive, empty when nothing changed
     */
    Mono<ScalingDirective> tickWorkload(String workload) {
        CoordinatorProperties.Workload limits = config.getWorkloads().get(workload);
        Mono<Void> sample = predictive.isSampleQueueDepth()
            ? recordSignal(workload, ScalingSignal.builder()
                .timestamp(clock.instant())
                .metric(ScalingSignal.QUEUE_DEPTH)
                .value(statusTracker.countActive(limits.getWorkflowTypes()))
                .build())
            : Mono.empty();

        return sample
            .then(Mono.zip(recentLoad(workload),
                autoscalerClient.getScale(workload).retryWhen(retryPolicy.toRetrySpec(RemoteCallErrors::isTransient))))
            .flatMap(tuple -> Mono.justOrEmpty(evaluate(workload, limits, tuple.getT1(), tuple.getT2())))
            .flatMap(this::apply)
            .onErrorResume(e -> {
                log.warn("Predictive scaling of {} skipped this tick: {}", workload, e.getMessage());
                monitoringService.recordScalingError(workload, "tick");
                return Mono.empty();
            });
    }

    /**
     * Decide whether a workload should change size
     *
     * @param history load values, oldest first
     * @param scale current replica counts
     * @return the directive to apply, empty to leave the workload alone
     */
    Optional<ScalingDirective> evaluate(String workload, CoordinatorProperties.Workload limits,
                                        List<Double> history, WorkloadScale scale) {
        OptionalDouble predicted = forecaster.forecast(history);
        if (predicted.isEmpty()) {
            log.debug("No load history for {}, skipping", workload);
            return Optional.empty();
        }
        double forecast = predicted.getAsDouble();
        int replicas = Math.max(scale.getCurrentReplicas(), scale.getDesiredReplicas());
        double capacity = replicas * limits.getCapacityPerReplica();
        int target = Math.max(limits.getMinReplicas(), Math.min(limits.getMaxReplicas(),
            (int) Math.ceil(forecast / limits.getCapacityPerReplica())));

        if (forecast > capacity * (1 + predictive.getScaleUpMargin())) {
            lowTicks.remove(workload);
            if (target > replicas) {
                log.info("Forecast {} for {} exceeds capacity {} of {} replicas, scaling up to {}",
                    forecast, workload, capacity, replicas, target);
                return Optional.of(directive(workload, replicas, target, forecast,
                    "forecast above capacity " + capacity));
            }
            log.info("Forecast {} for {} exceeds capacity {} but {} is already at its limit",
                forecast, workload, capacity, workload);
            return Optional.empty();
        }

        if (forecast < capacity * (1 - predictive.getScaleDownMargin())) {
            int ticks = lowTicks.merge(workload, 1, Integer::sum);
            if (ticks < predictive.getScaleDownTicks()) {
                log.debug("Forecast {} for {} below capacity {} ({}/{} ticks)",
                    forecast, workload, capacity, ticks, predictive.getScaleDownTicks());
                return Optional.empty();
            }
            lowTicks.remove(workload);
            if (target < replicas) {
                log.info("Forecast {} for {} below capacity {} for {} ticks, scaling down to {}",
                    forecast, workload, capacity, ticks, target);
                return Optional.of(directive(workload, replicas, target, forecast,
                    "forecast below capacity " + capacity + " for " + ticks + " ticks"));
            }
            return Optional.empty();
        }

        lowTicks.remove(workload);
        log.debug("Forecast {} for {} within capacity {}, no change", forecast, workload, capacity);
        return Optional.empty();
    }

    /**
     * Append a load observation for a workload
     *
     * @throws IllegalArgumentException for an unknown workload
     */
    public Mono<Void> recordSignal(String workload, ScalingSignal signal) {
        if (!config.getWorkloads().containsKey(workload)) {
            return Mono.error(new IllegalArgumentException("Unknown workload: " + workload));
        }
        return Mono.fromCallable(() -> objectMapper.writeValueAsString(signal))
            .flatMap(json -> store.listPush(SIGNAL_KEY_PREFIX + workload, json, predictive.getSignalHistoryMax(), null))
            .doOnSuccess(size -> log.debug("Recorded {}={} for {}", signal.getMetric(), signal.getValue(), workload))
            .then();
    }

    /**
     * Applied directives, newest first
     */
    public List<ScalingDirective> getRecentDecisions(int limit) {
        return decisionHistory.recent(limit);
    }

    private Mono<List<Double>> recentLoad(String workload) {
        int depth = Math.max(predictive.getWindow(), predictive.getSeasonLength() * 2);
        return store.listRange(SIGNAL_KEY_PREFIX + workload, 0, depth - 1)
            .flatMap(json -> {
                try {
                    return Mono.just(objectMapper.readValue(json, ScalingSignal.class));
                } catch (JsonProcessingException e) {
                    log.warn("Skipping unreadable scaling signal of {}: {}", workload, e.getOriginalMessage());
                    return Mono.empty();
                }
            })
            .map(ScalingSignal::getValue)
            .collectList()
            .map(newestFirst -> {
                List<Double> oldestFirst = new ArrayList<>(newestFirst);
                Collections.reverse(oldestFirst);
                return oldestFirst;
            });
    }

    private Mono<ScalingDirective> apply(ScalingDirective directive) {
        return autoscalerClient.setReplicas(directive.getWorkload(), directive.getToReplicas())
            .retryWhen(retryPolicy.toRetrySpec(RemoteCallErrors::isTransient))
            .then(Mono.fromCallable(() -> {
                decisionHistory.add(directive);
                monitoringService.recordScalingDirective(directive);
                return directive;
            }))
            .flatMap(applied -> {
                if (!dependenciesService.isEnabled()) {
                    return Mono.just(applied);
                }
                return dependenciesService.onScalingEvent(applied.getWorkload(),
                        applied.getFromReplicas(), applied.getToReplicas())
                    .onErrorResume(e -> {
                        log.warn("Dependency propagation for {} failed: {}", applied.getWorkload(), e.getMessage());
                        return Mono.just(List.of());
                    })
                    .thenReturn(applied);
            })
            .onErrorResume(e -> {
                log.warn("Failed to scale {} to {}: {}", directive.getWorkload(), directive.getToReplicas(), e.getMessage());
                monitoringService.recordScalingError(directive.getWorkload(), "set-replicas");
                return Mono.empty();
            });
    }

    private ScalingDirective directive(String workload, int from, int to, double forecast, String reason) {
        return ScalingDirective.builder()
            .workload(workload)
            .fromReplicas(from)
            .toReplicas(to)
            .direction(to > from ? ScalingDirective.Direction.SCALE_UP : ScalingDirective.Direction.SCALE_DOWN)
            .source(ScalingDirective.Source.PREDICTIVE)
            .forecast(forecast)
            .reason(reason)
            .timestamp(clock.instant())
            .build();
    }
}
