package com.whereq.coordinator.scaling;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.coordinator.cluster.AutoscalerClient;
import com.whereq.coordinator.cluster.HpaStatus;
import com.whereq.coordinator.config.CoordinatorProperties;
import com.whereq.coordinator.model.HpaEvent;
import com.whereq.coordinator.monitoring.MonitoringService;
import com.whereq.coordinator.store.KeyValueStore;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Watches the HorizontalPodAutoscalers of the configured workloads and records
 * their scaling activity.
 *
 * An event is recorded when the HPA's current, desired and actual replica counts
 * disagree, at most once per workload within the minimum event gap. Scale-up and
 * scale-down events also feed an effectiveness series: 1 when the workload already
 * runs the desired replicas, 0 otherwise.
 */
@Slf4j
@Service
public class HpaEventLogger {

    static final String EVENTS_KEY_PREFIX = "coordinator:hpa:events:";
    static final String ALL_EVENTS_KEY = "coordinator:hpa:all-events";
    static final String EFFECTIVENESS_KEY_PREFIX = "coordinator:hpa:effectiveness:";
    private static final int EFFECTIVENESS_SAMPLES = 100;

    private final CoordinatorProperties.ScalingConfig scaling;
    private final CoordinatorProperties.HpaEventsConfig config;
    private final boolean schedulingEnabled;
    private final AutoscalerClient autoscalerClient;
    private final KeyValueStore store;
    private final ObjectMapper objectMapper;
    private final MonitoringService monitoringService;
    private final Clock clock;

    private final Map<String, Instant> lastEventTimes = new ConcurrentHashMap<>();
    private ScheduledExecutorService scheduler;

    public HpaEventLogger(CoordinatorProperties properties,
                          AutoscalerClient autoscalerClient,
                          KeyValueStore store,
                          ObjectMapper objectMapper,
                          MonitoringService monitoringService,
                          Clock clock) {
        this.scaling = properties.getScaling();
        this.config = scaling.getHpaEvents();
        this.schedulingEnabled = properties.getScheduling().isEnabled();
        this.autoscalerClient = autoscalerClient;
        this.store = store;
        this.objectMapper = objectMapper;
        this.monitoringService = monitoringService;
        this.clock = clock;
    }

    @PostConstruct
    public void initialize() {
        if (config.isEnabled() && schedulingEnabled) {
            start();
        } else {
            log.info("HPA event logging disabled");
        }
    }

    public synchronized void start() {
        if (scheduler != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "hpa-event-logger");
            thread.setDaemon(true);
            return thread;
        });
        long interval = config.getInterval().toMillis();
        scheduler.scheduleWithFixedDelay(this::checkEvents, 0, interval, TimeUnit.MILLISECONDS);
        log.info("HPA event logger started, checking every {}", config.getInterval());
    }

    @PreDestroy
    public synchronized void close() {
        if (scheduler == null) {
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
        scheduler = null;
        log.info("HPA event logger stopped");
    }

    /**
     * Inspect every watched workload once. Never throws.
     */
    void checkEvents() {
        try {
            Flux.fromIterable(scaling.getWorkloads().keySet())
                .concatMap(this::checkWorkload)
                .then()
                .block(config.getInterval().multipliedBy(2));
        } catch (RuntimeException e) {
            log.error("HPA event check failed", e);
        }
    }

    /**
     * Read one workload's HPA and record an event if it is scaling
     *
     * @return Mono with the recorded event, empty when none was recorded
     */
    Mono<HpaEvent> checkWorkload(String workload) {
        return Mono.zip(autoscalerClient.getHpaStatus(workload), autoscalerClient.getScale(workload))
            .flatMap(tuple -> Mono.justOrEmpty(classify(tuple.getT1(), tuple.getT2().getCurrentReplicas(), clock.instant())))
            .filter(this::claimEventSlot)
            .flatMap(this::logEvent)
            .onErrorResume(e -> {
                log.warn("Cannot inspect HPA of {}: {}", workload, e.getMessage());
                return Mono.empty();
            });
    }

    /**
     * Turn an HPA reading into an event
     *
     * @param actualReplicas replicas the workload runs
     * @return the event, empty when current, desired and actual replicas agree
     */
    static Optional<HpaEvent> classify(HpaStatus hpa, int actualReplicas, Instant now) {
        int current = hpa.getCurrentReplicas();
        int desired = hpa.getDesiredReplicas();
        if (current == desired && current == actualReplicas) {
            return Optional.empty();
        }

        String eventType;
        String limitingFactor = null;
        if (desired > current) {
            if (hpa.isScalingLimited() || desired > hpa.getMaxReplicas() && hpa.getMaxReplicas() > 0) {
                eventType = HpaEvent.LIMITED_SCALE;
                limitingFactor = hpa.getLimitedReason() != null ? hpa.getLimitedReason() : "max-replicas";
            } else {
                eventType = HpaEvent.SCALE_UP;
            }
        } else if (desired < current) {
            eventType = HpaEvent.SCALE_DOWN;
        } else {
            eventType = HpaEvent.NO_SCALE;
        }

        HpaEvent event = HpaEvent.builder()
            .workload(hpa.getWorkload())
            .eventType(eventType)
            .currentReplicas(current)
            .desiredReplicas(desired)
            .actualReplicas(actualReplicas)
            .minReplicas(hpa.getMinReplicas())
            .maxReplicas(hpa.getMaxReplicas())
            .limitingFactor(limitingFactor)
            .timestamp(now)
            .build();

        if (!hpa.getMetrics().isEmpty()) {
            HpaStatus.MetricValue trigger = hpa.getMetrics().get(0);
            event.setTriggerMetric(trigger.getName());
            event.setTriggerValue(trigger.getCurrent());
            event.setTriggerThreshold(trigger.getTarget());
        } else {
            event.setTriggerMetric("unknown");
        }
        return Optional.of(event);
    }

    /**
     * Recent events, newest first
     *
     * @param workload workload filter, null for all workloads
     */
    public Flux<HpaEvent> getRecentEvents(String workload, int limit) {
        String key = workload != null ? EVENTS_KEY_PREFIX + workload : ALL_EVENTS_KEY;
        return store.listRange(key, 0, limit - 1L)
            .flatMap(json -> {
                try {
                    return Mono.just(objectMapper.readValue(json, HpaEvent.class));
                } catch (JsonProcessingException e) {
                    log.warn("Skipping unreadable HPA event: {}", e.getOriginalMessage());
                    return Mono.empty();
                }
            });
    }

    /**
     * Share of recent scale events where the workload reached the desired replicas
     *
     * @return Mono with a ratio in [0, 1], empty when there is no data
     */
    public Mono<Double> getScalingEffectiveness(String workload) {
        return store.listRange(EFFECTIVENESS_KEY_PREFIX + workload, 0, EFFECTIVENESS_SAMPLES - 1)
            .map(Double::parseDouble)
            .collectList()
            .filter(samples -> !samples.isEmpty())
            .map(samples -> samples.stream().mapToDouble(Double::doubleValue).average().orElse(0.0));
    }

    private boolean claimEventSlot(HpaEvent event) {
        Instant now = event.getTimestamp();
        Duration gap = config.getMinEventGap();
        boolean[] claimed = new boolean[1];
        lastEventTimes.compute(event.getWorkload() + ":" + event.getEventType(), (slot, last) -> {
            if (last == null || !now.isBefore(last.plus(gap))) {
                claimed[0] = true;
                return now;
            }
            return last;
        });
        if (!claimed[0]) {
            log.debug("Suppressing {} event of {} within {}", event.getEventType(), event.getWorkload(), gap);
        }
        return claimed[0];
    }

    private Mono<HpaEvent> logEvent(HpaEvent event) {
        log.info("HPA event {}: {} current={} desired={} actual={} trigger={} ({} / {}){}",
            event.getWorkload(), event.getEventType(), event.getCurrentReplicas(), event.getDesiredReplicas(),
            event.getActualReplicas(), event.getTriggerMetric(), event.getTriggerValue(), event.getTriggerThreshold(),
            event.getLimitingFactor() != null ? " limited by " + event.getLimitingFactor() : "");
        monitoringService.recordHpaEvent(event.getWorkload(), event.getEventType());

        Mono<Void> effectiveness = Mono.empty();
        if (HpaEvent.SCALE_UP.equals(event.getEventType()) || HpaEvent.SCALE_DOWN.equals(event.getEventType())) {
            String sample = event.getActualReplicas() == event.getDesiredReplicas() ? "1" : "0";
            effectiveness = store.listPush(EFFECTIVENESS_KEY_PREFIX + event.getWorkload(), sample,
                EFFECTIVENESS_SAMPLES, null).then();
        }

        return Mono.fromCallable(() -> objectMapper.writeValueAsString(event))
            .flatMap(json -> store.listPush(EVENTS_KEY_PREFIX + event.getWorkload(), json,
                    config.getMaxEventsPerWorkload(), null)
                .then(store.listPush(ALL_EVENTS_KEY, json, config.getMaxEvents(), null)))
            .then(effectiveness)
            .thenReturn(event)
            .onErrorResume(e -> {
                log.warn("Failed to store HPA event of {}: {}", event.getWorkload(), e.getMessage());
                return Mono.just(event);
            });
    }
}
