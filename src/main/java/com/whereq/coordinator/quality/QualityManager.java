package com.whereq.coordinator.quality;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.coordinator.config.CoordinatorProperties;
import com.whereq.coordinator.dto.WorkflowRequest;
import com.whereq.coordinator.exception.QuotaExceededException;
import com.whereq.coordinator.model.QualityAssessment;
import com.whereq.coordinator.model.QualityFactor;
import com.whereq.coordinator.model.QualityFactorKind;
import com.whereq.coordinator.model.QualityLevel;
import com.whereq.coordinator.model.ResourceUtilization;
import com.whereq.coordinator.model.SubscriptionTier;
import com.whereq.coordinator.resource.ResourceManager;
import com.whereq.coordinator.store.KeyValueStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Decides the quality level a request runs at.
 *
 * Each factor is scored in [0, 1] and combined as a weighted mean; the aggregate
 * falls into a band by the configured thresholds. An explicit quality target
 * replaces the computed level. Either way the level never exceeds the tier ceiling.
 *
 * @author WhereQ Inc.
 */
@Slf4j
@Service
public class QualityManager {

    static final String SELECTION_KEY_PREFIX = "coordinator:quality:selection:";
    static final String HISTORY_KEY_PREFIX = "coordinator:quality:history:";
    static final String OUTCOME_KEY_PREFIX = "coordinator:quality:outcome:";

    private static final double NEUTRAL_SCORE = 0.5;

    private final CoordinatorProperties.QualityConfig config;
    private final ResourceManager resourceManager;
    private final InputComplexityAnalyzer inputAnalyzer;
    private final KeyValueStore store;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private List<QualityFactorProvider> factorProviders = List.of();

    public QualityManager(CoordinatorProperties properties, ResourceManager resourceManager,
                          InputComplexityAnalyzer inputAnalyzer, KeyValueStore store,
                          ObjectMapper objectMapper, Clock clock) {
        this.config = properties.getQuality();
        this.resourceManager = resourceManager;
        this.inputAnalyzer = inputAnalyzer;
        this.store = store;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Autowired(required = false)
    public void setFactorProviders(List<QualityFactorProvider> factorProviders) {
        this.factorProviders = List.copyOf(factorProviders);
        log.info("Quality factor extensions registered: {}",
            factorProviders.stream().map(QualityFactorProvider::name).toList());
    }

    /**
     * Assess the quality level for a request
     *
     * @param request workflow request
     * @return Mono with the assessment
     * @throws QuotaExceededException (as error signal) when strict tier enforcement
     *         is on and an explicit target is above the tier ceiling
     */
    public Mono<QualityAssessment> assessQuality(WorkflowRequest request) {
        Optional<QualityLevel> explicit = request.explicitQualityTarget();
        QualityLevel ceiling = resourceManager.getHighestAllowedQuality(request.getSubscriptionTier());

        if (explicit.isPresent() && explicit.get().isAbove(ceiling) && config.isStrictTierEnforcement()) {
            return Mono.error(new QuotaExceededException("Quality " + explicit.get().getValue()
                + " is not available for tier " + tierName(request.getSubscriptionTier()), ceiling));
        }

        return Mono.zip(resourceManager.getResourceUtilization(), historyScore(request.getType()))
            .map(tuple -> {
                List<QualityFactor> factors = collectFactors(request, tuple.getT1(), tuple.getT2());
                double score = aggregate(factors);
                QualityLevel computed = band(score);

                QualityLevel level = computed;
                if (explicit.isPresent()) {
                    level = explicit.get();
                    factors.add(QualityFactor.of(QualityFactorKind.REQUESTED, 1.0, 0.0));
                }

                boolean clamped = level.isAbove(ceiling);
                if (clamped) {
                    log.info("Quality {} for {} request from user {} clamped to tier ceiling {}",
                        level.getValue(), request.getType(), request.getUserId(), ceiling.getValue());
                    level = ceiling;
                }

                log.debug("Quality assessment for {}: score={}, computed={}, resolved={}, factors={}",
                    request.getType(), score, computed, level, factors);

                return QualityAssessment.builder()
                    .qualityLevel(level)
                    .score(score)
                    .factors(factors)
                    .explicit(explicit.isPresent())
                    .clamped(clamped)
                    .ceiling(ceiling)
                    .build();
            });
    }

    /**
     * Map an aggregate score onto a band
     */
    public QualityLevel band(double score) {
        if (score >= config.getHighThreshold()) {
            return QualityLevel.HIGH;
        }
        if (score >= config.getMediumThreshold()) {
            return QualityLevel.MEDIUM;
        }
        return QualityLevel.LOW;
    }

    /**
     * Record the level chosen for a request type. Failures are logged, never raised.
     */
    public Mono<Void> recordQualitySelection(String type, QualityLevel level) {
        String selectionKey = SELECTION_KEY_PREFIX + type + ":";
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("level", level.getValue());
        entry.put("timestamp", clock.instant().toString());

        return Mono.fromCallable(() -> objectMapper.writeValueAsString(entry))
            .flatMap(json -> store.increment(selectionKey + level.getValue(), 1, config.getHistoryTtl())
                .then(store.increment(selectionKey + "total", 1, config.getHistoryTtl()))
                .then(store.listPush(HISTORY_KEY_PREFIX + type, json, config.getHistoryMaxEntries(), config.getHistoryTtl())))
            .then()
            .onErrorResume(e -> {
                log.warn("Failed to record quality selection {} for {}: {}", level, type, e.getMessage());
                return Mono.empty();
            });
    }

    /**
     * Record whether a workflow of the type succeeded; feeds the history factor.
     * Failures are logged, never raised.
     */
    public Mono<Void> recordOutcome(String type, boolean success) {
        String prefix = OUTCOME_KEY_PREFIX + type + ":";
        Mono<Long> completed = store.increment(prefix + "completed", 1, config.getHistoryTtl());
        Mono<Void> counted = success
            ? completed.then(store.increment(prefix + "succeeded", 1, config.getHistoryTtl())).then()
            : completed.then();
        return counted.onErrorResume(e -> {
            log.warn("Failed to record outcome for {}: {}", type, e.getMessage());
            return Mono.empty();
        });
    }

    private List<QualityFactor> collectFactors(WorkflowRequest request, ResourceUtilization utilization,
                                               double historyScore) {
        CoordinatorProperties.Weights weights = config.getWeights();
        List<QualityFactor> factors = new ArrayList<>();

        factors.add(QualityFactor.of(QualityFactorKind.INPUT_COMPLEXITY, inputAnalyzer.analyze(request), weights.getInput()));
        factors.add(QualityFactor.of(QualityFactorKind.RESOURCE_AVAILABILITY, availability(utilization), weights.getResources()));
        factors.add(QualityFactor.of(QualityFactorKind.SUBSCRIPTION, subscriptionScore(request.getSubscriptionTier()),
            weights.getSubscription()));
        factors.add(QualityFactor.of(QualityFactorKind.HISTORY, historyScore, weights.getHistory()));
        if (request.getQualityPreference() != null) {
            factors.add(QualityFactor.of(QualityFactorKind.PREFERENCE, request.getQualityPreference().getScore(),
                weights.getPreference()));
        }

        for (QualityFactorProvider provider : factorProviders) {
            try {
                provider.score(request)
                    .ifPresent(score -> factors.add(provider.toFactor(score, weights.getExtension())));
            } catch (RuntimeException e) {
                log.warn("Quality factor {} failed, ignoring it: {}", provider.name(), e.getMessage());
            }
        }
        return factors;
    }

    private static double aggregate(List<QualityFactor> factors) {
        double weighted = 0;
        double totalWeight = 0;
        for (QualityFactor factor : factors) {
            weighted += factor.getScore() * factor.getWeight();
            totalWeight += factor.getWeight();
        }
        return totalWeight > 0 ? weighted / totalWeight : NEUTRAL_SCORE;
    }

    /**
     * Free capacity; GPU counts most for ML work
     */
    private static double availability(ResourceUtilization utilization) {
        if (utilization == null) {
            return NEUTRAL_SCORE;
        }
        return (1 - utilization.getCpu()) * 0.3
            + (1 - utilization.getMemory()) * 0.3
            + (1 - utilization.getGpu()) * 0.4;
    }

    private static double subscriptionScore(SubscriptionTier tier) {
        if (tier == null) {
            return 0.25;
        }
        return switch (tier) {
            case PREMIUM -> 1.0;
            case STANDARD -> 0.5;
            case FREE -> 0.25;
        };
    }

    /**
     * Success rate of the type so far; neutral without history or when the store fails
     */
    private Mono<Double> historyScore(String type) {
        String prefix = OUTCOME_KEY_PREFIX + type + ":";
        return Mono.zip(store.getLong(prefix + "completed"), store.getLong(prefix + "succeeded"))
            .map(counts -> counts.getT1() > 0
                ? Math.min(1.0, (double) counts.getT2() / counts.getT1())
                : NEUTRAL_SCORE)
            .onErrorResume(e -> {
                log.warn("Quality history for {} unavailable: {}", type, e.getMessage());
                return Mono.just(NEUTRAL_SCORE);
            });
    }

    private static String tierName(SubscriptionTier tier) {
        return tier != null ? tier.getValue() : "unknown";
    }
}
