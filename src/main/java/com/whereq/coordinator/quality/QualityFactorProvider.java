package com.whereq.coordinator.quality;

import com.whereq.coordinator.dto.WorkflowRequest;
import com.whereq.coordinator.model.QualityFactor;

import java.util.Optional;

/**
 * Contributes an additional factor to quality assessment. Beans implementing this
 * are picked up automatically; their factors carry the EXTENSION kind.
 */
public interface QualityFactorProvider {

    /**
     * Factor name, reported with the assessment
     */
    String name();

    /**
     * Score the request in [0, 1], or empty to abstain
     */
    Optional<Double> score(WorkflowRequest request);

    /**
     * Weight relative to the built-in factors; defaults to the configured extension weight
     */
    default Optional<Double> weight() {
        return Optional.empty();
    }

    default QualityFactor toFactor(double score, double defaultWeight) {
        return QualityFactor.extension(name(), score, weight().orElse(defaultWeight));
    }
}
