package com.whereq.coordinator.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of quality assessment for one request
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QualityAssessment {
    private QualityLevel qualityLevel;

    /**
     * Weighted aggregate of the factor scores
     */
    private double score;

    @Builder.Default
    private List<QualityFactor> factors = new ArrayList<>();

    /**
     * Level came from an explicit quality target
     */
    private boolean explicit;

    /**
     * Level was lowered to the tier ceiling
     */
    private boolean clamped;

    private QualityLevel ceiling;
}
