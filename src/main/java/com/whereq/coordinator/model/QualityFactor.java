package com.whereq.coordinator.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One scored input to a quality decision, score normalized to [0, 1]
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QualityFactor {
    private QualityFactorKind kind;

    /**
     * Kind name for built-in factors, provider-chosen for extensions
     */
    private String name;

    private double score;

    private double weight;

    public static QualityFactor of(QualityFactorKind kind, double score, double weight) {
        return new QualityFactor(kind, kind.name().toLowerCase(), clamp(score), weight);
    }

    public static QualityFactor extension(String name, double score, double weight) {
        return new QualityFactor(QualityFactorKind.EXTENSION, name, clamp(score), weight);
    }

    private static double clamp(double score) {
        if (Double.isNaN(score)) {
            return 0.5;
        }
        return Math.max(0.0, Math.min(1.0, score));
    }
}
