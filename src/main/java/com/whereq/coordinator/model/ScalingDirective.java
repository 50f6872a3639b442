package com.whereq.coordinator.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Desired-replica directive sent to the autoscaling API for one workload.
 */
@Value
@Builder(toBuilder = true)
public class ScalingDirective {
    String workload;

    int fromReplicas;

    int toReplicas;

    Direction direction;

    Source source;

    /**
     * Forecast load that triggered the directive; null for propagated directives
     */
    Double forecast;

    /**
     * Human-readable reason for this directive.
     */
    String reason;

    Instant timestamp;

    public enum Direction {
        SCALE_UP,
        SCALE_DOWN
    }

    public enum Source {
        /**
         * Forecast-driven, issued by the predictive tick
         */
        PREDICTIVE,

        /**
         * Propagated from a workload this one supports
         */
        DEPENDENCY,

        /**
         * Submitted through the API
         */
        MANUAL
    }
}
