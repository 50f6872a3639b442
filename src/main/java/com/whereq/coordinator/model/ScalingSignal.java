package com.whereq.coordinator.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Point-in-time load observation feeding the forecaster
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScalingSignal {
    public static final String QUEUE_DEPTH = "queue-depth";

    private Instant timestamp;
    private String metric;
    private double value;
}
