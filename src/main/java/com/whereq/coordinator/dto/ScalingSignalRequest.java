package com.whereq.coordinator.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Externally produced load observation for a workload
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScalingSignalRequest {
    @NotBlank
    private String metric;

    private double value;

    /**
     * Defaults to receipt time
     */
    private Instant timestamp;
}
