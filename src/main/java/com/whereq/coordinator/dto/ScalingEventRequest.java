package com.whereq.coordinator.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Manual scaling event to propagate through the dependency graph
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScalingEventRequest {
    @NotBlank
    private String workload;

    @Min(0)
    private int fromReplicas;

    @Min(0)
    private int toReplicas;
}
