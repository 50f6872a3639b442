package com.whereq.coordinator.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Concrete compute request for one workflow. Built once by the resource manager
 * and not changed after the workflow is submitted.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ResourceAllocation implements Serializable {
    private static final long serialVersionUID = 1L;

    /**
     * CPU quantity, e.g. "2000m"
     */
    private String cpu;

    /**
     * Memory quantity, e.g. "8Gi"
     */
    private String memory;

    private int gpu;

    /**
     * Node pool the selector targets
     */
    private String nodePool;

    @Builder.Default
    private Map<String, String> nodeSelector = new LinkedHashMap<>();

    @Builder.Default
    private List<Toleration> tolerations = new ArrayList<>();

    private String priorityClassName;

    private int priorityValue;

    private QualityLevel qualityLevel;
}
