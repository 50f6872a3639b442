package com.whereq.coordinator.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * Kubernetes pod toleration
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Toleration implements Serializable {
    private static final long serialVersionUID = 1L;

    private String key;

    @Builder.Default
    private String operator = "Equal";

    private String value;

    @Builder.Default
    private String effect = "NoSchedule";
}
