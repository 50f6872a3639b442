package com.whereq.coordinator.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.whereq.coordinator.model.QualityLevel;
import com.whereq.coordinator.model.QualityPreference;
import com.whereq.coordinator.model.SubscriptionTier;
import com.whereq.coordinator.model.WorkflowPriority;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Logical processing request submitted by a client.
 *
 * @author WhereQ Inc.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class WorkflowRequest implements Serializable {
    private static final long serialVersionUID = 1L;

    public static final String QUALITY_AUTO = "auto";

    /**
     * Processing pipeline, also the name of the workflow template on the engine.
     * Examples: 3d-reconstruction, material-recognition, scene-graph-generation, room-layout
     */
    @NotBlank(message = "type is required")
    private String type;

    @NotBlank(message = "userId is required")
    private String userId;

    @NotNull(message = "subscriptionTier is required")
    private SubscriptionTier subscriptionTier;

    /**
     * "auto" lets the coordinator decide; otherwise one of low, medium, high.
     */
    @Builder.Default
    private String qualityTarget = QUALITY_AUTO;

    private QualityPreference qualityPreference;

    /**
     * Derived from type and tier when absent.
     */
    private WorkflowPriority priority;

    @Builder.Default
    private Boolean enableCaching = Boolean.TRUE;

    /**
     * Pipeline parameters, passed through to the workflow as arguments.
     */
    @Builder.Default
    private Map<String, Object> parameters = new LinkedHashMap<>();

    /**
     * Explicit quality level, empty for "auto".
     *
     * @throws IllegalArgumentException when the target is neither auto nor a known level
     */
    public Optional<QualityLevel> explicitQualityTarget() {
        if (qualityTarget == null || qualityTarget.isBlank() || QUALITY_AUTO.equalsIgnoreCase(qualityTarget)) {
            return Optional.empty();
        }
        return Optional.of(QualityLevel.fromValue(qualityTarget));
    }

    @JsonIgnore
    public boolean isCacheable() {
        return enableCaching == null || enableCaching;
    }

    /**
     * Copy with its own parameter map so later edits by the caller cannot leak in.
     */
    public WorkflowRequest snapshot() {
        return toBuilder()
            .parameters(parameters == null ? new LinkedHashMap<>() : new LinkedHashMap<>(parameters))
            .build();
    }
}
