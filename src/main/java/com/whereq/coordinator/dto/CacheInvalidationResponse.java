package com.whereq.coordinator.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Result of a cache invalidation request
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheInvalidationResponse {
    /**
     * Workflow type or cache key that was targeted
     */
    private String target;

    /**
     * Entries removed, or scheduled for removal when invalidating by type
     */
    private long entries;
}
