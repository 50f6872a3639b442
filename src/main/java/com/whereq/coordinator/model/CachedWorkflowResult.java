package com.whereq.coordinator.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Result of a completed workflow shared by later requests with the same fingerprint
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CachedWorkflowResult {
    private String cacheKey;
    private String workflowId;
    private String type;

    /**
     * Engine outputs of the producing workflow
     */
    private JsonNode result;

    private Instant createdAt;
    private long ttlSeconds;

    /**
     * Expired from {@code createdAt + ttlSeconds} on, whether or not the store evicted it
     */
    public boolean isExpiredAt(Instant now) {
        return createdAt == null || !now.isBefore(createdAt.plusSeconds(ttlSeconds));
    }
}
