package com.whereq.coordinator.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.coordinator.config.CoordinatorProperties;
import com.whereq.coordinator.dto.WorkflowRequest;
import com.whereq.coordinator.model.CachedWorkflowResult;
import com.whereq.coordinator.model.QualityLevel;
import com.whereq.coordinator.store.KeyValueStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Result cache keyed by request fingerprint.
 *
 * Keys look like {@code workflow:<type>:<sha256>} and are stored under the configured
 * prefix. Entries carry their own creation time and TTL; expiry is decided here, not
 * left to store eviction. The manager also tracks which workflow is currently
 * producing the result for a fingerprint so identical requests can share it.
 *
 * @author WhereQ Inc.
 */
@Slf4j
@Service
public class CacheManager {

    private static final String KEY_NAMESPACE = "workflow:";

    private final KeyValueStore store;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final String keyPrefix;
    private final Duration defaultTtl;

    /**
     * Fingerprint → workflow currently producing its result
     */
    private final ConcurrentHashMap<String, String> inFlight = new ConcurrentHashMap<>();

    public CacheManager(KeyValueStore store, ObjectMapper objectMapper, Clock clock,
                        CoordinatorProperties properties) {
        this.store = store;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.keyPrefix = properties.getCache().getKeyPrefix();
        this.defaultTtl = properties.getCache().getDefaultTtl();
    }

    /**
     * Fingerprint of a request: SHA-256 over type, resolved quality level and parameters
     * with every map sorted by key, so insertion order never changes the key. The level
     * is the one the request will actually run at, after tier clamping, so a result is
     * only shared between requests entitled to the same quality.
     *
     * @param request accepted request
     * @param qualityLevel level the request resolved to
     */
    public String generateCacheKey(WorkflowRequest request, QualityLevel qualityLevel) {
        Map<String, Object> fingerprint = new TreeMap<>();
        fingerprint.put("type", request.getType());
        fingerprint.put("qualityLevel", qualityLevel.getValue());
        fingerprint.put("parameters", canonicalize(request.getParameters() != null ? request.getParameters() : Map.of()));

        try {
            byte[] canonical = objectMapper.writeValueAsBytes(fingerprint);
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(canonical);
            return KEY_NAMESPACE + request.getType() + ":" + HexFormat.of().formatHex(digest);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Request parameters are not serializable", e);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Cached result, only while {@code now < createdAt + ttl}. Store failures count as a miss.
     *
     * @param cacheKey fingerprint key
     * @return Mono with the entry, empty on miss or expiry
     */
    public Mono<CachedWorkflowResult> get(String cacheKey) {
        return store.get(keyPrefix + cacheKey)
            .flatMap(json -> {
                try {
                    return Mono.just(objectMapper.readValue(json, CachedWorkflowResult.class));
                } catch (JsonProcessingException e) {
                    log.warn("Discarding unreadable cache entry {}: {}", cacheKey, e.getOriginalMessage());
                    return Mono.empty();
                }
            })
            .filter(entry -> {
                Instant now = clock.instant();
                if (entry.isExpiredAt(now)) {
                    log.debug("Cache entry {} expired at {}", cacheKey, entry.getCreatedAt().plusSeconds(entry.getTtlSeconds()));
                    return false;
                }
                return true;
            })
            .onErrorResume(e -> {
                log.warn("Cache lookup for {} failed, treating as miss: {}", cacheKey, e.getMessage());
                return Mono.empty();
            });
    }

    /**
     * Store a result, replacing any previous entry, in a single write
     *
     * @param cacheKey fingerprint key
     * @param workflowId workflow that produced the result
     * @param result result payload
     * @param ttl time to live, null for the default
     * @return Mono that completes when stored
     */
    public Mono<Void> set(String cacheKey, String workflowId, JsonNode result, Duration ttl) {
        Duration effectiveTtl = ttl != null ? ttl : defaultTtl;
        CachedWorkflowResult entry = CachedWorkflowResult.builder()
            .cacheKey(cacheKey)
            .workflowId(workflowId)
            .type(typeOf(cacheKey))
            .result(result != null ? result : objectMapper.createObjectNode())
            .createdAt(clock.instant())
            .ttlSeconds(effectiveTtl.toSeconds())
            .build();

        return Mono.fromCallable(() -> objectMapper.writeValueAsString(entry))
            .flatMap(json -> store.set(keyPrefix + cacheKey, json, effectiveTtl))
            .doOnSuccess(v -> log.info("Cached result of workflow {} under {} for {}", workflowId, cacheKey, effectiveTtl));
    }

    /**
     * Remove one entry
     *
     * @return Mono with true if an entry existed
     */
    public Mono<Boolean> invalidate(String cacheKey) {
        return store.delete(keyPrefix + cacheKey)
            .doOnSuccess(deleted -> log.info("Invalidated cache entry {}: {}", cacheKey, deleted));
    }

    /**
     * Remove every entry of a workflow type. Returns once the matching keys are known;
     * deletion continues in the background.
     *
     * @return Mono with the number of entries scheduled for removal
     */
    public Mono<Long> invalidateByType(String type) {
        return store.scan(keyPrefix + KEY_NAMESPACE + type + ":*")
            .collectList()
            .map(keys -> {
                Flux.fromIterable(keys)
                    .flatMap(store::delete)
                    .count()
                    .subscribe(
                        deleted -> log.info("Invalidated {} cache entries of type {}", deleted, type),
                        e -> log.error("Cache invalidation for type {} incomplete", type, e));
                return (long) keys.size();
            });
    }

    /**
     * Register a workflow as the producer of a fingerprint's result
     *
     * @return the workflow already producing it, empty if this one won the claim
     */
    public Optional<String> claimInFlight(String cacheKey, String workflowId) {
        return Optional.ofNullable(inFlight.putIfAbsent(cacheKey, workflowId));
    }

    /**
     * Drop the claim, only if still held by this workflow
     */
    public void releaseInFlight(String cacheKey, String workflowId) {
        if (cacheKey != null && inFlight.remove(cacheKey, workflowId)) {
            log.debug("Released in-flight claim {} held by {}", cacheKey, workflowId);
        }
    }

    private static String typeOf(String cacheKey) {
        if (cacheKey.startsWith(KEY_NAMESPACE)) {
            int end = cacheKey.lastIndexOf(':');
            if (end > KEY_NAMESPACE.length()) {
                return cacheKey.substring(KEY_NAMESPACE.length(), end);
            }
        }
        return null;
    }

    private static Object canonicalize(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> sorted = new TreeMap<>();
            map.forEach((k, v) -> sorted.put(String.valueOf(k), canonicalize(v)));
            return sorted;
        }
        if (value instanceof Collection<?> collection) {
            List<Object> items = new ArrayList<>(collection.size());
            collection.forEach(item -> items.add(canonicalize(item)));
            return items;
        }
        return value;
    }
}
