package com.whereq.coordinator.controller;

import com.whereq.coordinator.cache.CacheManager;
import com.whereq.coordinator.dto.CacheInvalidationResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Result cache administration
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/cache")
@Tag(name = "Cache", description = "Invalidate cached workflow results")
public class CacheController {

    @Autowired
    private CacheManager cacheManager;

    @DeleteMapping("/{type}")
    @Operation(summary = "Invalidate by type", description = "Remove every cached result of a workflow type")
    public Mono<ResponseEntity<CacheInvalidationResponse>> invalidateType(@PathVariable String type) {
        return cacheManager.invalidateByType(type)
            .map(count -> ResponseEntity.ok(CacheInvalidationResponse.builder()
                .target(type)
                .entries(count)
                .build()))
            .onErrorResume(e -> {
                log.error("Cache invalidation for type {} failed", type, e);
                return Mono.just(ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build());
            });
    }

    @DeleteMapping
    @Operation(summary = "Invalidate by key", description = "Remove one cached result")
    public Mono<ResponseEntity<CacheInvalidationResponse>> invalidateKey(@RequestParam("key") String key) {
        return cacheManager.invalidate(key)
            .map(deleted -> ResponseEntity.ok(CacheInvalidationResponse.builder()
                .target(key)
                .entries(Boolean.TRUE.equals(deleted) ? 1 : 0)
                .build()))
            .onErrorResume(e -> {
                log.error("Cache invalidation for key {} failed", key, e);
                return Mono.just(ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build());
            });
    }
}
