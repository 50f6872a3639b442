package com.whereq.coordinator.store;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Redis-backed key-value store using string values and lists
 */
@Slf4j
@Service
public class RedisKeyValueStore implements KeyValueStore {

    private static final long SCAN_COUNT = 500;

    private final ReactiveRedisTemplate<String, String> redisTemplate;

    public RedisKeyValueStore(ReactiveRedisTemplate<String, String> redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    @Override
    public Mono<String> get(String key) {
        return redisTemplate.opsForValue().get(key);
    }

    @Override
    public Mono<Void> set(String key, String value, Duration ttl) {
        // SET with EX so value and expiry land in one command
        Mono<Boolean> write = ttl != null
            ? redisTemplate.opsForValue().set(key, value, ttl)
            : redisTemplate.opsForValue().set(key, value);
        return write
            .doOnSuccess(ok -> log.debug("Stored {} (ttl={})", key, ttl))
            .then();
    }

    @Override
    public Mono<Long> increment(String key, long delta, Duration ttl) {
        return redisTemplate.opsForValue().increment(key, delta)
            .flatMap(value -> ttl != null
                ? redisTemplate.expire(key, ttl).thenReturn(value)
                : Mono.just(value));
    }

    @Override
    public Mono<Boolean> delete(String key) {
        return redisTemplate.delete(key)
            .map(deleted -> deleted > 0);
    }

    @Override
    public Flux<String> scan(String pattern) {
        return redisTemplate.scan(ScanOptions.scanOptions()
            .match(pattern)
            .count(SCAN_COUNT)
            .build());
    }

    @Override
    public Mono<Long> listPush(String key, String value, int maxLength, Duration ttl) {
        return redisTemplate.opsForList().leftPush(key, value)
            .flatMap(size -> redisTemplate.opsForList().trim(key, 0, maxLength - 1L)
                .thenReturn(Math.min(size, maxLength)))
            .flatMap(size -> ttl != null
                ? redisTemplate.expire(key, ttl).thenReturn(size)
                : Mono.just(size));
    }

    @Override
    public Flux<String> listRange(String key, long start, long end) {
        return redisTemplate.opsForList().range(key, start, end);
    }
}
