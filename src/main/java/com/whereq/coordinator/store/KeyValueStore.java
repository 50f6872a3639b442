package com.whereq.coordinator.store;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Key-value store backing caches, status records, history and scaling signals.
 * Values are opaque strings; callers own the encoding.
 */
public interface KeyValueStore {
    /**
     * Read a value
     *
     * @param key the key
     * @return Mono with the value, empty when absent
     */
    Mono<String> get(String key);

    /**
     * Write a value in one operation, replacing any previous value
     *
     * @param key the key
     * @param value the value
     * @param ttl expiry, null to keep forever
     * @return Mono that completes when written
     */
    Mono<Void> set(String key, String value, Duration ttl);

    /**
     * Atomically add to a counter, creating it at zero
     *
     * @param key the counter key
     * @param delta amount to add
     * @param ttl expiry refreshed on every increment, null to keep forever
     * @return Mono with the new value
     */
    Mono<Long> increment(String key, long delta, Duration ttl);

    /**
     * Delete a key
     *
     * @param key the key
     * @return Mono with true if the key existed
     */
    Mono<Boolean> delete(String key);

    /**
     * Iterate keys matching a glob pattern, e.g. {@code prefix:*}
     *
     * @param pattern glob pattern
     * @return Flux of matching keys
     */
    Flux<String> scan(String pattern);

    /**
     * Prepend to a list and trim it to the newest {@code maxLength} entries
     *
     * @param key list key
     * @param value entry to add
     * @param maxLength entries to keep
     * @param ttl expiry, null to keep forever
     * @return Mono with the list length after trimming
     */
    Mono<Long> listPush(String key, String value, int maxLength, Duration ttl);

    /**
     * Read list entries, newest first
     *
     * @param key list key
     * @param start first index, inclusive
     * @param end last index, inclusive; -1 for the tail
     * @return Flux of entries
     */
    Flux<String> listRange(String key, long start, long end);

    /**
     * Read a counter
     *
     * @return Mono with the value, 0 when absent or not numeric
     */
    default Mono<Long> getLong(String key) {
        return get(key)
            .map(value -> {
                try {
                    return Long.parseLong(value);
                } catch (NumberFormatException e) {
                    return 0L;
                }
            })
            .defaultIfEmpty(0L);
    }
}
