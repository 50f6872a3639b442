package com.whereq.coordinator.store;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Map-backed store for tests. Every operation runs on subscription; TTLs are ignored.
 */
public class InMemoryKeyValueStore implements KeyValueStore {

    private final Map<String, String> values = new ConcurrentHashMap<>();
    private final Map<String, LinkedList<String>> lists = new ConcurrentHashMap<>();
    private volatile boolean failing;
    private volatile String heldPrefix;
    private volatile Sinks.Empty<Void> writeGate = Sinks.empty();

    public void setFailing(boolean failing) {
        this.failing = failing;
    }

    /**
     * Writes to keys under {@code keyPrefix} wait until {@link #releaseWrites()}.
     */
    public void holdWrites(String keyPrefix) {
        writeGate = Sinks.empty();
        heldPrefix = keyPrefix;
    }

    public void releaseWrites() {
        heldPrefix = null;
        writeGate.tryEmitEmpty();
    }

    public Map<String, String> values() {
        return values;
    }

    public List<String> list(String key) {
        LinkedList<String> list = lists.get(key);
        if (list == null) {
            return List.of();
        }
        synchronized (list) {
            return new ArrayList<>(list);
        }
    }

    @Override
    public Mono<String> get(String key) {
        return Mono.defer(() -> {
            checkAvailable();
            return Mono.justOrEmpty(values.get(key));
        });
    }

    @Override
    public Mono<Void> set(String key, String value, Duration ttl) {
        Mono<Void> write = Mono.defer(() -> {
            checkAvailable();
            values.put(key, value);
            return Mono.empty();
        });
        return Mono.defer(() -> {
            String prefix = heldPrefix;
            return prefix != null && key.startsWith(prefix) ? writeGate.asMono().then(write) : write;
        });
    }

    @Override
    public Mono<Long> increment(String key, long delta, Duration ttl) {
        return Mono.defer(() -> {
            checkAvailable();
            String next = values.merge(key, String.valueOf(delta),
                (old, d) -> String.valueOf(Long.parseLong(old) + Long.parseLong(d)));
            return Mono.just(Long.parseLong(next));
        });
    }

    @Override
    public Mono<Boolean> delete(String key) {
        return Mono.defer(() -> {
            checkAvailable();
            boolean removed = values.remove(key) != null;
            removed |= lists.remove(key) != null;
            return Mono.just(removed);
        });
    }

    @Override
    public Flux<String> scan(String pattern) {
        return Flux.defer(() -> {
            checkAvailable();
            Pattern regex = Pattern.compile(globToRegex(pattern));
            List<String> keys = new ArrayList<>();
            values.keySet().stream().filter(k -> regex.matcher(k).matches()).forEach(keys::add);
            lists.keySet().stream().filter(k -> regex.matcher(k).matches()).forEach(keys::add);
            return Flux.fromIterable(keys);
        });
    }

    @Override
    public Mono<Long> listPush(String key, String value, int maxLength, Duration ttl) {
        return Mono.defer(() -> {
            checkAvailable();
            LinkedList<String> list = lists.computeIfAbsent(key, k -> new LinkedList<>());
            synchronized (list) {
                list.addFirst(value);
                while (list.size() > maxLength) {
                    list.removeLast();
                }
                return Mono.just((long) list.size());
            }
        });
    }

    @Override
    public Flux<String> listRange(String key, long start, long end) {
        return Flux.defer(() -> {
            checkAvailable();
            List<String> snapshot = list(key);
            int from = (int) Math.min(start, snapshot.size());
            int to = end < 0 ? snapshot.size() : (int) Math.min(end + 1, snapshot.size());
            return Flux.fromIterable(from < to ? snapshot.subList(from, to) : List.of());
        });
    }

    private void checkAvailable() {
        if (failing) {
            throw new IllegalStateException("store unavailable");
        }
    }

    private static String globToRegex(String glob) {
        StringBuilder regex = new StringBuilder();
        for (char c : glob.toCharArray()) {
            switch (c) {
                case '*' -> regex.append(".*");
                case '?' -> regex.append('.');
                default -> regex.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return regex.toString();
    }
}
