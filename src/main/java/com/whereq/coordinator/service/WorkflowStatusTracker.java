package com.whereq.coordinator.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.coordinator.config.CoordinatorProperties;
import com.whereq.coordinator.exception.WorkflowNotFoundException;
import com.whereq.coordinator.model.WorkflowStatus;
import com.whereq.coordinator.store.KeyValueStore;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Track workflow status records.
 *
 * Live records are held in memory and changed under a per-key compute, so concurrent
 * updates to one workflow never interleave. Every change is written to the store as
 * JSON; terminal records leave memory once persisted and are read back on demand.
 */
@Slf4j
@Service
public class WorkflowStatusTracker {

    static final String STATUS_KEY_PREFIX = "coordinator:workflow:";

    private final KeyValueStore store;
    private final ObjectMapper objectMapper;
    private final Duration ttl;

    private final ConcurrentHashMap<String, WorkflowStatus> statuses = new ConcurrentHashMap<>();

    public WorkflowStatusTracker(KeyValueStore store, ObjectMapper objectMapper, CoordinatorProperties properties) {
        this.store = store;
        this.objectMapper = objectMapper;
        this.ttl = properties.getStatus().getTtl();
    }

    /**
     * Register a new workflow record
     *
     * @param status initial record
     * @return Mono with the stored record
     */
    public Mono<WorkflowStatus> create(WorkflowStatus status) {
        statuses.put(status.getId(), status);
        log.info("Workflow {} registered as {}", status.getId(), status.getStatus());
        return persist(status).thenReturn(status);
    }

    /**
     * Apply a change to a workflow record
     *
     * @param workflowId workflow identifier
     * @param change function from the current record to the next one
     * @return Mono with the previous and the new record; errors with
     *         {@link WorkflowNotFoundException} when the workflow is unknown
     */
    public Mono<Transition> update(String workflowId, UnaryOperator<WorkflowStatus> change) {
        return get(workflowId)
            .map(loaded -> {
                statuses.putIfAbsent(workflowId, loaded);
                AtomicReference<WorkflowStatus> previous = new AtomicReference<>();
                WorkflowStatus current = statuses.compute(workflowId, (id, existing) -> {
                    WorkflowStatus base = existing != null ? existing : loaded;
                    previous.set(base);
                    return change.apply(base);
                });
                return new Transition(previous.get(), current);
            })
            .flatMap(transition -> {
                if (!transition.isChanged()) {
                    if (transition.getCurrent().isTerminal()) {
                        statuses.remove(workflowId, transition.getCurrent());
                    }
                    return Mono.just(transition);
                }
                WorkflowStatus current = transition.getCurrent();
                if (transition.getPrevious().getStatus() != current.getStatus()) {
                    log.info("Workflow {} status: {} -> {}", workflowId,
                        transition.getPrevious().getStatus(), current.getStatus());
                }
                return persist(current)
                    .doOnSuccess(v -> {
                        if (current.isTerminal()) {
                            statuses.remove(workflowId, current);
                        }
                    })
                    .thenReturn(transition);
            });
    }

    /**
     * Get a workflow record, from memory or the store
     *
     * @param workflowId workflow identifier
     * @return Mono with the record; errors with {@link WorkflowNotFoundException}
     */
    public Mono<WorkflowStatus> get(String workflowId) {
        WorkflowStatus live = statuses.get(workflowId);
        if (live != null) {
            return Mono.just(live);
        }
        return store.get(STATUS_KEY_PREFIX + workflowId)
            .flatMap(json -> Mono.fromCallable(() -> objectMapper.readValue(json, WorkflowStatus.class)))
            .switchIfEmpty(Mono.error(new WorkflowNotFoundException(workflowId)));
    }

    /**
     * Workflows not yet terminal, oldest first
     *
     * @param userId owner filter, null for all
     */
    public List<WorkflowStatus> listActive(String userId) {
        return statuses.values().stream()
            .filter(status -> !status.isTerminal())
            .filter(status -> userId == null || userId.equals(status.getUserId()))
            .sorted(Comparator.comparing(WorkflowStatus::getCreatedAt,
                Comparator.nullsLast(Comparator.naturalOrder())))
            .collect(Collectors.toList());
    }

    /**
     * Number of live workflows of the given types
     */
    public long countActive(List<String> types) {
        return statuses.values().stream()
            .filter(status -> !status.isTerminal())
            .filter(status -> types.contains(status.getType()))
            .count();
    }

    /**
     * Load non-terminal records persisted by an earlier run back into memory
     *
     * @return Flux of the recovered records
     */
    public Flux<WorkflowStatus> recoverActive() {
        return store.scan(STATUS_KEY_PREFIX + "*")
            .flatMap(store::get)
            .flatMap(json -> {
                try {
                    return Mono.just(objectMapper.readValue(json, WorkflowStatus.class));
                } catch (JsonProcessingException e) {
                    log.warn("Skipping unreadable status record: {}", e.getOriginalMessage());
                    return Mono.empty();
                }
            })
            .filter(status -> !status.isTerminal())
            .filter(status -> statuses.putIfAbsent(status.getId(), status) == null)
            .doOnNext(status -> log.info("Recovered workflow {} in status {}", status.getId(), status.getStatus()));
    }

    private Mono<Void> persist(WorkflowStatus status) {
        return Mono.fromCallable(() -> objectMapper.writeValueAsString(status))
            .flatMap(json -> store.set(STATUS_KEY_PREFIX + status.getId(), json, ttl))
            .doOnError(e -> log.error("Failed to persist status of workflow {}", status.getId(), e));
    }

    /**
     * A record before and after one update
     */
    @Getter
    public static class Transition {
        private final WorkflowStatus previous;
        private final WorkflowStatus current;

        public Transition(WorkflowStatus previous, WorkflowStatus current) {
            this.previous = previous;
            this.current = current;
        }

        public boolean isChanged() {
            return previous != current;
        }

        /**
         * True only for the update that moved the record into a terminal phase
         */
        public boolean becameTerminal() {
            return !previous.isTerminal() && current.isTerminal();
        }
    }
}
