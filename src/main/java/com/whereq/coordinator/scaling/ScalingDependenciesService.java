package com.whereq.coordinator.scaling;

import com.whereq.coordinator.cluster.AutoscalerClient;
import com.whereq.coordinator.config.CoordinatorProperties;
import com.whereq.coordinator.exception.DependencyCycleException;
import com.whereq.coordinator.exception.RemoteCallErrors;
import com.whereq.coordinator.model.RetryPolicy;
import com.whereq.coordinator.model.ScalingDirective;
import com.whereq.coordinator.monitoring.MonitoringService;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Propagates a scaling change of one workload to the workloads it requires.
 *
 * The graph holds edges "A requires B with ratio r". When A moves from {@code f} to
 * {@code t} replicas, B is set to {@code ceil(current(B) * t / f * r)}, bounded by B's
 * replica limits, and the change continues through B's own requirements. Directives
 * are applied dependencies first.
 *
 * @author WhereQ Inc.
 */
@Slf4j
@Service
public class ScalingDependenciesService {

    private final CoordinatorProperties.ScalingConfig config;
    private final AutoscalerClient autoscalerClient;
    private final ScalingDecisionHistory decisionHistory;
    private final MonitoringService monitoringService;
    private final Clock clock;
    private final RetryPolicy retryPolicy;

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    /**
     * workload → edges to the workloads it requires
     */
    private Map<String, List<Edge>> graph = Collections.emptyMap();

    public ScalingDependenciesService(CoordinatorProperties properties,
                                      AutoscalerClient autoscalerClient,
                                      ScalingDecisionHistory decisionHistory,
                                      MonitoringService monitoringService,
                                      Clock clock) {
        this.config = properties.getScaling();
        this.autoscalerClient = autoscalerClient;
        this.decisionHistory = decisionHistory;
        this.monitoringService = monitoringService;
        this.clock = clock;
        this.retryPolicy = config.getRetry();
    }

    /**
     * Load and validate the configured graph. An invalid graph fails startup.
     */
    @PostConstruct
    public void initialize() {
        if (!config.getDependencies().isEnabled()) {
            log.info("Scaling dependencies disabled");
            return;
        }
        setDependencies(config.getDependencies().getEdges());
    }

    public boolean isEnabled() {
        return config.getDependencies().isEnabled();
    }

    /**
     * Replace the dependency graph
     *
     * @throws IllegalArgumentException when an edge names an unconfigured workload
     *         or has a non-positive ratio
     * @throws DependencyCycleException when the edges form a cycle
     */
    public void setDependencies(List<CoordinatorProperties.Dependency> dependencies) {
        Map<String, List<Edge>> next = new LinkedHashMap<>();
        for (CoordinatorProperties.Dependency dependency : dependencies) {
            requireWorkload(dependency.getWorkload());
            requireWorkload(dependency.getRequires());
            if (dependency.getRatio() <= 0) {
                throw new IllegalArgumentException("Dependency ratio must be positive: "
                    + dependency.getWorkload() + " -> " + dependency.getRequires());
            }
            next.computeIfAbsent(dependency.getWorkload(), k -> new ArrayList<>())
                .add(new Edge(dependency.getRequires(), dependency.getRatio()));
        }

        List<String> cycle = findCycle(next);
        if (!cycle.isEmpty()) {
            throw new DependencyCycleException(cycle);
        }

        lock.writeLock().lock();
        try {
            graph = next;
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Loaded {} scaling dependencies", dependencies.size());
    }

    /**
     * Workloads required by the given workload, with their ratios
     */
    public Map<String, Double> getDependencies(String workload) {
        lock.readLock().lock();
        try {
            Map<String, Double> result = new LinkedHashMap<>();
            graph.getOrDefault(workload, List.of()).forEach(edge -> result.put(edge.requires, edge.ratio));
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Propagate a replica change of one workload through its requirements
     *
     * @param workload workload that changed
     * @param fromReplicas replicas before the change
     * @param toReplicas replicas after the change
     * @return Mono with the directives that were applied, dependencies first
     */
    public Mono<List<ScalingDirective>> onScalingEvent(String workload, int fromReplicas, int toReplicas) {
        if (fromReplicas == toReplicas) {
            return Mono.just(List.of());
        }
        List<String> order = propagationOrder(workload);
        if (order.size() <= 1) {
            log.debug("No dependencies to propagate for {}", workload);
            return Mono.just(List.of());
        }

        return Flux.fromIterable(order.subList(1, order.size()))
            .flatMap(dependency -> autoscalerClient.getScale(dependency)
                .map(scale -> Map.entry(dependency, scale.getDesiredReplicas()))
                .onErrorResume(e -> {
                    log.warn("Cannot read replicas of {}, skipping it: {}", dependency, e.getMessage());
                    return Mono.empty();
                }))
            .collectMap(Map.Entry::getKey, Map.Entry::getValue)
            .map(current -> plan(workload, fromReplicas, toReplicas, order, current))
            .flatMapMany(Flux::fromIterable)
            .concatMap(this::apply)
            .collectList()
            .doOnSuccess(applied -> log.info("Propagated {} {} -> {} to {} dependent workloads",
                workload, fromReplicas, toReplicas, applied.size()));
    }

    /**
     * Target replicas of every workload reachable from {@code root}
     *
     * @param order root first, each workload before the workloads it requires
     * @param current current replicas of the reachable workloads; a missing entry is skipped
     * @return directives ordered dependencies first
     */
    List<ScalingDirective> plan(String root, int fromReplicas, int toReplicas,
                                List<String> order, Map<String, Integer> current) {
        Map<String, int[]> changes = new HashMap<>();
        changes.put(root, new int[]{fromReplicas, toReplicas});

        Map<String, List<Edge>> snapshot = snapshot();
        List<ScalingDirective> directives = new ArrayList<>();
        Instant now = clock.instant();

        for (String workload : order.subList(1, order.size())) {
            Integer currentReplicas = current.get(workload);
            if (currentReplicas == null) {
                continue;
            }
            int target = -1;
            String drivenBy = null;
            for (Map.Entry<String, List<Edge>> entry : snapshot.entrySet()) {
                int[] parentChange = changes.get(entry.getKey());
                if (parentChange == null) {
                    continue;
                }
                for (Edge edge : entry.getValue()) {
                    if (edge.requires.equals(workload)) {
                        int candidate = proportional(currentReplicas, parentChange[0], parentChange[1], edge.ratio);
                        if (candidate > target) {
                            target = candidate;
                            drivenBy = entry.getKey();
                        }
                    }
                }
            }
            if (target < 0) {
                continue;
            }
            CoordinatorProperties.Workload limits = config.getWorkloads().get(workload);
            target = Math.max(limits.getMinReplicas(), Math.min(limits.getMaxReplicas(), target));
            changes.put(workload, new int[]{currentReplicas, target});

            if (target != currentReplicas) {
                directives.add(ScalingDirective.builder()
                    .workload(workload)
                    .fromReplicas(currentReplicas)
                    .toReplicas(target)
                    .direction(target > currentReplicas
                        ? ScalingDirective.Direction.SCALE_UP : ScalingDirective.Direction.SCALE_DOWN)
                    .source(ScalingDirective.Source.DEPENDENCY)
                    .reason("required by " + drivenBy + " (" + root + " " + fromReplicas + " -> " + toReplicas + ")")
                    .timestamp(now)
                    .build());
            }
        }

        Collections.reverse(directives);
        return directives;
    }

    static int proportional(int currentReplicas, int fromReplicas, int toReplicas, double ratio) {
        if (fromReplicas <= 0) {
            return (int) Math.ceil(toReplicas * ratio);
        }
        return (int) Math.ceil(currentReplicas * ((double) toReplicas / fromReplicas) * ratio);
    }

    /**
     * Workloads reachable from {@code root}, root first, every workload before the
     * workloads it requires
     */
    List<String> propagationOrder(String root) {
        Map<String, List<Edge>> snapshot = snapshot();

        Set<String> reachable = new LinkedHashSet<>();
        Deque<String> pending = new ArrayDeque<>();
        pending.add(root);
        while (!pending.isEmpty()) {
            String workload = pending.poll();
            if (reachable.add(workload)) {
                snapshot.getOrDefault(workload, List.of()).forEach(edge -> pending.add(edge.requires));
            }
        }

        // Kahn's algorithm over the reachable subgraph
        Map<String, Integer> inDegree = new LinkedHashMap<>();
        reachable.forEach(workload -> inDegree.put(workload, 0));
        for (String workload : reachable) {
            for (Edge edge : snapshot.getOrDefault(workload, List.of())) {
                inDegree.merge(edge.requires, 1, Integer::sum);
            }
        }
        List<String> order = new ArrayList<>(reachable.size());
        Deque<String> ready = new ArrayDeque<>();
        inDegree.forEach((workload, degree) -> {
            if (degree == 0) {
                ready.add(workload);
            }
        });
        while (!ready.isEmpty()) {
            String workload = ready.poll();
            order.add(workload);
            for (Edge edge : snapshot.getOrDefault(workload, List.of())) {
                if (inDegree.merge(edge.requires, -1, Integer::sum) == 0) {
                    ready.add(edge.requires);
                }
            }
        }
        return order;
    }

    private Mono<ScalingDirective> apply(ScalingDirective directive) {
        return autoscalerClient.setReplicas(directive.getWorkload(), directive.getToReplicas())
            .retryWhen(retryPolicy.toRetrySpec(RemoteCallErrors::isTransient))
            .then(Mono.fromCallable(() -> {
                decisionHistory.add(directive);
                monitoringService.recordScalingDirective(directive);
                log.info("Scaled {} {} -> {}: {}", directive.getWorkload(),
                    directive.getFromReplicas(), directive.getToReplicas(), directive.getReason());
                return directive;
            }))
            .onErrorResume(e -> {
                log.warn("Failed to scale dependency {} to {}: {}",
                    directive.getWorkload(), directive.getToReplicas(), e.getMessage());
                monitoringService.recordScalingError(directive.getWorkload(), "propagate");
                return Mono.empty();
            });
    }

    private Map<String, List<Edge>> snapshot() {
        lock.readLock().lock();
        try {
            return graph;
        } finally {
            lock.readLock().unlock();
        }
    }

    private void requireWorkload(String workload) {
        if (workload == null || !config.getWorkloads().containsKey(workload)) {
            throw new IllegalArgumentException("Scaling dependency names unknown workload: " + workload);
        }
    }

    /**
     * A cycle in the graph as a path that starts and ends at the same workload,
     * empty when the graph is acyclic
     */
    static List<String> findCycle(Map<String, List<Edge>> graph) {
        Set<String> done = new HashSet<>();
        for (String start : graph.keySet()) {
            List<String> path = new ArrayList<>();
            List<String> cycle = visit(start, graph, path, new HashSet<>(), done);
            if (!cycle.isEmpty()) {
                return cycle;
            }
        }
        return List.of();
    }

    private static List<String> visit(String workload, Map<String, List<Edge>> graph,
                                      List<String> path, Set<String> onPath, Set<String> done) {
        if (onPath.contains(workload)) {
            List<String> cycle = new ArrayList<>(path.subList(path.indexOf(workload), path.size()));
            cycle.add(workload);
            return cycle;
        }
        if (!done.add(workload)) {
            return List.of();
        }
        path.add(workload);
        onPath.add(workload);
        for (Edge edge : graph.getOrDefault(workload, List.of())) {
            List<String> cycle = visit(edge.requires, graph, path, onPath, done);
            if (!cycle.isEmpty()) {
                return cycle;
            }
        }
        onPath.remove(workload);
        path.remove(path.size() - 1);
        return List.of();
    }

    static final class Edge {
        private final String requires;
        private final double ratio;

        Edge(String requires, double ratio) {
            this.requires = requires;
            this.ratio = ratio;
        }
    }
}
