package com.whereq.coordinator.cluster;

import com.fasterxml.jackson.databind.JsonNode;
import com.whereq.coordinator.config.CoordinatorProperties;
import com.whereq.coordinator.exception.EngineRejectedException;
import com.whereq.coordinator.exception.RemoteCallErrors;
import com.whereq.coordinator.model.NodeMetrics;
import com.whereq.coordinator.resource.QuantityParser;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Kubernetes core and metrics API client for node capacity and usage
 */
@Slf4j
@Component
public class KubernetesClusterClient implements ClusterClient {

    private static final String TARGET = "kubernetes api";

    private final WebClient webClient;
    private final CircuitBreaker circuitBreaker;
    private final Duration timeout;
    private final String gpuResourceName;

    public KubernetesClusterClient(@Qualifier("clusterWebClient") WebClient webClient,
                                   @Qualifier("clusterCircuitBreaker") CircuitBreaker circuitBreaker,
                                   CoordinatorProperties properties) {
        this.webClient = webClient;
        this.circuitBreaker = circuitBreaker;
        this.timeout = properties.getCluster().getTimeout();
        this.gpuResourceName = properties.getCluster().getGpuResourceName();
    }

    @Override
    public Mono<List<NodeMetrics>> getNodeMetrics() {
        Mono<JsonNode> nodes = get("/api/v1/nodes");
        // metrics-server may be missing; nodes then report zero usage
        Mono<Map<String, JsonNode>> usage = get("/apis/metrics.k8s.io/v1beta1/nodes")
            .map(this::usageByNode)
            .onErrorResume(EngineRejectedException.class, e -> {
                log.warn("Node metrics API unavailable: {}", e.getMessage());
                return Mono.just(Map.of());
            });

        return Mono.zip(nodes, usage)
            .map(tuple -> parseNodes(tuple.getT1(), tuple.getT2()));
    }

    private Mono<JsonNode> get(String path) {
        return webClient.get()
            .uri(path)
            .retrieve()
            .bodyToMono(JsonNode.class)
            .transform(RemoteCallErrors.guard(TARGET, timeout, circuitBreaker));
    }

    private Map<String, JsonNode> usageByNode(JsonNode metrics) {
        Map<String, JsonNode> usage = new HashMap<>();
        for (JsonNode item : metrics.path("items")) {
            usage.put(item.path("metadata").path("name").asText(), item.path("usage"));
        }
        return usage;
    }

    private List<NodeMetrics> parseNodes(JsonNode nodeList, Map<String, JsonNode> usage) {
        List<NodeMetrics> result = new ArrayList<>();
        for (JsonNode node : nodeList.path("items")) {
            String name = node.path("metadata").path("name").asText();
            try {
                JsonNode capacity = node.path("status").path("allocatable");
                if (capacity.isMissingNode() || capacity.isEmpty()) {
                    capacity = node.path("status").path("capacity");
                }
                JsonNode nodeUsage = usage.get(name);

                Map<String, String> labels = new LinkedHashMap<>();
                node.path("metadata").path("labels").fields()
                    .forEachRemaining(label -> labels.put(label.getKey(), label.getValue().asText()));

                result.add(NodeMetrics.builder()
                    .name(name)
                    .labels(labels)
                    .cpuCapacityMillis(QuantityParser.parseCpuMillis(capacity.path("cpu").asText("0")))
                    .memoryCapacityBytes(QuantityParser.parseMemoryBytes(capacity.path("memory").asText("0")))
                    .gpuCapacity(capacity.path(gpuResourceName).asInt(0))
                    .cpuUsageMillis(nodeUsage != null ? QuantityParser.parseCpuMillis(nodeUsage.path("cpu").asText("0")) : 0)
                    .memoryUsageBytes(nodeUsage != null ? QuantityParser.parseMemoryBytes(nodeUsage.path("memory").asText("0")) : 0)
                    .ready(isReady(node))
                    .build());
            } catch (IllegalArgumentException e) {
                log.warn("Skipping node {} with unparseable quantities: {}", name, e.getMessage());
            }
        }
        return result;
    }

    private static boolean isReady(JsonNode node) {
        for (JsonNode condition : node.path("status").path("conditions")) {
            if ("Ready".equals(condition.path("type").asText())) {
                return "True".equals(condition.path("status").asText());
            }
        }
        return false;
    }
}
