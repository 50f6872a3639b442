package com.whereq.coordinator.cluster;

import com.fasterxml.jackson.databind.JsonNode;
import com.whereq.coordinator.config.CoordinatorProperties;
import com.whereq.coordinator.exception.RemoteCallErrors;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Scales deployments through the scale subresource and reads their HPAs
 */
@Slf4j
@Component
public class KubernetesAutoscalerClient implements AutoscalerClient {

    private static final String TARGET = "autoscaling api";
    private static final MediaType MERGE_PATCH = MediaType.valueOf("application/merge-patch+json");

    private final WebClient webClient;
    private final CircuitBreaker circuitBreaker;
    private final Duration timeout;
    private final String namespace;

    public KubernetesAutoscalerClient(@Qualifier("clusterWebClient") WebClient webClient,
                                      @Qualifier("clusterCircuitBreaker") CircuitBreaker circuitBreaker,
                                      CoordinatorProperties properties) {
        this.webClient = webClient;
        this.circuitBreaker = circuitBreaker;
        this.timeout = properties.getCluster().getTimeout();
        this.namespace = properties.getCluster().getNamespace();
    }

    @Override
    public Mono<WorkloadScale> getScale(String workload) {
        return webClient.get()
            .uri("/apis/apps/v1/namespaces/{namespace}/deployments/{name}/scale", namespace, workload)
            .retrieve()
            .bodyToMono(JsonNode.class)
            .map(scale -> WorkloadScale.builder()
                .workload(workload)
                .currentReplicas(scale.path("status").path("replicas").asInt(0))
                .desiredReplicas(scale.path("spec").path("replicas").asInt(0))
                .build())
            .transform(RemoteCallErrors.guard(TARGET, timeout, circuitBreaker));
    }

    @Override
    public Mono<Void> setReplicas(String workload, int replicas) {
        Map<String, Object> patch = Map.of("spec", Map.of("replicas", replicas));
        return webClient.patch()
            .uri("/apis/apps/v1/namespaces/{namespace}/deployments/{name}/scale", namespace, workload)
            .contentType(MERGE_PATCH)
            .bodyValue(patch)
            .retrieve()
            .toBodilessEntity()
            .then()
            .transform(RemoteCallErrors.guard(TARGET, timeout, circuitBreaker))
            .doOnSuccess(v -> log.info("Set {} replicas to {}", workload, replicas));
    }

    @Override
    public Mono<HpaStatus> getHpaStatus(String workload) {
        return webClient.get()
            .uri("/apis/autoscaling/v2/namespaces/{namespace}/horizontalpodautoscalers/{name}",
                namespace, workload + "-hpa")
            .retrieve()
            .bodyToMono(JsonNode.class)
            .map(hpa -> parseHpa(workload, hpa))
            .transform(RemoteCallErrors.guard(TARGET, timeout, circuitBreaker));
    }

    private HpaStatus parseHpa(String workload, JsonNode hpa) {
        JsonNode spec = hpa.path("spec");
        JsonNode status = hpa.path("status");

        HpaStatus result = HpaStatus.builder()
            .workload(workload)
            .currentReplicas(status.path("currentReplicas").asInt(0))
            .desiredReplicas(status.path("desiredReplicas").asInt(0))
            .minReplicas(spec.path("minReplicas").asInt(1))
            .maxReplicas(spec.path("maxReplicas").asInt(0))
            .build();

        for (JsonNode condition : status.path("conditions")) {
            if ("ScalingLimited".equals(condition.path("type").asText())
                    && "True".equals(condition.path("status").asText())) {
                result.setScalingLimited(true);
                result.setLimitedReason(condition.path("reason").asText(null));
            }
        }

        Map<String, Double> targets = new HashMap<>();
        for (JsonNode metric : spec.path("metrics")) {
            JsonNode source = metricSource(metric);
            targets.put(metricName(metric, source), number(source.path("target")));
        }
        Map<String, HpaStatus.MetricValue> values = new LinkedHashMap<>();
        for (JsonNode metric : status.path("currentMetrics")) {
            JsonNode source = metricSource(metric);
            String name = metricName(metric, source);
            values.put(name, new HpaStatus.MetricValue(name, number(source.path("current")), targets.get(name)));
        }
        targets.forEach((name, target) -> values.putIfAbsent(name, new HpaStatus.MetricValue(name, null, target)));
        result.getMetrics().addAll(values.values());
        return result;
    }

    private static JsonNode metricSource(JsonNode metric) {
        String type = metric.path("type").asText("Resource");
        // "Resource" → "resource", "ContainerResource" → "containerResource"
        return metric.path(Character.toLowerCase(type.charAt(0)) + type.substring(1));
    }

    private static String metricName(JsonNode metric, JsonNode source) {
        JsonNode name = source.path("name");
        if (name.isMissingNode()) {
            name = source.path("metric").path("name");
        }
        return name.asText(metric.path("type").asText("unknown"));
    }

    private static Double number(JsonNode value) {
        for (String field : new String[]{"averageUtilization", "averageValue", "value"}) {
            JsonNode node = value.path(field);
            if (!node.isMissingNode() && !node.isNull()) {
                if (node.isNumber()) {
                    return node.asDouble();
                }
                try {
                    return Double.parseDouble(node.asText().replaceAll("[^0-9.]", ""));
                } catch (NumberFormatException e) {
                    return null;
                }
            }
        }
        return null;
    }
}
