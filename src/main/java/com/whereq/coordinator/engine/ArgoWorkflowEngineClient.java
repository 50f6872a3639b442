package com.whereq.coordinator.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.whereq.coordinator.config.CoordinatorProperties;
import com.whereq.coordinator.exception.RemoteCallErrors;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;

/**
 * Argo Workflows server REST client
 */
@Slf4j
@Component
public class ArgoWorkflowEngineClient implements WorkflowEngineClient {

    private static final String TARGET = "workflow engine";

    private final WebClient webClient;
    private final CircuitBreaker circuitBreaker;
    private final ObjectMapper objectMapper;
    private final ArgoStatusMapper statusMapper;
    private final String namespace;
    private final Duration timeout;

    public ArgoWorkflowEngineClient(@Qualifier("engineWebClient") WebClient webClient,
                                    @Qualifier("engineCircuitBreaker") CircuitBreaker circuitBreaker,
                                    ObjectMapper objectMapper,
                                    CoordinatorProperties properties,
                                    Clock clock) {
        this.webClient = webClient;
        this.circuitBreaker = circuitBreaker;
        this.objectMapper = objectMapper;
        this.statusMapper = new ArgoStatusMapper(clock);
        this.namespace = properties.getEngine().getNamespace();
        this.timeout = properties.getEngine().getTimeout();
    }

    @Override
    public Mono<String> submit(ObjectNode manifest) {
        ObjectNode body = objectMapper.createObjectNode();
        body.set("workflow", manifest);

        return webClient.post()
            .uri("/api/v1/workflows/{namespace}", namespace)
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(body)
            .retrieve()
            .bodyToMono(JsonNode.class)
            .map(created -> created.path("metadata").path("name").asText(
                manifest.path("metadata").path("name").asText()))
            .transform(RemoteCallErrors.guard(TARGET, timeout, circuitBreaker))
            .doOnSuccess(name -> log.info("Submitted workflow {} to namespace {}", name, namespace));
    }

    @Override
    public Mono<EngineObservation> getWorkflow(String name) {
        return webClient.get()
            .uri("/api/v1/workflows/{namespace}/{name}", namespace, name)
            .retrieve()
            .bodyToMono(JsonNode.class)
            .map(statusMapper::toObservation)
            .transform(RemoteCallErrors.guard(TARGET, timeout, circuitBreaker));
    }

    @Override
    public Mono<Void> terminate(String name) {
        return webClient.put()
            .uri("/api/v1/workflows/{namespace}/{name}/terminate", namespace, name)
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(objectMapper.createObjectNode().put("name", name).put("namespace", namespace))
            .retrieve()
            .toBodilessEntity()
            .then()
            .transform(RemoteCallErrors.guard(TARGET, timeout, circuitBreaker))
            .doOnSuccess(v -> log.info("Terminated workflow {}", name));
    }
}
