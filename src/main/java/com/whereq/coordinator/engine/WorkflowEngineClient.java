package com.whereq.coordinator.engine;

import com.fasterxml.jackson.databind.node.ObjectNode;
import reactor.core.publisher.Mono;

/**
 * Execution engine that runs workflow manifests
 */
public interface WorkflowEngineClient {
    /**
     * Submit a workflow manifest
     *
     * @param manifest declarative workflow
     * @return Mono with the engine's name for the workflow
     */
    Mono<String> submit(ObjectNode manifest);

    /**
     * Read the current phase, progress and nodes of a workflow
     *
     * @param name engine workflow name
     * @return Mono with the observation
     */
    Mono<EngineObservation> getWorkflow(String name);

    /**
     * Stop a running workflow
     *
     * @param name engine workflow name
     * @return Mono that completes when the engine accepted the request
     */
    Mono<Void> terminate(String name);
}
