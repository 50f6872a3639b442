package com.whereq.coordinator.exception;

import lombok.Getter;

import java.util.List;

/**
 * Scaling dependency configuration is not a DAG
 */
@Getter
public class DependencyCycleException extends CoordinatorException {

    private final List<String> cycle;

    public DependencyCycleException(List<String> cycle) {
        super("Scaling dependency cycle: " + String.join(" -> ", cycle));
        this.cycle = List.copyOf(cycle);
    }
}
