package com.whereq.coordinator.model;

/**
 * Known contributors to a quality assessment.
 * EXTENSION covers factors contributed by pluggable providers.
 */
public enum QualityFactorKind {
    INPUT_COMPLEXITY,
    RESOURCE_AVAILABILITY,
    SUBSCRIPTION,
    HISTORY,
    PREFERENCE,
    REQUESTED,
    EXTENSION
}
