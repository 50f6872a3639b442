package com.whereq.coordinator.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import reactor.util.retry.Retry;
import reactor.util.retry.RetryBackoffSpec;

import java.io.Serializable;
import java.time.Duration;
import java.util.function.Predicate;

/**
 * Retry policy for calls to the execution engine and the autoscaling API
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RetryPolicy implements Serializable {
    private static final long serialVersionUID = 1L;

    /**
     * Total attempts including the first call
     */
    @Builder.Default
    private int maxAttempts = 3;

    /**
     * Initial backoff interval in milliseconds, doubled per retry
     */
    @Builder.Default
    private long initialIntervalMs = 500;

    /**
     * Maximum backoff interval in milliseconds
     */
    @Builder.Default
    private long maxIntervalMs = 10000;

    /**
     * Random jitter applied to each backoff, 0 - 1
     */
    @Builder.Default
    private double jitterFactor = 0.5;

    /**
     * Get default retry policy
     */
    public static RetryPolicy defaultPolicy() {
        return RetryPolicy.builder().build();
    }

    /**
     * Reactor retry spec for this policy. Exhaustion rethrows the last failure
     * so callers see the original cause.
     *
     * @param retryable which failures are worth another attempt
     */
    public RetryBackoffSpec toRetrySpec(Predicate<Throwable> retryable) {
        return Retry.backoff(Math.max(0, maxAttempts - 1), Duration.ofMillis(initialIntervalMs))
            .maxBackoff(Duration.ofMillis(maxIntervalMs))
            .jitter(jitterFactor)
            .filter(retryable)
            .onRetryExhaustedThrow((spec, signal) -> signal.failure());
    }
}
