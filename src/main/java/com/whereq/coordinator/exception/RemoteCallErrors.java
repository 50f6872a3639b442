package com.whereq.coordinator.exception;

import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.reactor.circuitbreaker.operator.CircuitBreakerOperator;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Maps failures of outbound HTTP calls onto the coordinator's exception taxonomy.
 */
public final class RemoteCallErrors {

    private RemoteCallErrors() {
    }

    /**
     * 5xx, 429, I/O and timeouts are transient; other 4xx are rejections.
     */
    public static Throwable classify(String target, Throwable error) {
        if (error instanceof CoordinatorException) {
            return error;
        }
        if (error instanceof WebClientResponseException response) {
            int status = response.getStatusCode().value();
            if (status >= 500 || status == 429) {
                return new TransientInfraException(target + " returned " + status, error);
            }
            return new EngineRejectedException(target + " rejected the call with " + status
                + ": " + response.getStatusText(), status);
        }
        if (error instanceof WebClientRequestException
                || error instanceof TimeoutException
                || error instanceof IOException) {
            return new TransientInfraException(target + " unreachable: " + error.getMessage(), error);
        }
        return error;
    }

    public static boolean isTransient(Throwable error) {
        return error instanceof TransientInfraException;
    }

    /**
     * Apply timeout, error classification and the circuit breaker to a remote call.
     * An open circuit surfaces as {@link TransientInfraException}.
     */
    public static <T> Function<Mono<T>, Mono<T>> guard(String target, Duration timeout, CircuitBreaker circuitBreaker) {
        return call -> call
            .timeout(timeout)
            .onErrorMap(e -> classify(target, e))
            .transformDeferred(CircuitBreakerOperator.of(circuitBreaker))
            .onErrorMap(CallNotPermittedException.class,
                e -> new TransientInfraException(target + " circuit open", e));
    }
}
