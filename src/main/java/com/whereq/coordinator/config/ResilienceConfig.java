package com.whereq.coordinator.config;

import com.whereq.coordinator.exception.TransientInfraException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig.SlidingWindowType;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

/**
 * Circuit breakers guarding outbound calls, so a slow engine or autoscaler
 * fails fast instead of tying up request and tick threads.
 */
@Configuration
public class ResilienceConfig {

    @Bean
    @Qualifier("engineCircuitBreaker")
    public CircuitBreaker engineCircuitBreaker() {
        return CircuitBreaker.of("engine", breakerConfig());
    }

    @Bean
    @Qualifier("clusterCircuitBreaker")
    public CircuitBreaker clusterCircuitBreaker() {
        return CircuitBreaker.of("cluster", breakerConfig());
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    private CircuitBreakerConfig breakerConfig() {
        // Only infrastructure failures count; engine rejections (4xx) are the caller's fault
        return CircuitBreakerConfig.custom()
            .failureRateThreshold(50.0f)
            .slidingWindowType(SlidingWindowType.COUNT_BASED)
            .slidingWindowSize(20)
            .minimumNumberOfCalls(10)
            .waitDurationInOpenState(Duration.ofSeconds(30))
            .recordException(ex -> ex instanceof TransientInfraException)
            .build();
    }
}
