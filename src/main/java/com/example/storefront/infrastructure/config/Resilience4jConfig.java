package com.example.storefront.infrastructure.config;

import com.example.storefront.domain.exception.PaymentProcessorException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Resilience4j setup for the payment processor.
 * Transient failures are retried once; a failing processor opens the breaker.
 */
@Configuration
public class Resilience4jConfig {

    public static final String PAYMENT_PROCESSOR = "payment-processor";

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry() {
        CircuitBreakerConfig circuitBreakerConfig = CircuitBreakerConfig.custom()
                .failureRateThreshold(50)
                .waitDurationInOpenState(Duration.ofSeconds(30))
                .permittedNumberOfCallsInHalfOpenState(3)
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(10)
                .minimumNumberOfCalls(5)
                .automaticTransitionFromOpenToHalfOpenEnabled(true)
                // only transient failures count toward opening the breaker
                .recordException(e -> !(e instanceof PaymentProcessorException p) || p.isTransientFailure())
                .build();

        return CircuitBreakerRegistry.of(circuitBreakerConfig);
    }

    @Bean
    public CircuitBreaker paymentProcessorCircuitBreaker(CircuitBreakerRegistry circuitBreakerRegistry) {
        return circuitBreakerRegistry.circuitBreaker(PAYMENT_PROCESSOR);
    }

    @Bean
    public RetryRegistry retryRegistry() {
        RetryConfig retryConfig = RetryConfig.custom()
                .maxAttempts(2)
                .waitDuration(Duration.ofMillis(500))
                .retryOnException(e -> e instanceof PaymentProcessorException p && p.isTransientFailure())
                .build();

        return RetryRegistry.of(retryConfig);
    }

    @Bean
    public Retry paymentProcessorRetry(RetryRegistry retryRegistry) {
        return retryRegistry.retry(PAYMENT_PROCESSOR);
    }
}
