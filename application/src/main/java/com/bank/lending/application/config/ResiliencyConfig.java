package com.bank.lending.application.config;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Resiliency configuration
 * Circuit breaker, retry and timeout for the geolocation lookup
 */
@Configuration
public class ResiliencyConfig {

    /**
     * Circuit breaker registry
     */
    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry() {
        return CircuitBreakerRegistry.ofDefaults();
    }

    /**
     * Retry registry
     */
    @Bean
    public RetryRegistry retryRegistry() {
        return RetryRegistry.ofDefaults();
    }

    /**
     * Time limiter registry
     */
    @Bean
    public TimeLimiterRegistry timeLimiterRegistry() {
        return TimeLimiterRegistry.ofDefaults();
    }

    /**
     * Circuit breaker for the IP geolocation provider.
     * The free tier rate-limits aggressively, so the breaker opens quickly and stays open a while.
     */
    @Bean("geolocationCircuitBreaker")
    public CircuitBreaker geolocationCircuitBreaker(CircuitBreakerRegistry registry) {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .failureRateThreshold(50.0f) // Open after 50% failures
                .waitDurationInOpenState(Duration.ofMinutes(2))
                .slidingWindowSize(10) // Last 10 calls
                .minimumNumberOfCalls(5)
                .permittedNumberOfCallsInHalfOpenState(2)
                .automaticTransitionFromOpenToHalfOpenEnabled(true)
                .recordExceptions(Exception.class)
                .build();

        return registry.circuitBreaker("geolocation", config);
    }

    /**
     * Single retry for transient geolocation failures
     */
    @Bean("geolocationRetry")
    public Retry geolocationRetry(RetryRegistry registry) {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(2)
                .waitDuration(Duration.ofMillis(200))
                .retryExceptions(IllegalStateException.class)
                .build();

        return registry.retry("geolocation", config);
    }

    /**
     * Time limiter for the whole geolocation lookup, retries included
     */
    @Bean("geolocationTimeLimiter")
    public TimeLimiter geolocationTimeLimiter(
            TimeLimiterRegistry registry,
            @Value("${app.geolocation.timeout:2s}") Duration timeout) {
        TimeLimiterConfig config = TimeLimiterConfig.custom()
                .timeoutDuration(timeout)
                .cancelRunningFuture(true)
                .build();

        return registry.timeLimiter("geolocation", config);
    }
}
