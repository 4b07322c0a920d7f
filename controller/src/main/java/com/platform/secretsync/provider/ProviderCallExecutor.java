package com.platform.secretsync.provider;

import com.platform.secretsync.core.CircuitBreakerManager;
import com.platform.secretsync.core.ProviderRateLimiter;
import com.platform.secretsync.core.RetryEngine;
import com.platform.secretsync.error.ErrorCode;
import com.platform.secretsync.error.ProviderException;
import com.platform.secretsync.observability.MetricsRegistry;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Guard around every provider call: per-provider rate limit, circuit breaker and retry with backoff.
 */
@Slf4j
@Component
public class ProviderCallExecutor {

    private final ProviderRateLimiter rateLimiter;
    private final CircuitBreakerManager circuitBreakers;
    private final RetryEngine retryEngine;
    private final MetricsRegistry metricsRegistry;

    public ProviderCallExecutor(ProviderRateLimiter rateLimiter, CircuitBreakerManager circuitBreakers,
                                RetryEngine retryEngine, MetricsRegistry metricsRegistry) {
        this.rateLimiter = rateLimiter;
        this.circuitBreakers = circuitBreakers;
        this.retryEngine = retryEngine;
        this.metricsRegistry = metricsRegistry;
    }

    public <T> T call(ProviderType provider, String operation, String resource, Supplier<T> call) {
        CircuitBreaker circuitBreaker = circuitBreakers.circuitBreaker(provider);
        return retryEngine.executeWithRetry(operation, provider.id(), () -> {
            rateLimiter.acquire(provider);
            long start = System.currentTimeMillis();
            try {
                T result = circuitBreaker.executeSupplier(call);
                metricsRegistry.recordProviderCall(provider.id(), operation, true, System.currentTimeMillis() - start);
                return result;
            } catch (CallNotPermittedException e) {
                metricsRegistry.recordProviderCall(provider.id(), operation, false, 0);
                throw new ProviderException(ErrorCode.PROVIDER_UNAVAILABLE, provider.id(), resource,
                    "Circuit breaker for " + provider.id() + " is open", e);
            } catch (RuntimeException e) {
                metricsRegistry.recordProviderCall(provider.id(), operation, false, System.currentTimeMillis() - start);
                log.debug("{} {} on {} failed: {}", provider.id(), operation, resource, e.getMessage());
                throw e;
            }
        });
    }

    public void run(ProviderType provider, String operation, String resource, Runnable call) {
        call(provider, operation, resource, () -> {
            call.run();
            return null;
        });
    }
}
