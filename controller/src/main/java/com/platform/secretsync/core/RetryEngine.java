package com.platform.secretsync.core;

import com.platform.secretsync.error.SecretSyncException;
import com.platform.secretsync.observability.MetricsRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Retry engine with exponential backoff and jitter.
 * Only {@link SecretSyncException}s flagged as retryable are retried; everything else propagates at once.
 */
@Slf4j
@Component
public class RetryEngine {

    private final MetricsRegistry metricsRegistry;
    private final int maxAttempts;
    private final ExponentialBackoff backoff;

    public RetryEngine(
            MetricsRegistry metricsRegistry,
            @Value("${secretsync.retry.max-attempts:5}") int maxAttempts,
            @Value("${secretsync.retry.initial-delay-ms:500}") long initialDelayMs,
            @Value("${secretsync.retry.max-delay-ms:30000}") long maxDelayMs,
            @Value("${secretsync.retry.multiplier:2.0}") double multiplier,
            @Value("${secretsync.retry.jitter-factor:0.2}") double jitterFactor) {
        this.metricsRegistry = metricsRegistry;
        this.maxAttempts = maxAttempts;
        this.backoff = new ExponentialBackoff(
            Duration.ofMillis(initialDelayMs), Duration.ofMillis(maxDelayMs), multiplier, jitterFactor);
    }

    /**
     * Execute an operation with retry logic.
     */
    public <T> T executeWithRetry(String operationName, String system, Supplier<T> operation) {
        int attempt = 0;

        while (true) {
            try {
                T result = operation.get();
                if (attempt > 0) {
                    log.info("{}.{} succeeded after {} attempts", system, operationName, attempt + 1);
                }
                return result;

            } catch (SecretSyncException e) {
                attempt++;
                if (!e.isRetryable()) {
                    throw e;
                }

                metricsRegistry.recordRetryAttempt(system, attempt);
                log.warn("{}.{} failed (attempt {}/{}): {}",
                    system, operationName, attempt, maxAttempts, e.getMessage());

                if (attempt >= maxAttempts) {
                    log.error("{}.{} failed after {} attempts", system, operationName, maxAttempts);
                    throw e;
                }

                Duration delay = backoff.delayFor(attempt);
                log.debug("Retrying in {}ms", delay.toMillis());
                sleep(delay);
            }
        }
    }

    /**
     * Execute an operation with retry logic (void return).
     */
    public void executeWithRetry(String operationName, String system, Runnable operation) {
        executeWithRetry(operationName, system, () -> {
            operation.run();
            return null;
        });
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    protected void sleep(Duration delay) {
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Retry interrupted", ie);
        }
    }
}
