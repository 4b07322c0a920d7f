package com.platform.secretsync.core;

import com.platform.secretsync.config.SecretSyncProperties;
import com.platform.secretsync.provider.ProviderType;
import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.Refill;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Token bucket per provider type. Every provider call of every sync target draws from the same
 * bucket so that concurrent reconciles cannot trip account-wide throttling.
 */
@Slf4j
@Component
public class ProviderRateLimiter {

    private final SecretSyncProperties properties;
    private final Map<ProviderType, Bucket> buckets = new ConcurrentHashMap<>();

    public ProviderRateLimiter(SecretSyncProperties properties) {
        this.properties = properties;
    }

    /**
     * Blocks until a permit for the provider is available.
     */
    public void acquire(ProviderType provider) {
        try {
            resolveBucket(provider).asBlocking().consume(1);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted waiting for " + provider.id() + " rate limit", e);
        }
    }

    public long availablePermits(ProviderType provider) {
        return resolveBucket(provider).getAvailableTokens();
    }

    private Bucket resolveBucket(ProviderType provider) {
        return buckets.computeIfAbsent(provider, this::createBucket);
    }

    private Bucket createBucket(ProviderType provider) {
        SecretSyncProperties.RateLimit limit = properties.getProviders().rateLimit(provider);
        log.info("Rate limit for {}: {} calls/s, burst {}", provider.id(), limit.getPermitsPerSecond(), limit.getBurst());

        Bandwidth bandwidth = Bandwidth.classic(
            limit.getBurst(),
            Refill.greedy(limit.getPermitsPerSecond(), Duration.ofSeconds(1))
        );
        return Bucket.builder()
            .addLimit(bandwidth)
            .build();
    }
}
