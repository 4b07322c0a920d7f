package com.platform.secretsync.core;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Capped exponential backoff with symmetric jitter.
 */
public record ExponentialBackoff(Duration initialDelay, Duration maxDelay, double multiplier, double jitterFactor) {

    public ExponentialBackoff {
        if (initialDelay.isNegative() || initialDelay.isZero()) {
            throw new IllegalArgumentException("initialDelay must be positive");
        }
        if (maxDelay.compareTo(initialDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must not be smaller than initialDelay");
        }
    }

    /**
     * Base delay for the given attempt (1-based) without jitter.
     */
    public long baseDelayMillis(int attempt) {
        double exponentialDelay = initialDelay.toMillis() * Math.pow(multiplier, Math.max(0, attempt - 1));
        return (long) Math.min(exponentialDelay, (double) maxDelay.toMillis());
    }

    /**
     * Delay for the given attempt with jitter applied, never below the initial delay
     * and never above the cap.
     */
    public Duration delayFor(int attempt) {
        long baseDelay = baseDelayMillis(attempt);
        long jitter = (long) (baseDelay * jitterFactor * ThreadLocalRandom.current().nextDouble());

        long delay;
        if (ThreadLocalRandom.current().nextBoolean()) {
            delay = Math.min(baseDelay + jitter, maxDelay.toMillis());
        } else {
            delay = Math.max(initialDelay.toMillis(), baseDelay - jitter);
        }
        return Duration.ofMillis(delay);
    }
}
