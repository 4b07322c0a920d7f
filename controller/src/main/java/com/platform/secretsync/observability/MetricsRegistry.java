package com.platform.secretsync.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Central registry for controller metrics.
 */
@Slf4j
@Component
public class MetricsRegistry {

    private final MeterRegistry meterRegistry;
    private final Map<String, Counter> counters;
    private final Map<String, Timer> timers;
    private final Map<String, AtomicInteger> gaugeValues;

    public MetricsRegistry(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.counters = new ConcurrentHashMap<>();
        this.timers = new ConcurrentHashMap<>();
        this.gaugeValues = new ConcurrentHashMap<>();

        Gauge.builder("secretsync.targets.active", () -> gauge("targets.active").get())
            .register(meterRegistry);
        log.info("Metrics registry initialized");
    }

    /**
     * Increment a counter.
     */
    public void incrementCounter(String name) {
        counters.computeIfAbsent(name, k ->
            Counter.builder(name)
                .register(meterRegistry))
            .increment();
    }

    /**
     * Increment a counter with tags.
     */
    public void incrementCounter(String name, String... tags) {
        String key = name + String.join(".", tags);
        counters.computeIfAbsent(key, k ->
            Counter.builder(name)
                .tags(tags)
                .register(meterRegistry))
            .increment();
    }

    /**
     * Record the outcome and duration of one reconcile.
     */
    public void recordReconcile(String target, String outcome, Duration duration) {
        incrementCounter("secretsync.reconcile.total", "target", target, "outcome", outcome);
        timers.computeIfAbsent(target, k ->
            Timer.builder("secretsync.reconcile.duration")
                .tag("target", target)
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry))
            .record(duration);
    }

    /**
     * Record a phase transition.
     */
    public void recordPhaseTransition(String target, Object fromPhase, Object toPhase) {
        String from = fromPhase != null ? fromPhase.toString() : "null";
        String to = toPhase != null ? toPhase.toString() : "unknown";

        incrementCounter("secretsync.phase.transition",
            "target", target,
            "from", from,
            "to", to);

        log.debug("Recorded phase transition for {}: {} -> {}", target, from, to);
    }

    public void incrementInvalidTransitions(String target) {
        incrementCounter("secretsync.phase.transition.invalid", "target", target);
    }

    /**
     * Record a provider API call.
     */
    public void recordProviderCall(String provider, String operation, boolean success, long latencyMs) {
        incrementCounter("secretsync.provider.calls",
            "provider", provider, "operation", operation, "success", String.valueOf(success));
        timers.computeIfAbsent(provider + "." + operation, k ->
            Timer.builder("secretsync.provider.latency")
                .tag("provider", provider)
                .tag("operation", operation)
                .register(meterRegistry))
            .record(Duration.ofMillis(latencyMs));
    }

    public void recordRetryAttempt(String provider, int attemptNumber) {
        incrementCounter("secretsync.provider.retry",
            "provider", provider, "attempt", String.valueOf(attemptNumber));
    }

    public void recordCircuitBreakerStateChange(String provider, String state) {
        incrementCounter("secretsync.circuitbreaker.state", "provider", provider, "state", state);
    }

    public void recordSecretWrite(String provider, String action) {
        incrementCounter("secretsync.secrets.written", "provider", provider, "action", action);
    }

    public void recordDrift(String target, String driftType) {
        incrementCounter("secretsync.drift.detected", "target", target, "type", driftType);
    }

    public void recordDecryptionFailure(String target) {
        incrementCounter("secretsync.decryption.failures", "target", target);
    }

    public void setActiveTargets(int count) {
        gauge("targets.active").set(count);
    }

    private AtomicInteger gauge(String name) {
        return gaugeValues.computeIfAbsent(name, k -> new AtomicInteger(0));
    }
}
