package com.platform.secretsync.core;

import com.platform.secretsync.observability.MetricsRegistry;
import com.platform.secretsync.provider.ProviderType;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;

/**
 * One circuit breaker per provider type, shared by every sync target using that provider.
 */
@Slf4j
@Component
public class CircuitBreakerManager {

    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final MetricsRegistry metricsRegistry;

    public CircuitBreakerManager(CircuitBreakerRegistry circuitBreakerRegistry, MetricsRegistry metricsRegistry) {
        this.circuitBreakerRegistry = circuitBreakerRegistry;
        this.metricsRegistry = metricsRegistry;
    }

    @PostConstruct
    public void init() {
        for (ProviderType provider : ProviderType.values()) {
            registerEventListeners(circuitBreaker(provider), provider.id());
        }
        log.info("CircuitBreakerManager initialized");
    }

    private void registerEventListeners(CircuitBreaker circuitBreaker, String provider) {
        circuitBreaker.getEventPublisher()
            .onStateTransition(event -> {
                String fromState = event.getStateTransition().getFromState().name();
                String toState = event.getStateTransition().getToState().name();

                log.info("Circuit breaker {} state change: {} -> {}", provider, fromState, toState);
                metricsRegistry.recordCircuitBreakerStateChange(provider, toState);
            })
            .onError(event -> log.debug("Circuit breaker {} recorded error: {}",
                provider, event.getThrowable().getMessage()));
    }

    public CircuitBreaker circuitBreaker(ProviderType provider) {
        return circuitBreakerRegistry.circuitBreaker(provider.id());
    }

    public String getState(ProviderType provider) {
        return circuitBreaker(provider).getState().name();
    }

    public Map<ProviderType, String> getAllStates() {
        Map<ProviderType, String> states = new EnumMap<>(ProviderType.class);
        for (ProviderType provider : ProviderType.values()) {
            states.put(provider, getState(provider));
        }
        return states;
    }

    public void reset(ProviderType provider) {
        circuitBreaker(provider).reset();
        log.info("Reset circuit breaker {}", provider.id());
    }
}
