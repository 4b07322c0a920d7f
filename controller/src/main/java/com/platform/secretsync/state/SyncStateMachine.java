package com.platform.secretsync.state;

import com.platform.secretsync.crd.SyncTargetKey;
import com.platform.secretsync.observability.LoggingConfig;
import com.platform.secretsync.observability.MetricsRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.UnaryOperator;

/**
 * Owns the phase of every sync target and validates transitions between phases.
 */
@Slf4j
@Component
public class SyncStateMachine {

    /**
     * Notified after every applied transition.
     */
    @FunctionalInterface
    public interface TransitionListener {
        void onTransition(SyncTargetContext context);
    }

    private static final Map<SyncPhase, Set<SyncPhase>> ALLOWED_TRANSITIONS = Map.of(
        SyncPhase.PENDING, EnumSet.of(SyncPhase.PULLING),
        SyncPhase.PULLING, EnumSet.of(SyncPhase.PARSING),
        SyncPhase.PARSING, EnumSet.of(SyncPhase.DECRYPTING),
        SyncPhase.DECRYPTING, EnumSet.of(SyncPhase.BUILDING_CANONICAL),
        SyncPhase.BUILDING_CANONICAL, EnumSet.of(SyncPhase.DIFFING),
        SyncPhase.DIFFING, EnumSet.of(SyncPhase.APPLYING, SyncPhase.SYNCED),
        SyncPhase.APPLYING, EnumSet.of(SyncPhase.SYNCED),
        SyncPhase.SYNCED, EnumSet.of(SyncPhase.PENDING),
        SyncPhase.ERROR, EnumSet.of(SyncPhase.PENDING)
    );

    private final Map<SyncTargetKey, SyncTargetContext> contexts = new ConcurrentHashMap<>();
    private final List<TransitionListener> listeners = new CopyOnWriteArrayList<>();
    private final MetricsRegistry metricsRegistry;

    public SyncStateMachine(MetricsRegistry metricsRegistry) {
        this.metricsRegistry = metricsRegistry;
    }

    public void addListener(TransitionListener listener) {
        listeners.add(listener);
    }

    public SyncTargetContext initialize(SyncTargetKey target) {
        SyncTargetContext context = SyncTargetContext.initial(target);
        contexts.put(target, context);
        metricsRegistry.setActiveTargets(contexts.size());
        metricsRegistry.recordPhaseTransition(target.toString(), null, SyncPhase.PENDING);
        log.info("Initialized state machine for sync target {}", target);
        return context;
    }

    /**
     * Moves the target to {@code targetPhase}.
     *
     * @throws IllegalStateException if the transition is not allowed
     */
    public SyncTargetContext transition(SyncTargetKey target, SyncPhase targetPhase, String description) {
        return apply(target, current -> {
            if (!isTransitionAllowed(current.phase(), targetPhase)) {
                metricsRegistry.incrementInvalidTransitions(target.toString());
                throw new IllegalStateException(String.format("Invalid phase transition %s -> %s for %s",
                    current.phase(), targetPhase, target));
            }
            return current.withPhase(targetPhase, description);
        });
    }

    /**
     * Moves the target to {@code Error} from any phase.
     */
    public SyncTargetContext fail(SyncTargetKey target, String reason, boolean degraded) {
        return apply(target, current -> current.withFailure(SyncPhase.ERROR, reason, degraded));
    }

    /**
     * Records a transient failure: the target returns to {@code Pending} and is retried in place.
     */
    public SyncTargetContext retry(SyncTargetKey target, String reason, boolean degraded) {
        return apply(target, current -> current.withFailure(SyncPhase.PENDING, reason, degraded));
    }

    public SyncTargetContext succeed(SyncTargetKey target, String description, String revision, String checksum,
                                     int synced) {
        return apply(target, current -> {
            if (!isTransitionAllowed(current.phase(), SyncPhase.SYNCED)) {
                throw new IllegalStateException("Cannot complete a reconcile from " + current.phase());
            }
            return current.withSuccess(description, revision, checksum, synced);
        });
    }

    /**
     * Returns to {@code Pending} from any phase and clears the failure history.
     */
    public SyncTargetContext reset(SyncTargetKey target, String reason) {
        return apply(target, current -> current.reset(reason));
    }

    public SyncTargetContext getContext(SyncTargetKey target) {
        return contexts.get(target);
    }

    public Map<SyncTargetKey, SyncTargetContext> getAll() {
        return Map.copyOf(contexts);
    }

    public void remove(SyncTargetKey target) {
        if (contexts.remove(target) != null) {
            metricsRegistry.setActiveTargets(contexts.size());
            log.info("Removed sync target {} from state machine", target);
        }
    }

    static boolean isTransitionAllowed(SyncPhase from, SyncPhase to) {
        Set<SyncPhase> allowed = ALLOWED_TRANSITIONS.get(from);
        return allowed != null && allowed.contains(to);
    }

    private SyncTargetContext apply(SyncTargetKey target, UnaryOperator<SyncTargetContext> change) {
        SyncTargetContext[] before = new SyncTargetContext[1];
        SyncTargetContext updated = contexts.compute(target, (key, current) -> {
            before[0] = current != null ? current : SyncTargetContext.initial(key);
            return change.apply(before[0]);
        });
        SyncTargetContext previous = before[0];
        metricsRegistry.setActiveTargets(contexts.size());
        if (updated.phase() != previous.phase()) {
            log.info("Phase transition: {} -> {} for {} ({})", previous.phase(), updated.phase(), target,
                updated.description());
            metricsRegistry.recordPhaseTransition(target.toString(), previous.phase(), updated.phase());
        }
        LoggingConfig.setPhase(updated.phase().displayName());
        for (TransitionListener listener : listeners) {
            try {
                listener.onTransition(updated);
            } catch (RuntimeException e) {
                log.error("Transition listener failed for {}: {}", target, e.getMessage(), e);
            }
        }
        return updated;
    }
}
