package com.platform.secretsync.reconcile;

import com.platform.secretsync.config.SecretSyncProperties;
import com.platform.secretsync.core.ExponentialBackoff;
import com.platform.secretsync.crd.SecretManagerConfig;
import com.platform.secretsync.crd.SyncTargetKey;
import com.platform.secretsync.error.SecretSyncException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.function.Predicate;

/**
 * Runs one reconcile task per sync target on a shared worker pool. Each target has at most one
 * run in flight; wake-ups arriving meanwhile collapse into a single follow-up run.
 */
@Slf4j
@Component
public class ReconcileScheduler {

    public enum WakeReason {
        CREATED,
        SPEC_CHANGED,
        SOURCE_CHANGED,
        CREDENTIAL_CHANGED,
        MANUAL,
        TIMER
    }

    private final TaskScheduler taskScheduler;
    private final ReconciliationEngine engine;
    private final SyncTargetValidator validator;
    private final ExponentialBackoff backoff;
    private final Map<SyncTargetKey, TargetTask> tasks = new ConcurrentHashMap<>();
    private volatile boolean accepting = true;

    public ReconcileScheduler(TaskScheduler reconcileScheduler, ReconciliationEngine engine,
                              SyncTargetValidator validator, SecretSyncProperties properties) {
        this.taskScheduler = reconcileScheduler;
        this.engine = engine;
        this.validator = validator;
        SecretSyncProperties.Reconciler settings = properties.getReconciler();
        this.backoff = new ExponentialBackoff(settings.getInitialBackoff(), settings.getMaxBackoff(), 2.0, 0.1);
    }

    /**
     * Mutable per target scheduling state, guarded by the task's monitor.
     */
    private static final class TargetTask {
        final SyncTargetKey key;
        SecretManagerConfig resource;
        Long generation;
        String reconcileRequest;
        ScheduledFuture<?> future;
        CancellationToken token = new CancellationToken();
        boolean running;
        boolean rerunRequested;
        boolean pullRequested = true;
        boolean removed;
        int failures;
        Instant lastPull;

        TargetTask(SyncTargetKey key) {
            this.key = key;
        }
    }

    /**
     * Registers a new or changed sync target. A new generation or reconcile annotation wakes it up.
     */
    public void upsert(SecretManagerConfig resource) {
        SyncTargetKey key = SyncTargetKey.of(resource);
        TargetTask task = tasks.computeIfAbsent(key, TargetTask::new);
        WakeReason reason = null;
        synchronized (task) {
            Long generation = resource.getMetadata().getGeneration();
            String request = resource.reconcileRequest();
            if (task.resource == null) {
                reason = WakeReason.CREATED;
            } else if (!Objects.equals(task.generation, generation)) {
                reason = WakeReason.SPEC_CHANGED;
                task.failures = 0;
            } else if (request != null && !request.equals(task.reconcileRequest)) {
                reason = WakeReason.MANUAL;
            }
            task.resource = resource;
            task.generation = generation;
            task.reconcileRequest = request;
        }
        if (reason != null) {
            wake(key, reason);
        }
    }

    /**
     * Cancels the target's task at its next checkpoint and forgets the target.
     */
    public void remove(SyncTargetKey key) {
        TargetTask task = tasks.remove(key);
        if (task == null) {
            return;
        }
        boolean forgetNow;
        synchronized (task) {
            task.removed = true;
            task.token.cancel();
            if (task.future != null) {
                task.future.cancel(false);
            }
            forgetNow = !task.running;
        }
        if (forgetNow) {
            engine.forget(key);
        }
        log.info("Sync target {} removed", key);
    }

    /**
     * Requests a reconcile as soon as possible.
     *
     * @return false if the target is unknown
     */
    public boolean wake(SyncTargetKey key, WakeReason reason) {
        TargetTask task = tasks.get(key);
        if (task == null || !accepting) {
            return false;
        }
        synchronized (task) {
            if (reason != WakeReason.TIMER && reason != WakeReason.CREDENTIAL_CHANGED) {
                task.pullRequested = true;
            }
            if (task.running) {
                task.rerunRequested = true;
                log.debug("Reconcile of {} in flight, queued follow-up ({})", key, reason);
                return true;
            }
            schedule(task, Duration.ZERO);
        }
        log.debug("Woke {} ({})", key, reason);
        return true;
    }

    public Set<SyncTargetKey> knownTargets() {
        return Set.copyOf(tasks.keySet());
    }

    /**
     * Targets whose current resource matches the predicate.
     */
    public Set<SyncTargetKey> targetsMatching(Predicate<SecretManagerConfig> predicate) {
        Set<SyncTargetKey> matches = new HashSet<>();
        tasks.forEach((key, task) -> {
            SecretManagerConfig resource;
            synchronized (task) {
                resource = task.resource;
            }
            if (resource != null && predicate.test(resource)) {
                matches.add(key);
            }
        });
        return matches;
    }

    public boolean isRunning(SyncTargetKey key) {
        TargetTask task = tasks.get(key);
        if (task == null) {
            return false;
        }
        synchronized (task) {
            return task.running;
        }
    }

    public int inFlight() {
        int count = 0;
        for (TargetTask task : tasks.values()) {
            synchronized (task) {
                if (task.running) {
                    count++;
                }
            }
        }
        return count;
    }

    /**
     * Waits until no run is in flight or the timeout elapses.
     *
     * @return true if idle
     */
    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        Instant deadline = Instant.now().plus(timeout);
        while (inFlight() > 0) {
            if (Instant.now().isAfter(deadline)) {
                return false;
            }
            Thread.sleep(100);
        }
        return true;
    }

    /**
     * Stops scheduling new runs. Runs already in flight continue.
     */
    public void stop() {
        accepting = false;
        for (TargetTask task : tasks.values()) {
            synchronized (task) {
                if (task.future != null) {
                    task.future.cancel(false);
                    task.future = null;
                }
            }
        }
        log.info("Reconcile scheduler stopped, {} runs in flight", inFlight());
    }

    /**
     * Cancels in-flight runs at their next checkpoint.
     */
    public void cancelAll() {
        for (TargetTask task : tasks.values()) {
            synchronized (task) {
                task.token.cancel();
            }
        }
    }

    private void schedule(TargetTask task, Duration delay) {
        if (task.future != null) {
            task.future.cancel(false);
        }
        task.future = taskScheduler.schedule(() -> run(task), Instant.now().plus(delay));
    }

    private void run(TargetTask task) {
        SecretManagerConfig resource;
        boolean pullDue;
        CancellationToken token;
        synchronized (task) {
            if (task.removed || !accepting) {
                return;
            }
            if (task.running) {
                task.rerunRequested = true;
                return;
            }
            task.running = true;
            task.rerunRequested = false;
            task.future = null;
            resource = task.resource;
            pullDue = task.pullRequested || pullIntervalElapsed(task);
            task.pullRequested = false;
            token = task.token;
        }

        ReconcileOutcome outcome;
        try {
            outcome = engine.reconcile(new ReconcileRequest(resource, pullDue, token));
        } catch (RuntimeException e) {
            log.error("Reconcile task for {} failed unexpectedly", task.key, e);
            outcome = ReconcileOutcome.of(ReconcileOutcome.Result.FAILED, false, e.getMessage());
        }
        afterRun(task, outcome);
    }

    private void afterRun(TargetTask task, ReconcileOutcome outcome) {
        boolean forget = false;
        synchronized (task) {
            task.running = false;
            if (task.removed) {
                forget = true;
            } else {
                if (outcome.pulled()) {
                    task.lastPull = Instant.now();
                }
                Duration delay = nextDelay(task, outcome);
                if (task.rerunRequested && accepting) {
                    task.rerunRequested = false;
                    schedule(task, Duration.ZERO);
                } else if (delay != null && accepting) {
                    log.debug("Next reconcile of {} in {}", task.key, delay);
                    schedule(task, delay);
                }
            }
        }
        if (forget) {
            engine.forget(task.key);
        }
    }

    private Duration nextDelay(TargetTask task, ReconcileOutcome outcome) {
        if (outcome.needsBackoff()) {
            task.failures++;
            return backoff.delayFor(task.failures);
        }
        task.failures = 0;
        if (!outcome.schedulesNextRun()) {
            return null;
        }
        return intervals(task).map(SyncTargetValidator.Intervals::next).orElse(null);
    }

    private boolean pullIntervalElapsed(TargetTask task) {
        if (task.lastPull == null) {
            return true;
        }
        return intervals(task)
            .map(i -> !task.lastPull.plus(i.pull()).isAfter(Instant.now()))
            .orElse(true);
    }

    private Optional<SyncTargetValidator.Intervals> intervals(TargetTask task) {
        if (task.resource == null || task.resource.getSpec() == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(validator.intervals(task.resource.getSpec()));
        } catch (SecretSyncException e) {
            log.debug("No valid intervals for {}: {}", task.key, e.getMessage());
            return Optional.empty();
        }
    }
}
