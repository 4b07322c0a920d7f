package com.platform.secretsync.lifecycle;

import com.platform.secretsync.observability.MetricsRegistry;
import com.platform.secretsync.provider.ProviderClientFactory;
import com.platform.secretsync.reconcile.ReconcileScheduler;
import com.platform.secretsync.reconcile.SyncTargetWatcher;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationListener;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Shuts the controller down in phases: stop watching, stop scheduling, let in-flight reconciles
 * finish within the timeout, cancel the rest at their next checkpoint, then close provider clients.
 */
@Slf4j
@Component
public class GracefulShutdownManager implements ApplicationListener<ContextClosedEvent> {

    private final ReconcileScheduler scheduler;
    private final ObjectProvider<SyncTargetWatcher> watcher;
    private final ProviderClientFactory providers;
    private final ApplicationLifecycleManager lifecycleManager;
    private final MetricsRegistry metricsRegistry;
    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);

    @Value("${secretsync.shutdown.timeout:30s}")
    private Duration shutdownTimeout;

    public GracefulShutdownManager(ReconcileScheduler scheduler, ObjectProvider<SyncTargetWatcher> watcher,
                                   ProviderClientFactory providers, ApplicationLifecycleManager lifecycleManager,
                                   MetricsRegistry metricsRegistry) {
        this.scheduler = scheduler;
        this.watcher = watcher;
        this.providers = providers;
        this.lifecycleManager = lifecycleManager;
        this.metricsRegistry = metricsRegistry;
    }

    @Override
    public void onApplicationEvent(ContextClosedEvent event) {
        performGracefulShutdown();
    }

    @PreDestroy
    public void onPreDestroy() {
        performGracefulShutdown();
    }

    public boolean isShuttingDown() {
        return shuttingDown.get();
    }

    public void performGracefulShutdown() {
        if (!shuttingDown.compareAndSet(false, true)) {
            log.debug("Shutdown already in progress");
            return;
        }
        Instant started = Instant.now();
        log.info("Graceful shutdown initiated (timeout={})", shutdownTimeout);
        lifecycleManager.startDraining();

        log.info("[1/4] Stopping watches");
        SyncTargetWatcher active = watcher.getIfAvailable();
        if (active != null) {
            active.stop();
        }

        log.info("[2/4] Stopping reconcile scheduling");
        scheduler.stop();

        log.info("[3/4] Waiting for in-flight reconciles");
        waitForInFlight();

        log.info("[4/4] Closing provider clients");
        providers.close();

        lifecycleManager.markStopped();
        metricsRegistry.incrementCounter("lifecycle.shutdown", "status", "complete");
        log.info("Graceful shutdown complete ({} ms)", Duration.between(started, Instant.now()).toMillis());
    }

    private void waitForInFlight() {
        try {
            if (!scheduler.awaitIdle(shutdownTimeout)) {
                log.warn("{} reconciles still running after {}, cancelling", scheduler.inFlight(), shutdownTimeout);
                scheduler.cancelAll();
                scheduler.awaitIdle(Duration.ofSeconds(5));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for reconciles, cancelling");
            scheduler.cancelAll();
        }
    }
}
