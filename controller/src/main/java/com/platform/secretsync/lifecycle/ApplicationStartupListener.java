package com.platform.secretsync.lifecycle;

import com.platform.secretsync.reconcile.SyncTargetWatcher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Starts the cluster watches once the context is ready and marks the controller ready.
 */
@Slf4j
@Component
public class ApplicationStartupListener {

    private final ApplicationLifecycleManager lifecycleManager;
    private final ObjectProvider<SyncTargetWatcher> watcher;

    public ApplicationStartupListener(ApplicationLifecycleManager lifecycleManager,
                                      ObjectProvider<SyncTargetWatcher> watcher) {
        this.lifecycleManager = lifecycleManager;
        this.watcher = watcher;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady(ApplicationReadyEvent event) {
        SyncTargetWatcher available = watcher.getIfAvailable();
        if (available != null) {
            available.start();
        } else {
            log.info("Watches disabled, sync targets are only reconciled on request");
        }
        lifecycleManager.markReady();
    }
}
