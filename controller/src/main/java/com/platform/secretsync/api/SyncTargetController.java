package com.platform.secretsync.api;

import com.platform.secretsync.crd.SyncTargetKey;
import com.platform.secretsync.diff.DriftRecord;
import com.platform.secretsync.error.ResourceNotFoundException;
import com.platform.secretsync.reconcile.DriftHistory;
import com.platform.secretsync.reconcile.ReconcileScheduler;
import com.platform.secretsync.state.SyncStateMachine;
import com.platform.secretsync.state.SyncTargetContext;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Read-only view of sync target state and drift, plus manual reconcile requests.
 */
@RestController
@RequestMapping("/api/sync-targets")
public class SyncTargetController {

    private final SyncStateMachine stateMachine;
    private final ReconcileScheduler scheduler;
    private final DriftHistory driftHistory;

    public SyncTargetController(SyncStateMachine stateMachine, ReconcileScheduler scheduler,
                                DriftHistory driftHistory) {
        this.stateMachine = stateMachine;
        this.scheduler = scheduler;
        this.driftHistory = driftHistory;
    }

    @GetMapping
    public List<SyncTargetContext> list() {
        return stateMachine.getAll().values().stream()
            .sorted(Comparator.comparing(context -> context.target().toString()))
            .toList();
    }

    @GetMapping("/{namespace}/{name}")
    public SyncTargetContext get(@PathVariable String namespace, @PathVariable String name) {
        SyncTargetKey key = new SyncTargetKey(namespace, name);
        SyncTargetContext context = stateMachine.getContext(key);
        if (context == null) {
            throw ResourceNotFoundException.syncTarget(key.toString());
        }
        return context;
    }

    @GetMapping("/drift")
    public List<DriftRecord> drift(@RequestParam(required = false) String target) {
        return target != null ? driftHistory.forTarget(target) : driftHistory.getAll();
    }

    @PostMapping("/{namespace}/{name}/reconcile")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public Map<String, String> reconcile(@PathVariable String namespace, @PathVariable String name) {
        SyncTargetKey key = new SyncTargetKey(namespace, name);
        if (!scheduler.wake(key, ReconcileScheduler.WakeReason.MANUAL)) {
            throw ResourceNotFoundException.syncTarget(key.toString());
        }
        return Map.of("target", key.toString(), "status", "queued");
    }
}
