package com.platform.secretsync.reconcile;

import com.platform.secretsync.crd.SyncTargetKey;
import com.platform.secretsync.crd.SyncTargetStatus;
import com.platform.secretsync.state.SyncPhase;
import com.platform.secretsync.state.SyncStateMachine;
import com.platform.secretsync.state.SyncTargetContext;
import io.fabric8.kubernetes.api.model.Condition;
import io.fabric8.kubernetes.api.model.ConditionBuilder;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Writes the status of a sync target on every phase transition.
 */
@Component
public class StatusPublisher implements SyncStateMachine.TransitionListener {

    public static final String READY = "Ready";

    /**
     * Per target facts that are not part of the phase context.
     */
    public record Details(Long observedGeneration, List<SyncTargetStatus.FailedFile> failedFiles,
                          DecryptionStatus decryptionStatus, Boolean sopsKeyAvailable, boolean configError) {

        public static Details of(Long observedGeneration) {
            return new Details(observedGeneration, List.of(), null, null, false);
        }

        public Details withDecryption(List<SyncTargetStatus.FailedFile> files, DecryptionStatus status,
                                      Boolean keyAvailable) {
            return new Details(observedGeneration, List.copyOf(files), status, keyAvailable, configError);
        }

        public Details withConfigError(boolean value) {
            return new Details(observedGeneration, failedFiles, decryptionStatus, sopsKeyAvailable, value);
        }
    }

    private final StatusWriter writer;
    private final Map<SyncTargetKey, Details> details = new ConcurrentHashMap<>();

    public StatusPublisher(StatusWriter writer, SyncStateMachine stateMachine) {
        this.writer = writer;
        stateMachine.addListener(this);
    }

    public void record(SyncTargetKey target, Details value) {
        details.put(target, value);
    }

    public Details details(SyncTargetKey target) {
        return details.getOrDefault(target, Details.of(null));
    }

    public void forget(SyncTargetKey target) {
        details.remove(target);
    }

    @Override
    public void onTransition(SyncTargetContext context) {
        writer.write(context.target(), toStatus(context, details(context.target())));
    }

    static SyncTargetStatus toStatus(SyncTargetContext context, Details details) {
        SyncTargetStatus status = new SyncTargetStatus();
        status.setPhase(context.phase().displayName());
        status.setDescription(context.description());
        status.setLastSyncTime(format(context.lastSyncTime()));
        status.setSyncedCount(context.syncedCount());
        status.setObservedGeneration(details.observedGeneration());
        status.setLastRevision(context.lastRevision());
        status.setLastChecksum(context.lastChecksum());
        status.setFailedFiles(new ArrayList<>(details.failedFiles()));
        status.setDegraded(context.degraded());
        status.setSopsKeyAvailable(details.sopsKeyAvailable());
        status.setDecryptionStatus(details.decryptionStatus() == null ? null : details.decryptionStatus().value());
        status.setConditions(new ArrayList<>(List.of(readyCondition(context, details))));
        return status;
    }

    static Condition readyCondition(SyncTargetContext context, Details details) {
        String status;
        String reason;
        if (context.phase() == SyncPhase.SYNCED && details.failedFiles().isEmpty()) {
            status = "True";
            reason = "Synced";
        } else if (context.phase() == SyncPhase.SYNCED) {
            status = "False";
            reason = "FilesFailed";
        } else if (context.degraded()) {
            status = "False";
            reason = "Degraded";
        } else if (details.configError()) {
            status = "False";
            reason = "ConfigurationError";
        } else if (context.phase() == SyncPhase.ERROR) {
            status = "False";
            reason = "Error";
        } else {
            status = "Unknown";
            reason = "Progressing";
        }
        return new ConditionBuilder()
            .withType(READY)
            .withStatus(status)
            .withReason(reason)
            .withMessage(context.description())
            .withObservedGeneration(details.observedGeneration())
            .withLastTransitionTime(format(context.lastTransitionTime()))
            .build();
    }

    private static String format(Instant instant) {
        return instant == null ? null : DateTimeFormatter.ISO_INSTANT.format(instant);
    }
}
