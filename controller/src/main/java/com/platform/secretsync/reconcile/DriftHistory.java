package com.platform.secretsync.reconcile;

import com.platform.secretsync.config.SecretSyncProperties;
import com.platform.secretsync.diff.DriftRecord;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Bounded in-memory log of detected drift, newest last.
 */
@Component
public class DriftHistory {

    private final Deque<DriftRecord> records = new ArrayDeque<>();
    private final int maxSize;

    public DriftHistory(SecretSyncProperties properties) {
        this.maxSize = Math.max(1, properties.getReconciler().getDriftHistorySize());
    }

    public synchronized void addAll(List<DriftRecord> drifts) {
        for (DriftRecord drift : drifts) {
            records.addLast(drift);
            if (records.size() > maxSize) {
                records.removeFirst();
            }
        }
    }

    public synchronized List<DriftRecord> getAll() {
        return List.copyOf(records);
    }

    public synchronized List<DriftRecord> forTarget(String target) {
        return records.stream()
            .filter(d -> d.target().equals(target))
            .toList();
    }
}
