package com.platform.secretsync.diff;

import com.platform.secretsync.canonical.CanonicalSecret;
import com.platform.secretsync.canonical.ConfigEntry;

import java.util.List;

/**
 * Changes needed to converge a provider on the desired state.
 *
 * @param toUpdate secrets that get a new version; a disabled entry may appear here and in
 *                 {@code toDisable} when its value changed as well
 * @param toDisable names of secrets to stop serving
 */
public record SecretDiff(List<CanonicalSecret> toCreate, List<CanonicalSecret> toUpdate, List<String> toDisable,
                         List<ConfigEntry> configsToWrite, List<DriftRecord> drifts) {

    public SecretDiff {
        toCreate = List.copyOf(toCreate);
        toUpdate = List.copyOf(toUpdate);
        toDisable = List.copyOf(toDisable);
        configsToWrite = List.copyOf(configsToWrite);
        drifts = List.copyOf(drifts);
    }

    public boolean isEmpty() {
        return toCreate.isEmpty() && toUpdate.isEmpty() && toDisable.isEmpty() && configsToWrite.isEmpty();
    }

    public int writeCount() {
        return toCreate.size() + toUpdate.size() + toDisable.size() + configsToWrite.size();
    }
}
