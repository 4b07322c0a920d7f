package com.platform.secretsync.diff;

import com.platform.secretsync.canonical.ConfigEntry;
import com.platform.secretsync.provider.ProviderSecretRecord;

import java.util.List;
import java.util.Map;

/**
 * What the provider holds for one sync target.
 *
 * @param secrets      record per desired secret name; absent names do not exist in the provider
 * @param managed      secrets tagged as managed by the target, only read when pruning
 * @param configValues current value per {@link #configKey(ConfigEntry)}; absent keys do not exist
 */
public record ActualState(Map<String, ProviderSecretRecord> secrets, List<ProviderSecretRecord> managed,
                          Map<String, String> configValues) {

    public ActualState {
        secrets = Map.copyOf(secrets);
        managed = List.copyOf(managed);
        configValues = Map.copyOf(configValues);
    }

    public static String configKey(ConfigEntry entry) {
        return entry.label() == null ? entry.name() : entry.name() + "|" + entry.label();
    }
}
