package com.platform.secretsync.diff;

import com.platform.secretsync.canonical.CanonicalSecret;
import com.platform.secretsync.canonical.CanonicalSet;
import com.platform.secretsync.canonical.ConfigEntry;
import com.platform.secretsync.provider.ProviderSecretRecord;
import com.platform.secretsync.provider.SecretVersion;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Compares the desired state built from Git with what a provider holds. Secrets are matched by
 * canonical name and compared by the SHA-256 of their latest enabled payload.
 */
@Slf4j
@Component
public class DiffEngine {

    /**
     * @param triggerUpdate when false only missing secrets and configs are scheduled
     * @param prune         schedule managed secrets that are gone from Git for disabling
     */
    public record Options(boolean triggerUpdate, boolean prune) {
    }

    public SecretDiff diff(String target, CanonicalSet desired, ActualState actual, Options options) {
        List<CanonicalSecret> toCreate = new ArrayList<>();
        List<CanonicalSecret> toUpdate = new ArrayList<>();
        List<String> toDisable = new ArrayList<>();
        List<ConfigEntry> configsToWrite = new ArrayList<>();
        List<DriftRecord> drifts = new ArrayList<>();
        Set<String> desiredNames = new HashSet<>();

        for (CanonicalSecret secret : desired.secrets()) {
            desiredNames.add(secret.name());
            ProviderSecretRecord record = actual.secrets().get(secret.name());
            Optional<SecretVersion> served = record == null || record.isSoftDeleted()
                ? Optional.empty()
                : record.latestEnabledVersion();
            boolean changed = served.isPresent() && !sameValue(secret, served.get());

            if (secret.enabled()) {
                if (record == null || record.isSoftDeleted()) {
                    toCreate.add(secret);
                    drifts.add(drift(target, secret.name(), DriftType.MISSING, secret.value(), null, "CREATE"));
                } else if (served.isEmpty()) {
                    if (options.triggerUpdate()) {
                        toUpdate.add(secret);
                    }
                    drifts.add(drift(target, secret.name(), DriftType.DISABLED_IN_PROVIDER, secret.value(), null,
                        options.triggerUpdate() ? "UPDATE" : "SKIPPED"));
                } else if (changed) {
                    if (options.triggerUpdate()) {
                        toUpdate.add(secret);
                    }
                    drifts.add(drift(target, secret.name(), DriftType.VALUE_CHANGED, secret.value(),
                        served.get().payload(), options.triggerUpdate() ? "UPDATE" : "SKIPPED"));
                }
            } else if (served.isPresent()) {
                if (changed && options.triggerUpdate()) {
                    toUpdate.add(secret);
                }
                toDisable.add(secret.name());
                drifts.add(drift(target, secret.name(), DriftType.SHOULD_BE_DISABLED, secret.value(),
                    served.get().payload(), changed && options.triggerUpdate() ? "UPDATE_AND_DISABLE" : "DISABLE"));
            }
        }

        if (options.prune()) {
            for (ProviderSecretRecord record : actual.managed()) {
                if (!desiredNames.contains(record.name()) && record.isActive()) {
                    toDisable.add(record.name());
                    drifts.add(drift(target, record.name(), DriftType.NOT_IN_GIT, null, null, "DISABLE"));
                }
            }
        }

        for (ConfigEntry config : desired.configs()) {
            String current = actual.configValues().get(ActualState.configKey(config));
            if (current == null) {
                configsToWrite.add(config);
                drifts.add(drift(target, config.name(), DriftType.CONFIG_MISSING, config.value(), null, "WRITE"));
            } else if (!current.equals(config.value())) {
                if (options.triggerUpdate()) {
                    configsToWrite.add(config);
                }
                drifts.add(drift(target, config.name(), DriftType.CONFIG_CHANGED, config.value(), current,
                    options.triggerUpdate() ? "WRITE" : "SKIPPED"));
            }
        }

        SecretDiff diff = new SecretDiff(toCreate, toUpdate, toDisable, configsToWrite, drifts);
        log.debug("Diff for {}: {} create, {} update, {} disable, {} config writes", target,
            toCreate.size(), toUpdate.size(), toDisable.size(), configsToWrite.size());
        return diff;
    }

    /**
     * Logs every divergence with masked values. Used in diff discovery mode where nothing is applied.
     */
    public void report(SecretDiff diff) {
        for (DriftRecord drift : diff.drifts()) {
            log.warn("Drift {} on {}: git={} provider={} (would {})", drift.driftType(), drift.name(),
                drift.desired(), drift.actual(), drift.action());
        }
    }

    private static boolean sameValue(CanonicalSecret secret, SecretVersion version) {
        if (version.payloadSha256() == null) {
            return false;
        }
        return version.payloadSha256().equals(SecretVersion.sha256(secret.value()));
    }

    private static DriftRecord drift(String target, String name, DriftType type, String desired, String actual,
                                     String action) {
        return DriftRecord.create(target, name, type, ValueMasker.mask(desired), ValueMasker.mask(actual), action);
    }
}
