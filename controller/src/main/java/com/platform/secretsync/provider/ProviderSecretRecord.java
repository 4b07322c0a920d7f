package com.platform.secretsync.provider;

import com.platform.secretsync.canonical.CanonicalSecretBuilder;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Provider-neutral view of a stored secret.
 *
 * @param versions      version log, oldest first
 * @param stagingLabels label to version id, empty where the provider has no labels
 * @param softDelete    pending deletion, null when the secret is live
 * @param location      null only for automatically replicated secrets
 */
public record ProviderSecretRecord(String name, List<SecretVersion> versions, Map<String, String> stagingLabels,
                                   SoftDeleteRecord softDelete, String environment, String location,
                                   Map<String, String> tags) {

    public ProviderSecretRecord {
        versions = List.copyOf(versions);
        stagingLabels = Map.copyOf(stagingLabels);
        tags = Map.copyOf(tags);
        requireOrdered(versions);
    }

    public Optional<SecretVersion> latestEnabledVersion() {
        for (int i = versions.size() - 1; i >= 0; i--) {
            if (versions.get(i).enabled()) {
                return Optional.of(versions.get(i));
            }
        }
        return Optional.empty();
    }

    public Optional<SecretVersion> latestVersion() {
        return versions.isEmpty() ? Optional.empty() : Optional.of(versions.get(versions.size() - 1));
    }

    public boolean isSoftDeleted() {
        return softDelete != null;
    }

    /**
     * Live secret with at least one enabled version.
     */
    public boolean isActive() {
        return !isSoftDeleted() && latestEnabledVersion().isPresent();
    }

    public boolean isManagedBy(String syncTargetTag) {
        return CanonicalSecretBuilder.MANAGED_BY.equals(tags.get(CanonicalSecretBuilder.TAG_MANAGED_BY))
            && syncTargetTag.equals(tags.get(CanonicalSecretBuilder.TAG_SYNC_TARGET));
    }

    /**
     * Returns a copy with {@code version} appended to the log.
     *
     * @throws IllegalArgumentException if the version would not be the newest entry
     */
    public ProviderSecretRecord append(SecretVersion version) {
        List<SecretVersion> appended = new ArrayList<>(versions);
        appended.add(version);
        return new ProviderSecretRecord(name, appended, stagingLabels, softDelete, environment, location, tags);
    }

    private static void requireOrdered(List<SecretVersion> versions) {
        Comparator<SecretVersion> byTime = Comparator.comparing(SecretVersion::createTime,
            Comparator.nullsFirst(Comparator.naturalOrder()));
        for (int i = 1; i < versions.size(); i++) {
            SecretVersion previous = versions.get(i - 1);
            SecretVersion current = versions.get(i);
            if (byTime.compare(previous, current) > 0 || previous.versionId().equals(current.versionId())) {
                throw new IllegalArgumentException("Version log out of order at " + current.versionId());
            }
        }
    }
}
