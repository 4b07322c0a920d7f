package com.platform.secretsync.provider.azure;

import com.azure.core.exception.ResourceNotFoundException;
import com.azure.core.util.polling.SyncPoller;
import com.azure.security.keyvault.secrets.SecretClient;
import com.azure.security.keyvault.secrets.models.DeletedSecret;
import com.azure.security.keyvault.secrets.models.KeyVaultSecret;
import com.azure.security.keyvault.secrets.models.SecretProperties;
import com.platform.secretsync.canonical.CanonicalSecret;
import com.platform.secretsync.canonical.CanonicalSecretBuilder;
import com.platform.secretsync.canonical.MetadataNormalizer;
import com.platform.secretsync.provider.ProviderCallExecutor;
import com.platform.secretsync.provider.ProviderClient;
import com.platform.secretsync.provider.ProviderSecretRecord;
import com.platform.secretsync.provider.ProviderType;
import com.platform.secretsync.provider.SecretVersion;
import com.platform.secretsync.provider.SoftDeleteRecord;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Key Vault secrets. The newest version is the served one, so only it can be reported as enabled;
 * older versions are kept in the log without payload.
 */
@Slf4j
public class AzureKeyVaultClient implements ProviderClient {

    private static final Duration POLL_TIMEOUT = Duration.ofMinutes(2);

    private final SecretClient client;
    private final ProviderCallExecutor executor;
    private final MetadataNormalizer metadata;

    public AzureKeyVaultClient(SecretClient client, ProviderCallExecutor executor, MetadataNormalizer metadata) {
        this.client = client;
        this.executor = executor;
        this.metadata = metadata;
    }

    @Override
    public ProviderType type() {
        return ProviderType.AZURE;
    }

    @Override
    public void create(CanonicalSecret secret) {
        executor.run(type(), "setSecret", secret.name(), () -> azure(secret.name(), () -> write(secret)));
    }

    @Override
    public void putValue(CanonicalSecret secret) {
        executor.run(type(), "setSecret", secret.name(), () -> azure(secret.name(), () -> write(secret)));
    }

    @Override
    public List<ProviderSecretRecord> listActive(String syncTargetTag) {
        return executor.call(type(), "listPropertiesOfSecrets", syncTargetTag, () -> azure(syncTargetTag, () -> {
            List<ProviderSecretRecord> records = new ArrayList<>();
            for (SecretProperties properties : client.listPropertiesOfSecrets()) {
                Map<String, String> tags = properties.getTags() == null ? Map.of() : properties.getTags();
                if (!CanonicalSecretBuilder.MANAGED_BY.equals(tags.get(CanonicalSecretBuilder.TAG_MANAGED_BY))
                        || !syncTargetTag.equals(tags.get(CanonicalSecretBuilder.TAG_SYNC_TARGET))) {
                    continue;
                }
                records.add(toRecord(properties.getName(), versions(properties.getName()), null, false));
            }
            return records;
        }));
    }

    @Override
    public Optional<ProviderSecretRecord> getMetadata(String name) {
        return executor.call(type(), "getSecret", name, () -> azure(name, () -> {
            List<SecretProperties> versions;
            try {
                versions = versions(name);
            } catch (ResourceNotFoundException e) {
                return deletedRecord(name);
            }
            if (versions.isEmpty()) {
                return deletedRecord(name);
            }
            return Optional.of(toRecord(name, versions, null, true));
        }));
    }

    @Override
    public void disable(String name) {
        executor.run(type(), "updateSecretProperties", name, () -> azure(name, () -> {
            List<SecretProperties> versions = versions(name);
            if (versions.isEmpty()) {
                return null;
            }
            SecretProperties latest = versions.get(versions.size() - 1);
            if (Boolean.FALSE.equals(latest.isEnabled())) {
                return null;
            }
            client.updateSecretProperties(latest.setEnabled(false));
            log.info("Disabled Azure secret {} version {}", name, latest.getVersion());
            return null;
        }));
    }

    @Override
    public void softDelete(String name) {
        executor.run(type(), "beginDeleteSecret", name, () -> azure(name, () -> {
            DeletedSecret deleted = delete(name);
            log.info("Soft deleted Azure secret {}, purge scheduled for {}", name,
                deleted == null ? null : deleted.getScheduledPurgeDate());
            return null;
        }));
    }

    @Override
    public void hardDelete(String name) {
        executor.run(type(), "purgeDeletedSecret", name, () -> azure(name, () -> {
            try {
                client.getDeletedSecret(name);
            } catch (ResourceNotFoundException e) {
                delete(name);
            }
            client.purgeDeletedSecret(name);
            log.info("Purged Azure secret {}", name);
            return null;
        }));
    }

    private Void write(CanonicalSecret secret) {
        KeyVaultSecret value = new KeyVaultSecret(secret.name(), secret.value())
            .setProperties(new SecretProperties().setTags(secret.tags()).setEnabled(true));
        try {
            client.setSecret(value);
        } catch (RuntimeException e) {
            // 409 means the name is held by a soft-deleted secret.
            if (!AzureErrors.hasStatus(e, 409)) {
                throw e;
            }
            recover(secret.name());
            client.setSecret(value);
        }
        return null;
    }

    private void recover(String name) {
        SyncPoller<KeyVaultSecret, Void> poller = client.beginRecoverDeletedSecret(name);
        poller.waitForCompletion(POLL_TIMEOUT);
        log.info("Recovered soft deleted Azure secret {}", name);
    }

    private DeletedSecret delete(String name) {
        SyncPoller<DeletedSecret, Void> poller = client.beginDeleteSecret(name);
        poller.waitForCompletion(POLL_TIMEOUT);
        return poller.poll().getValue();
    }

    private Optional<ProviderSecretRecord> deletedRecord(String name) {
        DeletedSecret deleted;
        try {
            deleted = client.getDeletedSecret(name);
        } catch (ResourceNotFoundException e) {
            return Optional.empty();
        }
        SoftDeleteRecord softDelete = new SoftDeleteRecord(instant(deleted.getDeletedOn()),
            instant(deleted.getScheduledPurgeDate()));
        Map<String, String> tags = deleted.getProperties().getTags() == null ? Map.of() : deleted.getProperties().getTags();
        return Optional.of(new ProviderSecretRecord(name, List.of(), Map.of(), softDelete,
            metadata.environment(tags, null), metadata.location(tags, deleted.getProperties().getId(), false), tags));
    }

    private List<SecretProperties> versions(String name) {
        List<SecretProperties> versions = new ArrayList<>();
        client.listPropertiesOfSecretVersions(name).forEach(versions::add);
        versions.sort(Comparator.comparing(SecretProperties::getCreatedOn,
            Comparator.nullsFirst(Comparator.naturalOrder())));
        return versions;
    }

    private ProviderSecretRecord toRecord(String name, List<SecretProperties> versions, SoftDeleteRecord softDelete,
                                          boolean withPayload) {
        List<SecretVersion> history = new ArrayList<>();
        SecretProperties latest = versions.isEmpty() ? null : versions.get(versions.size() - 1);
        for (SecretProperties properties : versions) {
            boolean served = properties == latest && !Boolean.FALSE.equals(properties.isEnabled());
            String payload = served && withPayload ? client.getSecret(name, properties.getVersion()).getValue() : null;
            history.add(SecretVersion.of(properties.getVersion(), payload, served, instant(properties.getCreatedOn())));
        }
        Map<String, String> tags = latest == null || latest.getTags() == null ? Map.of() : latest.getTags();
        String identifier = latest == null ? null : latest.getId();
        return new ProviderSecretRecord(name, history, Map.of(), softDelete,
            metadata.environment(tags, null), metadata.location(tags, identifier, false), tags);
    }

    private static Instant instant(OffsetDateTime time) {
        return time == null ? null : time.toInstant();
    }

    private static <T> T azure(String resource, Supplier<T> call) {
        try {
            return call.get();
        } catch (RuntimeException e) {
            throw AzureErrors.translate(e, resource);
        }
    }
}
