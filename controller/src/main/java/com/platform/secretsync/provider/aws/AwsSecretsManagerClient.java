package com.platform.secretsync.provider.aws;

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
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.secretsmanager.SecretsManagerClient;
import software.amazon.awssdk.services.secretsmanager.model.DeleteSecretResponse;
import software.amazon.awssdk.services.secretsmanager.model.DescribeSecretResponse;
import software.amazon.awssdk.services.secretsmanager.model.Filter;
import software.amazon.awssdk.services.secretsmanager.model.FilterNameStringType;
import software.amazon.awssdk.services.secretsmanager.model.GetSecretValueResponse;
import software.amazon.awssdk.services.secretsmanager.model.InvalidRequestException;
import software.amazon.awssdk.services.secretsmanager.model.ResourceExistsException;
import software.amazon.awssdk.services.secretsmanager.model.ResourceNotFoundException;
import software.amazon.awssdk.services.secretsmanager.model.SecretListEntry;
import software.amazon.awssdk.services.secretsmanager.model.SecretVersionsListEntry;
import software.amazon.awssdk.services.secretsmanager.model.Tag;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Secrets Manager: every write appends a version and moves {@code AWSCURRENT} to it.
 * Disabling is a soft delete with a recovery window since the service has no disabled state.
 */
@Slf4j
public class AwsSecretsManagerClient implements ProviderClient {

    static final String CURRENT = "AWSCURRENT";
    static final String PREVIOUS = "AWSPREVIOUS";

    private final SecretsManagerClient client;
    private final ProviderCallExecutor executor;
    private final MetadataNormalizer metadata;
    private final long recoveryWindowDays;

    public AwsSecretsManagerClient(SecretsManagerClient client, ProviderCallExecutor executor,
                                   MetadataNormalizer metadata, long recoveryWindowDays) {
        this.client = client;
        this.executor = executor;
        this.metadata = metadata;
        this.recoveryWindowDays = recoveryWindowDays;
    }

    @Override
    public ProviderType type() {
        return ProviderType.AWS;
    }

    @Override
    public void create(CanonicalSecret secret) {
        String name = secret.name();
        executor.run(type(), "createSecret", name, () -> aws(name, () -> {
            try {
                client.createSecret(b -> b.name(name).secretString(secret.value()).tags(tags(secret)));
                log.info("Created AWS secret {}", name);
            } catch (ResourceExistsException | InvalidRequestException e) {
                // The name is taken by a live or a scheduled-for-deletion secret.
                restoreIfDeleted(name);
                client.putSecretValue(b -> b.secretId(name).secretString(secret.value()));
                client.tagResource(b -> b.secretId(name).tags(tags(secret)));
                log.info("Secret {} already existed, wrote new version", name);
            }
            return null;
        }));
    }

    @Override
    public void putValue(CanonicalSecret secret) {
        String name = secret.name();
        executor.run(type(), "putSecretValue", name, () -> aws(name, () -> {
            try {
                client.putSecretValue(b -> b.secretId(name).secretString(secret.value()));
            } catch (InvalidRequestException e) {
                if (!restoreIfDeleted(name)) {
                    throw e;
                }
                client.putSecretValue(b -> b.secretId(name).secretString(secret.value()));
            }
            client.tagResource(b -> b.secretId(name).tags(tags(secret)));
            return null;
        }));
    }

    @Override
    public void addStagingLabel(String name, String label, String versionId) {
        executor.run(type(), "updateSecretVersionStage", name, () -> aws(name, () -> {
            DescribeSecretResponse description = client.describeSecret(b -> b.secretId(name));
            String holder = null;
            for (Map.Entry<String, List<String>> entry : description.versionIdsToStages().entrySet()) {
                if (entry.getValue().contains(label)) {
                    holder = entry.getKey();
                }
            }
            if (versionId.equals(holder)) {
                return null;
            }
            String previousHolder = holder;
            client.updateSecretVersionStage(b -> b.secretId(name)
                .versionStage(label)
                .moveToVersionId(versionId)
                .removeFromVersionId(previousHolder));
            return null;
        }));
    }

    @Override
    public List<ProviderSecretRecord> listActive(String syncTargetTag) {
        return executor.call(type(), "listSecrets", syncTargetTag, () -> aws(syncTargetTag, () -> {
            List<ProviderSecretRecord> records = new ArrayList<>();
            Iterable<SecretListEntry> entries = client.listSecretsPaginator(b -> b.filters(
                    Filter.builder().key(FilterNameStringType.TAG_KEY).values(CanonicalSecretBuilder.TAG_SYNC_TARGET).build(),
                    Filter.builder().key(FilterNameStringType.TAG_VALUE).values(syncTargetTag).build()))
                .secretList();
            for (SecretListEntry entry : entries) {
                if (entry.deletedDate() != null) {
                    continue;
                }
                Map<String, String> tags = toMap(entry.tags());
                List<SecretVersion> versions = new ArrayList<>();
                Map<String, String> labels = new HashMap<>();
                entry.secretVersionsToStages().forEach((versionId, stages) -> {
                    versions.add(new SecretVersion(versionId, null, null, stages.contains(CURRENT), null));
                    stages.forEach(stage -> labels.put(stage, versionId));
                });
                versions.sort(Comparator.comparing((SecretVersion v) -> v.enabled()));
                records.add(new ProviderSecretRecord(entry.name(), versions, labels, null,
                    metadata.environment(tags, null), metadata.location(tags, entry.arn(), false), tags));
            }
            return records;
        }));
    }

    @Override
    public Optional<ProviderSecretRecord> getMetadata(String name) {
        return executor.call(type(), "describeSecret", name, () -> aws(name, () -> {
            DescribeSecretResponse description;
            try {
                description = client.describeSecret(b -> b.secretId(name));
            } catch (ResourceNotFoundException e) {
                return Optional.<ProviderSecretRecord>empty();
            }
            Map<String, String> tags = toMap(description.tags());
            SoftDeleteRecord softDelete = description.deletedDate() == null ? null
                : new SoftDeleteRecord(description.deletedDate(),
                    description.deletedDate().plus(Duration.ofDays(recoveryWindowDays)));

            GetSecretValueResponse current = null;
            if (softDelete == null && hasCurrentVersion(description)) {
                current = client.getSecretValue(b -> b.secretId(name).versionStage(CURRENT));
            }
            Map<String, String> labels = new HashMap<>();
            description.versionIdsToStages().forEach((versionId, stages) ->
                stages.forEach(stage -> labels.put(stage, versionId)));

            List<SecretVersion> versions = versions(name, description, current, softDelete != null);
            return Optional.of(new ProviderSecretRecord(name, versions, labels, softDelete,
                metadata.environment(tags, null), metadata.location(tags, description.arn(), false), tags));
        }));
    }

    @Override
    public void disable(String name) {
        softDelete(name);
    }

    @Override
    public void softDelete(String name) {
        executor.run(type(), "deleteSecret", name, () -> aws(name, () -> {
            DeleteSecretResponse response = client.deleteSecret(b -> b.secretId(name).recoveryWindowInDays(recoveryWindowDays));
            log.info("Scheduled AWS secret {} for deletion on {}", name, response.deletionDate());
            return null;
        }));
    }

    @Override
    public void hardDelete(String name) {
        executor.run(type(), "forceDeleteSecret", name, () -> aws(name, () -> {
            client.deleteSecret(b -> b.secretId(name).forceDeleteWithoutRecovery(true));
            log.info("Deleted AWS secret {} without recovery", name);
            return null;
        }));
    }

    @Override
    public void close() {
        client.close();
    }

    private boolean restoreIfDeleted(String name) {
        DescribeSecretResponse description = client.describeSecret(b -> b.secretId(name));
        if (description.deletedDate() == null) {
            return false;
        }
        client.restoreSecret(b -> b.secretId(name));
        log.info("Restored AWS secret {} scheduled for deletion on {}", name, description.deletedDate());
        return true;
    }

    private List<SecretVersion> versions(String name, DescribeSecretResponse description,
                                         GetSecretValueResponse current, boolean deleted) {
        Map<String, Instant> created = new HashMap<>();
        if (!deleted) {
            for (SecretVersionsListEntry entry : client.listSecretVersionIds(b -> b.secretId(name)).versions()) {
                created.put(entry.versionId(), entry.createdDate());
            }
        }
        if (current != null) {
            created.put(current.versionId(), current.createdDate());
        }
        List<SecretVersion> versions = new ArrayList<>();
        description.versionIdsToStages().forEach((versionId, stages) -> {
            boolean isCurrent = stages.contains(CURRENT);
            String payload = current != null && versionId.equals(current.versionId()) ? current.secretString() : null;
            versions.add(SecretVersion.of(versionId, payload, isCurrent && !deleted, created.get(versionId)));
        });
        versions.sort(Comparator.comparing(SecretVersion::createTime, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(SecretVersion::enabled));
        return versions;
    }

    private static boolean hasCurrentVersion(DescribeSecretResponse description) {
        return description.versionIdsToStages().values().stream().anyMatch(stages -> stages.contains(CURRENT));
    }

    private static Collection<Tag> tags(CanonicalSecret secret) {
        return secret.tags().entrySet().stream()
            .map(e -> Tag.builder().key(e.getKey()).value(e.getValue()).build())
            .toList();
    }

    private static Map<String, String> toMap(List<Tag> tags) {
        Map<String, String> map = new HashMap<>();
        if (tags != null) {
            tags.forEach(tag -> map.put(tag.key(), tag.value()));
        }
        return map;
    }

    private static <T> T aws(String resource, Supplier<T> call) {
        try {
            return call.get();
        } catch (SdkException e) {
            throw AwsErrors.translate(e, resource);
        }
    }
}
