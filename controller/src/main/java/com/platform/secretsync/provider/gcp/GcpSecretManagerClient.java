package com.platform.secretsync.provider.gcp;

import com.google.api.gax.rpc.AlreadyExistsException;
import com.google.api.gax.rpc.NotFoundException;
import com.google.cloud.secretmanager.v1.AccessSecretVersionResponse;
import com.google.cloud.secretmanager.v1.ListSecretsRequest;
import com.google.cloud.secretmanager.v1.ProjectName;
import com.google.cloud.secretmanager.v1.Replication;
import com.google.cloud.secretmanager.v1.Secret;
import com.google.cloud.secretmanager.v1.SecretManagerServiceClient;
import com.google.cloud.secretmanager.v1.SecretName;
import com.google.cloud.secretmanager.v1.SecretPayload;
import com.google.protobuf.ByteString;
import com.google.protobuf.FieldMask;
import com.google.protobuf.Timestamp;
import com.platform.secretsync.canonical.CanonicalSecret;
import com.platform.secretsync.canonical.CanonicalSecretBuilder;
import com.platform.secretsync.canonical.MetadataNormalizer;
import com.platform.secretsync.error.ErrorCode;
import com.platform.secretsync.error.ProviderException;
import com.platform.secretsync.provider.ProviderCallExecutor;
import com.platform.secretsync.provider.ProviderClient;
import com.platform.secretsync.provider.ProviderSecretRecord;
import com.platform.secretsync.provider.ProviderType;
import com.platform.secretsync.provider.SecretVersion;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.zip.CRC32C;

/**
 * Secret Manager. Replication is automatic unless a location is configured, in which case a single
 * user-managed replica is created there.
 */
@Slf4j
public class GcpSecretManagerClient implements ProviderClient {

    private final SecretManagerServiceClient client;
    private final ProviderCallExecutor executor;
    private final MetadataNormalizer metadata;
    private final String projectId;
    private final String location;

    /**
     * @param location replica location, null for automatic replication
     */
    public GcpSecretManagerClient(SecretManagerServiceClient client, ProviderCallExecutor executor,
                                  MetadataNormalizer metadata, String projectId, String location) {
        this.client = client;
        this.executor = executor;
        this.metadata = metadata;
        this.projectId = projectId;
        this.location = location;
    }

    @Override
    public ProviderType type() {
        return ProviderType.GCP;
    }

    @Override
    public void create(CanonicalSecret secret) {
        executor.run(type(), "createSecret", secret.name(), () -> gcp(secret.name(), () -> {
            Secret resource = Secret.newBuilder()
                .setReplication(replication())
                .putAllLabels(GcpLabels.sanitize(secret.tags()))
                .build();
            try {
                client.createSecret(ProjectName.of(projectId), secret.name(), resource);
                log.info("Created GCP secret {} ({})", secret.name(), location == null ? "automatic" : location);
            } catch (AlreadyExistsException e) {
                log.info("GCP secret {} already exists, adding a version", secret.name());
            }
            addVersion(secret);
            return null;
        }));
    }

    @Override
    public void putValue(CanonicalSecret secret) {
        executor.run(type(), "addSecretVersion", secret.name(), () -> gcp(secret.name(), () -> {
            addVersion(secret);
            client.updateSecret(Secret.newBuilder()
                    .setName(SecretName.of(projectId, secret.name()).toString())
                    .putAllLabels(GcpLabels.sanitize(secret.tags()))
                    .build(),
                FieldMask.newBuilder().addPaths("labels").build());
            return null;
        }));
    }

    @Override
    public List<ProviderSecretRecord> listActive(String syncTargetTag) {
        return executor.call(type(), "listSecrets", syncTargetTag, () -> gcp(syncTargetTag, () -> {
            String filter = String.format("labels.%s=%s AND labels.%s=%s",
                CanonicalSecretBuilder.TAG_MANAGED_BY, GcpLabels.sanitize(CanonicalSecretBuilder.MANAGED_BY),
                CanonicalSecretBuilder.TAG_SYNC_TARGET, GcpLabels.sanitize(syncTargetTag));
            ListSecretsRequest request = ListSecretsRequest.newBuilder()
                .setParent(ProjectName.of(projectId).toString())
                .setFilter(filter)
                .build();
            List<ProviderSecretRecord> records = new ArrayList<>();
            for (Secret secret : client.listSecrets(request).iterateAll()) {
                String name = SecretName.parse(secret.getName()).getSecret();
                ProviderSecretRecord record = toRecord(name, secret, false);
                // Label values are sanitized; the filter already matched the exact target.
                Map<String, String> tags = new HashMap<>(record.tags());
                tags.put(CanonicalSecretBuilder.TAG_SYNC_TARGET, syncTargetTag);
                records.add(new ProviderSecretRecord(record.name(), record.versions(), record.stagingLabels(),
                    null, record.environment(), record.location(), tags));
            }
            return records;
        }));
    }

    @Override
    public Optional<ProviderSecretRecord> getMetadata(String name) {
        return executor.call(type(), "getSecret", name, () -> gcp(name, () -> {
            Secret secret;
            try {
                secret = client.getSecret(SecretName.of(projectId, name));
            } catch (NotFoundException e) {
                return Optional.<ProviderSecretRecord>empty();
            }
            return Optional.of(toRecord(name, secret, true));
        }));
    }

    @Override
    public void disable(String name) {
        executor.run(type(), "disableSecretVersion", name, () -> gcp(name, () -> {
            for (com.google.cloud.secretmanager.v1.SecretVersion version : versions(name)) {
                if (version.getState() == com.google.cloud.secretmanager.v1.SecretVersion.State.ENABLED) {
                    client.disableSecretVersion(version.getName());
                    log.info("Disabled GCP secret version {}", version.getName());
                }
            }
            return null;
        }));
    }

    @Override
    public void softDelete(String name) {
        throw new ProviderException(ErrorCode.PROVIDER_REQUEST_INVALID, GcpErrors.PROVIDER, name,
            "Secret Manager has no soft delete; disable or hard delete instead");
    }

    @Override
    public void hardDelete(String name) {
        executor.run(type(), "deleteSecret", name, () -> gcp(name, () -> {
            client.deleteSecret(SecretName.of(projectId, name));
            log.info("Deleted GCP secret {}", name);
            return null;
        }));
    }

    @Override
    public void close() {
        client.close();
    }

    private void addVersion(CanonicalSecret secret) {
        ByteString data = ByteString.copyFromUtf8(secret.value());
        CRC32C checksum = new CRC32C();
        checksum.update(data.toByteArray());
        SecretPayload payload = SecretPayload.newBuilder()
            .setData(data)
            .setDataCrc32C(checksum.getValue())
            .build();
        client.addSecretVersion(SecretName.of(projectId, secret.name()), payload);
    }

    private Replication replication() {
        if (location == null) {
            return Replication.newBuilder().setAutomatic(Replication.Automatic.getDefaultInstance()).build();
        }
        return Replication.newBuilder()
            .setUserManaged(Replication.UserManaged.newBuilder()
                .addReplicas(Replication.UserManaged.Replica.newBuilder().setLocation(location)))
            .build();
    }

    private List<com.google.cloud.secretmanager.v1.SecretVersion> versions(String name) {
        List<com.google.cloud.secretmanager.v1.SecretVersion> versions = new ArrayList<>();
        for (com.google.cloud.secretmanager.v1.SecretVersion version
                : client.listSecretVersions(SecretName.of(projectId, name)).iterateAll()) {
            if (version.getState() != com.google.cloud.secretmanager.v1.SecretVersion.State.DESTROYED) {
                versions.add(version);
            }
        }
        versions.sort(Comparator.comparing(v -> instant(v.getCreateTime())));
        return versions;
    }

    private ProviderSecretRecord toRecord(String name, Secret secret, boolean withPayload) {
        List<com.google.cloud.secretmanager.v1.SecretVersion> versions = versions(name);
        com.google.cloud.secretmanager.v1.SecretVersion latestEnabled = null;
        for (com.google.cloud.secretmanager.v1.SecretVersion version : versions) {
            if (version.getState() == com.google.cloud.secretmanager.v1.SecretVersion.State.ENABLED) {
                latestEnabled = version;
            }
        }
        List<SecretVersion> history = new ArrayList<>();
        for (com.google.cloud.secretmanager.v1.SecretVersion version : versions) {
            boolean enabled = version.getState() == com.google.cloud.secretmanager.v1.SecretVersion.State.ENABLED;
            String payload = withPayload && version == latestEnabled ? access(version.getName()) : null;
            history.add(SecretVersion.of(versionId(version.getName()), payload, enabled,
                instant(version.getCreateTime())));
        }
        Map<String, String> labels = secret.getLabelsMap();
        boolean automatic = secret.getReplication().hasAutomatic();
        String identifier = automatic || secret.getReplication().getUserManaged().getReplicasCount() == 0
            ? secret.getName()
            : secret.getName() + "/locations/" + secret.getReplication().getUserManaged().getReplicas(0).getLocation();
        return new ProviderSecretRecord(name, history, Map.of(), null,
            metadata.environment(labels, null), metadata.location(labels, identifier, automatic), labels);
    }

    private String access(String versionName) {
        AccessSecretVersionResponse response = client.accessSecretVersion(versionName);
        byte[] data = response.getPayload().getData().toByteArray();
        if (response.getPayload().hasDataCrc32C()) {
            CRC32C checksum = new CRC32C();
            checksum.update(data);
            if (response.getPayload().getDataCrc32C() != checksum.getValue()) {
                throw new ProviderException(ErrorCode.PROVIDER_UNAVAILABLE, GcpErrors.PROVIDER, versionName,
                    "Payload checksum mismatch, data corrupted in transit");
            }
        }
        return response.getPayload().getData().toStringUtf8();
    }

    static String versionId(String versionName) {
        return versionName.substring(versionName.lastIndexOf('/') + 1);
    }

    private static Instant instant(Timestamp timestamp) {
        return Instant.ofEpochSecond(timestamp.getSeconds(), timestamp.getNanos());
    }

    private static <T> T gcp(String resource, Supplier<T> call) {
        try {
            return call.get();
        } catch (RuntimeException e) {
            throw GcpErrors.translate(e, resource);
        }
    }
}
