package com.platform.secretsync.reconcile;

import com.platform.secretsync.canonical.CanonicalSecret;
import com.platform.secretsync.canonical.CanonicalSecretBuilder;
import com.platform.secretsync.canonical.CanonicalSet;
import com.platform.secretsync.canonical.ConfigEntry;
import com.platform.secretsync.canonical.ParsedFile;
import com.platform.secretsync.config.SecretSyncProperties;
import com.platform.secretsync.crd.SecretManagerConfig;
import com.platform.secretsync.crd.SecretsConfig;
import com.platform.secretsync.crd.SyncTargetKey;
import com.platform.secretsync.crd.SyncTargetSpec;
import com.platform.secretsync.crd.SyncTargetStatus;
import com.platform.secretsync.crypto.DecryptionKeyProvider;
import com.platform.secretsync.crypto.KeyMaterial;
import com.platform.secretsync.crypto.SecretDecryptor;
import com.platform.secretsync.diff.ActualState;
import com.platform.secretsync.diff.DiffEngine;
import com.platform.secretsync.diff.DriftRecord;
import com.platform.secretsync.diff.SecretDiff;
import com.platform.secretsync.error.DecryptionException;
import com.platform.secretsync.error.ErrorCode;
import com.platform.secretsync.error.ReconcileCancelledException;
import com.platform.secretsync.error.SecretSyncException;
import com.platform.secretsync.error.ValidationException;
import com.platform.secretsync.kustomize.KustomizeBuilder;
import com.platform.secretsync.kustomize.KustomizeOutputParser;
import com.platform.secretsync.notification.DriftNotifier;
import com.platform.secretsync.observability.LoggingConfig;
import com.platform.secretsync.observability.MetricsRegistry;
import com.platform.secretsync.parser.SecretFileParser;
import com.platform.secretsync.provider.ProviderClientFactory;
import com.platform.secretsync.provider.ProviderClients;
import com.platform.secretsync.provider.ProviderSecretRecord;
import com.platform.secretsync.resolver.DirectoryResolver;
import com.platform.secretsync.resolver.EntryClassification;
import com.platform.secretsync.resolver.ParsedEntry;
import com.platform.secretsync.source.Snapshot;
import com.platform.secretsync.source.SnapshotCache;
import com.platform.secretsync.source.SourceAdapterRegistry;
import com.platform.secretsync.state.SyncPhase;
import com.platform.secretsync.state.SyncStateMachine;
import com.platform.secretsync.state.SyncTargetContext;
import io.fabric8.kubernetes.client.KubernetesClientException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Drives one sync target through pull, parse, decrypt, build, diff and apply.
 * Callers guarantee that at most one reconcile per target runs at a time.
 */
@Slf4j
@Component
public class ReconciliationEngine {

    private final SyncStateMachine stateMachine;
    private final StatusPublisher statusPublisher;
    private final SyncTargetValidator validator;
    private final SourceAdapterRegistry sources;
    private final SnapshotCache snapshotCache;
    private final DirectoryResolver resolver;
    private final SecretFileParser parser;
    private final SecretDecryptor decryptor;
    private final DecryptionKeyProvider keys;
    private final KustomizeBuilder kustomizeBuilder;
    private final KustomizeOutputParser kustomizeParser;
    private final CanonicalSecretBuilder builder;
    private final DiffEngine diffEngine;
    private final ProviderClientFactory providers;
    private final DriftHistory driftHistory;
    private final DriftNotifier notifier;
    private final MetricsRegistry metricsRegistry;
    private final Duration degradedAfter;

    private final Map<SyncTargetKey, Snapshot> lastSnapshots = new ConcurrentHashMap<>();

    public ReconciliationEngine(SyncStateMachine stateMachine, StatusPublisher statusPublisher,
                                SyncTargetValidator validator, SourceAdapterRegistry sources,
                                SnapshotCache snapshotCache, DirectoryResolver resolver, SecretFileParser parser,
                                SecretDecryptor decryptor, DecryptionKeyProvider keys,
                                KustomizeBuilder kustomizeBuilder, KustomizeOutputParser kustomizeParser,
                                CanonicalSecretBuilder builder, DiffEngine diffEngine,
                                ProviderClientFactory providers, DriftHistory driftHistory, DriftNotifier notifier,
                                MetricsRegistry metricsRegistry, SecretSyncProperties properties) {
        this.stateMachine = stateMachine;
        this.statusPublisher = statusPublisher;
        this.validator = validator;
        this.sources = sources;
        this.snapshotCache = snapshotCache;
        this.resolver = resolver;
        this.parser = parser;
        this.decryptor = decryptor;
        this.keys = keys;
        this.kustomizeBuilder = kustomizeBuilder;
        this.kustomizeParser = kustomizeParser;
        this.builder = builder;
        this.diffEngine = diffEngine;
        this.providers = providers;
        this.driftHistory = driftHistory;
        this.notifier = notifier;
        this.metricsRegistry = metricsRegistry;
        this.degradedAfter = properties.getReconciler().getDegradedAfter();
    }

    /**
     * Decrypted and parsed files of one reconcile.
     */
    record FileResults(List<ParsedFile> files, List<SyncTargetStatus.FailedFile> failed,
                       DecryptionStatus decryptionStatus, Boolean keyAvailable) {
    }

    public ReconcileOutcome reconcile(ReconcileRequest request) {
        SecretManagerConfig resource = request.resource();
        SyncTargetKey target = SyncTargetKey.of(resource);
        SyncTargetSpec spec = resource.getSpec();
        Instant start = Instant.now();
        boolean pulled = false;

        LoggingConfig.setTargetContext(target.toString(), providerId(spec));
        statusPublisher.record(target, StatusPublisher.Details.of(resource.getMetadata().getGeneration()));
        try {
            if (spec != null && spec.isSuspend()) {
                log.info("Sync target {} is suspended", target);
                return ReconcileOutcome.of(ReconcileOutcome.Result.SUSPENDED, false, "suspended");
            }
            begin(target);
            validator.validate(spec);

            stateMachine.transition(target, SyncPhase.PULLING,
                "Pulling " + spec.getSourceRef().describe(target.namespace()));
            Snapshot previous = lastSnapshots.get(target);
            Snapshot snapshot = pull(target, spec, request.pullDue());
            pulled = snapshot != previous;
            LoggingConfig.setRevision(snapshot.revision());
            request.token().checkpoint(target);

            SecretsConfig secrets = spec.getSecrets();
            boolean kustomize = secrets.getKustomizePath() != null && !secrets.getKustomizePath().isBlank();
            stateMachine.transition(target, SyncPhase.PARSING, (kustomize
                ? "Using kustomization " + secrets.getKustomizePath()
                : "Resolving " + secrets.getEnvironment() + " profile") + " at revision " + snapshot.revision());
            List<ParsedEntry> entries = kustomize
                ? List.of()
                : resolver.resolve(snapshot.contentRoot(), secrets.getBasePath(), secrets.getPrefix(),
                    secrets.getEnvironment());
            request.token().checkpoint(target);

            FileResults results;
            if (kustomize) {
                stateMachine.transition(target, SyncPhase.DECRYPTING,
                    "Rendering kustomization " + secrets.getKustomizePath());
                results = renderKustomization(target, secrets, snapshot);
            } else {
                stateMachine.transition(target, SyncPhase.DECRYPTING, "Decrypting " + entries.size() + " files");
                results = decryptAndParse(target, spec, entries);
            }
            statusPublisher.record(target, statusPublisher.details(target)
                .withDecryption(results.failed(), results.decryptionStatus(), results.keyAvailable()));
            request.token().checkpoint(target);

            stateMachine.transition(target, SyncPhase.BUILDING_CANONICAL,
                "Building desired state from " + results.files().size() + " files");
            CanonicalSet desired = builder.build(target, spec, results.files());
            request.token().checkpoint(target);

            stateMachine.transition(target, SyncPhase.DIFFING,
                "Comparing " + desired.secrets().size() + " secrets and " + desired.configs().size() + " configs");
            ProviderClients clients = providers.forTarget(spec);
            // A file that failed to decrypt must not make its secrets look deleted.
            boolean prune = spec.isPrune() && results.failed().isEmpty();
            ActualState actual = readActual(target, desired, clients, prune);
            SecretDiff diff = diffEngine.diff(target.toString(), desired, actual,
                new DiffEngine.Options(spec.isTriggerUpdate(), prune));
            diff.drifts().forEach(d -> metricsRegistry.recordDrift(target.toString(), d.driftType().name()));
            notifier.onDiff(resource, diff);
            request.token().checkpoint(target);

            int synced = desired.secrets().size() + desired.configs().size();
            if (spec.isDiffDiscovery()) {
                diffEngine.report(diff);
                driftHistory.addAll(diff.drifts());
                succeed(target, snapshot, synced, diff.drifts().isEmpty()
                    ? "In sync (diff discovery)"
                    : diff.drifts().size() + " divergences observed (diff discovery, nothing applied)");
                return finish(target, start, ReconcileOutcome.synced(pulled, 0, "observed"));
            }
            if (diff.isEmpty()) {
                driftHistory.addAll(diff.drifts());
                succeed(target, snapshot, synced, "In sync at " + snapshot.revision());
                return finish(target, start, ReconcileOutcome.synced(pulled, 0, "in sync"));
            }

            stateMachine.transition(target, SyncPhase.APPLYING, "Applying " + diff.writeCount() + " changes");
            int writes = apply(clients, diff);
            driftHistory.addAll(diff.drifts().stream().map(DriftRecord::markResolved).toList());
            succeed(target, snapshot, synced, "Applied " + writes + " changes at " + snapshot.revision());
            return finish(target, start, ReconcileOutcome.synced(pulled, writes, "applied"));

        } catch (ReconcileCancelledException e) {
            log.info("Reconcile of {} cancelled", target);
            return finish(target, start, ReconcileOutcome.of(ReconcileOutcome.Result.CANCELLED, pulled,
                e.getMessage()));
        } catch (SecretSyncException e) {
            return finish(target, start, handleFailure(target, e, pulled));
        } catch (KubernetesClientException e) {
            log.warn("Kubernetes API call failed while reconciling {}: {}", target, e.getMessage());
            return finish(target, start, retry(target, "Kubernetes API error: " + e.getMessage(), pulled));
        } catch (RuntimeException e) {
            log.error("Unexpected error reconciling {}", target, e);
            stateMachine.fail(target, "[" + ErrorCode.INTERNAL_ERROR.getCode() + "] " + e.getMessage(), false);
            return finish(target, start, ReconcileOutcome.of(ReconcileOutcome.Result.FAILED, pulled,
                e.getMessage()));
        } finally {
            LoggingConfig.clearTargetContext();
        }
    }

    /**
     * Drops all per target state once the target is deleted.
     */
    public void forget(SyncTargetKey target) {
        lastSnapshots.remove(target);
        keys.evict(target);
        snapshotCache.evict(target);
        statusPublisher.forget(target);
        notifier.forget(target);
        stateMachine.remove(target);
    }

    private void begin(SyncTargetKey target) {
        SyncTargetContext context = stateMachine.getContext(target);
        if (context == null) {
            stateMachine.initialize(target);
        } else if (context.phase() != SyncPhase.PENDING) {
            if (context.phase().isIdle()) {
                stateMachine.transition(target, SyncPhase.PENDING, "Reconcile started");
            } else {
                stateMachine.reset(target, "Previous reconcile did not finish");
            }
        }
    }

    private Snapshot pull(SyncTargetKey target, SyncTargetSpec spec, boolean pullDue) {
        Snapshot last = lastSnapshots.get(target);
        boolean cached = last != null && Files.isDirectory(last.contentRoot());
        if (cached && (!pullDue || spec.isSuspendGitPulls())) {
            log.debug("Reusing snapshot {} of {}", last.revision(), target);
            return last;
        }
        Snapshot snapshot = sources.forRef(spec.getSourceRef()).pull(target, spec.getSourceRef());
        if (snapshot.sameContentAs(last)) {
            log.debug("Source of {} unchanged at {}", target, snapshot.revision());
        } else {
            log.info("Pulled revision {} (checksum {}) for {}", snapshot.revision(), snapshot.checksum(), target);
        }
        lastSnapshots.put(target, snapshot);
        return snapshot;
    }

    /**
     * Values of the Secret and ConfigMap objects rendered by the target's kustomization. Encrypted
     * inputs are the business of kustomize plugins, so nothing is decrypted here.
     */
    FileResults renderKustomization(SyncTargetKey target, SecretsConfig secrets, Snapshot snapshot) {
        String path = secrets.getKustomizePath();
        KustomizeOutputParser.Output output = kustomizeParser.parse(
            kustomizeBuilder.build(snapshot.contentRoot(), path));
        String service = secrets.getPrefix() != null && !secrets.getPrefix().isBlank()
            ? secrets.getPrefix()
            : target.name();

        List<ParsedFile> files = new ArrayList<>();
        files.add(new ParsedFile(new ParsedEntry(path, new byte[0], EntryClassification.ENCRYPTED_SECRET, service,
            secrets.getEnvironment()), output.secrets()));
        if (!output.configs().isEmpty()) {
            files.add(new ParsedFile(new ParsedEntry(path, new byte[0], EntryClassification.PLAINTEXT_CONFIG,
                service, secrets.getEnvironment()), output.configs()));
        }
        log.info("Kustomization {} of {} rendered {} secrets and {} config values", path, target,
            output.secrets().size(), output.configs().size());
        return new FileResults(files, List.of(), DecryptionStatus.NOT_REQUIRED, null);
    }

    FileResults decryptAndParse(SyncTargetKey target, SyncTargetSpec spec, List<ParsedEntry> entries) {
        SecretsConfig.SecretKeyRef keyRef = spec.getSecrets().getDecryption() == null
            ? null
            : spec.getSecrets().getDecryption().getSecretRef();
        List<ParsedFile> files = new ArrayList<>();
        List<SyncTargetStatus.FailedFile> failed = new ArrayList<>();
        boolean encrypted = false;

        for (ParsedEntry entry : entries) {
            try {
                byte[] plaintext = entry.content();
                if (entry.classification() == EntryClassification.ENCRYPTED_SECRET) {
                    if (decryptor.isEncrypted(entry.content(), entry.format())) {
                        encrypted = true;
                        try (KeyMaterial key = keys.open(target, keyRef)) {
                            plaintext = decryptor.decrypt(entry.content(), entry.format(), key);
                        }
                    } else {
                        log.warn("{} is not encrypted, reading it as plaintext", entry.relativePath());
                    }
                }
                files.add(new ParsedFile(entry, parser.parse(entry.format(), plaintext)));
            } catch (DecryptionException e) {
                if (e.isKeyMissing()) {
                    statusPublisher.record(target, statusPublisher.details(target)
                        .withDecryption(List.of(), DecryptionStatus.PERMANENT_FAILURE, false));
                    throw e;
                }
                log.error("Failed to decrypt {}: {}", entry.relativePath(), e.getMessage());
                metricsRegistry.recordDecryptionFailure(target.toString());
                failed.add(new SyncTargetStatus.FailedFile(entry.relativePath(),
                    "[" + e.getErrorCode().getCode() + "] " + e.getMessage()));
            } catch (KubernetesClientException e) {
                statusPublisher.record(target, statusPublisher.details(target)
                    .withDecryption(List.of(), DecryptionStatus.TRANSIENT_FAILURE, null));
                throw e;
            } catch (ValidationException e) {
                log.error("Failed to parse {}: {}", entry.relativePath(), e.getMessage());
                failed.add(new SyncTargetStatus.FailedFile(entry.relativePath(),
                    "[" + e.getErrorCode().getCode() + "] " + e.getMessage()));
            }
        }

        DecryptionStatus status;
        if (!encrypted && failed.isEmpty()) {
            status = DecryptionStatus.NOT_REQUIRED;
        } else if (failed.isEmpty()) {
            status = DecryptionStatus.SUCCESS;
        } else {
            status = DecryptionStatus.PERMANENT_FAILURE;
        }
        return new FileResults(files, failed, status, encrypted ? Boolean.TRUE : null);
    }

    private ActualState readActual(SyncTargetKey target, CanonicalSet desired, ProviderClients clients,
                                   boolean prune) {
        Map<String, ProviderSecretRecord> records = new HashMap<>();
        for (CanonicalSecret secret : desired.secrets()) {
            clients.secrets().getMetadata(secret.name()).ifPresent(record -> records.put(secret.name(), record));
        }
        List<ProviderSecretRecord> managed = List.of();
        if (prune) {
            String tag = CanonicalSecretBuilder.syncTargetTag(target);
            managed = clients.secrets().listActive(tag).stream()
                .filter(record -> record.isManagedBy(tag))
                .toList();
        }
        Map<String, String> configValues = new HashMap<>();
        if (clients.configs() != null) {
            for (ConfigEntry config : desired.configs()) {
                clients.configs().getValue(config)
                    .ifPresent(value -> configValues.put(ActualState.configKey(config), value));
            }
        }
        return new ActualState(records, managed, configValues);
    }

    /**
     * Applies creates, then updates, then disables. Writes already started always run to completion.
     */
    int apply(ProviderClients clients, SecretDiff diff) {
        int writes = 0;
        String provider = clients.secrets().type().id();
        for (CanonicalSecret secret : diff.toCreate()) {
            clients.secrets().create(secret);
            metricsRegistry.recordSecretWrite(provider, "create");
            writes++;
        }
        for (CanonicalSecret secret : diff.toUpdate()) {
            clients.secrets().putValue(secret);
            metricsRegistry.recordSecretWrite(provider, "update");
            writes++;
        }
        for (String name : diff.toDisable()) {
            clients.secrets().disable(name);
            metricsRegistry.recordSecretWrite(provider, "disable");
            writes++;
        }
        if (!diff.configsToWrite().isEmpty()) {
            if (clients.configs() == null) {
                throw new ValidationException(ErrorCode.INVALID_SPEC, "configs are routed but no config store is set up");
            }
            for (ConfigEntry config : diff.configsToWrite()) {
                clients.configs().putValue(config);
                metricsRegistry.recordSecretWrite(provider, "config");
                writes++;
            }
        }
        log.info("Applied {} creates, {} updates, {} disables, {} config writes", diff.toCreate().size(),
            diff.toUpdate().size(), diff.toDisable().size(), diff.configsToWrite().size());
        return writes;
    }

    private void succeed(SyncTargetKey target, Snapshot snapshot, int synced, String description) {
        stateMachine.succeed(target, description, snapshot.revision(), snapshot.checksum(), synced);
    }

    private ReconcileOutcome handleFailure(SyncTargetKey target, SecretSyncException e, boolean pulled) {
        SyncTargetContext context = stateMachine.getContext(target);
        SyncPhase step = context == null ? SyncPhase.PENDING : context.phase();
        String reason = String.format("%s failed: [%s] %s", step, e.getErrorCode().getCode(), e.getMessage());

        if (e.getErrorCode().requiresSpecChange()) {
            log.error("Sync target {} is misconfigured: {}", target, e.getMessage());
            statusPublisher.record(target, statusPublisher.details(target).withConfigError(true));
            stateMachine.fail(target, reason, false);
            return ReconcileOutcome.of(ReconcileOutcome.Result.CONFIG_ERROR, pulled, reason);
        }
        if (e.isRetryable()) {
            log.warn("Transient failure reconciling {}: {}", target, reason);
            return retry(target, reason, pulled);
        }
        log.error("Reconcile of {} failed: {}", target, reason);
        stateMachine.fail(target, reason, false);
        return ReconcileOutcome.of(ReconcileOutcome.Result.FAILED, pulled, reason);
    }

    private ReconcileOutcome retry(SyncTargetKey target, String reason, boolean pulled) {
        SyncTargetContext context = stateMachine.getContext(target);
        Instant since = context == null || context.firstFailureTime() == null ? Instant.now()
            : context.firstFailureTime();
        boolean degraded = Duration.between(since, Instant.now()).compareTo(degradedAfter) >= 0;
        if (degraded) {
            log.warn("Sync target {} degraded: failing since {}", target, since);
        }
        stateMachine.retry(target, reason, degraded);
        return ReconcileOutcome.of(ReconcileOutcome.Result.RETRY, pulled, reason);
    }

    private ReconcileOutcome finish(SyncTargetKey target, Instant start, ReconcileOutcome outcome) {
        metricsRegistry.recordReconcile(target.toString(), outcome.result().name().toLowerCase(),
            Duration.between(start, Instant.now()));
        return outcome;
    }

    private static String providerId(SyncTargetSpec spec) {
        if (spec == null || spec.getProvider() == null) {
            return null;
        }
        if (spec.getProvider().getType() != null) {
            return spec.getProvider().getType().id();
        }
        return spec.getProvider().getAws() != null ? "aws"
            : spec.getProvider().getAzure() != null ? "azure"
            : spec.getProvider().getGcp() != null ? "gcp" : null;
    }
}
