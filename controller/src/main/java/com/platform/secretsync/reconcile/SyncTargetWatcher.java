package com.platform.secretsync.reconcile;

import com.platform.secretsync.config.SecretSyncProperties;
import com.platform.secretsync.crd.SecretManagerConfig;
import com.platform.secretsync.crd.SecretsConfig;
import com.platform.secretsync.crd.SourceRef;
import com.platform.secretsync.crd.SyncTargetKey;
import com.platform.secretsync.crypto.DecryptionKeyProvider;
import com.platform.secretsync.observability.MetricsRegistry;
import com.platform.secretsync.source.ArgoCdSourceAdapter;
import com.platform.secretsync.source.FluxSourceAdapter;
import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.Secret;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.dsl.Informable;
import io.fabric8.kubernetes.client.dsl.MixedOperation;
import io.fabric8.kubernetes.client.informers.ResourceEventHandler;
import io.fabric8.kubernetes.client.informers.SharedIndexInformer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * Feeds cluster events into the reconcile scheduler: sync target lifecycle, source object
 * changes and key Secret changes.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "secretsync.watch", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SyncTargetWatcher {

    private final KubernetesClient client;
    private final ReconcileScheduler scheduler;
    private final DecryptionKeyProvider keys;
    private final MetricsRegistry metricsRegistry;
    private final String watchNamespace;
    private final List<SharedIndexInformer<?>> informers = new ArrayList<>();

    public SyncTargetWatcher(KubernetesClient client, ReconcileScheduler scheduler, DecryptionKeyProvider keys,
                             MetricsRegistry metricsRegistry, SecretSyncProperties properties) {
        this.client = client;
        this.scheduler = scheduler;
        this.keys = keys;
        this.metricsRegistry = metricsRegistry;
        this.watchNamespace = properties.getReconciler().getWatchNamespace();
    }

    public synchronized void start() {
        if (!informers.isEmpty()) {
            return;
        }
        log.info("Starting watches in {}", watchNamespace.isBlank() ? "all namespaces" : "namespace " + watchNamespace);

        inform("SecretManagerConfig", scoped(client.resources(SecretManagerConfig.class)),
            handler(this::onTargetChanged, (old, current) -> onTargetChanged(current), this::onTargetDeleted));

        inform(SourceRef.FLUX_GIT_REPOSITORY,
            scoped(client.genericKubernetesResources(FluxSourceAdapter.API_VERSION, SourceRef.FLUX_GIT_REPOSITORY)),
            handler(r -> onSourceChanged(SourceRef.FLUX_GIT_REPOSITORY, r),
                this::onFluxSourceUpdated,
                r -> onSourceChanged(SourceRef.FLUX_GIT_REPOSITORY, r)));

        inform(SourceRef.ARGOCD_APPLICATION,
            scoped(client.genericKubernetesResources(ArgoCdSourceAdapter.API_VERSION, SourceRef.ARGOCD_APPLICATION)),
            handler(r -> onSourceChanged(SourceRef.ARGOCD_APPLICATION, r),
                this::onArgoSourceUpdated,
                r -> onSourceChanged(SourceRef.ARGOCD_APPLICATION, r)));

        // Key Secrets may live outside the watched namespace.
        inform("Secret", client.secrets().inAnyNamespace(),
            handler(this::onSecretChanged, (old, current) -> onSecretUpdated(old, current), this::onSecretChanged));
    }

    public synchronized void stop() {
        informers.forEach(SharedIndexInformer::stop);
        informers.clear();
        log.info("Watches stopped");
    }

    public synchronized boolean isWatching() {
        return !informers.isEmpty() && informers.stream().allMatch(SharedIndexInformer::isRunning);
    }

    void onTargetChanged(SecretManagerConfig resource) {
        scheduler.upsert(resource);
        metricsRegistry.setActiveTargets(scheduler.knownTargets().size());
    }

    void onTargetDeleted(SecretManagerConfig resource) {
        scheduler.remove(SyncTargetKey.of(resource));
        metricsRegistry.setActiveTargets(scheduler.knownTargets().size());
    }

    void onSourceChanged(String kind, HasMetadata source) {
        String namespace = source.getMetadata().getNamespace();
        String name = source.getMetadata().getName();
        Set<SyncTargetKey> affected = scheduler.targetsMatching(resource -> references(resource, kind, namespace, name));
        if (!affected.isEmpty()) {
            log.info("{} {}/{} changed, waking {} targets", kind, namespace, name, affected.size());
        }
        affected.forEach(key -> scheduler.wake(key, ReconcileScheduler.WakeReason.SOURCE_CHANGED));
    }

    void onSecretChanged(Secret secret) {
        String namespace = secret.getMetadata().getNamespace();
        String name = secret.getMetadata().getName();
        Set<SyncTargetKey> affected = new HashSet<>(keys.invalidate(namespace, name));
        affected.addAll(scheduler.targetsMatching(resource -> referencesKey(resource, namespace, name)));
        if (keys.isDefaultKeySecret(namespace, name)) {
            affected.addAll(scheduler.targetsMatching(resource -> !hasExplicitKey(resource)));
        }
        affected.forEach(key -> scheduler.wake(key, ReconcileScheduler.WakeReason.CREDENTIAL_CHANGED));
    }

    private void onSecretUpdated(Secret old, Secret current) {
        if (old != null && Objects.equals(old.getData(), current.getData())
            && Objects.equals(old.getStringData(), current.getStringData())) {
            return;
        }
        onSecretChanged(current);
    }

    private void onFluxSourceUpdated(GenericKubernetesResource old, GenericKubernetesResource current) {
        if (!Objects.equals(fluxRevision(old), fluxRevision(current))) {
            onSourceChanged(SourceRef.FLUX_GIT_REPOSITORY, current);
        }
    }

    private void onArgoSourceUpdated(GenericKubernetesResource old, GenericKubernetesResource current) {
        if (!Objects.equals(specOf(old), specOf(current)) || !Objects.equals(argoRevision(old), argoRevision(current))) {
            onSourceChanged(SourceRef.ARGOCD_APPLICATION, current);
        }
    }

    static boolean references(SecretManagerConfig resource, String kind, String namespace, String name) {
        SourceRef ref = resource.getSpec() != null ? resource.getSpec().getSourceRef() : null;
        if (ref == null || !kind.equals(ref.getKind()) || !name.equals(ref.getName())) {
            return false;
        }
        String refNamespace = ref.getNamespace() != null ? ref.getNamespace() : resource.getMetadata().getNamespace();
        return namespace.equals(refNamespace);
    }

    static boolean referencesKey(SecretManagerConfig resource, String namespace, String name) {
        if (!hasExplicitKey(resource)) {
            return false;
        }
        SecretsConfig.SecretKeyRef ref = keyRef(resource);
        String refNamespace = ref.getNamespace() != null ? ref.getNamespace() : resource.getMetadata().getNamespace();
        return name.equals(ref.getName()) && namespace.equals(refNamespace);
    }

    private static boolean hasExplicitKey(SecretManagerConfig resource) {
        SecretsConfig.SecretKeyRef ref = keyRef(resource);
        return ref != null && ref.getName() != null && !ref.getName().isBlank();
    }

    private static SecretsConfig.SecretKeyRef keyRef(SecretManagerConfig resource) {
        if (resource.getSpec() == null || resource.getSpec().getSecrets() == null
            || resource.getSpec().getSecrets().getDecryption() == null) {
            return null;
        }
        return resource.getSpec().getSecrets().getDecryption().getSecretRef();
    }

    private static Object fluxRevision(GenericKubernetesResource resource) {
        if (resource == null || !(resource.getAdditionalProperties().get("status") instanceof Map<?, ?> status)) {
            return null;
        }
        Object artifact = status.get("artifact");
        return artifact instanceof Map<?, ?> map ? map.get("revision") : null;
    }

    private static Object argoRevision(GenericKubernetesResource resource) {
        if (resource == null || !(resource.getAdditionalProperties().get("status") instanceof Map<?, ?> status)) {
            return null;
        }
        Object sync = status.get("sync");
        return sync instanceof Map<?, ?> map ? map.get("revision") : null;
    }

    private static Object specOf(GenericKubernetesResource resource) {
        return resource == null ? null : resource.getAdditionalProperties().get("spec");
    }

    private <T extends HasMetadata> void inform(String kind, Informable<T> source, ResourceEventHandler<T> handler) {
        SharedIndexInformer<T> informer = source.runnableInformer(0);
        informer.addEventHandler(handler);
        informer.start().whenComplete((ignored, error) -> {
            if (error != null) {
                log.warn("Watch on {} failed to start: {}", kind, error.getMessage());
            } else {
                log.info("Watch on {} synced", kind);
            }
        });
        informers.add(informer);
    }

    private <T extends HasMetadata> Informable<T> scoped(MixedOperation<T, ?, ?> operation) {
        return watchNamespace.isBlank() ? operation.inAnyNamespace() : operation.inNamespace(watchNamespace);
    }

    private static <T> ResourceEventHandler<T> handler(Consumer<T> onAdd, BiConsumer<T, T> onUpdate,
                                                       Consumer<T> onDelete) {
        return new ResourceEventHandler<>() {
            @Override
            public void onAdd(T obj) {
                dispatch(() -> onAdd.accept(obj));
            }

            @Override
            public void onUpdate(T oldObj, T newObj) {
                dispatch(() -> onUpdate.accept(oldObj, newObj));
            }

            @Override
            public void onDelete(T obj, boolean deletedFinalStateUnknown) {
                dispatch(() -> onDelete.accept(obj));
            }
        };
    }

    private static void dispatch(Runnable action) {
        try {
            action.run();
        } catch (RuntimeException e) {
            log.error("Failed to handle watch event", e);
        }
    }
}
