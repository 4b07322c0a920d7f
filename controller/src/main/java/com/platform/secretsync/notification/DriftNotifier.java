package com.platform.secretsync.notification;

import com.platform.secretsync.canonical.CanonicalSecretBuilder;
import com.platform.secretsync.crd.NotificationsConfig;
import com.platform.secretsync.crd.SecretManagerConfig;
import com.platform.secretsync.crd.SourceRef;
import com.platform.secretsync.crd.SyncTargetKey;
import com.platform.secretsync.diff.SecretDiff;
import com.platform.secretsync.observability.MetricsRegistry;
import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.api.model.ObjectMetaBuilder;
import io.fabric8.kubernetes.api.model.OwnerReferenceBuilder;
import io.fabric8.kubernetes.client.KubernetesClientException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps the drift alert routing of each sync target in line with its {@code notifications} block.
 *
 * <p>For Flux sources a {@code secret-drift-alert-<name>} Alert owned by the sync target points a
 * notification Provider at it. For ArgoCD sources the subscriptions become
 * {@code notifications.argoproj.io/subscribe.*} annotations on the Application. Objects are only
 * written when the block changes. Failures are logged and never fail the reconcile.
 */
@Slf4j
@Component
public class DriftNotifier {

    public static final String ALERT_API_VERSION = "notification.toolkit.fluxcd.io/v1beta2";
    public static final String ALERT_KIND = "Alert";
    static final String ALERT_PREFIX = "secret-drift-alert-";
    static final String SUBSCRIBE_PREFIX = "notifications.argoproj.io/subscribe.";

    /** Routine progress events that should not page anyone. */
    static final List<String> EXCLUDED_EVENTS = List.of(
        ".*Ready.*", ".*ReconciliationSucceeded.*", ".*ReconciliationInProgress.*", ".*Started.*");

    private final NotificationWriter writer;
    private final MetricsRegistry metricsRegistry;
    private final Map<SyncTargetKey, Routing> applied = new ConcurrentHashMap<>();

    /**
     * Routing last written for a target.
     *
     * @param alertProvider Flux Provider of the Alert, null when no Alert should exist
     * @param annotations   subscription annotations set on the Application
     */
    record Routing(NotificationsConfig.ProviderRef alertProvider, Map<String, String> annotations) {

        boolean isEmpty() {
            return alertProvider == null && annotations.isEmpty();
        }
    }

    public DriftNotifier(NotificationWriter writer, MetricsRegistry metricsRegistry) {
        this.writer = writer;
        this.metricsRegistry = metricsRegistry;
    }

    /**
     * Brings the routing objects up to date and reports the divergences of {@code diff}.
     */
    public void onDiff(SecretManagerConfig resource, SecretDiff diff) {
        SyncTargetKey target = SyncTargetKey.of(resource);
        NotificationsConfig config = resource.getSpec().getNotifications();
        SourceRef source = resource.getSpec().getSourceRef();
        Routing next = new Routing(fluxProvider(target, config, source), subscriptions(config, source));

        Routing previous = applied.get(target);
        if (!next.equals(previous)) {
            try {
                syncAlert(resource, target, previous, next);
                syncAnnotations(source, target, previous, next);
                applied.put(target, next);
            } catch (KubernetesClientException e) {
                log.warn("Failed to update drift notifications for {}: {}", target, e.getMessage());
                metricsRegistry.incrementCounter("notifications.errors", "target", target.toString());
            }
        }

        if (!diff.drifts().isEmpty() && !next.isEmpty()) {
            log.warn("{} divergences on {}, alerting through {}", diff.drifts().size(), target,
                next.alertProvider() != null ? "Flux Provider " + next.alertProvider().getName() : "ArgoCD");
            metricsRegistry.incrementCounter("notifications.drift", "target", target.toString());
        }
    }

    public void forget(SyncTargetKey target) {
        applied.remove(target);
    }

    private void syncAlert(SecretManagerConfig resource, SyncTargetKey target, Routing previous, Routing next) {
        String alertName = ALERT_PREFIX + target.name();
        if (next.alertProvider() != null) {
            if (previous == null || !next.alertProvider().equals(previous.alertProvider())) {
                writer.applyAlert(alert(resource, target, next.alertProvider()));
                log.info("Drift alerts of {} routed to Flux Provider {}/{}", target,
                    next.alertProvider().getNamespace(), next.alertProvider().getName());
            }
        } else if (previous == null || previous.alertProvider() != null) {
            // Unknown after a restart, so the delete is attempted once.
            writer.deleteAlert(target.namespace(), alertName);
        }
    }

    private void syncAnnotations(SourceRef source, SyncTargetKey target, Routing previous, Routing next) {
        if (source == null || !SourceRef.ARGOCD_APPLICATION.equals(source.getKind())) {
            return;
        }
        Set<String> stale = new HashSet<>(previous == null ? Set.of() : previous.annotations().keySet());
        stale.removeAll(next.annotations().keySet());
        if (next.annotations().isEmpty() && stale.isEmpty()) {
            return;
        }
        String namespace = source.getNamespace() != null ? source.getNamespace() : target.namespace();
        writer.updateApplicationAnnotations(namespace, source.getName(), next.annotations(), stale);
        log.info("Updated {} notification subscriptions on Application {}/{}", next.annotations().size(),
            namespace, source.getName());
    }

    private static NotificationsConfig.ProviderRef fluxProvider(SyncTargetKey target, NotificationsConfig config,
                                                                SourceRef source) {
        if (config == null || config.getFluxcd() == null || config.getFluxcd().getProviderRef() == null) {
            return null;
        }
        NotificationsConfig.ProviderRef ref = config.getFluxcd().getProviderRef();
        if (ref.getName() == null || ref.getName().isBlank()) {
            return null;
        }
        if (source == null || !SourceRef.FLUX_GIT_REPOSITORY.equals(source.getKind())) {
            log.debug("Skipping Flux alert for {}: source is not a GitRepository", target);
            return null;
        }
        return new NotificationsConfig.ProviderRef(ref.getName(),
            ref.getNamespace() != null ? ref.getNamespace() : target.namespace());
    }

    private static Map<String, String> subscriptions(NotificationsConfig config, SourceRef source) {
        Map<String, String> annotations = new LinkedHashMap<>();
        if (config == null || config.getArgocd() == null || config.getArgocd().getSubscriptions() == null
            || source == null || !SourceRef.ARGOCD_APPLICATION.equals(source.getKind())) {
            return annotations;
        }
        for (NotificationsConfig.Subscription subscription : config.getArgocd().getSubscriptions()) {
            if (isBlank(subscription.getTrigger()) || isBlank(subscription.getService())
                || isBlank(subscription.getChannel())) {
                log.warn("Ignoring incomplete notification subscription {}", subscription);
                continue;
            }
            annotations.put(SUBSCRIBE_PREFIX + subscription.getTrigger() + "." + subscription.getService(),
                subscription.getChannel());
        }
        return annotations;
    }

    static GenericKubernetesResource alert(SecretManagerConfig resource, SyncTargetKey target,
                                           NotificationsConfig.ProviderRef provider) {
        ObjectMetaBuilder metadata = new ObjectMetaBuilder()
            .withName(ALERT_PREFIX + target.name())
            .withNamespace(target.namespace())
            .withLabels(Map.of(CanonicalSecretBuilder.TAG_MANAGED_BY, CanonicalSecretBuilder.MANAGED_BY));
        if (resource.getMetadata().getUid() != null) {
            metadata.withOwnerReferences(new OwnerReferenceBuilder()
                .withApiVersion(resource.getApiVersion())
                .withKind(resource.getKind())
                .withName(target.name())
                .withUid(resource.getMetadata().getUid())
                .withController(true)
                .withBlockOwnerDeletion(true)
                .build());
        }

        Map<String, Object> spec = new LinkedHashMap<>();
        spec.put("providerRef", Map.of("name", provider.getName(), "namespace", provider.getNamespace()));
        spec.put("eventSources", List.of(Map.of(
            "kind", resource.getKind(), "name", target.name(), "namespace", target.namespace())));
        spec.put("exclusionList", EXCLUDED_EVENTS);

        GenericKubernetesResource alert = new GenericKubernetesResource();
        alert.setApiVersion(ALERT_API_VERSION);
        alert.setKind(ALERT_KIND);
        alert.setMetadata(metadata.build());
        alert.setAdditionalProperty("spec", spec);
        return alert;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
