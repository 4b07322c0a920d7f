package com.platform.secretsync.notification;

import com.platform.secretsync.TestSpecs;
import com.platform.secretsync.crd.NotificationsConfig;
import com.platform.secretsync.crd.SecretManagerConfig;
import com.platform.secretsync.crd.SourceRef;
import com.platform.secretsync.crd.SyncTargetKey;
import com.platform.secretsync.crd.SyncTargetSpec;
import com.platform.secretsync.diff.DriftRecord;
import com.platform.secretsync.diff.DriftType;
import com.platform.secretsync.diff.SecretDiff;
import com.platform.secretsync.observability.MetricsRegistry;
import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anySet;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class DriftNotifierTest {

    private static final SecretDiff NO_DRIFT = new SecretDiff(List.of(), List.of(), List.of(), List.of(), List.of());

    private NotificationWriter writer;
    private SimpleMeterRegistry meterRegistry;
    private DriftNotifier notifier;

    @BeforeEach
    void setUp() {
        writer = mock(NotificationWriter.class);
        meterRegistry = new SimpleMeterRegistry();
        notifier = new DriftNotifier(writer, new MetricsRegistry(meterRegistry));
    }

    @Test
    void buildsAlertOwnedByTheSyncTarget() {
        SecretManagerConfig resource = resource(flux("slack", "monitoring"), SourceRef.FLUX_GIT_REPOSITORY);
        resource.getMetadata().setUid("uid-1");

        notifier.onDiff(resource, NO_DRIFT);

        ArgumentCaptor<GenericKubernetesResource> captor = ArgumentCaptor.forClass(GenericKubernetesResource.class);
        verify(writer).applyAlert(captor.capture());
        GenericKubernetesResource alert = captor.getValue();
        assertThat(alert.getApiVersion()).isEqualTo("notification.toolkit.fluxcd.io/v1beta2");
        assertThat(alert.getKind()).isEqualTo("Alert");
        assertThat(alert.getMetadata().getName()).isEqualTo("secret-drift-alert-billing");
        assertThat(alert.getMetadata().getOwnerReferences()).singleElement()
            .satisfies(owner -> {
                assertThat(owner.getUid()).isEqualTo("uid-1");
                assertThat(owner.getKind()).isEqualTo("SecretManagerConfig");
                assertThat(owner.getController()).isTrue();
            });
        @SuppressWarnings("unchecked")
        Map<String, Object> spec = (Map<String, Object>) alert.getAdditionalProperties().get("spec");
        assertThat(spec.get("providerRef")).isEqualTo(Map.of("name", "slack", "namespace", "monitoring"));
        assertThat(spec.get("eventSources")).isEqualTo(List.of(
            Map.of("kind", "SecretManagerConfig", "name", "billing", "namespace", "team-a")));
        assertThat(spec.get("exclusionList")).isEqualTo(DriftNotifier.EXCLUDED_EVENTS);
    }

    @Test
    void providerNamespaceDefaultsToTargetNamespace() {
        notifier.onDiff(resource(flux("slack", null), SourceRef.FLUX_GIT_REPOSITORY), NO_DRIFT);

        ArgumentCaptor<GenericKubernetesResource> captor = ArgumentCaptor.forClass(GenericKubernetesResource.class);
        verify(writer).applyAlert(captor.capture());
        assertThat(captor.getValue().getMetadata().getOwnerReferences()).isEmpty();
        @SuppressWarnings("unchecked")
        Map<String, Object> spec = (Map<String, Object>) captor.getValue().getAdditionalProperties().get("spec");
        assertThat(spec.get("providerRef")).isEqualTo(Map.of("name", "slack", "namespace", "team-a"));
    }

    @Test
    void unchangedBlockIsNotRewritten() {
        SecretManagerConfig resource = resource(flux("slack", null), SourceRef.FLUX_GIT_REPOSITORY);

        notifier.onDiff(resource, NO_DRIFT);
        notifier.onDiff(resource, NO_DRIFT);

        verify(writer, times(1)).applyAlert(any());
    }

    @Test
    void removingFluxBlockDeletesAlert() {
        notifier.onDiff(resource(flux("slack", null), SourceRef.FLUX_GIT_REPOSITORY), NO_DRIFT);

        notifier.onDiff(resource(null, SourceRef.FLUX_GIT_REPOSITORY), NO_DRIFT);
        notifier.onDiff(resource(null, SourceRef.FLUX_GIT_REPOSITORY), NO_DRIFT);

        verify(writer, times(1)).deleteAlert("team-a", "secret-drift-alert-billing");
    }

    @Test
    void fluxBlockIsIgnoredForArgoCdSources() {
        SecretManagerConfig resource = resource(flux("slack", null), SourceRef.ARGOCD_APPLICATION);

        notifier.onDiff(resource, NO_DRIFT);

        verify(writer, never()).applyAlert(any());
        verify(writer, never()).updateApplicationAnnotations(anyString(), anyString(), anyMap(), anySet());
    }

    @Test
    void argoCdSubscriptionsBecomeApplicationAnnotations() {
        NotificationsConfig notifications = argo(
            new NotificationsConfig.Subscription("drift-detected", "slack", "#secrets"),
            new NotificationsConfig.Subscription("drift-detected", "email", "team@example.com"));

        notifier.onDiff(resource(notifications, SourceRef.ARGOCD_APPLICATION), NO_DRIFT);

        verify(writer).updateApplicationAnnotations("flux-system", "platform-secrets", Map.of(
            "notifications.argoproj.io/subscribe.drift-detected.slack", "#secrets",
            "notifications.argoproj.io/subscribe.drift-detected.email", "team@example.com"), Set.of());
    }

    @Test
    void droppedSubscriptionIsRemovedFromApplication() {
        notifier.onDiff(resource(argo(
            new NotificationsConfig.Subscription("drift-detected", "slack", "#secrets"),
            new NotificationsConfig.Subscription("drift-detected", "email", "team@example.com")),
            SourceRef.ARGOCD_APPLICATION), NO_DRIFT);

        notifier.onDiff(resource(argo(
            new NotificationsConfig.Subscription("drift-detected", "slack", "#secrets")),
            SourceRef.ARGOCD_APPLICATION), NO_DRIFT);

        verify(writer).updateApplicationAnnotations("flux-system", "platform-secrets",
            Map.of("notifications.argoproj.io/subscribe.drift-detected.slack", "#secrets"),
            Set.of("notifications.argoproj.io/subscribe.drift-detected.email"));
    }

    @Test
    void writeFailureDoesNotPropagateAndIsRetried() {
        SecretManagerConfig resource = resource(flux("slack", null), SourceRef.FLUX_GIT_REPOSITORY);
        doThrow(new KubernetesClientException("forbidden", 403, null)).when(writer).applyAlert(any());

        assertThatCode(() -> notifier.onDiff(resource, NO_DRIFT)).doesNotThrowAnyException();
        notifier.onDiff(resource, NO_DRIFT);

        verify(writer, times(2)).applyAlert(any());
        assertThat(meterRegistry.counter("notifications.errors", "target", "team-a/billing").count())
            .isEqualTo(2.0);
    }

    @Test
    void driftIsCountedOnlyWhenRoutingIsConfigured() {
        SecretDiff drifted = new SecretDiff(List.of(), List.of(), List.of(), List.of(), List.of(
            DriftRecord.create("team-a/billing", "billing-DB_PASSWORD", DriftType.VALUE_CHANGED, "***", "***",
                "UPDATE")));

        notifier.onDiff(resource(null, SourceRef.FLUX_GIT_REPOSITORY), drifted);
        assertThat(meterRegistry.find("notifications.drift").counter()).isNull();

        notifier.onDiff(resource(flux("slack", null), SourceRef.FLUX_GIT_REPOSITORY), drifted);
        assertThat(meterRegistry.counter("notifications.drift", "target", "team-a/billing").count())
            .isEqualTo(1.0);
    }

    @Test
    void forgetResetsKnownRouting() {
        SecretManagerConfig resource = resource(flux("slack", null), SourceRef.FLUX_GIT_REPOSITORY);
        notifier.onDiff(resource, NO_DRIFT);

        notifier.forget(SyncTargetKey.of(resource));
        notifier.onDiff(resource, NO_DRIFT);

        verify(writer, times(2)).applyAlert(any());
    }

    private static NotificationsConfig flux(String provider, String namespace) {
        NotificationsConfig notifications = new NotificationsConfig();
        notifications.setFluxcd(new NotificationsConfig.FluxNotifications(
            new NotificationsConfig.ProviderRef(provider, namespace)));
        return notifications;
    }

    private static NotificationsConfig argo(NotificationsConfig.Subscription... subscriptions) {
        NotificationsConfig notifications = new NotificationsConfig();
        notifications.setArgocd(new NotificationsConfig.ArgoCdNotifications(List.of(subscriptions)));
        return notifications;
    }

    private static SecretManagerConfig resource(NotificationsConfig notifications, String sourceKind) {
        SyncTargetSpec spec = TestSpecs.gcp("prod");
        spec.getSourceRef().setKind(sourceKind);
        spec.setNotifications(notifications);
        return TestSpecs.resource("team-a", "billing", 1, spec);
    }
}
