package com.platform.secretsync.notification;

import com.platform.secretsync.crd.SourceRef;
import com.platform.secretsync.source.ArgoCdSourceAdapter;
import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.dsl.NonDeletingOperation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

@Slf4j
@Component
public class KubernetesNotificationWriter implements NotificationWriter {

    private final KubernetesClient client;

    public KubernetesNotificationWriter(KubernetesClient client) {
        this.client = client;
    }

    @Override
    public void applyAlert(GenericKubernetesResource alert) {
        client.genericKubernetesResources(DriftNotifier.ALERT_API_VERSION, DriftNotifier.ALERT_KIND)
            .inNamespace(alert.getMetadata().getNamespace())
            .resource(alert)
            .createOr(NonDeletingOperation::update);
        log.debug("Applied Alert {}/{}", alert.getMetadata().getNamespace(), alert.getMetadata().getName());
    }

    @Override
    public void deleteAlert(String namespace, String name) {
        boolean deleted = !client.genericKubernetesResources(DriftNotifier.ALERT_API_VERSION, DriftNotifier.ALERT_KIND)
            .inNamespace(namespace)
            .withName(name)
            .delete()
            .isEmpty();
        if (deleted) {
            log.info("Deleted Alert {}/{}", namespace, name);
        }
    }

    @Override
    public void updateApplicationAnnotations(String namespace, String name, Map<String, String> annotations,
                                             Set<String> remove) {
        client.genericKubernetesResources(ArgoCdSourceAdapter.API_VERSION, SourceRef.ARGOCD_APPLICATION)
            .inNamespace(namespace)
            .withName(name)
            .edit(application -> {
                Map<String, String> merged = application.getMetadata().getAnnotations() == null
                    ? new HashMap<>()
                    : new HashMap<>(application.getMetadata().getAnnotations());
                remove.forEach(merged::remove);
                merged.putAll(annotations);
                application.getMetadata().setAnnotations(merged);
                return application;
            });
    }
}
