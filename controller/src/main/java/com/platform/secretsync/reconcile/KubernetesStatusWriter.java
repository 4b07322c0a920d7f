package com.platform.secretsync.reconcile;

import com.platform.secretsync.crd.SecretManagerConfig;
import com.platform.secretsync.crd.SyncTargetKey;
import com.platform.secretsync.crd.SyncTargetStatus;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Writes status through the {@code status} subresource. A failed write is logged and retried with
 * the next transition.
 */
@Slf4j
@Component
public class KubernetesStatusWriter implements StatusWriter {

    private final KubernetesClient client;

    public KubernetesStatusWriter(KubernetesClient client) {
        this.client = client;
    }

    @Override
    public void write(SyncTargetKey target, SyncTargetStatus status) {
        try {
            client.resources(SecretManagerConfig.class)
                .inNamespace(target.namespace())
                .withName(target.name())
                .editStatus(resource -> {
                    resource.setStatus(status);
                    return resource;
                });
        } catch (KubernetesClientException e) {
            if (e.getCode() == 404) {
                log.debug("Sync target {} is gone, status not written", target);
            } else {
                log.warn("Failed to write status for {}: {}", target, e.getMessage());
            }
        }
    }
}
