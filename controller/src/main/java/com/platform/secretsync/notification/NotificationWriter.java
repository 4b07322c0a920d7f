package com.platform.secretsync.notification;

import io.fabric8.kubernetes.api.model.GenericKubernetesResource;

import java.util.Map;
import java.util.Set;

/**
 * Writes the GitOps objects that route drift alerts.
 */
public interface NotificationWriter {

    /**
     * Creates the Flux Alert, or replaces the existing one of the same name.
     */
    void applyAlert(GenericKubernetesResource alert);

    void deleteAlert(String namespace, String name);

    /**
     * Sets {@code annotations} on an ArgoCD Application and drops the keys in {@code remove}.
     * Other annotations are left untouched.
     */
    void updateApplicationAnnotations(String namespace, String name, Map<String, String> annotations,
                                      Set<String> remove);
}
