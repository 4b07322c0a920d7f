package com.platform.secretsync.source;

import io.fabric8.kubernetes.api.model.GenericKubernetesResource;

import java.util.Optional;

/**
 * Read-only access to GitOps source objects (Flux GitRepository, ArgoCD Application).
 */
public interface SourceObjectReader {

    Optional<GenericKubernetesResource> find(String apiVersion, String kind, String namespace, String name);
}
