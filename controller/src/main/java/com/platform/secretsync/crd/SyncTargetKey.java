package com.platform.secretsync.crd;

import io.fabric8.kubernetes.api.model.HasMetadata;

/**
 * Namespace/name identity of a sync target.
 */
public record SyncTargetKey(String namespace, String name) {

    public static SyncTargetKey of(HasMetadata resource) {
        return new SyncTargetKey(resource.getMetadata().getNamespace(), resource.getMetadata().getName());
    }

    public static SyncTargetKey parse(String value) {
        int slash = value.indexOf('/');
        if (slash <= 0 || slash == value.length() - 1) {
            throw new IllegalArgumentException("Expected namespace/name but got " + value);
        }
        return new SyncTargetKey(value.substring(0, slash), value.substring(slash + 1));
    }

    @Override
    public String toString() {
        return namespace + "/" + name;
    }
}
