package com.platform.secretsync.crd;

import io.fabric8.kubernetes.api.model.Namespaced;
import io.fabric8.kubernetes.client.CustomResource;
import io.fabric8.kubernetes.model.annotation.Group;
import io.fabric8.kubernetes.model.annotation.Kind;
import io.fabric8.kubernetes.model.annotation.Plural;
import io.fabric8.kubernetes.model.annotation.ShortNames;
import io.fabric8.kubernetes.model.annotation.Version;

/**
 * Declarative sync target: one service/environment whose Git-tracked secrets are pushed to one
 * provider account.
 */
@Group(SecretManagerConfig.GROUP)
@Version("v1beta1")
@Kind("SecretManagerConfig")
@Plural("secretmanagerconfigs")
@ShortNames("smc")
public class SecretManagerConfig extends CustomResource<SyncTargetSpec, SyncTargetStatus> implements Namespaced {

    public static final String GROUP = "secret-management.microscaler.io";

    /**
     * Annotation whose value change requests an immediate, forced reconcile.
     */
    public static final String RECONCILE_ANNOTATION = GROUP + "/reconcile";

    @Override
    protected SyncTargetStatus initStatus() {
        return new SyncTargetStatus();
    }

    public String reconcileRequest() {
        if (getMetadata() == null || getMetadata().getAnnotations() == null) {
            return null;
        }
        return getMetadata().getAnnotations().get(RECONCILE_ANNOTATION);
    }
}
