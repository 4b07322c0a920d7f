package com.platform.secretsync.crd;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class SyncTargetSpec {

    private SourceRef sourceRef;

    private ProviderConfig provider;

    private SecretsConfig secrets;

    private ConfigsConfig configs;

    private NotificationsConfig notifications;

    private String gitRepositoryPullInterval = "5m";

    private String reconcileInterval = "1m";

    /**
     * Observe-only mode: divergences are logged, never corrected.
     */
    private boolean diffDiscovery;

    /**
     * Disable provider secrets managed by this target that no longer exist in Git.
     */
    private boolean prune;

    /**
     * When false, only missing secrets are created; existing values are left alone.
     */
    private boolean triggerUpdate = true;

    private boolean suspend;

    private boolean suspendGitPulls;
}
