package com.platform.secretsync.crd;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Where drift alerts are routed. The Flux and ArgoCD blocks are independent; each only applies
 * when the target's source is of the matching kind.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class NotificationsConfig {

    private FluxNotifications fluxcd;

    private ArgoCdNotifications argocd;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class FluxNotifications {
        private ProviderRef providerRef;
    }

    /**
     * Flux notification Provider; the namespace defaults to the sync target's.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ProviderRef {
        private String name;
        private String namespace;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ArgoCdNotifications {
        private List<Subscription> subscriptions = new ArrayList<>();
    }

    /**
     * One {@code notifications.argoproj.io/subscribe.<trigger>.<service>: <channel>} annotation.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Subscription {
        private String trigger;
        private String service;
        private String channel;
    }
}
