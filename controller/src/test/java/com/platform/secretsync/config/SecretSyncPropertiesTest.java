package com.platform.secretsync.config;

import com.platform.secretsync.provider.ProviderType;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.context.ConfigurationPropertiesAutoConfiguration;
import org.springframework.boot.autoconfigure.validation.ValidationAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class SecretSyncPropertiesTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(
            ConfigurationPropertiesAutoConfiguration.class, ValidationAutoConfiguration.class))
        .withUserConfiguration(SecretSyncProperties.class);

    @Test
    void defaultsApply() {
        runner.run(context -> {
            SecretSyncProperties properties = context.getBean(SecretSyncProperties.class);
            assertThat(properties.getReconciler().getWorkers()).isEqualTo(4);
            assertThat(properties.getReconciler().getMaxBackoff()).isEqualTo(Duration.ofMinutes(5));
            assertThat(properties.getDecryption().getSecretNames()).contains("sops-private-key");
            assertThat(properties.getProviders().rateLimit(ProviderType.AWS).getPermitsPerSecond()).isEqualTo(10);
            assertThat(properties.getKustomize().getBinary()).isEqualTo("kustomize");
            assertThat(properties.getKustomize().getTimeout()).isEqualTo(Duration.ofMinutes(2));
        });
    }

    @Test
    void bindsRelaxedNames() {
        runner.withPropertyValues(
                "secretsync.reconciler.workers=8",
                "secretsync.reconciler.initial-backoff=2s",
                "secretsync.providers.rate-limits.gcp.permits-per-second=3")
            .run(context -> {
                SecretSyncProperties properties = context.getBean(SecretSyncProperties.class);
                assertThat(properties.getReconciler().getWorkers()).isEqualTo(8);
                assertThat(properties.getReconciler().getInitialBackoff()).isEqualTo(Duration.ofSeconds(2));
                assertThat(properties.getProviders().rateLimit(ProviderType.GCP).getPermitsPerSecond()).isEqualTo(3);
            });
    }

    @Test
    void rejectsEmptyWorkerPool() {
        runner.withPropertyValues("secretsync.reconciler.workers=0")
            .run(context -> assertThat(context).hasFailed());
    }

    @Test
    void rejectsBlankKustomizeBinary() {
        runner.withPropertyValues("secretsync.kustomize.binary= ")
            .run(context -> assertThat(context).hasFailed());
    }

    @Test
    void rejectsRecoveryWindowAwsWouldRefuse() {
        runner.withPropertyValues("secretsync.providers.aws-recovery-window-days=3")
            .run(context -> assertThat(context).hasFailed());
    }
}
