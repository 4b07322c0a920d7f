package com.platform.secretsync.config;

import com.platform.secretsync.provider.ProviderType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for the secret sync controller.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "secretsync")
public class SecretSyncProperties {

    @Valid
    private Reconciler reconciler = new Reconciler();

    @Valid
    private Source source = new Source();

    @Valid
    private Decryption decryption = new Decryption();

    @Valid
    private Kustomize kustomize = new Kustomize();

    @Valid
    private Providers providers = new Providers();

    @Data
    public static class Reconciler {
        /**
         * Size of the worker pool shared by all sync targets.
         */
        @Min(value = 1, message = "At least one reconcile worker is required")
        private int workers = 4;

        @NotNull
        private Duration initialBackoff = Duration.ofSeconds(10);

        @NotNull
        private Duration maxBackoff = Duration.ofMinutes(5);

        /**
         * How long transient failures may persist before the target is reported as degraded.
         */
        @NotNull
        private Duration degradedAfter = Duration.ofMinutes(15);

        @Min(1)
        private int driftHistorySize = 500;

        /**
         * Namespace watched for sync targets; empty means all namespaces.
         */
        private String watchNamespace = "";
    }

    @Data
    public static class Source {
        @NotNull
        private Path cacheDir = Path.of(System.getProperty("java.io.tmpdir"), "secret-sync");

        @NotNull
        private Duration connectTimeout = Duration.ofSeconds(10);

        @NotNull
        private Duration readTimeout = Duration.ofSeconds(60);

        /**
         * Extracted snapshots kept per sync target.
         */
        @Min(value = 1, message = "The current snapshot must be kept")
        private int keepSnapshots = 2;
    }

    @Data
    public static class Kustomize {
        /**
         * Executable run for targets that set {@code secrets.kustomizePath}.
         */
        @NotBlank
        private String binary = "kustomize";

        @NotNull
        private Duration timeout = Duration.ofMinutes(2);
    }

    @Data
    public static class Decryption {
        /**
         * Namespace searched for a SOPS key when the target does not reference one.
         */
        @NotBlank
        private String controllerNamespace = "secret-sync-system";

        @NotEmpty
        private List<String> secretNames = new ArrayList<>(List.of("sops-private-key", "sops-gpg-key", "gpg-key"));

        @NotEmpty
        private List<String> secretFields = new ArrayList<>(
            List.of("private-key", "key", "gpg-key", "age-key", "keys.txt"));
    }

    @Data
    public static class Providers {
        private Map<ProviderType, @Valid RateLimit> rateLimits = new EnumMap<>(ProviderType.class);

        @NotNull
        private Duration callTimeout = Duration.ofSeconds(30);

        /**
         * AWS soft delete recovery window.
         */
        @Min(value = 7, message = "AWS accepts recovery windows of 7 to 30 days")
        @Max(value = 30, message = "AWS accepts recovery windows of 7 to 30 days")
        private int awsRecoveryWindowDays = 7;

        /**
         * Overrides the AWS service endpoint, e.g. for a local emulator.
         */
        private URI awsEndpoint;

        /**
         * Global Parameter Manager endpoint; other locations use the regional
         * {@code https://parametermanager.{location}.rep.googleapis.com/v1}.
         */
        @NotBlank
        private String gcpParameterManagerEndpoint = "https://parametermanager.googleapis.com/v1";

        public RateLimit rateLimit(ProviderType type) {
            return rateLimits.getOrDefault(type, new RateLimit());
        }
    }

    @Data
    public static class RateLimit {
        @Min(1)
        private long permitsPerSecond = 10;

        @Min(1)
        private long burst = 20;
    }
}
