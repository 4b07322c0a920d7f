package com.platform.secretsync.reconcile;

import com.platform.secretsync.crd.SyncTargetSpec;
import com.platform.secretsync.error.ErrorCode;
import com.platform.secretsync.error.ValidationException;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Rejects sync target specs that can never reconcile.
 */
@Component
public class SyncTargetValidator {

    static final Duration MIN_PULL_INTERVAL = Duration.ofMinutes(1);

    /**
     * Parsed timing of a valid spec.
     */
    public record Intervals(Duration pull, Duration reconcile) {

        /**
         * Delay until the next scheduled run after a successful one.
         */
        public Duration next() {
            return pull.compareTo(reconcile) < 0 ? pull : reconcile;
        }
    }

    public Intervals validate(SyncTargetSpec spec) {
        if (spec == null) {
            throw new ValidationException(ErrorCode.MISSING_REQUIRED_FIELD, "spec is required");
        }
        if (spec.getSourceRef() == null || isBlank(spec.getSourceRef().getName())) {
            throw missing("sourceRef.name");
        }
        if (spec.getProvider() == null) {
            throw missing("provider");
        }
        spec.getProvider().resolveType();
        if (spec.getSecrets() == null || isBlank(spec.getSecrets().getEnvironment())) {
            throw missing("secrets.environment");
        }
        if (spec.getSecrets().getDecryption() != null && spec.getSecrets().getDecryption().getSecretRef() != null
                && isBlank(spec.getSecrets().getDecryption().getSecretRef().getName())) {
            throw missing("secrets.decryption.secretRef.name");
        }
        return intervals(spec);
    }

    public Intervals intervals(SyncTargetSpec spec) {
        Duration pull = IntervalParser.parse("gitRepositoryPullInterval", spec.getGitRepositoryPullInterval());
        if (pull.compareTo(MIN_PULL_INTERVAL) < 0) {
            throw ValidationException.interval("gitRepositoryPullInterval", spec.getGitRepositoryPullInterval(),
                "must be at least 1m");
        }
        Duration reconcile = IntervalParser.parse("reconcileInterval", spec.getReconcileInterval());
        return new Intervals(pull, reconcile);
    }

    private static ValidationException missing(String field) {
        return new ValidationException(ErrorCode.MISSING_REQUIRED_FIELD, field + " is required");
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
