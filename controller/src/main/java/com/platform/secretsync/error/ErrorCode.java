package com.platform.secretsync.error;

/**
 * Standardized error codes for the secret sync controller.
 * Each error has a unique code that is written to the sync target status.
 *
 * Format: SS-{CATEGORY}{NUMBER}
 * Categories:
 * - 1xx: Sync target configuration errors
 * - 2xx: Source errors (artifact fetch, checksum, clone)
 * - 3xx: Directory resolution errors
 * - 4xx: Decryption errors
 * - 5xx: Provider errors
 * - 6xx: Reconciliation errors
 * - 9xx: Internal errors
 */
public enum ErrorCode {

    // ==================== Configuration Errors (1xx) ====================

    INVALID_SPEC("SS-100", "Invalid sync target configuration", ErrorCategory.CONFIGURATION),
    MISSING_REQUIRED_FIELD("SS-101", "Missing required field", ErrorCategory.CONFIGURATION),
    INVALID_INTERVAL("SS-102", "Invalid interval", ErrorCategory.CONFIGURATION),
    NAME_COLLISION("SS-103", "Canonical secret names collide", ErrorCategory.CONFIGURATION),

    // ==================== Source Errors (2xx) ====================

    SOURCE_NOT_FOUND("SS-200", "Source artifact not available", ErrorCategory.RECOVERABLE),
    CHECKSUM_MISMATCH("SS-201", "Artifact checksum mismatch", ErrorCategory.RECOVERABLE),
    SOURCE_TIMEOUT("SS-202", "Source pull timed out", ErrorCategory.RECOVERABLE),
    SOURCE_FETCH_FAILED("SS-203", "Source fetch failed", ErrorCategory.RECOVERABLE),
    ARCHIVE_INVALID("SS-204", "Artifact archive could not be extracted", ErrorCategory.RECOVERABLE),

    // ==================== Resolution Errors (3xx) ====================

    SERVICE_NOT_FOUND("SS-300", "Service directory not found", ErrorCategory.FATAL),
    PROFILE_NOT_FOUND("SS-301", "Environment profile not found", ErrorCategory.FATAL),
    KUSTOMIZE_BUILD_FAILED("SS-302", "Kustomize build failed", ErrorCategory.FATAL),

    // ==================== Decryption Errors (4xx) ====================

    KEY_NOT_FOUND("SS-400", "Decryption key not found", ErrorCategory.FATAL),
    DECRYPTION_FAILED("SS-401", "Decryption failed", ErrorCategory.FATAL),
    UNSUPPORTED_ENVELOPE("SS-402", "Unsupported envelope format", ErrorCategory.FATAL),
    MAC_MISMATCH("SS-403", "Envelope integrity check failed", ErrorCategory.FATAL),

    // ==================== Provider Errors (5xx) ====================

    PROVIDER_AUTH_FAILED("SS-500", "Provider authentication or authorization failed", ErrorCategory.FATAL),
    PROVIDER_THROTTLED("SS-501", "Provider throttled the request", ErrorCategory.RECOVERABLE),
    PROVIDER_UNAVAILABLE("SS-502", "Provider unavailable", ErrorCategory.RECOVERABLE),
    PROVIDER_NOT_FOUND("SS-503", "Provider resource not found", ErrorCategory.RECOVERABLE),
    PROVIDER_REQUEST_INVALID("SS-504", "Provider rejected the request", ErrorCategory.FATAL),
    PROVIDER_ERROR("SS-505", "Provider error", ErrorCategory.FATAL),

    // ==================== Reconciliation Errors (6xx) ====================

    STATE_TRANSITION_INVALID("SS-600", "Invalid state transition", ErrorCategory.RECOVERABLE),
    RECONCILE_CANCELLED("SS-601", "Reconcile cancelled", ErrorCategory.RECOVERABLE),

    // ==================== Internal Errors (9xx) ====================

    INTERNAL_ERROR("SS-900", "Internal error", ErrorCategory.FATAL),
    RESOURCE_NOT_FOUND("SS-901", "Resource not found", ErrorCategory.RECOVERABLE);

    private final String code;
    private final String defaultMessage;
    private final ErrorCategory category;

    ErrorCode(String code, String defaultMessage, ErrorCategory category) {
        this.code = code;
        this.defaultMessage = defaultMessage;
        this.category = category;
    }

    public String getCode() {
        return code;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }

    public ErrorCategory getCategory() {
        return category;
    }

    public boolean isFatal() {
        return category != ErrorCategory.RECOVERABLE;
    }

    public boolean isRecoverable() {
        return category == ErrorCategory.RECOVERABLE;
    }

    public boolean requiresSpecChange() {
        return category == ErrorCategory.CONFIGURATION;
    }

    /**
     * Error category for distinguishing how the reconciler reacts.
     */
    public enum ErrorCategory {
        /**
         * Transient errors, retried in place.
         */
        RECOVERABLE,

        /**
         * Fatal for the current attempt, retried after backoff.
         */
        FATAL,

        /**
         * The sync target itself is wrong; nothing is retried until its spec changes.
         */
        CONFIGURATION
    }
}
