package com.platform.secretsync.reconcile;

/**
 * Outcome of the decrypt step, written to {@code status.decryptionStatus}.
 */
public enum DecryptionStatus {
    SUCCESS("Success"),
    TRANSIENT_FAILURE("TransientFailure"),
    PERMANENT_FAILURE("PermanentFailure"),
    NOT_REQUIRED("NotRequired");

    private final String value;

    DecryptionStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
