package com.platform.secretsync.error;

/**
 * Base exception for all secret sync exceptions.
 * Carries an ErrorCode for standardized error handling.
 */
public abstract class SecretSyncException extends RuntimeException {

    private final ErrorCode errorCode;

    protected SecretSyncException(ErrorCode errorCode) {
        super(errorCode.getDefaultMessage());
        this.errorCode = errorCode;
    }

    protected SecretSyncException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected SecretSyncException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public boolean isFatal() {
        return errorCode.isFatal();
    }

    public boolean isRetryable() {
        return errorCode.isRecoverable();
    }
}
