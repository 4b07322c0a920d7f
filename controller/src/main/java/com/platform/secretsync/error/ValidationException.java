package com.platform.secretsync.error;

/**
 * Exception for sync target configuration errors.
 */
public class ValidationException extends SecretSyncException {

    private final String field;
    private final Object rejectedValue;

    public ValidationException(String message) {
        super(ErrorCode.INVALID_SPEC, message);
        this.field = null;
        this.rejectedValue = null;
    }

    public ValidationException(ErrorCode errorCode, String message) {
        super(errorCode, message);
        this.field = null;
        this.rejectedValue = null;
    }

    public ValidationException(String field, String message) {
        super(ErrorCode.MISSING_REQUIRED_FIELD,
            String.format("Missing or empty field '%s': %s", field, message));
        this.field = field;
        this.rejectedValue = null;
    }

    public ValidationException(String field, Object rejectedValue, String message) {
        super(ErrorCode.INVALID_SPEC,
            String.format("Invalid value '%s' for field '%s': %s", rejectedValue, field, message));
        this.field = field;
        this.rejectedValue = rejectedValue;
    }

    public static ValidationException interval(String field, String rejectedValue, String message) {
        return new ValidationException(ErrorCode.INVALID_INTERVAL,
            String.format("Invalid interval '%s' for field '%s': %s", rejectedValue, field, message));
    }

    public String getField() {
        return field;
    }

    public Object getRejectedValue() {
        return rejectedValue;
    }
}
