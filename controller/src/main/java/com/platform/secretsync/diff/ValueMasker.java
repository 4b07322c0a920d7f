package com.platform.secretsync.diff;

/**
 * Shortens secret values to a form that is safe to log.
 */
public final class ValueMasker {

    static final String MASK = "****";

    private ValueMasker() {
    }

    /**
     * First and last four characters for values longer than eight characters, {@code ****} otherwise.
     */
    public static String mask(String value) {
        if (value == null) {
            return null;
        }
        if (value.length() <= 8) {
            return MASK;
        }
        return value.substring(0, 4) + MASK + value.substring(value.length() - 4);
    }
}
