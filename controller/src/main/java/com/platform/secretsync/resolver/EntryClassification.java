package com.platform.secretsync.resolver;

public enum EntryClassification {
    /** {@code application.properties}: non-secret configuration. */
    PLAINTEXT_CONFIG,
    /** {@code application.secrets.*}: secret values, usually SOPS encrypted. */
    ENCRYPTED_SECRET
}
