package com.platform.secretsync.parser;

import java.util.Locale;
import java.util.Optional;

public enum SecretFileFormat {
    DOTENV,
    YAML,
    PROPERTIES;

    /**
     * Format implied by a file name such as {@code application.secrets.env}.
     */
    public static Optional<SecretFileFormat> fromFileName(String fileName) {
        String lower = fileName.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".env")) {
            return Optional.of(DOTENV);
        }
        if (lower.endsWith(".yaml") || lower.endsWith(".yml")) {
            return Optional.of(YAML);
        }
        if (lower.endsWith(".properties")) {
            return Optional.of(PROPERTIES);
        }
        return Optional.empty();
    }
}
