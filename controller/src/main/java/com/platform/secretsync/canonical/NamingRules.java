package com.platform.secretsync.canonical;

import com.platform.secretsync.provider.ProviderType;

import java.util.regex.Pattern;

/**
 * Per-provider charset and length constraints on secret names.
 *
 * @param invalid     characters that must be replaced
 * @param replacement character substituted for each invalid one
 * @param maxLength   maximum name length
 */
public record NamingRules(Pattern invalid, char replacement, int maxLength) {

    public static final NamingRules GCP = new NamingRules(Pattern.compile("[^A-Za-z0-9_-]"), '_', 255);
    public static final NamingRules AWS = new NamingRules(Pattern.compile("[^A-Za-z0-9/_+=.@-]"), '_', 512);
    public static final NamingRules AZURE = new NamingRules(Pattern.compile("[^A-Za-z0-9-]"), '-', 127);

    /** Parameter Store names: letters, digits, {@code . - _ /}. */
    public static final NamingRules AWS_PARAMETER = new NamingRules(Pattern.compile("[^A-Za-z0-9._/-]"), '_', 1011);

    /** App Configuration keys reject only {@code %}; control characters are dropped too. */
    public static final NamingRules AZURE_APP_CONFIG = new NamingRules(Pattern.compile("[%\\p{Cntrl}]"), '_', 10000);

    public static NamingRules forSecrets(ProviderType provider) {
        return switch (provider) {
            case AWS -> AWS;
            case AZURE -> AZURE;
            case GCP -> GCP;
        };
    }
}
