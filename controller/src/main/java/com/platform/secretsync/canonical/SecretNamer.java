package com.platform.secretsync.canonical;

import com.platform.secretsync.error.ErrorCode;
import com.platform.secretsync.error.ValidationException;
import com.platform.secretsync.provider.ProviderType;
import org.springframework.stereotype.Component;

/**
 * Builds provider-legal names of the form {@code {prefix-}key{-suffix}}.
 *
 * <p>Names are a pure function of their inputs: invalid characters are replaced, runs of dashes
 * collapsed, leading and trailing dashes trimmed, and the result clamped to the provider's maximum
 * length. Underscores are part of the key and are never collapsed or trimmed.
 */
@Component
public class SecretNamer {

    public String canonicalName(String prefix, String key, String suffix, ProviderType provider) {
        return apply(join(prefix, key, suffix), NamingRules.forSecrets(provider), key);
    }

    /**
     * AWS Parameter Store name {@code {path}/{key}}.
     */
    public String parameterName(String parameterPath, String key) {
        String path = parameterPath.endsWith("/") ? parameterPath : parameterPath + "/";
        if (!path.startsWith("/")) {
            path = "/" + path;
        }
        String sanitized = NamingRules.AWS_PARAMETER.invalid().matcher(path + key).replaceAll("_")
            .replaceAll("/{2,}", "/");
        return clamp(sanitized, NamingRules.AWS_PARAMETER.maxLength(), key);
    }

    /**
     * Azure App Configuration key {@code {prefix}:{key}}.
     */
    public String appConfigKey(String prefix, String key) {
        String joined = prefix == null || prefix.isBlank() ? key : prefix + ":" + key;
        return clamp(NamingRules.AZURE_APP_CONFIG.invalid().matcher(joined).replaceAll("_"),
            NamingRules.AZURE_APP_CONFIG.maxLength(), key);
    }

    static String join(String prefix, String key, String suffix) {
        StringBuilder name = new StringBuilder();
        if (prefix != null && !prefix.isBlank()) {
            name.append(stripDashes(prefix.trim())).append('-');
        }
        name.append(key);
        if (suffix != null && !suffix.isBlank()) {
            name.append('-').append(stripDashes(suffix.trim()));
        }
        return name.toString();
    }

    static String apply(String raw, NamingRules rules, String key) {
        String sanitized = rules.invalid().matcher(raw).replaceAll(String.valueOf(rules.replacement()));
        sanitized = sanitized.replaceAll("-{2,}", "-");
        return clamp(sanitized, rules.maxLength(), key);
    }

    private static String clamp(String name, int maxLength, String key) {
        String result = stripDashes(name);
        if (result.length() > maxLength) {
            result = stripDashes(result.substring(0, maxLength));
        }
        if (result.isEmpty()) {
            throw new ValidationException(ErrorCode.NAME_COLLISION,
                "Key '" + key + "' produces an empty provider name after sanitization");
        }
        return result;
    }

    private static String stripDashes(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && value.charAt(start) == '-') {
            start++;
        }
        while (end > start && value.charAt(end - 1) == '-') {
            end--;
        }
        return value.substring(start, end);
    }
}
