package com.platform.secretsync.provider;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.HexFormat;

/**
 * One entry of a provider secret's version log.
 *
 * @param payload       secret value, null when the provider does not let us read it
 *                      (disabled or scheduled for deletion)
 * @param payloadSha256 hex SHA-256 of the payload, null when the payload is unknown
 */
public record SecretVersion(String versionId, String payload, String payloadSha256, boolean enabled,
                            Instant createTime) {

    public static SecretVersion of(String versionId, String payload, boolean enabled, Instant createTime) {
        return new SecretVersion(versionId, payload, payload == null ? null : sha256(payload), enabled, createTime);
    }

    public SecretVersion withoutPayload() {
        return new SecretVersion(versionId, null, payloadSha256, enabled, createTime);
    }

    public static String sha256(String value) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(value.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    @Override
    public String toString() {
        return "SecretVersion[" + versionId + ", enabled=" + enabled + ", created=" + createTime + "]";
    }
}
