package com.platform.secretsync.crypto;

import com.platform.secretsync.error.DecryptionException;
import com.platform.secretsync.error.ErrorCode;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Recomputes the SOPS document MAC: SHA-512 over the plaintext leaves in document order.
 */
@Slf4j
final class MacAccumulator {

    private final MessageDigest digest;
    private final boolean onlyEncrypted;

    MacAccumulator(boolean onlyEncrypted) {
        try {
            this.digest = MessageDigest.getInstance("SHA-512");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-512 not available", e);
        }
        this.onlyEncrypted = onlyEncrypted;
    }

    void add(byte[] plaintext, boolean wasEncrypted) {
        if (wasEncrypted || !onlyEncrypted) {
            digest.update(plaintext);
        }
    }

    void add(String plaintext, boolean wasEncrypted) {
        add(plaintext.getBytes(StandardCharsets.UTF_8), wasEncrypted);
    }

    void verify(SopsMetadata metadata, byte[] dataKey) {
        String expected = HexFormat.of().withUpperCase().formatHex(digest.digest());
        if (metadata.mac() == null || metadata.mac().isBlank()) {
            log.warn("SOPS document carries no MAC, skipping integrity check");
            return;
        }
        String lastModified = metadata.lastModified() != null ? metadata.lastModified() : "";
        String stored = SopsValueCipher.decrypt(metadata.mac(), dataKey, lastModified).text();
        if (!expected.equalsIgnoreCase(stored)) {
            throw new DecryptionException(ErrorCode.MAC_MISMATCH,
                "SOPS MAC mismatch: document was modified after encryption");
        }
    }
}
