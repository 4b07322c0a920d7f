package com.platform.secretsync.crypto;

import com.platform.secretsync.parser.SecretFileFormat;

/**
 * Turns an envelope-encrypted secret file into plaintext of the same format.
 */
public interface SecretDecryptor {

    boolean isEncrypted(byte[] content, SecretFileFormat format);

    /**
     * @throws com.platform.secretsync.error.DecryptionException when the key does not match, the
     *         envelope is malformed or unsupported, or the integrity check fails
     */
    byte[] decrypt(byte[] content, SecretFileFormat format, KeyMaterial key);
}
