package com.platform.secretsync.crypto;

import com.platform.secretsync.error.DecryptionException;
import com.platform.secretsync.parser.SecretFileFormat;

/**
 * A parsed SOPS file: metadata plus encrypted leaves that can be rendered back as plaintext.
 */
abstract class SopsDocument {

    abstract SopsMetadata metadata();

    /**
     * Decrypts every encrypted leaf, verifies the MAC and renders the plaintext document
     * in its original format.
     */
    abstract byte[] decrypt(byte[] dataKey);

    static SopsDocument parse(SecretFileFormat format, String content) {
        return switch (format) {
            case YAML -> YamlSopsDocument.parse(content);
            case DOTENV -> DotenvSopsDocument.parse(content);
            case PROPERTIES -> throw DecryptionException.unsupported("SOPS properties files are not supported");
        };
    }

    static String additionalData(Iterable<String> path) {
        StringBuilder aad = new StringBuilder();
        for (String segment : path) {
            aad.append(segment).append(':');
        }
        return aad.toString();
    }
}
