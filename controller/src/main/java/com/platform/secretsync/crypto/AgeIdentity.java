package com.platform.secretsync.crypto;

import com.platform.secretsync.error.DecryptionException;
import org.bouncycastle.crypto.params.X25519PrivateKeyParameters;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * An age X25519 identity ({@code AGE-SECRET-KEY-1...}).
 */
final class AgeIdentity implements AutoCloseable {

    static final String SECRET_KEY_HRP = "age-secret-key-";
    static final String RECIPIENT_HRP = "age";

    private final byte[] scalar;
    private final byte[] publicKey;

    private AgeIdentity(byte[] scalar) {
        this.scalar = scalar;
        this.publicKey = new X25519PrivateKeyParameters(scalar, 0).generatePublicKey().getEncoded();
    }

    static AgeIdentity parse(String encoded) {
        Bech32.Decoded decoded;
        try {
            decoded = Bech32.decode(encoded.trim());
        } catch (IllegalArgumentException e) {
            throw DecryptionException.failed("Malformed age identity: " + e.getMessage());
        }
        if (!SECRET_KEY_HRP.equals(decoded.hrp()) || decoded.data().length != 32) {
            throw DecryptionException.failed("Not an age X25519 identity");
        }
        return new AgeIdentity(decoded.data());
    }

    /**
     * Parses every identity line of a key file, ignoring comments and blank lines.
     */
    static List<AgeIdentity> parseAll(String keyFile) {
        List<AgeIdentity> identities = new ArrayList<>();
        for (String line : keyFile.split("\\R")) {
            String trimmed = line.trim();
            if (trimmed.toUpperCase().startsWith("AGE-SECRET-KEY-1")) {
                identities.add(parse(trimmed));
            }
        }
        return identities;
    }

    X25519PrivateKeyParameters privateKey() {
        return new X25519PrivateKeyParameters(scalar, 0);
    }

    byte[] publicKey() {
        return publicKey.clone();
    }

    /**
     * The {@code age1...} recipient string for this identity.
     */
    String recipient() {
        return Bech32.encode(RECIPIENT_HRP, publicKey);
    }

    @Override
    public void close() {
        Arrays.fill(scalar, (byte) 0);
    }
}
