package com.platform.secretsync.crypto;

import com.platform.secretsync.error.DecryptionException;
import lombok.extern.slf4j.Slf4j;
import org.bouncycastle.crypto.InvalidCipherTextException;
import org.bouncycastle.crypto.agreement.X25519Agreement;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.generators.HKDFBytesGenerator;
import org.bouncycastle.crypto.macs.HMac;
import org.bouncycastle.crypto.modes.ChaCha20Poly1305;
import org.bouncycastle.crypto.params.AEADParameters;
import org.bouncycastle.crypto.params.HKDFParameters;
import org.bouncycastle.crypto.params.KeyParameter;
import org.bouncycastle.crypto.params.X25519PublicKeyParameters;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Optional;

/**
 * Reader for age v1 files restricted to X25519 recipient stanzas.
 */
@Slf4j
final class AgeEnvelope {

    static final String ARMOR_BEGIN = "-----BEGIN AGE ENCRYPTED FILE-----";
    static final String ARMOR_END = "-----END AGE ENCRYPTED FILE-----";
    static final String VERSION_LINE = "age-encryption.org/v1";
    static final String X25519_LABEL = "age-encryption.org/v1/X25519";

    static final int FILE_KEY_SIZE = 16;
    static final int PAYLOAD_NONCE_SIZE = 16;
    static final int CHUNK_SIZE = 64 * 1024;
    static final int TAG_SIZE = 16;
    private static final int COLUMNS = 64;

    private record Stanza(List<String> args, byte[] body) {
    }

    private AgeEnvelope() {
    }

    static byte[] dearmor(String armored) {
        String text = armored.trim();
        if (!text.startsWith(ARMOR_BEGIN) || !text.endsWith(ARMOR_END)) {
            throw DecryptionException.unsupported("age data key is not an armored age file");
        }
        String body = text.substring(ARMOR_BEGIN.length(), text.length() - ARMOR_END.length());
        try {
            return Base64.getMimeDecoder().decode(body.trim());
        } catch (IllegalArgumentException e) {
            throw DecryptionException.failed("Invalid base64 in armored age file", e);
        }
    }

    /**
     * Decrypts an age file with the first identity that unwraps its file key.
     *
     * @return the payload, or empty when none of the identities is a recipient
     */
    static Optional<byte[]> open(byte[] file, List<AgeIdentity> identities) {
        int offset = 0;
        String versionLine = readLine(file, offset);
        if (!VERSION_LINE.equals(versionLine)) {
            throw DecryptionException.unsupported("Unsupported age version line");
        }
        offset += versionLine.length() + 1;

        List<Stanza> stanzas = new ArrayList<>();
        String line = readLine(file, offset);
        while (line.startsWith("-> ")) {
            offset += line.length() + 1;
            List<String> args = List.of(line.substring(3).split(" "));
            ByteArrayOutputStream body = new ByteArrayOutputStream();
            String bodyLine;
            do {
                bodyLine = readLine(file, offset);
                offset += bodyLine.length() + 1;
                body.writeBytes(decodeUnpadded(bodyLine));
            } while (bodyLine.length() == COLUMNS);
            stanzas.add(new Stanza(args, body.toByteArray()));
            line = readLine(file, offset);
        }
        if (!line.startsWith("--- ")) {
            throw DecryptionException.failed("Malformed age header");
        }
        int headerMacInput = offset + 3;
        byte[] headerMac = decodeUnpadded(line.substring(4));
        offset += line.length() + 1;

        byte[] fileKey = unwrapFileKey(stanzas, identities);
        if (fileKey == null) {
            return Optional.empty();
        }

        byte[] expectedMac = hmac(hkdf(fileKey, new byte[0], "header"), file, headerMacInput);
        if (!MessageDigest.isEqual(expectedMac, headerMac)) {
            throw DecryptionException.failed("age header MAC mismatch");
        }
        if (file.length - offset < PAYLOAD_NONCE_SIZE + TAG_SIZE) {
            throw DecryptionException.failed("Truncated age payload");
        }
        byte[] nonce = new byte[PAYLOAD_NONCE_SIZE];
        System.arraycopy(file, offset, nonce, 0, PAYLOAD_NONCE_SIZE);
        offset += PAYLOAD_NONCE_SIZE;
        return Optional.of(decryptStream(hkdf(fileKey, nonce, "payload"), file, offset));
    }

    private static byte[] unwrapFileKey(List<Stanza> stanzas, List<AgeIdentity> identities) {
        for (Stanza stanza : stanzas) {
            if (stanza.args().size() != 2 || !"X25519".equals(stanza.args().get(0))) {
                continue;
            }
            byte[] ephemeral = decodeUnpadded(stanza.args().get(1));
            if (ephemeral.length != 32 || stanza.body().length != FILE_KEY_SIZE + TAG_SIZE) {
                throw DecryptionException.failed("Malformed age X25519 stanza");
            }
            for (AgeIdentity identity : identities) {
                byte[] shared = new byte[32];
                X25519Agreement agreement = new X25519Agreement();
                agreement.init(identity.privateKey());
                try {
                    agreement.calculateAgreement(new X25519PublicKeyParameters(ephemeral, 0), shared, 0);
                } catch (IllegalStateException e) {
                    log.debug("Rejected low-order age ephemeral share");
                    continue;
                }
                byte[] salt = new byte[64];
                System.arraycopy(ephemeral, 0, salt, 0, 32);
                System.arraycopy(identity.publicKey(), 0, salt, 32, 32);
                byte[] wrapKey = hkdf(shared, salt, X25519_LABEL);
                try {
                    return chacha(wrapKey, new byte[12], stanza.body(), 0, stanza.body().length);
                } catch (InvalidCipherTextException e) {
                    log.trace("Stanza not addressed to {}", identity.recipient());
                }
            }
        }
        return null;
    }

    private static byte[] decryptStream(byte[] payloadKey, byte[] file, int offset) {
        ByteArrayOutputStream plaintext = new ByteArrayOutputStream();
        long counter = 0;
        int sealedChunk = CHUNK_SIZE + TAG_SIZE;
        while (true) {
            int remaining = file.length - offset;
            boolean last = remaining <= sealedChunk;
            int length = last ? remaining : sealedChunk;
            byte[] nonce = new byte[12];
            for (int i = 0; i < 8; i++) {
                nonce[10 - i] = (byte) (counter >>> (8 * i));
            }
            nonce[11] = (byte) (last ? 1 : 0);
            try {
                plaintext.writeBytes(chacha(payloadKey, nonce, file, offset, length));
            } catch (InvalidCipherTextException e) {
                throw DecryptionException.failed("age payload authentication failed", e);
            }
            if (last) {
                return plaintext.toByteArray();
            }
            offset += length;
            counter++;
        }
    }

    static byte[] hkdf(byte[] secret, byte[] salt, String info) {
        HKDFBytesGenerator generator = new HKDFBytesGenerator(new SHA256Digest());
        generator.init(new HKDFParameters(secret, salt, info.getBytes(StandardCharsets.US_ASCII)));
        byte[] out = new byte[32];
        generator.generateBytes(out, 0, out.length);
        return out;
    }

    static byte[] hmac(byte[] key, byte[] data, int length) {
        HMac mac = new HMac(new SHA256Digest());
        mac.init(new KeyParameter(key));
        mac.update(data, 0, length);
        byte[] out = new byte[mac.getMacSize()];
        mac.doFinal(out, 0);
        return out;
    }

    private static byte[] chacha(byte[] key, byte[] nonce, byte[] input, int offset, int length)
            throws InvalidCipherTextException {
        ChaCha20Poly1305 cipher = new ChaCha20Poly1305();
        cipher.init(false, new AEADParameters(new KeyParameter(key), TAG_SIZE * 8, nonce));
        byte[] out = new byte[cipher.getOutputSize(length)];
        int written = cipher.processBytes(input, offset, length, out, 0);
        cipher.doFinal(out, written);
        return out;
    }

    private static String readLine(byte[] data, int offset) {
        for (int i = offset; i < data.length; i++) {
            if (data[i] == '\n') {
                return new String(data, offset, i - offset, StandardCharsets.US_ASCII);
            }
        }
        throw DecryptionException.failed("Truncated age header");
    }

    private static byte[] decodeUnpadded(String value) {
        try {
            return Base64.getDecoder().decode(value);
        } catch (IllegalArgumentException e) {
            throw DecryptionException.failed("Invalid base64 in age header", e);
        }
    }
}
