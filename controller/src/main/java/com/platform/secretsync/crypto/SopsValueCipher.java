package com.platform.secretsync.crypto;

import com.platform.secretsync.error.DecryptionException;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.Base64;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decrypts single SOPS leaf values of the form
 * {@code ENC[AES256_GCM,data:<b64>,iv:<b64>,tag:<b64>,type:<type>]}.
 */
final class SopsValueCipher {

    private static final Pattern ENCRYPTED = Pattern.compile(
        "^ENC\\[AES256_GCM,data:(.*),iv:(.+),tag:(.+),type:(.+)]$", Pattern.DOTALL);
    private static final int TAG_BITS = 128;

    /**
     * A decrypted leaf and the type SOPS recorded for it.
     */
    record Plaintext(byte[] bytes, String type) {

        String text() {
            return new String(bytes, StandardCharsets.UTF_8);
        }
    }

    private SopsValueCipher() {
    }

    static boolean isEncrypted(String value) {
        return value != null && ENCRYPTED.matcher(value).matches();
    }

    /**
     * @param additionalData the value's key path joined by {@code :} with a trailing {@code :}
     */
    static Plaintext decrypt(String value, byte[] dataKey, String additionalData) {
        Matcher matcher = ENCRYPTED.matcher(value);
        if (!matcher.matches()) {
            throw DecryptionException.unsupported("Value is not an AES256_GCM SOPS envelope");
        }
        try {
            Base64.Decoder decoder = Base64.getDecoder();
            byte[] data = decoder.decode(matcher.group(1));
            byte[] iv = decoder.decode(matcher.group(2));
            byte[] tag = decoder.decode(matcher.group(3));

            byte[] sealed = new byte[data.length + tag.length];
            System.arraycopy(data, 0, sealed, 0, data.length);
            System.arraycopy(tag, 0, sealed, data.length, tag.length);

            Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
            cipher.init(Cipher.DECRYPT_MODE, new SecretKeySpec(dataKey, "AES"), new GCMParameterSpec(TAG_BITS, iv));
            cipher.updateAAD(additionalData.getBytes(StandardCharsets.UTF_8));
            return new Plaintext(cipher.doFinal(sealed), matcher.group(4));
        } catch (AEADBadTagException e) {
            throw DecryptionException.failed("Authentication failed for value at '" + additionalData + "'", e);
        } catch (IllegalArgumentException | GeneralSecurityException e) {
            throw DecryptionException.failed("Malformed encrypted value at '" + additionalData + "'", e);
        }
    }
}
