package com.platform.secretsync.crypto;

import com.platform.secretsync.error.DecryptionException;
import com.platform.secretsync.parser.SecretFileFormat;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Decrypts Mozilla SOPS files in memory using age or PGP key groups.
 */
@Slf4j
@Component
public class SopsSecretDecryptor implements SecretDecryptor {

    private static final String ENC_MARKER = "ENC[AES256_GCM,";
    private static final Pattern YAML_SOPS_BLOCK = Pattern.compile("(?m)^sops:\\s*$");
    private static final Pattern DOTENV_SOPS_LINE = Pattern.compile("(?m)^sops_(mac|lastmodified|version)=");
    private static final int DATA_KEY_SIZE = 32;

    private final Map<KeyMaterial.Kind, DataKeyUnwrapper> unwrappers = new EnumMap<>(KeyMaterial.Kind.class);

    public SopsSecretDecryptor(List<DataKeyUnwrapper> unwrappers) {
        unwrappers.forEach(unwrapper -> this.unwrappers.put(unwrapper.kind(), unwrapper));
    }

    @Override
    public boolean isEncrypted(byte[] content, SecretFileFormat format) {
        String text = new String(content, StandardCharsets.UTF_8);
        return switch (format) {
            case YAML -> YAML_SOPS_BLOCK.matcher(text).find() || text.contains(ENC_MARKER);
            case DOTENV -> DOTENV_SOPS_LINE.matcher(text).find() || text.contains(ENC_MARKER);
            case PROPERTIES -> text.contains(ENC_MARKER);
        };
    }

    @Override
    public byte[] decrypt(byte[] content, SecretFileFormat format, KeyMaterial key) {
        SopsDocument document = SopsDocument.parse(format, new String(content, StandardCharsets.UTF_8));
        SopsMetadata metadata = document.metadata();
        if (!metadata.hasKeyGroups()) {
            throw DecryptionException.unsupported("SOPS file has no age or pgp key groups");
        }

        DataKeyUnwrapper unwrapper = unwrappers.get(key.kind());
        if (unwrapper == null) {
            throw DecryptionException.unsupported("No unwrapper for " + key.kind() + " keys");
        }
        byte[] dataKey = unwrapper.unwrap(metadata, key)
            .orElseThrow(() -> DecryptionException.failed(
                "None of the " + key.kind() + " key groups in the file match the key from " + key.source()));
        try {
            if (dataKey.length != DATA_KEY_SIZE) {
                throw DecryptionException.failed("Unwrapped data key has unexpected length " + dataKey.length);
            }
            return document.decrypt(dataKey);
        } finally {
            Arrays.fill(dataKey, (byte) 0);
        }
    }
}
