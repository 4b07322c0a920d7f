package com.platform.secretsync.crypto;

import com.platform.secretsync.error.DecryptionException;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Dotenv flavour of a SOPS file. Metadata lives in {@code sops_*} lines; comment lines are
 * encrypted with empty additional data.
 */
final class DotenvSopsDocument extends SopsDocument {

    private static final String METADATA_PREFIX = "sops_";

    private record Line(String key, String value, boolean comment) {
    }

    private final List<Line> lines;
    private final SopsMetadata metadata;

    private DotenvSopsDocument(List<Line> lines, SopsMetadata metadata) {
        this.lines = lines;
        this.metadata = metadata;
    }

    static DotenvSopsDocument parse(String content) {
        List<Line> lines = new ArrayList<>();
        Map<String, String> metadataEntries = new LinkedHashMap<>();
        for (String raw : content.split("\\R")) {
            if (raw.isBlank()) {
                continue;
            }
            if (raw.startsWith("#")) {
                lines.add(new Line(null, raw.substring(1), true));
                continue;
            }
            int separator = raw.indexOf('=');
            if (separator <= 0) {
                throw DecryptionException.failed("Invalid dotenv line without '=' in SOPS file");
            }
            String key = raw.substring(0, separator);
            String value = raw.substring(separator + 1);
            if (key.startsWith(METADATA_PREFIX)) {
                metadataEntries.put(key, value);
            } else {
                lines.add(new Line(key, value, false));
            }
        }
        return new DotenvSopsDocument(lines, SopsMetadata.fromDotenv(metadataEntries));
    }

    @Override
    SopsMetadata metadata() {
        return metadata;
    }

    @Override
    byte[] decrypt(byte[] dataKey) {
        MacAccumulator mac = new MacAccumulator(metadata.macOnlyEncrypted());
        StringBuilder out = new StringBuilder();
        for (Line line : lines) {
            String additionalData = line.comment() ? "" : additionalData(List.of(line.key()));
            String plaintext;
            if (SopsValueCipher.isEncrypted(line.value())) {
                plaintext = SopsValueCipher.decrypt(line.value(), dataKey, additionalData).text();
                mac.add(plaintext, true);
            } else {
                plaintext = SopsMetadata.unescape(line.value());
                mac.add(plaintext, false);
            }
            String escaped = plaintext.replace("\n", "\\n");
            if (line.comment()) {
                out.append('#').append(escaped).append('\n');
            } else {
                out.append(line.key()).append('=').append(escaped).append('\n');
            }
        }
        mac.verify(metadata, dataKey);
        return out.toString().getBytes(StandardCharsets.UTF_8);
    }
}
