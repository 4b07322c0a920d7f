package com.platform.secretsync.resolver;

import com.platform.secretsync.parser.SecretFileFormat;

import java.util.Arrays;
import java.util.Objects;

/**
 * A file picked up from a profile directory, with its raw bytes.
 *
 * @param relativePath path below the snapshot root, {@code /}-separated
 * @param serviceName  service the file belongs to
 * @param profile      environment directory the file was read from
 */
public record ParsedEntry(String relativePath, byte[] content, EntryClassification classification,
                          String serviceName, String profile) {

    public ParsedEntry {
        Objects.requireNonNull(relativePath, "relativePath");
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(classification, "classification");
    }

    public String fileName() {
        int slash = relativePath.lastIndexOf('/');
        return slash < 0 ? relativePath : relativePath.substring(slash + 1);
    }

    public SecretFileFormat format() {
        return SecretFileFormat.fromFileName(fileName()).orElse(SecretFileFormat.DOTENV);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ParsedEntry other)) {
            return false;
        }
        return relativePath.equals(other.relativePath)
            && Arrays.equals(content, other.content)
            && classification == other.classification
            && Objects.equals(serviceName, other.serviceName)
            && Objects.equals(profile, other.profile);
    }

    @Override
    public int hashCode() {
        return Objects.hash(relativePath, Arrays.hashCode(content), classification, serviceName, profile);
    }

    @Override
    public String toString() {
        return "ParsedEntry[" + relativePath + ", " + classification + ", service=" + serviceName + "]";
    }
}
