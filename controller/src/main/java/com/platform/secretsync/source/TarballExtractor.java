package com.platform.secretsync.source;

import com.platform.secretsync.error.ErrorCode;
import com.platform.secretsync.error.SourceException;
import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveInputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorInputStream;
import org.springframework.stereotype.Component;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Extracts gzip-compressed tar archives, refusing entries that resolve outside the target directory.
 */
@Component
public class TarballExtractor {

    /**
     * @return number of regular files written
     */
    public int extract(String sourceRef, Path archive, Path targetDir) {
        Path root = targetDir.toAbsolutePath().normalize();
        int files = 0;
        try (InputStream fileIn = new BufferedInputStream(Files.newInputStream(archive));
             GzipCompressorInputStream gzipIn = new GzipCompressorInputStream(fileIn);
             TarArchiveInputStream tarIn = new TarArchiveInputStream(gzipIn)) {

            Files.createDirectories(root);
            TarArchiveEntry entry;
            while ((entry = tarIn.getNextEntry()) != null) {
                Path resolved = root.resolve(entry.getName()).normalize();
                if (!resolved.startsWith(root)) {
                    throw new SourceException(ErrorCode.ARCHIVE_INVALID, sourceRef,
                        "Archive entry escapes extraction root: " + entry.getName());
                }
                if (entry.isDirectory()) {
                    Files.createDirectories(resolved);
                } else if (entry.isFile()) {
                    Files.createDirectories(resolved.getParent());
                    Files.copy(tarIn, resolved, StandardCopyOption.REPLACE_EXISTING);
                    files++;
                }
                // links and devices are skipped
            }
        } catch (IOException e) {
            throw new SourceException(ErrorCode.ARCHIVE_INVALID, sourceRef,
                "Failed to extract artifact: " + e.getMessage(), e);
        }
        return files;
    }
}
