package com.platform.secretsync.crypto;

import java.util.Map;
import java.util.Optional;

/**
 * Reads the data of a credential object (a Kubernetes Secret) as raw bytes per field.
 */
public interface CredentialReader {

    Optional<Map<String, byte[]>> read(String namespace, String name);
}
