package com.platform.secretsync.crypto;

import java.util.Optional;

/**
 * Recovers the SOPS data key from the key groups in a document's metadata.
 */
interface DataKeyUnwrapper {

    KeyMaterial.Kind kind();

    /**
     * @return the 32-byte data key, or empty when no key group is addressed to {@code key}
     */
    Optional<byte[]> unwrap(SopsMetadata metadata, KeyMaterial key);
}
