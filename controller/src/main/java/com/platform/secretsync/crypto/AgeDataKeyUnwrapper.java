package com.platform.secretsync.crypto;

import com.platform.secretsync.error.DecryptionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

@Slf4j
@Component
class AgeDataKeyUnwrapper implements DataKeyUnwrapper {

    @Override
    public KeyMaterial.Kind kind() {
        return KeyMaterial.Kind.AGE;
    }

    @Override
    public Optional<byte[]> unwrap(SopsMetadata metadata, KeyMaterial key) {
        List<AgeIdentity> identities = AgeIdentity.parseAll(key.asText());
        if (identities.isEmpty()) {
            throw DecryptionException.failed("No age identities in " + key.source());
        }
        try {
            for (SopsMetadata.AgeStanza stanza : metadata.age()) {
                if (stanza.enc() == null) {
                    continue;
                }
                Optional<byte[]> dataKey = AgeEnvelope.open(AgeEnvelope.dearmor(stanza.enc()), identities);
                if (dataKey.isPresent()) {
                    log.debug("Unwrapped data key for age recipient {}", stanza.recipient());
                    return dataKey;
                }
            }
            return Optional.empty();
        } finally {
            identities.forEach(AgeIdentity::close);
        }
    }
}
