package com.platform.secretsync.crypto;

import com.platform.secretsync.error.DecryptionException;
import lombok.extern.slf4j.Slf4j;
import org.bouncycastle.openpgp.PGPCompressedData;
import org.bouncycastle.openpgp.PGPEncryptedData;
import org.bouncycastle.openpgp.PGPEncryptedDataList;
import org.bouncycastle.openpgp.PGPException;
import org.bouncycastle.openpgp.PGPLiteralData;
import org.bouncycastle.openpgp.PGPPrivateKey;
import org.bouncycastle.openpgp.PGPPublicKeyEncryptedData;
import org.bouncycastle.openpgp.PGPSecretKey;
import org.bouncycastle.openpgp.PGPSecretKeyRingCollection;
import org.bouncycastle.openpgp.PGPUtil;
import org.bouncycastle.openpgp.jcajce.JcaPGPObjectFactory;
import org.bouncycastle.openpgp.operator.bc.BcKeyFingerprintCalculator;
import org.bouncycastle.openpgp.operator.bc.BcPBESecretKeyDecryptorBuilder;
import org.bouncycastle.openpgp.operator.bc.BcPGPDigestCalculatorProvider;
import org.bouncycastle.openpgp.operator.bc.BcPublicKeyDataDecryptorFactory;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Unwraps SOPS data keys encrypted to an OpenPGP key. Only keys without a passphrase are supported.
 */
@Slf4j
@Component
class PgpDataKeyUnwrapper implements DataKeyUnwrapper {

    @Override
    public KeyMaterial.Kind kind() {
        return KeyMaterial.Kind.PGP;
    }

    @Override
    public Optional<byte[]> unwrap(SopsMetadata metadata, KeyMaterial key) {
        PGPSecretKeyRingCollection keyRings = readKeyRings(key);
        for (SopsMetadata.PgpStanza stanza : metadata.pgp()) {
            if (stanza.enc() == null) {
                continue;
            }
            Optional<byte[]> dataKey = decrypt(stanza, keyRings);
            if (dataKey.isPresent()) {
                log.debug("Unwrapped data key for PGP fingerprint {}", stanza.fingerprint());
                return dataKey;
            }
        }
        return Optional.empty();
    }

    private static PGPSecretKeyRingCollection readKeyRings(KeyMaterial key) {
        try (InputStream input = PGPUtil.getDecoderStream(new ByteArrayInputStream(key.bytes()))) {
            return new PGPSecretKeyRingCollection(input, new BcKeyFingerprintCalculator());
        } catch (IOException | PGPException e) {
            throw DecryptionException.failed("Unable to read PGP private key from " + key.source(), e);
        }
    }

    private static Optional<byte[]> decrypt(SopsMetadata.PgpStanza stanza, PGPSecretKeyRingCollection keyRings) {
        byte[] armored = stanza.enc().getBytes(StandardCharsets.US_ASCII);
        try (InputStream decoded = PGPUtil.getDecoderStream(new ByteArrayInputStream(armored))) {
            JcaPGPObjectFactory factory = new JcaPGPObjectFactory(decoded);
            Object head = factory.nextObject();
            if (!(head instanceof PGPEncryptedDataList)) {
                head = factory.nextObject();
            }
            if (!(head instanceof PGPEncryptedDataList encryptedDataList)) {
                throw DecryptionException.unsupported("PGP data key is not an encrypted message");
            }
            for (PGPEncryptedData data : encryptedDataList) {
                if (!(data instanceof PGPPublicKeyEncryptedData publicKeyData)) {
                    continue;
                }
                PGPSecretKey secretKey = keyRings.getSecretKey(publicKeyData.getKeyID());
                if (secretKey == null) {
                    continue;
                }
                return Optional.of(readLiteral(publicKeyData, extractPrivateKey(secretKey)));
            }
            return Optional.empty();
        } catch (IOException | PGPException e) {
            throw DecryptionException.failed("Failed to decrypt PGP data key", e);
        }
    }

    private static PGPPrivateKey extractPrivateKey(PGPSecretKey secretKey) {
        try {
            return secretKey.extractPrivateKey(
                new BcPBESecretKeyDecryptorBuilder(new BcPGPDigestCalculatorProvider()).build(new char[0]));
        } catch (PGPException e) {
            throw DecryptionException.failed("PGP private key is protected by a passphrase", e);
        }
    }

    private static byte[] readLiteral(PGPPublicKeyEncryptedData data, PGPPrivateKey privateKey)
            throws IOException, PGPException {
        try (InputStream clear = data.getDataStream(new BcPublicKeyDataDecryptorFactory(privateKey))) {
            Object plain = new JcaPGPObjectFactory(clear).nextObject();
            if (plain instanceof PGPCompressedData compressed) {
                plain = new JcaPGPObjectFactory(compressed.getDataStream()).nextObject();
            }
            if (!(plain instanceof PGPLiteralData literal)) {
                throw DecryptionException.unsupported("PGP data key message has no literal data");
            }
            byte[] payload;
            try (InputStream literalInput = literal.getInputStream()) {
                payload = literalInput.readAllBytes();
            }
            if (data.isIntegrityProtected() && !data.verify()) {
                throw DecryptionException.failed("PGP message integrity check failed");
            }
            return payload;
        }
    }
}
