package com.platform.secretsync.crypto;

import com.platform.secretsync.error.DecryptionException;
import com.platform.secretsync.error.ErrorCode;
import com.platform.secretsync.parser.ParsedValue;
import com.platform.secretsync.parser.SecretFileFormat;
import com.platform.secretsync.parser.YamlSecretParser;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SopsSecretDecryptorTest {

    private final SopsSecretDecryptor decryptor = new SopsSecretDecryptor(List.of(new AgeDataKeyUnwrapper()));
    private final SopsFixture fixture = new SopsFixture();

    @Test
    void decryptsDotenvIncludingCommentedEntries() {
        byte[] encrypted = bytes(fixture.dotenv(List.of("DB_PASSWORD=s3cret", "#OLD_TOKEN=expired", "API_KEY=a=b")));

        try (KeyMaterial key = fixture.key()) {
            byte[] plaintext = decryptor.decrypt(encrypted, SecretFileFormat.DOTENV, key);

            assertThat(new String(plaintext, StandardCharsets.UTF_8))
                .isEqualTo("DB_PASSWORD=s3cret\n#OLD_TOKEN=expired\nAPI_KEY=a=b\n");
        }
    }

    @Test
    void decryptsYamlAndRestoresTypes() {
        byte[] encrypted = bytes(fixture.yaml("pa ss", 5432));

        try (KeyMaterial key = fixture.key()) {
            String plaintext = new String(decryptor.decrypt(encrypted, SecretFileFormat.YAML, key), StandardCharsets.UTF_8);

            assertThat(new YamlSecretParser().parse(plaintext)).containsExactly(
                ParsedValue.enabled("db.password", "pa ss"),
                ParsedValue.enabled("db.port", "5432"));
            assertThat(plaintext).doesNotContain("sops:");
        }
    }

    @Test
    void detectsEncryptedContent() {
        assertThat(decryptor.isEncrypted(bytes(fixture.dotenv(List.of("A=1"))), SecretFileFormat.DOTENV)).isTrue();
        assertThat(decryptor.isEncrypted(bytes(fixture.yaml("x", 1)), SecretFileFormat.YAML)).isTrue();
        assertThat(decryptor.isEncrypted(bytes("A=1\n"), SecretFileFormat.DOTENV)).isFalse();
        assertThat(decryptor.isEncrypted(bytes("a: 1\n"), SecretFileFormat.YAML)).isFalse();
    }

    @Test
    void keyThatIsNotARecipientFails() {
        byte[] encrypted = bytes(fixture.dotenv(List.of("A=1")));

        try (KeyMaterial otherKey = new SopsFixture().key()) {
            assertThatThrownBy(() -> decryptor.decrypt(encrypted, SecretFileFormat.DOTENV, otherKey))
                .isInstanceOf(DecryptionException.class)
                .extracting(e -> ((DecryptionException) e).getErrorCode())
                .isEqualTo(ErrorCode.DECRYPTION_FAILED);
        }
    }

    @Test
    void editedPlaintextValueFailsMacCheck() {
        String document = fixture.dotenv(List.of("A=1")) + "INJECTED=plain\n";

        try (KeyMaterial key = fixture.key()) {
            assertThatThrownBy(() -> decryptor.decrypt(bytes(document), SecretFileFormat.DOTENV, key))
                .isInstanceOf(DecryptionException.class)
                .extracting(e -> ((DecryptionException) e).getErrorCode())
                .isEqualTo(ErrorCode.MAC_MISMATCH);
        }
    }

    @Test
    void valueMovedToAnotherKeyFailsAuthentication() {
        String document = fixture.dotenv(List.of("A=1", "B=2"));
        String swapped = document.replaceFirst("(?m)^A=", "C=");

        try (KeyMaterial key = fixture.key()) {
            assertThatThrownBy(() -> decryptor.decrypt(bytes(swapped), SecretFileFormat.DOTENV, key))
                .isInstanceOf(DecryptionException.class)
                .hasMessageContaining("Authentication failed");
        }
    }

    @Test
    void documentWithoutKeyGroupsIsUnsupported() {
        try (KeyMaterial key = fixture.key()) {
            assertThatThrownBy(() -> decryptor.decrypt(bytes("A=ENC[AES256_GCM,data:,iv:AA==,tag:AA==,type:str]\n"),
                SecretFileFormat.DOTENV, key))
                .isInstanceOf(DecryptionException.class)
                .extracting(e -> ((DecryptionException) e).getErrorCode())
                .isEqualTo(ErrorCode.UNSUPPORTED_ENVELOPE);
        }
    }

    @Test
    void propertiesFilesAreNotDecryptable() {
        try (KeyMaterial key = fixture.key()) {
            assertThatThrownBy(() -> decryptor.decrypt(bytes("a=ENC[x]"), SecretFileFormat.PROPERTIES, key))
                .isInstanceOf(DecryptionException.class)
                .extracting(e -> ((DecryptionException) e).getErrorCode())
                .isEqualTo(ErrorCode.UNSUPPORTED_ENVELOPE);
        }
    }

    @Test
    void rejectsKeyMaterialOfUnknownType() {
        assertThatThrownBy(() -> KeyMaterial.of(bytes("not a key"), "test/key"))
            .isInstanceOf(DecryptionException.class)
            .extracting(e -> ((DecryptionException) e).getErrorCode())
            .isEqualTo(ErrorCode.UNSUPPORTED_ENVELOPE);
    }

    private static byte[] bytes(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }
}
