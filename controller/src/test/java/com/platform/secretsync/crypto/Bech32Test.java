package com.platform.secretsync.crypto;

import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class Bech32Test {

    @Test
    void decodesWhatItEncodes() {
        byte[] data = new byte[32];
        for (int i = 0; i < data.length; i++) {
            data[i] = (byte) (i * 7);
        }

        String encoded = Bech32.encode("age", data);
        Bech32.Decoded decoded = Bech32.decode(encoded.toUpperCase(Locale.ROOT));

        assertThat(encoded).startsWith("age1");
        assertThat(decoded.hrp()).isEqualTo("age");
        assertThat(decoded.data()).isEqualTo(data);
    }

    @Test
    void decodesBip173Vector() {
        assertThat(Bech32.decode("A12UEL5L").hrp()).isEqualTo("a");
    }

    @Test
    void rejectsMixedCaseAndBadChecksum() {
        String valid = Bech32.encode("age", new byte[32]);
        String corrupted = valid.substring(0, valid.length() - 1) + (valid.endsWith("q") ? "p" : "q");

        assertThatThrownBy(() -> Bech32.decode("Age1" + valid.substring(4)))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Bech32.decode(corrupted))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("checksum");
    }
}
