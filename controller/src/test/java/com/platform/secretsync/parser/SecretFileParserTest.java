package com.platform.secretsync.parser;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class SecretFileParserTest {

    private final SecretFileParser parser =
        new SecretFileParser(new EnvFileParser(), new YamlSecretParser(), new PropertiesFileParser());

    @Test
    void dispatchesByFormat() {
        assertThat(parser.parse(SecretFileFormat.DOTENV, bytes("A=1"))).containsExactly(ParsedValue.enabled("A", "1"));
        assertThat(parser.parse(SecretFileFormat.YAML, bytes("a: 1"))).containsExactly(ParsedValue.enabled("a", "1"));
        assertThat(parser.parse(SecretFileFormat.PROPERTIES, bytes("server.port: 8080\n! note\n# note")))
            .containsExactly(ParsedValue.enabled("server.port", "8080"));
    }

    @Test
    void detectsFormatFromFileName() {
        assertThat(SecretFileFormat.fromFileName("application.secrets.env")).contains(SecretFileFormat.DOTENV);
        assertThat(SecretFileFormat.fromFileName("application.secrets.YAML")).contains(SecretFileFormat.YAML);
        assertThat(SecretFileFormat.fromFileName("application.properties")).contains(SecretFileFormat.PROPERTIES);
        assertThat(SecretFileFormat.fromFileName("README.md")).isEmpty();
    }

    private static byte[] bytes(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }
}
