package com.platform.secretsync.kustomize;

import com.platform.secretsync.error.ValidationException;
import com.platform.secretsync.parser.ParsedValue;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class KustomizeOutputParserTest {

    private final KustomizeOutputParser parser = new KustomizeOutputParser();

    @Test
    void decodesSecretDataAndKeepsConfigMapsApart() {
        KustomizeOutputParser.Output output = parser.parse("""
            apiVersion: v1
            kind: ConfigMap
            metadata:
              name: billing-config
            data:
              LOG_LEVEL: INFO
            ---
            apiVersion: v1
            kind: Secret
            metadata:
              name: billing-secrets
            data:
              DB_PASSWORD: aHVudGVyMg==
            stringData:
              API_KEY: abc123
            ---
            apiVersion: apps/v1
            kind: Deployment
            metadata:
              name: billing
            """);

        assertThat(output.secrets()).containsExactly(
            ParsedValue.enabled("DB_PASSWORD", "hunter2"), ParsedValue.enabled("API_KEY", "abc123"));
        assertThat(output.configs()).containsExactly(ParsedValue.enabled("LOG_LEVEL", "INFO"));
    }

    @Test
    void laterSecretWinsForTheSameKey() {
        KustomizeOutputParser.Output output = parser.parse("""
            ---
            kind: Secret
            metadata:
              name: first
            data:
              TOKEN: dmFsdWUx
            ---
            kind: Secret
            metadata:
              name: second
            data:
              TOKEN: dmFsdWUy
            """);

        assertThat(output.secrets()).containsExactly(ParsedValue.enabled("TOKEN", "value2"));
    }

    @Test
    void skipsValuesThatAreNotBase64() {
        KustomizeOutputParser.Output output = parser.parse("""
            kind: Secret
            metadata:
              name: billing
            data:
              BROKEN: "%%%not-base64"
              GOOD: b2s=
            """);

        assertThat(output.secrets()).containsExactly(ParsedValue.enabled("GOOD", "ok"));
    }

    @Test
    void emptyStreamHasNoValues() {
        KustomizeOutputParser.Output output = parser.parse("");

        assertThat(output.secrets()).isEmpty();
        assertThat(output.configs()).isEmpty();
    }

    @Test
    void rejectsMalformedYaml() {
        assertThatThrownBy(() -> parser.parse("kind: Secret\ndata: [unclosed"))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("Invalid kustomize output");
    }
}
