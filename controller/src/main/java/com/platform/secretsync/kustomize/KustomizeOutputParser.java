package com.platform.secretsync.kustomize;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.platform.secretsync.error.ValidationException;
import com.platform.secretsync.parser.ParsedValue;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the key/value pairs of the Secret and ConfigMap objects in a {@code kustomize build} stream.
 * A key defined by several objects takes the value of the last one.
 */
@Slf4j
@Component
public class KustomizeOutputParser {

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    /**
     * Values of the rendered objects, split by kind.
     */
    public record Output(List<ParsedValue> secrets, List<ParsedValue> configs) {
    }

    public Output parse(String yaml) {
        Map<String, String> secrets = new LinkedHashMap<>();
        Map<String, String> configs = new LinkedHashMap<>();
        try (MappingIterator<JsonNode> documents = yamlMapper.readerFor(JsonNode.class).readValues(yaml)) {
            while (documents.hasNextValue()) {
                JsonNode document = documents.nextValue();
                if (document == null || !document.isObject()) {
                    continue;
                }
                String kind = document.path("kind").asText();
                if ("Secret".equals(kind)) {
                    readSecret(document, secrets);
                } else if ("ConfigMap".equals(kind)) {
                    document.path("data").fields()
                        .forEachRemaining(field -> configs.put(field.getKey(), field.getValue().asText()));
                } else {
                    log.debug("Skipping {} in kustomize output", kind);
                }
            }
        } catch (IOException e) {
            throw new ValidationException("Invalid kustomize output: " + e.getMessage());
        }
        return new Output(toValues(secrets), toValues(configs));
    }

    private static void readSecret(JsonNode secret, Map<String, String> values) {
        String name = secret.path("metadata").path("name").asText("<unnamed>");
        for (Iterator<Map.Entry<String, JsonNode>> it = secret.path("data").fields(); it.hasNext(); ) {
            Map.Entry<String, JsonNode> field = it.next();
            try {
                byte[] decoded = Base64.getDecoder().decode(field.getValue().asText());
                values.put(field.getKey(), StandardCharsets.UTF_8.newDecoder()
                    .decode(ByteBuffer.wrap(decoded)).toString());
            } catch (IllegalArgumentException | CharacterCodingException e) {
                log.warn("Skipping key {} of Secret {}: not base64 encoded UTF-8", field.getKey(), name);
            }
        }
        secret.path("stringData").fields()
            .forEachRemaining(field -> values.put(field.getKey(), field.getValue().asText()));
    }

    private static List<ParsedValue> toValues(Map<String, String> values) {
        List<ParsedValue> parsed = new ArrayList<>(values.size());
        values.forEach((key, value) -> parsed.add(ParsedValue.enabled(key, value)));
        return parsed;
    }
}
