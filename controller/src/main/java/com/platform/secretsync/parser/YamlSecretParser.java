package com.platform.secretsync.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.platform.secretsync.error.ValidationException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Flattens a YAML document into dotted keys; list items become {@code key[i]}.
 */
@Component
public class YamlSecretParser {

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    public List<ParsedValue> parse(String content) {
        JsonNode root;
        try {
            root = yamlMapper.readTree(content);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Invalid YAML secret file: " + e.getOriginalMessage());
        }
        List<ParsedValue> values = new ArrayList<>();
        if (root != null && !root.isMissingNode()) {
            flatten("", root, values);
        }
        return values;
    }

    private void flatten(String path, JsonNode node, List<ParsedValue> out) {
        if (node.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (path.isEmpty() && "sops".equals(field.getKey())) {
                    continue;
                }
                flatten(path.isEmpty() ? field.getKey() : path + "." + field.getKey(), field.getValue(), out);
            }
        } else if (node.isArray()) {
            for (int i = 0; i < node.size(); i++) {
                flatten(path + "[" + i + "]", node.get(i), out);
            }
        } else if (!path.isEmpty()) {
            out.add(ParsedValue.enabled(path, node.isNull() ? "" : node.asText()));
        }
    }
}
