package com.platform.secretsync.crypto;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.DoubleNode;
import com.fasterxml.jackson.databind.node.LongNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.platform.secretsync.error.DecryptionException;

import java.math.BigDecimal;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.Map;

/**
 * YAML flavour of a SOPS file. Additional data for a leaf is its map key path; list indexes are not
 * part of the path.
 */
final class YamlSopsDocument extends SopsDocument {

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    private final ObjectNode root;
    private final SopsMetadata metadata;

    private YamlSopsDocument(ObjectNode root, SopsMetadata metadata) {
        this.root = root;
        this.metadata = metadata;
    }

    static YamlSopsDocument parse(String content) {
        JsonNode tree;
        try {
            tree = YAML.readTree(content);
        } catch (JsonProcessingException e) {
            throw DecryptionException.failed("SOPS YAML file is not valid YAML: " + e.getOriginalMessage(), e);
        }
        if (!(tree instanceof ObjectNode object) || !object.path("sops").isObject()) {
            throw DecryptionException.unsupported("YAML file has no sops metadata block");
        }
        JsonNode sops = object.remove("sops");
        return new YamlSopsDocument(object, SopsMetadata.fromYaml(sops));
    }

    @Override
    SopsMetadata metadata() {
        return metadata;
    }

    @Override
    byte[] decrypt(byte[] dataKey) {
        MacAccumulator mac = new MacAccumulator(metadata.macOnlyEncrypted());
        ObjectNode plaintext = (ObjectNode) walk(root.deepCopy(), new ArrayDeque<>(), dataKey, mac);
        mac.verify(metadata, dataKey);
        try {
            return YAML.writeValueAsBytes(plaintext);
        } catch (JsonProcessingException e) {
            throw DecryptionException.failed("Failed to render decrypted YAML", e);
        }
    }

    private JsonNode walk(JsonNode node, Deque<String> path, byte[] dataKey, MacAccumulator mac) {
        if (node.isObject()) {
            ObjectNode object = (ObjectNode) node;
            Iterator<Map.Entry<String, JsonNode>> fields = object.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                path.addLast(field.getKey());
                field.setValue(walk(field.getValue(), path, dataKey, mac));
                path.removeLast();
            }
            return object;
        }
        if (node.isArray()) {
            ArrayNode array = (ArrayNode) node;
            for (int i = 0; i < array.size(); i++) {
                array.set(i, walk(array.get(i), path, dataKey, mac));
            }
            return array;
        }
        if (node.isTextual() && SopsValueCipher.isEncrypted(node.textValue())) {
            SopsValueCipher.Plaintext plaintext = SopsValueCipher.decrypt(node.textValue(), dataKey, additionalData(path));
            mac.add(plaintext.bytes(), true);
            return typed(plaintext);
        }
        if (!node.isNull()) {
            mac.add(macBytes(node), false);
        }
        return node;
    }

    private static JsonNode typed(SopsValueCipher.Plaintext plaintext) {
        String text = plaintext.text();
        try {
            return switch (plaintext.type()) {
                case "int" -> LongNode.valueOf(Long.parseLong(text));
                case "float" -> DoubleNode.valueOf(Double.parseDouble(text));
                case "bool" -> BooleanNode.valueOf("true".equalsIgnoreCase(text));
                default -> TextNode.valueOf(text);
            };
        } catch (NumberFormatException e) {
            return TextNode.valueOf(text);
        }
    }

    private static String macBytes(JsonNode node) {
        if (node.isBoolean()) {
            return node.booleanValue() ? "True" : "False";
        }
        if (node.isFloatingPointNumber()) {
            return BigDecimal.valueOf(node.doubleValue()).stripTrailingZeros().toPlainString();
        }
        return node.asText();
    }
}
