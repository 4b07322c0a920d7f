package com.platform.secretsync.parser;

import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Dispatches plaintext file content to the parser for its format.
 */
@Component
public class SecretFileParser {

    private final EnvFileParser envParser;
    private final YamlSecretParser yamlParser;
    private final PropertiesFileParser propertiesParser;

    public SecretFileParser(EnvFileParser envParser, YamlSecretParser yamlParser,
                            PropertiesFileParser propertiesParser) {
        this.envParser = envParser;
        this.yamlParser = yamlParser;
        this.propertiesParser = propertiesParser;
    }

    public List<ParsedValue> parse(SecretFileFormat format, byte[] content) {
        String text = new String(content, StandardCharsets.UTF_8);
        return switch (format) {
            case DOTENV -> envParser.parse(text);
            case YAML -> yamlParser.parse(text);
            case PROPERTIES -> propertiesParser.parse(text);
        };
    }
}
