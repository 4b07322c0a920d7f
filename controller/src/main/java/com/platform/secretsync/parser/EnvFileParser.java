package com.platform.secretsync.parser;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Parses dotenv content. A commented line whose remainder is itself a valid
 * {@code KEY=VALUE} pair is returned as a disabled entry.
 */
@Component
public class EnvFileParser {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_.-]*");

    public List<ParsedValue> parse(String content) {
        List<ParsedValue> values = new ArrayList<>();
        for (String rawLine : content.split("\\R")) {
            String line = rawLine.trim();
            if (line.isEmpty()) {
                continue;
            }
            boolean enabled = true;
            if (line.startsWith("#")) {
                line = line.substring(1).trim();
                enabled = false;
            }
            if (line.startsWith("export ")) {
                line = line.substring("export ".length()).trim();
            }
            int separator = line.indexOf('=');
            if (separator <= 0) {
                continue;
            }
            String key = line.substring(0, separator).trim();
            if (!IDENTIFIER.matcher(key).matches()) {
                continue;
            }
            String value = unquote(line.substring(separator + 1).trim()).replace("\\n", "\n");
            values.add(new ParsedValue(key, value, enabled));
        }
        return values;
    }

    static String unquote(String value) {
        if (value.length() >= 2) {
            char first = value.charAt(0);
            char last = value.charAt(value.length() - 1);
            if ((first == '"' || first == '\'') && first == last) {
                return value.substring(1, value.length() - 1);
            }
        }
        return value;
    }
}
