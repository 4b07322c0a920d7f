package com.platform.secretsync.parser;

/**
 * One key/value pair read from a secret or properties file.
 *
 * @param enabled false for entries commented out with a leading {@code #}
 */
public record ParsedValue(String key, String value, boolean enabled) {

    public static ParsedValue enabled(String key, String value) {
        return new ParsedValue(key, value, true);
    }

    public static ParsedValue disabled(String key, String value) {
        return new ParsedValue(key, value, false);
    }
}
