package com.platform.secretsync.canonical;

import com.platform.secretsync.parser.ParsedValue;
import com.platform.secretsync.resolver.ParsedEntry;

import java.util.List;

/**
 * A resolved file together with the key/value pairs read from its plaintext.
 */
public record ParsedFile(ParsedEntry entry, List<ParsedValue> values) {
}
