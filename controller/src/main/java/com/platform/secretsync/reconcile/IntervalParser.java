package com.platform.secretsync.reconcile;

import com.platform.secretsync.error.ValidationException;

import java.time.Duration;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses Go style durations such as {@code 90s}, {@code 5m} or {@code 1h30m}.
 */
public final class IntervalParser {

    private static final Pattern FORMAT = Pattern.compile("^(\\d+(ms|h|m|s))+$");
    private static final Pattern PART = Pattern.compile("(\\d+)(ms|h|m|s)");

    private IntervalParser() {
    }

    public static Duration parse(String field, String value) {
        if (value == null || value.isBlank()) {
            throw ValidationException.interval(field, value, "must not be empty");
        }
        String trimmed = value.trim();
        if (!FORMAT.matcher(trimmed).matches()) {
            throw ValidationException.interval(field, value, "expected a duration like 30s, 5m or 1h30m");
        }
        Duration total = Duration.ZERO;
        Matcher part = PART.matcher(trimmed);
        while (part.find()) {
            long amount = Long.parseLong(part.group(1));
            total = total.plus(switch (part.group(2)) {
                case "h" -> Duration.ofHours(amount);
                case "m" -> Duration.ofMinutes(amount);
                case "s" -> Duration.ofSeconds(amount);
                default -> Duration.ofMillis(amount);
            });
        }
        if (total.isZero()) {
            throw ValidationException.interval(field, value, "must be positive");
        }
        return total;
    }
}
