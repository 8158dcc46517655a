package net.spookly.stateprox.config;

import java.time.Duration;

/**
 * Parses duration settings written as {@code 1500ms}, {@code 120s}, {@code 2m}, {@code 1h}
 * or a bare number of seconds.
 */
public final class ConfigDurations {
    private ConfigDurations() {
    }

    /**
     * Parse a duration value, returning {@link Duration#ZERO} for blank input.
     *
     * @throws ConfigException when the value is malformed or negative
     */
    public static Duration parse(String raw, String field) {
        if (raw == null || raw.isBlank()) {
            return Duration.ZERO;
        }
        String value = raw.trim().toLowerCase();
        String digits;
        String unit;
        if (value.endsWith("ms")) {
            digits = value.substring(0, value.length() - 2);
            unit = "ms";
        } else if (value.endsWith("s") || value.endsWith("m") || value.endsWith("h")) {
            digits = value.substring(0, value.length() - 1);
            unit = value.substring(value.length() - 1);
        } else {
            digits = value;
            unit = "s";
        }
        long amount;
        try {
            amount = Long.parseLong(digits.trim());
        } catch (NumberFormatException e) {
            throw new ConfigException(field + " must be a duration like 120s: " + raw, e);
        }
        if (amount < 0) {
            throw new ConfigException(field + " must not be negative: " + raw);
        }
        switch (unit) {
            case "ms":
                return Duration.ofMillis(amount);
            case "m":
                return Duration.ofMinutes(amount);
            case "h":
                return Duration.ofHours(amount);
            case "s":
            default:
                return Duration.ofSeconds(amount);
        }
    }
}
