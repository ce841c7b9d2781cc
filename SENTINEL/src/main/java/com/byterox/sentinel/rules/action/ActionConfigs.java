package com.byterox.sentinel.rules.action;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Lenient readers for free-form action and step configuration.
 */
public final class ActionConfigs {

    private ActionConfigs() {
    }

    public static String string(Map<String, ?> config, String key, String fallback) {
        Object value = config != null ? config.get(key) : null;
        return value != null && !value.toString().isBlank() ? value.toString() : fallback;
    }

    /**
     * A list value, or a comma separated string.
     */
    public static List<String> strings(Map<String, ?> config, String key) {
        Object value = config != null ? config.get(key) : null;
        if (value instanceof Collection<?> values) {
            return values.stream()
                    .filter(v -> v != null && !v.toString().isBlank())
                    .map(Object::toString)
                    .toList();
        }
        if (value != null && !value.toString().isBlank()) {
            return Arrays.stream(value.toString().split(","))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .toList();
        }
        return List.of();
    }

    /**
     * Parse milliseconds (number or numeric string) or an ISO-8601 duration such as {@code PT5M}.
     *
     * @return null when absent
     * @throws IllegalArgumentException when present but unreadable
     */
    public static Duration duration(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return Duration.ofMillis(number.longValue());
        }
        String text = value.toString().trim();
        if (text.isEmpty()) {
            return null;
        }
        if (text.chars().allMatch(Character::isDigit)) {
            return Duration.ofMillis(Long.parseLong(text));
        }
        try {
            return Duration.parse(text);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Unreadable duration '" + text + "'", e);
        }
    }
}
