package com.byterox.sentinel.rules;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Comparison vocabulary shared by automation rules, detection rules,
 * notification rules and workflow condition steps.
 */
public enum ConditionOperator {
    EQUALS("equals"),
    GREATER_THAN("greater_than"),
    LESS_THAN("less_than"),
    CONTAINS("contains"),
    IN("in");

    private final String value;

    ConditionOperator(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<ConditionOperator> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(op -> op.value.equals(normalized))
                .findFirst();
    }
}
