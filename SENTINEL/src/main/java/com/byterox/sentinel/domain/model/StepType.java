package com.byterox.sentinel.domain.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Kinds of workflow steps.
 */
public enum StepType {
    SCAN("scan"),
    NOTIFY("notify"),
    WAIT("wait"),
    CONDITION("condition"),
    ACTION("action");

    private final String value;

    StepType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<StepType> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(type -> type.value.equals(normalized))
                .findFirst();
    }
}
