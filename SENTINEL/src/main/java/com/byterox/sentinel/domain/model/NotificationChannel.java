package com.byterox.sentinel.domain.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum NotificationChannel {
    EMAIL("email"),
    SLACK("slack"),
    WEBHOOK("webhook"),
    SMS("sms");

    private final String value;

    NotificationChannel(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<NotificationChannel> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(channel -> channel.value.equals(normalized))
                .findFirst();
    }
}
