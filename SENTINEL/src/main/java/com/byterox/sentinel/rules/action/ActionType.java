package com.byterox.sentinel.rules.action;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * The fixed set of actions a rule or workflow step can dispatch.
 */
public enum ActionType {
    SEND_ALERT("send_alert"),
    BLOCK_IPS("block_ips"),
    TRIGGER_INCIDENT("trigger_incident"),
    RUN_ADDITIONAL_SCAN("run_additional_scan"),
    UPDATE_BLOCKLIST("update_blocklist");

    private final String value;

    ActionType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<ActionType> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(type -> type.value.equals(normalized))
                .findFirst();
    }
}
