package com.byterox.sentinel.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Result of one dispatched action.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ActionOutcome {

    private String actionType;

    private String ruleId;

    private String ruleName;

    private boolean success;

    private String message;

    @Builder.Default
    private Map<String, Object> details = new HashMap<>();

    private Instant executedAt;

    public static ActionOutcome failure(String actionType, String message, Instant at) {
        return ActionOutcome.builder()
                .actionType(actionType)
                .success(false)
                .message(message)
                .executedAt(at)
                .build();
    }
}
