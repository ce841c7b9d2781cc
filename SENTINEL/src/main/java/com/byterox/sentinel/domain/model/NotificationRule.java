package com.byterox.sentinel.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Condition-gated fan-out from a trigger type to delivery channels.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NotificationRule {

    private String id;

    private String name;

    private String description;

    /** Trigger type, e.g. scan_complete or scan_failed */
    private String trigger;

    /** All must hold; empty means always */
    @Builder.Default
    private List<RuleCondition> conditions = new ArrayList<>();

    @Builder.Default
    private List<ChannelTarget> channels = new ArrayList<>();

    @Builder.Default
    private boolean enabled = true;

    private long triggeredCount;

    private Instant lastTriggeredAt;

    private Instant createdAt;
}
