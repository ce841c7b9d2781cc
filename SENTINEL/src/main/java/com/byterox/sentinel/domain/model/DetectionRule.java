package com.byterox.sentinel.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Severity-classified rule. All conditions must hold for a match.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DetectionRule {

    private String id;

    private String name;

    private String description;

    /** Grouping such as vulnerability, exposure or posture */
    private String category;

    /** critical, high, medium, low or info */
    @Builder.Default
    private String severity = "medium";

    @Builder.Default
    private List<RuleCondition> conditions = new ArrayList<>();

    @Builder.Default
    private List<RuleAction> actions = new ArrayList<>();

    @Builder.Default
    private boolean enabled = true;

    private long triggeredCount;

    private Instant lastTriggeredAt;

    private Instant createdAt;

    private Instant updatedAt;
}
