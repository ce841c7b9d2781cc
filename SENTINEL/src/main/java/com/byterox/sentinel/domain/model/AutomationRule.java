package com.byterox.sentinel.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Condition and action pair evaluated against each scan result of a job.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AutomationRule {

    private String id;

    private String name;

    private String description;

    private RuleCondition condition;

    private RuleAction action;

    @Builder.Default
    private boolean enabled = true;

    /** Times the condition evaluated true, regardless of action outcome */
    private long triggeredCount;

    private Instant lastTriggeredAt;

    private Instant createdAt;

    private Instant updatedAt;
}
