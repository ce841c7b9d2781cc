package com.byterox.sentinel.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConfigurationStats {

    private long scanProfiles;

    private long automationRules;

    private long enabledAutomationRules;

    private long detectionRules;

    private long enabledDetectionRules;

    private long exclusionLists;

    private long enabledExclusionLists;

    /** Sum of triggeredCount over automation rules */
    private long totalRuleTriggers;
}
