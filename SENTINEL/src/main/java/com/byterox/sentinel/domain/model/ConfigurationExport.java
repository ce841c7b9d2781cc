package com.byterox.sentinel.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Portable snapshot of the configuration store.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConfigurationExport {

    @Builder.Default
    private String version = "1.0";

    private Instant exportedAt;

    @Builder.Default
    private List<ScanProfile> scanProfiles = new ArrayList<>();

    @Builder.Default
    private List<AutomationRule> automationRules = new ArrayList<>();

    @Builder.Default
    private List<DetectionRule> detectionRules = new ArrayList<>();

    @Builder.Default
    private List<ExclusionList> exclusionLists = new ArrayList<>();
}
