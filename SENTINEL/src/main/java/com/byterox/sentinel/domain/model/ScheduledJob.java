package com.byterox.sentinel.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Recurring scan definition bound to a cron trigger.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduledJob {

    private String id;

    private String name;

    @Builder.Default
    private List<String> targets = new ArrayList<>();

    /** Standard 5-field cron */
    private String cronExpression;

    @Builder.Default
    private Map<String, Object> scanOptions = new HashMap<>();

    /** Optional profile whose config seeds the scan options */
    private String scanProfileId;

    /** Automation rules evaluated against every result of this job */
    @Builder.Default
    private List<String> automationRuleIds = new ArrayList<>();

    @Builder.Default
    private NotificationSettings notificationSettings = new NotificationSettings();

    @Builder.Default
    private boolean enabled = true;

    private Instant lastRun;

    /** Unset while the job has no armed timer */
    private Instant nextRun;

    private long runCount;

    private Instant createdAt;

    private Instant updatedAt;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class NotificationSettings {
        private boolean enabled;

        @Builder.Default
        private String type = "scan_complete";

        @Builder.Default
        private List<ChannelTarget> channels = new ArrayList<>();
    }
}
