package com.byterox.sentinel.api.dto;

import com.byterox.sentinel.domain.model.AutomationRule;
import com.byterox.sentinel.domain.model.ScheduledJob;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Request DTO for creating a scheduled job.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleRequest {

    @NotBlank
    private String name;

    @NotEmpty
    private List<String> targets;

    @NotBlank
    private String cronExpression;

    private Map<String, Object> scanOptions;

    private String scanProfileId;

    /** Ids of existing automation rules */
    private List<String> automationRuleIds;

    /** Rules created together with the job */
    private List<AutomationRule> automationRules;

    private ScheduledJob.NotificationSettings notificationSettings;

    private Boolean enabled;

    public ScheduledJob toJob() {
        return ScheduledJob.builder()
                .name(name)
                .targets(new ArrayList<>(targets))
                .cronExpression(cronExpression)
                .scanOptions(scanOptions != null ? new HashMap<>(scanOptions) : new HashMap<>())
                .scanProfileId(scanProfileId)
                .automationRuleIds(automationRuleIds != null ? new ArrayList<>(automationRuleIds) : new ArrayList<>())
                .notificationSettings(notificationSettings != null
                        ? notificationSettings : new ScheduledJob.NotificationSettings())
                .enabled(enabled == null || enabled)
                .build();
    }

    public List<AutomationRule> inlineRules() {
        return automationRules != null ? automationRules : List.of();
    }
}
