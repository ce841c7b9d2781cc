package com.byterox.sentinel.api.dto;

import com.byterox.sentinel.domain.model.ScheduledJob;
import com.byterox.sentinel.scheduler.JobPatch;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * Request DTO for patching a scheduled job. Absent fields are left unchanged.
 */
@Data
public class ScheduleUpdateRequest {

    private String name;
    private List<String> targets;
    private String cronExpression;
    private Map<String, Object> scanOptions;
    private String scanProfileId;
    private List<String> automationRuleIds;
    private ScheduledJob.NotificationSettings notificationSettings;
    private Boolean enabled;

    public JobPatch toPatch() {
        return JobPatch.builder()
                .name(name)
                .targets(targets)
                .cronExpression(cronExpression)
                .scanOptions(scanOptions)
                .scanProfileId(scanProfileId)
                .automationRuleIds(automationRuleIds)
                .notificationSettings(notificationSettings)
                .enabled(enabled)
                .build();
    }
}
