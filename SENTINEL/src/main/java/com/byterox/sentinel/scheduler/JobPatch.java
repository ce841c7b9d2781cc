package com.byterox.sentinel.scheduler;

import com.byterox.sentinel.domain.model.ScheduledJob;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Partial update of a scheduled job. Null fields keep their current value.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobPatch {

    private String name;

    private List<String> targets;

    private String cronExpression;

    private Map<String, Object> scanOptions;

    private String scanProfileId;

    private List<String> automationRuleIds;

    private ScheduledJob.NotificationSettings notificationSettings;

    private Boolean enabled;
}
