package com.byterox.sentinel.domain.repository;

import com.byterox.sentinel.domain.model.JobRun;
import com.byterox.sentinel.domain.model.Notification;
import com.byterox.sentinel.domain.model.WorkflowExecution;

import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Append-only sink for job runs, workflow executions and notifications.
 * <p>
 * Read back for dashboards and statistics only; the engines never branch on history.
 * Query results are ordered newest first.
 */
public interface HistoryStore {

    void appendJobRun(JobRun run);

    List<JobRun> findJobRuns(String jobId, int limit);

    void appendExecution(WorkflowExecution execution);

    Optional<WorkflowExecution> findExecution(String executionId);

    List<WorkflowExecution> findExecutions(String workflowId, int limit);

    void appendNotification(Notification notification);

    List<Notification> findNotifications(Predicate<Notification> filter, int limit);
}
