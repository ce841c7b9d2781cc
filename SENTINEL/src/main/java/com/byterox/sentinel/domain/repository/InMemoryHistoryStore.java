package com.byterox.sentinel.domain.repository;

import com.byterox.sentinel.config.SentinelProperties;
import com.byterox.sentinel.domain.model.JobRun;
import com.byterox.sentinel.domain.model.Notification;
import com.byterox.sentinel.domain.model.WorkflowExecution;
import org.springframework.stereotype.Repository;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Bounded in-memory history. The oldest entries are dropped once a log exceeds
 * {@code sentinel.history.max-entries}.
 */
@Repository
public class InMemoryHistoryStore implements HistoryStore {

    private final int maxEntries;
    private final Deque<JobRun> jobRuns = new ArrayDeque<>();
    private final Deque<WorkflowExecution> executions = new ArrayDeque<>();
    private final Deque<Notification> notifications = new ArrayDeque<>();

    public InMemoryHistoryStore(SentinelProperties properties) {
        this.maxEntries = properties.getHistory().getMaxEntries();
    }

    @Override
    public void appendJobRun(JobRun run) {
        append(jobRuns, run);
    }

    @Override
    public List<JobRun> findJobRuns(String jobId, int limit) {
        return query(jobRuns, run -> Objects.equals(run.getJobId(), jobId), limit);
    }

    @Override
    public void appendExecution(WorkflowExecution execution) {
        append(executions, execution);
    }

    @Override
    public Optional<WorkflowExecution> findExecution(String executionId) {
        return query(executions, e -> e.getExecutionId().equals(executionId), 1).stream().findFirst();
    }

    @Override
    public List<WorkflowExecution> findExecutions(String workflowId, int limit) {
        return query(executions, e -> Objects.equals(e.getWorkflowId(), workflowId), limit);
    }

    @Override
    public void appendNotification(Notification notification) {
        append(notifications, notification);
    }

    @Override
    public List<Notification> findNotifications(Predicate<Notification> filter, int limit) {
        return query(notifications, filter, limit);
    }

    // ========== Private Methods ==========

    private <T> void append(Deque<T> log, T entry) {
        Objects.requireNonNull(entry, "history entry");
        synchronized (log) {
            log.addFirst(entry);
            while (log.size() > maxEntries) {
                log.removeLast();
            }
        }
    }

    private <T> List<T> query(Deque<T> log, Predicate<T> filter, int limit) {
        synchronized (log) {
            return log.stream()
                    .filter(filter)
                    .limit(limit > 0 ? limit : Long.MAX_VALUE)
                    .toList();
        }
    }
}
