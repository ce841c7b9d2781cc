package com.byterox.sentinel.domain.model;

import lombok.Getter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One run of a workflow.
 * <p>
 * The context only grows by merging step outputs, completed steps are only appended,
 * and every mutator rejects calls once the execution reached a terminal status.
 */
@Getter
public class WorkflowExecution {

    private final String executionId;

    private final String workflowId;

    private final String workflowName;

    private final int totalSteps;

    private final Instant startedAt;

    private final Map<String, Object> context;

    private final List<StepRecord> stepsCompleted;

    private volatile ExecutionStatus status = ExecutionStatus.RUNNING;

    private volatile Instant completedAt;

    private volatile Instant failedAt;

    private volatile String error;

    /** Index of the step that failed, -1 otherwise */
    private volatile int failedStepIndex = -1;

    public WorkflowExecution(String executionId, String workflowId, String workflowName,
                             int totalSteps, Map<String, Object> initialContext, Instant startedAt) {
        this.executionId = executionId;
        this.workflowId = workflowId;
        this.workflowName = workflowName;
        this.totalSteps = totalSteps;
        this.startedAt = startedAt;
        this.context = Collections.synchronizedMap(new LinkedHashMap<>(
                initialContext != null ? initialContext : Map.of()));
        this.stepsCompleted = Collections.synchronizedList(new ArrayList<>());
    }

    public synchronized void recordStep(StepRecord record, Map<String, Object> output) {
        ensureRunning();
        if (output != null) {
            context.putAll(output);
        }
        stepsCompleted.add(record);
    }

    public synchronized void complete(Instant at) {
        ensureRunning();
        this.completedAt = at;
        this.status = ExecutionStatus.COMPLETED;
    }

    /**
     * End the execution as FAILED. The failing step is appended to the recorded steps, so
     * the recorded steps always end with it.
     */
    public synchronized void fail(StepRecord failedStep, String error, Instant at) {
        ensureRunning();
        stepsCompleted.add(failedStep);
        this.failedStepIndex = failedStep.getIndex();
        this.error = error;
        this.failedAt = at;
        this.status = ExecutionStatus.FAILED;
    }

    public Map<String, Object> getContext() {
        synchronized (context) {
            return Collections.unmodifiableMap(new LinkedHashMap<>(context));
        }
    }

    public List<StepRecord> getStepsCompleted() {
        synchronized (stepsCompleted) {
            return List.copyOf(stepsCompleted);
        }
    }

    /** Percentage of steps recorded so far */
    public int getProgress() {
        if (totalSteps == 0) {
            return 100;
        }
        return (int) Math.round(getStepsCompleted().size() * 100.0 / totalSteps);
    }

    private void ensureRunning() {
        if (status.isTerminal()) {
            throw new IllegalStateException("Execution " + executionId + " is already " + status);
        }
    }
}
